/**
 * Probability layer derivation: hull propagation, midpoint hull, mass point distribution and the
 * warp correction. Entry point is {@link com.deca.engine.probability.ProbabilityLoader}.
 */
package com.deca.engine.probability;
