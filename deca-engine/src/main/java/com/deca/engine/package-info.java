/**
 * Decision frames and their constraint layers.
 * <ul>
 *   <li>{@link com.deca.engine.DecisionFrame} – frame lifecycle, evaluation, moments and security levels</li>
 *   <li>{@link com.deca.engine.ProbabilityLayer} – local probability statements, box and midpoint hints</li>
 *   <li>{@link com.deca.engine.ValueLayer} – value statements on real nodes</li>
 * </ul>
 */
package com.deca.engine;
