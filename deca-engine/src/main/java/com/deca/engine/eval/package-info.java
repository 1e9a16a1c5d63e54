/**
 * Expected-value evaluation.
 * <ul>
 *   <li>{@link com.deca.engine.eval.Evaluator} – omega, psi, delta, gamma and digamma</li>
 *   <li>{@link com.deca.engine.eval.ExtremalAllocator} – greedy extremal EV over the local hull</li>
 * </ul>
 */
package com.deca.engine.eval;
