/**
 * Distributional summaries of a loaded frame.
 * <ul>
 *   <li>{@link com.deca.engine.moments.MomentCalculator} – mean, variance and third central moment per alternative</li>
 *   <li>{@link com.deca.engine.moments.MomentReport} – moments plus per-node standard deviations</li>
 *   <li>{@link com.deca.engine.moments.SecurityLevelCalculator} – strong, marked and weak security levels</li>
 * </ul>
 */
package com.deca.engine.moments;
