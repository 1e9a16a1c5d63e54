/**
 * User input stores shared by the probability and value layers.
 * <ul>
 *   <li>{@link com.deca.engine.base.Statement} – one interval statement</li>
 *   <li>{@link com.deca.engine.base.ConstraintBase} – statements, box override and midpoint hints</li>
 *   <li>{@link com.deca.engine.base.IntervalVector} – immutable bound arrays handed out by queries</li>
 *   <li>{@link com.deca.engine.base.Tolerance} – numeric tolerances and sentinels</li>
 * </ul>
 */
package com.deca.engine.base;
