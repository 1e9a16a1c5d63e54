/**
 * Frame topology.
 * <ul>
 *   <li>{@link com.deca.tree.AlternativeTree} – preorder-numbered tree of one alternative, validated on build</li>
 *   <li>{@link com.deca.tree.FrameTopology} – all alternatives plus the index conversion tables</li>
 *   <li>{@link com.deca.tree.NodeKind} – real or intermediate</li>
 * </ul>
 * Errors are reported as {@link com.deca.tree.error.DecaException}.
 */
package com.deca.tree;
