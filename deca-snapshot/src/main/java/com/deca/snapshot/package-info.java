/**
 * JSON snapshots of decision frame input.
 * <ul>
 *   <li>{@link com.deca.snapshot.FrameSnapshot} – shape, name and both layers of a frame</li>
 *   <li>{@link com.deca.snapshot.FrameSnapshots} – capture, restore and JSON conversion</li>
 * </ul>
 */
package com.deca.snapshot;
