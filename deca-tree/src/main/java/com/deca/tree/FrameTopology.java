package com.deca.tree;

import com.deca.config.EngineLimits;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Shape of a frame: one {@link AlternativeTree} per alternative plus the conversion tables
 * between the coordinate systems used to key flat arrays.
 * <ul>
 *   <li>tree position: (alternative, position), both 1-based</li>
 *   <li>local ordinal: 1-based rank of a node among the real (or intermediate) nodes of its alternative</li>
 *   <li>sequential index: 0-based over all nodes of all alternatives, alternative by alternative</li>
 *   <li>real / intermediate index: 0-based over the real (or intermediate) nodes of all alternatives</li>
 * </ul>
 * Immutable after construction.
 */
public final class FrameTopology {

    private static final Logger log = LoggerFactory.getLogger(FrameTopology.class);

    private final List<AlternativeTree> trees;
    private final int[] sequentialOffset;
    private final int[] realOffset;
    private final int[] intermediateOffset;
    private final int[] seqAlternative;
    private final int[] seqPosition;
    private final int[] seqReal;
    private final int[] seqIntermediate;
    private final int[] realSeq;
    private final int[] intermediateSeq;

    private FrameTopology(List<AlternativeTree> trees) {
        this.trees = Collections.unmodifiableList(new ArrayList<>(trees));
        int n = trees.size();
        sequentialOffset = new int[n + 1];
        realOffset = new int[n + 1];
        intermediateOffset = new int[n + 1];
        for (int a = 0; a < n; a++) {
            AlternativeTree t = trees.get(a);
            sequentialOffset[a + 1] = sequentialOffset[a] + t.size();
            realOffset[a + 1] = realOffset[a] + t.realCount();
            intermediateOffset[a + 1] = intermediateOffset[a] + t.intermediateCount();
        }
        int total = sequentialOffset[n];
        seqAlternative = new int[total];
        seqPosition = new int[total];
        seqReal = new int[total];
        seqIntermediate = new int[total];
        realSeq = new int[realOffset[n]];
        intermediateSeq = new int[intermediateOffset[n]];
        int seq = 0;
        int real = 0;
        int intermediate = 0;
        for (int a = 0; a < n; a++) {
            AlternativeTree t = trees.get(a);
            for (int pos = 1; pos <= t.size(); pos++, seq++) {
                seqAlternative[seq] = a + 1;
                seqPosition[seq] = pos;
                if (t.isIntermediate(pos)) {
                    seqReal[seq] = -1;
                    seqIntermediate[seq] = intermediate;
                    intermediateSeq[intermediate++] = seq;
                } else {
                    seqReal[seq] = real;
                    seqIntermediate[seq] = -1;
                    realSeq[real++] = seq;
                }
            }
        }
    }

    /**
     * Frame where every alternative is a single level of real nodes.
     *
     * @param leafCounts number of real nodes per alternative
     */
    public static FrameTopology flat(EngineLimits limits, int... leafCounts) {
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(leafCounts, "leafCounts");
        checkAlternativeCount(limits, leafCounts.length);
        List<AlternativeTree> trees = new ArrayList<>(leafCounts.length);
        int total = 0;
        for (int a = 0; a < leafCounts.length; a++) {
            int count = leafCounts[a];
            if (count < 1) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "alternative " + (a + 1) + " has " + count + " nodes");
            }
            if (count > limits.getMaxLeavesPerAlternative()) {
                throw new DecaException(ErrorKind.TOO_MANY_CONS, "alternative " + (a + 1) + " has " + count + " leaves");
            }
            if (count > limits.getMaxNodesPerAlternative()) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "alternative " + (a + 1) + " has " + count + " nodes");
            }
            total += count;
        }
        if (total > limits.getMaxLeaves()) {
            throw new DecaException(ErrorKind.TOO_MANY_CONS, "frame has " + total + " leaves");
        }
        for (int count : leafCounts) {
            trees.add(AlternativeTree.flat(count));
        }
        FrameTopology topology = new FrameTopology(trees);
        if (log.isDebugEnabled()) log.debug("Topology flat | alts={} | leaves={}", leafCounts.length, total);
        return topology;
    }

    /**
     * Frame with arbitrary tree-shaped alternatives.
     *
     * @param nodeCounts total nodes (real and intermediate) per alternative
     * @param next       per alternative, next-sibling link of each position (entry 0 unused)
     * @param down       per alternative, first-child link of each position (entry 0 unused)
     */
    public static FrameTopology tree(EngineLimits limits, int[] nodeCounts, int[][] next, int[][] down) {
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(nodeCounts, "nodeCounts");
        checkAlternativeCount(limits, nodeCounts.length);
        if (next == null || down == null || next.length != nodeCounts.length || down.length != nodeCounts.length) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "link arrays do not match " + nodeCounts.length + " alternatives");
        }
        for (int a = 0; a < nodeCounts.length; a++) {
            if (nodeCounts[a] < 1 || nodeCounts[a] > limits.getMaxNodesPerAlternative()) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "alternative " + (a + 1) + " has " + nodeCounts[a] + " nodes");
            }
        }
        List<AlternativeTree> trees = new ArrayList<>(nodeCounts.length);
        int totalReal = 0;
        for (int a = 0; a < nodeCounts.length; a++) {
            AlternativeTree t;
            try {
                t = AlternativeTree.fromLinks(nodeCounts[a], next[a], down[a]);
            } catch (DecaException e) {
                throw new DecaException(e.getKind(), "alternative " + (a + 1) + ", " + e.getDetail());
            }
            if (t.realCount() > limits.getMaxLeavesPerAlternative()) {
                throw new DecaException(ErrorKind.TOO_MANY_CONS, "alternative " + (a + 1) + " has " + t.realCount() + " leaves");
            }
            totalReal += t.realCount();
            trees.add(t);
        }
        if (totalReal > limits.getMaxLeaves()) {
            throw new DecaException(ErrorKind.TOO_MANY_CONS, "frame has " + totalReal + " leaves");
        }
        FrameTopology topology = new FrameTopology(trees);
        if (log.isDebugEnabled()) {
            log.debug("Topology tree | alts={} | nodes={} | leaves={}", nodeCounts.length,
                    topology.totalNodeCount(), totalReal);
        }
        return topology;
    }

    private static void checkAlternativeCount(EngineLimits limits, int alternatives) {
        if (alternatives < 2) {
            throw new DecaException(ErrorKind.TOO_FEW_ALTS, alternatives + " alternatives");
        }
        if (alternatives > limits.getMaxAlternatives()) {
            throw new DecaException(ErrorKind.TOO_MANY_ALTS, alternatives + " alternatives");
        }
    }

    public int alternativeCount() {
        return trees.size();
    }

    /** Tree of alternative {@code alt} (1-based). */
    public AlternativeTree tree(int alt) {
        requireAlternative(alt);
        return trees.get(alt - 1);
    }

    /** True when at least one alternative has an intermediate node. */
    public boolean isTreeShaped() {
        return totalIntermediateCount() > 0;
    }

    public int nodeCount(int alt) {
        return tree(alt).size();
    }

    public int realCount(int alt) {
        return tree(alt).realCount();
    }

    public int intermediateCount(int alt) {
        return tree(alt).intermediateCount();
    }

    public int totalNodeCount() {
        return sequentialOffset[trees.size()];
    }

    public int totalRealCount() {
        return realOffset[trees.size()];
    }

    public int totalIntermediateCount() {
        return intermediateOffset[trees.size()];
    }

    public boolean isValidAlternative(int alt) {
        return alt >= 1 && alt <= trees.size();
    }

    public boolean isValidNode(int alt, int position) {
        return isValidAlternative(alt) && trees.get(alt - 1).contains(position);
    }

    /** @throws DecaException INPUT_ERROR when {@code alt} is not an alternative of this frame */
    public void requireAlternative(int alt) {
        if (!isValidAlternative(alt)) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "no alternative " + alt);
        }
    }

    /** @throws DecaException INPUT_ERROR when (alt, position) is not a node of this frame */
    public void requireNode(int alt, int position) {
        if (!isValidNode(alt, position)) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "no node " + position + " in alternative " + alt);
        }
    }

    public NodeKind kind(int alt, int position) {
        requireNode(alt, position);
        return trees.get(alt - 1).kind(position);
    }

    /** First sequential index of alternative {@code alt}. */
    public int sequentialOffset(int alt) {
        requireAlternative(alt);
        return sequentialOffset[alt - 1];
    }

    /** First real index of alternative {@code alt}; its real nodes occupy {@code realCount(alt)} slots from here. */
    public int realOffset(int alt) {
        requireAlternative(alt);
        return realOffset[alt - 1];
    }

    public int intermediateOffset(int alt) {
        requireAlternative(alt);
        return intermediateOffset[alt - 1];
    }

    public int sequentialIndex(int alt, int position) {
        requireNode(alt, position);
        return sequentialOffset[alt - 1] + position - 1;
    }

    /** Global real index, or -1 for an intermediate node. */
    public int realIndex(int alt, int position) {
        return seqReal[sequentialIndex(alt, position)];
    }

    /** Global intermediate index, or -1 for a real node. */
    public int intermediateIndex(int alt, int position) {
        return seqIntermediate[sequentialIndex(alt, position)];
    }

    /** 1-based rank among the real nodes of the alternative, or -1 for an intermediate node. */
    public int realOrdinal(int alt, int position) {
        int r = realIndex(alt, position);
        return r < 0 ? -1 : r - realOffset[alt - 1] + 1;
    }

    /** 1-based rank among the intermediate nodes of the alternative, or -1 for a real node. */
    public int intermediateOrdinal(int alt, int position) {
        int i = intermediateIndex(alt, position);
        return i < 0 ? -1 : i - intermediateOffset[alt - 1] + 1;
    }

    /** Tree position of the {@code ordinal}-th real node (1-based) of alternative {@code alt}. */
    public int positionOfReal(int alt, int ordinal) {
        requireAlternative(alt);
        if (ordinal < 1 || ordinal > trees.get(alt - 1).realCount()) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "no real node " + ordinal + " in alternative " + alt);
        }
        return seqPosition[realSeq[realOffset[alt - 1] + ordinal - 1]];
    }

    /** Tree position of the {@code ordinal}-th intermediate node (1-based) of alternative {@code alt}. */
    public int positionOfIntermediate(int alt, int ordinal) {
        requireAlternative(alt);
        if (ordinal < 1 || ordinal > trees.get(alt - 1).intermediateCount()) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "no intermediate node " + ordinal + " in alternative " + alt);
        }
        return seqPosition[intermediateSeq[intermediateOffset[alt - 1] + ordinal - 1]];
    }

    public int alternativeOfSequential(int seq) {
        return seqAlternative[seq];
    }

    public int positionOfSequential(int seq) {
        return seqPosition[seq];
    }

    /** Real index of a sequential index, -1 if it is an intermediate node. */
    public int realOfSequential(int seq) {
        return seqReal[seq];
    }

    /** Intermediate index of a sequential index, -1 if it is a real node. */
    public int intermediateOfSequential(int seq) {
        return seqIntermediate[seq];
    }

    public int sequentialOfReal(int real) {
        return realSeq[real];
    }

    public int sequentialOfIntermediate(int intermediate) {
        return intermediateSeq[intermediate];
    }

    /** True when no level of the alternative mixes real and intermediate siblings. */
    public boolean isPureTree(int alt) {
        return tree(alt).isPure();
    }

    /** True when both nodes sit on the same level under the same parent. */
    public boolean haveSameParent(int alt, int position1, int position2) {
        requireNode(alt, position1);
        requireNode(alt, position2);
        AlternativeTree t = trees.get(alt - 1);
        return t.parent(position1) == t.parent(position2);
    }

    /** Number of nodes on the level of {@code position}, itself included. */
    public int siblingCount(int alt, int position) {
        requireNode(alt, position);
        return trees.get(alt - 1).siblingCount(position);
    }
}
