package com.deca.tree;

import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

import java.util.Arrays;

/**
 * Tree of one alternative. Nodes are numbered 1..size in preorder, so the first child of node
 * {@code t} is always {@code t + 1}; position 0 is the implicit root. Links are kept as
 * parallel index arrays (first child, next sibling, previous sibling, parent).
 * <p>
 * Instances are immutable once built and validated.
 */
public final class AlternativeTree {

    private final int size;
    private final int[] down;
    private final int[] next;
    private final int[] prev;
    private final int[] parent;
    private final int[] subtreeEnd;
    private final int realCount;

    private AlternativeTree(int size, int[] next, int[] down) {
        this.size = size;
        this.next = next;
        this.down = down;
        this.prev = new int[size + 1];
        this.parent = new int[size + 1];
        this.subtreeEnd = new int[size + 1];
        int reals = 0;
        for (int t = 1; t <= size; t++) {
            if (down[t] == 0) reals++;
        }
        this.realCount = reals;
    }

    /** A single level of {@code leaves} real nodes under the root. */
    public static AlternativeTree flat(int leaves) {
        if (leaves < 1) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "alternative needs at least one node, got " + leaves);
        }
        int[] next = new int[leaves + 1];
        int[] down = new int[leaves + 1];
        for (int t = 1; t < leaves; t++) {
            next[t] = t + 1;
        }
        down[0] = 1;
        AlternativeTree tree = new AlternativeTree(leaves, next, down);
        tree.link();
        return tree;
    }

    /**
     * Builds a tree from next-sibling and first-child links. Both arrays are indexed by tree
     * position and must hold at least {@code size + 1} entries; entry 0 is ignored (the root's
     * first child is always node 1). A zero link means "none".
     *
     * @throws DecaException TREE_ERROR when the links do not describe a preorder-numbered tree
     *                       covering exactly {@code size} nodes, or an intermediate node is lonely
     */
    public static AlternativeTree fromLinks(int size, int[] next, int[] down) {
        if (size < 1) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "alternative needs at least one node, got " + size);
        }
        if (next == null || down == null || next.length < size + 1 || down.length < size + 1) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "link arrays must hold " + (size + 1) + " entries");
        }
        int[] n = Arrays.copyOf(next, size + 1);
        int[] d = Arrays.copyOf(down, size + 1);
        n[0] = 0;
        d[0] = 1;
        int maxNext = 1;
        for (int t = 1; t <= size; t++) {
            if (n[t] < 0 || n[t] > size || d[t] < 0 || d[t] > size) {
                throw new DecaException(ErrorKind.TREE_ERROR, "link out of range at node " + t);
            }
            maxNext = Math.max(maxNext, n[t]);
        }
        if (maxNext != size) {
            throw new DecaException(ErrorKind.TREE_ERROR, "successor chain ends at " + maxNext + ", declared " + size);
        }
        AlternativeTree tree = new AlternativeTree(size, n, d);
        tree.link();
        return tree;
    }

    private void link() {
        int end = collectEnd(0);
        if (end != size) {
            throw new DecaException(ErrorKind.TREE_ERROR, "preorder walk ends at " + end + ", declared " + size);
        }
        if (hasLonelyIntermediate()) {
            throw new DecaException(ErrorKind.TREE_ERROR, "intermediate node without siblings or with a single child");
        }
    }

    /** Checks preorder contiguity below {@code s}, fills parent/prev/end links, returns the last node of the subtree or -1. */
    private int collectEnd(int s) {
        int end = s;
        int previous = 0;
        for (int t = down[s]; t != 0; t = next[t]) {
            if (t != end + 1) {
                return -1;
            }
            parent[t] = s;
            prev[t] = previous;
            previous = t;
            if (down[t] != 0) {
                end = collectEnd(t);
                if (end < 0) return -1;
            } else {
                end = t;
            }
            subtreeEnd[t] = end;
        }
        subtreeEnd[s] = end;
        return end;
    }

    private boolean hasLonelyIntermediate() {
        for (int t = 1; t <= size; t++) {
            if (down[t] == 0) continue;
            boolean onlyChild = prev[t] == 0 && next[t] == 0;
            boolean singleChild = next[down[t]] == 0;
            if (onlyChild || singleChild) return true;
        }
        return false;
    }

    /** Number of nodes, excluding the implicit root. */
    public int size() {
        return size;
    }

    public int realCount() {
        return realCount;
    }

    public int intermediateCount() {
        return size - realCount;
    }

    public boolean contains(int position) {
        return position >= 1 && position <= size;
    }

    public NodeKind kind(int position) {
        return down[position] != 0 ? NodeKind.INTERMEDIATE : NodeKind.REAL;
    }

    public boolean isIntermediate(int position) {
        return position != 0 && down[position] != 0;
    }

    /** First child of {@code position}, 0 if it is a real node. The root's first child is 1. */
    public int firstChild(int position) {
        return down[position];
    }

    /** Next sibling, 0 at the end of a level. */
    public int nextSibling(int position) {
        return next[position];
    }

    /** Previous sibling, 0 at the start of a level. */
    public int previousSibling(int position) {
        return prev[position];
    }

    /** Parent position, 0 for the top level. */
    public int parent(int position) {
        return parent[position];
    }

    /** Last position inside the subtree rooted at {@code position} (the position itself for a real node). */
    public int subtreeEnd(int position) {
        return subtreeEnd[position];
    }

    /** Children of {@code position} in sibling order. */
    public int[] children(int position) {
        int count = 0;
        for (int t = down[position]; t != 0; t = next[t]) count++;
        int[] out = new int[count];
        int i = 0;
        for (int t = down[position]; t != 0; t = next[t]) out[i++] = t;
        return out;
    }

    /** Siblings of {@code position} including itself. */
    public int siblingCount(int position) {
        int n = 1;
        for (int t = prev[position]; t != 0; t = prev[t]) n++;
        for (int t = next[position]; t != 0; t = next[t]) n++;
        return n;
    }

    /** True when no level mixes real and intermediate siblings. */
    public boolean isPure() {
        return isPureBelow(0);
    }

    private boolean isPureBelow(int s) {
        int reals = 0;
        int intermediates = 0;
        for (int t = down[s]; t != 0; t = next[t]) {
            if (down[t] != 0) {
                if (!isPureBelow(t)) return false;
                intermediates++;
            } else {
                reals++;
            }
        }
        return reals == 0 || intermediates == 0;
    }

    /** Copy of the next-sibling links, indexed by position. */
    public int[] nextLinks() {
        return next.clone();
    }

    /** Copy of the first-child links, indexed by position (entry 0 is 1). */
    public int[] downLinks() {
        return down.clone();
    }
}
