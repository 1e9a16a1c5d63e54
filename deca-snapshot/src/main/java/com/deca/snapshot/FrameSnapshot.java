package com.deca.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Persistable form of a decision frame: shape, name and the input of both layers. Derived state
 * is never stored; a restored frame is detached and recomputes it on attach.
 * <p>
 * {@code next} and {@code down} hold the tree links per alternative and are absent for flat
 * frames, where {@code nodeCounts} is the number of consequences per alternative.
 */
public final class FrameSnapshot {

    public static final String CURRENT_VERSION = "1";

    private final String version;
    private final String name;
    private final int[] nodeCounts;
    private final int[][] next;
    private final int[][] down;
    private final LayerSnapshot probabilities;
    private final LayerSnapshot values;

    @JsonCreator
    public FrameSnapshot(
            @JsonProperty("version") String version,
            @JsonProperty("name") String name,
            @JsonProperty("nodeCounts") int[] nodeCounts,
            @JsonProperty("next") int[][] next,
            @JsonProperty("down") int[][] down,
            @JsonProperty("probabilities") LayerSnapshot probabilities,
            @JsonProperty("values") LayerSnapshot values) {
        this.version = version != null ? version : CURRENT_VERSION;
        this.name = name != null ? name : "";
        this.nodeCounts = Objects.requireNonNull(nodeCounts, "nodeCounts").clone();
        this.next = copy(next);
        this.down = copy(down);
        this.probabilities = probabilities;
        this.values = values;
    }

    public String getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    public int[] getNodeCounts() {
        return nodeCounts.clone();
    }

    public int[][] getNext() {
        return copy(next);
    }

    public int[][] getDown() {
        return copy(down);
    }

    /** True when the snapshot carries tree links. */
    @JsonIgnore
    public boolean isTree() {
        return next != null && down != null;
    }

    public LayerSnapshot getProbabilities() {
        return probabilities;
    }

    public LayerSnapshot getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FrameSnapshot that = (FrameSnapshot) o;
        return version.equals(that.version)
                && name.equals(that.name)
                && Arrays.equals(nodeCounts, that.nodeCounts)
                && Arrays.deepEquals(next, that.next)
                && Arrays.deepEquals(down, that.down)
                && Objects.equals(probabilities, that.probabilities)
                && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(version, name, probabilities, values);
        h = 31 * h + Arrays.hashCode(nodeCounts);
        h = 31 * h + Arrays.deepHashCode(next);
        h = 31 * h + Arrays.deepHashCode(down);
        return h;
    }

    private static int[][] copy(int[][] links) {
        if (links == null) {
            return null;
        }
        int[][] c = new int[links.length][];
        for (int a = 0; a < links.length; a++) {
            c[a] = links[a] != null ? links[a].clone() : null;
        }
        return c;
    }
}
