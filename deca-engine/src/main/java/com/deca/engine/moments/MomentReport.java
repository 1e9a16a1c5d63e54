package com.deca.engine.moments;

import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;

/**
 * Moments per alternative plus the per-node standard deviations found on the way.
 * Deviations are indexed by sequential node index; nodes not visited carry -1.
 */
public final class MomentReport {

    private final FrameTopology topology;
    private final Moments[] byAlternative;
    private final double[] probabilitySd;
    private final double[] valueSd;

    MomentReport(FrameTopology topology, Moments[] byAlternative, double[] probabilitySd, double[] valueSd) {
        this.topology = topology;
        this.byAlternative = byAlternative;
        this.probabilitySd = probabilitySd;
        this.valueSd = valueSd;
    }

    /** @throws DecaException INPUT_ERROR when the alternative was not part of this computation */
    public Moments moments(int alt) {
        topology.requireAlternative(alt);
        Moments m = byAlternative[alt - 1];
        if (m == null) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "no moments for alternative " + alt);
        }
        return m;
    }

    /** Standard deviation of the local probability of a node. */
    public double probabilityDeviation(int alt, int node) {
        return probabilitySd[topology.sequentialIndex(alt, node)];
    }

    /**
     * Standard deviation of the value of a node. For an intermediate node this is the deviation of
     * its subtree outcome and is only returned when {@code includeIntermediate} is set; otherwise -1.
     */
    public double valueDeviation(int alt, int node, boolean includeIntermediate) {
        int seq = topology.sequentialIndex(alt, node);
        if (topology.realOfSequential(seq) < 0 && !includeIntermediate) {
            return -1.0;
        }
        return valueSd[seq];
    }
}
