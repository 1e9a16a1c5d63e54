package com.deca.engine.probability;

import com.deca.config.EngineConfig;
import com.deca.engine.base.ConstraintBase;
import com.deca.engine.base.Statement;
import com.deca.engine.base.Tolerance;
import com.deca.tree.AlternativeTree;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link ProbabilityState} from a probability base: box formation from the statements,
 * hull propagation, midpoint box validation, midpoint hull propagation and mass point
 * distribution, followed by the per-alternative normalization check.
 */
public class ProbabilityLoader {

    private static final Logger log = LoggerFactory.getLogger(ProbabilityLoader.class);

    private final EngineConfig config;
    private final MassPointDistributor distributor;

    public ProbabilityLoader(EngineConfig config) {
        this.config = config;
        this.distributor = new MassPointDistributor(new WarpCorrection(config));
    }

    /**
     * @throws DecaException INPUT_ERROR for a malformed statement, INCONSISTENT when the base admits
     *                       no normalized distribution, TOO_NARROW_STMT when a statement leaves a box
     *                       narrower than the configured minimum width
     */
    public ProbabilityState load(FrameTopology topology, ConstraintBase base) {
        int n = topology.totalNodeCount();
        double[] boxLower = new double[n];
        double[] boxUpper = new double[n];
        for (int i = 0; i < n; i++) {
            boxLower[i] = base.boxLower(i);
            boxUpper[i] = base.boxUpper(i);
            if (boxUpper[i] < boxLower[i]) {
                throw new DecaException(ErrorKind.INCONSISTENT, "box of node " + describe(topology, i) + " is empty");
            }
        }
        double minWidth = config.getLimits().getMinStatementWidth();
        for (int s = 1; s <= base.statementCount(); s++) {
            Statement st = base.statement(s);
            validate(topology, st, s);
            int i = topology.sequentialIndex(st.getAlternative(), st.getNode());
            boxLower[i] = Math.max(boxLower[i], st.getLower());
            boxUpper[i] = Math.min(boxUpper[i], st.getUpper());
            if (boxUpper[i] - boxLower[i] < 0.0) {
                throw new DecaException(ErrorKind.INCONSISTENT, "statement " + s + " empties node " + describe(topology, i));
            }
            if (minWidth > 0.0 && boxUpper[i] - boxLower[i] < minWidth) {
                throw new DecaException(ErrorKind.TOO_NARROW_STMT, "statement " + s + " on node " + describe(topology, i));
            }
        }

        double[] localHullLower = new double[n];
        double[] localHullUpper = new double[n];
        double[] hullLower = new double[n];
        double[] hullUpper = new double[n];
        for (int alt = 1; alt <= topology.alternativeCount(); alt++) {
            HullPropagator.propagate(alt, topology.tree(alt), topology.sequentialOffset(alt),
                    boxLower, boxUpper, localHullLower, localHullUpper, hullLower, hullUpper);
        }

        double[] midLower = new double[n];
        double[] midUpper = new double[n];
        for (int i = 0; i < n; i++) {
            if (base.hasMidpoint(i)) {
                double lo = base.midLower(i);
                double hi = base.midUpper(i);
                if (lo < localHullLower[i] - Tolerance.EPS || hi > localHullUpper[i] + Tolerance.EPS || lo > hi) {
                    throw new DecaException(ErrorKind.INCONSISTENT,
                            "midpoint [" + lo + ", " + hi + "] outside hull of node " + describe(topology, i));
                }
                midLower[i] = lo;
                midUpper[i] = hi;
            } else {
                midLower[i] = localHullLower[i];
                midUpper[i] = localHullUpper[i];
            }
        }
        double[] localMidHullLower = new double[n];
        double[] localMidHullUpper = new double[n];
        double[] midHullLower = new double[n];
        double[] midHullUpper = new double[n];
        for (int alt = 1; alt <= topology.alternativeCount(); alt++) {
            HullPropagator.propagate(alt, topology.tree(alt), topology.sequentialOffset(alt),
                    midLower, midUpper, localMidHullLower, localMidHullUpper, midHullLower, midHullUpper);
        }

        double[] localMass = new double[n];
        double[] mass = new double[n];
        boolean hinted = base.hasAnyMidpoint();
        for (int alt = 1; alt <= topology.alternativeCount(); alt++) {
            AlternativeTree tree = topology.tree(alt);
            int offset = topology.sequentialOffset(alt);
            distributor.distribute(tree, offset, localMidHullLower, localMidHullUpper, localMass, mass);
            if (hinted) {
                distributor.renormalize(tree, offset, localMidHullLower, localMidHullUpper, localMass, mass);
            }
            checkNormalization(topology, alt, mass);
        }
        if (log.isDebugEnabled()) {
            log.debug("Probability load | alts={} | nodes={} | statements={} | box={} | hinted={}",
                    topology.alternativeCount(), n, base.statementCount(), base.isBoxSet(), hinted);
        }
        return new ProbabilityState(topology, boxLower, boxUpper, localHullLower, localHullUpper,
                hullLower, hullUpper, localMidHullLower, localMidHullUpper, localMass, mass);
    }

    private static void validate(FrameTopology topology, Statement st, int number) {
        if (st.getLower() < 0.0 || st.getUpper() < st.getLower() || st.getUpper() > 1.0) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "statement " + number + " has bounds ["
                    + st.getLower() + ", " + st.getUpper() + "]");
        }
        if (!topology.isValidNode(st.getAlternative(), st.getNode())) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "statement " + number + " refers to missing node "
                    + st.getAlternative() + "." + st.getNode());
        }
    }

    private static void checkNormalization(FrameTopology topology, int alt, double[] mass) {
        int offset = topology.realOffset(alt);
        double sum = 0.0;
        for (int r = offset; r < offset + topology.realCount(alt); r++) {
            sum += mass[topology.sequentialOfReal(r)];
        }
        if (sum < 1.0 - Tolerance.EPS100 || sum > 1.0 + Tolerance.EPS100) {
            throw new DecaException(ErrorKind.INCONSISTENT, "mass points of alternative " + alt + " sum to " + sum);
        }
    }

    static String describe(FrameTopology topology, int seq) {
        return topology.alternativeOfSequential(seq) + "." + topology.positionOfSequential(seq);
    }
}
