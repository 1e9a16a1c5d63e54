package com.deca.engine.value;

import com.deca.config.EngineConfig;
import com.deca.engine.base.ConstraintBase;
import com.deca.engine.base.Statement;
import com.deca.engine.base.Tolerance;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link ValueState} from a value base. Values have no normalization, so the hull is
 * the box intersected with the statements and the mass point is the middle of the midpoint box
 * (or of the hull when no midpoint is given). Box and midpoint entries of intermediate nodes are
 * ignored.
 */
public final class ValueLoader {

    private static final Logger log = LoggerFactory.getLogger(ValueLoader.class);

    private final EngineConfig config;

    public ValueLoader(EngineConfig config) {
        this.config = config;
    }

    /**
     * @throws DecaException INPUT_ERROR for a malformed statement, ILLEGAL_NODE for a statement on an
     *                       intermediate node, INCONSISTENT for an empty hull or a midpoint outside it,
     *                       TOO_NARROW_STMT below the configured minimum width
     */
    public ValueState load(FrameTopology topology, ConstraintBase base) {
        int n = topology.totalRealCount();
        double[] lower = new double[n];
        double[] upper = new double[n];
        for (int r = 0; r < n; r++) {
            int seq = topology.sequentialOfReal(r);
            lower[r] = base.boxLower(seq);
            upper[r] = base.boxUpper(seq);
        }
        double minWidth = config.getLimits().getMinStatementWidth();
        for (int s = 1; s <= base.statementCount(); s++) {
            Statement st = base.statement(s);
            if (st.getLower() < 0.0 || st.getUpper() < st.getLower() || st.getUpper() > 1.0
                    || !topology.isValidNode(st.getAlternative(), st.getNode())) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "value statement " + s + ": " + st);
            }
            int r = topology.realIndex(st.getAlternative(), st.getNode());
            if (r < 0) {
                throw new DecaException(ErrorKind.ILLEGAL_NODE, "value statement " + s + " on intermediate node "
                        + st.getAlternative() + "." + st.getNode());
            }
            lower[r] = Math.max(lower[r], st.getLower());
            upper[r] = Math.min(upper[r], st.getUpper());
            if (lower[r] > upper[r]) {
                throw new DecaException(ErrorKind.INCONSISTENT, "value statement " + s + " empties node "
                        + st.getAlternative() + "." + st.getNode());
            }
            if (minWidth > 0.0 && upper[r] - lower[r] < minWidth) {
                throw new DecaException(ErrorKind.TOO_NARROW_STMT, "value statement " + s);
            }
        }
        double[] mass = new double[n];
        for (int r = 0; r < n; r++) {
            if (lower[r] > upper[r]) {
                throw new DecaException(ErrorKind.INCONSISTENT, "value box of real node " + r + " is empty");
            }
            int seq = topology.sequentialOfReal(r);
            double midLower = lower[r];
            double midUpper = upper[r];
            if (base.hasMidpoint(seq)) {
                midLower = base.midLower(seq);
                midUpper = base.midUpper(seq);
                if (midLower < lower[r] - Tolerance.EPS || midUpper > upper[r] + Tolerance.EPS || midLower > midUpper) {
                    throw new DecaException(ErrorKind.INCONSISTENT, "value midpoint [" + midLower + ", " + midUpper
                            + "] outside hull of node " + topology.alternativeOfSequential(seq) + "."
                            + topology.positionOfSequential(seq));
                }
            }
            mass[r] = (midLower + midUpper) / 2.0;
        }
        if (log.isDebugEnabled()) {
            log.debug("Value load | leaves={} | statements={} | box={}", n, base.statementCount(), base.isBoxSet());
        }
        return new ValueState(topology, lower, upper, mass);
    }
}
