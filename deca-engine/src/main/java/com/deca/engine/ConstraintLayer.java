package com.deca.engine;

import com.deca.engine.base.ConstraintBase;
import com.deca.engine.base.IntervalVector;
import com.deca.engine.base.Statement;
import com.deca.engine.base.Tolerance;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One constraint layer of a {@link DecisionFrame}: its statements, box override and midpoint hints.
 * <p>
 * Every mutation is transactional. Arguments are validated before anything changes; the base is
 * then changed and, when the frame is attached, the derived state is reloaded. If the reload
 * fails the base is restored and reloaded once more, and should that fail too the frame is
 * detached. The first failure is rethrown in both cases. On a detached frame mutations only
 * change the base and validation is deferred to the next attach.
 * <p>
 * Box and midpoint arrays are indexed by sequential node index.
 */
public abstract class ConstraintLayer {

    private static final Logger log = LoggerFactory.getLogger(ConstraintLayer.class);

    final DecisionFrame frame;
    final ConstraintBase base;

    ConstraintLayer(DecisionFrame frame) {
        this.frame = frame;
        this.base = new ConstraintBase(frame.topology().totalNodeCount());
    }

    /** Short layer name used in log lines and messages. */
    abstract String layerName();

    /** Validates a statement's node reference and bounds. */
    abstract void checkStatement(int alt, int node, double lower, double upper);

    /** Validates a midpoint statement's node reference and bounds. */
    abstract void checkMidpoint(int alt, int node, double lower, double upper);

    /** True when the layer takes input for the node at this sequential index. */
    abstract boolean acceptsNode(int seq);

    final FrameTopology topology() {
        return frame.topology();
    }

    // ---- statements ----

    public int statementCount() {
        frame.checkNotDisposed();
        return base.statementCount();
    }

    /** Statement by 1-based number. */
    public Statement statement(int number) {
        frame.checkNotDisposed();
        checkNumber(number);
        return base.statement(number);
    }

    public List<Statement> statements() {
        frame.checkNotDisposed();
        return base.statements();
    }

    /**
     * Appends a statement.
     *
     * @return the statement's number
     * @throws DecaException TOO_MANY_STMTS when the base is full, INPUT_ERROR for bad arguments, or
     *                       the load error of an attached frame
     */
    public int add(int alt, int node, double lower, double upper) {
        frame.checkNotDisposed();
        if (base.statementCount() >= frame.getConfig().getLimits().getMaxStatements()) {
            throw new DecaException(ErrorKind.TOO_MANY_STMTS, layerName() + " base holds "
                    + base.statementCount() + " statements");
        }
        checkStatement(alt, node, lower, upper);
        Statement statement = new Statement(alt, node, lower, upper);
        mutate("add", b -> b.append(statement));
        return base.statementCount();
    }

    /** Replaces statement {@code number} by a statement on a possibly different node. */
    public void replace(int number, int alt, int node, double lower, double upper) {
        frame.checkNotDisposed();
        checkNumber(number);
        checkStatement(alt, node, lower, upper);
        Statement statement = new Statement(alt, node, lower, upper);
        mutate("replace", b -> b.replace(number, statement));
    }

    /** Changes the bounds of statement {@code number}, keeping its node. */
    public void change(int number, double lower, double upper) {
        frame.checkNotDisposed();
        checkNumber(number);
        Statement current = base.statement(number);
        checkStatement(current.getAlternative(), current.getNode(), lower, upper);
        mutate("change", b -> b.replace(number, current.withBounds(lower, upper)));
    }

    /** Deletes statement {@code number}; later statements move up one number. */
    public void delete(int number) {
        frame.checkNotDisposed();
        checkNumber(number);
        mutate("delete", b -> b.remove(number));
    }

    // ---- midpoints ----

    public void addMidpoint(int alt, int node, double lower, double upper) {
        frame.checkNotDisposed();
        checkMidpoint(alt, node, lower, upper);
        int seq = topology().sequentialIndex(alt, node);
        mutate("add midpoint", b -> b.setMidpoint(seq, lower, upper));
    }

    public abstract void deleteMidpoint(int alt, int node);

    // ---- box ----

    public boolean isBoxSet() {
        frame.checkNotDisposed();
        return base.isBoxSet();
    }

    /**
     * Overrides the default [0,1] box of every node.
     *
     * @throws DecaException INPUT_ERROR for arrays of the wrong length or bounds outside [0,1]
     */
    public void setBox(double[] lower, double[] upper) {
        frame.checkNotDisposed();
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(upper, "upper");
        checkLength(lower, upper);
        double[] lo = new double[lower.length];
        double[] hi = new double[upper.length];
        for (int i = 0; i < lower.length; i++) {
            if (!acceptsNode(i)) {
                lo[i] = 0.0;
                hi[i] = 1.0;
                continue;
            }
            if (lower[i] < 0.0 || lower[i] > 1.0 || upper[i] < 0.0 || upper[i] > 1.0) {
                throw new DecaException(ErrorKind.INPUT_ERROR, layerName() + " box entry " + i
                        + " [" + lower[i] + ", " + upper[i] + "] outside [0,1]");
            }
            lo[i] = lower[i];
            hi[i] = upper[i];
        }
        mutate("set box", b -> b.setBox(lo, hi));
    }

    /** Drops the box override. A no-op without a box; a failed reload detaches the frame. */
    public void unsetBox() {
        frame.checkNotDisposed();
        if (!base.isBoxSet()) {
            return;
        }
        base.clearBox();
        if (frame.isAttached()) {
            try {
                frame.reload();
            } catch (DecaException e) {
                frame.forceDetach(layerName() + " unset box", e);
                throw e;
            }
        }
    }

    /** Box bounds per node; entries the layer does not use read -1. */
    public IntervalVector getBox() {
        frame.checkNotDisposed();
        int n = base.nodeCount();
        double[] lo = new double[n];
        double[] hi = new double[n];
        for (int i = 0; i < n; i++) {
            lo[i] = acceptsNode(i) ? base.boxLower(i) : Tolerance.UNSET;
            hi[i] = acceptsNode(i) ? base.boxUpper(i) : Tolerance.UNSET;
        }
        return new IntervalVector(lo, hi);
    }

    // ---- midpoint box ----

    /**
     * Sets all midpoint hints at once. A lower entry of -1 unsets the node's hint, -2 keeps it.
     *
     * @throws DecaException INPUT_ERROR for arrays of the wrong length, bounds outside [0,1] or a
     *                       lower bound above the upper
     */
    public void setMidpointBox(double[] lower, double[] upper) {
        frame.checkNotDisposed();
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(upper, "upper");
        checkLength(lower, upper);
        for (int i = 0; i < lower.length; i++) {
            if (!acceptsNode(i) || lower[i] == Tolerance.UNSET || lower[i] == Tolerance.KEEP) {
                continue;
            }
            if (lower[i] < 0.0 || upper[i] > 1.0 || lower[i] > upper[i]) {
                throw new DecaException(ErrorKind.INPUT_ERROR, layerName() + " midpoint entry " + i
                        + " [" + lower[i] + ", " + upper[i] + "] is not an interval in [0,1]");
            }
        }
        double[] lo = lower.clone();
        double[] hi = upper.clone();
        mutate("set midpoint box", b -> {
            for (int i = 0; i < lo.length; i++) {
                if (!acceptsNode(i) || lo[i] == Tolerance.KEEP) {
                    continue;
                }
                if (lo[i] == Tolerance.UNSET) {
                    b.clearMidpoint(i);
                } else {
                    b.setMidpoint(i, lo[i], hi[i]);
                }
            }
        });
    }

    /** Midpoint hints per node; unset entries and entries the layer does not use read -1. */
    public IntervalVector getMidpointBox() {
        frame.checkNotDisposed();
        int n = base.nodeCount();
        double[] lo = new double[n];
        double[] hi = new double[n];
        for (int i = 0; i < n; i++) {
            boolean set = acceptsNode(i) && base.hasMidpoint(i);
            lo[i] = set ? base.midLower(i) : Tolerance.UNSET;
            hi[i] = set ? base.midUpper(i) : Tolerance.UNSET;
        }
        return new IntervalVector(lo, hi);
    }

    /** Drops statements, box and midpoint hints. */
    public void reset() {
        frame.checkNotDisposed();
        mutate("reset", ConstraintBase::reset);
    }

    // ---- internals ----

    final void mutate(String operation, Consumer<ConstraintBase> change) {
        ConstraintBase saved = base.copy();
        change.accept(base);
        if (!frame.isAttached()) {
            return;
        }
        try {
            frame.reload();
        } catch (DecaException e) {
            base.restoreFrom(saved);
            log.warn("Constraint rollback | layer={} | op={} | kind={} | {}", layerName(), operation,
                    e.getKind(), e.getDetail());
            try {
                frame.reload();
            } catch (DecaException again) {
                frame.forceDetach(layerName() + " " + operation, again);
            }
            throw e;
        }
    }

    final void checkNumber(int number) {
        if (number < 1 || number > base.statementCount()) {
            throw new DecaException(ErrorKind.INPUT_ERROR, layerName() + " statement " + number
                    + " does not exist (" + base.statementCount() + " statements)");
        }
    }

    static void checkBounds(String what, double lower, double upper) {
        if (lower < 0.0 || upper > 1.0 || lower > upper) {
            throw new DecaException(ErrorKind.INPUT_ERROR, what + " bounds [" + lower + ", " + upper + "]");
        }
    }

    private void checkLength(double[] lower, double[] upper) {
        int n = base.nodeCount();
        if (lower.length != n || upper.length != n) {
            throw new DecaException(ErrorKind.INPUT_ERROR, layerName() + " box needs " + n + " entries, got "
                    + lower.length + " and " + upper.length);
        }
    }
}
