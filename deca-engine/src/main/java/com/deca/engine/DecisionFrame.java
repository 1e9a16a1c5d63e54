package com.deca.engine;

import com.deca.config.EngineConfig;
import com.deca.engine.eval.Allocation;
import com.deca.engine.eval.EvaluationMethod;
import com.deca.engine.eval.EvaluationResult;
import com.deca.engine.eval.Evaluator;
import com.deca.engine.moments.MomentCalculator;
import com.deca.engine.moments.MomentReport;
import com.deca.engine.moments.Moments;
import com.deca.engine.moments.SecurityLevelCalculator;
import com.deca.engine.moments.SecurityLevels;
import com.deca.engine.probability.ProbabilityLoader;
import com.deca.engine.probability.ProbabilityState;
import com.deca.engine.value.ValueLoader;
import com.deca.engine.value.ValueState;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.Objects;

/**
 * A decision frame: alternatives shaped as trees, with a probability and a value constraint layer.
 * <p>
 * A new frame is detached. {@link #attach()} derives hulls and mass points from both layers and
 * keeps them consistent through every later mutation; {@link #detach()} drops the derived state
 * but keeps the input. A disposed frame rejects every call with {@link ErrorKind#CORRUPTED}.
 * <p>
 * Queries on an attached frame that is not being mutated may run concurrently; mutations of one
 * frame must not.
 */
public final class DecisionFrame {

    private static final Logger log = LoggerFactory.getLogger(DecisionFrame.class);

    /** Longest accepted frame name. */
    public static final int MAX_NAME_LENGTH = 128;

    private final EngineConfig config;
    private final FrameTopology topology;
    private final ProbabilityLoader probabilityLoader;
    private final ValueLoader valueLoader;
    private final ProbabilityLayer probabilities;
    private final ValueLayer values;
    private volatile String name = "";
    private volatile Loaded loaded;
    private volatile boolean disposed;

    private DecisionFrame(EngineConfig config, FrameTopology topology) {
        this(config, topology, new ProbabilityLoader(config), new ValueLoader(config));
    }

    DecisionFrame(EngineConfig config, FrameTopology topology, ProbabilityLoader probabilityLoader,
                  ValueLoader valueLoader) {
        this.config = config;
        this.topology = topology;
        this.probabilityLoader = probabilityLoader;
        this.valueLoader = valueLoader;
        this.probabilities = new ProbabilityLayer(this);
        this.values = new ValueLayer(this);
    }

    /** Frame whose alternatives are flat lists of real nodes, with default configuration. */
    public static DecisionFrame createFlat(int... leafCounts) {
        return createFlat(EngineConfig.DEFAULT, leafCounts);
    }

    /**
     * Frame whose alternatives are flat lists of real nodes.
     *
     * @param leafCounts number of consequences per alternative
     * @throws DecaException TOO_FEW_ALTS, TOO_MANY_ALTS, TOO_MANY_CONS or INPUT_ERROR for a bad shape
     */
    public static DecisionFrame createFlat(EngineConfig config, int... leafCounts) {
        Objects.requireNonNull(config, "config");
        FrameTopology topology = FrameTopology.flat(config.getLimits(), leafCounts);
        log.info("Frame created | shape=flat | alts={} | nodes={}", topology.alternativeCount(),
                topology.totalNodeCount());
        return new DecisionFrame(config, topology);
    }

    public static DecisionFrame createTree(int[] nodeCounts, int[][] next, int[][] down) {
        return createTree(EngineConfig.DEFAULT, nodeCounts, next, down);
    }

    /**
     * Frame whose alternatives are trees given as preorder sibling and child links. For
     * alternative {@code a}, {@code next[a-1][t]} is the next sibling of node {@code t} and
     * {@code down[a-1][t]} its first child (0 for none); entry 0 describes the root.
     *
     * @throws DecaException TREE_ERROR for malformed links or an intermediate node with one child,
     *                       plus the shape errors of {@link #createFlat(EngineConfig, int...)}
     */
    public static DecisionFrame createTree(EngineConfig config, int[] nodeCounts, int[][] next, int[][] down) {
        Objects.requireNonNull(config, "config");
        FrameTopology topology = FrameTopology.tree(config.getLimits(), nodeCounts, next, down);
        log.info("Frame created | shape=tree | alts={} | nodes={} | intermediate={}", topology.alternativeCount(),
                topology.totalNodeCount(), topology.totalIntermediateCount());
        return new DecisionFrame(config, topology);
    }

    // ---- identity ----

    public String getName() {
        checkNotDisposed();
        return name;
    }

    /** @throws DecaException INPUT_ERROR for a name longer than {@link #MAX_NAME_LENGTH} */
    public void setName(String name) {
        checkNotDisposed();
        Objects.requireNonNull(name, "name");
        if (name.length() > MAX_NAME_LENGTH) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "frame name has " + name.length() + " characters");
        }
        this.name = name;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public FrameTopology topology() {
        return topology;
    }

    public ProbabilityLayer probabilities() {
        checkNotDisposed();
        return probabilities;
    }

    public ValueLayer values() {
        checkNotDisposed();
        return values;
    }

    // ---- lifecycle ----

    public boolean isAttached() {
        return loaded != null;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Derives the state of both layers. On failure the frame stays detached.
     *
     * @throws DecaException ATTACHED when already attached, or the load error
     */
    public void attach() {
        checkNotDisposed();
        if (loaded != null) {
            throw new DecaException(ErrorKind.ATTACHED, "frame '" + name + "'");
        }
        loaded = load();
        log.info("Frame attached | name={} | alts={} | pStatements={} | vStatements={}", name,
                topology.alternativeCount(), probabilities.base.statementCount(), values.base.statementCount());
    }

    /** Drops the derived state. Statements, boxes and midpoints are kept. */
    public void detach() {
        checkNotDisposed();
        if (loaded != null) {
            loaded = null;
            log.info("Frame detached | name={}", name);
        }
    }

    /** @throws DecaException CORRUPTED when already disposed */
    public void dispose() {
        checkNotDisposed();
        disposed = true;
        loaded = null;
        log.info("Frame disposed | name={}", name);
    }

    // ---- tree properties ----

    /** True when no level of the alternative mixes real and intermediate siblings. */
    public boolean isPureTree(int alt) {
        loaded();
        return topology.isPureTree(alt);
    }

    public boolean haveSameParent(int alt, int node1, int node2) {
        loaded();
        return topology.haveSameParent(alt, node1, node2);
    }

    /** Number of children of the node's parent, the node included. */
    public int siblingCount(int alt, int node) {
        loaded();
        return topology.siblingCount(alt, node);
    }

    // ---- evaluation ----

    public EvaluationResult evaluate(EvaluationMethod method, int alt) {
        return evaluate(method, alt, 0);
    }

    /**
     * @param other second alternative for DELTA, alternative bit mask for DIGAMMA, 0 otherwise
     */
    public EvaluationResult evaluate(EvaluationMethod method, int alt, int other) {
        Objects.requireNonNull(method, "method");
        return loaded().evaluator().evaluate(method, alt, other);
    }

    /** DIGAMMA against the alternatives whose bit {@code a-1} is set. */
    public EvaluationResult evaluateDigamma(int alt, BitSet others) {
        Objects.requireNonNull(others, "others");
        return loaded().evaluator().digamma(alt, others);
    }

    public double evaluateOmega(int alt) {
        return loaded().evaluator().omega(alt);
    }

    /**
     * Highest expected value of a subtree over the probability hull for caller supplied values.
     *
     * @param node   subtree root, 0 for the whole alternative
     * @param values value per real node, by global real index
     * @param negate return the negated expected value
     */
    public Allocation maximize(int alt, int node, double[] values, boolean negate) {
        Objects.requireNonNull(values, "values");
        return loaded().evaluator().allocator().maximize(alt, node, values, negate);
    }

    public Allocation minimize(int alt, int node, double[] values, boolean negate) {
        Objects.requireNonNull(values, "values");
        return loaded().evaluator().allocator().minimize(alt, node, values, negate);
    }

    // ---- moments and security ----

    /** Moments of every alternative; computed once per loaded state. */
    public MomentReport moments() {
        return loaded().moments();
    }

    public Moments moments(int alt) {
        return moments().moments(alt);
    }

    public double probabilityDeviation(int alt, int node) {
        MomentReport report = moments();
        topology.requireNode(alt, node);
        return report.probabilityDeviation(alt, node);
    }

    /** Value deviation of a node; -1 for an intermediate node unless {@code includeIntermediate}. */
    public double valueDeviation(int alt, int node, boolean includeIntermediate) {
        MomentReport report = moments();
        topology.requireNode(alt, node);
        return report.valueDeviation(alt, node, includeIntermediate);
    }

    /**
     * Moments of alternative 1's subtree below {@code node} with caller supplied leaf moments.
     * Arrays are indexed by real ordinal - 1 within alternative 1.
     */
    public MomentReport criteriaMoments(int node, double[] mean, double[] variance, double[] thirdCentral) {
        Objects.requireNonNull(mean, "mean");
        Objects.requireNonNull(variance, "variance");
        Objects.requireNonNull(thirdCentral, "thirdCentral");
        Loaded l = loaded();
        return new MomentCalculator(config.getMeanSnapMode())
                .computeCriteria(topology, l.probabilities(), node, mean, variance, thirdCentral);
    }

    /** @throws DecaException INPUT_ERROR for a threshold outside [0,1] */
    public SecurityLevels securityLevels(double threshold) {
        Loaded l = loaded();
        return new SecurityLevelCalculator(topology, l.probabilities(), l.values()).compute(threshold);
    }

    // ---- package internals ----

    void checkNotDisposed() {
        if (disposed) {
            throw new DecaException(ErrorKind.CORRUPTED, "frame '" + name + "' is disposed");
        }
    }

    /** Current derived state. */
    Loaded loaded() {
        checkNotDisposed();
        Loaded l = loaded;
        if (l == null) {
            throw new DecaException(ErrorKind.DETACHED, "frame '" + name + "'");
        }
        return l;
    }

    /** Re-derives the state of an attached frame; on failure the previous state stays published. */
    void reload() {
        loaded = load();
    }

    void forceDetach(String operation, DecaException cause) {
        loaded = null;
        log.warn("Frame forced detached | name={} | op={} | kind={} | {}", name, operation, cause.getKind(),
                cause.getDetail());
    }

    private Loaded load() {
        ProbabilityState p = probabilityLoader.load(topology, probabilities.base);
        ValueState v = valueLoader.load(topology, values.base);
        return new Loaded(p, v, new Evaluator(topology, p, v, config.getDigammaEmptyPolicy()));
    }

    /** Derived state of one successful load. */
    final class Loaded {
        private final ProbabilityState probabilities;
        private final ValueState values;
        private final Evaluator evaluator;
        private volatile MomentReport moments;

        Loaded(ProbabilityState probabilities, ValueState values, Evaluator evaluator) {
            this.probabilities = probabilities;
            this.values = values;
            this.evaluator = evaluator;
        }

        ProbabilityState probabilities() {
            return probabilities;
        }

        ValueState values() {
            return values;
        }

        Evaluator evaluator() {
            return evaluator;
        }

        MomentReport moments() {
            MomentReport m = moments;
            if (m == null) {
                m = new MomentCalculator(config.getMeanSnapMode()).compute(topology, probabilities, values);
                moments = m;
            }
            return m;
        }
    }
}
