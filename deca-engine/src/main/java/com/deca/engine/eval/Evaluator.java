package com.deca.engine.eval;

import com.deca.config.DigammaEmptyPolicy;
import com.deca.engine.probability.ProbabilityState;
import com.deca.engine.value.ValueState;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;

/**
 * Runs the five evaluation methods over one consistent pair of probability and value states.
 * The comparison methods combine psi bounds so that the lower result pairs the alternative's
 * worst case with the others' best case and vice versa.
 */
public final class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final FrameTopology topology;
    private final ProbabilityState probabilities;
    private final ValueState values;
    private final ExtremalAllocator allocator;
    private final DigammaEmptyPolicy emptyPolicy;

    public Evaluator(FrameTopology topology, ProbabilityState probabilities, ValueState values,
                     DigammaEmptyPolicy emptyPolicy) {
        this.topology = topology;
        this.probabilities = probabilities;
        this.values = values;
        this.allocator = new ExtremalAllocator(topology, probabilities);
        this.emptyPolicy = emptyPolicy;
    }

    public ExtremalAllocator allocator() {
        return allocator;
    }

    /** Mass-point expected value of an alternative. */
    public double omega(int alt) {
        topology.requireAlternative(alt);
        int first = topology.realOffset(alt);
        double omega = 0.0;
        for (int r = first; r < first + topology.realCount(alt); r++) {
            omega += probabilities.mass(topology.sequentialOfReal(r)) * values.mass(r);
        }
        return omega;
    }

    public double psiMin(int alt) {
        return allocator.extremum(alt, values.lowerHull(), false);
    }

    public double psiMax(int alt) {
        return allocator.extremum(alt, values.upperHull(), true);
    }

    /**
     * Evaluates {@code alt} with the given method. {@code other} is the second alternative for
     * DELTA, a bit mask of alternatives (bit {@code a-1} for alternative {@code a}) for DIGAMMA,
     * and must be 0 otherwise.
     *
     * @throws DecaException INPUT_ERROR for bad alternatives or a misplaced second argument
     */
    public EvaluationResult evaluate(EvaluationMethod method, int alt, int other) {
        topology.requireAlternative(alt);
        switch (method) {
            case OMEGA:
                requireNoOther(method, other);
                double omega = omega(alt);
                return new EvaluationResult(omega, omega, omega);
            case PSI:
                requireNoOther(method, other);
                return psi(alt);
            case DELTA:
                if (!topology.isValidAlternative(other) || other == alt) {
                    throw new DecaException(ErrorKind.INPUT_ERROR, "delta needs a second alternative, got " + other);
                }
                return delta(alt, other);
            case GAMMA:
                requireNoOther(method, other);
                BitSet all = new BitSet();
                all.set(0, topology.alternativeCount());
                all.clear(alt - 1);
                return compare(alt, all);
            case DIGAMMA:
                BitSet mask = new BitSet();
                for (int a = 1; a <= Math.min(topology.alternativeCount(), Integer.SIZE - 1); a++) {
                    if ((other & (1 << (a - 1))) != 0) mask.set(a - 1);
                }
                return digamma(alt, mask);
            default:
                throw new DecaException(ErrorKind.INPUT_ERROR, "unknown method " + method);
        }
    }

    /**
     * DIGAMMA against the alternatives whose bit {@code a-1} is set in {@code others}.
     * Bits beyond the alternative count are ignored.
     */
    public EvaluationResult digamma(int alt, BitSet others) {
        topology.requireAlternative(alt);
        if (others.get(alt - 1)) {
            throw new DecaException(ErrorKind.INPUT_ERROR, "digamma set contains alternative " + alt);
        }
        BitSet selected = others.get(0, topology.alternativeCount());
        if (selected.isEmpty()) {
            if (emptyPolicy == DigammaEmptyPolicy.REJECT) {
                throw new DecaException(ErrorKind.INPUT_ERROR, "digamma set is empty");
            }
            if (log.isDebugEnabled()) log.debug("Digamma empty set | alt={} | answering psi", alt);
            return psi(alt);
        }
        return compare(alt, selected);
    }

    private EvaluationResult psi(int alt) {
        return new EvaluationResult(psiMin(alt), omega(alt), psiMax(alt));
    }

    private EvaluationResult delta(int alt, int other) {
        return new EvaluationResult(
                psiMin(alt) - psiMax(other),
                omega(alt) - omega(other),
                psiMax(alt) - psiMin(other));
    }

    private EvaluationResult compare(int alt, BitSet others) {
        double scale = others.cardinality();
        double min = psiMin(alt);
        double mid = omega(alt);
        double max = psiMax(alt);
        for (int b = others.nextSetBit(0); b >= 0; b = others.nextSetBit(b + 1)) {
            int a = b + 1;
            min -= psiMax(a) / scale;
            mid -= omega(a) / scale;
            max -= psiMin(a) / scale;
        }
        return new EvaluationResult(min, mid, max);
    }

    private static void requireNoOther(EvaluationMethod method, int other) {
        if (other != 0) {
            throw new DecaException(ErrorKind.INPUT_ERROR, method + " takes no second alternative, got " + other);
        }
    }
}
