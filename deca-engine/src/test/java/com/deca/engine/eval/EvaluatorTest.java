package com.deca.engine.eval;

import com.deca.config.DigammaEmptyPolicy;
import com.deca.config.EngineConfig;
import com.deca.engine.DecisionFrame;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorTest {

    private static final double TOL = 1e-7;

    /** Three single-consequence alternatives worth 0.3, 0.6 and 0.9. */
    private static DecisionFrame threeSure(EngineConfig config) {
        DecisionFrame frame = DecisionFrame.createFlat(config, 1, 1, 1);
        frame.attach();
        frame.values().add(1, 1, 0.3, 0.3);
        frame.values().add(2, 1, 0.6, 0.6);
        frame.values().add(3, 1, 0.9, 0.9);
        return frame;
    }

    /** Alternative 1 with an intermediate node over two leaves, values 0.2, 0.4 and 1.0. */
    private static DecisionFrame treeWithValues() {
        DecisionFrame frame = DecisionFrame.createTree(new int[]{4, 2},
                new int[][]{{0, 4, 3, 0, 0}, {0, 2, 0}},
                new int[][]{{0, 2, 0, 0, 0}, {0, 0, 0}});
        frame.attach();
        frame.values().add(1, 2, 0.2, 0.2);
        frame.values().add(1, 3, 0.4, 0.4);
        frame.values().add(1, 4, 1.0, 1.0);
        return frame;
    }

    private static void assertResult(double min, double mid, double max, EvaluationResult r) {
        assertEquals(min, r.getMin(), TOL, "min");
        assertEquals(mid, r.getMid(), TOL, "mid");
        assertEquals(max, r.getMax(), TOL, "max");
    }

    @Test
    void psi_unconstrainedProbabilities_spanValueRange() {
        DecisionFrame frame = DecisionFrame.createFlat(2, 2);
        frame.attach();
        frame.values().add(1, 1, 0.2, 0.2);
        frame.values().add(1, 2, 0.8, 0.8);
        assertResult(0.2, 0.5, 0.8, frame.evaluate(EvaluationMethod.PSI, 1));
    }

    @Test
    void psi_treeAlternative_recursesThroughIntermediateNode() {
        DecisionFrame frame = treeWithValues();
        assertEquals(0.65, frame.evaluateOmega(1), TOL);
        assertResult(0.2, 0.65, 1.0, frame.evaluate(EvaluationMethod.PSI, 1));
    }

    @Test
    void maximize_subtree_returnsAllocation() {
        DecisionFrame frame = treeWithValues();
        double[] values = {0.2, 0.4, 1.0, 0.0, 0.0};
        Allocation max = frame.maximize(1, 1, values, false);
        assertEquals(0.4, max.getExpectedValue(), TOL);
        assertEquals(0.0, max.localProbability(1), TOL);
        assertEquals(1.0, max.localProbability(2), TOL);
        assertEquals(-1.0, max.localProbability(3));

        assertEquals(-0.4, frame.maximize(1, 1, values, true).getExpectedValue(), TOL);
        assertEquals(0.2, frame.minimize(1, 0, values, false).getExpectedValue(), TOL);

        DecaException e = assertThrows(DecaException.class, () -> frame.maximize(1, 2, values, false));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
        e = assertThrows(DecaException.class, () -> frame.maximize(1, 0, new double[]{0.1}, false));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void gamma_comparesAgainstMeanOfOthers() {
        DecisionFrame frame = threeSure(EngineConfig.DEFAULT);
        assertResult(-0.45, -0.45, -0.45, frame.evaluate(EvaluationMethod.GAMMA, 1));
        assertResult(0.45, 0.45, 0.45, frame.evaluate(EvaluationMethod.GAMMA, 3));
    }

    @Test
    void digamma_comparesAgainstSelectedSubset() {
        DecisionFrame frame = threeSure(EngineConfig.DEFAULT);
        assertResult(-0.6, -0.6, -0.6, frame.evaluate(EvaluationMethod.DIGAMMA, 1, 0b100));
        BitSet others = new BitSet();
        others.set(1);
        others.set(40);
        assertResult(-0.3, -0.3, -0.3, frame.evaluateDigamma(1, others));
    }

    @Test
    void digamma_ownBit_inputError() {
        DecisionFrame frame = threeSure(EngineConfig.DEFAULT);
        DecaException e = assertThrows(DecaException.class,
                () -> frame.evaluate(EvaluationMethod.DIGAMMA, 1, 0b011));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void digamma_emptySet_followsPolicy() {
        DecisionFrame degrade = threeSure(EngineConfig.DEFAULT);
        assertResult(0.3, 0.3, 0.3, degrade.evaluate(EvaluationMethod.DIGAMMA, 1, 0));

        EngineConfig reject = EngineConfig.builder().digammaEmptyPolicy(DigammaEmptyPolicy.REJECT).build();
        DecisionFrame strict = threeSure(reject);
        DecaException e = assertThrows(DecaException.class,
                () -> strict.evaluate(EvaluationMethod.DIGAMMA, 1, 0));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void secondAlternative_onlyWhereMethodTakesOne() {
        DecisionFrame frame = threeSure(EngineConfig.DEFAULT);
        assertEquals(ErrorKind.INPUT_ERROR, assertThrows(DecaException.class,
                () -> frame.evaluate(EvaluationMethod.PSI, 1, 2)).getKind());
        assertEquals(ErrorKind.INPUT_ERROR, assertThrows(DecaException.class,
                () -> frame.evaluate(EvaluationMethod.DELTA, 1, 1)).getKind());
        assertEquals(ErrorKind.INPUT_ERROR, assertThrows(DecaException.class,
                () -> frame.evaluate(EvaluationMethod.DELTA, 1)).getKind());
        assertEquals(ErrorKind.INPUT_ERROR, assertThrows(DecaException.class,
                () -> frame.evaluate(EvaluationMethod.OMEGA, 4)).getKind());
        assertResult(-0.3, -0.3, -0.3, frame.evaluate(EvaluationMethod.DELTA, 1, 2));
    }
}
