package com.deca.engine.moments;

import com.deca.config.EngineConfig;
import com.deca.config.EngineLimits;
import com.deca.engine.base.ConstraintBase;
import com.deca.engine.base.Statement;
import com.deca.engine.probability.ProbabilityLoader;
import com.deca.engine.value.ValueLoader;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecurityLevelCalculatorTest {

    private static final double TOL = 1e-9;

    private static SecurityLevelCalculator calculator(ConstraintBase p) {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 1);
        ConstraintBase v = new ConstraintBase(3);
        v.append(new Statement(1, 1, 0.1, 0.2));
        v.append(new Statement(1, 2, 0.5, 0.9));
        v.append(new Statement(2, 1, 0.6, 0.7));
        return new SecurityLevelCalculator(t, new ProbabilityLoader(EngineConfig.DEFAULT).load(t, p),
                new ValueLoader(EngineConfig.DEFAULT).load(t, v));
    }

    @Test
    void compute_unconstrainedProbabilities_spanWholeRange() {
        SecurityLevels levels = calculator(new ConstraintBase(3)).compute(0.4);
        assertEquals(0.0, levels.strong(1), TOL);
        assertEquals(0.5, levels.marked(1), TOL);
        assertEquals(1.0, levels.weak(1), TOL);
        assertEquals(0.0, levels.strong(2), TOL);
        assertEquals(0.0, levels.weak(2), TOL);
        assertEquals(2, levels.alternativeCount());
    }

    @Test
    void compute_boundedProbability_narrowsLevels() {
        ConstraintBase p = new ConstraintBase(3);
        p.append(new Statement(1, 1, 0.3, 0.6));
        SecurityLevels levels = calculator(p).compute(0.4);
        assertEquals(0.3, levels.strong(1), TOL);
        assertEquals(0.45, levels.marked(1), TOL);
        assertEquals(0.6, levels.weak(1), TOL);
        assertEquals(0.4, levels.getThreshold());
    }

    @Test
    void compute_thresholdOutsideUnitInterval_rejected() {
        DecaException e = assertThrows(DecaException.class, () -> calculator(new ConstraintBase(3)).compute(1.5));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }
}
