package com.deca.engine.moments;

import com.deca.config.EngineConfig;
import com.deca.config.EngineLimits;
import com.deca.config.MeanSnapMode;
import com.deca.engine.base.ConstraintBase;
import com.deca.engine.probability.ProbabilityLoader;
import com.deca.engine.probability.ProbabilityState;
import com.deca.engine.value.ValueLoader;
import com.deca.engine.value.ValueState;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MomentCalculatorTest {

    private static final double TOL = 1e-9;

    @Test
    void valueMoments_symmetricTriangle_sameForAllSnapModes() {
        for (MeanSnapMode mode : MeanSnapMode.values()) {
            double[] m = new MomentCalculator(mode).valueMoments(0.0, 0.5, 1.0);
            assertEquals(1.0 / 24.0, m[0], TOL, mode.name());
            assertEquals(0.0, m[1], TOL, mode.name());
        }
    }

    @Test
    void valueMoments_skewedMean_dependsOnSnapMode() {
        double[] full = new MomentCalculator(MeanSnapMode.FULL).valueMoments(0.0, 0.9, 1.0);
        assertEquals(1.0 / 18.0, full[0], TOL);
        assertEquals(0.0, full[1], TOL);

        double[] half = new MomentCalculator(MeanSnapMode.HALF).valueMoments(0.0, 0.9, 1.0);
        assertEquals(1.4725 / 18.0, half[0], TOL);

        double[] none = new MomentCalculator(MeanSnapMode.NONE).valueMoments(0.0, 0.9, 1.0);
        assertEquals(2.19 / 18.0, none[0], TOL);
    }

    @Test
    void valueMoments_pointValue_hasNoSpread() {
        double[] m = new MomentCalculator(MeanSnapMode.HALF).valueMoments(0.3, 0.3, 0.3);
        assertEquals(0.0, m[0]);
        assertEquals(0.0, m[1]);
    }

    @Test
    void probabilityMoments_scaleWithWidthAndConcentration() {
        double[] p = MomentCalculator.probabilityMoments(0.0, 0.5, 1.0, 2.0);
        assertEquals(1.0 / 12.0, p[0], TOL);
        assertEquals(1.0 / 12.0, p[1], TOL);
        assertArrayEquals(new double[]{0.0, 0.0}, MomentCalculator.probabilityMoments(0.4, 0.4, 0.4, 1.0));
    }

    @Test
    void compute_unconstrainedPair_matchesClosedForm() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 1);
        ProbabilityState p = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(3));
        ValueState v = new ValueLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(3));
        MomentReport report = new MomentCalculator(MeanSnapMode.HALF).compute(t, p, v);

        Moments m = report.moments(1);
        assertEquals(0.5, m.getMean(), TOL);
        assertEquals(1.0 / 36.0, m.getVariance(), TOL);
        assertEquals(0.0, m.getThirdCentral(), TOL);
        assertEquals(Math.sqrt(1.0 / 12.0), report.probabilityDeviation(1, 1), TOL);
        assertEquals(Math.sqrt(1.0 / 24.0), report.valueDeviation(1, 2, false), TOL);

        // a single leaf gets all mass, so only the value spreads
        Moments single = report.moments(2);
        assertEquals(0.5, single.getMean(), TOL);
        assertEquals(1.0 / 24.0, single.getVariance(), TOL);
    }

    @Test
    void computeCriteria_suppliedLeafMoments_replaceValueLayer() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 1);
        ProbabilityState p = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(3));
        MomentReport report = new MomentCalculator(MeanSnapMode.HALF).computeCriteria(t, p, 0,
                new double[]{0.5, 0.5}, new double[]{1.0 / 24.0, 1.0 / 24.0}, new double[]{0.0, 0.0});
        assertEquals(0.5, report.moments(1).getMean(), TOL);
        assertEquals(1.0 / 36.0, report.moments(1).getVariance(), TOL);

        DecaException e = assertThrows(DecaException.class, () -> report.moments(2));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void computeCriteria_shortArrays_rejected() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 1);
        ProbabilityState p = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(3));
        DecaException e = assertThrows(DecaException.class, () -> new MomentCalculator(MeanSnapMode.HALF)
                .computeCriteria(t, p, 0, new double[]{0.5}, new double[]{0.1}, new double[]{0.0}));
        assertEquals(ErrorKind.INPUT_ERROR, e.getKind());
    }

    @Test
    void compute_intermediateValueDeviation_onlyOnRequest() {
        FrameTopology t = FrameTopology.tree(EngineLimits.DEFAULT, new int[]{4, 2},
                new int[][]{{0, 4, 3, 0, 0}, {0, 2, 0}},
                new int[][]{{0, 2, 0, 0, 0}, {0, 0, 0}});
        ProbabilityState p = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(6));
        ValueState v = new ValueLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(6));
        MomentReport report = new MomentCalculator(MeanSnapMode.HALF).compute(t, p, v);
        assertEquals(-1.0, report.valueDeviation(1, 1, false));
        assertTrue(report.valueDeviation(1, 1, true) > 0.0);
        assertEquals(0.5, report.moments(1).getMean(), TOL);
    }
}
