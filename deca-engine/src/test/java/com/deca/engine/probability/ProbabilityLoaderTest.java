package com.deca.engine.probability;

import com.deca.config.EngineConfig;
import com.deca.config.EngineLimits;
import com.deca.engine.base.ConstraintBase;
import com.deca.engine.base.Statement;
import com.deca.tree.FrameTopology;
import com.deca.tree.error.DecaException;
import com.deca.tree.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProbabilityLoaderTest {

    private static final double TOL = 1e-7;

    /** Alternative 1: node 1 intermediate over leaves 2 and 3, leaf 4. Alternative 2: two leaves. */
    private static FrameTopology mixed() {
        return FrameTopology.tree(EngineLimits.DEFAULT, new int[]{4, 2},
                new int[][]{{0, 4, 3, 0, 0}, {0, 2, 0}},
                new int[][]{{0, 2, 0, 0, 0}, {0, 0, 0}});
    }

    @Test
    void load_unconstrainedTree_splitsEvenlyPerLevel() {
        FrameTopology t = mixed();
        ProbabilityState s = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, new ConstraintBase(t.totalNodeCount()));
        assertArrayEquals(new double[]{0.5, 0.25, 0.25, 0.5, 0.5, 0.5}, s.massPoints(), TOL);
        assertArrayEquals(new double[]{0.5, 0.5, 0.5, 0.5, 0.5, 0.5}, s.localMassPoints(), TOL);
        assertEquals(0.0, s.hullLower(1), TOL);
        assertEquals(1.0, s.hullUpper(1), TOL);
    }

    @Test
    void load_constrainedTree_keepsLevelSumsAndHullBounds() {
        FrameTopology t = mixed();
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 1, 0.3, 0.6));
        base.append(new Statement(1, 2, 0.1, 0.5));
        base.append(new Statement(1, 4, 0.2, 0.9));
        base.append(new Statement(2, 1, 0.05, 0.3));
        ProbabilityState s = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, base);

        double[] mass = s.massPoints();
        assertEquals(1.0, mass[1] + mass[2] + mass[3], 1e-6);
        assertEquals(mass[0], mass[1] + mass[2], 1e-6);
        assertEquals(1.0, mass[4] + mass[5], 1e-6);
        for (int i = 0; i < t.totalNodeCount(); i++) {
            assertTrue(s.hullLower(i) <= mass[i] + 1e-8, "lower hull above mass at " + i);
            assertTrue(mass[i] <= s.hullUpper(i) + 1e-8, "mass above upper hull at " + i);
            assertTrue(s.boxLower(i) <= s.localHullLower(i) + 1e-8);
            assertTrue(s.localHullUpper(i) <= s.boxUpper(i) + 1e-8);
        }
        assertEquals(0.3, s.localHullLower(0), TOL);
        assertEquals(0.6, s.localHullUpper(0), TOL);
        assertEquals(0.4, s.localHullLower(3), TOL);
        assertEquals(0.7, s.localHullUpper(3), TOL);
    }

    @Test
    void load_collapsedSibling_warpsTowardCentroid() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 3, 1);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 3, 0.0, 0.2));

        ProbabilityState warped = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, base);
        assertEquals(0.4518519, warped.mass(0), 1e-6);
        assertEquals(0.4518519, warped.mass(1), 1e-6);
        assertEquals(0.0962963, warped.mass(2), 1e-6);

        EngineConfig plain = EngineConfig.builder().warpEnabled(false).build();
        ProbabilityState flat = new ProbabilityLoader(plain).load(t, base);
        assertEquals(1.0 / 2.2, flat.mass(0), 1e-6);
        assertEquals(0.2 / 2.2, flat.mass(2), 1e-6);
    }

    @Test
    void load_halfWarpWeight_blendsBothPoints() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 3, 1);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 3, 0.0, 0.2));
        EngineConfig half = EngineConfig.builder().warpWeight(0.5).build();
        ProbabilityState s = new ProbabilityLoader(half).load(t, base);
        assertEquals((0.0962963 + 0.2 / 2.2) / 2.0, s.mass(2), 1e-6);
    }

    /** First alternative with {@code siblings} leaves, the last pinned at 0.1 and the one before capped at 0.2. */
    private static ProbabilityState wideLevel(EngineConfig config, int siblings) {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, siblings, 2);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, siblings, 0.1, 0.1));
        base.append(new Statement(1, siblings - 1, 0.0, 0.2));
        return new ProbabilityLoader(config).load(t, base);
    }

    @Test
    void load_tenSiblings_warpFadedBetweenSoftAndHardDimension() {
        EngineConfig unfaded = EngineConfig.builder().warpSoftDimension(12).warpMaxDimension(12).build();
        EngineConfig plain = EngineConfig.builder().warpEnabled(false).build();
        ProbabilityState full = wideLevel(unfaded, 10);
        ProbabilityState none = wideLevel(plain, 10);
        ProbabilityState faded = wideLevel(EngineConfig.DEFAULT, 10);

        assertTrue(Math.abs(full.mass(8) - none.mass(8)) > 0.01);
        double factor = (12 + 1 - 10) / (double) (12 + 1 - 8);
        double sum = 0.0;
        for (int i = 0; i < 10; i++) {
            assertEquals(none.mass(i) + factor * (full.mass(i) - none.mass(i)), faded.mass(i), 1e-9);
            sum += faded.mass(i);
        }
        assertEquals(1.0, sum, 1e-6);
        assertEquals(0.1, faded.mass(9), TOL);
    }

    @Test
    void load_thirteenSiblings_warpSkippedAboveHardDimension() {
        EngineConfig plain = EngineConfig.builder().warpEnabled(false).build();
        ProbabilityState skipped = wideLevel(EngineConfig.DEFAULT, 13);
        ProbabilityState none = wideLevel(plain, 13);
        for (int i = 0; i < 13; i++) {
            assertEquals(none.mass(i), skipped.mass(i), 0.0);
        }
        assertEquals(0.2 * 0.9 / (11 * 0.9 + 0.2), skipped.mass(11), TOL);
    }

    @Test
    void load_pinnedLeaf_leavesRemainderToSibling() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 2);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 1, 0.7, 0.7));
        ProbabilityState s = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, base);
        assertEquals(0.7, s.mass(0), TOL);
        assertEquals(0.3, s.mass(1), TOL);
        assertEquals(0.3, s.hullLower(1), TOL);
        assertEquals(0.3, s.hullUpper(1), TOL);
    }

    @Test
    void load_lowerBoundsAboveOne_isInconsistent() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 2);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 1, 0.6, 1.0));
        base.append(new Statement(1, 2, 0.6, 1.0));
        DecaException e = assertThrows(DecaException.class,
                () -> new ProbabilityLoader(EngineConfig.DEFAULT).load(t, base));
        assertEquals(ErrorKind.INCONSISTENT, e.getKind());
    }

    @Test
    void load_midpointHint_fixesMassPoint() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 1);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.setMidpoint(0, 0.2, 0.2);
        ProbabilityState s = new ProbabilityLoader(EngineConfig.DEFAULT).load(t, base);
        assertEquals(0.2, s.mass(0), TOL);
        assertEquals(0.8, s.mass(1), TOL);
        assertEquals(1.0, s.mass(2), TOL);
    }

    @Test
    void load_midpointOutsideHull_isInconsistent() {
        FrameTopology t = FrameTopology.flat(EngineLimits.DEFAULT, 2, 1);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 1, 0.5, 0.6));
        base.setMidpoint(0, 0.1, 0.1);
        DecaException e = assertThrows(DecaException.class,
                () -> new ProbabilityLoader(EngineConfig.DEFAULT).load(t, base));
        assertEquals(ErrorKind.INCONSISTENT, e.getKind());
    }

    @Test
    void load_narrowStatement_rejectedWhenMinimumWidthSet() {
        EngineLimits limits = new EngineLimits(100, 1022, 512, 920, 301, 0.1);
        EngineConfig config = EngineConfig.builder().limits(limits).build();
        FrameTopology t = FrameTopology.flat(limits, 2, 2);
        ConstraintBase base = new ConstraintBase(t.totalNodeCount());
        base.append(new Statement(1, 1, 0.3, 0.35));
        DecaException e = assertThrows(DecaException.class, () -> new ProbabilityLoader(config).load(t, base));
        assertEquals(ErrorKind.TOO_NARROW_STMT, e.getKind());
    }
}
