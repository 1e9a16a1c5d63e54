package com.deca.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Engine configuration, optionally loaded from environment variables.
 * <p>
 * Limits: DECA_MAX_ALTS, DECA_MAX_NODES_PER_ALT, DECA_MAX_LEAVES_PER_ALT, DECA_MAX_LEAVES,
 * DECA_MAX_STMTS, DECA_MIN_STMT_WIDTH.
 * <p>
 * Mass point warp: DECA_WARP_ENABLED, DECA_WARP_SOFT_DIM, DECA_WARP_MAX_DIM, DECA_WARP_WEIGHT.
 * <p>
 * Evaluation: DECA_DIGAMMA_EMPTY ({@link DigammaEmptyPolicy}), DECA_MEAN_SNAP ({@link MeanSnapMode}).
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    private static final String ENV_MAX_ALTS = "DECA_MAX_ALTS";
    private static final String ENV_MAX_NODES_PER_ALT = "DECA_MAX_NODES_PER_ALT";
    private static final String ENV_MAX_LEAVES_PER_ALT = "DECA_MAX_LEAVES_PER_ALT";
    private static final String ENV_MAX_LEAVES = "DECA_MAX_LEAVES";
    private static final String ENV_MAX_STMTS = "DECA_MAX_STMTS";
    private static final String ENV_MIN_STMT_WIDTH = "DECA_MIN_STMT_WIDTH";
    private static final String ENV_WARP_ENABLED = "DECA_WARP_ENABLED";
    private static final String ENV_WARP_SOFT_DIM = "DECA_WARP_SOFT_DIM";
    private static final String ENV_WARP_MAX_DIM = "DECA_WARP_MAX_DIM";
    private static final String ENV_WARP_WEIGHT = "DECA_WARP_WEIGHT";
    private static final String ENV_DIGAMMA_EMPTY = "DECA_DIGAMMA_EMPTY";
    private static final String ENV_MEAN_SNAP = "DECA_MEAN_SNAP";

    private static final int DEFAULT_WARP_SOFT_DIM = 8;
    private static final int DEFAULT_WARP_MAX_DIM = 12;
    /** Upper bound on the hard cutoff; corner enumeration is 2^(maxDim-1). */
    private static final int WARP_MAX_DIM_CEILING = 20;
    private static final double DEFAULT_WARP_WEIGHT = 1.0;

    /** Configuration with all defaults. */
    public static final EngineConfig DEFAULT = builder().build();

    private final EngineLimits limits;
    private final boolean warpEnabled;
    private final int warpSoftDimension;
    private final int warpMaxDimension;
    private final double warpWeight;
    private final DigammaEmptyPolicy digammaEmptyPolicy;
    private final MeanSnapMode meanSnapMode;

    private EngineConfig(Builder b) {
        this.limits = b.limits;
        this.warpEnabled = b.warpEnabled;
        if (b.warpSoftDimension < 2) {
            throw new IllegalArgumentException("warpSoftDimension must be at least 2, got: " + b.warpSoftDimension);
        }
        if (b.warpMaxDimension < b.warpSoftDimension || b.warpMaxDimension > WARP_MAX_DIM_CEILING) {
            throw new IllegalArgumentException("warpMaxDimension must be in [" + b.warpSoftDimension + ","
                    + WARP_MAX_DIM_CEILING + "], got: " + b.warpMaxDimension);
        }
        if (!(b.warpWeight >= 0.0 && b.warpWeight <= 1.0)) {
            throw new IllegalArgumentException("warpWeight must be in [0,1], got: " + b.warpWeight);
        }
        this.warpSoftDimension = b.warpSoftDimension;
        this.warpMaxDimension = b.warpMaxDimension;
        this.warpWeight = b.warpWeight;
        this.digammaEmptyPolicy = b.digammaEmptyPolicy;
        this.meanSnapMode = b.meanSnapMode;
    }

    public EngineLimits getLimits() {
        return limits;
    }

    /** Whether the warp correction is applied on top of the degrees-of-freedom mass point. Default true. */
    public boolean isWarpEnabled() {
        return warpEnabled;
    }

    /** Sibling count up to which the warp correction is applied at full strength. Default 8. */
    public int getWarpSoftDimension() {
        return warpSoftDimension;
    }

    /** Sibling count above which the warp correction is skipped. Default 12. */
    public int getWarpMaxDimension() {
        return warpMaxDimension;
    }

    /** Extra multiplier on the warp blend factor (1 = full, 0.5 = half). Default 1. */
    public double getWarpWeight() {
        return warpWeight;
    }

    public DigammaEmptyPolicy getDigammaEmptyPolicy() {
        return digammaEmptyPolicy;
    }

    public MeanSnapMode getMeanSnapMode() {
        return meanSnapMode;
    }

    public static EngineConfig fromEnvironment() {
        EngineLimits d = EngineLimits.DEFAULT;
        EngineLimits limits = new EngineLimits(
                parseInt(ENV_MAX_ALTS, d.getMaxAlternatives()),
                parseInt(ENV_MAX_NODES_PER_ALT, d.getMaxNodesPerAlternative()),
                parseInt(ENV_MAX_LEAVES_PER_ALT, d.getMaxLeavesPerAlternative()),
                parseInt(ENV_MAX_LEAVES, d.getMaxLeaves()),
                parseInt(ENV_MAX_STMTS, d.getMaxStatements()),
                parseDouble(ENV_MIN_STMT_WIDTH, d.getMinStatementWidth()));
        return builder()
                .limits(limits)
                .warpEnabled(parseBoolean(System.getenv(ENV_WARP_ENABLED), true))
                .warpSoftDimension(parseInt(ENV_WARP_SOFT_DIM, DEFAULT_WARP_SOFT_DIM))
                .warpMaxDimension(parseInt(ENV_WARP_MAX_DIM, DEFAULT_WARP_MAX_DIM))
                .warpWeight(parseDouble(ENV_WARP_WEIGHT, DEFAULT_WARP_WEIGHT))
                .digammaEmptyPolicy(parseEnum(ENV_DIGAMMA_EMPTY, DigammaEmptyPolicy.class, DigammaEmptyPolicy.DEGRADE_TO_PSI))
                .meanSnapMode(parseEnum(ENV_MEAN_SNAP, MeanSnapMode.class, MeanSnapMode.HALF))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid integer | env={} | value={} | default={}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDouble(String key, double defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid number | env={} | value={} | default={}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static <E extends Enum<E>> E parseEnum(String key, Class<E> type, E defaultValue) {
        return parseEnum(System.getenv(key), type, defaultValue, key);
    }

    static <E extends Enum<E>> E parseEnum(String value, Class<E> type, E defaultValue, String key) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid {} | env={} | value={} | default={}", type.getSimpleName(), key, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" + limits + ", warp=" + warpEnabled + "(" + warpSoftDimension + "/" + warpMaxDimension
                + ", weight=" + warpWeight + "), digammaEmpty=" + digammaEmptyPolicy + ", meanSnap=" + meanSnapMode + "}";
    }

    public static final class Builder {
        private EngineLimits limits = EngineLimits.DEFAULT;
        private boolean warpEnabled = true;
        private int warpSoftDimension = DEFAULT_WARP_SOFT_DIM;
        private int warpMaxDimension = DEFAULT_WARP_MAX_DIM;
        private double warpWeight = DEFAULT_WARP_WEIGHT;
        private DigammaEmptyPolicy digammaEmptyPolicy = DigammaEmptyPolicy.DEGRADE_TO_PSI;
        private MeanSnapMode meanSnapMode = MeanSnapMode.HALF;

        public Builder limits(EngineLimits limits) {
            this.limits = Objects.requireNonNull(limits, "limits");
            return this;
        }

        public Builder warpEnabled(boolean warpEnabled) {
            this.warpEnabled = warpEnabled;
            return this;
        }

        public Builder warpSoftDimension(int warpSoftDimension) {
            this.warpSoftDimension = warpSoftDimension;
            return this;
        }

        public Builder warpMaxDimension(int warpMaxDimension) {
            this.warpMaxDimension = warpMaxDimension;
            return this;
        }

        public Builder warpWeight(double warpWeight) {
            this.warpWeight = warpWeight;
            return this;
        }

        public Builder digammaEmptyPolicy(DigammaEmptyPolicy digammaEmptyPolicy) {
            this.digammaEmptyPolicy = Objects.requireNonNull(digammaEmptyPolicy, "digammaEmptyPolicy");
            return this;
        }

        public Builder meanSnapMode(MeanSnapMode meanSnapMode) {
            this.meanSnapMode = Objects.requireNonNull(meanSnapMode, "meanSnapMode");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
