package com.edge.merger.core.merge;

/**
 * 重试时放宽比值检验阈值：t × factor，上限 cap，且不低于原阈值
 */
public class FallbackPolicy {

    public static final double DEFAULT_RELAX_FACTOR = 1.3;
    public static final double DEFAULT_RELAX_CAP = 0.9;

    private final double relaxFactor;
    private final double relaxCap;

    public FallbackPolicy() {
        this(DEFAULT_RELAX_FACTOR, DEFAULT_RELAX_CAP);
    }

    public FallbackPolicy(double relaxFactor, double relaxCap) {
        if (relaxFactor < 1.0) {
            throw new IllegalArgumentException("Relax factor must be >= 1, got " + relaxFactor);
        }
        if (relaxCap <= 0 || relaxCap >= 1) {
            throw new IllegalArgumentException("Relax cap must be in (0,1), got " + relaxCap);
        }
        this.relaxFactor = relaxFactor;
        this.relaxCap = relaxCap;
    }

    public double relax(double threshold) {
        return Math.max(threshold, Math.min(threshold * relaxFactor, relaxCap));
    }

    public double getRelaxFactor() {
        return relaxFactor;
    }

    public double getRelaxCap() {
        return relaxCap;
    }
}
