package net.riseadvisor.util.image;

/**
 * Small numeric helpers shared by the analyzers and the aggregator.
 */
public final class QualityScoreMath {

    private QualityScoreMath() {
    }

    /** Clamps {@code value} into [0, 1]; NaN becomes 0. */
    public static double clampUnit(double value) {
        if (Double.isNaN(value) || value <= 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }

    /** Rounds half-up to two decimal places for reporting. */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
