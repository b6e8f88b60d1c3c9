package com.flowmable.colormatch;

/**
 * Per-channel mean and standard deviation of a pixel population in CIELAB.
 * <p>
 * Standard deviations are never exactly zero: a zero component is raised to {@link #STD_FLOOR}
 * so the transfer ratio {@code refStd / targetStd} stays finite. Non-finite values and negative
 * deviations are rejected.
 *
 * @param mean mean L*, a*, b*
 * @param std  standard deviation of L*, a*, b*
 */
public record LabStats(Lab mean, Lab std) {

    public static final double STD_FLOOR = 1e-6;

    public LabStats {
        InvalidConfigurationException.requireNonNull(mean, "mean");
        InvalidConfigurationException.requireNonNull(std, "std");
        if (!mean.isFinite() || !std.isFinite()) {
            throw new InvalidConfigurationException("Lab statistics must be finite, got mean " + mean + ", std " + std);
        }
        if (std.l() < 0.0 || std.a() < 0.0 || std.b() < 0.0) {
            throw new InvalidConfigurationException("Standard deviation must be >= 0, got: " + std);
        }
        std = new Lab(floor(std.l()), floor(std.a()), floor(std.b()));
    }

    private static double floor(double s) {
        return s == 0.0 ? STD_FLOOR : s;
    }
}
