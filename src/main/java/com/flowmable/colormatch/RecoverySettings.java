package com.flowmable.colormatch;

/**
 * White-balance / exposure recovery applied to an image before transfer, when no trusted
 * calibration exists for it.
 *
 * @param enabled      master switch
 * @param autoExposure move mean L* to the target
 * @param autoWhiteBalance move mean a*, b* to the target
 * @param target       Lab the image mean is pulled towards
 * @param strength     blend factor of the recovery shift, in [0, 1]
 */
public record RecoverySettings(
        boolean enabled,
        boolean autoExposure,
        boolean autoWhiteBalance,
        Lab target,
        double strength
) {
    public static final RecoverySettings DEFAULT =
            new RecoverySettings(true, true, true, Lab.NEUTRAL_GRAY, 1.0);

    public static final RecoverySettings DISABLED =
            new RecoverySettings(false, true, true, Lab.NEUTRAL_GRAY, 1.0);

    public RecoverySettings {
        InvalidConfigurationException.requireNonNull(target, "recovery target");
        if (!target.isFinite()) {
            throw new InvalidConfigurationException("Recovery target must be finite, got: " + target);
        }
        InvalidConfigurationException.requireStrength(strength, "Recovery strength");
    }

    public RecoverySettings withTarget(Lab newTarget) {
        return new RecoverySettings(enabled, autoExposure, autoWhiteBalance, newTarget, strength);
    }

    public RecoverySettings withEnabled(boolean newEnabled) {
        return new RecoverySettings(newEnabled, autoExposure, autoWhiteBalance, target, strength);
    }

    public RecoverySettings withAxes(boolean newAutoExposure, boolean newAutoWhiteBalance) {
        return new RecoverySettings(enabled, newAutoExposure, newAutoWhiteBalance, target, strength);
    }

    public RecoverySettings withStrength(double newStrength) {
        return new RecoverySettings(enabled, autoExposure, autoWhiteBalance, target, newStrength);
    }

    /** Human-readable step label, e.g. {@code "Recovery Auto WB + Auto Exposure"}. */
    public String describe() {
        StringBuilder parts = new StringBuilder();
        if (autoWhiteBalance) parts.append("Auto WB");
        if (autoExposure) {
            if (parts.length() > 0) parts.append(" + ");
            parts.append("Auto Exposure");
        }
        return "Recovery " + (parts.length() > 0 ? parts : "On");
    }
}
