package com.flowmable.colormatch;

/**
 * Per-batch correction configuration.
 *
 * @param mode               Lab channels touched by the transfer
 * @param strength           blend factor of the transfer and the spot shift, in [0, 1]
 * @param recovery           recovery configuration (only used when the reference supports it)
 * @param spotShift          palette shift applied last, or {@code null} for none
 * @param analysisSampleStep pixel stride used for per-image statistics
 */
public record CorrectionSettings(
        TransferMode mode,
        double strength,
        RecoverySettings recovery,
        LabShift spotShift,
        int analysisSampleStep
) {
    public static final int DEFAULT_SAMPLE_STEP = 2;

    public static final CorrectionSettings DEFAULT = new CorrectionSettings(
            TransferMode.FULL,
            1.0,
            RecoverySettings.DEFAULT,
            null,
            DEFAULT_SAMPLE_STEP
    );

    public CorrectionSettings {
        InvalidConfigurationException.requireNonNull(mode, "transfer mode");
        InvalidConfigurationException.requireStrength(strength, "Transfer strength");
        InvalidConfigurationException.requireNonNull(recovery, "recovery settings");
        InvalidConfigurationException.requireFinite(spotShift, "Spot shift");
        if (analysisSampleStep < 1) {
            throw new InvalidConfigurationException("Analysis sample step must be >= 1, got: " + analysisSampleStep);
        }
    }

    public CorrectionSettings withMode(TransferMode newMode) {
        return new CorrectionSettings(newMode, strength, recovery, spotShift, analysisSampleStep);
    }

    public CorrectionSettings withStrength(double newStrength) {
        return new CorrectionSettings(mode, newStrength, recovery, spotShift, analysisSampleStep);
    }

    public CorrectionSettings withRecovery(RecoverySettings newRecovery) {
        return new CorrectionSettings(mode, strength, newRecovery, spotShift, analysisSampleStep);
    }

    public CorrectionSettings withSpotShift(LabShift newSpotShift) {
        return new CorrectionSettings(mode, strength, recovery, newSpotShift, analysisSampleStep);
    }

    public CorrectionSettings withAnalysisSampleStep(int newStep) {
        return new CorrectionSettings(mode, strength, recovery, spotShift, newStep);
    }

    public boolean hasSpotShift() {
        return !LabShift.isZero(spotShift);
    }
}
