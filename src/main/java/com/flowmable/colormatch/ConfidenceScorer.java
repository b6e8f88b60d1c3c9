package com.flowmable.colormatch;

/**
 * Scores calibration confidence from an external chart quality score (when one exists), the
 * recovery configuration and the environmental risk tier.
 */
public class ConfidenceScorer {

    private final ConfidencePolicy policy;

    public ConfidenceScorer() {
        this(ConfidencePolicy.DEFAULT);
    }

    public ConfidenceScorer(ConfidencePolicy policy) {
        this.policy = InvalidConfigurationException.requireNonNull(policy, "confidence policy");
    }

    /**
     * @param qualityScore      chart-derived quality in [0, 100], or {@code null} when unavailable
     * @param recoveryAvailable whether the reference source supports recovery
     * @param recoveryEnabled   whether recovery is switched on
     * @param risk              environmental risk, or {@code null} when unknown
     */
    public Confidence score(Double qualityScore, boolean recoveryAvailable, boolean recoveryEnabled, RiskTier risk) {
        double base;
        if (qualityScore != null && Double.isFinite(qualityScore)) {
            base = qualityScore;
        } else if (recoveryAvailable) {
            base = recoveryEnabled ? policy.recoveryEnabledBase() : policy.recoveryDisabledBase();
        } else {
            base = policy.fallbackBase();
        }

        int score = (int) Math.round(ColorSpaceUtils.clamp(base - policy.penaltyFor(risk), 0, 100));
        return new Confidence(score, levelFor(score));
    }

    public ConfidenceLevel levelFor(int score) {
        if (score >= policy.highFloor()) return ConfidenceLevel.HIGH;
        if (score >= policy.midFloor()) return ConfidenceLevel.MID;
        return ConfidenceLevel.LOW;
    }
}
