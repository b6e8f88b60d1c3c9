package com.flowmable.colormatch;

/**
 * Constants of the confidence heuristic.
 *
 * @param recoveryEnabledBase  base score when recovery is available and enabled
 * @param recoveryDisabledBase base score when recovery is available but disabled
 * @param fallbackBase         base score with neither chart quality nor recovery
 * @param mediumRiskPenalty    subtracted for {@link RiskTier#MEDIUM}
 * @param highRiskPenalty      subtracted for {@link RiskTier#HIGH}
 * @param highFloor            minimum score labelled HIGH
 * @param midFloor             minimum score labelled MID
 */
public record ConfidencePolicy(
        int recoveryEnabledBase,
        int recoveryDisabledBase,
        int fallbackBase,
        int mediumRiskPenalty,
        int highRiskPenalty,
        int highFloor,
        int midFloor
) {
    public static final ConfidencePolicy DEFAULT = new ConfidencePolicy(
            55, // recoveryEnabledBase
            35, // recoveryDisabledBase
            40, // fallbackBase
            7,  // mediumRiskPenalty
            15, // highRiskPenalty
            70, // highFloor
            50  // midFloor
    );

    public ConfidencePolicy {
        if (midFloor > highFloor) {
            throw new InvalidConfigurationException("midFloor (" + midFloor + ") above highFloor (" + highFloor + ")");
        }
    }

    public int penaltyFor(RiskTier risk) {
        if (risk == null) return 0;
        return switch (risk) {
            case HIGH -> highRiskPenalty;
            case MEDIUM -> mediumRiskPenalty;
            case LOW -> 0;
        };
    }
}
