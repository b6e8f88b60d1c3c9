package com.flowmable.colormatch;

/**
 * Summary of how much a batch's calibration can be trusted.
 *
 * @param score integer in [0, 100]
 * @param level label derived from the score
 */
public record Confidence(int score, ConfidenceLevel level) {

    public Confidence {
        if (score < 0 || score > 100) {
            throw new InvalidConfigurationException("Confidence score out of range: " + score);
        }
        InvalidConfigurationException.requireNonNull(level, "confidence level");
    }
}
