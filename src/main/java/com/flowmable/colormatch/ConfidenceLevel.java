package com.flowmable.colormatch;

/**
 * Three-tier label for a calibration confidence score.
 */
public enum ConfidenceLevel {
    /** Score >= 70. */
    HIGH,
    /** Score 50–69. */
    MID,
    /** Score < 50. */
    LOW
}
