package com.flowmable.colormatch;

/**
 * Outcome of one image's pipeline.
 */
public enum CorrectionStatus {
    SUCCEEDED,
    FAILED
}
