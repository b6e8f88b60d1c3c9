package com.flowmable.colormatch;

/**
 * Result of correcting a single image.
 *
 * @param id            caller-supplied image identifier
 * @param status        SUCCEEDED or FAILED
 * @param preStats      statistics before any correction; null if the image failed before measuring
 * @param targetStats   statistics after recovery, used as the transfer's target; null on failure
 * @param recoveryShift applied recovery shift, or null when recovery did not run
 * @param spotShift     applied palette shift, or null when none was configured
 * @param error         failure description; null on success
 */
public record ImageCorrectionResult(
        String id,
        CorrectionStatus status,
        LabStats preStats,
        LabStats targetStats,
        LabShift recoveryShift,
        LabShift spotShift,
        String error
) {
    public static ImageCorrectionResult succeeded(String id, LabStats preStats, LabStats targetStats,
                                                  LabShift recoveryShift, LabShift spotShift) {
        return new ImageCorrectionResult(id, CorrectionStatus.SUCCEEDED, preStats, targetStats,
                recoveryShift, spotShift, null);
    }

    public static ImageCorrectionResult failed(String id, String error) {
        return new ImageCorrectionResult(id, CorrectionStatus.FAILED, null, null, null, null, error);
    }

    public boolean succeeded() {
        return status == CorrectionStatus.SUCCEEDED;
    }
}
