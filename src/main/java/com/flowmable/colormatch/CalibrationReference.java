package com.flowmable.colormatch;

/**
 * The statistics a batch is matched against, and where they came from.
 *
 * @param stats        reference Lab statistics
 * @param source       origin of the statistics
 * @param qualityScore chart-derived quality in [0, 100]; {@code null} for a reference image
 */
public record CalibrationReference(LabStats stats, Source source, Double qualityScore) {

    public enum Source {
        /** A photograph chosen by the user as the look to match. */
        REFERENCE_IMAGE,
        /** Statistics produced by an external chart analysis. */
        CHART
    }

    public CalibrationReference {
        InvalidConfigurationException.requireNonNull(stats, "reference statistics");
        InvalidConfigurationException.requireNonNull(source, "reference source");
        if (qualityScore != null && !(qualityScore >= 0.0 && qualityScore <= 100.0)) {
            throw new InvalidConfigurationException("Chart quality score must be within [0, 100], got: " + qualityScore);
        }
    }

    /**
     * Measure a reference image. The image goes through the same recovery as the images to be
     * corrected, on a private copy; {@code image} itself is left untouched.
     *
     * @throws EmptyInputException if the image has no pixels
     */
    public static CalibrationReference fromReferenceImage(PixelBuffer image, CorrectionSettings settings) {
        PixelBuffer work = image.copy();
        LabShifter.applyRecovery(work, settings.recovery(), settings.analysisSampleStep());
        LabStats stats = LabStatistics.computeLabStats(work, settings.analysisSampleStep());
        return new CalibrationReference(stats, Source.REFERENCE_IMAGE, null);
    }

    public static CalibrationReference fromChart(LabStats stats, Double qualityScore) {
        return new CalibrationReference(stats, Source.CHART, qualityScore);
    }

    /** Recovery only makes sense when matching against another photograph. */
    public boolean recoveryAvailable() {
        return source == Source.REFERENCE_IMAGE;
    }
}
