package com.flowmable.colormatch;

/**
 * Fixed Lab-space shifts: applying them to a buffer, and deriving them for recovery and for
 * spot/palette matching.
 */
public final class LabShifter {

    private LabShifter() {}

    /**
     * Result of running recovery on one buffer.
     *
     * @param preStats statistics of the buffer before recovery
     * @param shift    the applied shift, or {@code null} when recovery did not run
     */
    public record RecoveryOutcome(LabStats preStats, LabShift shift) {

        public boolean applied() {
            return shift != null;
        }
    }

    /**
     * Add {@code shift} to every pixel in Lab, clamp, convert back and blend by {@code strength}.
     * A {@code null} or all-zero shift leaves the buffer byte-identical.
     *
     * @return the same buffer, for chaining
     * @throws InvalidConfigurationException for a strength outside [0, 1] or a non-finite shift
     */
    public static PixelBuffer applyLabShift(PixelBuffer buffer, LabShift shift, double strength) {
        InvalidConfigurationException.requireNonNull(buffer, "pixel buffer");
        InvalidConfigurationException.requireStrength(strength, "Shift strength");
        InvalidConfigurationException.requireFinite(shift, "Lab shift");
        if (LabShift.isZero(shift)) {
            return buffer;
        }

        int n = buffer.pixelCount();
        for (int i = 0; i < n; i++) {
            int r = buffer.red(i);
            int g = buffer.green(i);
            int b = buffer.blue(i);

            Lab shifted = ColorSpaceUtils.rgbToLab(r, g, b).plus(shift).clamp();
            Rgb rgb = ColorSpaceUtils.labToRgb(shifted);

            buffer.setRgb(i,
                    ColorSpaceUtils.blend(r, rgb.r(), strength),
                    ColorSpaceUtils.blend(g, rgb.g(), strength),
                    ColorSpaceUtils.blend(b, rgb.b(), strength));
        }
        return buffer;
    }

    /**
     * Shift that moves the measured mean onto {@code target}. Exposure (L*) and white balance
     * (a*, b*) are independent; a disabled axis contributes 0.
     */
    public static LabShift computeRecoveryShift(LabStats stats, Lab target,
                                                boolean autoExposure, boolean autoWhiteBalance) {
        Lab mean = stats.mean();
        double dL = autoExposure ? target.l() - mean.l() : 0.0;
        double dA = autoWhiteBalance ? target.a() - mean.a() : 0.0;
        double dB = autoWhiteBalance ? target.b() - mean.b() : 0.0;
        return new LabShift(dL, dA, dB);
    }

    /**
     * Measure {@code buffer} and, when recovery is enabled, shift it towards the recovery target.
     *
     * @param sampleStep stride for the pre-recovery statistics
     */
    public static RecoveryOutcome applyRecovery(PixelBuffer buffer, RecoverySettings settings, int sampleStep) {
        LabStats stats = LabStatistics.computeLabStats(buffer, sampleStep);
        if (!settings.enabled()) {
            return new RecoveryOutcome(stats, null);
        }
        LabShift shift = computeRecoveryShift(stats, settings.target(),
                settings.autoExposure(), settings.autoWhiteBalance());
        applyLabShift(buffer, shift, settings.strength());
        return new RecoveryOutcome(stats, shift);
    }

    /** Palette shift: {@code target - measured}. */
    public static LabShift spotShift(Lab target, Lab measured) {
        return LabShift.between(measured, target);
    }

    /**
     * Palette shift against the full-resolution mean of a sample image.
     *
     * @throws EmptyInputException if the sample has no pixels
     */
    public static LabShift spotShiftFromSample(Lab target, PixelBuffer sample) {
        return spotShift(target, LabStatistics.meanLab(sample));
    }

    /**
     * Palette shift against the average of a patch around a picked point, default radius.
     */
    public static LabShift spotShiftFromPatch(Lab target, PixelBuffer sample, int x, int y) {
        return spotShiftFromPatch(target, sample, x, y, LabStatistics.DEFAULT_PATCH_RADIUS);
    }

    public static LabShift spotShiftFromPatch(Lab target, PixelBuffer sample, int x, int y, int radius) {
        return spotShift(target, LabStatistics.averagePatch(sample, x, y, radius));
    }
}
