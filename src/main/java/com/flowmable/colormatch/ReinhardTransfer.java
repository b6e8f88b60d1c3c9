package com.flowmable.colormatch;

/**
 * Statistical (Reinhard-style) color transfer.
 * <p>
 * Each selected Lab channel of the target is re-centered and re-scaled so its mean and standard
 * deviation match the reference: {@code (x - targetMean) * (refStd / targetStd) + refMean}.
 * Only first and second moments are matched; no patch-level correction happens here.
 * <p>
 * Partial strength blends the fully transferred pixel with the original in RGB space, after the
 * Lab → RGB conversion.
 */
public final class ReinhardTransfer {

    private ReinhardTransfer() {}

    /**
     * Transfer every pixel of {@code buffer} in place.
     *
     * @param buffer         pixels to correct, mutated in place
     * @param referenceStats statistics to match
     * @param targetStats    statistics of {@code buffer} itself
     * @param strength       blend factor in [0, 1]
     * @param mode           channels to transfer
     * @return the same buffer, for chaining
     * @throws InvalidConfigurationException for a missing argument or a strength outside [0, 1]
     */
    public static PixelBuffer applyReinhardTransfer(PixelBuffer buffer,
                                                    LabStats referenceStats,
                                                    LabStats targetStats,
                                                    double strength,
                                                    TransferMode mode) {
        InvalidConfigurationException.requireNonNull(buffer, "pixel buffer");
        InvalidConfigurationException.requireNonNull(referenceStats, "reference statistics");
        InvalidConfigurationException.requireNonNull(targetStats, "target statistics");
        InvalidConfigurationException.requireNonNull(mode, "transfer mode");
        InvalidConfigurationException.requireStrength(strength, "Transfer strength");

        int n = buffer.pixelCount();
        for (int i = 0; i < n; i++) {
            int r = buffer.red(i);
            int g = buffer.green(i);
            int b = buffer.blue(i);

            Lab transferred = transferLab(ColorSpaceUtils.rgbToLab(r, g, b), referenceStats, targetStats, mode);
            Rgb rgb = ColorSpaceUtils.labToRgb(transferred);

            buffer.setRgb(i,
                    ColorSpaceUtils.blend(r, rgb.r(), strength),
                    ColorSpaceUtils.blend(g, rgb.g(), strength),
                    ColorSpaceUtils.blend(b, rgb.b(), strength));
        }
        return buffer;
    }

    /**
     * Transfer a single color and clamp it into the valid Lab range.
     */
    public static Lab transferLab(Lab lab, LabStats referenceStats, LabStats targetStats, TransferMode mode) {
        Lab refMean = referenceStats.mean();
        Lab refStd = referenceStats.std();
        Lab tgtMean = targetStats.mean();
        Lab tgtStd = targetStats.std();

        double L = lab.l();
        double a = lab.a();
        double b = lab.b();

        if (mode.transfersLuminance()) {
            L = (L - tgtMean.l()) * (refStd.l() / tgtStd.l()) + refMean.l();
        }
        if (mode.transfersChroma()) {
            a = (a - tgtMean.a()) * (refStd.a() / tgtStd.a()) + refMean.a();
            b = (b - tgtMean.b()) * (refStd.b() / tgtStd.b()) + refMean.b();
        }
        return ColorSpaceUtils.clampLab(new Lab(L, a, b));
    }
}
