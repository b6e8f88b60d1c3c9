package com.flowmable.colormatch;

/**
 * A fixed additive offset in CIELAB, applied uniformly to every pixel.
 *
 * @param deltaL ΔL*
 * @param deltaA Δa*
 * @param deltaB Δb*
 */
public record LabShift(double deltaL, double deltaA, double deltaB) {

    public static final LabShift ZERO = new LabShift(0.0, 0.0, 0.0);

    /** {@code target - measured}, component-wise. */
    public static LabShift between(Lab measured, Lab target) {
        return new LabShift(target.l() - measured.l(), target.a() - measured.a(), target.b() - measured.b());
    }

    public boolean isFinite() {
        return Double.isFinite(deltaL) && Double.isFinite(deltaA) && Double.isFinite(deltaB);
    }

    /** True for a shift that leaves every pixel unchanged. {@code null} counts as zero too. */
    public static boolean isZero(LabShift shift) {
        return shift == null || (shift.deltaL == 0.0 && shift.deltaA == 0.0 && shift.deltaB == 0.0);
    }
}
