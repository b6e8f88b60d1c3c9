package com.flowmable.colormatch;

/**
 * A CIELAB color (D65).
 * <p>
 * Components are not range-checked: intermediate results of a transfer or shift may leave the
 * valid range and are brought back by {@link #clamp()} before conversion to RGB.
 *
 * @param l L* lightness, nominally [0, 100]
 * @param a a* green–red axis, nominally [-128, 127]
 * @param b b* blue–yellow axis, nominally [-128, 127]
 */
public record Lab(double l, double a, double b) {

    public static final Lab NEUTRAL_GRAY = new Lab(50.0, 0.0, 0.0);

    public Lab clamp() {
        return ColorSpaceUtils.clampLab(this);
    }

    public Lab plus(LabShift shift) {
        return new Lab(l + shift.deltaL(), a + shift.deltaA(), b + shift.deltaB());
    }

    public boolean isFinite() {
        return Double.isFinite(l) && Double.isFinite(a) && Double.isFinite(b);
    }
}
