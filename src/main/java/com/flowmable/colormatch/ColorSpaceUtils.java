package com.flowmable.colormatch;

/**
 * Color space conversion utilities.
 * <p>
 * Provides sRGB ⇄ CIELAB conversion (D65 illuminant) together with the Lab gamut clamp and the
 * RGB blend used when writing corrected pixels back. Conversions are pure and never fail;
 * {@code labToRgb(rgbToLab(c))} reproduces every 8-bit color within ±1 per channel.
 */
public final class ColorSpaceUtils {

    private ColorSpaceUtils() {}

    // D65 white point
    private static final double XN = 0.95047;
    private static final double YN = 1.00000;
    private static final double ZN = 1.08883;

    private static final double PIVOT_EPSILON = 0.008856;
    private static final double PIVOT_SLOPE = 7.787;
    private static final double PIVOT_OFFSET = 16.0 / 116.0;

    public static final double L_MIN = 0.0;
    public static final double L_MAX = 100.0;
    public static final double AB_MIN = -128.0;
    public static final double AB_MAX = 127.0;

    /**
     * Convert sRGB (0–255 per channel) to CIELAB.
     */
    public static Lab rgbToLab(int r, int g, int b) {
        // 1. sRGB → linear RGB
        double rl = gammaExpand(r / 255.0);
        double gl = gammaExpand(g / 255.0);
        double bl = gammaExpand(b / 255.0);

        // 2. Linear RGB → XYZ (D65 illuminant)
        double x = 0.4124564 * rl + 0.3575761 * gl + 0.1804375 * bl;
        double y = 0.2126729 * rl + 0.7151522 * gl + 0.0721750 * bl;
        double z = 0.0193339 * rl + 0.1191920 * gl + 0.9503041 * bl;

        // 3. XYZ → Lab
        double fx = labF(x / XN);
        double fy = labF(y / YN);
        double fz = labF(z / ZN);

        double L = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double bStar = 200.0 * (fy - fz);
        return new Lab(L, a, bStar);
    }

    /**
     * Convert CIELAB to sRGB, rounding and clamping each channel to [0, 255].
     * Out-of-gamut input is accepted; the clamp happens on the RGB side.
     */
    public static Rgb labToRgb(double L, double a, double bStar) {
        // 1. Lab → XYZ
        double fy = (L + 16.0) / 116.0;
        double fx = a / 500.0 + fy;
        double fz = fy - bStar / 200.0;

        double x = labFInverse(fx) * XN;
        double y = labFInverse(fy) * YN;
        double z = labFInverse(fz) * ZN;

        // 2. XYZ → linear RGB
        double rl = 3.2404542 * x - 1.5371385 * y - 0.4985314 * z;
        double gl = -0.9692660 * x + 1.8760108 * y + 0.0415560 * z;
        double bl = 0.0556434 * x - 0.2040259 * y + 1.0572252 * z;

        // 3. linear RGB → sRGB
        return new Rgb(
                toChannel(gammaCompress(rl)),
                toChannel(gammaCompress(gl)),
                toChannel(gammaCompress(bl))
        );
    }

    public static Rgb labToRgb(Lab lab) {
        return labToRgb(lab.l(), lab.a(), lab.b());
    }

    /**
     * Restrict a Lab color to L* ∈ [0, 100] and a*, b* ∈ [-128, 127].
     */
    public static Lab clampLab(Lab lab) {
        return new Lab(
                clamp(lab.l(), L_MIN, L_MAX),
                clamp(lab.a(), AB_MIN, AB_MAX),
                clamp(lab.b(), AB_MIN, AB_MAX)
        );
    }

    /**
     * Linear blend of one 8-bit channel: {@code round(base + (target - base) * amount)}.
     */
    public static int blend(int base, int target, double amount) {
        return (int) Math.round(base + (target - base) * amount);
    }

    static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }

    private static int toChannel(double c) {
        return (int) clamp(Math.round(c * 255.0), 0, 255);
    }

    private static double gammaExpand(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static double gammaCompress(double c) {
        return c <= 0.0031308 ? 12.92 * c : 1.055 * Math.pow(c, 1.0 / 2.4) - 0.055;
    }

    private static double labF(double t) {
        return t > PIVOT_EPSILON ? Math.cbrt(t) : PIVOT_SLOPE * t + PIVOT_OFFSET;
    }

    private static double labFInverse(double t) {
        double cube = t * t * t;
        return cube > PIVOT_EPSILON ? cube : (t - PIVOT_OFFSET) / PIVOT_SLOPE;
    }
}
