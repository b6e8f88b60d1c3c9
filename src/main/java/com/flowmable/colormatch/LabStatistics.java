package com.flowmable.colormatch;

/**
 * Sampled Lab statistics over pixel buffers.
 * <p>
 * Large images are sampled rather than read at full resolution: {@link #computeLabStats}
 * visits every {@code sampleStep}-th pixel in row-major order.
 */
public final class LabStatistics {

    private LabStatistics() {}

    /** Neighborhood radius used when a single point is picked from a sample image. */
    public static final int DEFAULT_PATCH_RADIUS = 6;

    /**
     * Mean and standard deviation of L*, a*, b*.
     *
     * @param buffer     pixels to analyze (read only)
     * @param sampleStep pixel stride; values below 1 are treated as 1
     * @throws EmptyInputException if the buffer has no pixels
     */
    public static LabStats computeLabStats(PixelBuffer buffer, int sampleStep) {
        int n = buffer.pixelCount();
        if (n == 0) {
            throw new EmptyInputException("Cannot compute Lab statistics of an empty "
                    + buffer.width() + "x" + buffer.height() + " buffer");
        }
        int stride = Math.max(1, sampleStep);

        // Sums are taken relative to the first sample so a uniform buffer yields exactly zero variance
        Lab pivot = buffer.lab(0);
        int count = 0;
        double sumL = 0, sumA = 0, sumB = 0;
        double sumSqL = 0, sumSqA = 0, sumSqB = 0;
        for (int i = 0; i < n; i += stride) {
            Lab lab = buffer.lab(i);
            double dL = lab.l() - pivot.l();
            double dA = lab.a() - pivot.a();
            double dB = lab.b() - pivot.b();
            sumL += dL;
            sumA += dA;
            sumB += dB;
            sumSqL += dL * dL;
            sumSqA += dA * dA;
            sumSqB += dB * dB;
            count++;
        }

        double offL = sumL / count;
        double offA = sumA / count;
        double offB = sumB / count;

        // E[x²] - E[x]² can dip below zero by rounding
        double varL = Math.max(0.0, sumSqL / count - offL * offL);
        double varA = Math.max(0.0, sumSqA / count - offA * offA);
        double varB = Math.max(0.0, sumSqB / count - offB * offB);

        return new LabStats(
                new Lab(pivot.l() + offL, pivot.a() + offA, pivot.b() + offB),
                new Lab(Math.sqrt(varL), Math.sqrt(varA), Math.sqrt(varB))
        );
    }

    /**
     * Full-resolution mean Lab of a buffer.
     *
     * @throws EmptyInputException if the buffer has no pixels
     */
    public static Lab meanLab(PixelBuffer buffer) {
        return computeLabStats(buffer, 1).mean();
    }

    public static Lab averagePatch(PixelBuffer buffer, int x, int y) {
        return averagePatch(buffer, x, y, DEFAULT_PATCH_RADIUS);
    }

    /**
     * Mean Lab over the square {@code [x-radius, x+radius] × [y-radius, y+radius]},
     * clipped to the buffer bounds.
     *
     * @throws InvalidConfigurationException if the point lies outside the buffer or the radius is negative
     */
    public static Lab averagePatch(PixelBuffer buffer, int x, int y, int radius) {
        if (radius < 0) {
            throw new InvalidConfigurationException("Patch radius must be >= 0, got: " + radius);
        }
        if (x < 0 || y < 0 || x >= buffer.width() || y >= buffer.height()) {
            throw new InvalidConfigurationException("Picked point (" + x + ", " + y + ") is outside the "
                    + buffer.width() + "x" + buffer.height() + " buffer");
        }
        int minX = Math.max(0, x - radius);
        int maxX = Math.min(buffer.width() - 1, x + radius);
        int minY = Math.max(0, y - radius);
        int maxY = Math.min(buffer.height() - 1, y + radius);

        int count = 0;
        double sumL = 0, sumA = 0, sumB = 0;
        for (int yy = minY; yy <= maxY; yy++) {
            for (int xx = minX; xx <= maxX; xx++) {
                Lab lab = buffer.lab(yy * buffer.width() + xx);
                sumL += lab.l();
                sumA += lab.a();
                sumB += lab.b();
                count++;
            }
        }
        return new Lab(sumL / count, sumA / count, sumB / count);
    }
}
