package com.flowmable.colormatch;

import java.util.Random;

/**
 * Synthetic pixel buffers shared by the tests.
 */
final class TestBuffers {

    private TestBuffers() {}

    /** Solid opaque fill. */
    static PixelBuffer solid(int r, int g, int b) {
        return PixelBuffer.filled(64, 64, new Rgb(r, g, b));
    }

    /** Horizontal gradient from color A to color B. */
    static PixelBuffer gradient(int r1, int g1, int b1, int r2, int g2, int b2) {
        PixelBuffer buffer = PixelBuffer.filled(128, 32, new Rgb(0, 0, 0));
        for (int x = 0; x < 128; x++) {
            double t = x / 127.0;
            Rgb c = new Rgb(
                    (int) (r1 + t * (r2 - r1)),
                    (int) (g1 + t * (g2 - g1)),
                    (int) (b1 + t * (b2 - b1)));
            for (int y = 0; y < 32; y++) {
                buffer.setRgb(x, y, c);
            }
        }
        return buffer;
    }

    /** Top half color A, bottom half color B. */
    static PixelBuffer twoColorSplit(int r1, int g1, int b1, int r2, int g2, int b2) {
        PixelBuffer buffer = PixelBuffer.filled(32, 32, new Rgb(r1, g1, b1));
        for (int y = 16; y < 32; y++) {
            for (int x = 0; x < 32; x++) {
                buffer.setRgb(x, y, new Rgb(r2, g2, b2));
            }
        }
        return buffer;
    }

    /** Deterministic pseudo-random photo-like content with varying alpha. */
    static PixelBuffer noise(long seed) {
        Random random = new Random(seed);
        PixelBuffer buffer = PixelBuffer.allocate(48, 48);
        random.nextBytes(buffer.data());
        return buffer;
    }
}
