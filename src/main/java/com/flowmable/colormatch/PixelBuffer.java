package com.flowmable.colormatch;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * A mutable width × height grid of RGBA byte quadruplets, row-major.
 * <p>
 * The core reads and writes the R, G and B bytes in place; alpha is never touched.
 * A buffer is owned by one pipeline call at a time and is not thread-safe.
 */
public final class PixelBuffer {

    private static final int CHANNELS = 4;

    private final int width;
    private final int height;
    private final byte[] rgba;

    /**
     * Wrap an existing RGBA array without copying it.
     *
     * @throws InvalidConfigurationException if the dimensions are negative or disagree with the array length
     */
    public PixelBuffer(int width, int height, byte[] rgba) {
        if (width < 0 || height < 0) {
            throw new InvalidConfigurationException("Negative buffer size: " + width + "x" + height);
        }
        InvalidConfigurationException.requireNonNull(rgba, "pixel data");
        if ((long) width * height * CHANNELS != rgba.length) {
            throw new InvalidConfigurationException("Pixel data length " + rgba.length
                    + " does not match " + width + "x" + height + " RGBA");
        }
        this.width = width;
        this.height = height;
        this.rgba = rgba;
    }

    /**
     * A fully transparent black buffer.
     *
     * @throws InvalidConfigurationException for negative sizes or more than {@link Integer#MAX_VALUE} bytes
     */
    public static PixelBuffer allocate(int width, int height) {
        if (width < 0 || height < 0) {
            throw new InvalidConfigurationException("Negative buffer size: " + width + "x" + height);
        }
        long length = (long) width * height * CHANNELS;
        if (length > Integer.MAX_VALUE) {
            throw new InvalidConfigurationException("Buffer " + width + "x" + height + " is too large for one RGBA array");
        }
        return new PixelBuffer(width, height, new byte[(int) length]);
    }

    /** An opaque buffer filled with a single color. */
    public static PixelBuffer filled(int width, int height, Rgb color) {
        PixelBuffer buffer = allocate(width, height);
        for (int i = 0; i < buffer.pixelCount(); i++) {
            buffer.setRgb(i, color.r(), color.g(), color.b());
            buffer.rgba[i * CHANNELS + 3] = (byte) 0xFF;
        }
        return buffer;
    }

    /**
     * Copy the pixels of an AWT image into a new buffer.
     */
    public static PixelBuffer fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        PixelBuffer buffer = allocate(w, h);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                int idx = (y * w + x) * CHANNELS;
                buffer.rgba[idx] = (byte) (argb >> 16);
                buffer.rgba[idx + 1] = (byte) (argb >> 8);
                buffer.rgba[idx + 2] = (byte) argb;
                buffer.rgba[idx + 3] = (byte) (argb >>> 24);
            }
        }
        return buffer;
    }

    /**
     * Render the buffer into a new {@code TYPE_INT_ARGB} image.
     */
    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(Math.max(1, width), Math.max(1, height), BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int idx = (y * width + x) * CHANNELS;
                int argb = (rgba[idx + 3] & 0xFF) << 24
                        | (rgba[idx] & 0xFF) << 16
                        | (rgba[idx + 1] & 0xFF) << 8
                        | (rgba[idx + 2] & 0xFF);
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public boolean isEmpty() {
        return pixelCount() == 0;
    }

    public int red(int pixel) {
        return rgba[pixel * CHANNELS] & 0xFF;
    }

    public int green(int pixel) {
        return rgba[pixel * CHANNELS + 1] & 0xFF;
    }

    public int blue(int pixel) {
        return rgba[pixel * CHANNELS + 2] & 0xFF;
    }

    public int alpha(int pixel) {
        return rgba[pixel * CHANNELS + 3] & 0xFF;
    }

    public Rgb rgb(int pixel) {
        return new Rgb(red(pixel), green(pixel), blue(pixel));
    }

    public Rgb rgb(int x, int y) {
        return rgb(y * width + x);
    }

    public Lab lab(int pixel) {
        return ColorSpaceUtils.rgbToLab(red(pixel), green(pixel), blue(pixel));
    }

    public void setRgb(int pixel, int r, int g, int b) {
        int idx = pixel * CHANNELS;
        rgba[idx] = (byte) r;
        rgba[idx + 1] = (byte) g;
        rgba[idx + 2] = (byte) b;
    }

    public void setRgb(int x, int y, Rgb color) {
        setRgb(y * width + x, color.r(), color.g(), color.b());
    }

    /** A deep copy with its own pixel array. */
    public PixelBuffer copy() {
        return new PixelBuffer(width, height, rgba.clone());
    }

    /**
     * Overwrite this buffer's pixels with those of a buffer of identical dimensions.
     */
    public void copyFrom(PixelBuffer other) {
        if (other.width != width || other.height != height) {
            throw new InvalidConfigurationException("Cannot copy " + other.width + "x" + other.height
                    + " pixels into a " + width + "x" + height + " buffer");
        }
        System.arraycopy(other.rgba, 0, rgba, 0, rgba.length);
    }

    /** Direct access to the backing array (RGBA, row-major). */
    public byte[] data() {
        return rgba;
    }

    public boolean samePixels(PixelBuffer other) {
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }
}
