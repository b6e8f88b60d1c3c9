package com.flowmable.colormatch;

/**
 * An 8-bit sRGB color.
 *
 * @param r Red channel (0–255)
 * @param g Green channel (0–255)
 * @param b Blue channel (0–255)
 */
public record Rgb(int r, int g, int b) {}
