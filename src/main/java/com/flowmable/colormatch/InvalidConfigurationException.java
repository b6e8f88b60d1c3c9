package com.flowmable.colormatch;

/**
 * Raised for configuration values outside their valid domain (strength, stride, patch radius...).
 * Always thrown before any pixel is modified.
 */
public class InvalidConfigurationException extends ColorMatchException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    static double requireStrength(double strength, String what) {
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new InvalidConfigurationException(what + " must be within [0, 1], got: " + strength);
        }
        return strength;
    }

    static LabShift requireFinite(LabShift shift, String what) {
        if (shift != null && !shift.isFinite()) {
            throw new InvalidConfigurationException(what + " must be finite, got: " + shift);
        }
        return shift;
    }

    static <T> T requireNonNull(T value, String what) {
        if (value == null) {
            throw new InvalidConfigurationException(what + " is required");
        }
        return value;
    }
}
