package com.flowmable.colormatch;

/**
 * Base class for failures raised by the color matching core.
 */
public class ColorMatchException extends RuntimeException {

    public ColorMatchException(String message) {
        super(message);
    }
}
