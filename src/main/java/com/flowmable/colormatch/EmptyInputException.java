package com.flowmable.colormatch;

/**
 * Raised when statistics are requested over a buffer with no pixels.
 */
public class EmptyInputException extends ColorMatchException {

    public EmptyInputException(String message) {
        super(message);
    }
}
