package com.flowmable.colormatch;

/**
 * One image of a batch. The pipeline owns {@code buffer} for the duration of the call.
 *
 * @param id     caller-supplied identifier, echoed in the result
 * @param buffer pixels to correct in place
 */
public record BatchItem(String id, PixelBuffer buffer) {

    public BatchItem {
        InvalidConfigurationException.requireNonNull(id, "image id");
    }
}
