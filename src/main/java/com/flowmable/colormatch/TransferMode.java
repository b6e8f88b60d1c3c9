package com.flowmable.colormatch;

/**
 * Selects which Lab channels a statistical transfer rewrites.
 */
public enum TransferMode {
    /** L*, a* and b*. */
    FULL(true, true),
    /** L* only. */
    LUMINANCE(true, false),
    /** a* and b* only. */
    CHROMATIC(false, true);

    private final boolean luminance;
    private final boolean chroma;

    TransferMode(boolean luminance, boolean chroma) {
        this.luminance = luminance;
        this.chroma = chroma;
    }

    public boolean transfersLuminance() {
        return luminance;
    }

    public boolean transfersChroma() {
        return chroma;
    }
}
