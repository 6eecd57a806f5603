package org.janelia.transients.spec;

/**
 * Bit values for per-pixel quality and validity flags.
 * A pixel is valid only when its flag value is zero.
 */
public class PixelFlags {

    public static final int VALID = 0;

    /** Flagged by an external quality mask (bad column, hot pixel, ...). */
    public static final int MASKED = 1;

    public static final int SATURATED = 1 << 1;

    /** Outside the area covered by the other image of a pair. */
    public static final int OUT_OF_FOOTPRINT = 1 << 2;

    /** NaN or infinite pixel value, or non-finite noise estimate. */
    public static final int NON_FINITE = 1 << 3;

    public static boolean isValid(final int flags) {
        return flags == VALID;
    }

    private PixelFlags() {
    }
}
