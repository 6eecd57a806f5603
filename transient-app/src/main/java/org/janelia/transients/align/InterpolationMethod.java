package org.janelia.transients.align;

/**
 * Methods for sampling reference pixels at non-integer positions.
 */
public enum InterpolationMethod {

    /** Use the closest source pixel. */
    NEAREST,

    /** Weighted mean of the (up to) four surrounding source pixels. */
    BILINEAR
}
