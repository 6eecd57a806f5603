package org.janelia.transients.difference;

import java.io.Serializable;

/**
 * Estimates the noise variance of a single image pixel from its value.
 * Implementations are calibration dependent and must be pure functions of the pixel value.
 */
@FunctionalInterface
public interface NoiseModel
        extends Serializable {

    /**
     * @return estimated variance (ADU squared) of a pixel with the specified value.
     */
    double variance(final double pixelValue);

}
