package org.janelia.transients.align;

import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.FailureCategory;

/**
 * Thrown when the photometric scale for an image pair is implausible or cannot be estimated.
 * Pairs failing this way are flagged for manual review.
 */
public class PhotometricException
        extends DataQualityException {

    private final Double scale;

    public PhotometricException(final String message,
                                final Double scale) {
        super(FailureCategory.PHOTOMETRIC, message);
        this.scale = scale;
    }

    /**
     * @return the rejected scale factor, or null if no scale could be estimated.
     */
    public Double getScale() {
        return scale;
    }
}
