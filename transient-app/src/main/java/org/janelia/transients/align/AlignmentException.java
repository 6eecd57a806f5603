package org.janelia.transients.align;

import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.FailureCategory;

/**
 * Thrown when an image pair cannot be geometrically aligned,
 * either because the coordinate mapping is missing or invalid or because the footprints barely overlap.
 */
public class AlignmentException
        extends DataQualityException {

    public AlignmentException(final String message) {
        super(FailureCategory.ALIGNMENT, message);
    }
}
