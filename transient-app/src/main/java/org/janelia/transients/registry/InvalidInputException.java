package org.janelia.transients.registry;

import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.FailureCategory;

/**
 * Missing or corrupt image data or metadata for one image pair.
 */
public class InvalidInputException
        extends DataQualityException {

    public InvalidInputException(final String message) {
        super(FailureCategory.INPUT, message);
    }

    public InvalidInputException(final String message,
                                 final Throwable cause) {
        super(FailureCategory.INPUT, message, cause);
    }
}
