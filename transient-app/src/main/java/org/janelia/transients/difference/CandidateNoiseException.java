package org.janelia.transients.difference;

import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.FailureCategory;

/**
 * Thrown when the noise model produces a non-positive or non-finite estimate for a valid pixel.
 */
public class CandidateNoiseException
        extends DataQualityException {

    public CandidateNoiseException(final String message) {
        super(FailureCategory.NOISE, message);
    }
}
