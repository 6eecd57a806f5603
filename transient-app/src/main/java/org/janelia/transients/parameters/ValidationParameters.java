package org.janelia.transients.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for cross-matching tracks against an external catalog.
 */
public class ValidationParameters
        implements Serializable {

    @Parameter(
            names = "--matchRadiusArcsec",
            description = "Catalog entries within this separation (inclusive) of a track match it")
    public double matchRadiusArcsec = 2.0;

    @Parameter(
            names = "--maxLookupAttempts",
            description = "Number of times a failed catalog lookup is attempted before giving up")
    public int maxLookupAttempts = 3;

    @Parameter(
            names = "--lookupBackoffMillis",
            description = "Wait before the first lookup retry, doubled for each further retry")
    public long lookupBackoffMillis = 200;

    public ValidationParameters() {
    }

    public void validate()
            throws IllegalArgumentException {
        if (matchRadiusArcsec < 0) {
            throw new IllegalArgumentException("matchRadiusArcsec must not be negative");
        }
        if (maxLookupAttempts < 1) {
            throw new IllegalArgumentException("maxLookupAttempts must be at least 1");
        }
        if (lookupBackoffMillis < 0) {
            throw new IllegalArgumentException("lookupBackoffMillis must not be negative");
        }
    }
}
