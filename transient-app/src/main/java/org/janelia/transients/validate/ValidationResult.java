package org.janelia.transients.validate;

import java.io.Serializable;

/**
 * Cross-match result for one track.
 */
public class ValidationResult
        implements Serializable {

    private final String trackId;
    private final ValidationOutcome outcome;
    private final String matchedEntryId;
    private final Double matchSeparationArcsec;
    private final int lookupAttempts;
    private final String message;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ValidationResult() {
        this(null, null, null, null, 0, null);
    }

    public ValidationResult(final String trackId,
                            final ValidationOutcome outcome,
                            final String matchedEntryId,
                            final Double matchSeparationArcsec,
                            final int lookupAttempts,
                            final String message) {
        this.trackId = trackId;
        this.outcome = outcome;
        this.matchedEntryId = matchedEntryId;
        this.matchSeparationArcsec = matchSeparationArcsec;
        this.lookupAttempts = lookupAttempts;
        this.message = message;
    }

    public static ValidationResult matched(final String trackId,
                                           final String matchedEntryId,
                                           final double matchSeparationArcsec,
                                           final int lookupAttempts) {
        return new ValidationResult(trackId, ValidationOutcome.MATCHED, matchedEntryId, matchSeparationArcsec,
                                    lookupAttempts, null);
    }

    public static ValidationResult unmatched(final String trackId,
                                             final int lookupAttempts) {
        return new ValidationResult(trackId, ValidationOutcome.UNMATCHED, null, null, lookupAttempts, null);
    }

    public static ValidationResult unavailable(final String trackId,
                                               final int lookupAttempts,
                                               final String message) {
        return new ValidationResult(trackId, ValidationOutcome.VALIDATION_UNAVAILABLE, null, null,
                                    lookupAttempts, message);
    }

    public static ValidationResult notValidated(final String trackId,
                                                final String message) {
        return new ValidationResult(trackId, ValidationOutcome.NOT_VALIDATED, null, null, 0, message);
    }

    public String getTrackId() {
        return trackId;
    }

    public ValidationOutcome getOutcome() {
        return outcome;
    }

    public String getMatchedEntryId() {
        return matchedEntryId;
    }

    public Double getMatchSeparationArcsec() {
        return matchSeparationArcsec;
    }

    public int getLookupAttempts() {
        return lookupAttempts;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return trackId + ":" + outcome + (matchedEntryId == null ? "" : ":" + matchedEntryId);
    }
}
