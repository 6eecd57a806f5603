package org.janelia.transients.validate;

/**
 * Result of cross-matching one track against the catalog.
 */
public enum ValidationOutcome {

    /** A catalog entry lies within the match radius. */
    MATCHED,

    /** No catalog entry lies within the match radius. */
    UNMATCHED,

    /** The catalog could not be queried after all lookup attempts. */
    VALIDATION_UNAVAILABLE,

    /** Expired and rejected tracks are not cross-matched. */
    NOT_VALIDATED
}
