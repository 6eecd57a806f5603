package org.janelia.transients.validate;

/**
 * Failure of an external catalog lookup (unreachable, timed out, or malformed response).
 * Lookups that fail this way may succeed when retried.
 */
public class ValidationLookupException
        extends Exception {

    public ValidationLookupException(final String message) {
        super(message);
    }

    public ValidationLookupException(final String message,
                                     final Throwable cause) {
        super(message, cause);
    }
}
