package org.janelia.transients.registry;

/**
 * The registry as a whole cannot be reached, so no image pair can be processed.
 */
public class RegistryUnavailableException
        extends Exception {

    public RegistryUnavailableException(final String message) {
        super(message);
    }

    public RegistryUnavailableException(final String message,
                                        final Throwable cause) {
        super(message, cause);
    }
}
