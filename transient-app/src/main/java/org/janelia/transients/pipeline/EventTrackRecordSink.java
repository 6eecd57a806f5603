package org.janelia.transients.pipeline;

import java.io.Closeable;
import java.io.IOException;

/**
 * Consumer of finalized track records.
 */
@FunctionalInterface
public interface EventTrackRecordSink
        extends Closeable {

    void write(final EventTrackRecord record)
            throws IOException;

    @Override
    default void close()
            throws IOException {
    }

}
