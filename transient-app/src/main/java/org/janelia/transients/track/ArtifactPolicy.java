package org.janelia.transients.track;

import java.io.Serializable;

/**
 * Decides whether an open track's candidates match an artifact pattern.
 */
public interface ArtifactPolicy
        extends Serializable {

    /**
     * @return description of the artifact pattern found in the track, or null if none was found.
     */
    String findArtifact(final EventTrack track);

}
