package org.janelia.transients.track;

/**
 * Lifecycle states of an {@link EventTrack}.
 */
public enum TrackState {

    /** Created from a single unmatched candidate. */
    NEW(true),

    /** At least two consistent candidates have been linked. */
    CONFIRMED(true),

    /** A confirmed track that had no candidate linked within the maximum time gap. */
    EXPIRED(false),

    /** Candidates match an artifact pattern. */
    REJECTED(false);

    private final boolean open;

    TrackState(final boolean open) {
        this.open = open;
    }

    /**
     * @return true if tracks in this state are not terminal.
     */
    public boolean isOpen() {
        return open;
    }
}
