package org.janelia.transients.track;

/**
 * Rejects multi-candidate tracks whose detections scatter further than a point source plausibly would.
 */
public class SpatialSpreadPolicy
        implements ArtifactPolicy {

    private final double maxSpreadArcsec;

    public SpatialSpreadPolicy(final double maxSpreadArcsec) {
        this.maxSpreadArcsec = maxSpreadArcsec;
    }

    @Override
    public String findArtifact(final EventTrack track) {
        String artifact = null;
        if (track.getCandidateCount() > 1) {
            final double spread = track.getSpreadArcsec();
            if (spread > maxSpreadArcsec) {
                artifact = String.format("spread %.3f arcsec exceeds %.3f arcsec", spread, maxSpreadArcsec);
            }
        }
        return artifact;
    }
}
