package org.janelia.transients.track;

import java.io.Serializable;

import org.janelia.transients.spec.Candidate;

/**
 * Inclusive pixel box on one sensor region known to produce spurious detections
 * (hot columns, charge traps, persistent ghosts).
 */
public class BadPixelRegion
        implements Serializable {

    private final String sensorRegionId;
    private final double minX;
    private final double minY;
    private final double maxX;
    private final double maxY;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private BadPixelRegion() {
        this(null, 0, 0, 0, 0);
    }

    public BadPixelRegion(final String sensorRegionId,
                          final double minX,
                          final double minY,
                          final double maxX,
                          final double maxY) {
        this.sensorRegionId = sensorRegionId;
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public String getSensorRegionId() {
        return sensorRegionId;
    }

    public boolean contains(final Candidate candidate) {
        return sensorRegionId.equals(candidate.getSensorRegionId()) &&
               (candidate.getCentroidX() >= minX) && (candidate.getCentroidX() <= maxX) &&
               (candidate.getCentroidY() >= minY) && (candidate.getCentroidY() <= maxY);
    }

    @Override
    public String toString() {
        return sensorRegionId + ":[" + minX + ", " + minY + ", " + maxX + ", " + maxY + "]";
    }
}
