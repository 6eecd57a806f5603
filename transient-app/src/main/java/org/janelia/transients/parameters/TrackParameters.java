package org.janelia.transients.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for partitioning candidates and linking them into event tracks.
 */
public class TrackParameters
        implements Serializable {

    @Parameter(
            names = "--linkToleranceArcsec",
            description = "Maximum separation between a candidate and a track's representative coordinate")
    public double linkToleranceArcsec = 1.5;

    @Parameter(
            names = "--partitionCellArcsec",
            description = "Size of the sky grid cells used to partition candidates for merging")
    public double partitionCellArcsec = 60.0;

    @Parameter(
            names = "--maxTimeGapSeconds",
            description = "Tracks without a new candidate for longer than this are closed")
    public double maxTimeGapSeconds = 259200.0;

    @Parameter(
            names = "--maxSpreadArcsec",
            description = "Tracks whose candidates scatter (RMS) further than this from the track coordinate " +
                          "are rejected as artifacts")
    public double maxSpreadArcsec = 1.0;

    @Parameter(
            names = "--badPixelRegionsJson",
            description = "JSON file listing bad pixel regions, tracks seen only inside them are rejected")
    public String badPixelRegionsJson;

    public TrackParameters() {
    }

    public long getMaxTimeGapMilliseconds() {
        return Math.round(maxTimeGapSeconds * 1000.0);
    }

    public void validate()
            throws IllegalArgumentException {
        if (! (linkToleranceArcsec > 0)) {
            throw new IllegalArgumentException("linkToleranceArcsec must be positive");
        }
        if (! (partitionCellArcsec > 2 * linkToleranceArcsec)) {
            throw new IllegalArgumentException("partitionCellArcsec must be more than twice linkToleranceArcsec");
        }
        if (maxTimeGapSeconds < 0) {
            throw new IllegalArgumentException("maxTimeGapSeconds must not be negative");
        }
        if (! (maxSpreadArcsec > 0)) {
            throw new IllegalArgumentException("maxSpreadArcsec must be positive");
        }
    }
}
