package org.janelia.transients.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.transients.detect.Connectivity;

/**
 * Parameters for extracting candidates from difference maps.
 */
public class ExtractionParameters
        implements Serializable {

    @Parameter(
            names = "--detectionThreshold",
            description = "Minimum absolute pixel significance (in sigma) for a pixel to be flagged")
    public double detectionThreshold = 5.0;

    @Parameter(
            names = "--minBlobPixelCount",
            description = "Connected regions with fewer flagged pixels are discarded")
    public int minBlobPixelCount = 10;

    @Parameter(
            names = "--connectivity",
            description = "Pixel neighborhood used to group flagged pixels")
    public Connectivity connectivity = Connectivity.EIGHT;

    @Parameter(
            names = "--borderMargin",
            description = "Discard regions whose centroid lies within this many pixels of the image edge")
    public int borderMargin = 0;

    @Parameter(
            names = "--minIntegratedSignificance",
            description = "Discard regions whose integrated flux significance is below this value (0 to disable)")
    public double minIntegratedSignificance = 0.0;

    public ExtractionParameters() {
    }

    public ExtractionParameters(final double detectionThreshold,
                                final int minBlobPixelCount) {
        this.detectionThreshold = detectionThreshold;
        this.minBlobPixelCount = minBlobPixelCount;
    }

    public void validate()
            throws IllegalArgumentException {
        if (! (detectionThreshold > 0)) {
            throw new IllegalArgumentException("detectionThreshold must be positive");
        }
        if (minBlobPixelCount < 1) {
            throw new IllegalArgumentException("minBlobPixelCount must be at least 1");
        }
        if (borderMargin < 0) {
            throw new IllegalArgumentException("borderMargin must not be negative");
        }
    }
}
