package org.janelia.transients.detect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.transients.parameters.ExtractionParameters;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.DifferenceMap;
import org.janelia.transients.spec.SkyCoordinate;
import org.janelia.transients.spec.WorldCoordinateMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts candidate detections from a difference map.
 * <p>
 * Valid pixels whose absolute significance exceeds the detection threshold are flagged,
 * flagged pixels are grouped into connected regions, and each region that is large enough
 * (and passes the optional border and integrated significance filters) becomes one candidate.
 * Brightening and fading residuals are both detected; the sign of a candidate's flux tells them apart.
 */
public class CandidateExtractor {

    private final ExtractionParameters parameters;
    private final ConnectedComponentLabeler labeler;

    public CandidateExtractor(final ExtractionParameters parameters) {
        this.parameters = parameters;
        this.labeler = new ConnectedComponentLabeler(parameters.connectivity);
    }

    /**
     * @return candidates sorted by descending peak significance (ties broken by centroid y, then x).
     *
     * @throws IllegalArgumentException
     *   if the map has no coordinate mapping.
     */
    public List<Candidate> extract(final DifferenceMap map)
            throws IllegalArgumentException {

        final WorldCoordinateMapping mapping = map.getCoordinateMapping();
        if (mapping == null) {
            throw new IllegalArgumentException("difference map " + map + " has no coordinate mapping");
        }

        final int width = map.getWidth();
        final int height = map.getHeight();
        final float[] residual = (float[]) map.getResidual().getPixels();
        final float[] noise = (float[]) map.getNoise().getPixels();

        final boolean[] significant = new boolean[residual.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final double significance = map.getSignificance(x, y);
                significant[(y * width) + x] = Math.abs(significance) > parameters.detectionThreshold;
            }
        }

        final List<int[]> regions = labeler.label(significant, width, height);
        final List<Blob> blobs = new ArrayList<>();

        int smallCount = 0;
        int filteredCount = 0;
        for (final int[] region : regions) {

            if (region.length < parameters.minBlobPixelCount) {
                smallCount++;
                continue;
            }

            final Blob blob = new Blob(region, residual, noise, width);

            if (isNearBorder(blob, width, height) ||
                (blob.getIntegratedSignificance() < parameters.minIntegratedSignificance)) {
                filteredCount++;
                continue;
            }

            blobs.add(blob);
        }

        blobs.sort(BLOB_ORDER);

        final List<Candidate> candidates = new ArrayList<>(blobs.size());
        for (int i = 0; i < blobs.size(); i++) {
            final Blob blob = blobs.get(i);
            final SkyCoordinate coordinate = mapping.pixelToSky(blob.centroidX, blob.centroidY);
            candidates.add(new Candidate(map.getPairId() + "#" + i,
                                         map.getPairId(),
                                         blob.centroidX,
                                         blob.centroidY,
                                         coordinate,
                                         blob.flux,
                                         blob.peakSignificance,
                                         blob.getIntegratedSignificance(),
                                         blob.pixelCount));
        }

        LOG.debug("extract: found {} candidates in {} regions of pair {} ({} too small, {} filtered)",
                  candidates.size(), regions.size(), map.getPairId(), smallCount, filteredCount);

        return candidates;
    }

    private boolean isNearBorder(final Blob blob,
                                 final int width,
                                 final int height) {
        final int margin = parameters.borderMargin;
        return (margin > 0) &&
               ((blob.centroidX < margin) || (blob.centroidX > (width - 1 - margin)) ||
                (blob.centroidY < margin) || (blob.centroidY > (height - 1 - margin)));
    }

    /**
     * Summary statistics for one connected region.
     */
    private static class Blob {

        private final int pixelCount;
        private final double centroidX;
        private final double centroidY;
        private final double flux;
        private final double peakSignificance;
        private final double noiseQuadratureSum;

        Blob(final int[] region,
             final float[] residual,
             final float[] noise,
             final int width) {

            double weightSum = 0.0;
            double weightedX = 0.0;
            double weightedY = 0.0;
            double sumX = 0.0;
            double sumY = 0.0;
            double fluxSum = 0.0;
            double varianceSum = 0.0;
            double peak = 0.0;

            for (final int index : region) {
                final int x = index % width;
                final int y = index / width;
                final double value = residual[index];
                final double weight = Math.abs(value);

                weightSum += weight;
                weightedX += weight * x;
                weightedY += weight * y;
                sumX += x;
                sumY += y;
                fluxSum += value;
                varianceSum += (double) noise[index] * noise[index];
                peak = Math.max(peak, Math.abs(value / noise[index]));
            }

            this.pixelCount = region.length;
            if (weightSum > 0) {
                this.centroidX = weightedX / weightSum;
                this.centroidY = weightedY / weightSum;
            } else {
                this.centroidX = sumX / region.length;
                this.centroidY = sumY / region.length;
            }
            this.flux = fluxSum;
            this.peakSignificance = peak;
            this.noiseQuadratureSum = Math.sqrt(varianceSum);
        }

        double getIntegratedSignificance() {
            return Math.abs(flux) / noiseQuadratureSum;
        }
    }

    private static final Comparator<Blob> BLOB_ORDER =
            Comparator.comparingDouble((Blob b) -> -b.peakSignificance)
                    .thenComparingDouble(b -> b.centroidY)
                    .thenComparingDouble(b -> b.centroidX);

    private static final Logger LOG = LoggerFactory.getLogger(CandidateExtractor.class);
}
