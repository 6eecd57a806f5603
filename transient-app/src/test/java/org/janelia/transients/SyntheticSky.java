package org.janelia.transients;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.janelia.transients.registry.ImageRegistry;
import org.janelia.transients.registry.InvalidInputException;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.Exposure;
import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.spec.SkyCoordinate;
import org.janelia.transients.spec.WorldCoordinateMapping;

/**
 * Builders for synthetic exposures, candidates, and an in-memory image registry used by tests.
 */
public class SyntheticSky {

    public static final SkyCoordinate FIELD_CENTER = new SkyCoordinate(150.0, 2.0);

    public static final double PIXEL_SCALE_ARCSEC = 1.0;

    /**
     * @return north-up mapping with 1 arcsec pixels, pixel (100, 100) at the field center.
     */
    public static WorldCoordinateMapping buildMapping() {
        return WorldCoordinateMapping.northUp(100.0, 100.0, FIELD_CENTER, PIXEL_SCALE_ARCSEC);
    }

    public static FloatProcessor buildNoise(final int width,
                                            final int height,
                                            final double background,
                                            final double sigma,
                                            final Random random) {
        final FloatProcessor fp = new FloatProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                fp.setf(x, y, (float) (background + (sigma * random.nextGaussian())));
            }
        }
        return fp;
    }

    public static FloatProcessor buildConstant(final int width,
                                               final int height,
                                               final double value) {
        final FloatProcessor fp = new FloatProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                fp.setf(x, y, (float) value);
            }
        }
        return fp;
    }

    /**
     * Adds a circular gaussian source, integrating each pixel with 20x20 sub-samples.
     * Only pixels within 6 sigma (at least 3 pixels) of the center are touched.
     */
    public static void addGaussianSource(final FloatProcessor fp,
                                         final double centerX,
                                         final double centerY,
                                         final double totalFlux,
                                         final double sigma) {
        final int radius = (int) Math.ceil(Math.max(3.0, 6.0 * sigma));
        final int subSamples = 20;
        final double norm = totalFlux / (2.0 * Math.PI * sigma * sigma * subSamples * subSamples);
        final int cx = (int) Math.round(centerX);
        final int cy = (int) Math.round(centerY);
        for (int y = cy - radius; y <= cy + radius; y++) {
            for (int x = cx - radius; x <= cx + radius; x++) {
                double sum = 0.0;
                for (int sy = 0; sy < subSamples; sy++) {
                    final double py = y - 0.5 + ((sy + 0.5) / subSamples) - centerY;
                    for (int sx = 0; sx < subSamples; sx++) {
                        final double px = x - 0.5 + ((sx + 0.5) / subSamples) - centerX;
                        sum += Math.exp(-((px * px) + (py * py)) / (2.0 * sigma * sigma));
                    }
                }
                fp.setf(x, y, (float) (fp.getf(x, y) + (norm * sum)));
            }
        }
    }

    public static Exposure buildExposure(final String exposureId,
                                         final ImagePairId pairId,
                                         final FloatProcessor pixels,
                                         final WorldCoordinateMapping mapping) {
        return Exposure.withoutFlags(exposureId,
                                     pairId.getFieldId(),
                                     pairId.getSensorRegionId(),
                                     pairId.getFilter(),
                                     pixels,
                                     mapping);
    }

    public static Exposure buildExposure(final String exposureId,
                                         final ImagePairId pairId,
                                         final FloatProcessor pixels,
                                         final ByteProcessor flags,
                                         final WorldCoordinateMapping mapping) {
        return new Exposure(exposureId,
                            pairId.getFieldId(),
                            pairId.getSensorRegionId(),
                            pairId.getFilter(),
                            pixels,
                            flags,
                            mapping);
    }

    public static ImagePairId buildPairId(final long observationTime) {
        return new ImagePairId("field-1", "sensor-1", "r", observationTime);
    }

    /**
     * @return candidate with arbitrary pixel position, positive flux, and the specified peak significance.
     */
    public static Candidate buildCandidate(final String candidateId,
                                           final ImagePairId pairId,
                                           final SkyCoordinate coordinate,
                                           final double peakSignificance) {
        return new Candidate(candidateId, pairId, 100.0, 100.0, coordinate, 100.0, peakSignificance,
                             peakSignificance, 12);
    }

    public static Candidate buildCandidate(final String candidateId,
                                           final ImagePairId pairId,
                                           final SkyCoordinate coordinate) {
        return buildCandidate(candidateId, pairId, coordinate, 10.0);
    }

    /**
     * Image registry backed by a map of pairs.
     */
    public static class InMemoryRegistry
            implements ImageRegistry {

        private final Map<ImagePairId, ImagePair> pairs = new TreeMap<>();

        public void add(final ImagePair pair) {
            pairs.put(pair.getPairId(), pair);
        }

        @Override
        public List<ImagePairId> listImagePairIds() {
            return new ArrayList<>(pairs.keySet());
        }

        @Override
        public ImagePair fetchImagePair(final ImagePairId pairId)
                throws InvalidInputException {
            final ImagePair pair = pairs.get(pairId);
            if (pair == null) {
                throw new InvalidInputException("missing pair " + pairId);
            }
            return pair;
        }
    }

    private SyntheticSky() {
    }
}
