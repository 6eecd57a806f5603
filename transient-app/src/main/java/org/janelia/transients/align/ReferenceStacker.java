package org.janelia.transients.align;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.List;
import java.util.Objects;

import org.janelia.transients.spec.Exposure;
import org.janelia.transients.spec.PixelFlags;
import org.janelia.transients.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines exposures that already share a pixel grid into one deep reference exposure.
 * <p>
 * Each output pixel is the sigma-clipped median of the valid input values at that pixel.
 * Output pixels with no valid input are zero and carry the union of the input flags
 * (plus {@link PixelFlags#NON_FINITE} for non-finite inputs).
 * The output keeps the field, sensor region, filter, and coordinate mapping of the first exposure.
 */
public class ReferenceStacker {

    private final double clipSigma;
    private final int maxClipIterations;

    public ReferenceStacker() {
        this(DEFAULT_CLIP_SIGMA, DEFAULT_MAX_CLIP_ITERATIONS);
    }

    public ReferenceStacker(final double clipSigma,
                            final int maxClipIterations) {
        this.clipSigma = clipSigma;
        this.maxClipIterations = maxClipIterations;
    }

    /**
     * @return median-combined exposure.
     *
     * @throws IllegalArgumentException
     *   if no exposures are specified or if the exposures differ in dimensions or filter.
     */
    public Exposure stack(final String exposureId,
                          final List<Exposure> exposures)
            throws IllegalArgumentException {

        if ((exposures == null) || exposures.isEmpty()) {
            throw new IllegalArgumentException("no exposures to stack for " + exposureId);
        }

        final Exposure first = exposures.get(0);
        final int width = first.getWidth();
        final int height = first.getHeight();
        for (final Exposure exposure : exposures) {
            if ((exposure.getWidth() != width) || (exposure.getHeight() != height)) {
                throw new IllegalArgumentException(
                        "exposure " + exposure + " dimensions " + exposure.getWidth() + "x" + exposure.getHeight() +
                        " differ from " + first + " dimensions " + width + "x" + height);
            }
            if (! Objects.equals(first.getFilter(), exposure.getFilter())) {
                throw new IllegalArgumentException("exposure " + exposure + " filter " + exposure.getFilter() +
                                                   " differs from " + first + " filter " + first.getFilter());
            }
        }

        LOG.debug("stack: entry, exposureId={}, stacking {} exposures", exposureId, exposures.size());

        final ProcessTimer timer = new ProcessTimer();

        final int exposureCount = exposures.size();
        final float[][] inputPixels = new float[exposureCount][];
        final byte[][] inputFlags = new byte[exposureCount][];
        for (int i = 0; i < exposureCount; i++) {
            inputPixels[i] = (float[]) exposures.get(i).getPixels().getPixels();
            inputFlags[i] = (byte[]) exposures.get(i).getQualityFlags().getPixels();
        }

        final FloatProcessor stackedPixels = new FloatProcessor(width, height);
        final ByteProcessor stackedFlags = new ByteProcessor(width, height);
        final float[] outputPixels = (float[]) stackedPixels.getPixels();
        final byte[] outputFlags = (byte[]) stackedFlags.getPixels();

        final double[] values = new double[exposureCount];
        final double[] scratch = new double[exposureCount];
        int unusablePixelCount = 0;

        for (int p = 0; p < outputPixels.length; p++) {
            int count = 0;
            int unionFlags = PixelFlags.VALID;
            for (int i = 0; i < exposureCount; i++) {
                final int flags = inputFlags[i][p] & 0xff;
                final float value = inputPixels[i][p];
                if (! Float.isFinite(value)) {
                    unionFlags |= flags | PixelFlags.NON_FINITE;
                } else if (PixelFlags.isValid(flags)) {
                    values[count++] = value;
                } else {
                    unionFlags |= flags;
                }
            }

            if (count > 0) {
                outputPixels[p] = (float) SigmaClippedMedian.compute(values, count, scratch,
                                                                     clipSigma, maxClipIterations);
            } else {
                outputFlags[p] = (byte) unionFlags;
                unusablePixelCount++;
            }
        }

        LOG.debug("stack: exit, exposureId={}, {} pixels had no valid input, elapsed time is {}",
                  exposureId, unusablePixelCount, timer);

        return new Exposure(exposureId,
                            first.getFieldId(),
                            first.getSensorRegionId(),
                            first.getFilter(),
                            stackedPixels,
                            stackedFlags,
                            first.getCoordinateMapping());
    }

    public static final double DEFAULT_CLIP_SIGMA = 3.0;
    public static final int DEFAULT_MAX_CLIP_ITERATIONS = 5;

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceStacker.class);
}
