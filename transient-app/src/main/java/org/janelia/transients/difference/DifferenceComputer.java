package org.janelia.transients.difference;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import org.janelia.transients.spec.AlignedPair;
import org.janelia.transients.spec.DifferenceMap;
import org.janelia.transients.spec.PixelFlags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes pixel-wise residuals and noise for an aligned pair.
 * <pre>
 *     residual = science - scale * reference
 *     noise    = sqrt( scienceVariance(science) + scale^2 * referenceVariance(reference) )
 * </pre>
 * Invalid pixels stay flagged and hold NaN values.
 * The computation is pure: identical input always yields bit-identical output.
 */
public class DifferenceComputer {

    private final NoiseModel scienceNoiseModel;
    private final NoiseModel referenceNoiseModel;

    public DifferenceComputer(final NoiseModel noiseModel) {
        this(noiseModel, noiseModel);
    }

    public DifferenceComputer(final NoiseModel scienceNoiseModel,
                              final NoiseModel referenceNoiseModel) {
        this.scienceNoiseModel = scienceNoiseModel;
        this.referenceNoiseModel = referenceNoiseModel;
    }

    /**
     * @return difference map for the specified pair.
     *
     * @throws CandidateNoiseException
     *   if the noise model produces a non-positive or non-finite value for any valid pixel.
     */
    public DifferenceMap compute(final AlignedPair alignedPair)
            throws CandidateNoiseException {

        final int width = alignedPair.getWidth();
        final int height = alignedPair.getHeight();

        final float[] science = (float[]) alignedPair.getScience().getPixels();
        final float[] reference = (float[]) alignedPair.getReference().getPixels();
        final byte[] sourceFlags = (byte[]) alignedPair.getValidityFlags().getPixels();

        final float[] residual = new float[science.length];
        final float[] noise = new float[science.length];
        final byte[] flags = sourceFlags.clone();

        final double scale = alignedPair.getPhotometricScale();
        final double scaleSquared = scale * scale;

        for (int i = 0; i < science.length; i++) {

            if (flags[i] != PixelFlags.VALID) {
                residual[i] = Float.NaN;
                noise[i] = Float.NaN;
                continue;
            }

            final double variance = scienceNoiseModel.variance(science[i]) +
                                    (scaleSquared * referenceNoiseModel.variance(reference[i]));

            if (! (Double.isFinite(variance) && (variance > 0))) {
                throw new CandidateNoiseException("noise model produced variance " + variance + " for pixel (" +
                                                  (i % width) + ", " + (i / width) + ") of pair " +
                                                  alignedPair.getPairId());
            }

            residual[i] = (float) (science[i] - (scale * reference[i]));
            noise[i] = (float) Math.sqrt(variance);

            // float rounding of tiny variances must not produce a zero estimate
            if (noise[i] <= 0.0f) {
                throw new CandidateNoiseException("noise estimate underflowed for pixel (" + (i % width) + ", " +
                                                  (i / width) + ") of pair " + alignedPair.getPairId());
            }
        }

        LOG.debug("compute: built {}x{} difference map for pair {}", width, height, alignedPair.getPairId());

        return new DifferenceMap(alignedPair.getPairId(),
                                 new FloatProcessor(width, height, residual),
                                 new FloatProcessor(width, height, noise),
                                 new ByteProcessor(width, height, flags),
                                 alignedPair.getCoordinateMapping());
    }

    private static final Logger LOG = LoggerFactory.getLogger(DifferenceComputer.class);
}
