package org.janelia.transients.align;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import org.janelia.transients.spec.PixelFlags;

/**
 * Robust estimate of the factor that scales reference flux to the science flux zero-point.
 * <p>
 * The estimate is the sigma-clipped median of science / reference pixel ratios over pixels
 * that are valid in both images and whose reference value exceeds a minimum signal.
 * Clipping uses the median absolute deviation, so a few bright residuals (the transients themselves,
 * cosmic rays) do not move the estimate.
 */
public class PhotometricScaleEstimator {

    private final double minReferenceSignal;
    private final int minSamplePixels;

    public PhotometricScaleEstimator(final double minReferenceSignal,
                                     final int minSamplePixels) {
        this.minReferenceSignal = minReferenceSignal;
        this.minSamplePixels = minSamplePixels;
    }

    /**
     * @return estimated scale factor.
     *
     * @throws PhotometricException
     *   if too few pixels are usable for the estimate.
     */
    public double estimate(final FloatProcessor science,
                           final FloatProcessor reference,
                           final ByteProcessor validityFlags)
            throws PhotometricException {

        final float[] sciencePixels = (float[]) science.getPixels();
        final float[] referencePixels = (float[]) reference.getPixels();
        final byte[] flags = (byte[]) validityFlags.getPixels();

        final int stride = Math.max(1, (int) Math.ceil((double) flags.length / MAX_SAMPLES));
        final double minSignal = Math.max(0.0, minReferenceSignal);

        final double[] ratios = new double[(flags.length / stride) + 1];
        int count = 0;
        for (int i = 0; i < flags.length; i += stride) {
            if ((flags[i] == PixelFlags.VALID) && (referencePixels[i] > minSignal)) {
                final double ratio = sciencePixels[i] / (double) referencePixels[i];
                if (Double.isFinite(ratio)) {
                    ratios[count++] = ratio;
                }
            }
        }

        if (count < minSamplePixels) {
            throw new PhotometricException("only " + count + " pixels usable for scale estimation, " +
                                           minSamplePixels + " required", null);
        }

        return SigmaClippedMedian.compute(ratios, count, new double[count], CLIP_SIGMA, MAX_CLIP_ITERATIONS);
    }

    private static final int MAX_SAMPLES = 250000;
    private static final int MAX_CLIP_ITERATIONS = 5;
    private static final double CLIP_SIGMA = 3.0;
}
