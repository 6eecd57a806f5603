package org.janelia.transients.align;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import org.janelia.transients.parameters.AlignmentParameters;
import org.janelia.transients.spec.AlignedPair;
import org.janelia.transients.spec.Exposure;
import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.PixelFlags;
import org.janelia.transients.spec.SkyCoordinate;
import org.janelia.transients.spec.WorldCoordinateMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples the reference exposure of a pair onto the science exposure's pixel grid
 * and normalizes reference flux to the science zero-point.
 * <p>
 * Invalidity propagates through interpolation: a resampled pixel is flagged whenever any source pixel
 * with non-zero interpolation weight is flagged, non-finite, or outside the reference footprint.
 * Flagged pixels keep a NaN reference value.
 * <p>
 * Instances are stateless and safe to share between worker threads.
 */
public class ImageAligner {

    private final AlignmentParameters parameters;
    private final PhotometricScaleEstimator scaleEstimator;

    public ImageAligner(final AlignmentParameters parameters) {
        this.parameters = parameters;
        this.scaleEstimator = new PhotometricScaleEstimator(parameters.minScaleReferenceSignal,
                                                            parameters.minScaleSamplePixels);
    }

    /**
     * @return aligned version of the specified pair.
     *
     * @throws AlignmentException
     *   if either coordinate mapping is missing or invalid,
     *   or if the footprints overlap less than the configured minimum fraction.
     *
     * @throws PhotometricException
     *   if the photometric scale cannot be estimated or lies outside the plausible range.
     */
    public AlignedPair align(final ImagePair pair)
            throws AlignmentException, PhotometricException {

        final Exposure science = pair.getScience();
        final Exposure reference = pair.getReference();

        final WorldCoordinateMapping scienceMapping = science.getCoordinateMapping();
        final WorldCoordinateMapping referenceMapping = reference.getCoordinateMapping();
        if ((scienceMapping == null) || (! scienceMapping.isValid())) {
            throw new AlignmentException("science exposure " + science + " has missing or invalid " +
                                         "coordinate mapping " + scienceMapping);
        }
        if ((referenceMapping == null) || (! referenceMapping.isValid())) {
            throw new AlignmentException("reference exposure " + reference + " has missing or invalid " +
                                         "coordinate mapping " + referenceMapping);
        }

        final int width = science.getWidth();
        final int height = science.getHeight();
        final FloatProcessor resampledReference = new FloatProcessor(width, height);
        final ByteProcessor flags = new ByteProcessor(width, height);

        final boolean sharedGrid = scienceMapping.equals(referenceMapping) &&
                                   (reference.getWidth() == width) && (reference.getHeight() == height);

        final InterpolatedSource source = sharedGrid ? null : new InterpolatedSource(reference);

        int inFootprintCount = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {

                int flag = science.getQualityFlags().get(x, y);
                if (! Float.isFinite(science.getPixels().getf(x, y))) {
                    flag |= PixelFlags.NON_FINITE;
                }

                final Sample sample;
                if (sharedGrid) {
                    sample = sample(reference, x, y);
                } else {
                    final SkyCoordinate coordinate = scienceMapping.pixelToSky(x, y);
                    final double[] referencePixel = referenceMapping.skyToPixel(coordinate);
                    if (referencePixel == null) {
                        sample = OUT_OF_FOOTPRINT_SAMPLE;
                    } else if (parameters.interpolation == InterpolationMethod.NEAREST) {
                        sample = sampleNearest(reference, referencePixel[0], referencePixel[1]);
                    } else {
                        sample = source.sampleBilinear(referencePixel[0], referencePixel[1]);
                    }
                }

                if ((sample.flag & PixelFlags.OUT_OF_FOOTPRINT) == 0) {
                    inFootprintCount++;
                }

                flag |= sample.flag;
                flags.set(x, y, flag);
                resampledReference.setf(x, y, PixelFlags.isValid(flag) ? (float) sample.value : Float.NaN);
            }
        }

        final double overlapFraction = (double) inFootprintCount / ((double) width * height);
        if (overlapFraction < parameters.minOverlapFraction) {
            throw new AlignmentException("pair " + pair + " footprint overlap fraction " + overlapFraction +
                                         " is below minimum " + parameters.minOverlapFraction);
        }

        final double scale;
        if (parameters.fixedPhotometricScale == null) {
            scale = scaleEstimator.estimate(science.getPixels(), resampledReference, flags);
        } else {
            scale = parameters.fixedPhotometricScale;
        }

        if (! (Double.isFinite(scale) &&
               (scale >= parameters.minPhotometricScale) && (scale <= parameters.maxPhotometricScale))) {
            throw new PhotometricException("pair " + pair + " photometric scale " + scale +
                                           " is outside plausible range [" + parameters.minPhotometricScale +
                                           ", " + parameters.maxPhotometricScale + "]",
                                           scale);
        }

        LOG.debug("align: pair {} aligned with overlapFraction {}, scale {}, sharedGrid {}",
                  pair, overlapFraction, scale, sharedGrid);

        return new AlignedPair(pair.getPairId(),
                               science.getPixels(),
                               resampledReference,
                               flags,
                               scale,
                               scienceMapping);
    }

    private static Sample sample(final Exposure source,
                                 final int x,
                                 final int y) {
        final float value = source.getPixels().getf(x, y);
        int flag = source.getQualityFlags().get(x, y);
        if (! Float.isFinite(value)) {
            flag |= PixelFlags.NON_FINITE;
        }
        return new Sample(value, flag);
    }

    private static Sample sampleNearest(final Exposure source,
                                        final double x,
                                        final double y) {
        final int ix = (int) Math.floor(x + 0.5);
        final int iy = (int) Math.floor(y + 0.5);
        if (isOutside(source, ix, iy)) {
            return OUT_OF_FOOTPRINT_SAMPLE;
        }
        return sample(source, ix, iy);
    }

    /**
     * Reference pixels prepared for ImageJ bilinear interpolation.
     * Flagged pixels are zero filled in the value copy, and each flag bit has its own 0/1 mask that is
     * interpolated the same way, so a non-zero mask sample means a flagged pixel had non-zero weight.
     */
    private static class InterpolatedSource {

        private final Exposure exposure;
        private final FloatProcessor values;
        private final FloatProcessor[] flagMasks;

        InterpolatedSource(final Exposure exposure) {

            this.exposure = exposure;

            final int width = exposure.getWidth();
            final int height = exposure.getHeight();
            this.values = new FloatProcessor(width, height);
            this.flagMasks = new FloatProcessor[INTERPOLATED_FLAGS.length];

            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    final Sample sample = sample(exposure, x, y);
                    if (PixelFlags.isValid(sample.flag)) {
                        values.setf(x, y, (float) sample.value);
                    } else {
                        for (int i = 0; i < INTERPOLATED_FLAGS.length; i++) {
                            if ((sample.flag & INTERPOLATED_FLAGS[i]) != 0) {
                                if (flagMasks[i] == null) {
                                    flagMasks[i] = new FloatProcessor(width, height);
                                    flagMasks[i].setInterpolationMethod(ImageProcessor.BILINEAR);
                                }
                                flagMasks[i].setf(x, y, 1.0f);
                            }
                        }
                    }
                }
            }

            this.values.setInterpolationMethod(ImageProcessor.BILINEAR);
        }

        Sample sampleBilinear(final double x,
                              final double y) {

            final double snappedX = snap(x);
            final double snappedY = snap(y);

            final int x0 = (int) Math.floor(snappedX);
            final int y0 = (int) Math.floor(snappedY);
            final int x1 = snappedX == x0 ? x0 : x0 + 1;
            final int y1 = snappedY == y0 ? y0 : y0 + 1;

            if (isOutside(exposure, x0, y0) || isOutside(exposure, x1, y1)) {
                return OUT_OF_FOOTPRINT_SAMPLE;
            }

            if ((x0 == x1) && (y0 == y1)) {
                return sample(exposure, x0, y0);
            }

            int flag = 0;
            for (int i = 0; i < INTERPOLATED_FLAGS.length; i++) {
                if ((flagMasks[i] != null) && (flagMasks[i].getInterpolatedPixel(snappedX, snappedY) > 0.0)) {
                    flag |= INTERPOLATED_FLAGS[i];
                }
            }

            return new Sample(values.getInterpolatedPixel(snappedX, snappedY), flag);
        }

        /**
         * Positions numerically on a pixel center are moved onto it so that edge pixels stay inside the footprint.
         */
        private static double snap(final double position) {
            final double nearest = Math.rint(position);
            return Math.abs(position - nearest) < SNAP_EPSILON ? nearest : position;
        }
    }

    private static boolean isOutside(final Exposure source,
                                     final int x,
                                     final int y) {
        return (x < 0) || (y < 0) || (x >= source.getWidth()) || (y >= source.getHeight());
    }

    private static class Sample {
        private final double value;
        private final int flag;

        Sample(final double value,
               final int flag) {
            this.value = value;
            this.flag = flag;
        }
    }

    private static final Sample OUT_OF_FOOTPRINT_SAMPLE = new Sample(Double.NaN, PixelFlags.OUT_OF_FOOTPRINT);

    private static final int[] INTERPOLATED_FLAGS = {
            PixelFlags.MASKED, PixelFlags.SATURATED, PixelFlags.NON_FINITE
    };

    private static final double SNAP_EPSILON = 1.0e-6;

    private static final Logger LOG = LoggerFactory.getLogger(ImageAligner.class);
}
