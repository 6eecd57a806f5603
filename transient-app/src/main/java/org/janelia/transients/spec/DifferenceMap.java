package org.janelia.transients.spec;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

import java.util.Arrays;

/**
 * Per-pixel residual (science - scale * reference) and estimated noise (standard deviation)
 * for one aligned pair.  Invalid pixels are flagged and hold NaN residual and noise values.
 */
public class DifferenceMap {

    private final ImagePairId pairId;
    private final FloatProcessor residual;
    private final FloatProcessor noise;
    private final ByteProcessor validityFlags;
    private final WorldCoordinateMapping coordinateMapping;

    /**
     * @throws IllegalArgumentException
     *   if dimensions differ or any valid pixel has a noise estimate that is not finite and positive.
     */
    public DifferenceMap(final ImagePairId pairId,
                         final FloatProcessor residual,
                         final FloatProcessor noise,
                         final ByteProcessor validityFlags,
                         final WorldCoordinateMapping coordinateMapping)
            throws IllegalArgumentException {

        final int width = residual.getWidth();
        final int height = residual.getHeight();
        if ((noise.getWidth() != width) || (noise.getHeight() != height) ||
            (validityFlags.getWidth() != width) || (validityFlags.getHeight() != height)) {
            throw new IllegalArgumentException("difference map " + pairId + " has inconsistent dimensions");
        }

        final float[] noisePixels = (float[]) noise.getPixels();
        final byte[] flags = (byte[]) validityFlags.getPixels();
        for (int i = 0; i < flags.length; i++) {
            if ((flags[i] == PixelFlags.VALID) && ! (Float.isFinite(noisePixels[i]) && (noisePixels[i] > 0))) {
                throw new IllegalArgumentException("difference map " + pairId + " has invalid noise value " +
                                                   noisePixels[i] + " for valid pixel " + i);
            }
        }

        this.pairId = pairId;
        this.residual = residual;
        this.noise = noise;
        this.validityFlags = validityFlags;
        this.coordinateMapping = coordinateMapping;
    }

    public ImagePairId getPairId() {
        return pairId;
    }

    public FloatProcessor getResidual() {
        return residual;
    }

    public FloatProcessor getNoise() {
        return noise;
    }

    public ByteProcessor getValidityFlags() {
        return validityFlags;
    }

    public WorldCoordinateMapping getCoordinateMapping() {
        return coordinateMapping;
    }

    public int getWidth() {
        return residual.getWidth();
    }

    public int getHeight() {
        return residual.getHeight();
    }

    public boolean isValid(final int x,
                           final int y) {
        return PixelFlags.isValid(validityFlags.get(x, y));
    }

    public double getResidual(final int x,
                              final int y) {
        return residual.getf(x, y);
    }

    public double getNoise(final int x,
                           final int y) {
        return noise.getf(x, y);
    }

    /**
     * @return residual / noise for the specified pixel, or NaN if the pixel is invalid.
     */
    public double getSignificance(final int x,
                                  final int y) {
        if (! isValid(x, y)) {
            return Double.NaN;
        }
        return residual.getf(x, y) / noise.getf(x, y);
    }

    /**
     * @return true if the other map has bit-identical residual, noise, and flag values.
     */
    public boolean isIdenticalTo(final DifferenceMap other) {
        return pairId.equals(other.pairId) &&
               Arrays.equals((float[]) residual.getPixels(), (float[]) other.residual.getPixels()) &&
               Arrays.equals((float[]) noise.getPixels(), (float[]) other.noise.getPixels()) &&
               Arrays.equals((byte[]) validityFlags.getPixels(), (byte[]) other.validityFlags.getPixels());
    }

    @Override
    public String toString() {
        return "DifferenceMap{" + pairId + ", " + getWidth() + "x" + getHeight() + "}";
    }
}
