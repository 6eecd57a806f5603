package org.janelia.transients.difference;

/**
 * Variance of a CCD pixel: Poisson noise from the collected signal plus a constant read noise floor.
 * <pre>
 *     variance = max(value, 0) / gain + readNoise^2
 * </pre>
 */
public class PoissonReadNoiseModel
        implements NoiseModel {

    private final double gain;
    private final double readNoise;

    /**
     * @param  gain       detector gain in electrons per ADU.
     * @param  readNoise  read noise in ADU.
     */
    public PoissonReadNoiseModel(final double gain,
                                 final double readNoise) {
        this.gain = gain;
        this.readNoise = readNoise;
    }

    @Override
    public double variance(final double pixelValue) {
        return (Math.max(pixelValue, 0.0) / gain) + (readNoise * readNoise);
    }

    @Override
    public String toString() {
        return "PoissonReadNoiseModel{gain=" + gain + ", readNoise=" + readNoise + "}";
    }
}
