package org.janelia.transients.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.transients.difference.NoiseModel;
import org.janelia.transients.difference.PoissonReadNoiseModel;

/**
 * Detector calibration values for the default Poisson plus read noise model.
 */
public class NoiseModelParameters
        implements Serializable {

    @Parameter(
            names = "--gain",
            description = "Detector gain in electrons per ADU, used to derive Poisson noise from pixel values")
    public double gain = 1.0;

    @Parameter(
            names = "--readNoise",
            description = "Constant per-pixel noise floor (read noise) in ADU")
    public double readNoise = 5.0;

    public NoiseModelParameters() {
    }

    public NoiseModel buildNoiseModel() {
        return new PoissonReadNoiseModel(gain, readNoise);
    }

    public void validate()
            throws IllegalArgumentException {
        if (! (gain > 0)) {
            throw new IllegalArgumentException("gain must be positive");
        }
        if (readNoise < 0) {
            throw new IllegalArgumentException("readNoise must not be negative");
        }
    }
}
