package org.janelia.transients.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.transients.align.InterpolationMethod;

/**
 * Parameters for resampling reference exposures and estimating photometric scale.
 */
public class AlignmentParameters
        implements Serializable {

    @Parameter(
            names = "--interpolation",
            description = "Method used to resample reference pixels onto the science grid")
    public InterpolationMethod interpolation = InterpolationMethod.BILINEAR;

    @Parameter(
            names = "--minOverlapFraction",
            description = "Minimum fraction of science pixels that must map into the reference footprint")
    public double minOverlapFraction = 0.5;

    @Parameter(
            names = "--minPhotometricScale",
            description = "Smallest plausible reference to science flux scale factor")
    public double minPhotometricScale = 0.1;

    @Parameter(
            names = "--maxPhotometricScale",
            description = "Largest plausible reference to science flux scale factor")
    public double maxPhotometricScale = 10.0;

    @Parameter(
            names = "--fixedPhotometricScale",
            description = "Use this scale factor instead of estimating one from pixel ratios " +
                          "(still checked against the plausible range)")
    public Double fixedPhotometricScale;

    @Parameter(
            names = "--minScaleReferenceSignal",
            description = "Only reference pixels brighter than this value contribute to scale estimation")
    public double minScaleReferenceSignal = 0.0;

    @Parameter(
            names = "--minScaleSamplePixels",
            description = "Minimum number of usable pixels needed to estimate a scale factor")
    public int minScaleSamplePixels = 25;

    public AlignmentParameters() {
    }

    /**
     * @throws IllegalArgumentException
     *   if any parameter value is out of range.
     */
    public void validate()
            throws IllegalArgumentException {
        if ((minOverlapFraction < 0) || (minOverlapFraction > 1)) {
            throw new IllegalArgumentException("minOverlapFraction must be between 0 and 1");
        }
        if (! ((minPhotometricScale > 0) && (minPhotometricScale <= maxPhotometricScale))) {
            throw new IllegalArgumentException("photometric scale range [" + minPhotometricScale + ", " +
                                               maxPhotometricScale + "] is invalid");
        }
        if (minScaleSamplePixels < 1) {
            throw new IllegalArgumentException("minScaleSamplePixels must be positive");
        }
    }
}
