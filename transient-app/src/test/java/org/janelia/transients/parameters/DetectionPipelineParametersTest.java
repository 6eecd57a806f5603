package org.janelia.transients.parameters;

import java.io.StringReader;

import org.janelia.transients.align.InterpolationMethod;
import org.janelia.transients.detect.Connectivity;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DetectionPipelineParameters} class.
 */
public class DetectionPipelineParametersTest {

    @Test
    public void testJsonRoundTrip() {

        final DetectionPipelineParameters parameters = new DetectionPipelineParameters();
        parameters.alignment.interpolation = InterpolationMethod.NEAREST;
        parameters.alignment.fixedPhotometricScale = 1.25;
        parameters.extraction.connectivity = Connectivity.FOUR;
        parameters.track.badPixelRegionsJson = "/data/bad-pixels.json";
        parameters.execution.unitTimeoutSeconds = 42;

        final DetectionPipelineParameters parsed =
                DetectionPipelineParameters.fromJson(new StringReader(parameters.toJson()));

        Assert.assertEquals("bad interpolation", InterpolationMethod.NEAREST, parsed.alignment.interpolation);
        Assert.assertEquals("bad fixed scale", 1.25, parsed.alignment.fixedPhotometricScale, 0.0);
        Assert.assertEquals("bad connectivity", Connectivity.FOUR, parsed.extraction.connectivity);
        Assert.assertEquals("bad bad pixel path", "/data/bad-pixels.json", parsed.track.badPixelRegionsJson);
        Assert.assertEquals("bad timeout", 42, parsed.execution.unitTimeoutSeconds);
    }

    @Test
    public void testPartialJsonKeepsDefaults() {

        final String json = "{ \"extraction\": { \"detectionThreshold\": 7.5 }, \"unknownSection\": 1 }";
        final DetectionPipelineParameters parsed = DetectionPipelineParameters.fromJson(new StringReader(json));

        Assert.assertEquals("bad threshold", 7.5, parsed.extraction.detectionThreshold, 0.0);
        Assert.assertEquals("min blob default should be kept", 10, parsed.extraction.minBlobPixelCount);
        Assert.assertEquals("connectivity default should be kept", Connectivity.EIGHT, parsed.extraction.connectivity);
        Assert.assertEquals("track default should be kept", 1.5, parsed.track.linkToleranceArcsec, 0.0);
        Assert.assertNull("fixed scale should not be set", parsed.alignment.fixedPhotometricScale);

        parsed.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreshold() {
        final DetectionPipelineParameters parameters = new DetectionPipelineParameters();
        parameters.extraction.detectionThreshold = 0.0;
        parameters.validate();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidScaleBounds() {
        final DetectionPipelineParameters parameters = new DetectionPipelineParameters();
        parameters.alignment.minPhotometricScale = 5.0;
        parameters.alignment.maxPhotometricScale = 2.0;
        parameters.validate();
    }

}
