package org.janelia.transients.pipeline;

import ij.process.FloatProcessor;

import java.util.List;
import java.util.Random;

import org.janelia.transients.SyntheticSky;
import org.janelia.transients.align.AlignmentException;
import org.janelia.transients.align.PhotometricException;
import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.spec.WorldCoordinateMapping;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link PairDetectionFunction} class.
 */
public class PairDetectionFunctionTest {

    private static final double BACKGROUND = 100.0;

    private final ImagePairId pairId = SyntheticSky.buildPairId(1718000000000L);

    @Test
    public void testSinglePointSource()
            throws Exception {

        final FloatProcessor science = SyntheticSky.buildNoise(200, 200, BACKGROUND, 1.0, new Random(1234));
        SyntheticSky.addGaussianSource(science, 100.0, 100.0, 50.0, 0.2);

        final List<Candidate> candidates =
                new PairDetectionFunction(buildParameters(5.0, 1)).detect(buildPair(science));

        Assert.assertEquals("bad candidate count", 1, candidates.size());

        final Candidate candidate = candidates.get(0);
        final double offset = Math.hypot(candidate.getCentroidX() - 100.0, candidate.getCentroidY() - 100.0);
        Assert.assertTrue("candidate " + candidate + " should be within 1 pixel of the source", offset <= 1.0);
        Assert.assertEquals("peak significance should be close to the source flux",
                            50.0, candidate.getPeakSignificance(), 5.0);
        Assert.assertTrue("brightening source should have positive flux", candidate.getFlux() > 0);
        Assert.assertEquals("candidate should be tied to its pair", pairId, candidate.getSourcePairId());
    }

    @Test
    public void testFadingSource()
            throws Exception {

        final FloatProcessor science = SyntheticSky.buildNoise(100, 100, BACKGROUND, 1.0, new Random(99));
        SyntheticSky.addGaussianSource(science, 40.0, 60.0, -400.0, 1.0);

        final List<Candidate> candidates =
                new PairDetectionFunction(buildParameters(5.0, 4)).detect(buildPair(science));

        Assert.assertEquals("bad candidate count", 1, candidates.size());
        Assert.assertTrue("fading source should have negative flux", candidates.get(0).getFlux() < 0);
        Assert.assertEquals("bad centroid x", 40.0, candidates.get(0).getCentroidX(), 0.5);
        Assert.assertEquals("bad centroid y", 60.0, candidates.get(0).getCentroidY(), 0.5);
    }

    @Test
    public void testDeterminism()
            throws Exception {

        final FloatProcessor science = SyntheticSky.buildNoise(120, 120, BACKGROUND, 1.0, new Random(5));
        SyntheticSky.addGaussianSource(science, 30.0, 30.0, 300.0, 1.0);
        SyntheticSky.addGaussianSource(science, 80.5, 70.2, 600.0, 1.5);

        final PairDetectionFunction function = new PairDetectionFunction(buildParameters(3.0, 2));
        final List<Candidate> first = function.detect(buildPair(science));
        final List<Candidate> second = function.detect(buildPair((FloatProcessor) science.duplicate()));

        Assert.assertFalse("sources should be detected", first.isEmpty());
        Assert.assertEquals("repeated detection should give identical candidates", first, second);
    }

    @Test(expected = PhotometricException.class)
    public void testImplausibleScale()
            throws Exception {
        final FloatProcessor science = SyntheticSky.buildConstant(50, 50, BACKGROUND * 25);
        new PairDetectionFunction(buildParameters(5.0, 1)).detect(buildPair(science));
    }

    @Test(expected = AlignmentException.class)
    public void testMissingMapping()
            throws Exception {
        final FloatProcessor science = SyntheticSky.buildConstant(50, 50, BACKGROUND);
        final ImagePair pair = new ImagePair(
                pairId,
                SyntheticSky.buildExposure("sci", pairId, science, null),
                SyntheticSky.buildExposure("ref", pairId, SyntheticSky.buildConstant(50, 50, BACKGROUND),
                                           SyntheticSky.buildMapping()));
        new PairDetectionFunction(buildParameters(5.0, 1)).detect(pair);
    }

    /**
     * @return parameters with negligible Poisson noise and a combined science plus reference noise of one.
     */
    static DetectionPipelineParameters buildParameters(final double detectionThreshold,
                                                       final int minBlobPixelCount) {
        final DetectionPipelineParameters parameters = new DetectionPipelineParameters();
        parameters.noise.gain = 1.0e12;
        parameters.noise.readNoise = Math.sqrt(0.5);
        parameters.extraction.detectionThreshold = detectionThreshold;
        parameters.extraction.minBlobPixelCount = minBlobPixelCount;
        return parameters;
    }

    private ImagePair buildPair(final FloatProcessor science) {
        final WorldCoordinateMapping mapping = SyntheticSky.buildMapping();
        final FloatProcessor reference = SyntheticSky.buildConstant(science.getWidth(), science.getHeight(),
                                                                    BACKGROUND);
        return new ImagePair(pairId,
                             SyntheticSky.buildExposure("sci", pairId, science, mapping),
                             SyntheticSky.buildExposure("ref", pairId, reference, mapping));
    }
}
