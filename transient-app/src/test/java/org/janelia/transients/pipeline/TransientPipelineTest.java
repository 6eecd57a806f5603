package org.janelia.transients.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

import ij.process.FloatProcessor;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.janelia.transients.SyntheticSky;
import org.janelia.transients.json.JsonUtils;
import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.janelia.transients.registry.ImageRegistry;
import org.janelia.transients.registry.InvalidInputException;
import org.janelia.transients.registry.RegistryUnavailableException;
import org.janelia.transients.spec.CatalogEntry;
import org.janelia.transients.spec.Exposure;
import org.janelia.transients.spec.FailureCategory;
import org.janelia.transients.spec.ImagePair;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.spec.WorldCoordinateMapping;
import org.janelia.transients.track.EventTrack;
import org.janelia.transients.track.TrackAggregator;
import org.janelia.transients.track.TrackState;
import org.janelia.transients.util.LogbackTestTools;
import org.janelia.transients.validate.InMemoryCatalog;
import org.janelia.transients.validate.ValidationOutcome;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link TransientPipeline} class.
 */
public class TransientPipelineTest {

    private static final long FIRST_TIME = 1718000000000L;
    private static final long TEN_MINUTES = 10 * 60 * 1000L;
    private static final double BACKGROUND = 100.0;

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @BeforeClass
    public static void before() {
        LogbackTestTools.setLogLevelToWarn(UnitOfWorkRunner.class.getName());
    }

    @Test
    public void testTwoPairsFormOneConfirmedTrack()
            throws Exception {

        final SyntheticSky.InMemoryRegistry registry = new SyntheticSky.InMemoryRegistry();
        registry.add(buildPairWithSource(FIRST_TIME, 100.0, 1));
        registry.add(buildPairWithSource(FIRST_TIME + TEN_MINUTES, 100.3, 2));

        final InMemoryCatalog catalog = new InMemoryCatalog(Collections.singletonList(
                new CatalogEntry("SN-1", SyntheticSky.FIELD_CENTER, "SN", null)));

        final List<EventTrackRecord> records = new ArrayList<>();
        final BatchResult result = buildPipeline(registry, catalog).run(Collections.singletonList("SN-1"),
                                                                        records::add);

        Assert.assertEquals("bad track count", 1, result.getTracks().size());
        final EventTrack track = result.getTracks().get(0);
        Assert.assertEquals("bad track state", TrackState.CONFIRMED, track.getState());
        Assert.assertEquals("track should hold both candidates", 2, track.getCandidateCount());
        Assert.assertEquals("bad first detection", FIRST_TIME, track.getFirstDetectionTime());
        Assert.assertEquals("bad last detection", FIRST_TIME + TEN_MINUTES, track.getLastDetectionTime());

        Assert.assertEquals("bad validation outcome",
                            ValidationOutcome.MATCHED, result.getValidationResults().get(0).getOutcome());

        final BatchDiagnostics diagnostics = result.getDiagnostics();
        Assert.assertEquals("bad processed pair count", 2, diagnostics.getProcessedPairCount());
        Assert.assertEquals("bad candidate count", 2, diagnostics.getCandidateCount());
        Assert.assertEquals("bad confirmed count", 1, diagnostics.getTrackCount(TrackState.CONFIRMED));
        Assert.assertFalse("batch should have no failures", diagnostics.hasPartialFailures());
        Assert.assertEquals("bad recall", 1.0, diagnostics.getValidationMetrics().getRecall(), 0.0);

        Assert.assertEquals("one record should be written per track", 1, records.size());
        Assert.assertEquals("bad record observations", 2, records.get(0).getObservations().size());
        Assert.assertEquals("bad record entry", "SN-1", records.get(0).getMatchedEntryId());
    }

    @Test
    public void testFailingPairsDoNotStopBatch()
            throws Exception {

        final SyntheticSky.InMemoryRegistry registry = new SyntheticSky.InMemoryRegistry();
        registry.add(buildPairWithSource(FIRST_TIME, 100.0, 1));
        registry.add(buildPairWithSource(FIRST_TIME + TEN_MINUTES, 100.3, 2));

        // pair without reference coordinate mapping
        final ImagePairId unalignedId = SyntheticSky.buildPairId(FIRST_TIME + (2 * TEN_MINUTES));
        registry.add(new ImagePair(unalignedId,
                                   buildScience(unalignedId, 100.0, 3),
                                   SyntheticSky.buildExposure("ref", unalignedId,
                                                              SyntheticSky.buildConstant(200, 200, BACKGROUND),
                                                              null)));

        // pair with implausible zero-point
        final ImagePairId scaledId = SyntheticSky.buildPairId(FIRST_TIME + (3 * TEN_MINUTES));
        registry.add(new ImagePair(scaledId,
                                   SyntheticSky.buildExposure("sci", scaledId,
                                                              SyntheticSky.buildConstant(200, 200, BACKGROUND * 50),
                                                              SyntheticSky.buildMapping()),
                                   buildReference(scaledId)));

        final BatchResult result = buildPipeline(registry, new InMemoryCatalog(Collections.emptyList()))
                .run(null, record -> { });

        final BatchDiagnostics diagnostics = result.getDiagnostics();
        Assert.assertEquals("bad pair count", 4, diagnostics.getPairCount());
        Assert.assertEquals("bad processed pair count", 2, diagnostics.getProcessedPairCount());
        Assert.assertEquals("bad alignment failure count", 1, diagnostics.getFailureCount(FailureCategory.ALIGNMENT));
        Assert.assertEquals("bad photometric failure count",
                            1, diagnostics.getFailureCount(FailureCategory.PHOTOMETRIC));
        Assert.assertEquals("photometric failure should be flagged for review",
                            Collections.singletonList(scaledId.toString()), diagnostics.getPairsFlaggedForReview());
        Assert.assertTrue("batch should report partial failures", diagnostics.hasPartialFailures());

        Assert.assertEquals("surviving pairs should still form a track", 1, result.getTracks().size());
        Assert.assertEquals(TrackState.CONFIRMED, result.getTracks().get(0).getState());
        Assert.assertEquals("bad validation outcome",
                            ValidationOutcome.UNMATCHED, result.getValidationResults().get(0).getOutcome());
    }

    @Test
    public void testTimedOutPairIsCounted()
            throws Exception {

        final SyntheticSky.InMemoryRegistry fastRegistry = new SyntheticSky.InMemoryRegistry();
        fastRegistry.add(buildPairWithSource(FIRST_TIME, 100.0, 1));
        final ImagePairId slowId = SyntheticSky.buildPairId(FIRST_TIME + TEN_MINUTES);

        final ImageRegistry registry = new ImageRegistry() {
            @Override
            public List<ImagePairId> listImagePairIds() {
                final List<ImagePairId> pairIds = new ArrayList<>(fastRegistry.listImagePairIds());
                pairIds.add(slowId);
                return pairIds;
            }

            @Override
            public ImagePair fetchImagePair(final ImagePairId pairId)
                    throws InvalidInputException {
                if (slowId.equals(pairId)) {
                    try {
                        Thread.sleep(30000);
                    } catch (final InterruptedException e) {
                        throw new InvalidInputException("interrupted while reading " + pairId, e);
                    }
                }
                return fastRegistry.fetchImagePair(pairId);
            }
        };

        final DetectionPipelineParameters parameters = PairDetectionFunctionTest.buildParameters(5.0, 4);
        parameters.execution.unitTimeoutSeconds = 2;
        parameters.execution.maxUnitAttempts = 2;

        final BatchResult result = new TransientPipeline(parameters,
                                                         registry,
                                                         new InMemoryCatalog(Collections.emptyList()),
                                                         Collections.emptyList())
                .run(null, record -> { });

        final BatchDiagnostics diagnostics = result.getDiagnostics();
        Assert.assertEquals("bad timeout failure count", 1, diagnostics.getFailureCount(FailureCategory.TIMEOUT));
        Assert.assertEquals("bad timed out attempt count", 2, diagnostics.getTimedOutAttemptCount());
        Assert.assertEquals("bad processed pair count", 1, diagnostics.getProcessedPairCount());
        Assert.assertEquals("remaining pair should still produce a track", 1, result.getTracks().size());
    }

    @Test
    public void testUnavailableRegistryAbortsBatch()
            throws Exception {

        final SyntheticSky.InMemoryRegistry availableRegistry = new SyntheticSky.InMemoryRegistry();
        availableRegistry.add(buildPairWithSource(FIRST_TIME, 100.0, 1));

        final ImageRegistry registry = new ImageRegistry() {
            @Override
            public List<ImagePairId> listImagePairIds() {
                return availableRegistry.listImagePairIds();
            }

            @Override
            public ImagePair fetchImagePair(final ImagePairId pairId)
                    throws RegistryUnavailableException {
                throw new RegistryUnavailableException("storage offline");
            }
        };

        final List<EventTrackRecord> records = new ArrayList<>();
        try {
            buildPipeline(registry, new InMemoryCatalog(Collections.emptyList())).run(null, records::add);
            Assert.fail("unavailable registry should abort the batch");
        } catch (final BatchAbortedException e) {
            Assert.assertNotNull("diagnostics should be attached", e.getDiagnostics());
            Assert.assertEquals("bad abort reason", "storage offline", e.getDiagnostics().getAbortReason());
        }
        Assert.assertTrue("aborted batch should not write records", records.isEmpty());
    }

    @Test
    public void testUnlistableRegistryAbortsBatch() {

        final ImageRegistry registry = new ImageRegistry() {
            @Override
            public List<ImagePairId> listImagePairIds()
                    throws RegistryUnavailableException {
                throw new RegistryUnavailableException("catalog database down");
            }

            @Override
            public ImagePair fetchImagePair(final ImagePairId pairId) {
                throw new UnsupportedOperationException();
            }
        };

        try {
            buildPipeline(registry, new InMemoryCatalog(Collections.emptyList())).run(null, record -> { });
            Assert.fail("unavailable registry should abort the batch");
        } catch (final BatchAbortedException e) {
            Assert.assertEquals("bad abort reason", "catalog database down", e.getDiagnostics().getAbortReason());
        } catch (final Exception e) {
            Assert.fail("unexpected exception " + e);
        }
    }

    @Test
    public void testJsonLinesRecordSink()
            throws Exception {

        final SyntheticSky.InMemoryRegistry registry = new SyntheticSky.InMemoryRegistry();
        registry.add(buildPairWithSource(FIRST_TIME, 100.0, 1));
        registry.add(buildPairWithSource(FIRST_TIME + TEN_MINUTES, 100.3, 2));

        final File tracksFile = new File(temporaryFolder.getRoot(), "tracks.jsonl");
        try (final JsonLinesRecordSink sink = new JsonLinesRecordSink(tracksFile.toPath())) {
            buildPipeline(registry, new InMemoryCatalog(Collections.emptyList())).run(null, sink);
        }

        final List<String> lines = Files.readAllLines(tracksFile.toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals("bad line count", 1, lines.size());

        final JsonNode record = JsonUtils.FAST_MAPPER.readTree(lines.get(0));
        Assert.assertTrue("bad track id", record.get("trackId").asText().startsWith("track_"));
        Assert.assertEquals("bad state", "CONFIRMED", record.get("state").asText());
        Assert.assertEquals("bad validation outcome", "UNMATCHED", record.get("validationOutcome").asText());
        Assert.assertEquals("bad observation count", 2, record.get("observations").size());
        Assert.assertEquals("bad ra", SyntheticSky.FIELD_CENTER.getRa(), record.get("ra").asDouble(), 1.0e-3);
    }

    private static TransientPipeline buildPipeline(final ImageRegistry registry,
                                                   final InMemoryCatalog catalog)
            throws Exception {
        final DetectionPipelineParameters parameters = PairDetectionFunctionTest.buildParameters(5.0, 4);
        return new TransientPipeline(parameters,
                                     registry,
                                     catalog,
                                     TrackAggregator.buildArtifactPolicies(parameters.track));
    }

    private static ImagePair buildPairWithSource(final long observationTime,
                                                 final double sourceX,
                                                 final long seed) {
        final ImagePairId pairId = SyntheticSky.buildPairId(observationTime);
        return new ImagePair(pairId, buildScience(pairId, sourceX, seed), buildReference(pairId));
    }

    private static Exposure buildScience(final ImagePairId pairId,
                                         final double sourceX,
                                         final long seed) {
        final FloatProcessor science = SyntheticSky.buildNoise(200, 200, BACKGROUND, 1.0, new Random(seed));
        SyntheticSky.addGaussianSource(science, sourceX, 100.0, 500.0, 1.0);
        final WorldCoordinateMapping mapping = SyntheticSky.buildMapping();
        return SyntheticSky.buildExposure("sci-" + pairId.getObservationTime(), pairId, science, mapping);
    }

    private static Exposure buildReference(final ImagePairId pairId) {
        return SyntheticSky.buildExposure("ref", pairId,
                                          SyntheticSky.buildConstant(200, 200, BACKGROUND),
                                          SyntheticSky.buildMapping());
    }
}
