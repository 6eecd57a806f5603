package org.janelia.transients.client.spark;

import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import org.janelia.transients.client.ClientRunner;
import org.janelia.transients.client.parameter.BatchInputParameters;
import org.janelia.transients.client.parameter.CommandLineParameters;
import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.janelia.transients.pipeline.BatchAbortedException;
import org.janelia.transients.pipeline.BatchDiagnostics;
import org.janelia.transients.pipeline.BatchResult;
import org.janelia.transients.pipeline.JsonLinesRecordSink;
import org.janelia.transients.pipeline.PairDetectionFunction;
import org.janelia.transients.pipeline.TransientPipeline;
import org.janelia.transients.pipeline.UnitOfWorkRunner;
import org.janelia.transients.registry.FitsImageRegistry;
import org.janelia.transients.registry.RegistryUnavailableException;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.track.EventTrack;
import org.janelia.transients.track.PartitionPlanner;
import org.janelia.transients.track.SpatialPartitionKey;
import org.janelia.transients.track.TrackAggregator;
import org.janelia.transients.util.FileUtil;
import org.janelia.transients.util.ProcessTimer;
import org.janelia.transients.validate.InMemoryCatalog;
import org.janelia.transients.validate.TrackValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import scala.Tuple2;

/**
 * Spark client for running a transient detection batch over a FITS manifest on a cluster.
 * <p>
 * Pairs are detected on executors (each executor reads FITS files directly, so the manifest paths
 * must be visible to every node). Candidate partition groups are planned on the driver, candidates
 * are shuffled by group key and merged into tracks on executors, and tracks are validated on the driver.
 */
public class SparkTransientDetectionClient
        implements Serializable {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public BatchInputParameters input = new BatchInputParameters();

        @ParametersDelegate
        public DetectionPipelineParameters detection = new DetectionPipelineParameters();

        public DetectionPipelineParameters getDetectionParameters()
                throws IOException {
            return input.parametersJson == null ?
                   detection : DetectionPipelineParameters.fromJsonFile(input.parametersJson);
        }
    }

    /** Run the client with command line parameters. */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {
                final Parameters parameters = new Parameters();
                parameters.parse(args);
                final SparkTransientDetectionClient client = new SparkTransientDetectionClient();
                client.createContextAndRun(parameters);
            }
        };
        clientRunner.run();
    }

    public SparkTransientDetectionClient() {
    }

    /** Create a spark context and run the client with the specified parameters. */
    public void createContextAndRun(final Parameters clientParameters)
            throws IOException {
        final SparkConf conf = new SparkConf().setAppName(getClass().getSimpleName());
        try (final JavaSparkContext sparkContext = new JavaSparkContext(conf)) {
            LogUtilities.logSparkClusterInfo(sparkContext);
            run(sparkContext, clientParameters);
        }
    }

    /** Run the client with the specified spark context and parameters. */
    public BatchResult run(final JavaSparkContext sparkContext,
                           final Parameters clientParameters)
            throws IOException {

        LOG.info("run: entry, clientParameters={}", clientParameters);

        final ProcessTimer timer = new ProcessTimer();

        clientParameters.input.validate();
        final DetectionPipelineParameters detection = clientParameters.getDetectionParameters();
        detection.validate();

        final String manifestPath = clientParameters.input.manifest;
        final long maxCachedReferences = clientParameters.input.maxCachedReferences;
        final BatchDiagnostics diagnostics = new BatchDiagnostics();

        final List<ImagePairId> pairIds;
        try {
            pairIds = FitsImageRegistry.fromManifestFile(manifestPath, maxCachedReferences).listImagePairIds();
        } catch (final RegistryUnavailableException e) {
            diagnostics.setAbortReason(e.getMessage());
            saveDiagnostics(clientParameters.input, diagnostics);
            throw new BatchAbortedException("failed to list image pairs", e, diagnostics);
        }

        // map stage
        final PairDetectionFunction detectionFunction = new PairDetectionFunction(detection);
        final long timeoutMilliseconds = detection.execution.unitTimeoutSeconds * 1000L;
        final int maxUnitAttempts = detection.execution.maxUnitAttempts;

        final JavaRDD<ImagePairId> rddPairIds = sparkContext.parallelize(pairIds);
        final JavaRDD<PairDetectionResult> rddResults = rddPairIds.mapPartitions(pairIdIterator -> {

            final List<ImagePairId> partitionPairIds = new ArrayList<>();
            pairIdIterator.forEachRemaining(partitionPairIds::add);

            final FitsImageRegistry registry = FitsImageRegistry.fromManifestFile(manifestPath, maxCachedReferences);
            final List<PairDetectionResult> results = new ArrayList<>(partitionPairIds.size());

            try (final UnitOfWorkRunner runner =
                         new UnitOfWorkRunner(1,
                                              timeoutMilliseconds,
                                              maxUnitAttempts,
                                              TransientPipeline::isRetryable)) {
                for (final UnitOfWorkRunner.UnitOutcome<ImagePairId, List<Candidate>> outcome :
                        runner.runAll(partitionPairIds, pairId -> {
                            LogUtilities.setupExecutorLog(pairId.toString());
                            try {
                                return detectionFunction.detect(registry, pairId);
                            } finally {
                                LogUtilities.clearExecutorLog();
                            }
                        })) {
                    results.add(new PairDetectionResult(outcome));
                }
            }

            return results.iterator();
        });

        rddResults.cache();

        final List<PairDetectionResult> results = rddResults.collect();
        for (final PairDetectionResult result : results) {
            if (result.isRegistryUnavailable()) {
                diagnostics.setAbortReason(result.getFailureMessage());
                saveDiagnostics(clientParameters.input, diagnostics);
                throw new BatchAbortedException("registry unavailable while fetching " + result.getPairId(),
                                                null,
                                                diagnostics);
            }
            result.recordIn(diagnostics);
        }

        final List<Candidate> candidates = new ArrayList<>();
        long batchEndTime = Long.MIN_VALUE;
        for (final PairDetectionResult result : results) {
            for (final Candidate candidate : result.getCandidates()) {
                candidates.add(candidate);
                batchEndTime = Math.max(batchEndTime, candidate.getObservationTime());
            }
        }

        LOG.info("run: map stage produced {} candidates from {} of {} pairs, elapsed time is {}",
                 candidates.size(), diagnostics.getProcessedPairCount(), pairIds.size(), timer);

        // partition then merge
        final Map<String, SpatialPartitionKey> groupKeys = new PartitionPlanner(detection.track).planGroupKeys(candidates);
        final Broadcast<Map<String, SpatialPartitionKey>> broadcastGroupKeys = sparkContext.broadcast(groupKeys);

        final TrackAggregator aggregator = new TrackAggregator(detection.track,
                                                               detection.extraction.detectionThreshold,
                                                               TrackAggregator.buildArtifactPolicies(detection.track));
        final long finalBatchEndTime = batchEndTime;

        final JavaRDD<Candidate> rddCandidates = rddResults.flatMap(result -> result.getCandidates().iterator());

        final JavaRDD<PartitionMergeResult> rddMergeResults = rddCandidates
                .mapToPair(candidate -> new Tuple2<>(broadcastGroupKeys.value().get(candidate.getCandidateId()),
                                                     candidate))
                .groupByKey()
                .mapPartitions(groupIterator -> {
                    final SortedMap<SpatialPartitionKey, List<Candidate>> groups = new TreeMap<>();
                    groupIterator.forEachRemaining(group -> {
                        final List<Candidate> groupList = new ArrayList<>();
                        group._2().forEach(groupList::add);
                        groups.put(group._1(), groupList);
                    });
                    return PartitionMergeResult.mergeAll(groups,
                                                         aggregator,
                                                         finalBatchEndTime,
                                                         timeoutMilliseconds,
                                                         maxUnitAttempts).iterator();
                });

        final List<PartitionMergeResult> mergeResults = new ArrayList<>(rddMergeResults.collect());
        mergeResults.sort((a, b) -> a.getKey().compareTo(b.getKey()));

        final List<EventTrack> tracks = new ArrayList<>();
        for (final PartitionMergeResult mergeResult : mergeResults) {
            tracks.addAll(mergeResult.getTracks());
            mergeResult.recordIn(diagnostics);
        }

        LOG.info("run: merge stage produced {} tracks from {} of {} partitions, elapsed time is {}",
                 tracks.size(), diagnostics.getProcessedPartitionCount(), mergeResults.size(), timer);

        rddResults.unpersist();

        // validate on the driver
        final InMemoryCatalog catalog = InMemoryCatalog.fromJsonFile(clientParameters.input.catalog);
        final List<String> expectedEntryIds = clientParameters.input.expectedEntries == null ?
                                              null : FileUtil.loadJsonArrayFile(clientParameters.input.expectedEntries,
                                                                                String.class);
        final BatchResult batchResult;
        try (final JsonLinesRecordSink sink = new JsonLinesRecordSink(Paths.get(clientParameters.input.tracksOutput))) {
            batchResult = TransientPipeline.validateAndWrite(tracks,
                                                             new TrackValidator(detection.validation, catalog),
                                                             expectedEntryIds,
                                                             sink,
                                                             diagnostics);
        }

        diagnostics.setElapsedMilliseconds(timer.getElapsedMilliseconds());
        saveDiagnostics(clientParameters.input, diagnostics);

        LOG.info("run: exit, {}, {}, elapsed time is {}", diagnostics, diagnostics.getValidationMetrics(), timer);

        return batchResult;
    }

    private static void saveDiagnostics(final BatchInputParameters input,
                                        final BatchDiagnostics diagnostics)
            throws IOException {
        if (input.diagnosticsOutput != null) {
            FileUtil.saveJsonFile(input.diagnosticsOutput, diagnostics);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SparkTransientDetectionClient.class);
}
