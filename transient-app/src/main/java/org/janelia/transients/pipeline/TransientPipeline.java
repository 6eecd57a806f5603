package org.janelia.transients.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;

import org.janelia.transients.parameters.DetectionPipelineParameters;
import org.janelia.transients.registry.ImageRegistry;
import org.janelia.transients.registry.RegistryUnavailableException;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.track.ArtifactPolicy;
import org.janelia.transients.track.EventTrack;
import org.janelia.transients.track.PartitionPlanner;
import org.janelia.transients.track.SpatialPartitionKey;
import org.janelia.transients.track.TrackAggregator;
import org.janelia.transients.util.ProcessTimer;
import org.janelia.transients.validate.CatalogLookup;
import org.janelia.transients.validate.TrackValidator;
import org.janelia.transients.validate.ValidationMetrics;
import org.janelia.transients.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a detection batch on a local worker pool.
 * <p>
 * The map stage detects candidates for each image pair independently. After all pairs finish,
 * candidates are planned into partition groups and each group is merged into tracks independently.
 * Finally tracks are validated against the catalog and written to the record sink.
 * <p>
 * Pair and partition failures are counted in the batch diagnostics and never stop sibling units.
 * Only an unreachable registry aborts the batch.
 */
public class TransientPipeline {

    private final DetectionPipelineParameters parameters;
    private final ImageRegistry registry;
    private final CatalogLookup catalog;
    private final List<ArtifactPolicy> artifactPolicies;

    public TransientPipeline(final DetectionPipelineParameters parameters,
                             final ImageRegistry registry,
                             final CatalogLookup catalog,
                             final List<ArtifactPolicy> artifactPolicies) {
        this.parameters = parameters;
        this.registry = registry;
        this.catalog = catalog;
        this.artifactPolicies = artifactPolicies;
    }

    /**
     * Processes every pair the registry lists.
     *
     * @throws BatchAbortedException
     *   if the registry cannot be reached.
     */
    public BatchResult run(final Collection<String> expectedEntryIds,
                           final EventTrackRecordSink sink)
            throws IOException, BatchAbortedException {
        final List<ImagePairId> pairIds;
        try {
            pairIds = registry.listImagePairIds();
        } catch (final RegistryUnavailableException e) {
            final BatchDiagnostics diagnostics = new BatchDiagnostics();
            diagnostics.setAbortReason(e.getMessage());
            throw new BatchAbortedException("failed to list image pairs", e, diagnostics);
        }
        return run(pairIds, expectedEntryIds, sink);
    }

    /**
     * @param  pairIds           pairs to process.
     * @param  expectedEntryIds  catalog entries the batch is expected to find (for recall), or null.
     * @param  sink              receives one record per track.
     *
     * @throws IOException
     *   if records cannot be written.
     *
     * @throws BatchAbortedException
     *   if the registry cannot be reached.
     */
    public BatchResult run(final List<ImagePairId> pairIds,
                           final Collection<String> expectedEntryIds,
                           final EventTrackRecordSink sink)
            throws IOException, BatchAbortedException {

        LOG.info("run: entry, processing {} pairs", pairIds.size());

        final ProcessTimer timer = new ProcessTimer();
        final BatchDiagnostics diagnostics = new BatchDiagnostics();
        final PairDetectionFunction detectionFunction = new PairDetectionFunction(parameters);

        final List<EventTrack> tracks = new ArrayList<>();

        try (final UnitOfWorkRunner runner =
                     new UnitOfWorkRunner(parameters.execution.threads,
                                          parameters.execution.unitTimeoutSeconds * 1000L,
                                          parameters.execution.maxUnitAttempts,
                                          TransientPipeline::isRetryable)) {

            // map stage
            final List<UnitOfWorkRunner.UnitOutcome<ImagePairId, List<Candidate>>> pairOutcomes =
                    runner.runAll(pairIds, pairId -> detectionFunction.detect(registry, pairId));

            final List<Candidate> candidates = new ArrayList<>();
            for (final UnitOfWorkRunner.UnitOutcome<ImagePairId, List<Candidate>> outcome : pairOutcomes) {
                diagnostics.recordTimeouts(outcome.getTimeoutCount());
                if (outcome.isSuccess()) {
                    candidates.addAll(outcome.getResult());
                    diagnostics.recordPairSuccess(outcome.getResult().size(), outcome.getAttemptCount());
                } else if (outcome.getFailure() instanceof RegistryUnavailableException) {
                    diagnostics.setAbortReason(outcome.getFailure().getMessage());
                    diagnostics.setElapsedMilliseconds(timer.getElapsedMilliseconds());
                    LOG.error("run: aborting batch, registry unavailable while fetching {}", outcome.getKey());
                    throw new BatchAbortedException("registry unavailable while fetching " + outcome.getKey(),
                                                    outcome.getFailure(),
                                                    diagnostics);
                } else {
                    LOG.warn("run: skipping pair {}, {}",
                             outcome.getKey(), outcome.getFailure() == null ? null : outcome.getFailure().getMessage());
                    diagnostics.recordPairFailure(outcome.getKey().toString(),
                                                  outcome.getFailure(),
                                                  outcome.getAttemptCount());
                }
            }

            LOG.info("run: map stage produced {} candidates from {} of {} pairs, elapsed time is {}",
                     candidates.size(), diagnostics.getProcessedPairCount(), pairIds.size(), timer);

            // partition then merge
            long batchEndTime = Long.MIN_VALUE;
            for (final Candidate candidate : candidates) {
                batchEndTime = Math.max(batchEndTime, candidate.getObservationTime());
            }
            final long finalBatchEndTime = batchEndTime;

            final SortedMap<SpatialPartitionKey, List<Candidate>> groups =
                    new PartitionPlanner(parameters.track).plan(candidates);
            final TrackAggregator aggregator = new TrackAggregator(parameters.track,
                                                                   parameters.extraction.detectionThreshold,
                                                                   artifactPolicies);

            final List<UnitOfWorkRunner.UnitOutcome<SpatialPartitionKey, List<EventTrack>>> partitionOutcomes =
                    runner.runAll(new ArrayList<>(groups.keySet()),
                                  key -> aggregator.aggregate(groups.get(key), finalBatchEndTime));

            for (final UnitOfWorkRunner.UnitOutcome<SpatialPartitionKey, List<EventTrack>> outcome : partitionOutcomes) {
                diagnostics.recordTimeouts(outcome.getTimeoutCount());
                if (outcome.isSuccess()) {
                    tracks.addAll(outcome.getResult());
                    diagnostics.recordPartitionSuccess(outcome.getAttemptCount());
                } else {
                    LOG.warn("run: failed to merge partition {}", outcome.getKey(), outcome.getFailure());
                    diagnostics.recordPartitionFailure(outcome.getKey().toString(),
                                                       outcome.getFailure(),
                                                       outcome.getAttemptCount());
                }
            }
        }

        final BatchResult result = validateAndWrite(tracks,
                                                    new TrackValidator(parameters.validation, catalog),
                                                    expectedEntryIds,
                                                    sink,
                                                    diagnostics);

        diagnostics.setElapsedMilliseconds(timer.getElapsedMilliseconds());

        LOG.info("run: exit, {}, {}, elapsed time is {}", diagnostics, diagnostics.getValidationMetrics(), timer);

        return result;
    }

    /**
     * Validates tracks, records validation metrics and track counts in the diagnostics,
     * and writes one record per track to the sink.
     */
    public static BatchResult validateAndWrite(final List<EventTrack> tracks,
                                               final TrackValidator validator,
                                               final Collection<String> expectedEntryIds,
                                               final EventTrackRecordSink sink,
                                               final BatchDiagnostics diagnostics)
            throws IOException {

        final List<ValidationResult> validationResults = validator.validate(tracks);

        diagnostics.recordTracks(tracks);
        diagnostics.setValidationMetrics(ValidationMetrics.fromResults(validationResults, expectedEntryIds));

        for (int i = 0; i < tracks.size(); i++) {
            sink.write(new EventTrackRecord(tracks.get(i), validationResults.get(i)));
        }

        return new BatchResult(tracks, validationResults, diagnostics);
    }

    /**
     * Data quality failures repeat on every attempt and an unreachable registry must not be retried silently.
     */
    public static boolean isRetryable(final Throwable failure) {
        return ! ((failure instanceof DataQualityException) || (failure instanceof RegistryUnavailableException));
    }

    private static final Logger LOG = LoggerFactory.getLogger(TransientPipeline.class);
}
