package org.janelia.transients.client.spark;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;

import org.janelia.transients.pipeline.BatchDiagnostics;
import org.janelia.transients.pipeline.TransientPipeline;
import org.janelia.transients.pipeline.UnitOfWorkRunner;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.FailureCategory;
import org.janelia.transients.track.EventTrack;
import org.janelia.transients.track.SpatialPartitionKey;
import org.janelia.transients.track.TrackAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializable outcome of merging one candidate group into tracks on a Spark executor.
 */
public class PartitionMergeResult
        implements Serializable {

    private final SpatialPartitionKey key;
    private final List<EventTrack> tracks;
    private final FailureCategory failureCategory;
    private final String failureMessage;
    private final int attemptCount;
    private final int timeoutCount;

    public PartitionMergeResult(final UnitOfWorkRunner.UnitOutcome<SpatialPartitionKey, List<EventTrack>> outcome) {
        this.key = outcome.getKey();
        this.attemptCount = outcome.getAttemptCount();
        this.timeoutCount = outcome.getTimeoutCount();
        if (outcome.isSuccess()) {
            this.tracks = outcome.getResult();
            this.failureCategory = null;
            this.failureMessage = null;
        } else {
            this.tracks = Collections.emptyList();
            this.failureCategory = BatchDiagnostics.categorize(outcome.getFailure());
            this.failureMessage = String.valueOf(outcome.getFailure().getMessage());
        }
    }

    /**
     * Merges each group with retries and a per-attempt timeout.
     *
     * @return one result per group, in key order.
     */
    public static List<PartitionMergeResult> mergeAll(final SortedMap<SpatialPartitionKey, List<Candidate>> groups,
                                                      final TrackAggregator aggregator,
                                                      final long batchEndTime,
                                                      final long timeoutMilliseconds,
                                                      final int maxUnitAttempts) {

        final List<PartitionMergeResult> results = new ArrayList<>(groups.size());

        try (final UnitOfWorkRunner runner =
                     new UnitOfWorkRunner(1,
                                          timeoutMilliseconds,
                                          maxUnitAttempts,
                                          TransientPipeline::isRetryable)) {
            for (final UnitOfWorkRunner.UnitOutcome<SpatialPartitionKey, List<EventTrack>> outcome :
                    runner.runAll(new ArrayList<>(groups.keySet()),
                                  key -> aggregator.aggregate(groups.get(key), batchEndTime))) {
                if (! outcome.isSuccess()) {
                    LOG.warn("mergeAll: failed to merge partition {}", outcome.getKey(), outcome.getFailure());
                }
                results.add(new PartitionMergeResult(outcome));
            }
        }

        return results;
    }

    public SpatialPartitionKey getKey() {
        return key;
    }

    public List<EventTrack> getTracks() {
        return tracks;
    }

    public boolean isSuccess() {
        return failureCategory == null;
    }

    public FailureCategory getFailureCategory() {
        return failureCategory;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public int getTimeoutCount() {
        return timeoutCount;
    }

    /**
     * Adds this outcome to the batch diagnostics.
     */
    public void recordIn(final BatchDiagnostics diagnostics) {
        diagnostics.recordTimeouts(timeoutCount);
        if (isSuccess()) {
            diagnostics.recordPartitionSuccess(attemptCount);
        } else {
            diagnostics.recordPartitionFailure(key.toString(), failureCategory, failureMessage, attemptCount);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PartitionMergeResult.class);
}
