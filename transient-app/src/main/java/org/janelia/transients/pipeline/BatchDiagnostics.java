package org.janelia.transients.pipeline;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

import org.janelia.transients.spec.DataQualityException;
import org.janelia.transients.spec.FailureCategory;
import org.janelia.transients.track.EventTrack;
import org.janelia.transients.track.TrackState;
import org.janelia.transients.validate.ValidationMetrics;

/**
 * Batch level counts of processed units, failures by category, retries, and tracks.
 * Instances are filled by the batch driver thread only.
 */
public class BatchDiagnostics
        implements Serializable {

    /**
     * Final failure of one pair or partition unit.
     */
    public static class UnitFailure
            implements Serializable {

        private final String unitId;
        private final FailureCategory category;
        private final String message;
        private final int attemptCount;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private UnitFailure() {
            this(null, null, null, 0);
        }

        public UnitFailure(final String unitId,
                           final FailureCategory category,
                           final String message,
                           final int attemptCount) {
            this.unitId = unitId;
            this.category = category;
            this.message = message;
            this.attemptCount = attemptCount;
        }

        public String getUnitId() {
            return unitId;
        }

        public FailureCategory getCategory() {
            return category;
        }

        public String getMessage() {
            return message;
        }

        public int getAttemptCount() {
            return attemptCount;
        }
    }

    private int pairCount;
    private int processedPairCount;
    private int candidateCount;
    private int partitionCount;
    private int processedPartitionCount;
    private int trackCount;
    private int retriedUnitCount;
    private int timedOutAttemptCount;
    private final Map<FailureCategory, Integer> failureCounts;
    private final Map<TrackState, Integer> trackStateCounts;
    private final List<UnitFailure> failures;
    private final List<String> pairsFlaggedForReview;
    private ValidationMetrics validationMetrics;
    private String abortReason;
    private long elapsedMilliseconds;

    public BatchDiagnostics() {
        this.failureCounts = new EnumMap<>(FailureCategory.class);
        this.trackStateCounts = new EnumMap<>(TrackState.class);
        this.failures = new ArrayList<>();
        this.pairsFlaggedForReview = new ArrayList<>();
    }

    public void recordPairSuccess(final int pairCandidateCount,
                                  final int attemptCount) {
        pairCount++;
        processedPairCount++;
        candidateCount += pairCandidateCount;
        recordAttempts(attemptCount);
    }

    public void recordPairFailure(final String pairId,
                                  final Throwable failure,
                                  final int attemptCount) {
        recordPairFailure(pairId, categorize(failure), getMessage(failure), attemptCount);
    }

    /**
     * Photometric failures are also flagged for manual review.
     */
    public void recordPairFailure(final String pairId,
                                  final FailureCategory category,
                                  final String message,
                                  final int attemptCount) {
        pairCount++;
        recordFailure(pairId, category, message, attemptCount);
        if (category == FailureCategory.PHOTOMETRIC) {
            pairsFlaggedForReview.add(pairId);
        }
    }

    public void recordPartitionSuccess(final int attemptCount) {
        partitionCount++;
        processedPartitionCount++;
        recordAttempts(attemptCount);
    }

    public void recordPartitionFailure(final String partitionId,
                                       final Throwable failure,
                                       final int attemptCount) {
        recordPartitionFailure(partitionId, categorize(failure), getMessage(failure), attemptCount);
    }

    public void recordPartitionFailure(final String partitionId,
                                       final FailureCategory category,
                                       final String message,
                                       final int attemptCount) {
        partitionCount++;
        recordFailure(partitionId, category, message, attemptCount);
    }

    public void recordTimeouts(final int timeoutCount) {
        timedOutAttemptCount += timeoutCount;
    }

    public void recordTracks(final List<EventTrack> tracks) {
        trackCount += tracks.size();
        for (final EventTrack track : tracks) {
            trackStateCounts.merge(track.getState(), 1, Integer::sum);
        }
    }

    public void setValidationMetrics(final ValidationMetrics validationMetrics) {
        this.validationMetrics = validationMetrics;
    }

    public void setAbortReason(final String abortReason) {
        this.abortReason = abortReason;
    }

    public void setElapsedMilliseconds(final long elapsedMilliseconds) {
        this.elapsedMilliseconds = elapsedMilliseconds;
    }

    public int getPairCount() {
        return pairCount;
    }

    public int getProcessedPairCount() {
        return processedPairCount;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getPartitionCount() {
        return partitionCount;
    }

    public int getProcessedPartitionCount() {
        return processedPartitionCount;
    }

    public int getTrackCount() {
        return trackCount;
    }

    public int getRetriedUnitCount() {
        return retriedUnitCount;
    }

    public int getTimedOutAttemptCount() {
        return timedOutAttemptCount;
    }

    public int getFailureCount(final FailureCategory category) {
        return failureCounts.getOrDefault(category, 0);
    }

    public int getTotalFailureCount() {
        return failures.size();
    }

    public int getTrackCount(final TrackState state) {
        return trackStateCounts.getOrDefault(state, 0);
    }

    public List<UnitFailure> getFailures() {
        return failures;
    }

    public List<String> getPairsFlaggedForReview() {
        return pairsFlaggedForReview;
    }

    public ValidationMetrics getValidationMetrics() {
        return validationMetrics;
    }

    public String getAbortReason() {
        return abortReason;
    }

    public long getElapsedMilliseconds() {
        return elapsedMilliseconds;
    }

    public boolean hasPartialFailures() {
        return ! failures.isEmpty();
    }

    /**
     * @return failure counts keyed by category name, for logging.
     */
    public Map<String, Integer> getFailureCountsByName() {
        final Map<String, Integer> counts = new TreeMap<>();
        failureCounts.forEach((category, count) -> counts.put(category.name(), count));
        return counts;
    }

    @Override
    public String toString() {
        return "{\"pairCount\": " + pairCount + ", \"processedPairCount\": " + processedPairCount +
               ", \"candidateCount\": " + candidateCount + ", \"partitionCount\": " + partitionCount +
               ", \"trackCount\": " + trackCount + ", \"failures\": " + getFailureCountsByName() +
               ", \"retriedUnitCount\": " + retriedUnitCount + ", \"timedOutAttemptCount\": " + timedOutAttemptCount +
               '}';
    }

    /**
     * @return category for a unit failure, based on the exception that ended the unit.
     */
    public static FailureCategory categorize(final Throwable failure) {
        final FailureCategory category;
        if (failure instanceof DataQualityException) {
            category = ((DataQualityException) failure).getCategory();
        } else if (failure instanceof TimeoutException) {
            category = FailureCategory.TIMEOUT;
        } else {
            category = FailureCategory.UNEXPECTED;
        }
        return category;
    }

    private void recordAttempts(final int attemptCount) {
        if (attemptCount > 1) {
            retriedUnitCount++;
        }
    }

    private void recordFailure(final String unitId,
                               final FailureCategory category,
                               final String message,
                               final int attemptCount) {
        failureCounts.merge(category, 1, Integer::sum);
        failures.add(new UnitFailure(unitId, category, message, attemptCount));
        recordAttempts(attemptCount);
    }

    private static String getMessage(final Throwable failure) {
        return failure == null ? null : String.valueOf(failure.getMessage());
    }
}
