package org.janelia.transients.validate;

import java.io.Serializable;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Batch level cross-match counts and derived precision, recall, and accuracy.
 * Ratios with a zero denominator (and recall when no expected entries are known) are null.
 */
public class ValidationMetrics
        implements Serializable {

    private final int matchedCount;
    private final int unmatchedCount;
    private final int unavailableCount;
    private final int notValidatedCount;
    private final Integer expectedCount;
    private final Integer expectedMatchedCount;
    private final Double precision;
    private final Double recall;
    private final Double accuracy;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ValidationMetrics() {
        this(0, 0, 0, 0, null, null);
    }

    private ValidationMetrics(final int matchedCount,
                              final int unmatchedCount,
                              final int unavailableCount,
                              final int notValidatedCount,
                              final Integer expectedCount,
                              final Integer expectedMatchedCount) {
        this.matchedCount = matchedCount;
        this.unmatchedCount = unmatchedCount;
        this.unavailableCount = unavailableCount;
        this.notValidatedCount = notValidatedCount;
        this.expectedCount = expectedCount;
        this.expectedMatchedCount = expectedMatchedCount;

        final int validatedCount = matchedCount + unmatchedCount;
        this.precision = validatedCount > 0 ? (double) matchedCount / validatedCount : null;

        if ((expectedCount != null) && (expectedCount > 0)) {
            this.recall = (double) expectedMatchedCount / expectedCount;
        } else {
            this.recall = null;
        }

        final int missedCount = expectedCount == null ? 0 : expectedCount - expectedMatchedCount;
        final int accuracyDenominator = validatedCount + missedCount;
        this.accuracy = accuracyDenominator > 0 ? (double) matchedCount / accuracyDenominator : null;
    }

    /**
     * @param  results           validation results for the batch.
     * @param  expectedEntryIds  catalog entries the batch should have found, or null if unknown.
     */
    public static ValidationMetrics fromResults(final List<ValidationResult> results,
                                                final Collection<String> expectedEntryIds) {
        int matched = 0;
        int unmatched = 0;
        int unavailable = 0;
        int notValidated = 0;
        final Set<String> matchedEntryIds = new HashSet<>();
        for (final ValidationResult result : results) {
            switch (result.getOutcome()) {
                case MATCHED:
                    matched++;
                    matchedEntryIds.add(result.getMatchedEntryId());
                    break;
                case UNMATCHED:
                    unmatched++;
                    break;
                case VALIDATION_UNAVAILABLE:
                    unavailable++;
                    break;
                default:
                    notValidated++;
                    break;
            }
        }

        Integer expectedCount = null;
        Integer expectedMatchedCount = null;
        if (expectedEntryIds != null) {
            final Set<String> expected = new HashSet<>(expectedEntryIds);
            expectedCount = expected.size();
            expected.retainAll(matchedEntryIds);
            expectedMatchedCount = expected.size();
        }

        return new ValidationMetrics(matched, unmatched, unavailable, notValidated, expectedCount, expectedMatchedCount);
    }

    public int getMatchedCount() {
        return matchedCount;
    }

    public int getUnmatchedCount() {
        return unmatchedCount;
    }

    public int getUnavailableCount() {
        return unavailableCount;
    }

    public int getNotValidatedCount() {
        return notValidatedCount;
    }

    public Integer getExpectedCount() {
        return expectedCount;
    }

    public Integer getExpectedMatchedCount() {
        return expectedMatchedCount;
    }

    public Double getPrecision() {
        return precision;
    }

    public Double getRecall() {
        return recall;
    }

    public Double getAccuracy() {
        return accuracy;
    }

    @Override
    public String toString() {
        return "{\"matched\": " + matchedCount + ", \"unmatched\": " + unmatchedCount +
               ", \"unavailable\": " + unavailableCount + ", \"notValidated\": " + notValidatedCount +
               ", \"precision\": " + precision + ", \"recall\": " + recall + ", \"accuracy\": " + accuracy + '}';
    }
}
