package org.janelia.transients.client.spark;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import org.janelia.transients.pipeline.BatchDiagnostics;
import org.janelia.transients.pipeline.UnitOfWorkRunner;
import org.janelia.transients.registry.RegistryUnavailableException;
import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.FailureCategory;
import org.janelia.transients.spec.ImagePairId;

/**
 * Serializable outcome of one map unit executed on a Spark executor.
 */
public class PairDetectionResult
        implements Serializable {

    private final ImagePairId pairId;
    private final List<Candidate> candidates;
    private final FailureCategory failureCategory;
    private final String failureMessage;
    private final boolean registryUnavailable;
    private final int attemptCount;
    private final int timeoutCount;

    public PairDetectionResult(final UnitOfWorkRunner.UnitOutcome<ImagePairId, List<Candidate>> outcome) {
        this.pairId = outcome.getKey();
        this.attemptCount = outcome.getAttemptCount();
        this.timeoutCount = outcome.getTimeoutCount();
        if (outcome.isSuccess()) {
            this.candidates = outcome.getResult();
            this.failureCategory = null;
            this.failureMessage = null;
            this.registryUnavailable = false;
        } else {
            this.candidates = Collections.emptyList();
            this.failureCategory = BatchDiagnostics.categorize(outcome.getFailure());
            this.failureMessage = String.valueOf(outcome.getFailure().getMessage());
            this.registryUnavailable = outcome.getFailure() instanceof RegistryUnavailableException;
        }
    }

    public ImagePairId getPairId() {
        return pairId;
    }

    public List<Candidate> getCandidates() {
        return candidates;
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

    public boolean isRegistryUnavailable() {
        return registryUnavailable;
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
            diagnostics.recordPairSuccess(candidates.size(), attemptCount);
        } else {
            diagnostics.recordPairFailure(pairId.toString(), failureCategory, failureMessage, attemptCount);
        }
    }
}
