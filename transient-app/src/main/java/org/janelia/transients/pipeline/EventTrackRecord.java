package org.janelia.transients.pipeline;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.transients.spec.Candidate;
import org.janelia.transients.track.EventTrack;
import org.janelia.transients.track.TrackState;
import org.janelia.transients.validate.ValidationOutcome;
import org.janelia.transients.validate.ValidationResult;

/**
 * Output record for one finalized event track.
 */
public class EventTrackRecord
        implements Serializable {

    /**
     * One linked candidate.
     */
    public static class Observation
            implements Serializable {

        private final long timestamp;
        private final double flux;
        private final double significance;
        private final String pairId;
        private final String candidateId;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private Observation() {
            this(0, 0, 0, null, null);
        }

        public Observation(final long timestamp,
                           final double flux,
                           final double significance,
                           final String pairId,
                           final String candidateId) {
            this.timestamp = timestamp;
            this.flux = flux;
            this.significance = significance;
            this.pairId = pairId;
            this.candidateId = candidateId;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public double getFlux() {
            return flux;
        }

        public double getSignificance() {
            return significance;
        }

        public String getPairId() {
            return pairId;
        }

        public String getCandidateId() {
            return candidateId;
        }
    }

    private final String trackId;
    private final double ra;
    private final double dec;
    private final List<Observation> observations;
    private final TrackState state;
    private final String rejectionReason;
    private final ValidationOutcome validationOutcome;
    private final String matchedEntryId;
    private final double confidence;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private EventTrackRecord() {
        this.trackId = null;
        this.ra = 0;
        this.dec = 0;
        this.observations = null;
        this.state = null;
        this.rejectionReason = null;
        this.validationOutcome = null;
        this.matchedEntryId = null;
        this.confidence = 0;
    }

    public EventTrackRecord(final EventTrack track,
                            final ValidationResult validationResult) {
        this.trackId = track.getTrackId();
        this.ra = track.getCoordinate().getRa();
        this.dec = track.getCoordinate().getDec();
        this.observations = new ArrayList<>(track.getCandidateCount());
        for (final Candidate candidate : track.getCandidates()) {
            this.observations.add(new Observation(candidate.getObservationTime(),
                                                  candidate.getFlux(),
                                                  candidate.getPeakSignificance(),
                                                  candidate.getSourcePairId().toString(),
                                                  candidate.getCandidateId()));
        }
        this.state = track.getState();
        this.rejectionReason = track.getRejectionReason();
        this.validationOutcome = validationResult.getOutcome();
        this.matchedEntryId = validationResult.getMatchedEntryId();
        this.confidence = track.getConfidence();
    }

    public String getTrackId() {
        return trackId;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public TrackState getState() {
        return state;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    public ValidationOutcome getValidationOutcome() {
        return validationOutcome;
    }

    public String getMatchedEntryId() {
        return matchedEntryId;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return trackId + ":" + state + ":" + validationOutcome;
    }
}
