package org.janelia.transients.track;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.transients.spec.Candidate;
import org.janelia.transients.spec.ImagePairId;
import org.janelia.transients.spec.SkyCoordinate;

/**
 * Candidates from different image pairs believed to be the same physical transient.
 * <p>
 * The representative coordinate is the flux-weighted mean of the linked candidates' unit vectors,
 * so it is well behaved across the RA wrap and near the poles.
 * Tracks are only mutated by the {@link TrackAggregator} that created them.
 */
public class EventTrack
        implements Serializable {

    private final String trackId;
    private final long creationSequence;
    private final List<Candidate> candidates;

    private double weightedX;
    private double weightedY;
    private double weightedZ;
    private SkyCoordinate coordinate;

    private TrackState state;
    private String rejectionReason;
    private double confidence;

    EventTrack(final String trackId,
               final long creationSequence,
               final Candidate firstCandidate) {
        this.trackId = trackId;
        this.creationSequence = creationSequence;
        this.candidates = new ArrayList<>();
        this.state = TrackState.NEW;
        this.confidence = 0.0;
        add(firstCandidate);
    }

    public String getTrackId() {
        return trackId;
    }

    public long getCreationSequence() {
        return creationSequence;
    }

    /**
     * @return linked candidates in non-decreasing observation time order.
     */
    public List<Candidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    public int getCandidateCount() {
        return candidates.size();
    }

    public SkyCoordinate getCoordinate() {
        return coordinate;
    }

    public long getFirstDetectionTime() {
        return candidates.get(0).getObservationTime();
    }

    public long getLastDetectionTime() {
        return candidates.get(candidates.size() - 1).getObservationTime();
    }

    public TrackState getState() {
        return state;
    }

    public boolean isOpen() {
        return state.isOpen();
    }

    /**
     * @return description of the artifact pattern for rejected tracks, otherwise null.
     */
    public String getRejectionReason() {
        return rejectionReason;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean hasCandidateFrom(final ImagePairId pairId) {
        for (final Candidate candidate : candidates) {
            if (candidate.getSourcePairId().equals(pairId)) {
                return true;
            }
        }
        return false;
    }

    public double separationArcsec(final Candidate candidate) {
        return coordinate.separationArcsec(candidate.getCoordinate());
    }

    /**
     * @return root mean square separation of the linked candidates from the representative coordinate.
     */
    public double getSpreadArcsec() {
        double sum = 0.0;
        for (final Candidate candidate : candidates) {
            final double separation = separationArcsec(candidate);
            sum += separation * separation;
        }
        return Math.sqrt(sum / candidates.size());
    }

    /**
     * @return the representative coordinate this track would have if the specified candidate were linked.
     */
    SkyCoordinate getCoordinateWith(final Candidate candidate) {
        final double weight = getWeight(candidate);
        final double[] v = candidate.getCoordinate().toUnitVector();
        return SkyCoordinate.fromVector(weightedX + weight * v[0],
                                        weightedY + weight * v[1],
                                        weightedZ + weight * v[2]);
    }

    /**
     * @return true if every linked candidate and the specified candidate would lie within
     *         the tolerance of the updated representative coordinate.
     */
    boolean acceptsWithin(final Candidate candidate,
                          final double toleranceArcsec) {
        final SkyCoordinate updated = getCoordinateWith(candidate);
        if (updated.separationArcsec(candidate.getCoordinate()) > toleranceArcsec) {
            return false;
        }
        for (final Candidate linked : candidates) {
            if (updated.separationArcsec(linked.getCoordinate()) > toleranceArcsec) {
                return false;
            }
        }
        return true;
    }

    void add(final Candidate candidate) {

        if ((! candidates.isEmpty()) && (candidate.getObservationTime() < getLastDetectionTime())) {
            throw new IllegalStateException("candidate " + candidate.getCandidateId() +
                                            " is older than the last detection of track " + trackId);
        }

        final double weight = getWeight(candidate);
        final double[] v = candidate.getCoordinate().toUnitVector();
        weightedX += weight * v[0];
        weightedY += weight * v[1];
        weightedZ += weight * v[2];
        coordinate = SkyCoordinate.fromVector(weightedX, weightedY, weightedZ);

        candidates.add(candidate);
    }

    void setState(final TrackState state) {
        this.state = state;
    }

    void reject(final String reason) {
        this.state = TrackState.REJECTED;
        this.rejectionReason = reason;
    }

    void setConfidence(final double confidence) {
        this.confidence = confidence;
    }

    @Override
    public String toString() {
        return "{\"trackId\": \"" + trackId + "\", \"state\": \"" + state +
               "\", \"candidateCount\": " + candidates.size() + ", \"coordinate\": " + coordinate + '}';
    }

    /**
     * Candidates are weighted by absolute flux, with a floor so that zero flux candidates still count.
     */
    private static double getWeight(final Candidate candidate) {
        return Math.max(Math.abs(candidate.getFlux()), MIN_WEIGHT);
    }

    private static final double MIN_WEIGHT = 1.0e-9;
}
