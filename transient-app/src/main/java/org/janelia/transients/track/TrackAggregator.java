package org.janelia.transients.track;

import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.janelia.transients.parameters.TrackParameters;
import org.janelia.transients.spec.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links the candidates of one partition group into event tracks.
 * <p>
 * Candidates are processed in observation time order. Each candidate links to the open track
 * nearest to it (ties broken by earliest track creation) whose representative coordinate is within
 * the link tolerance, provided no other candidate from the same image pair is already linked and
 * every linked candidate stays within tolerance of the updated coordinate. Otherwise the candidate
 * starts a new track. Tracks that go longer than the maximum time gap without a link accept no further
 * candidates; CONFIRMED ones expire.
 * <p>
 * Instances hold no per-group state, so one aggregator can merge different groups concurrently
 * (or be shipped to remote executors).
 */
public class TrackAggregator
        implements Serializable {

    private final double linkToleranceArcsec;
    private final long maxTimeGapMilliseconds;
    private final double detectionThreshold;
    private final List<ArtifactPolicy> artifactPolicies;

    public TrackAggregator(final TrackParameters parameters,
                           final double detectionThreshold,
                           final List<ArtifactPolicy> artifactPolicies) {
        this.linkToleranceArcsec = parameters.linkToleranceArcsec;
        this.maxTimeGapMilliseconds = parameters.getMaxTimeGapMilliseconds();
        this.detectionThreshold = detectionThreshold;
        this.artifactPolicies = new ArrayList<>(artifactPolicies);
    }

    /**
     * @return spread policy plus (when a bad pixel region file is configured) bad pixel region policy.
     *
     * @throws IOException
     *   if the bad pixel region file cannot be loaded.
     */
    public static List<ArtifactPolicy> buildArtifactPolicies(final TrackParameters parameters)
            throws IOException {
        final List<ArtifactPolicy> policies = new ArrayList<>();
        policies.add(new SpatialSpreadPolicy(parameters.maxSpreadArcsec));
        if (parameters.badPixelRegionsJson != null) {
            policies.add(BadPixelRegionPolicy.fromJsonFile(parameters.badPixelRegionsJson));
        }
        return policies;
    }

    /**
     * Aggregates candidates using the latest candidate observation time as the end of the batch.
     */
    public List<EventTrack> aggregate(final Collection<Candidate> candidates) {
        long batchEndTime = Long.MIN_VALUE;
        for (final Candidate candidate : candidates) {
            batchEndTime = Math.max(batchEndTime, candidate.getObservationTime());
        }
        return aggregate(candidates, batchEndTime);
    }

    /**
     * @param  candidates    all candidates of one partition group (in any order).
     * @param  batchEndTime  latest observation time of the whole batch, open tracks whose last
     *                       detection is more than the maximum gap before it are expired.
     *
     * @return tracks in creation order.
     */
    public List<EventTrack> aggregate(final Collection<Candidate> candidates,
                                      final long batchEndTime) {

        final List<Candidate> sortedCandidates = new ArrayList<>(candidates);
        sortedCandidates.sort(PartitionPlanner.TIME_ORDER);

        final List<EventTrack> tracks = new ArrayList<>();
        final List<EventTrack> openTracks = new ArrayList<>();

        for (final Candidate candidate : sortedCandidates) {

            expireStaleTracks(openTracks, candidate.getObservationTime());

            final EventTrack track = findLinkableTrack(openTracks, candidate);
            if (track == null) {
                final EventTrack newTrack = new EventTrack("track_" + candidate.getCandidateId(),
                                                           tracks.size(),
                                                           candidate);
                tracks.add(newTrack);
                openTracks.add(newTrack);
            } else {
                track.add(candidate);
                if (track.getState() == TrackState.NEW) {
                    track.setState(TrackState.CONFIRMED);
                }
                LOG.debug("aggregate: linked {} to {}", candidate.getCandidateId(), track.getTrackId());
            }
        }

        expireStaleTracks(openTracks, batchEndTime);

        int rejectedCount = 0;
        for (final EventTrack track : tracks) {
            if (! track.isOpen()) {
                continue;
            }
            for (final ArtifactPolicy policy : artifactPolicies) {
                final String artifact = policy.findArtifact(track);
                if (artifact != null) {
                    track.reject(artifact);
                    rejectedCount++;
                    LOG.debug("aggregate: rejected {}, {}", track.getTrackId(), artifact);
                    break;
                }
            }
        }

        for (final EventTrack track : tracks) {
            track.setConfidence(TrackConfidence.calculate(track, detectionThreshold));
        }

        LOG.debug("aggregate: built {} tracks from {} candidates, rejected {}",
                  tracks.size(), sortedCandidates.size(), rejectedCount);

        return tracks;
    }

    /**
     * Stops linking to tracks whose last detection is more than the maximum gap before the specified time.
     * Stale CONFIRMED tracks expire. Stale NEW tracks keep their state so that single detections are still validated.
     */
    private void expireStaleTracks(final List<EventTrack> openTracks,
                                   final long time) {
        openTracks.removeIf(track -> {
            final boolean stale = (time - track.getLastDetectionTime()) > maxTimeGapMilliseconds;
            if (stale) {
                if (track.getState() == TrackState.CONFIRMED) {
                    track.setState(TrackState.EXPIRED);
                }
                LOG.debug("expireStaleTracks: closed {} in state {}, last detection {}, current time {}",
                          track.getTrackId(), track.getState(), track.getLastDetectionTime(), time);
            }
            return stale;
        });
    }

    private EventTrack findLinkableTrack(final List<EventTrack> openTracks,
                                         final Candidate candidate) {

        final List<TrackDistance> qualifying = new ArrayList<>();
        for (final EventTrack track : openTracks) {
            if (! track.hasCandidateFrom(candidate.getSourcePairId())) {
                final double separation = track.separationArcsec(candidate);
                if (separation <= linkToleranceArcsec) {
                    qualifying.add(new TrackDistance(track, separation));
                }
            }
        }

        qualifying.sort(NEAREST_FIRST);

        for (final TrackDistance trackDistance : qualifying) {
            if (trackDistance.track.acceptsWithin(candidate, linkToleranceArcsec)) {
                return trackDistance.track;
            }
        }

        return null;
    }

    private static class TrackDistance {
        private final EventTrack track;
        private final double separation;

        TrackDistance(final EventTrack track,
                      final double separation) {
            this.track = track;
            this.separation = separation;
        }
    }

    private static final Comparator<TrackDistance> NEAREST_FIRST =
            Comparator.comparingDouble((TrackDistance td) -> td.separation)
                    .thenComparingLong(td -> td.track.getCreationSequence());

    private static final Logger LOG = LoggerFactory.getLogger(TrackAggregator.class);
}
