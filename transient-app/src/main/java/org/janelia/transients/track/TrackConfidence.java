package org.janelia.transients.track;

import org.janelia.transients.spec.Candidate;

/**
 * Scores a track in [0, 1] from the number of linked candidates and their combined significance.
 * Rejected tracks score 0.
 */
public class TrackConfidence {

    public static double calculate(final EventTrack track,
                                   final double detectionThreshold) {

        if (track.getState() == TrackState.REJECTED) {
            return 0.0;
        }

        double sumOfSquares = 0.0;
        for (final Candidate candidate : track.getCandidates()) {
            sumOfSquares += candidate.getPeakSignificance() * candidate.getPeakSignificance();
        }
        final double combinedSignificance = Math.sqrt(sumOfSquares);
        final int n = track.getCandidateCount();

        return (1.0 - Math.exp(-n / 2.0)) * (1.0 - Math.exp(-combinedSignificance / (2.0 * detectionThreshold)));
    }

    private TrackConfidence() {
    }
}
