package org.janelia.transients.validate;

import java.util.ArrayList;
import java.util.List;

import org.janelia.transients.parameters.ValidationParameters;
import org.janelia.transients.spec.CatalogEntry;
import org.janelia.transients.track.EventTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-matches finalized tracks against a catalog.
 * <p>
 * A track matches the nearest catalog entry whose separation from the track's representative
 * coordinate is at most the match radius. Failed lookups are retried with exponential backoff;
 * once attempts are exhausted the track is tagged {@link ValidationOutcome#VALIDATION_UNAVAILABLE}
 * and validation continues with the next track.
 */
public class TrackValidator {

    /** Separations within this much of the match radius count as on the radius. */
    public static final double MATCH_EPSILON_ARCSEC = 1.0e-6;

    private final ValidationParameters parameters;
    private final CatalogLookup catalog;

    public TrackValidator(final ValidationParameters parameters,
                          final CatalogLookup catalog) {
        this.parameters = parameters;
        this.catalog = catalog;
    }

    public List<ValidationResult> validate(final List<EventTrack> tracks) {
        final List<ValidationResult> results = new ArrayList<>(tracks.size());
        for (final EventTrack track : tracks) {
            results.add(validate(track));
        }
        return results;
    }

    public ValidationResult validate(final EventTrack track) {

        if (! track.isOpen()) {
            return ValidationResult.notValidated(track.getTrackId(), "track is " + track.getState());
        }

        final double maxSeparation = parameters.matchRadiusArcsec + MATCH_EPSILON_ARCSEC;
        long backoffMillis = parameters.lookupBackoffMillis;

        ValidationLookupException lastFailure = null;
        for (int attempt = 1; attempt <= parameters.maxLookupAttempts; attempt++) {

            try {

                final List<CatalogEntry> entries = catalog.coneSearch(track.getCoordinate(),
                                                                      parameters.matchRadiusArcsec);
                CatalogEntry nearest = null;
                double nearestSeparation = Double.MAX_VALUE;
                for (final CatalogEntry entry : entries) {
                    final double separation = track.getCoordinate().separationArcsec(entry.getCoordinate());
                    if ((separation <= maxSeparation) &&
                        ((separation < nearestSeparation) ||
                         ((separation == nearestSeparation) &&
                          (entry.getEntryId().compareTo(nearest.getEntryId()) < 0)))) {
                        nearest = entry;
                        nearestSeparation = separation;
                    }
                }

                if (nearest == null) {
                    return ValidationResult.unmatched(track.getTrackId(), attempt);
                }

                LOG.debug("validate: matched {} to {} at {} arcsec",
                          track.getTrackId(), nearest.getEntryId(), nearestSeparation);

                return ValidationResult.matched(track.getTrackId(), nearest.getEntryId(), nearestSeparation, attempt);

            } catch (final ValidationLookupException e) {

                lastFailure = e;
                LOG.warn("validate: lookup attempt {} of {} failed for {}",
                         attempt, parameters.maxLookupAttempts, track.getTrackId(), e);

                if (attempt < parameters.maxLookupAttempts) {
                    try {
                        Thread.sleep(backoffMillis);
                    } catch (final InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return ValidationResult.unavailable(track.getTrackId(), attempt,
                                                            "interrupted while waiting to retry lookup");
                    }
                    backoffMillis = nextBackoffMillis(backoffMillis);
                }
            }
        }

        return ValidationResult.unavailable(track.getTrackId(),
                                            parameters.maxLookupAttempts,
                                            lastFailure == null ? null : lastFailure.getMessage());
    }

    /**
     * @return double the specified backoff, capped at one minute.
     */
    static long nextBackoffMillis(final long backoffMillis) {
        return backoffMillis >= (MAX_BACKOFF_MILLIS / 2) ? MAX_BACKOFF_MILLIS : backoffMillis * 2;
    }

    static final long MAX_BACKOFF_MILLIS = 60 * 1000L;

    private static final Logger LOG = LoggerFactory.getLogger(TrackValidator.class);
}
