package org.janelia.transients.pipeline;

import java.util.List;

import org.janelia.transients.track.EventTrack;
import org.janelia.transients.validate.ValidationResult;

/**
 * Tracks, their validation results (same order), and diagnostics for one batch.
 */
public class BatchResult {

    private final List<EventTrack> tracks;
    private final List<ValidationResult> validationResults;
    private final BatchDiagnostics diagnostics;

    public BatchResult(final List<EventTrack> tracks,
                       final List<ValidationResult> validationResults,
                       final BatchDiagnostics diagnostics) {
        this.tracks = tracks;
        this.validationResults = validationResults;
        this.diagnostics = diagnostics;
    }

    public List<EventTrack> getTracks() {
        return tracks;
    }

    public List<ValidationResult> getValidationResults() {
        return validationResults;
    }

    public BatchDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
