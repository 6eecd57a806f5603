package org.janelia.transients.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for running units of work on a local worker pool.
 */
public class ExecutionParameters
        implements Serializable {

    @Parameter(
            names = "--threads",
            description = "Number of worker threads")
    public int threads = 4;

    @Parameter(
            names = "--unitTimeoutSeconds",
            description = "Maximum time for one attempt of a unit of work (image pair or partition)")
    public long unitTimeoutSeconds = 300;

    @Parameter(
            names = "--maxUnitAttempts",
            description = "Maximum number of attempts for a unit that times out or fails unexpectedly")
    public int maxUnitAttempts = 2;

    public ExecutionParameters() {
    }

    public void validate()
            throws IllegalArgumentException {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        if (unitTimeoutSeconds < 1) {
            throw new IllegalArgumentException("unitTimeoutSeconds must be at least 1");
        }
        if (maxUnitAttempts < 1) {
            throw new IllegalArgumentException("maxUnitAttempts must be at least 1");
        }
    }
}
