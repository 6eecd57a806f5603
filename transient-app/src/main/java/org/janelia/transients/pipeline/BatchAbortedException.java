package org.janelia.transients.pipeline;

/**
 * A systemic failure (for example an unreachable image registry) that stops the whole batch.
 */
public class BatchAbortedException
        extends RuntimeException {

    private final BatchDiagnostics diagnostics;

    public BatchAbortedException(final String message,
                                 final Throwable cause,
                                 final BatchDiagnostics diagnostics) {
        super(message, cause);
        this.diagnostics = diagnostics;
    }

    /**
     * @return diagnostics collected before the batch was aborted.
     */
    public BatchDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
