package dev.devanks.voltedge.pipeline.exception;

/**
 * Timestamps handed from one stage to the next are duplicated, out of order or not contiguous.
 */
public class StructuralViolationException extends PipelineException {
    public StructuralViolationException(String message) {
        super(message);
    }
}
