package dev.devanks.voltedge.pipeline.exception;

public class ArchiveIntegrityException extends PipelineException {
    public ArchiveIntegrityException(String message) {
        super(message);
    }

    public ArchiveIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
