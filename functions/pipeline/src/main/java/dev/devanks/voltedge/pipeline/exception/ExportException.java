package dev.devanks.voltedge.pipeline.exception;

public class ExportException extends PipelineException {
    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
