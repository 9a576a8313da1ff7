package dev.devanks.voltedge.pipeline.exception;

/**
 * A function payload value that cannot be interpreted. Configuration problems are not reported with this type.
 */
public class InvalidPayloadException extends IllegalArgumentException {
    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
