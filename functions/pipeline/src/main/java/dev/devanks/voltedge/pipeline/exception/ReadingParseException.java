package dev.devanks.voltedge.pipeline.exception;

import lombok.Getter;

/**
 * A raw row could not be parsed. Fatal for the whole batch.
 */
@Getter
public class ReadingParseException extends PipelineException {

    private final long lineNumber;

    public ReadingParseException(long lineNumber, String message) {
        super(formatMessage(lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public ReadingParseException(long lineNumber, String message, Throwable cause) {
        super(formatMessage(lineNumber, message), cause);
        this.lineNumber = lineNumber;
    }

    private static String formatMessage(long lineNumber, String message) {
        return "Line " + lineNumber + ": " + message;
    }
}
