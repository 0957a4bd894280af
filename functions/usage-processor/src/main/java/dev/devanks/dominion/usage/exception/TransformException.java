package dev.devanks.dominion.usage.exception;

/**
 * Raised when a time-of-day column or date cannot be turned into a timestamp.
 */
public class TransformException extends UsageProcessingException {

    public TransformException(String message) {
        super(ErrorKind.TRANSFORM, message);
    }

    public TransformException(String message, Throwable cause) {
        super(ErrorKind.TRANSFORM, message, cause);
    }
}
