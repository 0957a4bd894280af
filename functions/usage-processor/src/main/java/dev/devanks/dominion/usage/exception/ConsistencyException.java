package dev.devanks.dominion.usage.exception;

/**
 * Raised when hourly aggregation does not preserve total energy.
 */
public class ConsistencyException extends UsageProcessingException {

    public ConsistencyException(String message) {
        super(ErrorKind.CONSISTENCY, message);
    }

    public ConsistencyException(String message, Throwable cause) {
        super(ErrorKind.CONSISTENCY, message, cause);
    }
}
