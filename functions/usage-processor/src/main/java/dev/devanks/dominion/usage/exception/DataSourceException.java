package dev.devanks.dominion.usage.exception;

/**
 * Raised when the raw export cannot be read or lacks the expected sheets.
 */
public class DataSourceException extends UsageProcessingException {

    public DataSourceException(String message) {
        super(ErrorKind.DATA_SOURCE, message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(ErrorKind.DATA_SOURCE, message, cause);
    }
}
