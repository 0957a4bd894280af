package dev.devanks.dominion.usage.exception;

import lombok.Getter;

/**
 * Base type for failures that abort a usage import run. Each subtype maps to one {@link ErrorKind}.
 */
@Getter
public abstract class UsageProcessingException extends RuntimeException {

    private final ErrorKind kind;

    protected UsageProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected UsageProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
