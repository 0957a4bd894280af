package dev.devanks.dominion.usage.exception;

public enum ErrorKind {
    DATA_SOURCE,
    TRANSFORM,
    CONSISTENCY,
    UNEXPECTED
}
