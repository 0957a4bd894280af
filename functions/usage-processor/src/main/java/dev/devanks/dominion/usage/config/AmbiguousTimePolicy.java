package dev.devanks.dominion.usage.config;

/**
 * Which instant a wall-clock time repeated by a fall-back transition resolves to.
 */
public enum AmbiguousTimePolicy {
    EARLIEST,
    LATEST
}
