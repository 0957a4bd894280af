package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Long-format reading with a wall-clock timestamp, before any timezone is attached.
 */
@Value
public class IntervalReading {
    LocalDateTime timestamp;
    double value;
    Metric metric;
}
