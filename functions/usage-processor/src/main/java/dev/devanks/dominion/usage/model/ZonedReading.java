package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.time.ZonedDateTime;

@Value
public class ZonedReading {
    ZonedDateTime timestamp;
    double value;
    Metric metric;
}
