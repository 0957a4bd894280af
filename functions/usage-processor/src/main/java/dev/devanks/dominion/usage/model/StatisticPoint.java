package dev.devanks.dominion.usage.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A point of the long-term cumulative series. {@code sum} includes this point's {@code state}.
 */
@Value
@Builder
public class StatisticPoint {
    Instant start;
    double state;
    double sum;
}
