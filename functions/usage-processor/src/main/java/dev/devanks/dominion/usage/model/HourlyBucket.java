package dev.devanks.dominion.usage.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;

/**
 * One hour of usage: mean power and summed energy of the intervals starting in that hour.
 */
@Value
@Builder
public class HourlyBucket {
    ZonedDateTime hourStart;
    double powerKw;
    double energyKwh;
}
