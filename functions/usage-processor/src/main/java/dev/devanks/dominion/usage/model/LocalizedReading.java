package dev.devanks.dominion.usage.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZonedDateTime;

@Value
@Builder
public class LocalizedReading {
    ZonedDateTime timestamp;
    double powerKw;
    double energyKwh;
}
