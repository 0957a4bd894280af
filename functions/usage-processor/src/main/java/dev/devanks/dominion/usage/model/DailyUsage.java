package dev.devanks.dominion.usage.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.ZonedDateTime;

@Value
@Builder
public class DailyUsage {
    LocalDate date;
    double totalEnergyKwh;
    double avgPowerKw;
    double peakPowerKw;
    ZonedDateTime peakPowerTime;
    int dataPoints;
}
