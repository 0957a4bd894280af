package dev.devanks.dominion.usage.transform;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.exception.ConsistencyException;
import dev.devanks.dominion.usage.model.HourlyBucket;
import dev.devanks.dominion.usage.model.LocalizedReading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Combines the :00 and :30 readings of each hour: power by mean, energy by sum.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HourlyAggregator {

    private final UsageProperties properties;

    /**
     * @throws ConsistencyException if the hourly energy total differs from the interval total
     */
    public List<HourlyBucket> aggregate(List<LocalizedReading> readings) {
        Map<Instant, List<LocalizedReading>> byHour = new TreeMap<>();
        Map<Instant, ZonedDateTime> hourStarts = new TreeMap<>();

        for (LocalizedReading reading : readings) {
            ZonedDateTime hourStart = reading.getTimestamp().truncatedTo(ChronoUnit.HOURS);
            Instant key = hourStart.toInstant();
            hourStarts.putIfAbsent(key, hourStart);
            byHour.computeIfAbsent(key, k -> new ArrayList<>()).add(reading);
        }

        List<HourlyBucket> hourly = byHour.entrySet().stream()
                .map(hour -> HourlyBucket.builder()
                        .hourStart(hourStarts.get(hour.getKey()))
                        .powerKw(hour.getValue().stream().mapToDouble(LocalizedReading::getPowerKw).average().orElse(0.0))
                        .energyKwh(hour.getValue().stream().mapToDouble(LocalizedReading::getEnergyKwh).sum())
                        .build())
                .toList();

        validateConservation(readings, hourly);
        log.debug("Aggregated {} interval readings into {} hourly buckets.", readings.size(), hourly.size());
        return hourly;
    }

    @VisibleForTesting
    void validateConservation(List<LocalizedReading> readings, List<HourlyBucket> hourly) {
        double originalSum = readings.stream().mapToDouble(LocalizedReading::getEnergyKwh).sum();
        double hourlySum = hourly.stream().mapToDouble(HourlyBucket::getEnergyKwh).sum();

        if (Math.abs(originalSum - hourlySum) > properties.getConservationToleranceKwh()) {
            throw new ConsistencyException(String.format(
                    "Energy sum mismatch after hourly aggregation. Original: %.3f kWh, Hourly: %.3f kWh",
                    originalSum, hourlySum));
        }
    }
}
