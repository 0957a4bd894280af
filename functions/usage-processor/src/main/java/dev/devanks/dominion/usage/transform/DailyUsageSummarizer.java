package dev.devanks.dominion.usage.transform;

import dev.devanks.dominion.usage.model.DailyUsage;
import dev.devanks.dominion.usage.model.LocalizedReading;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.toList;

/**
 * Rolls interval readings up to one summary per local calendar day.
 */
@Component
public class DailyUsageSummarizer {

    public List<DailyUsage> summarize(List<LocalizedReading> readings) {
        Map<LocalDate, List<LocalizedReading>> byDate = readings.stream()
                .collect(groupingBy(reading -> reading.getTimestamp().toLocalDate(), TreeMap::new, toList()));

        return byDate.entrySet().stream()
                .map(day -> summarizeDay(day.getKey(), day.getValue()))
                .toList();
    }

    private DailyUsage summarizeDay(LocalDate date, List<LocalizedReading> readings) {
        // the earliest reading wins a tie for the peak
        LocalizedReading peak = readings.stream()
                .max(Comparator.comparingDouble(LocalizedReading::getPowerKw)
                        .thenComparing(reading -> reading.getTimestamp().toInstant(), Comparator.reverseOrder()))
                .orElseThrow();

        return DailyUsage.builder()
                .date(date)
                .totalEnergyKwh(readings.stream().mapToDouble(LocalizedReading::getEnergyKwh).sum())
                .avgPowerKw(readings.stream().mapToDouble(LocalizedReading::getPowerKw).average().orElse(0.0))
                .peakPowerKw(peak.getPowerKw())
                .peakPowerTime(peak.getTimestamp())
                .dataPoints(readings.size())
                .build();
    }
}
