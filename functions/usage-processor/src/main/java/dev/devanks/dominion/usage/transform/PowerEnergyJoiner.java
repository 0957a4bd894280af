package dev.devanks.dominion.usage.transform;

import dev.devanks.dominion.usage.model.LocalizedReading;
import dev.devanks.dominion.usage.model.ZonedReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inner join of power and energy readings on the exact instant. Readings present in only one
 * series are left out.
 */
@Component
@Slf4j
public class PowerEnergyJoiner {

    public List<LocalizedReading> join(List<ZonedReading> power, List<ZonedReading> energy) {
        Map<Instant, ZonedReading> energyByInstant = new LinkedHashMap<>();
        energy.forEach(reading -> energyByInstant.putIfAbsent(reading.getTimestamp().toInstant(), reading));

        List<LocalizedReading> joined = power.stream()
                .filter(powerReading -> energyByInstant.containsKey(powerReading.getTimestamp().toInstant()))
                .map(powerReading -> LocalizedReading.builder()
                        .timestamp(powerReading.getTimestamp())
                        .powerKw(powerReading.getValue())
                        .energyKwh(energyByInstant.get(powerReading.getTimestamp().toInstant()).getValue())
                        .build())
                .sorted(Comparator.comparing(reading -> reading.getTimestamp().toInstant()))
                .toList();

        if (joined.size() != power.size() || joined.size() != energy.size()) {
            log.warn("Power and energy readings did not fully match. Power: {}, Energy: {}, Joined: {}",
                    power.size(), energy.size(), joined.size());
        } else {
            log.debug("Joined {} power/energy readings.", joined.size());
        }
        return joined;
    }
}
