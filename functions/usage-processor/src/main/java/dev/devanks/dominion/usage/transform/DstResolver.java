package dev.devanks.dominion.usage.transform;

import dev.devanks.dominion.usage.config.AmbiguousTimePolicy;
import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.model.DstResolution;
import dev.devanks.dominion.usage.model.IntervalReading;
import dev.devanks.dominion.usage.model.Metric;
import dev.devanks.dominion.usage.model.ZonedReading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Attaches a timezone to wall-clock readings.
 * <ul>
 *     <li>Times repeated by a fall-back transition resolve according to the configured
 *     {@link AmbiguousTimePolicy}; a second reading landing on an instant already kept is collapsed.</li>
 *     <li>Times skipped by a spring-forward transition do not exist and are dropped.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DstResolver {

    private final UsageProperties properties;

    public DstResolution resolve(List<IntervalReading> readings, Metric metric, ZoneId zone) {
        var policy = properties.getAmbiguousTimePolicy();
        var resolution = DstResolution.builder().metric(metric);
        Set<Instant> seen = new HashSet<>();
        int collapsed = 0;

        List<IntervalReading> ordered = readings.stream()
                .sorted(Comparator.comparing(IntervalReading::getTimestamp))
                .toList();

        for (IntervalReading reading : ordered) {
            LocalDateTime local = reading.getTimestamp();
            List<ZoneOffset> validOffsets = zone.getRules().getValidOffsets(local);

            if (validOffsets.isEmpty()) {
                log.trace("Dropping {} reading at non-existent local time {} in {}", metric, local, zone);
                resolution.droppedTimestamp(local);
                continue;
            }

            ZonedDateTime zoned = ZonedDateTime.ofLocal(local, zone, null);
            if (validOffsets.size() > 1) {
                zoned = policy == AmbiguousTimePolicy.EARLIEST
                        ? zoned.withEarlierOffsetAtOverlap()
                        : zoned.withLaterOffsetAtOverlap();
            }

            if (!seen.add(zoned.toInstant())) {
                log.trace("Collapsing duplicate {} reading at {}", metric, zoned);
                collapsed++;
                continue;
            }
            resolution.reading(new ZonedReading(zoned, reading.getValue(), metric));
        }

        DstResolution result = resolution.collapsed(collapsed).build();
        if (result.hasNotice()) {
            log.debug("Missing {} timestamps during DST transitions: {}", metric, result.getDroppedTimestamps());
            log.warn("Some {} timestamps were lost during DST transition handling. Original rows: {}, Final rows: {} "
                            + "(dropped in gap: {}, collapsed in overlap: {})",
                    metric, readings.size(), result.getReadings().size(), result.getDroppedCount(), collapsed);
        }
        return result;
    }
}
