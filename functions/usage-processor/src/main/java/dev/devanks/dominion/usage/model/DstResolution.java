package dev.devanks.dominion.usage.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Readings that survived timezone resolution, along with the diagnostics for the ones that did not.
 * Dropped readings fell into a spring-forward gap; collapsed readings repeated an instant already kept.
 */
@Value
@Builder
public class DstResolution {
    Metric metric;
    @Singular
    List<ZonedReading> readings;
    @Singular
    List<LocalDateTime> droppedTimestamps;
    int collapsed;

    public int getDroppedCount() {
        return droppedTimestamps.size();
    }

    public boolean hasNotice() {
        return !droppedTimestamps.isEmpty() || collapsed > 0;
    }
}
