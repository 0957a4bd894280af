package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.util.List;

/**
 * Output of the transform chain up to the join: the entity-facing table plus DST diagnostics.
 */
@Value
public class ProcessedUsage {
    List<LocalizedReading> readings;
    DstResolution powerResolution;
    DstResolution energyResolution;

    public int getDstDroppedCount() {
        return powerResolution.getDroppedCount() + energyResolution.getDroppedCount();
    }

    public double getTotalEnergyKwh() {
        return readings.stream().mapToDouble(LocalizedReading::getEnergyKwh).sum();
    }
}
