package dev.devanks.dominion.usage.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StatisticMetadata {
    public static final String UNIT_KWH = "kWh";

    String statisticId;
    String name;
    String source;
    @Builder.Default
    String unitOfMeasurement = UNIT_KWH;
    @Builder.Default
    boolean hasSum = true;
    @Builder.Default
    boolean hasMean = false;
}
