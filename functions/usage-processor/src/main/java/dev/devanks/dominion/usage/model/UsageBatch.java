package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.util.List;

/**
 * Everything one import run derives in memory before it writes anything.
 */
@Value
public class UsageBatch {
    ProcessedUsage processed;
    List<HourlyBucket> hourly;
    List<DailyUsage> daily;
}
