package dev.devanks.dominion.usage.service;

import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.model.DstResolution;
import dev.devanks.dominion.usage.model.Metric;
import dev.devanks.dominion.usage.model.ProcessedUsage;
import dev.devanks.dominion.usage.model.RawUsageData;
import dev.devanks.dominion.usage.model.RawWideTable;
import dev.devanks.dominion.usage.model.UsageBatch;
import dev.devanks.dominion.usage.transform.DailyUsageSummarizer;
import dev.devanks.dominion.usage.transform.DstResolver;
import dev.devanks.dominion.usage.transform.HourlyAggregator;
import dev.devanks.dominion.usage.transform.IncompleteDayTrimmer;
import dev.devanks.dominion.usage.transform.LongFormatReshaper;
import dev.devanks.dominion.usage.transform.PowerEnergyJoiner;
import dev.devanks.dominion.usage.transform.SheetValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.Map;

/**
 * The in-memory transform chain: validate, trim, reshape, resolve DST, join, then aggregate.
 * Holds no state between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsagePipelineService {

    private final UsageProperties properties;
    private final SheetValidator sheetValidator;
    private final IncompleteDayTrimmer trimmer;
    private final LongFormatReshaper reshaper;
    private final DstResolver dstResolver;
    private final PowerEnergyJoiner joiner;
    private final HourlyAggregator hourlyAggregator;
    private final DailyUsageSummarizer dailySummarizer;

    /**
     * Produces the timezone-aware readings table (timestamp, power, energy) from a raw export.
     */
    public ProcessedUsage process(Map<String, RawWideTable> sheets) {
        ZoneId zone = properties.getZoneId();
        RawUsageData clean = trimmer.trim(sheetValidator.validate(sheets));

        DstResolution power = dstResolver.resolve(reshaper.reshape(clean.getPower(), Metric.POWER), Metric.POWER, zone);
        DstResolution energy = dstResolver.resolve(reshaper.reshape(clean.getEnergy(), Metric.ENERGY), Metric.ENERGY, zone);

        var processed = new ProcessedUsage(joiner.join(power.getReadings(), energy.getReadings()), power, energy);
        log.info("Processed usage export into {} readings in {} ({} dropped by DST resolution, {} kWh total).",
                processed.getReadings().size(), zone, processed.getDstDroppedCount(), processed.getTotalEnergyKwh());
        return processed;
    }

    /**
     * Runs the full chain, including hourly aggregation and daily summaries.
     *
     * @throws dev.devanks.dominion.usage.exception.UsageProcessingException on any fatal transform failure
     */
    public UsageBatch buildBatch(Map<String, RawWideTable> sheets) {
        ProcessedUsage processed = process(sheets);
        return new UsageBatch(
                processed,
                hourlyAggregator.aggregate(processed.getReadings()),
                dailySummarizer.summarize(processed.getReadings()));
    }
}
