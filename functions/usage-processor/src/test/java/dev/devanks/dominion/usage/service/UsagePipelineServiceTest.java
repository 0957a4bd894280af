package dev.devanks.dominion.usage.service;

import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.exception.DataSourceException;
import dev.devanks.dominion.usage.model.HourlyBucket;
import dev.devanks.dominion.usage.model.LocalizedReading;
import dev.devanks.dominion.usage.model.ProcessedUsage;
import dev.devanks.dominion.usage.model.StatisticPoint;
import dev.devanks.dominion.usage.model.UsageBatch;
import dev.devanks.dominion.usage.transform.DailyUsageSummarizer;
import dev.devanks.dominion.usage.transform.DstResolver;
import dev.devanks.dominion.usage.transform.HourlyAggregator;
import dev.devanks.dominion.usage.transform.IncompleteDayTrimmer;
import dev.devanks.dominion.usage.transform.LongFormatReshaper;
import dev.devanks.dominion.usage.transform.PowerEnergyJoiner;
import dev.devanks.dominion.usage.transform.SheetValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static dev.devanks.dominion.usage.UsageTestData.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("UsagePipelineService Tests")
class UsagePipelineServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 15);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 16);
    private static final String STATISTIC_ID = "dominion_energy:123_energy_consumption";

    private final UsagePipelineService pipeline = pipeline(new UsageProperties());

    @Test
    @DisplayName("buildBatch: a full day plus an unfinished day gives 48 readings and 24 hourly buckets")
    void buildBatch_fullDayAndIncompleteDay() {
        var sheets = export(
                table(POWER_SHEET, constantRow(DAY_1, 1.0), morningOnlyRow(DAY_2, 1.0)),
                table(ENERGY_SHEET, constantRow(DAY_1, 0.5), morningOnlyRow(DAY_2, 0.5)));

        UsageBatch batch = pipeline.buildBatch(sheets);

        assertThat(batch.getProcessed().getReadings()).hasSize(48);
        assertThat(batch.getProcessed().getReadings())
                .allMatch(reading -> reading.getTimestamp().toLocalDate().equals(DAY_1));
        assertThat(batch.getProcessed().getDstDroppedCount()).isZero();

        assertThat(batch.getHourly()).hasSize(24);
        assertThat(batch.getHourly()).allSatisfy(bucket -> {
            assertThat(bucket.getEnergyKwh()).isEqualTo(1.0);
            assertThat(bucket.getPowerKw()).isEqualTo(1.0);
        });
        assertThat(batch.getHourly().get(0).getHourStart()).isEqualTo(ZonedDateTime.of(DAY_1.atStartOfDay(), NEW_YORK));

        assertThat(batch.getDaily()).singleElement()
                .satisfies(day -> {
                    assertThat(day.getDate()).isEqualTo(DAY_1);
                    assertThat(day.getTotalEnergyKwh()).isEqualTo(24.0);
                    assertThat(day.getDataPoints()).isEqualTo(48);
                });
    }

    @Test
    @DisplayName("buildBatch then merge: with no stored series, 24 points with strictly increasing sums")
    void buildBatch_thenFirstMerge() {
        var sheets = export(
                table(POWER_SHEET, constantRow(DAY_1, 1.0), morningOnlyRow(DAY_2, 1.0)),
                table(ENERGY_SHEET, constantRow(DAY_1, 0.5), morningOnlyRow(DAY_2, 0.5)));
        StatisticsStore store = mock(StatisticsStore.class);
        when(store.findLastPoint(STATISTIC_ID)).thenReturn(Mono.empty());
        var merger = new StatisticsMerger(store, new UsageProperties(), Clock.systemUTC());

        UsageBatch batch = pipeline.buildBatch(sheets);

        StepVerifier.create(merger.plan(STATISTIC_ID, batch.getHourly()))
                .assertNext(plan -> {
                    assertThat(plan.getPoints()).hasSize(24);
                    List<Double> sums = plan.getPoints().stream().map(StatisticPoint::getSum).toList();
                    for (int i = 1; i < sums.size(); i++) {
                        assertThat(sums.get(i)).isGreaterThan(sums.get(i - 1));
                    }
                    assertThat(sums.get(23)).isEqualTo(24.0);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("buildBatch: hourly energy conserves the interval energy total")
    void buildBatch_conservesEnergy() {
        var sheets = export(
                table(POWER_SHEET, row(DAY_1, i -> i * 0.1)),
                table(ENERGY_SHEET, row(DAY_1, i -> i * 0.013)));

        UsageBatch batch = pipeline.buildBatch(sheets);

        double intervalTotal = batch.getProcessed().getReadings().stream().mapToDouble(LocalizedReading::getEnergyKwh).sum();
        double hourlyTotal = batch.getHourly().stream().mapToDouble(HourlyBucket::getEnergyKwh).sum();
        assertThat(Math.abs(intervalTotal - hourlyTotal)).isLessThanOrEqualTo(0.001);
        assertThat(batch.getHourly()).extracting(bucket -> bucket.getHourStart().toInstant()).isSorted();
    }

    @Test
    @DisplayName("process: a spring-forward day loses its two non-existent intervals in each sheet")
    void process_springForward() {
        var day = LocalDate.of(2024, 3, 10);
        var sheets = export(table(POWER_SHEET, constantRow(day, 1.0)), table(ENERGY_SHEET, constantRow(day, 0.5)));

        UsageBatch batch = pipeline.buildBatch(sheets);

        assertThat(batch.getProcessed().getReadings()).hasSize(46);
        assertThat(batch.getProcessed().getDstDroppedCount()).isEqualTo(4);
        assertThat(batch.getHourly()).hasSize(23);
        assertThat(batch.getDaily().get(0).getTotalEnergyKwh()).isEqualTo(23.0);
    }

    @Test
    @DisplayName("process: a fall-back day keeps all 48 intervals with distinct instants")
    void process_fallBack() {
        var day = LocalDate.of(2024, 11, 3);
        var sheets = export(table(POWER_SHEET, constantRow(day, 1.0)), table(ENERGY_SHEET, constantRow(day, 0.5)));

        ProcessedUsage processed = pipeline.process(sheets);

        assertThat(processed.getReadings()).hasSize(48);
        assertThat(processed.getReadings()).extracting(reading -> reading.getTimestamp().toInstant())
                .doesNotHaveDuplicates()
                .isSorted();
        assertThat(processed.getTotalEnergyKwh()).isEqualTo(24.0);
    }

    @Test
    @DisplayName("process: an export without the usage sheets fails before any transform")
    void process_missingSheets_throws() {
        var sheets = Map.of(POWER_SHEET, table(POWER_SHEET, constantRow(DAY_1, 1.0)));

        assertThatThrownBy(() -> pipeline.process(sheets)).isInstanceOf(DataSourceException.class);
    }

    private static UsagePipelineService pipeline(UsageProperties properties) {
        return new UsagePipelineService(
                properties,
                new SheetValidator(properties),
                new IncompleteDayTrimmer(),
                new LongFormatReshaper(),
                new DstResolver(properties),
                new PowerEnergyJoiner(),
                new HourlyAggregator(properties),
                new DailyUsageSummarizer());
    }
}
