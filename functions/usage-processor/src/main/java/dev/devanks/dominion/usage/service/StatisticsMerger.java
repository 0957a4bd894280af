package dev.devanks.dominion.usage.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.model.CorrectionWindow;
import dev.devanks.dominion.usage.model.HourlyBucket;
import dev.devanks.dominion.usage.model.MergePlan;
import dev.devanks.dominion.usage.model.StatisticMetadata;
import dev.devanks.dominion.usage.model.StatisticPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds freshly aggregated hourly usage into the persisted cumulative series.
 * <p>
 * The series is only ever recomputed after the correction start, which is the later of the last
 * persisted point and midnight {@link UsageProperties#getCorrectionWindowDays()} days ago. New sums are
 * anchored to the persisted sum at or before that start.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatisticsMerger {

    private final StatisticsStore statisticsStore;
    private final UsageProperties properties;
    private final Clock clock;

    /**
     * Computes the points to write without writing them.
     *
     * @param statisticId the series to merge into
     * @param hourly      hourly usage, any order
     * @return the correction window used and the points to append or replace
     */
    public Mono<MergePlan> plan(String statisticId, List<HourlyBucket> hourly) {
        return statisticsStore.findLastPoint(statisticId)
                .flatMap(lastPoint -> correctionWindowAfter(statisticId, lastPoint))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("No previous statistics found for {}, processing all available data.", statisticId);
                    return CorrectionWindow.firstRun();
                }))
                .map(window -> new MergePlan(window, cumulativePoints(hourly, window)))
                .doOnNext(plan -> log.debug("Merge plan for {}: {} points after {} with base sum {}",
                        statisticId, plan.getPoints().size(),
                        plan.getWindow().isFirstRun() ? "(first run)" : plan.getWindow().getStart(),
                        plan.getWindow().getBaselineSum()));
    }

    /**
     * Writes a plan. An empty plan is a no-op, which is the normal outcome when no new hour has completed.
     *
     * @return the number of points written
     */
    public Mono<Integer> apply(StatisticMetadata metadata, MergePlan plan) {
        if (plan.isEmpty()) {
            log.info("No new data to add to statistics {}", metadata.getStatisticId());
            return Mono.just(0);
        }
        return statisticsStore.upsert(metadata, plan.getPoints());
    }

    public Mono<Integer> merge(StatisticMetadata metadata, List<HourlyBucket> hourly) {
        return plan(metadata.getStatisticId(), hourly)
                .flatMap(plan -> apply(metadata, plan));
    }

    @VisibleForTesting
    Mono<CorrectionWindow> correctionWindowAfter(String statisticId, StatisticPoint lastPoint) {
        Instant correctionStart = correctionStart(lastPoint.getStart());
        log.debug("Last statistic time: {}, correction start: {}", lastPoint.getStart(), correctionStart);

        return statisticsStore.findSumAtOrBefore(statisticId, correctionStart)
                .defaultIfEmpty(0.0)
                .map(baselineSum -> new CorrectionWindow(correctionStart, baselineSum));
    }

    @VisibleForTesting
    Instant correctionStart(Instant lastPointStart) {
        ZoneId zone = properties.getZoneId();
        Instant earliestCorrectable = LocalDate.now(clock.withZone(zone))
                .minusDays(properties.getCorrectionWindowDays())
                .atStartOfDay(zone)
                .toInstant();
        return lastPointStart.isAfter(earliestCorrectable) ? lastPointStart : earliestCorrectable;
    }

    @VisibleForTesting
    List<StatisticPoint> cumulativePoints(List<HourlyBucket> hourly, CorrectionWindow window) {
        List<HourlyBucket> ordered = hourly.stream()
                .sorted(Comparator.comparing(bucket -> bucket.getHourStart().toInstant()))
                .toList();

        List<StatisticPoint> points = new ArrayList<>();
        double runningSum = window.getBaselineSum();
        for (HourlyBucket bucket : ordered) {
            Instant start = bucket.getHourStart().toInstant();
            if (!window.includes(start)) {
                continue;
            }
            runningSum += bucket.getEnergyKwh();
            points.add(StatisticPoint.builder()
                    .start(start)
                    .state(bucket.getEnergyKwh())
                    .sum(runningSum)
                    .build());
        }
        return points;
    }
}
