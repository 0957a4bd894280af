package dev.devanks.dominion.usage.service;

import dev.devanks.dominion.usage.model.StatisticMetadata;
import dev.devanks.dominion.usage.model.StatisticPoint;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Long-term store of cumulative statistic series, addressed by statistic id.
 */
public interface StatisticsStore {

    /**
     * @return the most recent point of the series, or empty if the series has none
     */
    Mono<StatisticPoint> findLastPoint(String statisticId);

    /**
     * @return the cumulative sum of the latest point starting at or before {@code instant}, or empty
     */
    Mono<Double> findSumAtOrBefore(String statisticId, Instant instant);

    /**
     * Registers the series metadata and writes the points, replacing any existing point with the same
     * start. Either all points are written or none.
     *
     * @return the number of points written
     */
    Mono<Integer> upsert(StatisticMetadata metadata, List<StatisticPoint> points);
}
