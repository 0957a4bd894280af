package dev.devanks.dominion.usage.service;

import dev.devanks.dominion.usage.entity.UsageStatisticEntity;
import dev.devanks.dominion.usage.entity.UsageStatisticMetadataEntity;
import dev.devanks.dominion.usage.model.StatisticMetadata;
import dev.devanks.dominion.usage.model.StatisticPoint;
import dev.devanks.dominion.usage.repository.UsageStatisticMetadataRepository;
import dev.devanks.dominion.usage.repository.UsageStatisticRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * {@link StatisticsStore} over Firestore. Lookups are single-document queries ordered by start, so a
 * run reads a bounded number of documents however long the series grows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FirestoreStatisticsStore implements StatisticsStore {

    private final UsageStatisticRepository statisticRepository;
    private final UsageStatisticMetadataRepository metadataRepository;
    private final TransactionalOperator transactionalOperator;

    @Override
    public Mono<StatisticPoint> findLastPoint(String statisticId) {
        log.debug("Fetching last statistic point for {}", statisticId);
        return statisticRepository.findFirstByStatisticIdOrderByStartDesc(statisticId)
                .next()
                .map(FirestoreStatisticsStore::toPoint)
                .doOnNext(point -> log.debug("Last statistic time: {}, Last sum: {}", point.getStart(), point.getSum()))
                .doOnError(e -> log.error("Error fetching last statistic point for {}: {}", statisticId, e.getMessage(), e));
    }

    @Override
    public Mono<Double> findSumAtOrBefore(String statisticId, Instant instant) {
        log.debug("Fetching cumulative sum of {} at or before {}", statisticId, instant);
        return statisticRepository.findFirstByStatisticIdAndStartLessThanEqualOrderByStartDesc(statisticId, instant)
                .next()
                .map(UsageStatisticEntity::getSum)
                .doOnError(e -> log.error("Error fetching sum of {} before {}: {}", statisticId, instant, e.getMessage(), e));
    }

    @Override
    public Mono<Integer> upsert(StatisticMetadata metadata, List<StatisticPoint> points) {
        if (points == null || points.isEmpty()) {
            log.debug("No statistic points provided for {}.", metadata.getStatisticId());
            return Mono.just(0);
        }
        log.info("Adding {} statistics to {}", points.size(), metadata.getStatisticId());

        Flux<UsageStatisticEntity> entities = Flux.fromIterable(points)
                .map(point -> toEntity(metadata.getStatisticId(), point));

        Mono<Integer> writes = metadataRepository.save(toEntity(metadata))
                .thenMany(statisticRepository.saveAll(entities))
                .count()
                .map(Long::intValue);

        return transactionalOperator.transactional(writes)
                .doOnSuccess(count -> log.info("Successfully wrote {} statistic points to {}", count, metadata.getStatisticId()))
                .doOnError(e -> log.error("Failed to write statistic points to {}: {}", metadata.getStatisticId(), e.getMessage(), e));
    }

    static StatisticPoint toPoint(UsageStatisticEntity entity) {
        return StatisticPoint.builder()
                .start(entity.getStart())
                .state(entity.getState())
                .sum(entity.getSum())
                .build();
    }

    static UsageStatisticEntity toEntity(String statisticId, StatisticPoint point) {
        return UsageStatisticEntity.builder()
                .id(UsageStatisticEntity.documentIdFor(statisticId, point.getStart()))
                .statisticId(statisticId)
                .start(point.getStart())
                .state(point.getState())
                .sum(point.getSum())
                .build();
    }

    static UsageStatisticMetadataEntity toEntity(StatisticMetadata metadata) {
        return UsageStatisticMetadataEntity.builder()
                .id(metadata.getStatisticId())
                .name(metadata.getName())
                .source(metadata.getSource())
                .unitOfMeasurement(metadata.getUnitOfMeasurement())
                .hasSum(metadata.isHasSum())
                .hasMean(metadata.isHasMean())
                .build();
    }
}
