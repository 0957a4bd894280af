package dev.devanks.dominion.usage.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.dominion.usage.entity.UsageStatisticEntity;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Both lookups need the composite index (statisticId ASC, start DESC) on {@code usage_statistics}.
 */
@Repository
public interface UsageStatisticRepository extends FirestoreReactiveRepository<UsageStatisticEntity> {

    Flux<UsageStatisticEntity> findFirstByStatisticIdOrderByStartDesc(String statisticId);

    Flux<UsageStatisticEntity> findFirstByStatisticIdAndStartLessThanEqualOrderByStartDesc(String statisticId, Instant start);
}
