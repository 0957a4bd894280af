package dev.devanks.dominion.usage.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.dominion.usage.entity.UsageStatisticMetadataEntity;
import org.springframework.stereotype.Repository;

@Repository
public interface UsageStatisticMetadataRepository extends FirestoreReactiveRepository<UsageStatisticMetadataEntity> {
}
