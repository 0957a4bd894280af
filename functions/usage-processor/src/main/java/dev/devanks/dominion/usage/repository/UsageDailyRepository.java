package dev.devanks.dominion.usage.repository;

import com.google.cloud.spring.data.firestore.FirestoreReactiveRepository;
import dev.devanks.dominion.usage.entity.UsageDailyEntity;

public interface UsageDailyRepository extends FirestoreReactiveRepository<UsageDailyEntity> {
}
