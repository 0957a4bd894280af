package dev.devanks.dominion.usage.config;

import com.google.cloud.spring.data.firestore.transaction.ReactiveFirestoreTransactionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Statistic points for one run are committed in a single Firestore transaction.
    @Bean
    public TransactionalOperator firestoreTransactionalOperator(ReactiveFirestoreTransactionManager transactionManager) {
        log.info("Initializing Firestore transactional operator.");
        return TransactionalOperator.create(transactionManager);
    }
}
