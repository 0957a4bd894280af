package dev.devanks.dominion.usage.service;

import dev.devanks.dominion.usage.entity.UsageDailyEntity;
import dev.devanks.dominion.usage.model.DailyUsage;
import dev.devanks.dominion.usage.repository.UsageDailyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DailyUsageService {

    private final UsageDailyRepository dailyRepository;

    /**
     * Saves one document per account and day, replacing any earlier summary of the same day.
     *
     * @return the number of summaries saved
     */
    public Mono<Integer> saveDailySummaries(String accountId, List<DailyUsage> summaries) {
        if (summaries == null || summaries.isEmpty()) {
            log.debug("No daily summaries to save for account {}.", accountId);
            return Mono.just(0);
        }
        log.debug("Attempting to save {} daily summaries for account {}.", summaries.size(), accountId);

        return dailyRepository.saveAll(Flux.fromIterable(summaries).map(summary -> toEntity(accountId, summary)))
                .doOnNext(entity -> log.trace("Saved daily summary: {}", entity))
                .count()
                .map(Long::intValue)
                .doOnSuccess(count -> log.info("Successfully saved {} daily summaries for account {}.", count, accountId))
                .doOnError(e -> log.error("Error saving daily summaries for account {}: {}", accountId, e.getMessage(), e));
    }

    static UsageDailyEntity toEntity(String accountId, DailyUsage summary) {
        return UsageDailyEntity.builder()
                .id(accountId + "_" + summary.getDate())
                .accountId(accountId)
                .date(summary.getDate().toString())
                .totalEnergyKWh(summary.getTotalEnergyKwh())
                .averagePowerKW(summary.getAvgPowerKw())
                .peakPowerKW(summary.getPeakPowerKw())
                .peakPowerTimestamp(summary.getPeakPowerTime().toInstant())
                .dataPoints(summary.getDataPoints())
                .build();
    }
}
