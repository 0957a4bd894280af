package dev.devanks.dominion.usage.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.exception.ErrorKind;
import dev.devanks.dominion.usage.exception.UsageProcessingException;
import dev.devanks.dominion.usage.model.MergePlan;
import dev.devanks.dominion.usage.model.StatisticMetadata;
import dev.devanks.dominion.usage.model.UsageBatch;
import dev.devanks.dominion.usage.model.UsageImportResult;
import dev.devanks.dominion.usage.service.io.GcsResourceProvider;
import dev.devanks.dominion.usage.service.io.UsageWorkbookReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

import static dev.devanks.dominion.usage.model.UsageImportResult.Status.FAILURE;
import static dev.devanks.dominion.usage.model.UsageImportResult.Status.SUCCESS;
import static reactor.core.scheduler.Schedulers.boundedElastic;

@Service
@RequiredArgsConstructor
@Slf4j
public class UsageImportService {

    private final UsageProperties properties;
    private final GcsResourceProvider resourceProvider;
    private final UsageWorkbookReader workbookReader;
    private final UsagePipelineService pipelineService;
    private final StatisticsMerger statisticsMerger;
    private final DailyUsageService dailyUsageService;
    private final ReadingsExportWriter exportWriter;
    private final Clock clock;

    private final KeyedSingleFlight<UsageImportResult> importsInFlight = new KeyedSingleFlight<>();
    private final KeyedSerialExecutor<UsageImportResult> importsPerStatistic = new KeyedSerialExecutor<>();

    /**
     * Imports one usage export for an account. A repeated request for an export that is already being
     * imported shares that run; imports of other exports into the same statistic wait for the running
     * one to finish, so merges never interleave.
     *
     * @param exportPath location of the export workbook
     * @param accountId  utility account the export belongs to
     * @return a Mono with the outcome of the import; fatal failures are reported as a FAILURE result
     */
    public Mono<UsageImportResult> importUsage(String exportPath, String accountId) {
        String statisticId = properties.getStatistics().statisticIdFor(accountId);
        return importsInFlight.execute(statisticId + "|" + exportPath,
                () -> importsPerStatistic.execute(statisticId, () -> runImport(exportPath, accountId, statisticId)));
    }

    /**
     * Reads and transforms the export off the caller's thread, plans the merge, then writes. Nothing is
     * written unless every transform step succeeded.
     */
    @VisibleForTesting
    Mono<UsageImportResult> runImport(String exportPath, String accountId, String statisticId) {
        long startMillis = clock.millis();
        log.info("Starting usage import for {} from {}", statisticId, exportPath);

        return Mono.fromCallable(() -> {
                    checkExportConfigured();
                    return pipelineService.buildBatch(workbookReader.read(resourceProvider.createReadableResource(exportPath)));
                })
                .subscribeOn(boundedElastic())
                .flatMap(batch -> statisticsMerger.plan(statisticId, batch.getHourly())
                        .flatMap(plan -> persist(accountId, statisticId, batch, plan, startMillis)))
                .onErrorResume(e -> handleImportError(e, statisticId, startMillis));
    }

    @VisibleForTesting
    Mono<UsageImportResult> persist(String accountId, String statisticId, UsageBatch batch, MergePlan plan, long startMillis) {
        var processed = batch.getProcessed();
        var metadata = metadataFor(accountId, statisticId);
        var result = UsageImportResult.builder()
                .status(SUCCESS)
                .statisticId(statisticId)
                .intervalCount(processed.getReadings().size())
                .hourlyCount(batch.getHourly().size())
                .dstDroppedCount(processed.getDstDroppedCount());

        return dailyUsageService.saveDailySummaries(accountId, batch.getDaily())
                .doOnNext(result::dailySummaries)
                .then(Mono.defer(() -> exportWriter.exportReadings(accountId, processed.getReadings())))
                .doOnNext(result::readingsExportPath)
                .then(Mono.defer(() -> statisticsMerger.apply(metadata, plan)))
                .map(written -> {
                    long duration = clock.millis() - startMillis;
                    return result.statisticsWritten(written)
                            .durationMs(duration)
                            .message(String.format("Usage import for %s completed in %d ms. Intervals: %d, Hourly: %d, "
                                            + "Statistics written: %d, DST dropped: %d.",
                                    statisticId, duration, processed.getReadings().size(), batch.getHourly().size(),
                                    written, processed.getDstDroppedCount()))
                            .build();
                })
                .doOnNext(summary -> log.info(summary.getMessage()));
    }

    @VisibleForTesting
    Mono<UsageImportResult> handleImportError(Throwable e, String statisticId, long startMillis) {
        ErrorKind kind = e instanceof UsageProcessingException usageException ? usageException.getKind() : ErrorKind.UNEXPECTED;
        log.error("Usage import for {} failed ({}): {}", statisticId, kind, e.getMessage(), e);

        return Mono.just(UsageImportResult.builder()
                .status(FAILURE)
                .statisticId(statisticId)
                .durationMs(clock.millis() - startMillis)
                .errorKind(kind)
                .errorDetails(e.getMessage())
                .message(String.format("Usage import for %s failed: %s", statisticId, e.getMessage()))
                .build());
    }

    private void checkExportConfigured() {
        if (!properties.getExport().isBucketConfigured()) {
            throw new IllegalStateException("usage.export.bucket-name must be set when the export is enabled.");
        }
    }

    private StatisticMetadata metadataFor(String accountId, String statisticId) {
        var statistics = properties.getStatistics();
        return StatisticMetadata.builder()
                .statisticId(statisticId)
                .name(statistics.displayNameFor(accountId))
                .source(statistics.getSource())
                .build();
    }
}
