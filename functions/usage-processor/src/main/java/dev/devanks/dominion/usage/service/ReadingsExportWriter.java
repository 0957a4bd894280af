package dev.devanks.dominion.usage.service;

import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.model.LocalizedReading;
import dev.devanks.dominion.usage.model.Metric;
import dev.devanks.dominion.usage.service.io.GcsResourceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.StringJoiner;
import java.util.zip.GZIPOutputStream;

import static org.springframework.util.ObjectUtils.isEmpty;
import static reactor.core.scheduler.Schedulers.boundedElastic;

/**
 * Publishes the timezone-aware readings table as gzipped CSV for reporting consumers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReadingsExportWriter {

    static final String CSV_HEADER = "timestamp," + Metric.POWER.getColumnName() + "," + Metric.ENERGY.getColumnName();

    private final UsageProperties properties;
    private final GcsResourceProvider resourceProvider;
    private final Clock clock;

    /**
     * Writes the readings of one account to the export bucket.
     *
     * @return the {@code gs://} path written, or an empty Mono when there is nothing to write or the
     * export is disabled
     */
    public Mono<String> exportReadings(String accountId, List<LocalizedReading> readings) {
        var exportProperties = properties.getExport();
        if (!exportProperties.isEnabled()) {
            log.debug("Readings export is disabled, skipping.");
            return Mono.empty();
        }
        if (isEmpty(readings)) {
            log.warn("No readings to export for account {}.", accountId);
            return Mono.empty();
        }
        if (!exportProperties.isBucketConfigured()) {
            return Mono.error(new IllegalStateException("usage.export.bucket-name must be set when the export is enabled."));
        }

        String gcsPath = buildPath(exportProperties.getBucketName(), accountId, ZonedDateTime.now(clock));

        return Mono.fromCallable(() -> {
                    log.info("Writing {} readings for account {} to {} on thread: {}",
                            readings.size(), accountId, gcsPath, Thread.currentThread().getName());

                    WritableResource resource = resourceProvider.createWritableResource(gcsPath);

                    try (OutputStream os = resource.getOutputStream();
                         GZIPOutputStream gzipOs = new GZIPOutputStream(os);
                         PrintWriter writer = new PrintWriter(new OutputStreamWriter(gzipOs, StandardCharsets.UTF_8))) {

                        writer.println(CSV_HEADER);
                        for (LocalizedReading reading : readings) {
                            writer.println(toCsvRow(reading));
                        }
                        writer.flush();
                    }
                    log.info("Successfully wrote {} readings to {}", readings.size(), gcsPath);
                    return gcsPath;
                })
                .subscribeOn(boundedElastic())
                .doOnError(e -> log.error("Readings export failed for path {}: {}", gcsPath, e.getMessage(), e))
                .onErrorMap(e -> new IllegalStateException("Readings export failed for path " + gcsPath, e));
    }

    private String buildPath(String bucketName, String accountId, ZonedDateTime now) {
        String directory = String.format("readings/%s/%s/", accountId, now.format(DateTimeFormatter.ofPattern("yyyy/MM/dd")));
        String filename = String.format("usage-%s-%s.csv.gz", accountId, now.format(DateTimeFormatter.ofPattern("HHmmss-SSSSSS")));
        return "gs://" + bucketName + "/" + directory + filename;
    }

    static String toCsvRow(LocalizedReading reading) {
        StringJoiner joiner = new StringJoiner(",");
        joiner.add(reading.getTimestamp().toOffsetDateTime().toString());
        joiner.add(String.valueOf(reading.getPowerKw()));
        joiner.add(String.valueOf(reading.getEnergyKwh()));
        return joiner.toString();
    }
}
