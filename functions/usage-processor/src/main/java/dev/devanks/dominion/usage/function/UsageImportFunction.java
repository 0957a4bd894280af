package dev.devanks.dominion.usage.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.dominion.usage.exception.ErrorKind;
import dev.devanks.dominion.usage.model.UsageImportResult;
import dev.devanks.dominion.usage.service.UsageImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class UsageImportFunction {

    static final String EXPORT_PATH = "exportPath";
    static final String ACCOUNT_ID = "accountId";

    private final UsageImportService importService;

    /**
     * Main function bean: usageImporter. Expects {@code exportPath} and {@code accountId} in the payload.
     */
    @Bean
    public Function<HashMap<String, Object>, UsageImportResult> usageImporter() {
        return payload -> {
            log.info("usageImporter function triggered with payload: {}", payload);

            String exportPath = stringValue(payload, EXPORT_PATH);
            String accountId = stringValue(payload, ACCOUNT_ID);
            if (exportPath == null || accountId == null) {
                return invalidPayload(payload);
            }

            try {
                return importService.importUsage(exportPath, accountId).block();
            } catch (Exception e) {
                log.error("Usage import for account {} failed unexpectedly: {}", accountId, e.getMessage(), e);
                return UsageImportResult.builder()
                        .status(UsageImportResult.Status.FAILURE)
                        .errorKind(ErrorKind.UNEXPECTED)
                        .errorDetails(e.getMessage())
                        .message("Usage import failed: " + e.getMessage())
                        .build();
            }
        };
    }

    @VisibleForTesting
    static String stringValue(Map<String, Object> payload, String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private UsageImportResult invalidPayload(Map<String, Object> payload) {
        log.error("Invalid usageImporter payload: {}", payload);
        return UsageImportResult.builder()
                .status(UsageImportResult.Status.FAILURE)
                .errorKind(ErrorKind.DATA_SOURCE)
                .errorDetails(String.format("Payload must contain '%s' and '%s'.", EXPORT_PATH, ACCOUNT_ID))
                .message("Error: Invalid usageImporter payload.")
                .build();
    }
}
