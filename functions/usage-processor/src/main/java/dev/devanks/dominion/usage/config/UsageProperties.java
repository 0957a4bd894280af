package dev.devanks.dominion.usage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "usage")
public class UsageProperties {

    public static final int DEFAULT_CORRECTION_WINDOW_DAYS = 30;
    public static final double DEFAULT_CONSERVATION_TOLERANCE_KWH = 0.001;

    /**
     * Timezone the utility's wall-clock timestamps are interpreted in.
     */
    @NotEmpty
    private String timezone = "America/New_York";

    @NotNull
    private AmbiguousTimePolicy ambiguousTimePolicy = AmbiguousTimePolicy.EARLIEST;

    /**
     * How many days of already persisted statistics a single run may recompute.
     */
    @Positive
    private int correctionWindowDays = DEFAULT_CORRECTION_WINDOW_DAYS;

    /**
     * Maximum allowed difference between interval and hourly energy totals.
     */
    @PositiveOrZero
    private double conservationToleranceKwh = DEFAULT_CONSERVATION_TOLERANCE_KWH;

    @Valid
    @NotNull
    private SheetProperties sheets = new SheetProperties();

    @Valid
    @NotNull
    private StatisticsProperties statistics = new StatisticsProperties();

    @Valid
    @NotNull
    private ExportProperties export = new ExportProperties();

    public ZoneId getZoneId() {
        return ZoneId.of(timezone);
    }

    @Data
    public static class SheetProperties {
        @NotEmpty
        private String powerSheetName = "kW Usage Data";
        @NotEmpty
        private String energySheetName = "kWH Usage Data";
    }

    @Data
    public static class StatisticsProperties {
        @NotEmpty
        private String source = "dominion_energy";
        @NotEmpty
        private String displayPrefix = "Dominion Energy";

        public String statisticIdFor(String accountId) {
            return String.format("%s:%s_energy_consumption", source, accountId);
        }

        public String displayNameFor(String accountId) {
            return String.format("%s %s Energy Consumption", displayPrefix, accountId);
        }
    }

    @Data
    public static class ExportProperties {
        private boolean enabled = false;

        /**
         * Bucket the entity-facing readings table is written to. Required when the export is enabled.
         */
        private String bucketName;

        @AssertTrue(message = "usage.export.bucket-name must be set when the export is enabled")
        public boolean isBucketConfigured() {
            return !enabled || StringUtils.hasText(bucketName);
        }
    }
}
