package dev.devanks.dominion.usage.transform;

import dev.devanks.dominion.usage.config.UsageProperties;
import dev.devanks.dominion.usage.exception.DataSourceException;
import dev.devanks.dominion.usage.model.RawUsageData;
import dev.devanks.dominion.usage.model.RawWideTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class SheetValidator {

    private static final int EXPECTED_SHEET_COUNT = 2;

    private final UsageProperties properties;

    /**
     * Resolves the power and energy sheets of a raw export.
     *
     * @param sheets sheet name to table, as read from the export
     * @return the two usage tables
     * @throws DataSourceException if fewer than two sheets exist or a named sheet is missing
     */
    public RawUsageData validate(Map<String, RawWideTable> sheets) {
        if (sheets == null || sheets.size() < EXPECTED_SHEET_COUNT) {
            throw new DataSourceException(String.format("Usage export missing expected sheets. Found: %s",
                    sheets == null ? "none" : sheets.keySet()));
        }

        var sheetNames = properties.getSheets();
        var power = requireSheet(sheets, sheetNames.getPowerSheetName());
        var energy = requireSheet(sheets, sheetNames.getEnergySheetName());

        log.debug("Validated usage export sheets {}: power has {} days, energy has {} days",
                sheets.keySet(), power.getRows().size(), energy.getRows().size());
        return new RawUsageData(power, energy);
    }

    private RawWideTable requireSheet(Map<String, RawWideTable> sheets, String name) {
        var table = sheets.get(name);
        if (table == null) {
            throw new DataSourceException(String.format("Usage export has no sheet named '%s'. Found: %s",
                    name, sheets.keySet()));
        }
        return table;
    }
}
