package dev.devanks.dominion.usage.transform;

import dev.devanks.dominion.usage.model.RawUsageData;
import dev.devanks.dominion.usage.model.RawWideTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Drops the latest day of a sheet when all of its afternoon columns are zero: the export was taken
 * before that day finished. Afternoon means the column label carries the PM marker.
 */
@Component
@Slf4j
public class IncompleteDayTrimmer {

    public RawUsageData trim(RawUsageData data) {
        return new RawUsageData(trim(data.getPower()), trim(data.getEnergy()));
    }

    public RawWideTable trim(RawWideTable table) {
        var latestDate = table.latestDate();
        if (latestDate.isEmpty()) {
            log.debug("Sheet '{}' has no rows, nothing to trim.", table.getName());
            return table;
        }

        LocalDate date = latestDate.get();
        double afternoonSum = afternoonSum(table, date);
        if (afternoonSum == 0.0) {
            log.info("Dropping incomplete day {} from sheet '{}' (all afternoon intervals are zero).",
                    date, table.getName());
            return table.withoutDate(date);
        }

        log.trace("Latest day {} of sheet '{}' is complete (afternoon sum {}).", date, table.getName(), afternoonSum);
        return table;
    }

    private double afternoonSum(RawWideTable table, LocalDate date) {
        List<String> afternoonColumns = table.getTimeColumns().stream()
                .filter(TimeOfDayLabels::isAfternoon)
                .toList();

        return table.getRows().stream()
                .filter(row -> row.getDate().equals(date))
                .mapToDouble(row -> afternoonColumns.stream().mapToDouble(row::value).sum())
                .sum();
    }
}
