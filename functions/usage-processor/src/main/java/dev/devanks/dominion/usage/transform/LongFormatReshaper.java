package dev.devanks.dominion.usage.transform;

import dev.devanks.dominion.usage.exception.TransformException;
import dev.devanks.dominion.usage.model.IntervalReading;
import dev.devanks.dominion.usage.model.Metric;
import dev.devanks.dominion.usage.model.RawWideTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unpivots a wide sheet into one reading per (day, time-of-day) pair, ordered by timestamp.
 */
@Component
@Slf4j
public class LongFormatReshaper {

    public List<IntervalReading> reshape(RawWideTable table, Metric metric) {
        if (table.getTimeColumns().isEmpty()) {
            throw new TransformException(String.format("Sheet '%s' has no time-of-day columns.", table.getName()));
        }

        Map<String, LocalTime> timesByColumn = parseColumns(table);

        List<IntervalReading> readings = table.getRows().stream()
                .flatMap(row -> timesByColumn.entrySet().stream()
                        .map(column -> new IntervalReading(
                                LocalDateTime.of(row.getDate(), column.getValue()),
                                row.value(column.getKey()),
                                metric)))
                .sorted(Comparator.comparing(IntervalReading::getTimestamp))
                .toList();

        log.debug("Reshaped sheet '{}' ({} days x {} columns) into {} {} readings.",
                table.getName(), table.getRows().size(), timesByColumn.size(), readings.size(), metric);
        return readings;
    }

    private Map<String, LocalTime> parseColumns(RawWideTable table) {
        Map<String, LocalTime> timesByColumn = new LinkedHashMap<>();
        for (String column : table.getTimeColumns()) {
            String label = TimeOfDayLabels.extract(column)
                    .orElseThrow(() -> new TransformException(String.format(
                            "Column '%s' of sheet '%s' has no time-of-day label.", column, table.getName())));
            try {
                timesByColumn.put(column, TimeOfDayLabels.parse(label));
            } catch (DateTimeParseException e) {
                throw new TransformException(String.format(
                        "Cannot parse time-of-day '%s' in column '%s' of sheet '%s'.", label, column, table.getName()), e);
            }
        }
        return timesByColumn;
    }
}
