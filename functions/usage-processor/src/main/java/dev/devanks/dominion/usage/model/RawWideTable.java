package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A usage sheet in wide format: one row per day, one column per half-hour label.
 */
@Value
public class RawWideTable {
    String name;
    List<String> timeColumns;
    List<WideTableRow> rows;

    public RawWideTable(String name, List<String> timeColumns, List<WideTableRow> rows) {
        this.name = name;
        this.timeColumns = List.copyOf(timeColumns);
        this.rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Optional<LocalDate> latestDate() {
        return rows.stream()
                .map(WideTableRow::getDate)
                .max(Comparator.naturalOrder());
    }

    public RawWideTable withoutDate(LocalDate date) {
        return new RawWideTable(name, timeColumns, rows.stream()
                .filter(row -> !row.getDate().equals(date))
                .toList());
    }
}
