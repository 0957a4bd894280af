package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One calendar day of a wide usage sheet: the day plus one value per time-of-day column.
 */
@Value
public class WideTableRow {
    LocalDate date;
    Map<String, Double> values;

    public WideTableRow(LocalDate date, Map<String, Double> values) {
        this.date = date;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public double value(String column) {
        Double value = values.get(column);
        return value != null ? value : 0.0;
    }

    /**
     * Row-wise sum across all time-of-day columns (the sheet's derived {@code Total}).
     */
    public double getTotal() {
        return values.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
