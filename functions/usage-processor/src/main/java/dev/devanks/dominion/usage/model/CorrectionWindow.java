package dev.devanks.dominion.usage.model;

import lombok.Value;

import java.time.Instant;

/**
 * Lower bound from which recomputed points replace or extend the persisted series, and the cumulative
 * sum the new points are anchored to. A window without a start covers the whole input (first run).
 */
@Value
public class CorrectionWindow {
    Instant start;
    double baselineSum;

    public static CorrectionWindow firstRun() {
        return new CorrectionWindow(null, 0.0);
    }

    public boolean isFirstRun() {
        return start == null;
    }

    public boolean includes(Instant instant) {
        return start == null || instant.isAfter(start);
    }
}
