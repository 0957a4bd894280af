package dev.devanks.dominion.usage.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Metric {
    POWER("power_kw"),
    ENERGY("energy_kwh");

    private final String columnName;
}
