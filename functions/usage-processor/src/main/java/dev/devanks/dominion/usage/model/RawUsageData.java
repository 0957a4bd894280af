package dev.devanks.dominion.usage.model;

import lombok.NonNull;
import lombok.Value;

/**
 * The two sheets of one export, resolved by name.
 */
@Value
public class RawUsageData {
    @NonNull
    RawWideTable power;
    @NonNull
    RawWideTable energy;
}
