package com.assettrack.inventory.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AssetCondition {
    EXCELLENT, GOOD, FAIR, POOR, DAMAGED;

    public String value() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<AssetCondition> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(c -> c.value().equals(value)).findFirst();
    }
}
