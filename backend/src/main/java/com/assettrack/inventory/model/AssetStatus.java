package com.assettrack.inventory.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AssetStatus {
    AVAILABLE, ASSIGNED, MAINTENANCE, REPAIR, RETIRED, LOST, STOLEN;

    public String value() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<AssetStatus> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(s -> s.value().equals(value)).findFirst();
    }
}
