package com.assettrack.inventory.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AssetCategory {
    LAPTOP, DESKTOP, MONITOR, PRINTER, PHONE, TABLET, SERVER, NETWORK_DEVICE, SOFTWARE_LICENSE, FURNITURE, ACCESSORY, OTHER;

    /** Lower-case wire value, e.g. {@code network_device}. */
    public String value() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<AssetCategory> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(c -> c.value().equals(value)).findFirst();
    }
}
