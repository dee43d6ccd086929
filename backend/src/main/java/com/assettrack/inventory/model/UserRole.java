package com.assettrack.inventory.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum UserRole {
    SUPER_ADMIN, ADMIN, MANAGER, USER, VIEWER;

    public String value() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<UserRole> fromValue(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values()).filter(r -> r.value().equals(value)).findFirst();
    }
}
