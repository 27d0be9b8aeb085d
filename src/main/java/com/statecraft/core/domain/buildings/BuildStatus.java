package com.statecraft.core.domain.buildings;

import java.util.Locale;

public enum BuildStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BuildStatus fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
