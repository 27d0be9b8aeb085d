package com.statecraft.core.domain.trade;

import java.util.Locale;

public enum OfferStatus {
    OPEN,
    COMPLETED,
    CANCELLED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OfferStatus fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
