package com.statecraft.core.domain.trade;

import java.util.Locale;
import java.util.Optional;

public enum TransportMode {
    LAND(1.0),
    RAIL(0.7),
    SEA(0.4),
    AUTO(1.0);

    private final double factor;

    TransportMode(double factor) {
        this.factor = factor;
    }

    public double factor() {
        return factor;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TransportMode> parse(String text) {
        if (text == null || text.isBlank()) return Optional.of(AUTO);
        for (TransportMode m : values()) {
            if (m.name().equalsIgnoreCase(text.trim())) return Optional.of(m);
        }
        return Optional.empty();
    }

    public static TransportMode fromDb(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Unknown transport mode: " + text));
    }
}
