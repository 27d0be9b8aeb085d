package com.statecraft.core.domain.modifiers;

import java.util.Locale;
import java.util.Optional;

/**
 * Where a modifier applies. PROVINCE rows are stored but never picked up by {@link ModifierAggregator}.
 */
public enum ModifierScope {
    GLOBAL,
    NATION,
    STATE,
    PROVINCE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModifierScope> parse(String text) {
        if (text == null) return Optional.empty();
        for (ModifierScope v : values()) {
            if (v.name().equalsIgnoreCase(text.trim())) return Optional.of(v);
        }
        return Optional.empty();
    }

    public boolean needsScopeId() {
        return this != GLOBAL;
    }

    public static ModifierScope fromDb(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Unknown ModifierScope: " + text));
    }
}
