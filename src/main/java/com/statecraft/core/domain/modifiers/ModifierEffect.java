package com.statecraft.core.domain.modifiers;

import java.util.Locale;
import java.util.Optional;

public enum ModifierEffect {
    PRODUCTION,
    POPULATION,
    TAX,
    ALL;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModifierEffect> parse(String text) {
        if (text == null) return Optional.empty();
        for (ModifierEffect v : values()) {
            if (v.name().equalsIgnoreCase(text.trim())) return Optional.of(v);
        }
        return Optional.empty();
    }

    public boolean appliesTo(ModifierEffect target) {
        return this == ALL || this == target;
    }

    public static ModifierEffect fromDb(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Unknown ModifierEffect: " + text));
    }
}
