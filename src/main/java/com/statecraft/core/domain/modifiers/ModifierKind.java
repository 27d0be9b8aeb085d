package com.statecraft.core.domain.modifiers;

import java.util.Locale;
import java.util.Optional;

public enum ModifierKind {
    MUL,
    ADD;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModifierKind> parse(String text) {
        if (text == null) return Optional.empty();
        for (ModifierKind v : values()) {
            if (v.name().equalsIgnoreCase(text.trim())) return Optional.of(v);
        }
        return Optional.empty();
    }

    public static ModifierKind fromDb(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Unknown ModifierKind: " + text));
    }
}
