package com.statecraft.core.domain.ledger;

import java.util.Locale;
import java.util.Optional;

/**
 * Every good that can sit in a province stockpile.
 * The display name is what persisted JSON maps and the resources table use as key.
 */
public enum Resource {

    RAW_ORE("Raw Ore", Category.RAW, 1.0),
    COAL("Coal", Category.RAW, 1.0),
    OIL("Oil", Category.RAW, 0.9),
    FOOD("Food", Category.RAW, 0.5),
    RAW_URANIUM("Raw Uranium", Category.RAW, 2.0),
    IRON("Iron", Category.REFINED, 1.5),
    FUEL("Fuel", Category.REFINED, 0.8),
    MILITARY_GOODS("Military Goods", Category.REFINED, 1.2),
    STEEL("Steel", Category.ADVANCED, 1.6),
    REFINED_URANIUM("Refined Uranium", Category.ADVANCED, 2.5);

    public enum Category {
        RAW,
        REFINED,
        ADVANCED
    }

    private final String displayName;
    private final Category category;
    private final double defaultWeightKg;

    Resource(String displayName, Category category, double defaultWeightKg) {
        this.displayName = displayName;
        this.category = category;
        this.defaultWeightKg = defaultWeightKg;
    }

    public String displayName() {
        return displayName;
    }

    public Category category() {
        return category;
    }

    public double defaultWeightKg() {
        return defaultWeightKg;
    }

    /**
     * Accepts the display name ("Raw Ore") or the constant name ("RAW_ORE"), case-insensitive.
     */
    public static Optional<Resource> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String t = text.trim();
        for (Resource r : values()) {
            if (r.displayName.equalsIgnoreCase(t) || r.name().equalsIgnoreCase(t)) return Optional.of(r);
        }
        String normalized = t.toUpperCase(Locale.ROOT).replace(' ', '_');
        for (Resource r : values()) {
            if (r.name().equals(normalized)) return Optional.of(r);
        }
        return Optional.empty();
    }

    public static Resource require(String text) {
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Unknown resource: " + text));
    }

    @Override
    public String toString() {
        return displayName;
    }
}
