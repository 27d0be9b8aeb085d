package com.statecraft.core.domain.ledger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Immutable resource -> quantity map. Quantities are finite and never negative; zero entries are dropped.
 */
public final class ResourceMap {

    private static final ResourceMap EMPTY = new ResourceMap(new EnumMap<>(Resource.class));

    private final EnumMap<Resource, Double> amounts;

    private ResourceMap(EnumMap<Resource, Double> amounts) {
        this.amounts = amounts;
    }

    public static ResourceMap empty() {
        return EMPTY;
    }

    public static ResourceMap of(Resource resource, double amount) {
        return builder().put(resource, amount).build();
    }

    public static ResourceMap of(Resource r1, double a1, Resource r2, double a2) {
        return builder().put(r1, a1).put(r2, a2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double get(Resource resource) {
        return amounts.getOrDefault(resource, 0.0);
    }

    public boolean isEmpty() {
        return amounts.isEmpty();
    }

    public int size() {
        return amounts.size();
    }

    public Map<Resource, Double> asMap() {
        return Collections.unmodifiableMap(amounts);
    }

    public void forEach(BiConsumer<Resource, Double> action) {
        amounts.forEach(action);
    }

    public ResourceMap scale(double factor) {
        Builder b = builder();
        amounts.forEach((r, v) -> b.put(r, v * factor));
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceMap other)) return false;
        return amounts.equals(other.amounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amounts);
    }

    @Override
    public String toString() {
        return amounts.toString();
    }

    public static final class Builder {
        private final EnumMap<Resource, Double> amounts = new EnumMap<>(Resource.class);

        private Builder() {}

        public Builder put(Resource resource, double amount) {
            Objects.requireNonNull(resource, "resource");
            check(resource, amount);
            if (amount == 0.0) {
                amounts.remove(resource);
            } else {
                amounts.put(resource, amount);
            }
            return this;
        }

        public Builder add(Resource resource, double amount) {
            return put(resource, amounts.getOrDefault(resource, 0.0) + amount);
        }

        public ResourceMap build() {
            if (amounts.isEmpty()) return EMPTY;
            return new ResourceMap(new EnumMap<>(amounts));
        }

        private static void check(Resource resource, double amount) {
            if (Double.isNaN(amount) || Double.isInfinite(amount) || amount < 0.0) {
                throw new IllegalArgumentException("Invalid quantity for " + resource.displayName() + ": " + amount);
            }
        }
    }
}
