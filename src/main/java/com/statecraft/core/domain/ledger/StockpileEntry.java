package com.statecraft.core.domain.ledger;

/**
 * One (province, resource) ledger row.
 * {@code capacity} is a hard ceiling, zero included, unless {@code uncapped} is set.
 */
public record StockpileEntry(String provinceId, Resource resource, double amount, double capacity, boolean uncapped) {

    public double clampToCapacity(double newAmount) {
        if (uncapped) return newAmount;
        return Math.min(newAmount, capacity);
    }
}
