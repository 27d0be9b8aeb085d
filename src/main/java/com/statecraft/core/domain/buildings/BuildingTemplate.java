package com.statecraft.core.domain.buildings;

import com.statecraft.core.domain.ledger.ResourceMap;

/**
 * Immutable reference data for one building type.
 * Costs are per tier; inputs and outputs are per unit of {@code count * tier}.
 */
public record BuildingTemplate(
        String id,
        String name,
        ResourceMap cost,
        double cashCost,
        int buildTimeTurns,
        ResourceMap inputs,
        ResourceMap outputs,
        double maintenanceCash,
        long maintenanceManpower
) {
    public ResourceMap costForTier(int tier) {
        return cost.scale(tier);
    }

    public double cashCostForTier(int tier) {
        return cashCost * tier;
    }
}
