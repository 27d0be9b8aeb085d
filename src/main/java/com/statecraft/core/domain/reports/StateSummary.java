package com.statecraft.core.domain.reports;

import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;

import java.util.Map;

/**
 * Per-turn picture of one state as seen by one nation. {@code produced} already includes the production modifier.
 */
public record StateSummary(
        String nationId,
        String stateId,
        String stateName,
        long population,
        Map<Resource, StockTotal> stock,
        ResourceMap produced,
        ResourceMap consumed,
        Map<Resource, Double> net,
        double productionModifier,
        double estimatedTaxIncome
) {
    public StateSummary {
        stock = Map.copyOf(stock);
        net = Map.copyOf(net);
    }

    public record StockTotal(double amount, double capacity) {}
}
