package com.statecraft.core.domain.trade;

import com.statecraft.core.domain.ledger.Resource;

import java.time.Instant;

public record MarketPost(
        long id,
        String posterNation,
        Resource resource,
        double quantity,
        double pricePerUnit,
        boolean sell,
        TransportMode mode,
        Instant createdAt
) {
    public double total() {
        return quantity * pricePerUnit;
    }
}
