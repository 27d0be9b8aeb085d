package com.statecraft.core.domain.trade;

import com.statecraft.core.domain.ledger.ResourceMap;

import java.time.Instant;

/**
 * Direct proposal from one nation to another. {@code offeredCash} is held in escrow while the offer is open.
 */
public record TradeOffer(
        long id,
        String fromNation,
        String toNation,
        ResourceMap offered,
        ResourceMap requested,
        double offeredCash,
        double requestedCash,
        OfferStatus status,
        TransportMode mode,
        Instant createdAt,
        Instant resolvedAt
) {
    public boolean isOpen() {
        return status == OfferStatus.OPEN;
    }
}
