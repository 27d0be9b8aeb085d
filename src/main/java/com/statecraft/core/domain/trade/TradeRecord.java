package com.statecraft.core.domain.trade;

import com.statecraft.core.domain.ledger.ResourceMap;

import java.time.Instant;

/** Ledger entry written for every settled offer. */
public record TradeRecord(
        long id,
        long offerId,
        String fromNation,
        String toNation,
        ResourceMap offered,
        ResourceMap requested,
        double cashExchanged,
        double transportCost,
        int turn,
        Instant createdAt
) {}
