package com.statecraft.core.domain.buildings;

import com.statecraft.core.domain.ledger.Reservation;

import java.util.List;

/**
 * A row of the build queue. {@code reserved} is the snapshot written when the build started;
 * the live claims are the reservation rows keyed by {@code id}.
 */
public record PendingBuild(
        long id,
        String nationId,
        String stateId,
        String buildingId,
        int tier,
        int startedTurn,
        int completeTurn,
        BuildStatus status,
        double cashPaid,
        List<Reservation> reserved
) {
    public PendingBuild {
        reserved = reserved == null ? List.of() : List.copyOf(reserved);
    }
}
