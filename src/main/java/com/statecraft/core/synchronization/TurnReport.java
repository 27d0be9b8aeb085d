package com.statecraft.core.synchronization;

/**
 * Outcome of one turn advance. {@code rowsSkipped} counts rows rolled back to their savepoint after an error.
 */
public record TurnReport(
        int turn,
        int buildsCompleted,
        int buildsFailed,
        int productionRows,
        int maintenanceRows,
        int modifiersExpired,
        int rowsSkipped
) {}
