package com.statecraft.core.domain.military;

/**
 * One queued unit. {@code armyId} and {@code provinceId} may be null.
 */
public record Recruit(
        long recruitId,
        String nationId,
        Long armyId,
        String stateId,
        String provinceId,
        String unitTemplateId,
        int createdTurn,
        String status
) {
    public static final String QUEUED = "queued";
}
