package com.statecraft.core.domain.buildings;

public record InstalledBuilding(String provinceId, String buildingId, int tier, int count) {

    /** Scale applied to inputs, outputs and maintenance. */
    public int multiplier() {
        return count * tier;
    }
}
