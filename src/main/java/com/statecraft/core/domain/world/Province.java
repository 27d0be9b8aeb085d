package com.statecraft.core.domain.world;

public record Province(
        String provinceId,
        String stateId,
        String controllerId,
        String name,
        long population,
        double nodeStrength,
        Double x,
        Double y
) {

    public boolean isControlledBy(String nationId) {
        return controllerId != null && controllerId.equals(nationId);
    }

    public boolean hasCoordinates() {
        return x != null && y != null;
    }
}
