package com.statecraft.core.domain.military;

public record Army(long armyId, String nationId, String name, String stateId) {}
