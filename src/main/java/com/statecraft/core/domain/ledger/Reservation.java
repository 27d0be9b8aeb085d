package com.statecraft.core.domain.ledger;

public record Reservation(long id, long buildId, String provinceId, Resource resource, double amount) {}
