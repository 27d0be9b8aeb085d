package com.statecraft.core.domain.trade;

public record TransportEstimate(double weightKg, double distance, TransportMode mode, double cost) {}
