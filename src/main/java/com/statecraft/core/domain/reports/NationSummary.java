package com.statecraft.core.domain.reports;

public record NationSummary(
        String nationId,
        String name,
        double cash,
        double debt,
        double taxRate,
        long population,
        int provinces,
        long buildingManpower,
        long recruitableManpower,
        long manpowerUsed,
        double taxModifier,
        double estimatedTaxIncome
) {}
