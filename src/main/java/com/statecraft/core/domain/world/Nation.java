package com.statecraft.core.domain.world;

public record Nation(
        String nationId,
        String name,
        double cash,
        double debt,
        double taxRate,
        long manpowerUsed,
        String affiliation,
        boolean wgrdMember
) {}
