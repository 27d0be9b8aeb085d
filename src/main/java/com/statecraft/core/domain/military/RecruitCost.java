package com.statecraft.core.domain.military;

import com.statecraft.core.domain.ledger.ResourceMap;

public record RecruitCost(int quantity, long manpower, double cash, ResourceMap resources) {}
