package com.statecraft.core.domain.modifiers;

public record FinalModifiers(EffectAggregate production, EffectAggregate population, EffectAggregate tax) {
}
