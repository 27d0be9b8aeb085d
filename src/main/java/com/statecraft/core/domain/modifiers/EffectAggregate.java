package com.statecraft.core.domain.modifiers;

import java.util.List;

/**
 * One effect's breakdown: {@code finalValue = max(0, (1 + addSum) * mulProduct)}.
 */
public record EffectAggregate(ModifierEffect effect, double addSum, double mulProduct, double finalValue, List<Long> modifierIds) {

    public EffectAggregate {
        modifierIds = List.copyOf(modifierIds);
    }

    public static EffectAggregate neutral(ModifierEffect effect) {
        return new EffectAggregate(effect, 0.0, 1.0, 1.0, List.of());
    }
}
