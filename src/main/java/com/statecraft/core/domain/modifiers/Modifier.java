package com.statecraft.core.domain.modifiers;

public record Modifier(
        long id,
        ModifierScope scope,
        String scopeId,
        ModifierEffect effect,
        ModifierKind kind,
        double value,
        String source,
        Integer createdTurn,
        Integer expiresTurn,
        boolean active
) {
    /**
     * Expired once {@code expires_turn < turn}; a modifier still counts on its expiry turn.
     */
    public boolean isExpiredAt(int turn) {
        return expiresTurn != null && expiresTurn < turn;
    }
}
