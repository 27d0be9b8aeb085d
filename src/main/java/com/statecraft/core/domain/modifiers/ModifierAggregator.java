package com.statecraft.core.domain.modifiers;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.ModifierDAO;
import com.statecraft.core.domain.result.EngineError;
import com.statecraft.core.domain.result.EngineException;
import com.statecraft.core.domain.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes global, nation and state modifiers into the final production, population and tax factors,
 * and owns the modifier table.
 *
 * <p>For each effect: {@code final = max(0, (1 + addSum) * mulProduct)}. Additive values are summed first,
 * inside the parentheses; the product of an empty set is 1. Rows with effect {@code all} count for every effect.
 */
public class ModifierAggregator {

    private static final Logger log = LoggerFactory.getLogger(ModifierAggregator.class);

    private final DatabaseManager db;
    private final ModifierDAO dao;

    public ModifierAggregator(DatabaseManager db, ModifierDAO dao) {
        this.db = db;
        this.dao = dao;
    }

    // ==========================================================
    // AGGREGATION
    // ==========================================================

    public Result<FinalModifiers> computeFinal(String nationId, String stateId, Integer currentTurn) {
        return Result.attempt(log, "computeFinalModifiers",
                () -> db.read(conn -> computeFinal(conn, nationId, stateId, currentTurn)));
    }

    public FinalModifiers computeFinal(Connection conn, String nationId, String stateId, Integer currentTurn) throws SQLException {
        return aggregate(dao.activeFor(conn, nationId, stateId), currentTurn);
    }

    /**
     * Pure fold over already-selected rows. Inactive rows, PROVINCE rows and rows expired at
     * {@code currentTurn} are skipped; a null turn disables the expiry check.
     */
    public static FinalModifiers aggregate(List<Modifier> modifiers, Integer currentTurn) {
        return new FinalModifiers(
                aggregateEffect(modifiers, ModifierEffect.PRODUCTION, currentTurn),
                aggregateEffect(modifiers, ModifierEffect.POPULATION, currentTurn),
                aggregateEffect(modifiers, ModifierEffect.TAX, currentTurn));
    }

    static EffectAggregate aggregateEffect(List<Modifier> modifiers, ModifierEffect target, Integer currentTurn) {
        double addSum = 0.0;
        double mulProduct = 1.0;
        List<Long> used = new ArrayList<>();

        for (Modifier m : modifiers) {
            if (!m.active() || m.scope() == ModifierScope.PROVINCE) continue;
            if (!m.effect().appliesTo(target)) continue;
            if (currentTurn != null && m.isExpiredAt(currentTurn)) continue;

            if (m.kind() == ModifierKind.ADD) addSum += m.value();
            else mulProduct *= m.value();
            used.add(m.id());
        }

        if (used.isEmpty()) return EffectAggregate.neutral(target);

        double finalValue = Math.max(0.0, (1.0 + addSum) * mulProduct);
        return new EffectAggregate(target, addSum, mulProduct, finalValue, used);
    }

    // ==========================================================
    // ADMIN
    // ==========================================================

    public Result<Long> addModifier(String scope, String scopeId, String effect, String kind, double value,
                                    String source, Integer createdTurn, Integer expiresTurn) {
        return Result.attempt(log, "addModifier", () -> {
            ModifierScope s = ModifierScope.parse(scope)
                    .orElseThrow(() -> invalid("Unknown modifier scope: " + scope));
            ModifierEffect e = ModifierEffect.parse(effect)
                    .orElseThrow(() -> invalid("Unknown modifier effect: " + effect));
            ModifierKind k = ModifierKind.parse(kind)
                    .orElseThrow(() -> invalid("Unknown modifier kind: " + kind));

            if (s.needsScopeId() && (scopeId == null || scopeId.isBlank())) {
                throw invalid("A " + s.dbValue() + " modifier needs a scope id");
            }
            if (!Double.isFinite(value)) throw invalid("Modifier value must be finite");

            String storedScopeId = s.needsScopeId() ? scopeId : null;
            long id = db.inTransaction(conn ->
                    dao.insert(conn, s, storedScopeId, e, k, value, source, createdTurn, expiresTurn));
            log.info("Modifier #{} added: {} {} {} {} {}", id, s.dbValue(),
                    storedScopeId == null ? "-" : storedScopeId, e.dbValue(), k.dbValue(), value);
            return id;
        });
    }

    public Result<Void> removeModifier(long id) {
        return Result.attempt(log, "removeModifier", () -> {
            boolean removed = db.inTransaction(conn -> dao.delete(conn, id));
            if (!removed) throw new EngineException(EngineError.notFound("Modifier #" + id + " not found"));
            log.info("Modifier #{} removed", id);
            return null;
        });
    }

    public Result<List<Modifier>> listModifiers(String scope, String scopeId, boolean onlyActive) {
        return Result.attempt(log, "listModifiers", () -> {
            ModifierScope s = null;
            if (scope != null && !scope.isBlank()) {
                s = ModifierScope.parse(scope).orElseThrow(() -> invalid("Unknown modifier scope: " + scope));
            }
            ModifierScope filter = s;
            return db.read(conn -> dao.list(conn, filter, scopeId, onlyActive));
        });
    }

    /**
     * Flags modifiers expired before {@code turn} as inactive. Called by the turn processor.
     */
    public int deactivateExpired(Connection conn, int turn) throws SQLException {
        return dao.deactivateExpired(conn, turn);
    }

    private static EngineException invalid(String message) {
        return new EngineException(EngineError.invalidArgument(message));
    }
}
