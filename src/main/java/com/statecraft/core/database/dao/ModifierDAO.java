package com.statecraft.core.database.dao;

import com.statecraft.core.domain.modifiers.Modifier;
import com.statecraft.core.domain.modifiers.ModifierEffect;
import com.statecraft.core.domain.modifiers.ModifierKind;
import com.statecraft.core.domain.modifiers.ModifierScope;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ModifierDAO {

    private static final String COLUMNS =
            "id, scope, scope_id, effect, kind, value, source, created_turn, expires_turn, active";

    public long insert(Connection conn, ModifierScope scope, String scopeId, ModifierEffect effect, ModifierKind kind,
                       double value, String source, Integer createdTurn, Integer expiresTurn) throws SQLException {
        String sql = """
            INSERT INTO modifiers (scope, scope_id, effect, kind, value, source, created_turn, expires_turn, active)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, 1)
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, scope.dbValue());
            ps.setString(2, scopeId);
            ps.setString(3, effect.dbValue());
            ps.setString(4, kind.dbValue());
            ps.setDouble(5, value);
            ps.setString(6, source);
            SqlSupport.setNullableInt(ps, 7, createdTurn);
            SqlSupport.setNullableInt(ps, 8, expiresTurn);
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public Optional<Modifier> find(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM modifiers WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public boolean delete(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM modifiers WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    /**
     * Filtered listing; a null {@code scope} or {@code scopeId} matches anything.
     */
    public List<Modifier> list(Connection conn, ModifierScope scope, String scopeId, boolean onlyActive) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM modifiers"
                + " WHERE (? IS NULL OR scope = ?) AND (? IS NULL OR scope_id = ?) AND (? = 0 OR active = 1)"
                + " ORDER BY id";
        String scopeText = scope == null ? null : scope.dbValue();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, scopeText);
            ps.setString(2, scopeText);
            ps.setString(3, scopeId);
            ps.setString(4, scopeId);
            ps.setInt(5, onlyActive ? 1 : 0);
            return collect(ps);
        }
    }

    /**
     * Active rows scoped to the world, to {@code nationId} or to {@code stateId}.
     */
    public List<Modifier> activeFor(Connection conn, String nationId, String stateId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM modifiers"
                + " WHERE active = 1 AND (scope = 'global'"
                + " OR (scope = 'nation' AND scope_id = ?)"
                + " OR (scope = 'state' AND scope_id = ?))"
                + " ORDER BY id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, stateId);
            return collect(ps);
        }
    }

    /**
     * Flags as inactive every active modifier whose {@code expires_turn < turn}.
     */
    public int deactivateExpired(Connection conn, int turn) throws SQLException {
        String sql = "UPDATE modifiers SET active = 0 WHERE active = 1 AND expires_turn IS NOT NULL AND expires_turn < ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, turn);
            return ps.executeUpdate();
        }
    }

    private static List<Modifier> collect(PreparedStatement ps) throws SQLException {
        List<Modifier> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(map(rs));
        }
        return out;
    }

    private static Modifier map(ResultSet rs) throws SQLException {
        return new Modifier(
                rs.getLong("id"),
                ModifierScope.fromDb(rs.getString("scope")),
                rs.getString("scope_id"),
                ModifierEffect.fromDb(rs.getString("effect")),
                ModifierKind.fromDb(rs.getString("kind")),
                rs.getDouble("value"),
                rs.getString("source"),
                SqlSupport.getNullableInt(rs, "created_turn"),
                SqlSupport.getNullableInt(rs, "expires_turn"),
                rs.getInt("active") != 0
        );
    }
}
