package com.statecraft.core.database.dao;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Key/value rows of the {@code config} table; the authoritative turn counter lives here.
 */
public class GameStateDAO {

    public static final String CURRENT_TURN = "current_turn";

    public int currentTurn(Connection conn) throws SQLException {
        String value = get(conn, CURRENT_TURN);
        if (value == null || value.isBlank()) return 0;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new SQLException("config.current_turn is not a number: " + value, e);
        }
    }

    public void setCurrentTurn(Connection conn, int turn) throws SQLException {
        put(conn, CURRENT_TURN, String.valueOf(turn));
    }

    public String get(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM config WHERE key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString("value") : null;
            }
        }
    }

    public void put(Connection conn, String key, String value) throws SQLException {
        String sql = "INSERT INTO config (key, value) VALUES (?, ?) ON CONFLICT (key) DO UPDATE SET value = excluded.value";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }
}
