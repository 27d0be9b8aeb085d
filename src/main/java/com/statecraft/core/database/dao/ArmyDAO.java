package com.statecraft.core.database.dao;

import com.statecraft.core.domain.military.Army;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public class ArmyDAO {

    public long insert(Connection conn, String nationId, String name, String stateId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO armies (nation_id, name, state_id) VALUES (?, ?, ?)")) {
            ps.setString(1, nationId);
            ps.setString(2, name);
            ps.setString(3, stateId);
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public Optional<Army> find(Connection conn, long armyId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT army_id, nation_id, name, state_id FROM armies WHERE army_id = ?")) {
            ps.setLong(1, armyId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    private static Army map(ResultSet rs) throws SQLException {
        return new Army(rs.getLong("army_id"), rs.getString("nation_id"), rs.getString("name"), rs.getString("state_id"));
    }
}
