package com.statecraft.core.database.dao;

import com.statecraft.core.domain.world.Nation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Nation treasury rows. Cash and debt are the only fields the engine writes during play.
 */
public class NationDAO {

    private static final String SELECT_SQL =
            "SELECT nation_id, name, cash, debt, tax_rate, manpower_used, affiliation, wgrd_member FROM nations";

    private static final String UPSERT_SQL = """
        INSERT INTO nations (nation_id, name, cash, debt, tax_rate, manpower_used, affiliation, wgrd_member)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (nation_id) DO UPDATE SET
            name = excluded.name,
            cash = excluded.cash,
            debt = excluded.debt,
            tax_rate = excluded.tax_rate,
            manpower_used = excluded.manpower_used,
            affiliation = excluded.affiliation,
            wgrd_member = excluded.wgrd_member
    """;

    public Optional<Nation> find(Connection conn, String nationId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_SQL + " WHERE nation_id = ?")) {
            ps.setString(1, nationId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public List<Nation> findAll(Connection conn) throws SQLException {
        List<Nation> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SELECT_SQL + " ORDER BY nation_id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(map(rs));
        }
        return out;
    }

    public void upsert(Connection conn, Nation n) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, n.nationId());
            ps.setString(2, n.name());
            ps.setDouble(3, n.cash());
            ps.setDouble(4, n.debt());
            ps.setDouble(5, n.taxRate());
            ps.setLong(6, n.manpowerUsed());
            ps.setString(7, n.affiliation());
            ps.setInt(8, n.wgrdMember() ? 1 : 0);
            ps.executeUpdate();
        }
    }

    public double cash(Connection conn, String nationId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT cash FROM nations WHERE nation_id = ?")) {
            ps.setString(1, nationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getDouble("cash") : 0.0;
            }
        }
    }

    /**
     * Debits {@code amount} only if the balance covers it.
     *
     * @return false (nothing changed) when cash is short
     */
    public boolean debitIfCovered(Connection conn, String nationId, double amount) throws SQLException {
        if (amount <= 0) return true;
        String sql = "UPDATE nations SET cash = cash - ? WHERE nation_id = ? AND cash + ? >= ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDouble(1, amount);
            ps.setString(2, nationId);
            ps.setDouble(3, SqlSupport.EPSILON);
            ps.setDouble(4, amount);
            return ps.executeUpdate() == 1;
        }
    }

    public void credit(Connection conn, String nationId, double amount) throws SQLException {
        if (amount == 0) return;
        try (PreparedStatement ps = conn.prepareStatement("UPDATE nations SET cash = cash + ? WHERE nation_id = ?")) {
            ps.setDouble(1, amount);
            ps.setString(2, nationId);
            ps.executeUpdate();
        }
    }

    public void setCashAndDebt(Connection conn, String nationId, double cash, double debt) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE nations SET cash = ?, debt = ? WHERE nation_id = ?")) {
            ps.setDouble(1, cash);
            ps.setDouble(2, debt);
            ps.setString(3, nationId);
            ps.executeUpdate();
        }
    }

    public void adjustManpowerUsed(Connection conn, String nationId, long delta) throws SQLException {
        String sql = "UPDATE nations SET manpower_used = MAX(0, manpower_used + ?) WHERE nation_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, delta);
            ps.setString(2, nationId);
            ps.executeUpdate();
        }
    }

    public boolean hasTechnology(Connection conn, String nationId, String techId) throws SQLException {
        String sql = "SELECT 1 FROM player_technologies WHERE nation_id = ? AND tech_id = ? LIMIT 1";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, techId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    public void grantTechnology(Connection conn, String nationId, String techId) throws SQLException {
        String sql = "INSERT OR IGNORE INTO player_technologies (nation_id, tech_id) VALUES (?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, techId);
            ps.executeUpdate();
        }
    }

    private static Nation map(ResultSet rs) throws SQLException {
        return new Nation(
                rs.getString("nation_id"),
                rs.getString("name"),
                rs.getDouble("cash"),
                rs.getDouble("debt"),
                rs.getDouble("tax_rate"),
                rs.getLong("manpower_used"),
                rs.getString("affiliation"),
                rs.getInt("wgrd_member") != 0
        );
    }
}
