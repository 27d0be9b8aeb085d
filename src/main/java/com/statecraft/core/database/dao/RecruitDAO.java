package com.statecraft.core.database.dao;

import com.statecraft.core.domain.military.Recruit;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class RecruitDAO {

    private static final String COLUMNS =
            "recruit_id, nation_id, army_id, state_id, province_id, unit_template_id, created_turn, status";

    public long insert(Connection conn, String nationId, Long armyId, String stateId, String provinceId,
                       String templateId, int createdTurn) throws SQLException {
        String sql = """
            INSERT INTO recruits (nation_id, army_id, state_id, province_id, unit_template_id, created_turn, status)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            SqlSupport.setNullableLong(ps, 2, armyId);
            ps.setString(3, stateId);
            ps.setString(4, provinceId);
            ps.setString(5, templateId);
            ps.setInt(6, createdTurn);
            ps.setString(7, Recruit.QUEUED);
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public Optional<Recruit> find(Connection conn, long recruitId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM recruits WHERE recruit_id = ?")) {
            ps.setLong(1, recruitId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    /**
     * A nation's recruits, optionally limited to one state ({@code stateId == null} lists all).
     */
    public List<Recruit> list(Connection conn, String nationId, String stateId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM recruits WHERE nation_id = ? AND (? IS NULL OR state_id = ?) ORDER BY recruit_id";
        List<Recruit> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, stateId);
            ps.setString(3, stateId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        }
        return out;
    }

    public boolean delete(Connection conn, long recruitId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM recruits WHERE recruit_id = ?")) {
            ps.setLong(1, recruitId);
            return ps.executeUpdate() == 1;
        }
    }

    /**
     * Manpower tied up by queued recruits of a nation in one state.
     */
    public long queuedManpowerInState(Connection conn, String nationId, String stateId) throws SQLException {
        String sql = """
            SELECT COALESCE(SUM(ut.manpower_cost), 0)
            FROM recruits r
            JOIN unit_templates ut ON ut.template_id = r.unit_template_id
            WHERE r.nation_id = ? AND r.state_id = ? AND r.status = ?
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, stateId);
            ps.setString(3, Recruit.QUEUED);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private static Recruit map(ResultSet rs) throws SQLException {
        return new Recruit(
                rs.getLong("recruit_id"),
                rs.getString("nation_id"),
                SqlSupport.getNullableLong(rs, "army_id"),
                rs.getString("state_id"),
                rs.getString("province_id"),
                rs.getString("unit_template_id"),
                rs.getInt("created_turn"),
                rs.getString("status")
        );
    }
}
