package com.statecraft.core.database.dao;

import com.statecraft.core.domain.buildings.BuildStatus;
import com.statecraft.core.domain.buildings.PendingBuild;
import com.statecraft.core.domain.ledger.Reservation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class StateBuildDAO {

    private static final String COLUMNS =
            "id, nation_id, state_id, building_id, tier, started_turn, complete_turn, status, cash_paid, reserved_json";

    public long insertPending(Connection conn, String nationId, String stateId, String buildingId,
                              int tier, int startedTurn, int completeTurn) throws SQLException {
        String sql = """
            INSERT INTO state_builds (nation_id, state_id, building_id, tier, started_turn, complete_turn, status)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, stateId);
            ps.setString(3, buildingId);
            ps.setInt(4, tier);
            ps.setInt(5, startedTurn);
            ps.setInt(6, completeTurn);
            ps.setString(7, BuildStatus.PENDING.dbValue());
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public void recordReservations(Connection conn, long buildId, double cashPaid, List<Reservation> reserved) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE state_builds SET cash_paid = ?, reserved_json = ? WHERE id = ?")) {
            ps.setDouble(1, cashPaid);
            ps.setString(2, ResourceJson.encodeReservations(reserved));
            ps.setLong(3, buildId);
            ps.executeUpdate();
        }
    }

    public Optional<PendingBuild> find(Connection conn, long buildId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM state_builds WHERE id = ?")) {
            ps.setLong(1, buildId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    /**
     * Pending builds with {@code complete_turn <= turn}, oldest first.
     */
    public List<PendingBuild> dueBy(Connection conn, int turn) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM state_builds WHERE status = ? AND complete_turn <= ? ORDER BY complete_turn, id";
        List<PendingBuild> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, BuildStatus.PENDING.dbValue());
            ps.setInt(2, turn);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        }
        return out;
    }

    public List<PendingBuild> pendingFor(Connection conn, String nationId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM state_builds WHERE nation_id = ? AND status = ? ORDER BY complete_turn, id";
        List<PendingBuild> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, BuildStatus.PENDING.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Moves a build out of pending. Returns false when the row was no longer pending.
     */
    public boolean finish(Connection conn, long buildId, BuildStatus status) throws SQLException {
        String sql = "UPDATE state_builds SET status = ? WHERE id = ? AND status = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            ps.setLong(2, buildId);
            ps.setString(3, BuildStatus.PENDING.dbValue());
            return ps.executeUpdate() == 1;
        }
    }

    public void delete(Connection conn, long buildId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM state_builds WHERE id = ?")) {
            ps.setLong(1, buildId);
            ps.executeUpdate();
        }
    }

    private static PendingBuild map(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        return new PendingBuild(
                id,
                rs.getString("nation_id"),
                rs.getString("state_id"),
                rs.getString("building_id"),
                rs.getInt("tier"),
                rs.getInt("started_turn"),
                rs.getInt("complete_turn"),
                BuildStatus.fromDb(rs.getString("status")),
                rs.getDouble("cash_paid"),
                ResourceJson.decodeReservations(id, rs.getString("reserved_json"))
        );
    }
}
