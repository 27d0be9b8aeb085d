package com.statecraft.core.database.dao;

import com.statecraft.core.domain.buildings.InstalledBuilding;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ProvinceBuildingDAO {

    public void increment(Connection conn, String provinceId, String buildingId, int tier) throws SQLException {
        String sql = """
            INSERT INTO province_buildings (province_id, building_id, tier, count)
            VALUES (?, ?, ?, 1)
            ON CONFLICT (province_id, building_id, tier) DO UPDATE SET count = count + 1
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provinceId);
            ps.setString(2, buildingId);
            ps.setInt(3, tier);
            ps.executeUpdate();
        }
    }

    /**
     * Removes one building; the row is deleted when its count reaches zero.
     *
     * @return false when there was nothing to remove
     */
    public boolean decrement(Connection conn, String provinceId, String buildingId, int tier) throws SQLException {
        Optional<InstalledBuilding> row = find(conn, provinceId, buildingId, tier);
        if (row.isEmpty() || row.get().count() <= 0) return false;

        String sql = row.get().count() == 1
                ? "DELETE FROM province_buildings WHERE province_id = ? AND building_id = ? AND tier = ?"
                : "UPDATE province_buildings SET count = count - 1 WHERE province_id = ? AND building_id = ? AND tier = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provinceId);
            ps.setString(2, buildingId);
            ps.setInt(3, tier);
            ps.executeUpdate();
        }
        return true;
    }

    public Optional<InstalledBuilding> find(Connection conn, String provinceId, String buildingId, int tier) throws SQLException {
        String sql = "SELECT province_id, building_id, tier, count FROM province_buildings WHERE province_id = ? AND building_id = ? AND tier = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provinceId);
            ps.setString(2, buildingId);
            ps.setInt(3, tier);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    /** Every installed building in the world, in a stable order. */
    public List<InstalledBuilding> findAll(Connection conn) throws SQLException {
        List<InstalledBuilding> out = new ArrayList<>();
        String sql = "SELECT province_id, building_id, tier, count FROM province_buildings WHERE count > 0 ORDER BY province_id, building_id, tier";
        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(map(rs));
        }
        return out;
    }

    /**
     * Buildings in the provinces a nation controls, optionally limited to one state.
     */
    public List<InstalledBuilding> controlledBy(Connection conn, String nationId, String stateId) throws SQLException {
        String sql = """
            SELECT pb.province_id, pb.building_id, pb.tier, pb.count
            FROM province_buildings pb
            JOIN provinces p ON p.province_id = pb.province_id
            WHERE p.controller_id = ? AND (? IS NULL OR p.state_id = ?) AND pb.count > 0
            ORDER BY pb.province_id, pb.building_id, pb.tier
        """;
        List<InstalledBuilding> out = new ArrayList<>();
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

    /**
     * Sum of {@code maintenance_manpower * count} over the nation's buildings in one state.
     */
    public long maintenanceManpowerInState(Connection conn, String nationId, String stateId) throws SQLException {
        String sql = """
            SELECT COALESCE(SUM(bt.maintenance_manpower * pb.count), 0)
            FROM province_buildings pb
            JOIN provinces p ON p.province_id = pb.province_id
            JOIN building_templates bt ON bt.id = pb.building_id
            WHERE p.controller_id = ? AND p.state_id = ?
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, stateId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /**
     * Maintenance bill per controlling nation: {@code maintenance_cash * count} over all of its buildings.
     * Buildings in uncontrolled provinces are not billed.
     */
    public Map<String, Double> maintenanceCashByNation(Connection conn) throws SQLException {
        String sql = """
            SELECT p.controller_id AS nation_id, SUM(bt.maintenance_cash * pb.count) AS bill
            FROM province_buildings pb
            JOIN provinces p ON p.province_id = pb.province_id
            JOIN building_templates bt ON bt.id = pb.building_id
            WHERE p.controller_id IS NOT NULL AND pb.count > 0
            GROUP BY p.controller_id
            ORDER BY p.controller_id
        """;
        Map<String, Double> out = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.put(rs.getString("nation_id"), rs.getDouble("bill"));
        }
        return out;
    }

    private static InstalledBuilding map(ResultSet rs) throws SQLException {
        return new InstalledBuilding(
                rs.getString("province_id"),
                rs.getString("building_id"),
                rs.getInt("tier"),
                rs.getInt("count")
        );
    }
}
