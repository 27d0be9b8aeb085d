package com.statecraft.core.database.dao;

import com.statecraft.core.domain.buildings.BuildingTemplate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class BuildingTemplateDAO {

    private static final String COLUMNS = """
        id, name, build_cost_resources, build_cash_cost, build_time_turns,
        inputs, outputs, maintenance_cash, maintenance_manpower
    """;

    private static final String UPSERT_SQL = """
        INSERT INTO building_templates (id, name, build_cost_resources, build_cash_cost, build_time_turns,
                                        inputs, outputs, maintenance_cash, maintenance_manpower)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (id) DO UPDATE SET
            name = excluded.name,
            build_cost_resources = excluded.build_cost_resources,
            build_cash_cost = excluded.build_cash_cost,
            build_time_turns = excluded.build_time_turns,
            inputs = excluded.inputs,
            outputs = excluded.outputs,
            maintenance_cash = excluded.maintenance_cash,
            maintenance_manpower = excluded.maintenance_manpower
    """;

    public Optional<BuildingTemplate> find(Connection conn, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM building_templates WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public List<BuildingTemplate> findAll(Connection conn) throws SQLException {
        List<BuildingTemplate> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM building_templates ORDER BY id");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(map(rs));
        }
        return out;
    }

    public void upsert(Connection conn, BuildingTemplate t) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, t.id());
            ps.setString(2, t.name());
            ps.setString(3, ResourceJson.encode(t.cost()));
            ps.setDouble(4, t.cashCost());
            ps.setInt(5, t.buildTimeTurns());
            ps.setString(6, ResourceJson.encode(t.inputs()));
            ps.setString(7, ResourceJson.encode(t.outputs()));
            ps.setDouble(8, t.maintenanceCash());
            ps.setLong(9, t.maintenanceManpower());
            ps.executeUpdate();
        }
    }

    private static BuildingTemplate map(ResultSet rs) throws SQLException {
        return new BuildingTemplate(
                rs.getString("id"),
                rs.getString("name"),
                ResourceJson.decode(rs.getString("build_cost_resources")),
                rs.getDouble("build_cash_cost"),
                rs.getInt("build_time_turns"),
                ResourceJson.decode(rs.getString("inputs")),
                ResourceJson.decode(rs.getString("outputs")),
                rs.getDouble("maintenance_cash"),
                rs.getLong("maintenance_manpower")
        );
    }
}
