package com.statecraft.core.database.dao;

import com.statecraft.core.domain.military.UnitTemplate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class UnitTemplateDAO {

    private static final String COLUMNS = """
        template_id, display_name, category, manpower_cost, build_cash_cost, resources_json,
        tech_required, classification, reference_nation
    """;

    private static final String UPSERT_SQL = """
        INSERT INTO unit_templates (template_id, display_name, category, manpower_cost, build_cash_cost,
                                    resources_json, tech_required, classification, reference_nation)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (template_id) DO UPDATE SET
            display_name = excluded.display_name,
            category = excluded.category,
            manpower_cost = excluded.manpower_cost,
            build_cash_cost = excluded.build_cash_cost,
            resources_json = excluded.resources_json,
            tech_required = excluded.tech_required,
            classification = excluded.classification,
            reference_nation = excluded.reference_nation
    """;

    public Optional<UnitTemplate> find(Connection conn, String templateId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM unit_templates WHERE template_id = ?")) {
            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public List<UnitTemplate> findAll(Connection conn) throws SQLException {
        List<UnitTemplate> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM unit_templates ORDER BY category, display_name");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(map(rs));
        }
        return out;
    }

    public void upsert(Connection conn, UnitTemplate t) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, t.templateId());
            ps.setString(2, t.displayName());
            ps.setString(3, t.category());
            ps.setLong(4, t.manpowerCost());
            ps.setDouble(5, t.cashCost());
            ps.setString(6, ResourceJson.encode(t.resources()));
            ps.setString(7, t.techRequired());
            ps.setString(8, t.classification());
            ps.setString(9, t.referenceNation());
            ps.executeUpdate();
        }
    }

    private static UnitTemplate map(ResultSet rs) throws SQLException {
        return new UnitTemplate(
                rs.getString("template_id"),
                rs.getString("display_name"),
                rs.getString("category"),
                rs.getLong("manpower_cost"),
                rs.getDouble("build_cash_cost"),
                ResourceJson.decode(rs.getString("resources_json")),
                rs.getString("tech_required"),
                rs.getString("classification"),
                rs.getString("reference_nation")
        );
    }
}
