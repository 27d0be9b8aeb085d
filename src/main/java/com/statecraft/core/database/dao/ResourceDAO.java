package com.statecraft.core.database.dao;

import com.statecraft.core.domain.ledger.Resource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

public class ResourceDAO {

    public double weightKg(Connection conn, Resource resource) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT weight_kg FROM resources WHERE resource = ?")) {
            ps.setString(1, resource.displayName());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Math.max(0.0, rs.getDouble("weight_kg"));
            }
        }
        return resource.defaultWeightKg();
    }
}
