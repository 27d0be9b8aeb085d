package com.statecraft.core.database.dao;

import com.statecraft.core.domain.world.Province;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ProvinceDAO {

    private static final String COLUMNS = "province_id, state_id, controller_id, name, population, node_strength, x, y";

    // Ordine di servizio: node_strength piu' alto prima, poi id per avere un risultato deterministico
    private static final String SERVICE_ORDER = " ORDER BY node_strength DESC, province_id ASC";

    private static final String UPSERT_SQL = """
        INSERT INTO provinces (province_id, state_id, controller_id, name, population, node_strength, x, y)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (province_id) DO UPDATE SET
            state_id = excluded.state_id,
            controller_id = excluded.controller_id,
            name = excluded.name,
            population = excluded.population,
            node_strength = excluded.node_strength,
            x = excluded.x,
            y = excluded.y
    """;

    public Optional<Province> find(Connection conn, String provinceId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM provinces WHERE province_id = ?")) {
            ps.setString(1, provinceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    /**
     * Nation's provinces inside one state, in service order.
     */
    public List<Province> controlledInState(Connection conn, String nationId, String stateId) throws SQLException {
        return query(conn, "SELECT " + COLUMNS + " FROM provinces WHERE controller_id = ? AND state_id = ?" + SERVICE_ORDER,
                nationId, stateId);
    }

    /**
     * All provinces of a nation, in service order.
     */
    public List<Province> controlledBy(Connection conn, String nationId) throws SQLException {
        return query(conn, "SELECT " + COLUMNS + " FROM provinces WHERE controller_id = ?" + SERVICE_ORDER, nationId);
    }

    public Optional<Province> strongestInState(Connection conn, String nationId, String stateId) throws SQLException {
        return controlledInState(conn, nationId, stateId).stream().findFirst();
    }

    public Optional<Province> strongest(Connection conn, String nationId) throws SQLException {
        return controlledBy(conn, nationId).stream().findFirst();
    }

    public void upsert(Connection conn, Province p) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, p.provinceId());
            ps.setString(2, p.stateId());
            ps.setString(3, p.controllerId());
            ps.setString(4, p.name());
            ps.setLong(5, p.population());
            ps.setDouble(6, p.nodeStrength());
            SqlSupport.setNullableDouble(ps, 7, p.x());
            SqlSupport.setNullableDouble(ps, 8, p.y());
            ps.executeUpdate();
        }
    }

    public void setController(Connection conn, String provinceId, String nationId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE provinces SET controller_id = ? WHERE province_id = ?")) {
            ps.setString(1, nationId);
            ps.setString(2, provinceId);
            ps.executeUpdate();
        }
    }

    public void upsertState(Connection conn, String stateId, String name) throws SQLException {
        String sql = "INSERT INTO states (state_id, name) VALUES (?, ?) ON CONFLICT (state_id) DO UPDATE SET name = excluded.name";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, stateId);
            ps.setString(2, name);
            ps.executeUpdate();
        }
    }

    public Optional<String> stateName(Connection conn, String stateId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT name FROM states WHERE state_id = ?")) {
            ps.setString(1, stateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.ofNullable(rs.getString("name"));
            }
        }
        return Optional.empty();
    }

    private List<Province> query(Connection conn, String sql, String... params) throws SQLException {
        List<Province> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) ps.setString(i + 1, params[i]);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        }
        return out;
    }

    private static Province map(ResultSet rs) throws SQLException {
        return new Province(
                rs.getString("province_id"),
                rs.getString("state_id"),
                rs.getString("controller_id"),
                rs.getString("name"),
                rs.getLong("population"),
                rs.getDouble("node_strength"),
                SqlSupport.getNullableDouble(rs, "x"),
                SqlSupport.getNullableDouble(rs, "y")
        );
    }
}
