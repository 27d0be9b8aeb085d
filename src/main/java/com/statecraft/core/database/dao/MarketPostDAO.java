package com.statecraft.core.database.dao;

import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.trade.MarketPost;
import com.statecraft.core.domain.trade.TransportMode;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class MarketPostDAO {

    private static final String COLUMNS = "id, poster_nation, resource, quantity, price_per_unit, is_sell, transport_mode, created_at";

    public long insert(Connection conn, String poster, Resource resource, double quantity, double price,
                       boolean sell, TransportMode mode, Instant createdAt) throws SQLException {
        String sql = """
            INSERT INTO market_posts (poster_nation, resource, quantity, price_per_unit, is_sell, transport_mode, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, poster);
            ps.setString(2, resource.displayName());
            ps.setDouble(3, quantity);
            ps.setDouble(4, price);
            ps.setInt(5, sell ? 1 : 0);
            ps.setString(6, mode.dbValue());
            ps.setString(7, createdAt.toString());
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public Optional<MarketPost> find(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM market_posts WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    /**
     * Open posts, newest first; {@code resource == null} lists every resource.
     */
    public List<MarketPost> list(Connection conn, Resource resource) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM market_posts WHERE (? IS NULL OR resource = ?) ORDER BY id DESC";
        List<MarketPost> out = new ArrayList<>();
        String name = resource == null ? null : resource.displayName();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        }
        return out;
    }

    public boolean delete(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM market_posts WHERE id = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    private static MarketPost map(ResultSet rs) throws SQLException {
        return new MarketPost(
                rs.getLong("id"),
                rs.getString("poster_nation"),
                Resource.require(rs.getString("resource")),
                rs.getDouble("quantity"),
                rs.getDouble("price_per_unit"),
                rs.getInt("is_sell") != 0,
                TransportMode.fromDb(rs.getString("transport_mode")),
                Instant.parse(rs.getString("created_at"))
        );
    }
}
