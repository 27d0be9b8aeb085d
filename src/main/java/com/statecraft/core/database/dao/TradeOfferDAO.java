package com.statecraft.core.database.dao;

import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.trade.OfferStatus;
import com.statecraft.core.domain.trade.TradeOffer;
import com.statecraft.core.domain.trade.TransportMode;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class TradeOfferDAO {

    private static final String COLUMNS = """
        id, from_nation, to_nation, offered_json, requested_json, offered_cash, requested_cash,
        status, transport_mode, created_at, resolved_at
    """;

    public long insertOpen(Connection conn, String from, String to, ResourceMap offered, ResourceMap requested,
                           double offeredCash, double requestedCash, TransportMode mode, Instant createdAt) throws SQLException {
        String sql = """
            INSERT INTO trade_offers (from_nation, to_nation, offered_json, requested_json, offered_cash,
                                      requested_cash, status, transport_mode, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, from);
            ps.setString(2, to);
            ps.setString(3, ResourceJson.encode(offered));
            ps.setString(4, ResourceJson.encode(requested));
            ps.setDouble(5, offeredCash);
            ps.setDouble(6, requestedCash);
            ps.setString(7, OfferStatus.OPEN.dbValue());
            ps.setString(8, mode.dbValue());
            ps.setString(9, createdAt.toString());
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public Optional<TradeOffer> find(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM trade_offers WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public int countOpenFrom(Connection conn, String nationId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM trade_offers WHERE from_nation = ? AND status = ?")) {
            ps.setString(1, nationId);
            ps.setString(2, OfferStatus.OPEN.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    /**
     * Offers sent or received by a nation, newest first.
     */
    public List<TradeOffer> involving(Connection conn, String nationId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM trade_offers WHERE from_nation = ? OR to_nation = ? ORDER BY id DESC";
        List<TradeOffer> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, nationId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
        }
        return out;
    }

    /**
     * Closes an open offer. The {@code status = 'open'} guard makes every terminal transition happen at most once.
     *
     * @return false when the offer was not open any more
     */
    public boolean closeIfOpen(Connection conn, long id, OfferStatus status, Instant resolvedAt) throws SQLException {
        String sql = "UPDATE trade_offers SET status = ?, resolved_at = ? WHERE id = ? AND status = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            ps.setString(2, resolvedAt.toString());
            ps.setLong(3, id);
            ps.setString(4, OfferStatus.OPEN.dbValue());
            return ps.executeUpdate() == 1;
        }
    }

    private static TradeOffer map(ResultSet rs) throws SQLException {
        String resolved = rs.getString("resolved_at");
        return new TradeOffer(
                rs.getLong("id"),
                rs.getString("from_nation"),
                rs.getString("to_nation"),
                ResourceJson.decode(rs.getString("offered_json")),
                ResourceJson.decode(rs.getString("requested_json")),
                rs.getDouble("offered_cash"),
                rs.getDouble("requested_cash"),
                OfferStatus.fromDb(rs.getString("status")),
                TransportMode.fromDb(rs.getString("transport_mode")),
                Instant.parse(rs.getString("created_at")),
                resolved == null ? null : Instant.parse(resolved)
        );
    }
}
