package com.statecraft.core.database.dao;

import com.statecraft.core.domain.trade.TradeRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class TradeLogDAO {

    public long insert(Connection conn, TradeRecord r) throws SQLException {
        String sql = """
            INSERT INTO trades (offer_id, from_nation, to_nation, offered_json, requested_json,
                                cash_exchanged, transport_cost, turn, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, r.offerId());
            ps.setString(2, r.fromNation());
            ps.setString(3, r.toNation());
            ps.setString(4, ResourceJson.encode(r.offered()));
            ps.setString(5, ResourceJson.encode(r.requested()));
            ps.setDouble(6, r.cashExchanged());
            ps.setDouble(7, r.transportCost());
            ps.setInt(8, r.turn());
            ps.setString(9, r.createdAt().toString());
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public List<TradeRecord> forOffer(Connection conn, long offerId) throws SQLException {
        List<TradeRecord> out = new ArrayList<>();
        String sql = """
            SELECT id, offer_id, from_nation, to_nation, offered_json, requested_json,
                   cash_exchanged, transport_cost, turn, created_at
            FROM trades WHERE offer_id = ? ORDER BY id
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, offerId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TradeRecord(
                            rs.getLong("id"),
                            rs.getLong("offer_id"),
                            rs.getString("from_nation"),
                            rs.getString("to_nation"),
                            ResourceJson.decode(rs.getString("offered_json")),
                            ResourceJson.decode(rs.getString("requested_json")),
                            rs.getDouble("cash_exchanged"),
                            rs.getDouble("transport_cost"),
                            rs.getInt("turn"),
                            Instant.parse(rs.getString("created_at"))
                    ));
                }
            }
        }
        return out;
    }
}
