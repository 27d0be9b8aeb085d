package com.statecraft.core.database.dao;

import com.statecraft.core.domain.ledger.Reservation;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.StockpileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows of {@code province_stockpiles} and {@code province_reservations}.
 * Every method runs on the caller's connection so it can take part in the caller's transaction.
 */
public class StockpileDAO {

    private static final Logger log = LoggerFactory.getLogger(StockpileDAO.class);

    private static final String UPSERT_SQL = """
        INSERT INTO province_stockpiles (province_id, resource, amount, capacity, uncapped)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (province_id, resource) DO UPDATE SET
            amount = excluded.amount,
            capacity = excluded.capacity,
            uncapped = excluded.uncapped
    """;

    public Optional<StockpileEntry> find(Connection conn, String provinceId, Resource resource) throws SQLException {
        String sql = "SELECT province_id, resource, amount, capacity, uncapped FROM province_stockpiles WHERE province_id = ? AND resource = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provinceId);
            ps.setString(2, resource.displayName());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(map(rs));
            }
        }
        return Optional.empty();
    }

    public List<StockpileEntry> listForProvince(Connection conn, String provinceId) throws SQLException {
        List<StockpileEntry> out = new ArrayList<>();
        String sql = "SELECT province_id, resource, amount, capacity, uncapped FROM province_stockpiles WHERE province_id = ? ORDER BY resource";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provinceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    StockpileEntry e = mapOrNull(rs);
                    if (e != null) out.add(e);
                }
            }
        }
        return out;
    }

    public void upsert(Connection conn, StockpileEntry entry) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, entry.provinceId());
            ps.setString(2, entry.resource().displayName());
            ps.setDouble(3, entry.amount());
            ps.setDouble(4, entry.capacity());
            ps.setInt(5, entry.uncapped() ? 1 : 0);
            ps.executeUpdate();
        }
    }

    public void setAmount(Connection conn, String provinceId, Resource resource, double amount) throws SQLException {
        String sql = "UPDATE province_stockpiles SET amount = ? WHERE province_id = ? AND resource = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setDouble(1, Math.max(0.0, amount));
            ps.setString(2, provinceId);
            ps.setString(3, resource.displayName());
            ps.executeUpdate();
        }
    }

    // ==========================================================
    // RESERVATIONS
    // ==========================================================

    public double reservedAmount(Connection conn, String provinceId, Resource resource) throws SQLException {
        String sql = "SELECT COALESCE(SUM(amount), 0) FROM province_reservations WHERE province_id = ? AND resource = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, provinceId);
            ps.setString(2, resource.displayName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getDouble(1) : 0.0;
            }
        }
    }

    public long insertReservation(Connection conn, long buildId, String provinceId, Resource resource, double amount) throws SQLException {
        String sql = "INSERT INTO province_reservations (build_id, province_id, resource, amount) VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, buildId);
            ps.setString(2, provinceId);
            ps.setString(3, resource.displayName());
            ps.setDouble(4, amount);
            ps.executeUpdate();
        }
        return SqlSupport.lastInsertId(conn);
    }

    public List<Reservation> reservationsFor(Connection conn, long buildId) throws SQLException {
        List<Reservation> out = new ArrayList<>();
        String sql = "SELECT id, build_id, province_id, resource, amount FROM province_reservations WHERE build_id = ? ORDER BY id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, buildId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Reservation(
                            rs.getLong("id"),
                            rs.getLong("build_id"),
                            rs.getString("province_id"),
                            Resource.require(rs.getString("resource")),
                            rs.getDouble("amount")
                    ));
                }
            }
        }
        return out;
    }

    public int deleteReservations(Connection conn, long buildId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM province_reservations WHERE build_id = ?")) {
            ps.setLong(1, buildId);
            return ps.executeUpdate();
        }
    }

    // ==========================================================
    // AGGREGATES
    // ==========================================================

    /**
     * Stock held by a nation across all of its provinces, minus what is reserved there.
     */
    public double nationAvailable(Connection conn, String nationId, Resource resource) throws SQLException {
        String sql = """
            SELECT
                (SELECT COALESCE(SUM(ps.amount), 0)
                   FROM province_stockpiles ps
                   JOIN provinces p ON p.province_id = ps.province_id
                  WHERE p.controller_id = ? AND ps.resource = ?)
              - (SELECT COALESCE(SUM(r.amount), 0)
                   FROM province_reservations r
                   JOIN provinces p ON p.province_id = r.province_id
                  WHERE p.controller_id = ? AND r.resource = ?) AS available
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, resource.displayName());
            ps.setString(3, nationId);
            ps.setString(4, resource.displayName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Math.max(0.0, rs.getDouble("available")) : 0.0;
            }
        }
    }

    /**
     * Amount and capacity per resource summed over the nation's provinces in one state.
     */
    public Map<Resource, double[]> stateTotals(Connection conn, String nationId, String stateId) throws SQLException {
        Map<Resource, double[]> out = new EnumMap<>(Resource.class);
        String sql = """
            SELECT ps.resource, SUM(ps.amount) AS amount, SUM(ps.capacity) AS capacity
            FROM province_stockpiles ps
            JOIN provinces p ON p.province_id = ps.province_id
            WHERE p.controller_id = ? AND p.state_id = ?
            GROUP BY ps.resource
        """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, nationId);
            ps.setString(2, stateId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Optional<Resource> r = Resource.parse(rs.getString("resource"));
                    if (r.isEmpty()) continue;
                    out.put(r.get(), new double[]{rs.getDouble("amount"), rs.getDouble("capacity")});
                }
            }
        }
        return out;
    }

    private static StockpileEntry map(ResultSet rs) throws SQLException {
        return new StockpileEntry(
                rs.getString("province_id"),
                Resource.require(rs.getString("resource")),
                rs.getDouble("amount"),
                rs.getDouble("capacity"),
                rs.getInt("uncapped") != 0
        );
    }

    private static StockpileEntry mapOrNull(ResultSet rs) throws SQLException {
        try {
            return map(rs);
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Risorsa ignota nel DB: {} (province {})", rs.getString("resource"), rs.getString("province_id"));
            return null;
        }
    }
}
