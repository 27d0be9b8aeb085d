package com.statecraft.core.domain.ledger;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.SqlSupport;
import com.statecraft.core.database.dao.StockpileDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-province resource ledger with a reservation overlay.
 *
 * <p>A reservation is a claim, not a deduction: {@code available = amount - sum(reservations)}.
 * Stock only leaves the ledger through {@link #consume} (reserved goods) or {@link #removeDirect} (unreserved goods),
 * so {@code amount >= sum(reservations)} holds for every (province, resource) after every call.
 *
 * <p>Each operation has two forms. The plain one runs in its own write transaction; the one taking a
 * {@link Connection} joins the caller's transaction, so a multi-row sequence commits or rolls back as a whole.
 * Availability is always re-read on the connection doing the write.
 */
public class StockpileStore {

    private static final Logger log = LoggerFactory.getLogger(StockpileStore.class);

    private final DatabaseManager db;
    private final StockpileDAO dao;
    private final double defaultCapacity;

    public StockpileStore(DatabaseManager db, StockpileDAO dao, double defaultCapacity) {
        this.db = db;
        this.dao = dao;
        this.defaultCapacity = defaultCapacity;
    }

    public double defaultCapacity() {
        return defaultCapacity;
    }

    // ==========================================================
    // READS
    // ==========================================================

    public double available(String provinceId, Resource resource) throws SQLException {
        return db.read(conn -> available(conn, provinceId, resource));
    }

    public double available(Connection conn, String provinceId, Resource resource) throws SQLException {
        double amount = dao.find(conn, provinceId, resource).map(StockpileEntry::amount).orElse(0.0);
        double reserved = dao.reservedAmount(conn, provinceId, resource);
        return Math.max(0.0, amount - reserved);
    }

    public double reserved(String provinceId, Resource resource) throws SQLException {
        return db.read(conn -> dao.reservedAmount(conn, provinceId, resource));
    }

    public Optional<StockpileEntry> entry(String provinceId, Resource resource) throws SQLException {
        return db.read(conn -> dao.find(conn, provinceId, resource));
    }

    public Optional<StockpileEntry> entry(Connection conn, String provinceId, Resource resource) throws SQLException {
        return dao.find(conn, provinceId, resource);
    }

    /**
     * Unreserved stock of one resource across every province a nation controls.
     */
    public double nationAvailable(Connection conn, String nationId, Resource resource) throws SQLException {
        return dao.nationAvailable(conn, nationId, resource);
    }

    /**
     * {amount, capacity} per resource summed over a nation's provinces in one state.
     */
    public Map<Resource, double[]> stateTotals(Connection conn, String nationId, String stateId) throws SQLException {
        return dao.stateTotals(conn, nationId, stateId);
    }

    public List<StockpileEntry> stockpile(String provinceId) throws SQLException {
        return db.read(conn -> dao.listForProvince(conn, provinceId));
    }

    public List<Reservation> reservationsFor(long buildId) throws SQLException {
        return db.read(conn -> dao.reservationsFor(conn, buildId));
    }

    public List<Reservation> reservationsFor(Connection conn, long buildId) throws SQLException {
        return dao.reservationsFor(conn, buildId);
    }

    // ==========================================================
    // RESERVE / CONSUME / RELEASE
    // ==========================================================

    public boolean reserve(long buildId, String provinceId, Resource resource, double amount) throws SQLException {
        return db.inTransaction(conn -> reserve(conn, buildId, provinceId, resource, amount));
    }

    /**
     * Inserts a reservation if {@code available >= amount}, otherwise changes nothing.
     */
    public boolean reserve(Connection conn, long buildId, String provinceId, Resource resource, double amount) throws SQLException {
        if (!(amount > 0.0) || Double.isInfinite(amount)) {
            throw new IllegalArgumentException("Reservation amount must be positive: " + amount);
        }
        double available = available(conn, provinceId, resource);
        if (available + SqlSupport.EPSILON < amount) {
            log.debug("Reservation refused: build={} {} {} wanted={} available={}",
                    buildId, provinceId, resource, amount, available);
            return false;
        }
        dao.insertReservation(conn, buildId, provinceId, resource, Math.min(amount, available));
        return true;
    }

    public List<Reservation> consume(long buildId) throws SQLException {
        return db.inTransaction(conn -> consume(conn, buildId));
    }

    /**
     * Turns every reservation of {@code buildId} into an actual stockpile decrement and deletes it.
     *
     * @return the reservations that were consumed
     */
    public List<Reservation> consume(Connection conn, long buildId) throws SQLException {
        List<Reservation> rows = dao.reservationsFor(conn, buildId);
        for (Reservation r : rows) {
            double current = dao.find(conn, r.provinceId(), r.resource()).map(StockpileEntry::amount).orElse(0.0);
            dao.setAmount(conn, r.provinceId(), r.resource(), Math.max(0.0, current - r.amount()));
        }
        dao.deleteReservations(conn, buildId);
        return rows;
    }

    public int release(long buildId) throws SQLException {
        return db.inTransaction(conn -> release(conn, buildId));
    }

    /**
     * Drops every reservation of {@code buildId}; stockpile amounts are untouched.
     */
    public int release(Connection conn, long buildId) throws SQLException {
        return dao.deleteReservations(conn, buildId);
    }

    // ==========================================================
    // DIRECT MOVEMENTS
    // ==========================================================

    public double add(String provinceId, Resource resource, double amount) throws SQLException {
        return db.inTransaction(conn -> add(conn, provinceId, resource, amount));
    }

    /**
     * Adds stock, clamped to the row's capacity. A missing row is created with the default capacity.
     *
     * @return the quantity actually stored
     */
    public double add(Connection conn, String provinceId, Resource resource, double amount) throws SQLException {
        if (!(amount > 0.0)) return 0.0;

        StockpileEntry entry = dao.find(conn, provinceId, resource)
                .orElse(new StockpileEntry(provinceId, resource, 0.0, defaultCapacity, false));

        double next = entry.clampToCapacity(entry.amount() + amount);
        double stored = Math.max(0.0, next - entry.amount());
        dao.upsert(conn, new StockpileEntry(provinceId, resource, Math.max(entry.amount(), next),
                entry.capacity(), entry.uncapped()));

        if (stored + SqlSupport.EPSILON < amount) {
            log.debug("Stockpile full: {} {} kept {} of {}", provinceId, resource, stored, amount);
        }
        return stored;
    }

    public boolean removeDirect(String provinceId, Resource resource, double amount) throws SQLException {
        return db.inTransaction(conn -> removeDirect(conn, provinceId, resource, amount));
    }

    /**
     * Unreserved decrement. Fails without touching anything when less than {@code amount} is available.
     */
    public boolean removeDirect(Connection conn, String provinceId, Resource resource, double amount) throws SQLException {
        if (amount <= 0.0) return true;
        double available = available(conn, provinceId, resource);
        if (available + SqlSupport.EPSILON < amount) return false;

        double current = dao.find(conn, provinceId, resource).map(StockpileEntry::amount).orElse(0.0);
        dao.setAmount(conn, provinceId, resource, Math.max(0.0, current - amount));
        return true;
    }

    /**
     * Takes up to {@code amount} of unreserved stock.
     *
     * @return the quantity actually taken
     */
    public double drainAvailable(Connection conn, String provinceId, Resource resource, double amount) throws SQLException {
        if (amount <= 0.0) return 0.0;
        double take = Math.min(available(conn, provinceId, resource), amount);
        if (take <= 0.0) return 0.0;
        double current = dao.find(conn, provinceId, resource).map(StockpileEntry::amount).orElse(0.0);
        dao.setAmount(conn, provinceId, resource, Math.max(0.0, current - take));
        return take;
    }

    // ==========================================================
    // ADMIN
    // ==========================================================

    public void setEntry(String provinceId, Resource resource, double amount, double capacity, boolean uncapped) throws SQLException {
        if (amount < 0 || capacity < 0) throw new IllegalArgumentException("Stockpile values must be >= 0");
        db.inTransaction(conn -> {
            double stored = uncapped ? amount : Math.min(amount, capacity);
            double reserved = dao.reservedAmount(conn, provinceId, resource);
            if (stored + SqlSupport.EPSILON < reserved) {
                throw new IllegalStateException("Cannot set " + resource + " in " + provinceId
                        + " to " + stored + ", below its reserved amount " + reserved);
            }
            dao.upsert(conn, new StockpileEntry(provinceId, resource, stored, capacity, uncapped));
            return null;
        });
    }
}
