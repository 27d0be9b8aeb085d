package com.statecraft.core.database;

import com.statecraft.core.domain.ledger.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Applies the numbered schema migrations that are missing from {@code schema_version}, each in its own transaction.
 * The schema is fixed: code never asks the database which columns exist.
 */
public class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public record Migration(int version, String description, List<String> statements) {}

    private static final List<Migration> MIGRATIONS = List.of(
            new Migration(1, "world, ledger and economy tables", List.of(
                    """
                    CREATE TABLE nations (
                        nation_id     TEXT PRIMARY KEY,
                        name          TEXT NOT NULL,
                        cash          REAL NOT NULL DEFAULT 0,
                        debt          REAL NOT NULL DEFAULT 0,
                        tax_rate      REAL NOT NULL DEFAULT 0,
                        manpower_used INTEGER NOT NULL DEFAULT 0,
                        affiliation   TEXT,
                        wgrd_member   INTEGER NOT NULL DEFAULT 0
                    )
                    """,
                    """
                    CREATE TABLE states (
                        state_id TEXT PRIMARY KEY,
                        name     TEXT NOT NULL
                    )
                    """,
                    """
                    CREATE TABLE provinces (
                        province_id   TEXT PRIMARY KEY,
                        state_id      TEXT NOT NULL,
                        controller_id TEXT,
                        name          TEXT,
                        population    INTEGER NOT NULL DEFAULT 0,
                        node_strength REAL NOT NULL DEFAULT 0,
                        x             REAL,
                        y             REAL
                    )
                    """,
                    "CREATE INDEX idx_provinces_controller ON provinces (controller_id, state_id)",
                    """
                    CREATE TABLE resources (
                        resource  TEXT PRIMARY KEY,
                        category  TEXT NOT NULL,
                        weight_kg REAL NOT NULL DEFAULT 1.0
                    )
                    """,
                    """
                    CREATE TABLE province_stockpiles (
                        province_id TEXT NOT NULL,
                        resource    TEXT NOT NULL,
                        amount      REAL NOT NULL DEFAULT 0 CHECK (amount >= 0),
                        capacity    REAL NOT NULL DEFAULT 0 CHECK (capacity >= 0),
                        uncapped    INTEGER NOT NULL DEFAULT 0,
                        PRIMARY KEY (province_id, resource)
                    )
                    """,
                    """
                    CREATE TABLE province_reservations (
                        id          INTEGER PRIMARY KEY AUTOINCREMENT,
                        build_id    INTEGER NOT NULL,
                        province_id TEXT NOT NULL,
                        resource    TEXT NOT NULL,
                        amount      REAL NOT NULL CHECK (amount > 0)
                    )
                    """,
                    "CREATE INDEX idx_reservations_build ON province_reservations (build_id)",
                    "CREATE INDEX idx_reservations_slot ON province_reservations (province_id, resource)",
                    """
                    CREATE TABLE building_templates (
                        id                   TEXT PRIMARY KEY,
                        name                 TEXT NOT NULL,
                        build_cost_resources TEXT NOT NULL DEFAULT '{}',
                        build_cash_cost      REAL NOT NULL DEFAULT 0,
                        build_time_turns     INTEGER NOT NULL DEFAULT 1,
                        inputs               TEXT NOT NULL DEFAULT '{}',
                        outputs              TEXT NOT NULL DEFAULT '{}',
                        maintenance_cash     REAL NOT NULL DEFAULT 0,
                        maintenance_manpower INTEGER NOT NULL DEFAULT 0
                    )
                    """,
                    """
                    CREATE TABLE state_builds (
                        id            INTEGER PRIMARY KEY AUTOINCREMENT,
                        nation_id     TEXT NOT NULL,
                        state_id      TEXT NOT NULL,
                        building_id   TEXT NOT NULL,
                        tier          INTEGER NOT NULL DEFAULT 1,
                        started_turn  INTEGER NOT NULL,
                        complete_turn INTEGER NOT NULL,
                        status        TEXT NOT NULL,
                        cash_paid     REAL NOT NULL DEFAULT 0,
                        reserved_json TEXT NOT NULL DEFAULT '[]'
                    )
                    """,
                    "CREATE INDEX idx_state_builds_due ON state_builds (status, complete_turn)",
                    """
                    CREATE TABLE province_buildings (
                        province_id TEXT NOT NULL,
                        building_id TEXT NOT NULL,
                        tier        INTEGER NOT NULL DEFAULT 1,
                        count       INTEGER NOT NULL DEFAULT 0 CHECK (count >= 0),
                        PRIMARY KEY (province_id, building_id, tier)
                    )
                    """,
                    """
                    CREATE TABLE market_posts (
                        id             INTEGER PRIMARY KEY AUTOINCREMENT,
                        poster_nation  TEXT NOT NULL,
                        resource       TEXT NOT NULL,
                        quantity       REAL NOT NULL,
                        price_per_unit REAL NOT NULL,
                        is_sell        INTEGER NOT NULL DEFAULT 1,
                        transport_mode TEXT NOT NULL DEFAULT 'auto',
                        created_at     TEXT NOT NULL
                    )
                    """,
                    """
                    CREATE TABLE trade_offers (
                        id             INTEGER PRIMARY KEY AUTOINCREMENT,
                        from_nation    TEXT NOT NULL,
                        to_nation      TEXT NOT NULL,
                        offered_json   TEXT NOT NULL DEFAULT '{}',
                        requested_json TEXT NOT NULL DEFAULT '{}',
                        offered_cash   REAL NOT NULL DEFAULT 0,
                        requested_cash REAL NOT NULL DEFAULT 0,
                        status         TEXT NOT NULL,
                        transport_mode TEXT NOT NULL DEFAULT 'auto',
                        created_at     TEXT NOT NULL,
                        resolved_at    TEXT
                    )
                    """,
                    "CREATE INDEX idx_trade_offers_from ON trade_offers (from_nation, status)",
                    """
                    CREATE TABLE trades (
                        id             INTEGER PRIMARY KEY AUTOINCREMENT,
                        offer_id       INTEGER NOT NULL,
                        from_nation    TEXT NOT NULL,
                        to_nation      TEXT NOT NULL,
                        offered_json   TEXT NOT NULL,
                        requested_json TEXT NOT NULL,
                        cash_exchanged REAL NOT NULL,
                        transport_cost REAL NOT NULL,
                        turn           INTEGER NOT NULL,
                        created_at     TEXT NOT NULL
                    )
                    """,
                    """
                    CREATE TABLE modifiers (
                        id           INTEGER PRIMARY KEY AUTOINCREMENT,
                        scope        TEXT NOT NULL,
                        scope_id     TEXT,
                        effect       TEXT NOT NULL,
                        kind         TEXT NOT NULL,
                        value        REAL NOT NULL,
                        source       TEXT,
                        created_turn INTEGER,
                        expires_turn INTEGER,
                        active       INTEGER NOT NULL DEFAULT 1
                    )
                    """,
                    """
                    CREATE TABLE config (
                        key   TEXT PRIMARY KEY,
                        value TEXT NOT NULL
                    )
                    """,
                    "INSERT INTO config (key, value) VALUES ('current_turn', '0')"
            )),
            new Migration(2, "recruitment tables", List.of(
                    """
                    CREATE TABLE unit_templates (
                        template_id      TEXT PRIMARY KEY,
                        display_name     TEXT NOT NULL,
                        category         TEXT,
                        manpower_cost    INTEGER NOT NULL DEFAULT 0,
                        build_cash_cost  REAL NOT NULL DEFAULT 0,
                        resources_json   TEXT NOT NULL DEFAULT '{}',
                        tech_required    TEXT,
                        classification   TEXT,
                        reference_nation TEXT
                    )
                    """,
                    """
                    CREATE TABLE armies (
                        army_id   INTEGER PRIMARY KEY AUTOINCREMENT,
                        nation_id TEXT NOT NULL,
                        name      TEXT NOT NULL,
                        state_id  TEXT
                    )
                    """,
                    """
                    CREATE TABLE recruits (
                        recruit_id       INTEGER PRIMARY KEY AUTOINCREMENT,
                        nation_id        TEXT NOT NULL,
                        army_id          INTEGER,
                        state_id         TEXT NOT NULL,
                        province_id      TEXT,
                        unit_template_id TEXT NOT NULL,
                        created_turn     INTEGER NOT NULL,
                        status           TEXT NOT NULL
                    )
                    """,
                    "CREATE INDEX idx_recruits_state ON recruits (nation_id, state_id)",
                    """
                    CREATE TABLE player_technologies (
                        nation_id TEXT NOT NULL,
                        tech_id   TEXT NOT NULL,
                        PRIMARY KEY (nation_id, tech_id)
                    )
                    """
            ))
    );

    private final DatabaseManager db;

    public SchemaMigrator(DatabaseManager db) {
        this.db = db;
    }

    public static int latestVersion() {
        return MIGRATIONS.get(MIGRATIONS.size() - 1).version();
    }

    /**
     * @return the schema version after migrating
     */
    public int migrate() throws SQLException {
        db.inTransaction(conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("""
                        CREATE TABLE IF NOT EXISTS schema_version (
                            version     INTEGER PRIMARY KEY,
                            description TEXT NOT NULL,
                            applied_at  TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP
                        )
                        """);
            }
            return null;
        });

        int current = currentVersion();
        for (Migration m : MIGRATIONS) {
            if (m.version() <= current) continue;

            db.inTransaction(conn -> {
                try (Statement st = conn.createStatement()) {
                    for (String sql : m.statements()) {
                        st.executeUpdate(sql);
                    }
                }
                if (m.version() == 1) seedResources(conn);
                try (PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
                    ps.setInt(1, m.version());
                    ps.setString(2, m.description());
                    ps.executeUpdate();
                }
                return null;
            });
            current = m.version();
            log.info("🗄️ Schema migrated to v{} ({})", m.version(), m.description());
        }
        return current;
    }

    public int currentVersion() throws SQLException {
        return db.read(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COALESCE(MAX(version), 0) FROM schema_version");
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    private static void seedResources(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO resources (resource, category, weight_kg) VALUES (?, ?, ?)")) {
            for (Resource r : Resource.values()) {
                ps.setString(1, r.displayName());
                ps.setString(2, r.category().name());
                ps.setDouble(3, r.defaultWeightKg());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }
}
