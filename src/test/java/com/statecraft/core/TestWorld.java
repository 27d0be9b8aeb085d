package com.statecraft.core;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.SchemaMigrator;
import com.statecraft.core.database.dao.BuildingTemplateDAO;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.database.dao.UnitTemplateDAO;
import com.statecraft.core.domain.buildings.BuildingTemplate;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.military.UnitTemplate;
import com.statecraft.core.domain.world.Nation;
import com.statecraft.core.domain.world.Province;
import com.statecraft.core.infrastructure.EngineConfig;
import com.statecraft.core.managers.EconomyEngine;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Migrated SQLite file under a JUnit temp dir plus seeding helpers. One instance per test.
 */
public final class TestWorld implements AutoCloseable {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    public final DatabaseManager db;
    public final EngineConfig config;
    public final EconomyEngine engine;

    private final NationDAO nations = new NationDAO();
    private final ProvinceDAO provinces = new ProvinceDAO();
    private final BuildingTemplateDAO buildings = new BuildingTemplateDAO();
    private final ProvinceBuildingDAO installed = new ProvinceBuildingDAO();
    private final UnitTemplateDAO units = new UnitTemplateDAO();
    private final GameStateDAO gameState = new GameStateDAO();

    public TestWorld(Path dir) throws SQLException {
        this.config = EngineConfig.defaults();
        this.db = new DatabaseManager("jdbc:sqlite:" + dir.resolve("world.db").toAbsolutePath(), 4, 5000);
        new SchemaMigrator(db).migrate();
        this.engine = new EconomyEngine(db, config, FIXED_CLOCK);
    }

    // --- seeding ---

    public TestWorld nation(String id, double cash) throws SQLException {
        return nation(new Nation(id, id, cash, 0.0, 0.0, 0, null, false));
    }

    public TestWorld nation(Nation n) throws SQLException {
        db.inTransaction(conn -> {
            nations.upsert(conn, n);
            return null;
        });
        return this;
    }

    public TestWorld province(String id, String stateId, String controller, long population, double strength) throws SQLException {
        return province(new Province(id, stateId, controller, id, population, strength, null, null));
    }

    public TestWorld province(Province p) throws SQLException {
        db.inTransaction(conn -> {
            provinces.upsertState(conn, p.stateId(), "State " + p.stateId());
            provinces.upsert(conn, p);
            return null;
        });
        return this;
    }

    public TestWorld controller(String provinceId, String nationId) throws SQLException {
        db.inTransaction(conn -> {
            provinces.setController(conn, provinceId, nationId);
            return null;
        });
        return this;
    }

    public TestWorld stock(String provinceId, Resource resource, double amount) throws SQLException {
        return stock(provinceId, resource, amount, 100000.0);
    }

    public TestWorld stock(String provinceId, Resource resource, double amount, double capacity) throws SQLException {
        engine.getStockpiles().setEntry(provinceId, resource, amount, capacity, false);
        return this;
    }

    public TestWorld building(BuildingTemplate t) throws SQLException {
        db.inTransaction(conn -> {
            buildings.upsert(conn, t);
            return null;
        });
        return this;
    }

    public TestWorld install(String provinceId, String buildingId, int tier) throws SQLException {
        db.inTransaction(conn -> {
            installed.increment(conn, provinceId, buildingId, tier);
            return null;
        });
        return this;
    }

    public TestWorld unit(UnitTemplate t) throws SQLException {
        db.inTransaction(conn -> {
            units.upsert(conn, t);
            return null;
        });
        return this;
    }

    public TestWorld tech(String nationId, String techId) throws SQLException {
        db.inTransaction(conn -> {
            nations.grantTechnology(conn, nationId, techId);
            return null;
        });
        return this;
    }

    public TestWorld turn(int turn) throws SQLException {
        db.inTransaction(conn -> {
            gameState.setCurrentTurn(conn, turn);
            return null;
        });
        return this;
    }

    public static BuildingTemplate template(String id, ResourceMap cost, double cashCost, int buildTime) {
        return new BuildingTemplate(id, id, cost, cashCost, buildTime, ResourceMap.empty(), ResourceMap.empty(), 0.0, 0);
    }

    // --- reads ---

    public Nation nationRow(String id) throws SQLException {
        return db.read(conn -> nations.find(conn, id)).orElseThrow();
    }

    public double cash(String nationId) throws SQLException {
        return nationRow(nationId).cash();
    }

    public double amount(String provinceId, Resource resource) throws SQLException {
        return engine.getStockpiles().entry(provinceId, resource).map(e -> e.amount()).orElse(0.0);
    }

    public double available(String provinceId, Resource resource) throws SQLException {
        return engine.getStockpiles().available(provinceId, resource);
    }

    public int currentTurn() throws SQLException {
        return db.read(gameState::currentTurn);
    }

    @Override
    public void close() {
        db.close();
    }
}
