package com.statecraft.core.synchronization;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.BuildingTemplateDAO;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.SqlSupport;
import com.statecraft.core.database.dao.StateBuildDAO;
import com.statecraft.core.domain.buildings.BuildPipeline;
import com.statecraft.core.domain.buildings.BuildStatus;
import com.statecraft.core.domain.buildings.BuildingTemplate;
import com.statecraft.core.domain.buildings.InstalledBuilding;
import com.statecraft.core.domain.buildings.PendingBuild;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.StockpileStore;
import com.statecraft.core.domain.modifiers.ModifierAggregator;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.domain.world.Nation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Advances the global turn: due builds, production, maintenance, modifier expiry, then the counter.
 *
 * <p>The whole turn is one write transaction. Each row runs under its own savepoint: a row that throws is rolled
 * back to it, logged and counted, and the turn goes on. The new turn number is written last.
 */
public class TurnProcessor {

    private static final Logger log = LoggerFactory.getLogger(TurnProcessor.class);

    private final DatabaseManager db;
    private final BuildPipeline pipeline;
    private final StockpileStore stockpiles;
    private final StateBuildDAO builds;
    private final ProvinceBuildingDAO installed;
    private final BuildingTemplateDAO templates;
    private final NationDAO nations;
    private final GameStateDAO gameState;
    private final ModifierAggregator modifiers;

    public TurnProcessor(DatabaseManager db,
                         BuildPipeline pipeline,
                         StockpileStore stockpiles,
                         StateBuildDAO builds,
                         ProvinceBuildingDAO installed,
                         BuildingTemplateDAO templates,
                         NationDAO nations,
                         GameStateDAO gameState,
                         ModifierAggregator modifiers) {
        this.db = db;
        this.pipeline = pipeline;
        this.stockpiles = stockpiles;
        this.builds = builds;
        this.installed = installed;
        this.templates = templates;
        this.nations = nations;
        this.gameState = gameState;
        this.modifiers = modifiers;
    }

    public Result<Integer> currentTurn() {
        return Result.attempt(log, "currentTurn", () -> db.read(gameState::currentTurn));
    }

    public Result<TurnReport> advanceTurn() {
        return Result.attempt(log, "advanceTurn", () -> {
            TurnReport report = db.inTransaction(this::runTurn);
            log.info("⏭️ Turn {} done: builds {}/{} (ok/failed), production {}, maintenance {}, expired modifiers {}, skipped {}",
                    report.turn(), report.buildsCompleted(), report.buildsFailed(), report.productionRows(),
                    report.maintenanceRows(), report.modifiersExpired(), report.rowsSkipped());
            return report;
        });
    }

    private TurnReport runTurn(Connection conn) throws SQLException {
        int nextTurn = gameState.currentTurn(conn) + 1;
        Counters c = new Counters();

        // 1. build in scadenza
        for (PendingBuild b : builds.dueBy(conn, nextTurn)) {
            Optional<BuildStatus> outcome = step(conn, c, "build #" + b.id(), cx -> pipeline.resolveDue(cx, b));
            outcome.ifPresent(s -> {
                if (s == BuildStatus.COMPLETED) c.completed++;
                else c.failed++;
            });
        }

        // 2. produzione / consumo
        Map<String, Optional<BuildingTemplate>> templateCache = new HashMap<>();
        for (InstalledBuilding ib : installed.findAll(conn)) {
            Optional<BuildingTemplate> tpl = templateCache.computeIfAbsent(ib.buildingId(), id -> lookupTemplate(conn, id));
            if (tpl.isEmpty()) {
                log.warn("⚠️ Production skipped for {} in {}: unknown template", ib.buildingId(), ib.provinceId());
                c.skipped++;
                continue;
            }
            step(conn, c, "production " + ib.buildingId() + "@" + ib.provinceId(), cx -> {
                produce(cx, ib, tpl.get());
                return Boolean.TRUE;
            }).ifPresent(ok -> c.production++);
        }

        // 3. manutenzione
        for (Map.Entry<String, Double> bill : installed.maintenanceCashByNation(conn).entrySet()) {
            step(conn, c, "maintenance " + bill.getKey(), cx -> {
                chargeMaintenance(cx, bill.getKey(), bill.getValue());
                return Boolean.TRUE;
            }).ifPresent(ok -> c.maintenance++);
        }

        // 4. modificatori scaduti
        step(conn, c, "modifier expiry", cx -> modifiers.deactivateExpired(cx, nextTurn))
                .ifPresent(n -> c.expired = n);

        gameState.setCurrentTurn(conn, nextTurn);
        return new TurnReport(nextTurn, c.completed, c.failed, c.production, c.maintenance, c.expired, c.skipped);
    }

    /**
     * Inputs come out of unreserved stock and stop at zero; outputs are added regardless of inputs,
     * clamped to capacity.
     */
    private void produce(Connection conn, InstalledBuilding ib, BuildingTemplate tpl) throws SQLException {
        int mult = ib.multiplier();
        if (mult <= 0) return;

        for (Map.Entry<Resource, Double> in : tpl.inputs().asMap().entrySet()) {
            double want = in.getValue() * mult;
            double taken = stockpiles.drainAvailable(conn, ib.provinceId(), in.getKey(), want);
            if (taken + SqlSupport.EPSILON < want) {
                log.debug("{}@{} short on {}: {} of {}", tpl.id(), ib.provinceId(), in.getKey(), taken, want);
            }
        }
        for (Map.Entry<Resource, Double> out : tpl.outputs().asMap().entrySet()) {
            stockpiles.add(conn, ib.provinceId(), out.getKey(), out.getValue() * mult);
        }
    }

    private void chargeMaintenance(Connection conn, String nationId, double bill) throws SQLException {
        if (bill <= 0) return;
        Optional<Nation> found = nations.find(conn, nationId);
        if (found.isEmpty()) {
            log.warn("Maintenance bill {} for unknown nation {} ignored", bill, nationId);
            return;
        }
        Nation n = found.get();
        if (n.cash() + SqlSupport.EPSILON >= bill) {
            nations.setCashAndDebt(conn, nationId, n.cash() - bill, n.debt());
        } else {
            double shortfall = bill - Math.max(0.0, n.cash());
            nations.setCashAndDebt(conn, nationId, 0.0, n.debt() + shortfall);
            log.info("💸 {} cannot cover maintenance {}: debt +{}", nationId, bill, shortfall);
        }
    }

    private Optional<BuildingTemplate> lookupTemplate(Connection conn, String id) {
        try {
            return templates.find(conn, id);
        } catch (SQLException | IllegalArgumentException e) {
            log.warn("⚠️ Building template {} unreadable: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    // ==========================================================
    // SAVEPOINT
    // ==========================================================

    private <T> Optional<T> step(Connection conn, Counters c, String what, DatabaseManager.SqlWork<T> work) throws SQLException {
        Savepoint sp = conn.setSavepoint();
        try {
            T out = work.apply(conn);
            conn.releaseSavepoint(sp);
            return Optional.ofNullable(out);
        } catch (SQLException | RuntimeException e) {
            conn.rollback(sp);
            c.skipped++;
            log.warn("⚠️ Turn row skipped ({}): {}", what, e.toString(), e);
            return Optional.empty();
        }
    }

    private static final class Counters {
        int completed;
        int failed;
        int production;
        int maintenance;
        int expired;
        int skipped;
    }
}
