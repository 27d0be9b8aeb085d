package com.statecraft.core.domain.buildings;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.BuildingTemplateDAO;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.database.dao.SqlSupport;
import com.statecraft.core.database.dao.StateBuildDAO;
import com.statecraft.core.domain.ledger.Reservation;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.StockpileStore;
import com.statecraft.core.domain.result.EngineError;
import com.statecraft.core.domain.result.EngineException;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.domain.world.Nation;
import com.statecraft.core.domain.world.Province;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Build queue state machine: {@code pending -> completed | failed | cancelled}.
 *
 * <p>{@link #start} reserves the whole cost up front; nothing is spent until the turn processor calls
 * {@link #resolveDue}, which consumes the reservations and installs the building.
 */
public class BuildPipeline {

    private static final Logger log = LoggerFactory.getLogger(BuildPipeline.class);

    private final DatabaseManager db;
    private final StockpileStore stockpiles;
    private final BuildingTemplateDAO templates;
    private final StateBuildDAO builds;
    private final ProvinceBuildingDAO installed;
    private final ProvinceDAO provinces;
    private final NationDAO nations;
    private final GameStateDAO gameState;

    public BuildPipeline(DatabaseManager db,
                         StockpileStore stockpiles,
                         BuildingTemplateDAO templates,
                         StateBuildDAO builds,
                         ProvinceBuildingDAO installed,
                         ProvinceDAO provinces,
                         NationDAO nations,
                         GameStateDAO gameState) {
        this.db = db;
        this.stockpiles = stockpiles;
        this.templates = templates;
        this.builds = builds;
        this.installed = installed;
        this.provinces = provinces;
        this.nations = nations;
        this.gameState = gameState;
    }

    // ==========================================================
    // START
    // ==========================================================

    /**
     * Queues a build and reserves {@code cost * tier} across the nation's provinces in the state,
     * strongest node first. One transaction: on any shortfall the row, the reservations and the cash debit
     * are all rolled back.
     */
    public Result<PendingBuild> start(String nationId, String stateId, String buildingId, int tier) {
        return Result.attempt(log, "startBuild", () -> {
            if (tier < 1) throw new EngineException(EngineError.invalidArgument("Tier must be >= 1, got " + tier));

            PendingBuild build = db.inTransaction(conn -> startInTx(conn, nationId, stateId, buildingId, tier));
            log.info("🏗️ Build #{} queued: {} T{} in {} for {} (completes turn {})",
                    build.id(), buildingId, tier, stateId, nationId, build.completeTurn());
            return build;
        });
    }

    private PendingBuild startInTx(Connection conn, String nationId, String stateId, String buildingId, int tier) throws SQLException {
        Nation nation = nations.find(conn, nationId)
                .orElseThrow(() -> new EngineException(EngineError.notFound("Nation " + nationId + " not found")));
        BuildingTemplate template = templates.find(conn, buildingId)
                .orElseThrow(() -> new EngineException(EngineError.notFound("Building " + buildingId + " not found")));

        List<Province> owned = provinces.controlledInState(conn, nation.nationId(), stateId);
        if (owned.isEmpty()) {
            throw new EngineException(EngineError.unauthorized(
                    nationId + " controls no province in state " + stateId));
        }

        int currentTurn = gameState.currentTurn(conn);
        int completeTurn = currentTurn + Math.max(0, template.buildTimeTurns());
        long buildId = builds.insertPending(conn, nationId, stateId, buildingId, tier, currentTurn, completeTurn);

        double cashCost = template.cashCostForTier(tier);
        if (!nations.debitIfCovered(conn, nationId, cashCost)) {
            throw new EngineException(EngineError.insufficientCash(cashCost - nations.cash(conn, nationId)));
        }

        for (Map.Entry<Resource, Double> need : template.costForTier(tier).asMap().entrySet()) {
            double shortfall = reserveAcross(conn, buildId, owned, need.getKey(), need.getValue());
            if (shortfall > SqlSupport.EPSILON) {
                throw new EngineException(EngineError.insufficientResource(need.getKey(), shortfall));
            }
        }

        List<Reservation> reserved = stockpiles.reservationsFor(conn, buildId);
        builds.recordReservations(conn, buildId, cashCost, reserved);
        return builds.find(conn, buildId)
                .orElseThrow(() -> new SQLException("Build #" + buildId + " vanished inside its own transaction"));
    }

    /**
     * Greedy reservation over {@code provinces}, in the order given.
     *
     * @return what could not be reserved, 0 when fully covered
     */
    private double reserveAcross(Connection conn, long buildId, List<Province> provinces,
                                 Resource resource, double amount) throws SQLException {
        double remaining = amount;
        for (Province p : provinces) {
            if (remaining <= SqlSupport.EPSILON) break;
            double take = Math.min(stockpiles.available(conn, p.provinceId(), resource), remaining);
            if (take <= SqlSupport.EPSILON) continue;
            if (stockpiles.reserve(conn, buildId, p.provinceId(), resource, take)) {
                remaining -= take;
            }
        }
        return Math.max(0.0, remaining);
    }

    // ==========================================================
    // CANCEL / DEMOLISH / QUEUE
    // ==========================================================

    /**
     * Releases the reservations, refunds the cash paid at start and deletes the row.
     */
    public Result<PendingBuild> cancel(String nationId, long buildId) {
        return Result.attempt(log, "cancelBuild", () -> {
            PendingBuild cancelled = db.inTransaction(conn -> {
                PendingBuild b = builds.find(conn, buildId)
                        .orElseThrow(() -> new EngineException(EngineError.notFound("Build #" + buildId + " not found")));
                if (!b.nationId().equals(nationId)) {
                    throw new EngineException(EngineError.unauthorized("Build #" + buildId + " belongs to " + b.nationId()));
                }
                if (b.status() != BuildStatus.PENDING) {
                    throw new EngineException(EngineError.invalidState(
                            "Build #" + buildId + " is " + b.status().dbValue() + ", only pending builds can be cancelled"));
                }

                stockpiles.release(conn, buildId);
                nations.credit(conn, nationId, b.cashPaid());
                builds.delete(conn, buildId);
                return new PendingBuild(b.id(), b.nationId(), b.stateId(), b.buildingId(), b.tier(),
                        b.startedTurn(), b.completeTurn(), BuildStatus.CANCELLED, b.cashPaid(), b.reserved());
            });
            log.info("Build #{} cancelled by {} (refund {})", buildId, nationId, cancelled.cashPaid());
            return cancelled;
        });
    }

    /**
     * Removes one installed building. Nothing is refunded.
     */
    public Result<InstalledBuilding> demolish(String nationId, String provinceId, String buildingId, int tier) {
        return Result.attempt(log, "demolish", () -> db.inTransaction(conn -> {
            Province p = provinces.find(conn, provinceId)
                    .orElseThrow(() -> new EngineException(EngineError.notFound("Province " + provinceId + " not found")));
            if (!p.isControlledBy(nationId)) {
                throw new EngineException(EngineError.unauthorized(nationId + " does not control " + provinceId));
            }
            if (!installed.decrement(conn, provinceId, buildingId, tier)) {
                throw new EngineException(EngineError.notFound(
                        "No " + buildingId + " T" + tier + " installed in " + provinceId));
            }
            log.info("Demolished one {} T{} in {}", buildingId, tier, provinceId);
            return installed.find(conn, provinceId, buildingId, tier)
                    .orElse(new InstalledBuilding(provinceId, buildingId, tier, 0));
        }));
    }

    public Result<List<PendingBuild>> buildQueue(String nationId) {
        return Result.attempt(log, "buildQueue", () -> db.read(conn -> builds.pendingFor(conn, nationId)));
    }

    // ==========================================================
    // TURN RESOLUTION
    // ==========================================================

    /**
     * Settles one due build on the turn processor's connection. The reservations are consumed in every case;
     * when the nation no longer holds a province in the state the build fails and nothing is refunded.
     */
    public BuildStatus resolveDue(Connection conn, PendingBuild build) throws SQLException {
        stockpiles.consume(conn, build.id());

        Optional<Province> host = provinces.strongestInState(conn, build.nationId(), build.stateId());
        if (host.isEmpty()) {
            builds.finish(conn, build.id(), BuildStatus.FAILED);
            log.warn("⚠️ Build #{} ({} T{}) failed: {} holds no province in {}; consumed resources are lost",
                    build.id(), build.buildingId(), build.tier(), build.nationId(), build.stateId());
            return BuildStatus.FAILED;
        }

        installed.increment(conn, host.get().provinceId(), build.buildingId(), build.tier());
        builds.finish(conn, build.id(), BuildStatus.COMPLETED);
        log.info("✅ Build #{} completed: {} T{} installed in {}",
                build.id(), build.buildingId(), build.tier(), host.get().provinceId());
        return BuildStatus.COMPLETED;
    }
}
