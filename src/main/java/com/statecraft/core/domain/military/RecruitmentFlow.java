package com.statecraft.core.domain.military;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.ArmyDAO;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.database.dao.RecruitDAO;
import com.statecraft.core.database.dao.SqlSupport;
import com.statecraft.core.database.dao.UnitTemplateDAO;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Unit recruitment. Unlike builds, recruits are paid on the spot: manpower, cash and resources leave in the
 * same transaction that queues the units, so a recruit never holds reservations.
 */
public class RecruitmentFlow {

    private static final Logger log = LoggerFactory.getLogger(RecruitmentFlow.class);

    private final DatabaseManager db;
    private final StockpileStore stockpiles;
    private final UnitTemplateDAO units;
    private final RecruitDAO recruits;
    private final ArmyDAO armies;
    private final NationDAO nations;
    private final ProvinceDAO provinces;
    private final ProvinceBuildingDAO buildings;
    private final GameStateDAO gameState;
    private final double manpowerRatio;

    public RecruitmentFlow(DatabaseManager db,
                           StockpileStore stockpiles,
                           UnitTemplateDAO units,
                           RecruitDAO recruits,
                           ArmyDAO armies,
                           NationDAO nations,
                           ProvinceDAO provinces,
                           ProvinceBuildingDAO buildings,
                           GameStateDAO gameState,
                           double manpowerRatio) {
        this.db = db;
        this.stockpiles = stockpiles;
        this.units = units;
        this.recruits = recruits;
        this.armies = armies;
        this.nations = nations;
        this.provinces = provinces;
        this.buildings = buildings;
        this.gameState = gameState;
        this.manpowerRatio = manpowerRatio;
    }

    // ==========================================================
    // COST
    // ==========================================================

    public Result<RecruitCost> estimateCost(String templateId, int quantity) {
        return Result.attempt(log, "estimateRecruitCost", () -> db.read(conn -> {
            UnitTemplate tpl = requireTemplate(conn, templateId);
            return estimate(tpl, quantity);
        }));
    }

    /**
     * Linear in quantity (at least 1). Cash and each resource total are rounded to whole units.
     */
    public static RecruitCost estimate(UnitTemplate tpl, int quantity) {
        int qty = Math.max(1, quantity);
        ResourceMap.Builder res = ResourceMap.builder();
        tpl.resources().forEach((r, perUnit) -> res.put(r, Math.round(perUnit * qty)));
        return new RecruitCost(qty, tpl.manpowerCost() * qty, Math.round(tpl.cashCost() * qty), res.build());
    }

    // ==========================================================
    // RECRUIT / DISBAND
    // ==========================================================

    /**
     * Queues {@code quantity} units in {@code stateId}. Checks run in this order: template, army, tech,
     * classification, manpower, cash, resources. Any failure rolls back every deduction made so far.
     */
    public Result<List<Recruit>> recruit(String nationId, String templateId, int quantity, String stateId, Long armyId) {
        return Result.attempt(log, "recruitUnit", () -> {
            if (quantity < 1) throw new EngineException(EngineError.invalidArgument("Quantity must be >= 1, got " + quantity));

            List<Recruit> queued = db.inTransaction(conn -> recruitInTx(conn, nationId, templateId, quantity, stateId, armyId));
            log.info("🪖 {} queued {} x {} in {}", nationId, quantity, templateId, stateId);
            return queued;
        });
    }

    private List<Recruit> recruitInTx(Connection conn, String nationId, String templateId, int quantity,
                                      String stateId, Long armyId) throws SQLException {
        Nation nation = requireNation(conn, nationId);
        UnitTemplate tpl = requireTemplate(conn, templateId);

        if (armyId != null) {
            Army army = armies.find(conn, armyId)
                    .orElseThrow(() -> new EngineException(EngineError.notFound("Army #" + armyId + " not found")));
            if (!army.nationId().equals(nationId)) {
                throw new EngineException(EngineError.unauthorized("Army #" + armyId + " belongs to " + army.nationId()));
            }
        }

        if (tpl.requiresTech() && !nations.hasTechnology(conn, nationId, tpl.techRequired())) {
            throw new EngineException(EngineError.invalidState(
                    "Required tech " + tpl.techRequired() + " not researched"));
        }
        if (!tpl.isAllowedFor(nation)) {
            throw new EngineException(EngineError.unauthorized(
                    tpl.displayName() + " is not allowed for " + nationId + " (classification/affiliation mismatch)"));
        }

        List<Province> inState = provinces.controlledInState(conn, nationId, stateId);
        if (inState.isEmpty()) {
            throw new EngineException(EngineError.unauthorized(nationId + " controls no province in state " + stateId));
        }

        RecruitCost cost = estimate(tpl, quantity);

        long recruitable = recruitableManpower(conn, nationId, stateId, inState);
        if (cost.manpower() > recruitable) {
            throw new EngineException(EngineError.insufficientManpower(cost.manpower() - recruitable));
        }

        if (!nations.debitIfCovered(conn, nationId, cost.cash())) {
            throw new EngineException(EngineError.insufficientCash(cost.cash() - nations.cash(conn, nationId)));
        }

        List<Province> elsewhere = new ArrayList<>();
        for (Province p : provinces.controlledBy(conn, nationId)) {
            if (!stateId.equals(p.stateId())) elsewhere.add(p);
        }
        for (Map.Entry<Resource, Double> need : cost.resources().asMap().entrySet()) {
            double remaining = drain(conn, inState, need.getKey(), need.getValue());
            remaining = drain(conn, elsewhere, need.getKey(), remaining);
            if (remaining > SqlSupport.EPSILON) {
                throw new EngineException(EngineError.insufficientResource(need.getKey(), remaining));
            }
        }

        nations.adjustManpowerUsed(conn, nationId, cost.manpower());

        String host = inState.get(0).provinceId();
        int turn = gameState.currentTurn(conn);
        List<Recruit> out = new ArrayList<>(cost.quantity());
        for (int i = 0; i < cost.quantity(); i++) {
            long id = recruits.insert(conn, nationId, armyId, stateId, host, templateId, turn);
            out.add(new Recruit(id, nationId, armyId, stateId, host, templateId, turn, Recruit.QUEUED));
        }
        return out;
    }

    // state-first then nation-wide: the caller passes the two province lists in that order
    private double drain(Connection conn, List<Province> scope, Resource resource, double amount) throws SQLException {
        double remaining = amount;
        for (Province p : scope) {
            if (remaining <= SqlSupport.EPSILON) break;
            remaining -= stockpiles.drainAvailable(conn, p.provinceId(), resource, remaining);
        }
        return Math.max(0.0, remaining);
    }

    /**
     * Deletes one recruit and gives back the cash and manpower of one unit. Resources are not refunded.
     */
    public Result<RecruitCost> disband(String nationId, long recruitId) {
        return Result.attempt(log, "disbandRecruit", () -> {
            RecruitCost refund = db.inTransaction(conn -> {
                Recruit r = recruits.find(conn, recruitId)
                        .orElseThrow(() -> new EngineException(EngineError.notFound("Recruit #" + recruitId + " not found")));
                if (!r.nationId().equals(nationId)) {
                    throw new EngineException(EngineError.unauthorized("Recruit #" + recruitId + " belongs to " + r.nationId()));
                }

                recruits.delete(conn, recruitId);
                RecruitCost unit = units.find(conn, r.unitTemplateId()).map(t -> estimate(t, 1)).orElse(null);
                if (unit == null) {
                    log.warn("Recruit #{} disbanded without refund: template {} is gone", recruitId, r.unitTemplateId());
                    return new RecruitCost(1, 0, 0.0, ResourceMap.empty());
                }
                nations.credit(conn, nationId, unit.cash());
                nations.adjustManpowerUsed(conn, nationId, -unit.manpower());
                return unit;
            });
            log.info("Recruit #{} disbanded by {}", recruitId, nationId);
            return refund;
        });
    }

    public Result<List<Recruit>> listRecruits(String nationId, String stateId) {
        return Result.attempt(log, "listRecruits", () -> db.read(conn -> recruits.list(conn, nationId, stateId)));
    }

    // ==========================================================
    // ARMIES / CATALOG
    // ==========================================================

    public Result<Army> createArmy(String nationId, String name, String stateId) {
        return Result.attempt(log, "createArmy", () -> {
            if (name == null || name.isBlank()) throw new EngineException(EngineError.invalidArgument("Army name is required"));
            return db.inTransaction(conn -> {
                requireNation(conn, nationId);
                long id = armies.insert(conn, nationId, name.trim(), stateId);
                return new Army(id, nationId, name.trim(), stateId);
            });
        });
    }

    public Result<List<UnitTemplate>> availableUnits(String nationId) {
        return Result.attempt(log, "availableUnits", () -> db.read(conn -> {
            Nation nation = requireNation(conn, nationId);
            List<UnitTemplate> out = new ArrayList<>();
            for (UnitTemplate t : units.findAll(conn)) {
                if (t.isAllowedFor(nation)) out.add(t);
            }
            return out;
        }));
    }

    // ==========================================================
    // MANPOWER
    // ==========================================================

    public Result<Long> recruitableManpower(String nationId, String stateId) {
        return Result.attempt(log, "recruitableManpower", () -> db.read(conn ->
                recruitableManpower(conn, nationId, stateId, provinces.controlledInState(conn, nationId, stateId))));
    }

    /**
     * {@code floor(population * ratio)} minus building manpower and queued recruits in the state, never below 0.
     */
    public long recruitableManpower(Connection conn, String nationId, String stateId, List<Province> inState) throws SQLException {
        long population = 0;
        for (Province p : inState) population += p.population();

        long pool = (long) Math.floor(population * manpowerRatio);
        long usedByBuildings = buildings.maintenanceManpowerInState(conn, nationId, stateId);
        long committed = recruits.queuedManpowerInState(conn, nationId, stateId);
        return Math.max(0L, pool - usedByBuildings - committed);
    }

    private Nation requireNation(Connection conn, String nationId) throws SQLException {
        return nations.find(conn, nationId)
                .orElseThrow(() -> new EngineException(EngineError.notFound("Nation " + nationId + " not found")));
    }

    private UnitTemplate requireTemplate(Connection conn, String templateId) throws SQLException {
        return units.find(conn, templateId)
                .orElseThrow(() -> new EngineException(EngineError.notFound("Unit template " + templateId + " not found")));
    }
}
