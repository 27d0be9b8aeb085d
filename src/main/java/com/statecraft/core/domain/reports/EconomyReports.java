package com.statecraft.core.domain.reports;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.BuildingTemplateDAO;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.domain.buildings.BuildingTemplate;
import com.statecraft.core.domain.buildings.InstalledBuilding;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.ledger.StockpileStore;
import com.statecraft.core.domain.military.RecruitmentFlow;
import com.statecraft.core.domain.modifiers.FinalModifiers;
import com.statecraft.core.domain.modifiers.ModifierAggregator;
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
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only economy views. Tax income is {@code tax_rate * population * final tax modifier}.
 */
public class EconomyReports {

    private static final Logger log = LoggerFactory.getLogger(EconomyReports.class);

    private final DatabaseManager db;
    private final NationDAO nations;
    private final ProvinceDAO provinces;
    private final ProvinceBuildingDAO installed;
    private final BuildingTemplateDAO templates;
    private final StockpileStore stockpiles;
    private final ModifierAggregator modifiers;
    private final RecruitmentFlow recruitment;
    private final GameStateDAO gameState;

    public EconomyReports(DatabaseManager db,
                          NationDAO nations,
                          ProvinceDAO provinces,
                          ProvinceBuildingDAO installed,
                          BuildingTemplateDAO templates,
                          StockpileStore stockpiles,
                          ModifierAggregator modifiers,
                          RecruitmentFlow recruitment,
                          GameStateDAO gameState) {
        this.db = db;
        this.nations = nations;
        this.provinces = provinces;
        this.installed = installed;
        this.templates = templates;
        this.stockpiles = stockpiles;
        this.modifiers = modifiers;
        this.recruitment = recruitment;
        this.gameState = gameState;
    }

    public Result<NationSummary> nationSummary(String nationId, Integer currentTurn) {
        return Result.attempt(log, "nationSummary", () -> db.read(conn -> {
            Nation n = requireNation(conn, nationId);
            List<Province> owned = provinces.controlledBy(conn, nationId);

            long population = 0;
            Map<String, List<Province>> byState = new TreeMap<>();
            for (Province p : owned) {
                population += p.population();
                byState.computeIfAbsent(p.stateId(), k -> new ArrayList<>()).add(p);
            }

            long buildingManpower = 0;
            long recruitable = 0;
            for (Map.Entry<String, List<Province>> e : byState.entrySet()) {
                buildingManpower += installed.maintenanceManpowerInState(conn, nationId, e.getKey());
                recruitable += recruitment.recruitableManpower(conn, nationId, e.getKey(), e.getValue());
            }

            FinalModifiers fm = modifiers.computeFinal(conn, nationId, null, turnOrCurrent(conn, currentTurn));
            double taxFactor = fm.tax().finalValue();
            return new NationSummary(n.nationId(), n.name(), n.cash(), n.debt(), n.taxRate(), population, owned.size(),
                    buildingManpower, recruitable, n.manpowerUsed(), taxFactor, n.taxRate() * population * taxFactor);
        }));
    }

    public Result<StateSummary> stateSummary(String nationId, String stateId, Integer currentTurn) {
        return Result.attempt(log, "stateSummary", () -> db.read(conn -> {
            Nation n = requireNation(conn, nationId);
            List<Province> inState = provinces.controlledInState(conn, nationId, stateId);
            if (inState.isEmpty()) {
                throw new EngineException(EngineError.unauthorized(nationId + " controls no province in state " + stateId));
            }

            long population = inState.stream().mapToLong(Province::population).sum();

            Map<Resource, StateSummary.StockTotal> stock = new EnumMap<>(Resource.class);
            stockpiles.stateTotals(conn, nationId, stateId)
                    .forEach((r, v) -> stock.put(r, new StateSummary.StockTotal(v[0], v[1])));

            FinalModifiers fm = modifiers.computeFinal(conn, nationId, stateId, turnOrCurrent(conn, currentTurn));
            double prodFactor = fm.production().finalValue();

            ResourceMap.Builder produced = ResourceMap.builder();
            ResourceMap.Builder consumed = ResourceMap.builder();
            Map<String, Optional<BuildingTemplate>> cache = new HashMap<>();
            for (InstalledBuilding ib : installed.controlledBy(conn, nationId, stateId)) {
                Optional<BuildingTemplate> tpl = cache.get(ib.buildingId());
                if (tpl == null) {
                    tpl = templates.find(conn, ib.buildingId());
                    cache.put(ib.buildingId(), tpl);
                }
                if (tpl.isEmpty()) continue;
                int mult = ib.multiplier();
                tpl.get().outputs().forEach((r, q) -> produced.add(r, q * mult * prodFactor));
                tpl.get().inputs().forEach((r, q) -> consumed.add(r, q * mult));
            }
            ResourceMap out = produced.build();
            ResourceMap in = consumed.build();

            Map<Resource, Double> net = new EnumMap<>(Resource.class);
            for (Resource r : Resource.values()) {
                double v = out.get(r) - in.get(r);
                if (v != 0.0) net.put(r, v);
            }

            String stateName = provinces.stateName(conn, stateId).orElse(stateId);
            double tax = n.taxRate() * population * fm.tax().finalValue();
            return new StateSummary(nationId, stateId, stateName, population, stock, out, in, net, prodFactor, tax);
        }));
    }

    private int turnOrCurrent(Connection conn, Integer turn) throws SQLException {
        return turn != null ? turn : gameState.currentTurn(conn);
    }

    private Nation requireNation(Connection conn, String nationId) throws SQLException {
        return nations.find(conn, nationId)
                .orElseThrow(() -> new EngineException(EngineError.notFound("Nation " + nationId + " not found")));
    }
}
