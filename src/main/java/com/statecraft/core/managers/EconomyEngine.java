package com.statecraft.core.managers;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.ArmyDAO;
import com.statecraft.core.database.dao.BuildingTemplateDAO;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.MarketPostDAO;
import com.statecraft.core.database.dao.ModifierDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.database.dao.RecruitDAO;
import com.statecraft.core.database.dao.ResourceDAO;
import com.statecraft.core.database.dao.StateBuildDAO;
import com.statecraft.core.database.dao.StockpileDAO;
import com.statecraft.core.database.dao.TradeLogDAO;
import com.statecraft.core.database.dao.TradeOfferDAO;
import com.statecraft.core.database.dao.UnitTemplateDAO;
import com.statecraft.core.domain.buildings.BuildPipeline;
import com.statecraft.core.domain.buildings.InstalledBuilding;
import com.statecraft.core.domain.buildings.PendingBuild;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.ledger.StockpileStore;
import com.statecraft.core.domain.military.Army;
import com.statecraft.core.domain.military.Recruit;
import com.statecraft.core.domain.military.RecruitCost;
import com.statecraft.core.domain.military.RecruitmentFlow;
import com.statecraft.core.domain.military.UnitTemplate;
import com.statecraft.core.domain.modifiers.FinalModifiers;
import com.statecraft.core.domain.modifiers.Modifier;
import com.statecraft.core.domain.modifiers.ModifierAggregator;
import com.statecraft.core.domain.reports.EconomyReports;
import com.statecraft.core.domain.reports.NationSummary;
import com.statecraft.core.domain.reports.StateSummary;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.domain.trade.MarketPost;
import com.statecraft.core.domain.trade.TradeEngine;
import com.statecraft.core.domain.trade.TradeOffer;
import com.statecraft.core.domain.trade.TradeRecord;
import com.statecraft.core.domain.trade.TransportCostModel;
import com.statecraft.core.domain.trade.TransportEstimate;
import com.statecraft.core.infrastructure.EngineConfig;
import com.statecraft.core.ports.IEconomyEngine;
import com.statecraft.core.synchronization.TurnProcessor;
import com.statecraft.core.synchronization.TurnReport;

import java.time.Clock;
import java.util.List;

/**
 * Wires the DAOs and services over one {@link DatabaseManager} and exposes them as {@link IEconomyEngine}.
 */
public class EconomyEngine implements IEconomyEngine {

    private final StockpileStore stockpiles;
    private final ModifierAggregator modifiers;
    private final BuildPipeline builds;
    private final RecruitmentFlow recruitment;
    private final TradeEngine trade;
    private final TurnProcessor turns;
    private final EconomyReports reports;

    public EconomyEngine(DatabaseManager db, EngineConfig config) {
        this(db, config, Clock.systemUTC());
    }

    public EconomyEngine(DatabaseManager db, EngineConfig config, Clock clock) {
        StockpileDAO stockpileDao = new StockpileDAO();
        ProvinceDAO provinceDao = new ProvinceDAO();
        NationDAO nationDao = new NationDAO();
        GameStateDAO gameStateDao = new GameStateDAO();
        BuildingTemplateDAO buildingTemplateDao = new BuildingTemplateDAO();
        StateBuildDAO stateBuildDao = new StateBuildDAO();
        ProvinceBuildingDAO provinceBuildingDao = new ProvinceBuildingDAO();

        this.stockpiles = new StockpileStore(db, stockpileDao, config.defaultStockpileCapacity());
        this.modifiers = new ModifierAggregator(db, new ModifierDAO());
        this.builds = new BuildPipeline(db, stockpiles, buildingTemplateDao, stateBuildDao, provinceBuildingDao,
                provinceDao, nationDao, gameStateDao);
        this.recruitment = new RecruitmentFlow(db, stockpiles, new UnitTemplateDAO(), new RecruitDAO(), new ArmyDAO(),
                nationDao, provinceDao, provinceBuildingDao, gameStateDao, config.recruitManpowerRatio());
        this.trade = new TradeEngine(db, stockpiles, new MarketPostDAO(), new TradeOfferDAO(), new TradeLogDAO(),
                nationDao, provinceDao, gameStateDao,
                new TransportCostModel(new ResourceDAO(), provinceDao, config.tradeBaseRatePerKgKm()),
                config.maxOpenOffers(), clock);
        this.turns = new TurnProcessor(db, builds, stockpiles, stateBuildDao, provinceBuildingDao, buildingTemplateDao,
                nationDao, gameStateDao, modifiers);
        this.reports = new EconomyReports(db, nationDao, provinceDao, provinceBuildingDao, buildingTemplateDao,
                stockpiles, modifiers, recruitment, gameStateDao);
    }

    // ==========================================================
    // GETTERS
    // ==========================================================
    public StockpileStore getStockpiles() { return stockpiles; }
    public ModifierAggregator getModifiers() { return modifiers; }
    public BuildPipeline getBuilds() { return builds; }
    public RecruitmentFlow getRecruitment() { return recruitment; }
    public TradeEngine getTrade() { return trade; }
    public TurnProcessor getTurns() { return turns; }
    public EconomyReports getReports() { return reports; }

    // ==========================================================
    // BUILD
    // ==========================================================
    @Override
    public Result<PendingBuild> startBuild(String nationId, String stateId, String buildingId, int tier) {
        return builds.start(nationId, stateId, buildingId, tier);
    }

    @Override
    public Result<PendingBuild> cancelBuild(String nationId, long buildId) {
        return builds.cancel(nationId, buildId);
    }

    @Override
    public Result<InstalledBuilding> demolish(String nationId, String provinceId, String buildingId, int tier) {
        return builds.demolish(nationId, provinceId, buildingId, tier);
    }

    @Override
    public Result<List<PendingBuild>> buildQueue(String nationId) {
        return builds.buildQueue(nationId);
    }

    // ==========================================================
    // TURN
    // ==========================================================
    @Override
    public Result<TurnReport> advanceTurn() {
        return turns.advanceTurn();
    }

    @Override
    public Result<Integer> currentTurn() {
        return turns.currentTurn();
    }

    // ==========================================================
    // TRADE
    // ==========================================================
    @Override
    public Result<MarketPost> postMarket(String nationId, String resource, double quantity, double pricePerUnit,
                                         boolean sell, String transportMode) {
        return trade.post(nationId, resource, quantity, pricePerUnit, sell, transportMode);
    }

    @Override
    public Result<TradeOffer> acceptMarketPost(String nationId, long postId) {
        return trade.acceptMarketPost(nationId, postId);
    }

    @Override
    public Result<Void> cancelMarketPost(String nationId, long postId) {
        return trade.cancelMarketPost(nationId, postId);
    }

    @Override
    public Result<List<MarketPost>> listMarketPosts(String resource) {
        return trade.listMarketPosts(resource);
    }

    @Override
    public Result<TradeOffer> createOffer(String fromNation, String toNation, ResourceMap offered, ResourceMap requested,
                                          double offeredCash, double requestedCash, String transportMode) {
        return trade.createOffer(fromNation, toNation, offered, requested, offeredCash, requestedCash, transportMode);
    }

    @Override
    public Result<TradeRecord> acceptOffer(long offerId, String accepterNation) {
        return trade.acceptOffer(offerId, accepterNation);
    }

    @Override
    public Result<TradeOffer> cancelOffer(long offerId, String nationId) {
        return trade.cancelOffer(offerId, nationId);
    }

    @Override
    public Result<List<TradeOffer>> listOffers(String nationId) {
        return trade.listOffers(nationId);
    }

    @Override
    public Result<TransportEstimate> estimateTransportCost(String fromNation, String toNation, ResourceMap offered,
                                                           ResourceMap requested, String transportMode) {
        return trade.estimateTransportCost(fromNation, toNation, offered, requested, transportMode);
    }

    // ==========================================================
    // RECRUITMENT
    // ==========================================================
    @Override
    public Result<RecruitCost> estimateRecruitCost(String templateId, int quantity) {
        return recruitment.estimateCost(templateId, quantity);
    }

    @Override
    public Result<List<Recruit>> recruitUnit(String nationId, String templateId, int quantity, String stateId, Long armyId) {
        return recruitment.recruit(nationId, templateId, quantity, stateId, armyId);
    }

    @Override
    public Result<RecruitCost> disbandRecruit(String nationId, long recruitId) {
        return recruitment.disband(nationId, recruitId);
    }

    @Override
    public Result<List<Recruit>> listRecruits(String nationId, String stateId) {
        return recruitment.listRecruits(nationId, stateId);
    }

    @Override
    public Result<Army> createArmy(String nationId, String name, String stateId) {
        return recruitment.createArmy(nationId, name, stateId);
    }

    @Override
    public Result<List<UnitTemplate>> availableUnits(String nationId) {
        return recruitment.availableUnits(nationId);
    }

    // ==========================================================
    // MODIFIERS
    // ==========================================================
    @Override
    public Result<Long> addModifier(String scope, String scopeId, String effect, String kind, double value,
                                    String source, Integer createdTurn, Integer expiresTurn) {
        return modifiers.addModifier(scope, scopeId, effect, kind, value, source, createdTurn, expiresTurn);
    }

    @Override
    public Result<Void> removeModifier(long modifierId) {
        return modifiers.removeModifier(modifierId);
    }

    @Override
    public Result<List<Modifier>> listModifiers(String scope, String scopeId, boolean onlyActive) {
        return modifiers.listModifiers(scope, scopeId, onlyActive);
    }

    @Override
    public Result<FinalModifiers> computeFinalModifiers(String nationId, String stateId, Integer currentTurn) {
        return modifiers.computeFinal(nationId, stateId, currentTurn);
    }

    // ==========================================================
    // REPORTS
    // ==========================================================
    @Override
    public Result<NationSummary> nationSummary(String nationId, Integer currentTurn) {
        return reports.nationSummary(nationId, currentTurn);
    }

    @Override
    public Result<StateSummary> stateSummary(String nationId, String stateId, Integer currentTurn) {
        return reports.stateSummary(nationId, stateId, currentTurn);
    }
}
