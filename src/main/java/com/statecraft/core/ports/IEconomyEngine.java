package com.statecraft.core.ports;

import com.statecraft.core.domain.buildings.InstalledBuilding;
import com.statecraft.core.domain.buildings.PendingBuild;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.military.Army;
import com.statecraft.core.domain.military.Recruit;
import com.statecraft.core.domain.military.RecruitCost;
import com.statecraft.core.domain.military.UnitTemplate;
import com.statecraft.core.domain.modifiers.FinalModifiers;
import com.statecraft.core.domain.modifiers.Modifier;
import com.statecraft.core.domain.reports.NationSummary;
import com.statecraft.core.domain.reports.StateSummary;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.domain.trade.MarketPost;
import com.statecraft.core.domain.trade.TradeOffer;
import com.statecraft.core.domain.trade.TradeRecord;
import com.statecraft.core.domain.trade.TransportEstimate;
import com.statecraft.core.synchronization.TurnReport;

import java.util.List;

/**
 * Operations offered to command front ends. Nothing here throws: every outcome, failures included, is a {@link Result}.
 */
public interface IEconomyEngine {

    // --- BUILD ---
    Result<PendingBuild> startBuild(String nationId, String stateId, String buildingId, int tier);
    Result<PendingBuild> cancelBuild(String nationId, long buildId);
    Result<InstalledBuilding> demolish(String nationId, String provinceId, String buildingId, int tier);
    Result<List<PendingBuild>> buildQueue(String nationId);

    // --- TURN ---
    Result<TurnReport> advanceTurn();
    Result<Integer> currentTurn();

    // --- MARKET ---
    Result<MarketPost> postMarket(String nationId, String resource, double quantity, double pricePerUnit,
                                  boolean sell, String transportMode);
    Result<TradeOffer> acceptMarketPost(String nationId, long postId);
    Result<Void> cancelMarketPost(String nationId, long postId);
    Result<List<MarketPost>> listMarketPosts(String resource);

    // --- DIRECT OFFERS ---
    Result<TradeOffer> createOffer(String fromNation, String toNation, ResourceMap offered, ResourceMap requested,
                                   double offeredCash, double requestedCash, String transportMode);
    Result<TradeRecord> acceptOffer(long offerId, String accepterNation);
    Result<TradeOffer> cancelOffer(long offerId, String nationId);
    Result<List<TradeOffer>> listOffers(String nationId);
    Result<TransportEstimate> estimateTransportCost(String fromNation, String toNation, ResourceMap offered,
                                                    ResourceMap requested, String transportMode);

    // --- RECRUITMENT ---
    Result<RecruitCost> estimateRecruitCost(String templateId, int quantity);
    Result<List<Recruit>> recruitUnit(String nationId, String templateId, int quantity, String stateId, Long armyId);
    Result<RecruitCost> disbandRecruit(String nationId, long recruitId);
    Result<List<Recruit>> listRecruits(String nationId, String stateId);
    Result<Army> createArmy(String nationId, String name, String stateId);
    Result<List<UnitTemplate>> availableUnits(String nationId);

    // --- MODIFIERS ---
    Result<Long> addModifier(String scope, String scopeId, String effect, String kind, double value,
                             String source, Integer createdTurn, Integer expiresTurn);
    Result<Void> removeModifier(long modifierId);
    Result<List<Modifier>> listModifiers(String scope, String scopeId, boolean onlyActive);
    Result<FinalModifiers> computeFinalModifiers(String nationId, String stateId, Integer currentTurn);

    // --- REPORTS ---
    Result<NationSummary> nationSummary(String nationId, Integer currentTurn);
    Result<StateSummary> stateSummary(String nationId, String stateId, Integer currentTurn);
}
