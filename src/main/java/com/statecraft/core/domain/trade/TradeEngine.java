package com.statecraft.core.domain.trade;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.MarketPostDAO;
import com.statecraft.core.database.dao.NationDAO;
import com.statecraft.core.database.dao.ProvinceDAO;
import com.statecraft.core.database.dao.SqlSupport;
import com.statecraft.core.database.dao.TradeLogDAO;
import com.statecraft.core.database.dao.TradeOfferDAO;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.ledger.StockpileStore;
import com.statecraft.core.domain.result.EngineError;
import com.statecraft.core.domain.result.EngineException;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.domain.world.Province;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Market posts and direct offers over one settlement primitive.
 *
 * <p>Cash offered is escrowed when an offer opens and leaves escrow exactly once: paid out on settlement,
 * or refunded on cancel or failed settlement. Every terminal transition goes through
 * {@link TradeOfferDAO#closeIfOpen}, so a refund can never be applied twice.
 */
public class TradeEngine {

    private static final Logger log = LoggerFactory.getLogger(TradeEngine.class);

    private final DatabaseManager db;
    private final StockpileStore stockpiles;
    private final MarketPostDAO posts;
    private final TradeOfferDAO offers;
    private final TradeLogDAO tradeLog;
    private final NationDAO nations;
    private final ProvinceDAO provinces;
    private final GameStateDAO gameState;
    private final TransportCostModel transport;
    private final int maxOpenOffers;
    private final Clock clock;

    public TradeEngine(DatabaseManager db,
                       StockpileStore stockpiles,
                       MarketPostDAO posts,
                       TradeOfferDAO offers,
                       TradeLogDAO tradeLog,
                       NationDAO nations,
                       ProvinceDAO provinces,
                       GameStateDAO gameState,
                       TransportCostModel transport,
                       int maxOpenOffers,
                       Clock clock) {
        this.db = db;
        this.stockpiles = stockpiles;
        this.posts = posts;
        this.offers = offers;
        this.tradeLog = tradeLog;
        this.nations = nations;
        this.provinces = provinces;
        this.gameState = gameState;
        this.transport = transport;
        this.maxOpenOffers = maxOpenOffers;
        this.clock = clock;
    }

    // ==========================================================
    // MARKET
    // ==========================================================

    public Result<MarketPost> post(String nationId, String resourceName, double quantity, double pricePerUnit,
                                   boolean sell, String mode) {
        return Result.attempt(log, "postMarket", () -> {
            Resource resource = parseResource(resourceName);
            TransportMode tm = parseMode(mode);
            requirePositive(quantity, "Quantity");
            requirePositive(pricePerUnit, "Price per unit");

            MarketPost post = db.inTransaction(conn -> {
                requireNation(conn, nationId);
                if (sell) {
                    double available = stockpiles.nationAvailable(conn, nationId, resource);
                    if (available + SqlSupport.EPSILON < quantity) {
                        throw new EngineException(EngineError.insufficientResource(resource, quantity - available));
                    }
                }
                long id = posts.insert(conn, nationId, resource, quantity, pricePerUnit, sell, tm, clock.instant());
                return posts.find(conn, id).orElseThrow(() -> new SQLException("Market post #" + id + " not readable"));
            });
            log.info("📦 Market post #{}: {} {} {} x{} @ {}", post.id(), nationId, sell ? "sells" : "buys",
                    resource, quantity, pricePerUnit);
            return post;
        });
    }

    /**
     * Turns a post into an open offer addressed to the poster and removes the post, in one transaction.
     * On a sell post the acceptor buys and escrows {@code price * qty}; on a buy post the acceptor sells and
     * asks for that amount in cash.
     */
    public Result<TradeOffer> acceptMarketPost(String acceptorId, long postId) {
        return Result.attempt(log, "acceptMarketPost", () -> {
            TradeOffer offer = db.inTransaction(conn -> {
                MarketPost post = posts.find(conn, postId)
                        .orElseThrow(() -> new EngineException(EngineError.notFound("Market post #" + postId + " not found")));
                if (post.posterNation().equals(acceptorId)) {
                    throw new EngineException(EngineError.invalidState("A nation cannot accept its own market post"));
                }
                requireNation(conn, acceptorId);

                double total = post.total();
                ResourceMap goods = ResourceMap.of(post.resource(), post.quantity());
                Instant now = clock.instant();
                long offerId;

                if (post.sell()) {
                    if (!nations.debitIfCovered(conn, acceptorId, total)) {
                        throw new EngineException(EngineError.insufficientCash(total - nations.cash(conn, acceptorId)));
                    }
                    offerId = offers.insertOpen(conn, acceptorId, post.posterNation(), ResourceMap.empty(), goods,
                            total, 0.0, post.mode(), now);
                } else {
                    double available = stockpiles.nationAvailable(conn, acceptorId, post.resource());
                    if (available + SqlSupport.EPSILON < post.quantity()) {
                        throw new EngineException(EngineError.insufficientResource(post.resource(), post.quantity() - available));
                    }
                    offerId = offers.insertOpen(conn, acceptorId, post.posterNation(), goods, ResourceMap.empty(),
                            0.0, total, post.mode(), now);
                }

                posts.delete(conn, postId);
                return offers.find(conn, offerId).orElseThrow(() -> new SQLException("Offer #" + offerId + " not readable"));
            });
            log.info("Market post #{} accepted by {} -> offer #{}", postId, acceptorId, offer.id());
            return offer;
        });
    }

    public Result<Void> cancelMarketPost(String nationId, long postId) {
        return Result.attempt(log, "cancelMarketPost", () -> db.inTransaction(conn -> {
            MarketPost post = posts.find(conn, postId)
                    .orElseThrow(() -> new EngineException(EngineError.notFound("Market post #" + postId + " not found")));
            if (!post.posterNation().equals(nationId)) {
                throw new EngineException(EngineError.unauthorized("Market post #" + postId + " belongs to " + post.posterNation()));
            }
            posts.delete(conn, postId);
            return null;
        }));
    }

    public Result<List<MarketPost>> listMarketPosts(String resourceName) {
        return Result.attempt(log, "listMarketPosts", () -> {
            Resource filter = resourceName == null || resourceName.isBlank() ? null : parseResource(resourceName);
            return db.read(conn -> posts.list(conn, filter));
        });
    }

    // ==========================================================
    // DIRECT OFFERS
    // ==========================================================

    public Result<TradeOffer> createOffer(String fromNation, String toNation, ResourceMap offered, ResourceMap requested,
                                          double offeredCash, double requestedCash, String mode) {
        return Result.attempt(log, "createOffer", () -> {
            TransportMode tm = parseMode(mode);
            ResourceMap give = offered == null ? ResourceMap.empty() : offered;
            ResourceMap want = requested == null ? ResourceMap.empty() : requested;
            requireNonNegative(offeredCash, "Offered cash");
            requireNonNegative(requestedCash, "Requested cash");
            if (fromNation.equals(toNation)) {
                throw new EngineException(EngineError.invalidArgument("A nation cannot trade with itself"));
            }
            if (give.isEmpty() && want.isEmpty() && offeredCash == 0 && requestedCash == 0) {
                throw new EngineException(EngineError.invalidArgument("An offer must move something"));
            }

            TradeOffer offer = db.inTransaction(conn -> {
                requireNation(conn, fromNation);
                requireNation(conn, toNation);

                if (offers.countOpenFrom(conn, fromNation) >= maxOpenOffers) {
                    throw new EngineException(EngineError.admissionLimit(maxOpenOffers));
                }
                if (!nations.debitIfCovered(conn, fromNation, offeredCash)) {
                    throw new EngineException(EngineError.insufficientCash(offeredCash - nations.cash(conn, fromNation)));
                }
                long id = offers.insertOpen(conn, fromNation, toNation, give, want, offeredCash, requestedCash, tm, clock.instant());
                return offers.find(conn, id).orElseThrow(() -> new SQLException("Offer #" + id + " not readable"));
            });
            log.info("🤝 Offer #{} opened: {} -> {} (escrow {})", offer.id(), fromNation, toNation, offeredCash);
            return offer;
        });
    }

    public Result<TradeOffer> cancelOffer(long offerId, String nationId) {
        return Result.attempt(log, "cancelOffer", () -> {
            TradeOffer cancelled = db.inTransaction(conn -> {
                TradeOffer offer = requireOffer(conn, offerId);
                if (!offer.fromNation().equals(nationId)) {
                    throw new EngineException(EngineError.unauthorized("Only " + offer.fromNation() + " can cancel offer #" + offerId));
                }
                if (!offers.closeIfOpen(conn, offerId, OfferStatus.CANCELLED, clock.instant())) {
                    throw new EngineException(EngineError.invalidState(
                            "Offer #" + offerId + " is " + offer.status().dbValue() + "; only open offers can be cancelled"));
                }
                nations.credit(conn, offer.fromNation(), offer.offeredCash());
                return requireOffer(conn, offerId);
            });
            log.info("Offer #{} cancelled, refunded {} to {}", offerId, cancelled.offeredCash(), nationId);
            return cancelled;
        });
    }

    public Result<List<TradeOffer>> listOffers(String nationId) {
        return Result.attempt(log, "listOffers", () -> db.read(conn -> offers.involving(conn, nationId)));
    }

    // ==========================================================
    // SETTLEMENT
    // ==========================================================

    /**
     * Settles an open offer addressed to {@code accepterId}.
     *
     * <p>Validation failures leave the offer open. A failure once settlement has begun rolls the settlement back,
     * then refunds the escrow and marks the offer failed in a second transaction.
     */
    public Result<TradeRecord> acceptOffer(long offerId, String accepterId) {
        return Result.attempt(log, "acceptOffer", () -> {
            try {
                TradeRecord record = db.inTransaction(conn -> settle(conn, offerId, accepterId));
                log.info("✅ Offer #{} settled: {} <-> {} (transport {})",
                        offerId, record.fromNation(), record.toNation(), record.transportCost());
                return record;
            } catch (SettlementFailed e) {
                boolean refunded = refundFailed(offerId);
                log.warn("⚠️ Settlement of offer #{} failed ({}); escrow refunded: {}",
                        offerId, e.getError().message(), refunded);
                throw new EngineException(e.getError());
            }
        });
    }

    private TradeRecord settle(Connection conn, long offerId, String accepterId) throws SQLException {
        TradeOffer offer = requireOffer(conn, offerId);
        if (!offer.toNation().equals(accepterId)) {
            throw new EngineException(EngineError.unauthorized("Offer #" + offerId + " is addressed to " + offer.toNation()));
        }
        if (!offer.isOpen()) {
            throw new EngineException(EngineError.invalidState("Offer #" + offerId + " is " + offer.status().dbValue()));
        }

        try {
            return transfer(conn, offer);
        } catch (EngineException e) {
            throw new SettlementFailed(e.getError(), e);
        } catch (SQLException | RuntimeException e) {
            log.error("❌ Storage error while settling offer #{}", offerId, e);
            throw new SettlementFailed(EngineError.storeError("acceptOffer"), e);
        }
    }

    private TradeRecord transfer(Connection conn, TradeOffer offer) throws SQLException {
        String creator = offer.fromNation();
        String accepter = offer.toNation();

        TransportEstimate est = transport.estimate(conn, creator, accepter, offer.offered(), offer.requested(), offer.mode());

        if (!nations.debitIfCovered(conn, accepter, offer.requestedCash())) {
            throw new EngineException(EngineError.insufficientCash(offer.requestedCash() - nations.cash(conn, accepter)));
        }
        nations.credit(conn, creator, offer.requestedCash());

        deductFromNation(conn, accepter, offer.requested());
        deductFromNation(conn, creator, offer.offered());
        creditToNation(conn, accepter, offer.offered());
        creditToNation(conn, creator, offer.requested());

        double netToAccepter = Math.max(0.0, offer.offeredCash() - est.cost());
        nations.credit(conn, accepter, netToAccepter);

        Instant now = clock.instant();
        if (!offers.closeIfOpen(conn, offer.id(), OfferStatus.COMPLETED, now)) {
            throw new EngineException(EngineError.invalidState("Offer #" + offer.id() + " was closed concurrently"));
        }

        TradeRecord draft = new TradeRecord(0L, offer.id(), creator, accepter, offer.offered(), offer.requested(),
                offer.offeredCash() - offer.requestedCash(), est.cost(), gameState.currentTurn(conn), now);
        long id = tradeLog.insert(conn, draft);
        return new TradeRecord(id, draft.offerId(), draft.fromNation(), draft.toNation(), draft.offered(),
                draft.requested(), draft.cashExchanged(), draft.transportCost(), draft.turn(), draft.createdAt());
    }

    /**
     * Compensation for a failed settlement. Runs in its own transaction after the settlement rolled back.
     *
     * @return false when the offer had already left the open state, in which case nothing is refunded
     */
    private boolean refundFailed(long offerId) throws SQLException {
        return db.inTransaction(conn -> {
            TradeOffer offer = offers.find(conn, offerId).orElse(null);
            if (offer == null || !offers.closeIfOpen(conn, offerId, OfferStatus.FAILED, clock.instant())) {
                return false;
            }
            nations.credit(conn, offer.fromNation(), offer.offeredCash());
            return true;
        });
    }

    // Strongest provinces first, unreserved stock only. Throws on shortfall; the caller's transaction rolls back.
    private void deductFromNation(Connection conn, String nationId, ResourceMap goods) throws SQLException {
        if (goods.isEmpty()) return;
        List<Province> owned = provinces.controlledBy(conn, nationId);
        for (Map.Entry<Resource, Double> e : goods.asMap().entrySet()) {
            double remaining = e.getValue();
            for (Province p : owned) {
                if (remaining <= SqlSupport.EPSILON) break;
                remaining -= stockpiles.drainAvailable(conn, p.provinceId(), e.getKey(), remaining);
            }
            if (remaining > SqlSupport.EPSILON) {
                log.debug("{} is short of {} by {}", nationId, e.getKey(), remaining);
                throw new EngineException(EngineError.insufficientResource(e.getKey(), remaining));
            }
        }
    }

    // Strongest province already holding the resource, else the strongest province.
    private void creditToNation(Connection conn, String nationId, ResourceMap goods) throws SQLException {
        if (goods.isEmpty()) return;
        List<Province> owned = provinces.controlledBy(conn, nationId);
        if (owned.isEmpty()) {
            throw new EngineException(EngineError.invalidState(nationId + " has no province to receive goods"));
        }
        for (Map.Entry<Resource, Double> e : goods.asMap().entrySet()) {
            String target = owned.get(0).provinceId();
            for (Province p : owned) {
                if (stockpiles.entry(conn, p.provinceId(), e.getKey()).isPresent()) {
                    target = p.provinceId();
                    break;
                }
            }
            double stored = stockpiles.add(conn, target, e.getKey(), e.getValue());
            if (stored + SqlSupport.EPSILON < e.getValue()) {
                log.warn("{} received {} {} but only {} fit in {}", nationId, e.getValue(), e.getKey(), stored, target);
            }
        }
    }

    // ==========================================================
    // ESTIMATES
    // ==========================================================

    public Result<TransportEstimate> estimateTransportCost(String fromNation, String toNation,
                                                           ResourceMap offered, ResourceMap requested, String mode) {
        return Result.attempt(log, "estimateTransportCost", () -> {
            TransportMode tm = parseMode(mode);
            return db.read(conn -> transport.estimate(conn, fromNation, toNation,
                    offered == null ? ResourceMap.empty() : offered,
                    requested == null ? ResourceMap.empty() : requested, tm));
        });
    }

    // ==========================================================
    // HELPERS
    // ==========================================================

    private void requireNation(Connection conn, String nationId) throws SQLException {
        if (nations.find(conn, nationId).isEmpty()) {
            throw new EngineException(EngineError.notFound("Nation " + nationId + " not found"));
        }
    }

    private TradeOffer requireOffer(Connection conn, long offerId) throws SQLException {
        return offers.find(conn, offerId)
                .orElseThrow(() -> new EngineException(EngineError.notFound("Offer #" + offerId + " not found")));
    }

    private static Resource parseResource(String name) {
        return Resource.parse(name)
                .orElseThrow(() -> new EngineException(EngineError.invalidArgument("Unknown resource: " + name)));
    }

    private static TransportMode parseMode(String mode) {
        return TransportMode.parse(mode)
                .orElseThrow(() -> new EngineException(EngineError.invalidArgument("Unknown transport mode: " + mode)));
    }

    private static void requirePositive(double v, String what) {
        if (!(v > 0) || !Double.isFinite(v)) {
            throw new EngineException(EngineError.invalidArgument(what + " must be positive"));
        }
    }

    private static void requireNonNegative(double v, String what) {
        if (!(v >= 0) || !Double.isFinite(v)) {
            throw new EngineException(EngineError.invalidArgument(what + " must be >= 0"));
        }
    }

    /** Marks a failure that happened after settlement started and therefore needs compensation. */
    private static final class SettlementFailed extends EngineException {
        SettlementFailed(EngineError error, Throwable cause) {
            super(error);
            initCause(cause);
        }
    }
}
