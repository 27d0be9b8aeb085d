package com.statecraft.core.domain.trade;

import com.statecraft.core.TestWorld;
import com.statecraft.core.database.dao.TradeLogDAO;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.result.ErrorKind;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.domain.world.Province;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TradeEngineTest {

    private static final ResourceMap TEN_STEEL = ResourceMap.of(Resource.STEEL, 10);
    private static final ResourceMap FIVE_FOOD = ResourceMap.of(Resource.FOOD, 5);

    @TempDir
    Path tmp;

    private TestWorld world;
    private TradeEngine trade;

    @BeforeEach
    void setUp() throws Exception {
        world = new TestWorld(tmp);
        world.nation("A", 2000)
                .nation("B", 0)
                .province(new Province("P1", "S1", "A", "P1", 1000, 5.0, 0.0, 0.0))
                .province(new Province("Q1", "S2", "B", "Q1", 1000, 5.0, 3.0, 4.0))
                .stock("P1", Resource.STEEL, 20);
        trade = world.engine.getTrade();
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    void cancelRefundsEscrowExactly() throws Exception {
        TradeOffer offer = trade.createOffer("A", "B", TEN_STEEL, FIVE_FOOD, 1000, 0, null).value();
        assertEquals(1000.0, world.cash("A"), 1e-9);
        assertEquals(TransportMode.AUTO, offer.mode());

        TradeOffer cancelled = trade.cancelOffer(offer.id(), "A").value();

        assertEquals(OfferStatus.CANCELLED, cancelled.status());
        assertNotNull(cancelled.resolvedAt());
        assertEquals(2000.0, world.cash("A"), 1e-9);

        assertEquals(ErrorKind.INVALID_STATE, trade.cancelOffer(offer.id(), "A").kind());
        assertEquals(2000.0, world.cash("A"), 1e-9);
    }

    @Test
    void failedSettlementRefundsOnceAndLeavesCreatorUntouched() throws Exception {
        TradeOffer offer = trade.createOffer("A", "B", TEN_STEEL, FIVE_FOOD, 1000, 0, "land").value();

        Result<TradeRecord> r = trade.acceptOffer(offer.id(), "B");

        assertEquals(ErrorKind.INSUFFICIENT_RESOURCE, r.kind());
        assertEquals(Resource.FOOD, r.error().resource());
        assertEquals(2000.0, world.cash("A"), 1e-9);
        assertEquals(20.0, world.amount("P1", Resource.STEEL), 1e-9);
        assertEquals(0.0, world.amount("Q1", Resource.STEEL), 1e-9);
        assertEquals(0.0, world.cash("B"), 1e-9);

        TradeOffer after = trade.listOffers("A").value().get(0);
        assertEquals(OfferStatus.FAILED, after.status());

        assertEquals(ErrorKind.INVALID_STATE, trade.acceptOffer(offer.id(), "B").kind());
        assertEquals(ErrorKind.INVALID_STATE, trade.cancelOffer(offer.id(), "A").kind());
        assertEquals(2000.0, world.cash("A"), 1e-9);
    }

    @Test
    void acceptBySomeoneElseKeepsOfferOpen() throws Exception {
        world.nation("C", 0);
        TradeOffer offer = trade.createOffer("A", "B", TEN_STEEL, FIVE_FOOD, 1000, 0, null).value();

        assertEquals(ErrorKind.UNAUTHORIZED, trade.acceptOffer(offer.id(), "C").kind());
        assertEquals(ErrorKind.NOT_FOUND, trade.acceptOffer(9999L, "B").kind());

        assertTrue(trade.listOffers("A").value().get(0).isOpen());
        assertEquals(1000.0, world.cash("A"), 1e-9);
    }

    @Test
    void settlementMovesGoodsCashAndTransportCost() throws Exception {
        world.stock("Q1", Resource.FOOD, 10);
        TradeOffer offer = trade.createOffer("A", "B", TEN_STEEL, FIVE_FOOD, 1000, 0, "land").value();

        TradeRecord record = trade.acceptOffer(offer.id(), "B").value();

        // (10 * 1.6 + 5 * 0.5) kg * 5 km * 0.00008
        double expectedCost = 18.5 * 5.0 * 0.00008;
        assertEquals(expectedCost, record.transportCost(), 1e-9);
        assertEquals(1000.0, record.cashExchanged(), 1e-9);
        assertEquals(offer.id(), record.offerId());

        assertEquals(10.0, world.amount("P1", Resource.STEEL), 1e-9);
        assertEquals(5.0, world.amount("P1", Resource.FOOD), 1e-9);
        assertEquals(10.0, world.amount("Q1", Resource.STEEL), 1e-9);
        assertEquals(5.0, world.amount("Q1", Resource.FOOD), 1e-9);

        assertEquals(1000.0, world.cash("A"), 1e-9);
        assertEquals(1000.0 - expectedCost, world.cash("B"), 1e-9);
        assertEquals(OfferStatus.COMPLETED, trade.listOffers("B").value().get(0).status());
        assertEquals(1, world.db.read(conn -> new TradeLogDAO().forOffer(conn, offer.id())).size());
    }

    @Test
    void requestedCashIsPaidByAccepter() throws Exception {
        world.nation("B", 300).stock("Q1", Resource.FOOD, 10);
        TradeOffer offer = trade.createOffer("A", "B", TEN_STEEL, ResourceMap.empty(), 0, 250, null).value();

        trade.acceptOffer(offer.id(), "B").value();

        assertEquals(2250.0, world.cash("A"), 1e-9);
        assertEquals(50.0, world.cash("B"), 1e-9);
    }

    @Test
    void fourthOpenOfferHitsAdmissionLimit() {
        for (int i = 0; i < 3; i++) {
            assertTrue(trade.createOffer("A", "B", ResourceMap.empty(), FIVE_FOOD, 0, 0, null).isOk());
        }

        Result<TradeOffer> fourth = trade.createOffer("A", "B", ResourceMap.empty(), FIVE_FOOD, 0, 0, null);
        assertEquals(ErrorKind.ADMISSION_LIMIT_EXCEEDED, fourth.kind());

        long open = trade.listOffers("A").value().stream().filter(TradeOffer::isOpen).count();
        assertEquals(3, open);

        trade.cancelOffer(trade.listOffers("A").value().get(0).id(), "A");
        assertTrue(trade.createOffer("A", "B", ResourceMap.empty(), FIVE_FOOD, 0, 0, null).isOk());
    }

    @Test
    void offerValidation() throws Exception {
        assertEquals(ErrorKind.INVALID_ARGUMENT, trade.createOffer("A", "A", TEN_STEEL, null, 0, 0, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, trade.createOffer("A", "B", null, null, 0, 0, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, trade.createOffer("A", "B", TEN_STEEL, null, -1, 0, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, trade.createOffer("A", "B", TEN_STEEL, null, 0, 0, "teleport").kind());
        assertEquals(ErrorKind.NOT_FOUND, trade.createOffer("A", "Z", TEN_STEEL, null, 0, 0, null).kind());
        assertEquals(ErrorKind.INSUFFICIENT_CASH, trade.createOffer("A", "B", TEN_STEEL, null, 5000, 0, null).kind());
        assertEquals(2000.0, world.cash("A"), 1e-9);
    }

    @Test
    void sellPostBecomesOfferFromBuyer() throws Exception {
        world.nation("B", 100).stock("P1", Resource.COAL, 10);

        MarketPost post = trade.post("A", "Coal", 10, 5, true, "rail").value();
        assertEquals(50.0, post.total(), 1e-9);
        assertEquals(1, trade.listMarketPosts("coal").value().size());
        assertTrue(trade.listMarketPosts("Iron").value().isEmpty());

        TradeOffer offer = trade.acceptMarketPost("B", post.id()).value();
        assertEquals("B", offer.fromNation());
        assertEquals("A", offer.toNation());
        assertEquals(50.0, offer.offeredCash(), 1e-9);
        assertEquals(TransportMode.RAIL, offer.mode());
        assertEquals(50.0, world.cash("B"), 1e-9);
        assertTrue(trade.listMarketPosts(null).value().isEmpty());

        trade.acceptOffer(offer.id(), "A").value();
        assertEquals(0.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(10.0, world.amount("Q1", Resource.COAL), 1e-9);
        assertTrue(world.cash("A") > 2000.0);
    }

    @Test
    void marketPostRules() throws Exception {
        assertEquals(ErrorKind.INSUFFICIENT_RESOURCE, trade.post("A", "Coal", 10, 5, true, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, trade.post("A", "Unobtainium", 10, 5, true, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, trade.post("A", "Steel", 0, 5, true, null).kind());

        MarketPost buy = trade.post("A", "Food", 5, 2, false, null).value();
        assertEquals(ErrorKind.INVALID_STATE, trade.acceptMarketPost("A", buy.id()).kind());
        assertEquals(ErrorKind.INSUFFICIENT_RESOURCE, trade.acceptMarketPost("B", buy.id()).kind());
        assertEquals(ErrorKind.UNAUTHORIZED, trade.cancelMarketPost("B", buy.id()).kind());
        assertTrue(trade.cancelMarketPost("A", buy.id()).isOk());
        assertEquals(ErrorKind.NOT_FOUND, trade.cancelMarketPost("A", buy.id()).kind());
    }

    @Test
    void transportEstimateUsesStrongestProvincesAndModeFactor() {
        TransportEstimate est = trade.estimateTransportCost("A", "B", TEN_STEEL, FIVE_FOOD, "sea").value();

        assertEquals(18.5, est.weightKg(), 1e-9);
        assertEquals(5.0, est.distance(), 1e-9);
        assertEquals(TransportMode.SEA, est.mode());
        assertEquals(18.5 * 5.0 * 0.00008 * 0.4, est.cost(), 1e-12);
    }

    @Test
    void transportCostIsZeroWithoutCoordinates() throws Exception {
        world.province("P1", "S1", "A", 1000, 5.0);

        assertEquals(0.0, trade.estimateTransportCost("A", "B", TEN_STEEL, null, null).value().cost(), 1e-12);
    }
}
