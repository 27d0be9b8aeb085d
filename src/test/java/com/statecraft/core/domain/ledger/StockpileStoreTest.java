package com.statecraft.core.domain.ledger;

import com.statecraft.core.TestWorld;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StockpileStoreTest {

    @TempDir
    Path tmp;

    private TestWorld world;
    private StockpileStore store;

    @BeforeEach
    void setUp() throws Exception {
        world = new TestWorld(tmp);
        world.nation("A", 0).province("P1", "S1", "A", 1000, 5.0);
        store = world.engine.getStockpiles();
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    void reserveBeyondAvailableLeavesEverythingUnchanged() throws Exception {
        world.stock("P1", Resource.COAL, 100);

        assertTrue(store.reserve(1L, "P1", Resource.COAL, 60));
        assertEquals(40.0, store.available("P1", Resource.COAL), 1e-9);

        assertFalse(store.reserve(2L, "P1", Resource.COAL, 50));
        assertEquals(100.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(40.0, store.available("P1", Resource.COAL), 1e-9);
        assertEquals(1, store.reservationsFor(1L).size());
        assertTrue(store.reservationsFor(2L).isEmpty());
    }

    @Test
    void releaseRestoresAvailabilityWithoutTouchingAmount() throws Exception {
        world.stock("P1", Resource.IRON, 80);
        assertTrue(store.reserve(7L, "P1", Resource.IRON, 30));
        assertTrue(store.reserve(7L, "P1", Resource.IRON, 20));

        assertEquals(2, store.release(7L));
        assertEquals(80.0, store.available("P1", Resource.IRON), 1e-9);
        assertEquals(80.0, world.amount("P1", Resource.IRON), 1e-9);
    }

    @Test
    void consumeDecrementsByReservedAmount() throws Exception {
        world.stock("P1", Resource.STEEL, 50);
        store.reserve(3L, "P1", Resource.STEEL, 20);

        assertEquals(1, store.consume(3L).size());
        assertEquals(30.0, world.amount("P1", Resource.STEEL), 1e-9);
        assertEquals(0.0, store.reserved("P1", Resource.STEEL), 1e-9);
        assertTrue(store.consume(3L).isEmpty());
    }

    @Test
    void removeDirectCannotEatIntoReservations() throws Exception {
        world.stock("P1", Resource.FOOD, 100);
        store.reserve(1L, "P1", Resource.FOOD, 70);

        assertFalse(store.removeDirect("P1", Resource.FOOD, 40));
        assertTrue(store.removeDirect("P1", Resource.FOOD, 30));
        assertEquals(70.0, world.amount("P1", Resource.FOOD), 1e-9);
        assertEquals(0.0, store.available("P1", Resource.FOOD), 1e-9);
    }

    @Test
    void addIsClampedToCapacity() throws Exception {
        world.stock("P1", Resource.OIL, 90, 100);

        assertEquals(10.0, store.add("P1", Resource.OIL, 25), 1e-9);
        assertEquals(100.0, world.amount("P1", Resource.OIL), 1e-9);
    }

    @Test
    void zeroCapacityIsAHardCeiling() throws Exception {
        world.stock("P1", Resource.OIL, 0, 0);

        assertEquals(0.0, store.add("P1", Resource.OIL, 5), 1e-9);
        assertEquals(0.0, world.amount("P1", Resource.OIL), 1e-9);
    }

    @Test
    void addCreatesMissingRowWithDefaultCapacity() throws Exception {
        assertEquals(12.0, store.add("P1", Resource.FUEL, 12), 1e-9);

        StockpileEntry e = store.entry("P1", Resource.FUEL).orElseThrow();
        assertEquals(store.defaultCapacity(), e.capacity(), 1e-9);
        assertFalse(e.uncapped());
        assertEquals(1, store.stockpile("P1").size());
    }

    @Test
    void setEntryRefusesToDropBelowReserved() throws Exception {
        world.stock("P1", Resource.COAL, 100);
        store.reserve(1L, "P1", Resource.COAL, 60);

        assertThrows(IllegalStateException.class, () -> store.setEntry("P1", Resource.COAL, 50, 100, false));
        assertEquals(100.0, world.amount("P1", Resource.COAL), 1e-9);
    }

    @Test
    void setEntryRefusesCapacityBelowReserved() throws Exception {
        world.stock("P1", Resource.COAL, 100);
        store.reserve(1L, "P1", Resource.COAL, 60);

        assertThrows(IllegalStateException.class, () -> store.setEntry("P1", Resource.COAL, 100, 50, false));
        assertEquals(100.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(60.0, store.reserved("P1", Resource.COAL), 1e-9);

        store.setEntry("P1", Resource.COAL, 100, 60, false);
        assertEquals(60.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(0.0, store.available("P1", Resource.COAL), 1e-9);
    }

    @Test
    void reserveRejectsNonPositiveAmounts() {
        assertThrows(IllegalArgumentException.class, () -> store.reserve(1L, "P1", Resource.COAL, 0));
    }

    @Test
    void concurrentReservationsNeverOverCommit() throws Exception {
        world.stock("P1", Resource.COAL, 100);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<Boolean> first = pool.submit(() -> {
                go.await();
                return store.reserve(1L, "P1", Resource.COAL, 60);
            });
            Future<Boolean> second = pool.submit(() -> {
                go.await();
                return store.reserve(2L, "P1", Resource.COAL, 60);
            });
            go.countDown();

            int wins = (first.get(30, TimeUnit.SECONDS) ? 1 : 0) + (second.get(30, TimeUnit.SECONDS) ? 1 : 0);
            assertEquals(1, wins);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(60.0, store.reserved("P1", Resource.COAL), 1e-9);
        assertEquals(40.0, store.available("P1", Resource.COAL), 1e-9);
    }
}
