package com.statecraft.core.infrastructure;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path tmp;

    @Test
    void bundledDefaults() {
        EngineConfig cfg = EngineConfig.defaults();

        assertEquals(100000.0, cfg.defaultStockpileCapacity(), 1e-9);
        assertEquals(3, cfg.maxOpenOffers());
        assertEquals(0.40, cfg.recruitManpowerRatio(), 1e-9);
        assertEquals(0.00008, cfg.tradeBaseRatePerKgKm(), 1e-12);
    }

    @Test
    void externalFileOverridesAndReloads() throws Exception {
        Path file = tmp.resolve("engine.properties");
        Files.writeString(file, "trade.max-open-offers=5\nstockpile.default-capacity=250\n");

        EngineConfig cfg = EngineConfig.load(file);
        assertEquals(5, cfg.maxOpenOffers());
        assertEquals(250.0, cfg.defaultStockpileCapacity(), 1e-9);

        Files.writeString(file, "trade.max-open-offers=7\n");
        cfg.reload();
        assertEquals(7, cfg.maxOpenOffers());
        assertEquals(100000.0, cfg.defaultStockpileCapacity(), 1e-9);
    }

    @Test
    void explicitValuesSurviveReload() {
        EngineConfig cfg = EngineConfig.defaults().set(EngineConfig.RECRUIT_MANPOWER_RATIO, "0.25");
        cfg.reload();

        assertEquals(0.25, cfg.recruitManpowerRatio(), 1e-9);
    }

    @Test
    void malformedNumbersFallBackToDefaults() {
        EngineConfig cfg = EngineConfig.defaults()
                .set(EngineConfig.TRADE_MAX_OPEN_OFFERS, "three")
                .set(EngineConfig.STOCKPILE_DEFAULT_CAPACITY, "NaN");

        assertEquals(3, cfg.maxOpenOffers());
        assertEquals(100000.0, cfg.defaultStockpileCapacity(), 1e-9);
    }

    @Test
    void missingExternalFileIsNotFatal() {
        EngineConfig cfg = EngineConfig.load(tmp.resolve("nope.properties"));

        assertEquals(3, cfg.maxOpenOffers());
    }
}
