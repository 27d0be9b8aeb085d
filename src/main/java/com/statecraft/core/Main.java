package com.statecraft.core;

import com.statecraft.core.database.DatabaseManager;
import com.statecraft.core.database.SchemaMigrator;
import com.statecraft.core.domain.result.Result;
import com.statecraft.core.infrastructure.EngineConfig;
import com.statecraft.core.managers.EconomyEngine;
import com.statecraft.core.synchronization.TurnReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Bootstrap: loads the configuration, migrates the schema and optionally advances one turn.
 *
 * <pre>
 *   Main [config.properties] [advance-turn]
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("🏛️ Statecraft Core Starting...");

        Path external = null;
        boolean advance = false;
        for (String a : args) {
            if ("advance-turn".equalsIgnoreCase(a)) advance = true;
            else external = Path.of(a);
        }

        EngineConfig config = EngineConfig.load(external);

        try (DatabaseManager db = new DatabaseManager(config)) {
            int version = new SchemaMigrator(db).migrate();
            log.info("✅ Schema at v{}", version);

            EconomyEngine engine = new EconomyEngine(db, config);
            log.info("Current turn: {}", engine.currentTurn().orElse(-1));

            if (advance) {
                Result<TurnReport> r = engine.advanceTurn();
                if (r.isOk()) {
                    log.info("⏭️ Advanced to turn {}", r.value().turn());
                } else {
                    log.error("🚨 Turn advance failed: {}", r.error().message());
                    System.exit(1);
                }
            }
        }
    }
}
