package com.statecraft.core.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Gestore della configurazione del motore economico.
 * Reads the bundled 'statecraft.properties' first, then an optional external file on top of it.
 * Each engine owns its own instance; nothing here is static.
 */
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String CLASSPATH_RESOURCE = "statecraft.properties";

    public static final String DB_URL = "db.url";
    public static final String DB_POOL_MAX_SIZE = "db.pool.max-size";
    public static final String DB_BUSY_TIMEOUT_MS = "db.busy-timeout-ms";
    public static final String STOCKPILE_DEFAULT_CAPACITY = "stockpile.default-capacity";
    public static final String TRADE_BASE_RATE = "trade.base-rate-per-kg-km";
    public static final String TRADE_MAX_OPEN_OFFERS = "trade.max-open-offers";
    public static final String RECRUIT_MANPOWER_RATIO = "recruit.manpower-ratio";

    private final Path externalFile;
    private final Properties overrides = new Properties();
    private volatile Properties props = new Properties();

    public EngineConfig(Path externalFile) {
        this.externalFile = externalFile;
    }

    public static EngineConfig load(Path externalFile) {
        EngineConfig cfg = new EngineConfig(externalFile);
        cfg.reload();
        return cfg;
    }

    public static EngineConfig defaults() {
        return load(null);
    }

    /**
     * Re-reads the classpath defaults and the external file. Values set through {@link #set} survive a reload.
     */
    public synchronized void reload() {
        Properties fresh = new Properties();

        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                fresh.load(in);
            } else {
                log.warn("⚠️ {} non trovato nel classpath. Uso valori di DEFAULT.", CLASSPATH_RESOURCE);
            }
        } catch (IOException e) {
            log.warn("Could not read bundled {}", CLASSPATH_RESOURCE, e);
        }

        if (externalFile != null) {
            if (Files.isRegularFile(externalFile)) {
                try (InputStream in = Files.newInputStream(externalFile)) {
                    fresh.load(in);
                    log.info("⚙️ Configurazione caricata da {}", externalFile);
                } catch (IOException e) {
                    log.warn("Could not read {}, keeping bundled values", externalFile, e);
                }
            } else {
                log.info("{} not found, using bundled configuration", externalFile);
            }
        }

        fresh.putAll(overrides);
        this.props = fresh;
    }

    public synchronized EngineConfig set(String key, String value) {
        overrides.setProperty(key, value);
        props.setProperty(key, value);
        return this;
    }

    public String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        return (val == null || val.isBlank()) ? defaultValue : val.trim();
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.error("❌ Errore config per {}: {} non è un numero.", key, val);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            double d = Double.parseDouble(val.trim());
            if (Double.isNaN(d) || Double.isInfinite(d)) return defaultValue;
            return d;
        } catch (NumberFormatException e) {
            log.error("❌ Errore config per {}: {} non è un numero.", key, val);
            return defaultValue;
        }
    }

    // --- typed accessors ---

    public String jdbcUrl() {
        return getString(DB_URL, "jdbc:sqlite:statecraft.db");
    }

    public int poolMaxSize() {
        return Math.max(1, getInt(DB_POOL_MAX_SIZE, 4));
    }

    public int busyTimeoutMs() {
        return Math.max(0, getInt(DB_BUSY_TIMEOUT_MS, 5000));
    }

    public double defaultStockpileCapacity() {
        return Math.max(0.0, getDouble(STOCKPILE_DEFAULT_CAPACITY, 100000.0));
    }

    public double tradeBaseRatePerKgKm() {
        return Math.max(0.0, getDouble(TRADE_BASE_RATE, 0.00008));
    }

    public int maxOpenOffers() {
        return Math.max(1, getInt(TRADE_MAX_OPEN_OFFERS, 3));
    }

    public double recruitManpowerRatio() {
        return Math.max(0.0, getDouble(RECRUIT_MANPOWER_RATIO, 0.40));
    }
}
