package com.statecraft.core.database;

import com.statecraft.core.database.dao.GameStateDAO;
import com.statecraft.core.database.dao.ResourceDAO;
import com.statecraft.core.domain.ledger.Resource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SchemaMigratorTest {

    @TempDir
    Path tmp;

    private DatabaseManager db;

    @BeforeEach
    void setUp() {
        db = new DatabaseManager("jdbc:sqlite:" + tmp.resolve("schema.db").toAbsolutePath(), 2, 5000);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void migratesFreshDatabaseToLatest() throws Exception {
        SchemaMigrator migrator = new SchemaMigrator(db);

        assertEquals(SchemaMigrator.latestVersion(), migrator.migrate());
        assertEquals(SchemaMigrator.latestVersion(), migrator.currentVersion());
        assertEquals(0, (int) db.read(conn -> new GameStateDAO().currentTurn(conn)));
        assertEquals(Resource.STEEL.defaultWeightKg(), db.read(conn -> new ResourceDAO().weightKg(conn, Resource.STEEL)), 1e-9);
    }

    @Test
    void secondRunIsANoOp() throws Exception {
        SchemaMigrator migrator = new SchemaMigrator(db);
        migrator.migrate();

        assertEquals(SchemaMigrator.latestVersion(), migrator.migrate());
        assertEquals(Resource.values().length, (int) db.read(conn -> {
            try (var st = conn.createStatement(); var rs = st.executeQuery("SELECT COUNT(*) FROM resources")) {
                rs.next();
                return rs.getInt(1);
            }
        }));
    }

    @Test
    void failedTransactionRollsBack() throws Exception {
        new SchemaMigrator(db).migrate();

        assertThrows(IllegalStateException.class, () -> db.inTransaction(conn -> {
            new GameStateDAO().setCurrentTurn(conn, 42);
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, (int) db.read(conn -> new GameStateDAO().currentTurn(conn)));
    }
}
