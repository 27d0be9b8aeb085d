package com.statecraft.core.synchronization;

import com.statecraft.core.TestWorld;
import com.statecraft.core.database.dao.ProvinceBuildingDAO;
import com.statecraft.core.database.dao.StateBuildDAO;
import com.statecraft.core.domain.buildings.BuildStatus;
import com.statecraft.core.domain.buildings.BuildingTemplate;
import com.statecraft.core.domain.buildings.InstalledBuilding;
import com.statecraft.core.domain.buildings.PendingBuild;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.world.Nation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TurnProcessorTest {

    @TempDir
    Path tmp;

    private TestWorld world;
    private TurnProcessor turns;

    @BeforeEach
    void setUp() throws Exception {
        world = new TestWorld(tmp);
        world.nation("A", 1000)
                .nation("B", 1000)
                .province("P1", "S1", "A", 1000, 4.0)
                .building(TestWorld.template("depot", ResourceMap.of(Resource.COAL, 50), 0, 1));
        turns = world.engine.getTurns();
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    void buildWithoutHostFailsButTurnAdvances() throws Exception {
        world.stock("P1", Resource.COAL, 100);
        PendingBuild b = world.engine.startBuild("A", "S1", "depot", 1).value();
        assertEquals(1, b.completeTurn());
        world.controller("P1", "B");

        TurnReport report = turns.advanceTurn().value();

        assertEquals(1, report.turn());
        assertEquals(0, report.buildsCompleted());
        assertEquals(1, report.buildsFailed());
        assertEquals(1, turns.currentTurn().value());
        assertEquals(50.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(50.0, world.available("P1", Resource.COAL), 1e-9);

        Optional<PendingBuild> row = world.db.read(conn -> new StateBuildDAO().find(conn, b.id()));
        assertEquals(BuildStatus.FAILED, row.orElseThrow().status());
        assertTrue(world.db.read(conn -> new ProvinceBuildingDAO().findAll(conn)).isEmpty());
    }

    @Test
    void equalStrengthHostIsLowestProvinceId() throws Exception {
        world.province("R2", "S2", "A", 500, 6.0)
                .province("R1", "S2", "A", 500, 6.0)
                .stock("R2", Resource.COAL, 100)
                .stock("R1", Resource.COAL, 100);
        world.engine.startBuild("A", "S2", "depot", 1).value();
        assertEquals(50.0, world.available("R1", Resource.COAL), 1e-9);
        assertEquals(100.0, world.available("R2", Resource.COAL), 1e-9);

        assertEquals(1, turns.advanceTurn().value().buildsCompleted());

        assertTrue(world.db.read(conn -> new ProvinceBuildingDAO().find(conn, "R1", "depot", 1)).isPresent());
        assertTrue(world.db.read(conn -> new ProvinceBuildingDAO().find(conn, "R2", "depot", 1)).isEmpty());
    }

    @Test
    void dueBuildIsInstalledOnceInStrongestProvince() throws Exception {
        world.province("P2", "S1", "A", 500, 9.0).stock("P1", Resource.COAL, 100);
        PendingBuild b = world.engine.startBuild("A", "S1", "depot", 2).value();
        assertEquals(0.0, world.available("P1", Resource.COAL), 1e-9);

        assertEquals(1, turns.advanceTurn().value().buildsCompleted());
        assertEquals(0, turns.advanceTurn().value().buildsCompleted());

        assertEquals(0.0, world.amount("P1", Resource.COAL), 1e-9);
        Optional<InstalledBuilding> hosted = world.db.read(conn -> new ProvinceBuildingDAO().find(conn, "P2", "depot", 2));
        assertEquals(1, hosted.orElseThrow().count());
        assertEquals(BuildStatus.COMPLETED,
                world.db.read(conn -> new StateBuildDAO().find(conn, b.id())).orElseThrow().status());
        assertEquals(2, turns.currentTurn().value());
    }

    @Test
    void productionScalesWithCountAndTier() throws Exception {
        world.building(new BuildingTemplate("mill", "Steel Mill", ResourceMap.empty(), 0, 1,
                        ResourceMap.of(Resource.COAL, 2), ResourceMap.of(Resource.STEEL, 1), 0.0, 0))
                .stock("P1", Resource.COAL, 10)
                .install("P1", "mill", 2)
                .install("P1", "mill", 2);

        TurnReport report = turns.advanceTurn().value();

        assertEquals(1, report.productionRows());
        assertEquals(2.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(4.0, world.amount("P1", Resource.STEEL), 1e-9);
    }

    @Test
    void productionDoesNotTouchReservedStock() throws Exception {
        world.building(new BuildingTemplate("mill", "Steel Mill", ResourceMap.empty(), 0, 1,
                        ResourceMap.of(Resource.COAL, 30), ResourceMap.of(Resource.STEEL, 1), 0.0, 0))
                .stock("P1", Resource.COAL, 60)
                .building(TestWorld.template("keep", ResourceMap.of(Resource.COAL, 50), 0, 10))
                .install("P1", "mill", 1);
        world.engine.startBuild("A", "S1", "keep", 1).value();

        turns.advanceTurn().value();

        assertEquals(50.0, world.amount("P1", Resource.COAL), 1e-9);
        assertEquals(0.0, world.available("P1", Resource.COAL), 1e-9);
        assertEquals(50.0, world.engine.getStockpiles().reserved("P1", Resource.COAL), 1e-9);
    }

    @Test
    void outputIsClampedToCapacity() throws Exception {
        world.building(new BuildingTemplate("well", "Oil Well", ResourceMap.empty(), 0, 1,
                        ResourceMap.empty(), ResourceMap.of(Resource.OIL, 50), 0.0, 0))
                .stock("P1", Resource.OIL, 0, 20)
                .install("P1", "well", 1);

        turns.advanceTurn().value();

        assertEquals(20.0, world.amount("P1", Resource.OIL), 1e-9);
    }

    @Test
    void unpaidMaintenanceBecomesDebt() throws Exception {
        world.nation(new Nation("A", "A", 20.0, 5.0, 0.0, 0, null, false))
                .building(new BuildingTemplate("fort", "Fort", ResourceMap.empty(), 0, 1,
                        ResourceMap.empty(), ResourceMap.empty(), 30.0, 0))
                .install("P1", "fort", 1);

        TurnReport report = turns.advanceTurn().value();

        assertEquals(1, report.maintenanceRows());
        Nation a = world.nationRow("A");
        assertEquals(0.0, a.cash(), 1e-9);
        assertEquals(15.0, a.debt(), 1e-9);
    }

    @Test
    void coveredMaintenanceIsPaidFromCash() throws Exception {
        world.building(new BuildingTemplate("fort", "Fort", ResourceMap.empty(), 0, 1,
                        ResourceMap.empty(), ResourceMap.empty(), 30.0, 0))
                .install("P1", "fort", 1)
                .install("P1", "fort", 1);

        turns.advanceTurn().value();

        assertEquals(940.0, world.cash("A"), 1e-9);
        assertEquals(0.0, world.nationRow("A").debt(), 1e-9);
    }

    @Test
    void unknownTemplateRowIsSkippedNotFatal() throws Exception {
        world.install("P1", "ghost", 1);

        TurnReport report = turns.advanceTurn().value();

        assertEquals(1, report.rowsSkipped());
        assertEquals(1, report.turn());
    }
}
