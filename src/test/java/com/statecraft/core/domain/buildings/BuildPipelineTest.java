package com.statecraft.core.domain.buildings;

import com.statecraft.core.TestWorld;
import com.statecraft.core.domain.ledger.Resource;
import com.statecraft.core.domain.ledger.ResourceMap;
import com.statecraft.core.domain.result.ErrorKind;
import com.statecraft.core.domain.result.Result;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuildPipelineTest {

    @TempDir
    Path tmp;

    private TestWorld world;
    private BuildPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        world = new TestWorld(tmp);
        world.nation("A", 500)
                .nation("B", 500)
                .province("P1", "S1", "A", 1000, 9.0)
                .province("P2", "S1", "A", 1000, 3.0)
                .province("Q1", "S2", "B", 1000, 5.0)
                .building(TestWorld.template("foundry", ResourceMap.of(Resource.IRON, 200), 100, 2));
        pipeline = world.engine.getBuilds();
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    void shortfallAcrossProvincesRollsBackEverything() throws Exception {
        world.stock("P1", Resource.IRON, 120).stock("P2", Resource.IRON, 50);

        Result<PendingBuild> r = pipeline.start("A", "S1", "foundry", 1);

        assertFalse(r.isOk());
        assertEquals(ErrorKind.INSUFFICIENT_RESOURCE, r.kind());
        assertEquals(Resource.IRON, r.error().resource());
        assertEquals(30.0, r.error().shortfall(), 1e-9);

        assertEquals(120.0, world.available("P1", Resource.IRON), 1e-9);
        assertEquals(50.0, world.available("P2", Resource.IRON), 1e-9);
        assertEquals(500.0, world.cash("A"), 1e-9);
        assertTrue(pipeline.buildQueue("A").value().isEmpty());
    }

    @Test
    void startReservesStrongestProvinceFirst() throws Exception {
        world.stock("P1", Resource.IRON, 150).stock("P2", Resource.IRON, 100);

        PendingBuild b = pipeline.start("A", "S1", "foundry", 1).value();

        assertEquals(BuildStatus.PENDING, b.status());
        assertEquals(2, b.completeTurn());
        assertEquals(100.0, b.cashPaid(), 1e-9);
        assertEquals(400.0, world.cash("A"), 1e-9);
        assertEquals(0.0, world.available("P1", Resource.IRON), 1e-9);
        assertEquals(50.0, world.available("P2", Resource.IRON), 1e-9);
        assertEquals(250.0, world.amount("P1", Resource.IRON) + world.amount("P2", Resource.IRON), 1e-9);

        List<PendingBuild> queue = pipeline.buildQueue("A").value();
        assertEquals(1, queue.size());
        assertEquals(2, queue.get(0).reserved().size());
    }

    @Test
    void equalStrengthProvincesAreServedByProvinceId() throws Exception {
        world.province("T2", "S3", "A", 1000, 5.0)
                .province("T1", "S3", "A", 1000, 5.0)
                .stock("T2", Resource.IRON, 150)
                .stock("T1", Resource.IRON, 150);

        pipeline.start("A", "S3", "foundry", 1).value();

        assertEquals(0.0, world.available("T1", Resource.IRON), 1e-9);
        assertEquals(100.0, world.available("T2", Resource.IRON), 1e-9);
    }

    @Test
    void tierScalesCost() throws Exception {
        world.stock("P1", Resource.IRON, 1000);

        PendingBuild b = pipeline.start("A", "S1", "foundry", 3).value();

        assertEquals(300.0, b.cashPaid(), 1e-9);
        assertEquals(400.0, world.available("P1", Resource.IRON), 1e-9);
    }

    @Test
    void cancelReleasesReservationsAndRefundsCash() throws Exception {
        world.stock("P1", Resource.IRON, 300);
        PendingBuild b = pipeline.start("A", "S1", "foundry", 1).value();

        Result<PendingBuild> cancelled = pipeline.cancel("A", b.id());

        assertTrue(cancelled.isOk());
        assertEquals(BuildStatus.CANCELLED, cancelled.value().status());
        assertEquals(500.0, world.cash("A"), 1e-9);
        assertEquals(300.0, world.available("P1", Resource.IRON), 1e-9);
        assertTrue(pipeline.buildQueue("A").value().isEmpty());

        assertEquals(ErrorKind.NOT_FOUND, pipeline.cancel("A", b.id()).kind());
    }

    @Test
    void cancelByAnotherNationIsRejected() throws Exception {
        world.stock("P1", Resource.IRON, 300);
        PendingBuild b = pipeline.start("A", "S1", "foundry", 1).value();

        assertEquals(ErrorKind.UNAUTHORIZED, pipeline.cancel("B", b.id()).kind());
        assertEquals(1, pipeline.buildQueue("A").value().size());
    }

    @Test
    void cancelAfterCompletionIsInvalidState() throws Exception {
        world.stock("P1", Resource.IRON, 300);
        PendingBuild b = pipeline.start("A", "S1", "foundry", 1).value();
        world.engine.advanceTurn();
        world.engine.advanceTurn();

        Result<PendingBuild> r = pipeline.cancel("A", b.id());
        assertEquals(ErrorKind.INVALID_STATE, r.kind());
    }

    @Test
    void insufficientCashLeavesNoRow() throws Exception {
        world.nation("A", 10).stock("P1", Resource.IRON, 300);

        assertEquals(ErrorKind.INSUFFICIENT_CASH, pipeline.start("A", "S1", "foundry", 1).kind());
        assertTrue(pipeline.buildQueue("A").value().isEmpty());
        assertEquals(300.0, world.available("P1", Resource.IRON), 1e-9);
    }

    @Test
    void stateWithoutOwnedProvinceIsUnauthorized() {
        assertEquals(ErrorKind.UNAUTHORIZED, pipeline.start("A", "S2", "foundry", 1).kind());
    }

    @Test
    void unknownTemplateAndBadTier() {
        assertEquals(ErrorKind.NOT_FOUND, pipeline.start("A", "S1", "missing", 1).kind());
        assertEquals(ErrorKind.NOT_FOUND, pipeline.start("Z", "S1", "foundry", 1).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, pipeline.start("A", "S1", "foundry", 0).kind());
    }

    @Test
    void demolishRemovesOneInstalledBuilding() throws Exception {
        world.install("P1", "foundry", 1).install("P1", "foundry", 1);

        InstalledBuilding left = pipeline.demolish("A", "P1", "foundry", 1).value();
        assertEquals(1, left.count());

        assertEquals(0, pipeline.demolish("A", "P1", "foundry", 1).value().count());
        assertEquals(ErrorKind.NOT_FOUND, pipeline.demolish("A", "P1", "foundry", 1).kind());
        assertEquals(ErrorKind.UNAUTHORIZED, pipeline.demolish("B", "P1", "foundry", 1).kind());
    }
}
