package com.statecraft.core.domain.modifiers;

import com.statecraft.core.TestWorld;
import com.statecraft.core.domain.result.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModifierAggregatorTest {

    @TempDir
    Path tmp;

    private TestWorld world;
    private ModifierAggregator modifiers;

    @BeforeEach
    void setUp() throws Exception {
        world = new TestWorld(tmp);
        world.nation("A", 0).province("P1", "S1", "A", 1000, 1.0);
        modifiers = world.engine.getModifiers();
    }

    @AfterEach
    void tearDown() {
        world.close();
    }

    @Test
    void additiveInsideMultiplicativeOutside() {
        modifiers.addModifier("global", null, "production", "add", 0.10, "boom", 0, null).value();
        modifiers.addModifier("nation", "A", "production", "mul", 0.9, "strike", 0, null).value();

        FinalModifiers fm = modifiers.computeFinal("A", "S1", 0).value();

        assertEquals(0.99, fm.production().finalValue(), 1e-9);
        assertEquals(0.10, fm.production().addSum(), 1e-9);
        assertEquals(0.9, fm.production().mulProduct(), 1e-9);
        assertEquals(2, fm.production().modifierIds().size());
        assertEquals(1.0, fm.tax().finalValue(), 1e-9);
        assertEquals(1.0, fm.population().finalValue(), 1e-9);
    }

    @Test
    void otherNationsAndStatesAreIgnored() {
        modifiers.addModifier("nation", "B", "tax", "add", 0.5, null, null, null);
        modifiers.addModifier("state", "S2", "tax", "add", 0.5, null, null, null);
        modifiers.addModifier("state", "S1", "tax", "add", 0.25, null, null, null);
        modifiers.addModifier("province", "P1", "tax", "add", 3.0, null, null, null);

        assertEquals(1.25, modifiers.computeFinal("A", "S1", null).value().tax().finalValue(), 1e-9);
    }

    @Test
    void allEffectCountsEverywhere() {
        modifiers.addModifier("global", null, "all", "mul", 2.0, null, null, null);

        FinalModifiers fm = modifiers.computeFinal("A", null, null).value();
        assertEquals(2.0, fm.production().finalValue(), 1e-9);
        assertEquals(2.0, fm.population().finalValue(), 1e-9);
        assertEquals(2.0, fm.tax().finalValue(), 1e-9);
    }

    @Test
    void finalValueNeverNegative() {
        modifiers.addModifier("global", null, "tax", "add", -3.0, null, null, null);

        assertEquals(0.0, modifiers.computeFinal("A", "S1", null).value().tax().finalValue(), 1e-9);
    }

    @Test
    void expiredRowsAreSkippedOnlyAfterTheirExpiryTurn() {
        modifiers.addModifier("global", null, "production", "add", 0.5, "festival", 1, 3);

        assertEquals(1.5, modifiers.computeFinal("A", "S1", 3).value().production().finalValue(), 1e-9);
        assertEquals(1.0, modifiers.computeFinal("A", "S1", 4).value().production().finalValue(), 1e-9);
    }

    @Test
    void turnAdvanceDeactivatesExpiredRows() throws Exception {
        long id = modifiers.addModifier("global", null, "production", "add", 0.5, null, 0, 0).value();
        modifiers.addModifier("global", null, "production", "add", 0.1, null, 0, null).value();

        assertEquals(1, world.engine.advanceTurn().value().modifiersExpired());

        List<Modifier> active = modifiers.listModifiers("global", null, true).value();
        assertEquals(1, active.size());
        assertNotEquals(id, active.get(0).id());
        assertEquals(2, modifiers.listModifiers(null, null, false).value().size());
    }

    @Test
    void validationAndRemoval() {
        assertEquals(ErrorKind.INVALID_ARGUMENT, modifiers.addModifier("galaxy", null, "tax", "add", 1, null, null, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, modifiers.addModifier("nation", " ", "tax", "add", 1, null, null, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, modifiers.addModifier("global", null, "luck", "add", 1, null, null, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, modifiers.addModifier("global", null, "tax", "pow", 1, null, null, null).kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT, modifiers.addModifier("global", null, "tax", "add", Double.NaN, null, null, null).kind());

        long id = modifiers.addModifier("global", null, "tax", "add", 1, null, null, null).value();
        assertTrue(modifiers.removeModifier(id).isOk());
        assertEquals(ErrorKind.NOT_FOUND, modifiers.removeModifier(id).kind());
    }

    @Test
    void pureFoldSkipsInactiveAndProvinceRows() {
        List<Modifier> rows = List.of(
                new Modifier(1, ModifierScope.GLOBAL, null, ModifierEffect.TAX, ModifierKind.MUL, 0.5, null, null, null, true),
                new Modifier(2, ModifierScope.GLOBAL, null, ModifierEffect.TAX, ModifierKind.MUL, 0.1, null, null, null, false),
                new Modifier(3, ModifierScope.PROVINCE, "P1", ModifierEffect.TAX, ModifierKind.ADD, 9, null, null, null, true));

        EffectAggregate tax = ModifierAggregator.aggregateEffect(rows, ModifierEffect.TAX, null);

        assertEquals(0.5, tax.finalValue(), 1e-9);
        assertEquals(List.of(1L), tax.modifierIds());
        assertEquals(EffectAggregate.neutral(ModifierEffect.TAX).finalValue(),
                ModifierAggregator.aggregateEffect(List.of(), ModifierEffect.TAX, null).finalValue(), 1e-9);
    }
}
