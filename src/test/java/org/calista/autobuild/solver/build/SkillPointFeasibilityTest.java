package org.calista.autobuild.solver.build;

import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.SkillStat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SkillPointFeasibilityTest {

    private static Item helmet(int id, double strReq, double strBonus) {
        return Item.builder(id).type("helmet").stat("strReq", strReq).stat("str", strBonus).build();
    }

    @ParameterizedTest
    @CsvSource({"1,0", "2,2", "50,98", "100,198", "101,200", "106,200", "200,200", "0,0"})
    void availablePointsPerLevel(int level, int expected) {
        assertEquals(expected, SkillPointFeasibility.availablePoints(level));
    }

    @Test
    void noItemsIsTriviallyFeasible() {
        SkillPointFeasibility.Result r = SkillPointFeasibility.evaluate(List.of(), 1, TomeMode.NO_TOMES);
        assertTrue(r.feasible);
        assertEquals(0.0, r.assignedTotal);
    }

    @Test
    void bonusItemWornFirstLowersAssignedPoints() {
        Item booster = helmet(1, 0, 30);
        Item heavy = Item.builder(2).type("boots").stat("strReq", 80).build();

        SkillPointFeasibility.Result r = SkillPointFeasibility.evaluate(List.of(heavy, booster), 106, TomeMode.NO_TOMES);

        assertTrue(r.feasible);
        assertEquals(50.0, r.assignedTotal, 1e-9);
        assertEquals(50.0, r.assigned(SkillStat.STR), 1e-9);
        assertEquals(0.0, r.assigned(SkillStat.DEX), 1e-9);
    }

    @Test
    void guildTomeAddsOneBasePointPerStat() {
        Item booster = helmet(1, 0, 30);
        Item heavy = Item.builder(2).type("boots").stat("strReq", 80).build();

        SkillPointFeasibility.Result r = SkillPointFeasibility.evaluate(List.of(booster, heavy), 106, TomeMode.GUILD_RAINBOW);

        assertTrue(r.feasible);
        assertEquals(49.0, r.assignedTotal, 1e-9);
    }

    @Test
    void requirementAboveStatCapIsInfeasible() {
        SkillPointFeasibility.Result r = SkillPointFeasibility.evaluate(List.of(helmet(1, 101, 0)), 106, TomeMode.NO_TOMES);

        assertFalse(r.feasible);
        assertEquals(Double.POSITIVE_INFINITY, r.assignedTotal);
        assertTrue(Double.isNaN(r.assigned(SkillStat.STR)));
    }

    @Test
    void levelOneHasNoPointsUnlessTomesHelp() {
        List<Item> twoPoints = List.of(helmet(1, 2, 0));
        List<Item> onePoint = List.of(helmet(1, 1, 0));

        assertFalse(SkillPointFeasibility.evaluate(twoPoints, 1, TomeMode.NO_TOMES).feasible);
        assertTrue(SkillPointFeasibility.evaluate(twoPoints, 1, TomeMode.FLEXIBLE_2).feasible);
        assertFalse(SkillPointFeasibility.evaluate(twoPoints, 1, TomeMode.GUILD_RAINBOW).feasible);
        assertTrue(SkillPointFeasibility.evaluate(onePoint, 1, TomeMode.GUILD_RAINBOW).feasible);
    }

    @Test
    void totalAcrossStatsIsBoundedByLevelPoints() {
        Item a = Item.builder(1).type("helmet").stat("strReq", 10).stat("dexReq", 10).build();

        assertFalse(SkillPointFeasibility.evaluate(List.of(a), 10, TomeMode.NO_TOMES).feasible);
        assertTrue(SkillPointFeasibility.evaluate(List.of(a), 11, TomeMode.NO_TOMES).feasible);
    }

    @Test
    void tomeModeParsingFallsBackToDefault() {
        assertEquals(TomeMode.GUILD_RAINBOW, TomeMode.parseOrDefault(" guild_rainbow ", TomeMode.NO_TOMES));
        assertEquals(TomeMode.NO_TOMES, TomeMode.parseOrDefault("bogus", TomeMode.NO_TOMES));
        assertEquals(TomeMode.FLEXIBLE_2, TomeMode.parseOrDefault(null, TomeMode.FLEXIBLE_2));
    }
}
