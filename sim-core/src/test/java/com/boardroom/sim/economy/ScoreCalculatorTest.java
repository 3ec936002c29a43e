package com.boardroom.sim.economy;

import com.boardroom.sim.config.DifficultyTier;
import com.boardroom.sim.economy.ScoreCalculator.FinalScoreBreakdown;
import com.boardroom.sim.economy.ScoreCalculator.QuarterlyBonus;
import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.model.TenureState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreCalculatorTest {

    private static TenureState fresh() {
        return TenureState.initial(DifficultyTier.NADELLA.settings());
    }

    @Nested
    @DisplayName("quarterlyBonus()")
    class QuarterlyBonusTests {

        @Test
        @DisplayName("a perfect quarter earns every line item: $16M")
        void perfectQuarter() {
            QuarterlyBonus bonus = ScoreCalculator.quarterlyBonus(fresh(), OrgState.initial(), true, 10);
            assertEquals(16, bonus.amount());
            assertEquals(6, bonus.reasons().size());
        }

        @Test
        @DisplayName("penalties can never drive the bonus negative")
        void neverNegative() {
            TenureState t = fresh().withFavorabilityChange(-25).withEvilScoreChange(15);
            OrgState org = new OrgState(10, 10, 60, 60, 60);
            QuarterlyBonus bonus = ScoreCalculator.quarterlyBonus(t, org, false, 0);
            assertEquals(0, bonus.amount());
            assertTrue(bonus.reasons().stream().anyMatch(r -> r.contains("DELIVERY, MORALE")));
        }

        @Test
        @DisplayName("new evil this quarter forfeits the ethics line")
        void newEvil() {
            TenureState t = fresh().withEvilScoreChange(2);
            assertEquals(14, ScoreCalculator.quarterlyBonus(t, OrgState.initial(), true, 10).amount());
        }
    }

    @Nested
    @DisplayName("Final score")
    class FinalScoreTests {

        private TenureState veteran() {
            return fresh()
                .withBonusAwarded(30)
                .withCardsPlayedRecorded(4)
                .withQuarterComplete()
                .withQuarterComplete()
                .withEvilScoreChange(1);
        }

        @Test
        @DisplayName("retired: (bonus + parachute + 5/PC + 1/card) × 2")
        void retired() {
            FinalScoreBreakdown b = ScoreCalculator.breakdown(veteran().withRetirement(), ResourceState.initial());
            assertEquals(30, b.accumulatedBonus());
            assertEquals(14, b.goldenParachute());
            assertEquals(50, b.pcConversion());
            assertEquals(4, b.projectsBonus());
            assertEquals(98, b.subtotal());
            assertEquals(196, b.finalScore());
        }

        @Test
        @DisplayName("ousted: same subtotal × 0.5")
        void ousted() {
            assertEquals(49, ScoreCalculator.finalScore(veteran().withOusted(), ResourceState.initial()));
        }
    }
}
