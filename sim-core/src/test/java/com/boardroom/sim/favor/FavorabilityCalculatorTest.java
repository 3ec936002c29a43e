package com.boardroom.sim.favor;

import com.boardroom.sim.config.DifficultySettings;
import com.boardroom.sim.config.DifficultyTier;
import com.boardroom.sim.favor.FavorabilityCalculator.FavorAdjustment;
import com.boardroom.sim.model.OrgState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of the favorability delta and its adjustments.
 */
class FavorabilityCalculatorTest {

    private static final DifficultySettings NADELLA = DifficultyTier.NADELLA.settings();

    @Nested
    @DisplayName("calculate() — success paths")
    class SuccessTests {

        @Test
        @DisplayName("full success in the grace period earns the base reward of 8")
        void fullSuccess() {
            assertEquals(8, FavorabilityCalculator.calculate(10, 20, true, 1, 0, 0, 0, NADELLA));
        }

        @Test
        @DisplayName("partial success (flat profit) earns half")
        void partialSuccess() {
            assertEquals(4, FavorabilityCalculator.calculate(20, 20, true, 1, 0, 0, 0, NADELLA));
        }

        @Test
        @DisplayName("evil score 20+ costs 3 on success")
        void evilOnSuccess() {
            assertEquals(5, FavorabilityCalculator.calculate(10, 20, true, 1, 20, 0, 0, NADELLA));
        }

        @Test
        @DisplayName("weak-project streak both penalizes and caps the gain")
        void streakCap() {
            assertEquals(6, FavorabilityCalculator.calculate(10, 20, true, 1, 0, 1, 0, NADELLA));
            assertEquals(2, FavorabilityCalculator.calculate(10, 20, true, 1, 0, 2, 0, NADELLA));
            assertEquals(0, FavorabilityCalculator.calculate(10, 20, true, 1, 0, 3, 0, NADELLA));
        }

        @Test
        @DisplayName("difficulty bonus shifts the reward")
        void difficultyBonus() {
            assertEquals(9, FavorabilityCalculator.calculate(10, 20, true, 1, 0, 0, 0,
                DifficultyTier.WELCH.settings()));
        }
    }

    @Nested
    @DisplayName("calculate() — failure path")
    class FailureTests {

        @Test
        @DisplayName("heavy loss with a missed directive is floored at −12 in the first year")
        void flooredLoss() {
            assertEquals(-12, FavorabilityCalculator.calculate(0, -15, false, 1, 0, 0, 0, NADELLA));
        }

        @Test
        @DisplayName("small decline with a missed directive: −1 −4 −pressure")
        void smallDecline() {
            assertEquals(-6, FavorabilityCalculator.calculate(20, 18, false, 1, 0, 0, 0, NADELLA));
        }

        @Test
        @DisplayName("decline over 10 doubles the decline penalty; scrutiny applies at evil 5+")
        void bigDeclineWithScrutiny() {
            // -6 decline, -4 directive, -2 pressure, -2 scrutiny
            assertEquals(-14, FavorabilityCalculator.calculate(40, 20, false, 2, 5, 0, 8, NADELLA));
        }

        @Test
        @DisplayName("positive profit with a missed directive still fails")
        void profitableButMissed() {
            assertEquals(-5, FavorabilityCalculator.calculate(10, 30, false, 1, 0, 0, 0, NADELLA));
        }
    }

    @Test
    @DisplayName("maxLoss widens by 2 per year after the first, down to −18")
    void maxLoss() {
        assertEquals(-12, FavorabilityCalculator.maxLoss(3));
        assertEquals(-12, FavorabilityCalculator.maxLoss(4));
        assertEquals(-14, FavorabilityCalculator.maxLoss(8));
        assertEquals(-18, FavorabilityCalculator.maxLoss(40));
    }

    @Test
    @DisplayName("hard tier loses 1 reward point at pressure 5+ after the grace period")
    void scaledReward() {
        DifficultySettings icahn = DifficultyTier.ICAHN.settings();
        assertEquals(7, FavorabilityCalculator.scaledSuccessReward(5, 2, icahn));
        assertEquals(6, FavorabilityCalculator.scaledSuccessReward(5, 4, icahn));
        assertEquals(8, FavorabilityCalculator.scaledSuccessReward(8, 10, NADELLA));
    }

    @Test
    @DisplayName("tenure decay follows the tier's settings")
    void tenureDecay() {
        assertEquals(0, FavorabilityCalculator.tenureDecay(50, DifficultyTier.WELCH.settings()));
        assertEquals(0, FavorabilityCalculator.tenureDecay(15, NADELLA));
        assertEquals(-1, FavorabilityCalculator.tenureDecay(16, NADELLA));
    }

    @Nested
    @DisplayName("Adjustments")
    class AdjustmentTests {

        @Test
        @DisplayName("two critical meters block gains and cost 5")
        void twoCritical() {
            FavorAdjustment adj = FavorabilityCalculator.lowMeterAdjustment(new OrgState(2, 4, 60, 60, 60));
            assertEquals(new FavorAdjustment(0, -5, "Multiple critical metrics: DELIVERY, MORALE"), adj);
            assertEquals(0, adj.applyTo(8));
            assertEquals(-8, adj.applyTo(-3));
        }

        @Test
        @DisplayName("one critical meter blocks gains and costs 2")
        void oneCritical() {
            FavorAdjustment adj = FavorabilityCalculator.lowMeterAdjustment(new OrgState(60, 60, 60, 60, 0));
            assertEquals(0, adj.maxPositiveGain());
            assertEquals(-2, adj.penalty());
        }

        @Test
        @DisplayName("three low meters cap gains at 2")
        void threeLow() {
            FavorAdjustment adj = FavorabilityCalculator.lowMeterAdjustment(new OrgState(10, 10, 10, 60, 60));
            assertTrue(adj.isCapped());
            assertEquals(2, adj.applyTo(8));
        }

        @Test
        @DisplayName("healthy meters → no adjustment")
        void healthy() {
            FavorAdjustment adj = FavorabilityCalculator.lowMeterAdjustment(OrgState.initial());
            assertSame(FavorAdjustment.NONE, adj);
            assertFalse(adj.isCapped());
            assertEquals(8, adj.applyTo(8));
        }

        @Test
        @DisplayName("low activity is forgiven for the first two quarters, then scales with tenure")
        void lowActivity() {
            assertSame(FavorAdjustment.NONE, FavorabilityCalculator.lowActivityAdjustment(0, 1));
            assertEquals(-10, FavorabilityCalculator.lowActivityAdjustment(0, 3).penalty());
            assertEquals(-8, FavorabilityCalculator.lowActivityAdjustment(1, 3).penalty());
            assertSame(FavorAdjustment.NONE, FavorabilityCalculator.lowActivityAdjustment(2, 3));
        }
    }
}
