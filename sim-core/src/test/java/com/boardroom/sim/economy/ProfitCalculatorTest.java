package com.boardroom.sim.economy;

import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.random.ScriptedRandomSource;
import com.boardroom.sim.random.SeededRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfitCalculatorTest {

    @Nested
    @DisplayName("baseOperations()")
    class BaseOperationsTests {

        @Test
        @DisplayName("normal quarter: base draw + meter bonuses + variance")
        void normalQuarter() {
            // bad-quarter check 50, base 100, variance 0; healthy meters add 10 + 10 + 5
            ScriptedRandomSource rng = ScriptedRandomSource.strict(50, 100, 0);
            assertEquals(125, ProfitCalculator.baseOperations(OrgState.initial(), rng, 0));
            assertEquals(3, rng.draws());
        }

        @Test
        @DisplayName("weak meters subtract the penalty")
        void weakMeters() {
            OrgState org = new OrgState(20, 60, 20, 60, 50);
            ScriptedRandomSource rng = ScriptedRandomSource.strict(50, 100, 0);
            // delivery -15, runway 0, governance -7
            assertEquals(78, ProfitCalculator.baseOperations(org, rng, 0));
        }

        @Test
        @DisplayName("bad quarter: a single draw in [-30, 21), no meter adjustment")
        void badQuarter() {
            ScriptedRandomSource rng = ScriptedRandomSource.strict(3, -12);
            assertEquals(-12, ProfitCalculator.baseOperations(OrgState.initial(), rng, 0));
            assertEquals(2, rng.draws());
        }

        @Test
        @DisplayName("organic growth scales every range")
        void growth() {
            // 50 quarters → growth 2.0: base [160, 281), bonuses 20 / 20 / 10
            ScriptedRandomSource rng = ScriptedRandomSource.strict(50, 200, 0);
            assertEquals(250, ProfitCalculator.baseOperations(OrgState.initial(), rng, 50));
        }

        @Test
        @DisplayName("Deterministic — same input always produces same output")
        void deterministic() {
            SeededRandomSource a = new SeededRandomSource(99L);
            SeededRandomSource b = new SeededRandomSource(99L);
            for (int q = 0; q < 20; q++) {
                assertEquals(ProfitCalculator.baseOperations(OrgState.initial(), a, q),
                             ProfitCalculator.baseOperations(OrgState.initial(), b, q));
            }
        }
    }

    @Nested
    @DisplayName("scaleRevenueProfit()")
    class ScalingTests {

        @Test
        @DisplayName("reference target, average delivery, first card → unscaled")
        void unscaled() {
            assertEquals(20, ProfitCalculator.scaleRevenueProfit(20, 25, 60, 0));
        }

        @Test
        @DisplayName("target scale is floored at 0.5x")
        void targetFloor() {
            assertEquals(10, ProfitCalculator.scaleRevenueProfit(20, 5, 60, 0));
        }

        @Test
        @DisplayName("double target, delivery 90+, second card → 2.0 × 1.05 × 0.65")
        void combined() {
            assertEquals(27, ProfitCalculator.scaleRevenueProfit(20, 50, 90, 1));
        }

        @Test
        @DisplayName("negative deltas truncate toward zero")
        void negativeTruncation() {
            assertEquals(-9, ProfitCalculator.scaleRevenueProfit(-15, 25, 60, 1));
        }

        @Test
        @DisplayName("diminishing returns stop at the third card")
        void diminishingClamp() {
            assertEquals(ProfitCalculator.scaleRevenueProfit(40, 25, 60, 2),
                         ProfitCalculator.scaleRevenueProfit(40, 25, 60, 7));
        }
    }

    @Test
    @DisplayName("format(): millions, billions and signs")
    void formatting() {
        assertEquals("$85M", ProfitCalculator.format(85));
        assertEquals("-$12M", ProfitCalculator.format(-12));
        assertEquals("$1.2B", ProfitCalculator.format(1200));
        assertEquals("-$1.5B", ProfitCalculator.format(-1500));
        assertEquals("+$5M", ProfitCalculator.formatWithSign(5));
        assertEquals("-$5M", ProfitCalculator.formatWithSign(-5));
    }
}
