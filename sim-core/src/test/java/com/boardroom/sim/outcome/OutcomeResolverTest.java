package com.boardroom.sim.outcome;

import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.outcome.OutcomeResolver.RollModifiers;
import com.boardroom.sim.random.ScriptedRandomSource;
import com.boardroom.sim.random.SeededRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link OutcomeResolver} weight modifiers and rolls.
 */
class OutcomeResolverTest {

    private static RollModifiers neutral(int quarter) {
        return new RollModifiers(50, 1, 0, 0, quarter, 0, 0, false);
    }

    // ── weightsFor() ───────────────────────────────────────────────

    @Nested
    @DisplayName("weightsFor() — modifier pipeline")
    class WeightTests {

        @Test
        @DisplayName("neutral inputs after the honeymoon → 20/60/20")
        void neutralInputs() {
            assertEquals(new OutcomeWeights(20, 60, 20), OutcomeResolver.weightsFor(neutral(5)));
        }

        @Test
        @DisplayName("quarter 1 honeymoon → Good +15, Bad −10")
        void honeymoon() {
            assertEquals(new OutcomeWeights(35, 55, 10), OutcomeResolver.weightsFor(neutral(1)));
        }

        @Test
        @DisplayName("honeymoon fades +15/+10/+5 over the first three quarters")
        void honeymoonFade() {
            assertEquals(15, OutcomeResolver.honeymoonGoodBonus(1));
            assertEquals(10, OutcomeResolver.honeymoonGoodBonus(2));
            assertEquals(5, OutcomeResolver.honeymoonGoodBonus(3));
            assertEquals(0, OutcomeResolver.honeymoonGoodBonus(4));
        }

        @Test
        @DisplayName("Bad never drops below 5 even with every bonus stacked")
        void badFloor() {
            RollModifiers m = new RollModifiers(100, 1, 0, -30, 1, 5, 10, false);
            OutcomeWeights w = OutcomeResolver.weightsFor(m);
            assertEquals(5, w.bad());
            assertEquals(60, w.good());
            assertEquals(35, w.expected());
        }

        @Test
        @DisplayName("extreme risk saturates Bad at 60 and keeps Expected ≥ 10")
        void badCeiling() {
            RollModifiers m = new RollModifiers(0, 8, 40, 100, 10, 0, 0, false);
            OutcomeWeights w = OutcomeResolver.weightsFor(m);
            assertEquals(60, w.bad());
            assertEquals(5, w.good());
            assertEquals(35, w.expected());
        }

        @Test
        @DisplayName("evil path bonus applies to corporate cards only")
        void evilPath() {
            assertEquals(0, OutcomeResolver.evilPathBonus(25, false));
            assertEquals(5, OutcomeResolver.evilPathBonus(10, true));
            assertEquals(10, OutcomeResolver.evilPathBonus(20, true));
        }
    }

    // ── roll() ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("OutcomeWeights.roll()")
    class RollTests {

        @Test
        @DisplayName("draw below Good → GOOD, below Good+Expected → EXPECTED, else BAD")
        void bands() {
            OutcomeWeights w = new OutcomeWeights(20, 60, 20);
            assertEquals(OutcomeTier.GOOD, w.roll(ScriptedRandomSource.strict(19)));
            assertEquals(OutcomeTier.EXPECTED, w.roll(ScriptedRandomSource.strict(20)));
            assertEquals(OutcomeTier.EXPECTED, w.roll(ScriptedRandomSource.strict(79)));
            assertEquals(OutcomeTier.BAD, w.roll(ScriptedRandomSource.strict(80)));
        }

        @Test
        @DisplayName("Bad weight 0 → BAD is never selected")
        void zeroBad_neverBad() {
            OutcomeWeights w = new OutcomeWeights(30, 70, 0);
            SeededRandomSource rng = new SeededRandomSource(3L);
            for (int i = 0; i < 5_000; i++) {
                assertNotEquals(OutcomeTier.BAD, w.roll(rng));
            }
        }

        @Test
        @DisplayName("all-zero weights → EXPECTED without drawing")
        void zeroTotal() {
            ScriptedRandomSource rng = ScriptedRandomSource.strict();
            assertEquals(OutcomeTier.EXPECTED, new OutcomeWeights(0, 0, 0).roll(rng));
            assertEquals(0, rng.draws());
        }

        @Test
        @DisplayName("negative weights are rejected")
        void negativeRejected() {
            assertThrows(IllegalArgumentException.class, () -> new OutcomeWeights(-1, 50, 50));
        }
    }

    @Nested
    @DisplayName("Crisis choice tables")
    class CrisisChoiceTests {

        @Test
        @DisplayName("PC cost takes precedence over corporate intensity")
        void pcWins() {
            assertEquals(OutcomeResolver.PC_CHOICE_WEIGHTS, OutcomeResolver.crisisChoiceWeights(2, 3));
            assertEquals(OutcomeResolver.CORPORATE_CHOICE_WEIGHTS, OutcomeResolver.crisisChoiceWeights(0, 3));
            assertEquals(OutcomeResolver.STANDARD_CHOICE_WEIGHTS, OutcomeResolver.crisisChoiceWeights(0, 0));
        }
    }

    @Test
    @DisplayName("Deterministic — same input always produces same output")
    void deterministic() {
        RollModifiers m = new RollModifiers(63, 3, 7, 10, 4, 3, 5, true);
        SeededRandomSource a = new SeededRandomSource(11L);
        SeededRandomSource b = new SeededRandomSource(11L);
        for (int i = 0; i < 50; i++) {
            assertEquals(OutcomeResolver.roll(m, a), OutcomeResolver.roll(m, b));
        }
    }
}
