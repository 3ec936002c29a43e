package com.boardroom.sim.situation;

import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.random.ScriptedRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SituationResolverTest {

    private static final CardSituations TABLE = new CardSituations("PROJ_TEST", List.of(
        new SituationTrigger("SIT_A", OutcomeTier.BAD, 1),
        new SituationTrigger("SIT_B", null, 1)));

    @Nested
    @DisplayName("Card-specific triggers")
    class CardTriggerTests {

        @Test
        @DisplayName("d20 of 18+ queues nothing after a single draw")
        void noTrigger() {
            ScriptedRandomSource rng = ScriptedRandomSource.strict(18);
            assertTrue(SituationResolver.checkForTrigger(TABLE, OutcomeTier.BAD, 3, rng, "t").isEmpty());
            assertEquals(1, rng.draws());
        }

        @Test
        @DisplayName("low d20 fires immediately with the weighted pick")
        void immediate() {
            Optional<PendingSituation> p = SituationResolver.checkForTrigger(
                TABLE, OutcomeTier.BAD, 3, ScriptedRandomSource.strict(3, 1), "thread");
            assertTrue(p.isPresent());
            assertEquals("SIT_A", p.get().situationId());
            assertEquals(3, p.get().scheduledQuarter());
            assertEquals(3, p.get().queuedAtQuarter());
            assertEquals("PROJ_TEST", p.get().originCardId());
            assertEquals("thread", p.get().originatingThreadId());
        }

        @Test
        @DisplayName("d20 sets the delay: 6-10 → +1, 11-14 → +2, 15-17 → +3")
        void delays() {
            assertEquals(4, SituationResolver.checkForTrigger(
                TABLE, OutcomeTier.BAD, 3, ScriptedRandomSource.strict(7, 2), "t").get().scheduledQuarter());
            assertEquals(5, SituationResolver.checkForTrigger(
                TABLE, OutcomeTier.BAD, 3, ScriptedRandomSource.strict(12, 2), "t").get().scheduledQuarter());
            assertEquals(6, SituationResolver.checkForTrigger(
                TABLE, OutcomeTier.BAD, 3, ScriptedRandomSource.strict(17, 2), "t").get().scheduledQuarter());
        }

        @Test
        @DisplayName("only triggers matching the outcome are candidates")
        void outcomeFilter() {
            Optional<PendingSituation> p = SituationResolver.checkForTrigger(
                TABLE, OutcomeTier.GOOD, 1, ScriptedRandomSource.strict(1, 1), "t");
            assertEquals("SIT_B", p.get().situationId());
        }

        @Test
        @DisplayName("no matching trigger → nothing queued, no selection draw")
        void noMatch() {
            CardSituations badOnly = new CardSituations("PROJ_TEST",
                List.of(new SituationTrigger("SIT_A", OutcomeTier.BAD, 1)));
            ScriptedRandomSource rng = ScriptedRandomSource.strict(2);
            assertTrue(SituationResolver.checkForTrigger(badOnly, OutcomeTier.GOOD, 1, rng, "t").isEmpty());
            assertEquals(1, rng.draws());
        }

        @Test
        @DisplayName("trigger weight must be positive")
        void weightValidation() {
            assertThrows(IllegalArgumentException.class, () -> new SituationTrigger("SIT_A", null, 0));
        }
    }

    @Nested
    @DisplayName("Generic triggers")
    class GenericTriggerTests {

        @Test
        @DisplayName("chance is min(25, 5 + 2q)")
        void chance() {
            assertEquals(7, SituationResolver.genericTriggerChance(1));
            assertEquals(25, SituationResolver.genericTriggerChance(10));
            assertEquals(25, SituationResolver.genericTriggerChance(40));
        }

        @Test
        @DisplayName("roll above the chance queues nothing")
        void miss() {
            assertTrue(SituationResolver.checkGenericTrigger(
                "PROJ_X", OutcomeTier.BAD, 1, ScriptedRandomSource.strict(8), "t").isEmpty());
        }

        @Test
        @DisplayName("Bad pool, d10 of 4 → immediate")
        void badPool() {
            PendingSituation p = SituationResolver.checkGenericTrigger(
                "PROJ_X", OutcomeTier.BAD, 1, ScriptedRandomSource.strict(7, 2, 4), "t").orElseThrow();
            assertEquals(SituationIds.SECURITY_VULNERABILITY, p.situationId());
            assertEquals(1, p.scheduledQuarter());
        }

        @Test
        @DisplayName("Good pool, d10 of 10 → three quarters out")
        void goodPool() {
            PendingSituation p = SituationResolver.checkGenericTrigger(
                "PROJ_X", OutcomeTier.GOOD, 2, ScriptedRandomSource.strict(1, 1, 10), "t").orElseThrow();
            assertEquals(SituationIds.PRESS_RECOGNITION, p.situationId());
            assertEquals(5, p.scheduledQuarter());
        }
    }

    @Test
    @DisplayName("deferral reschedules to next quarter and keeps the original queue quarter")
    void deferral() {
        PendingSituation p = PendingSituation.create("SIT_A", "PROJ_X", 2, 1, "t");
        assertFalse(p.isDueAt(2));
        assertTrue(p.isDueAt(3));
        PendingSituation deferred = p.withDeferred(3);
        assertEquals(4, deferred.scheduledQuarter());
        assertEquals(2, deferred.queuedAtQuarter());
        assertEquals(1, deferred.deferCount());
    }
}
