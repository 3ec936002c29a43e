package com.boardroom.sim.situation;

import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.random.RandomSource;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a card play queues a situation, which one, and how many
 * quarters until it surfaces.
 *
 * <h3>Card-specific</h3>
 * <p>One d20: 18-20 queue nothing. Otherwise a weighted trigger is picked for the
 * outcome and the d20 sets the delay: 1-5 now, 6-10 next quarter, 11-14 in two,
 * 15-17 in three.
 *
 * <h3>Generic</h3>
 * <p>Chance min(25, 5 + 2q) percent; the pool depends on the outcome tier; a d10
 * sets the delay: 1-4 now, 5-7 next quarter, 8-9 in two, 10 in three.
 */
public final class SituationResolver {

    private static final int NO_TRIGGER_FROM = 18;

    private static final List<String> GENERIC_BAD = List.of(
        SituationIds.KEY_PERFORMER_QUITS, SituationIds.REVIEW_SITE_BACKLASH, SituationIds.SECURITY_VULNERABILITY);

    private static final List<String> GENERIC_EXPECTED = List.of(
        SituationIds.KEY_PERFORMER_QUITS, SituationIds.REVIEW_SITE_BACKLASH);

    private static final List<String> GENERIC_GOOD = List.of(
        SituationIds.ENGAGEMENT_BOOST, SituationIds.PRESS_RECOGNITION);

    private SituationResolver() { /* utility class */ }

    public static Optional<PendingSituation> checkForTrigger(CardSituations cardSituations, OutcomeTier outcome,
                                                             int currentQuarter, RandomSource rng, String threadId) {
        int triggerRoll = rng.nextInt(1, 21);
        if (triggerRoll >= NO_TRIGGER_FROM) {
            return Optional.empty();
        }
        return cardSituations.selectTrigger(outcome, rng)
            .map(t -> PendingSituation.create(t.situationId(), cardSituations.cardId(),
                currentQuarter, cardTriggerDelay(triggerRoll), threadId));
    }

    public static Optional<PendingSituation> checkGenericTrigger(String cardId, OutcomeTier outcome,
                                                                 int currentQuarter, RandomSource rng, String threadId) {
        int chance = genericTriggerChance(currentQuarter);
        int roll = rng.nextInt(1, 101);
        if (roll > chance) {
            return Optional.empty();
        }
        List<String> pool = genericPool(outcome);
        String situationId = pool.get(rng.nextInt(0, pool.size()));
        int delay = genericDelay(rng.nextInt(1, 11));
        return Optional.of(PendingSituation.create(situationId, cardId, currentQuarter, delay, threadId));
    }

    public static int genericTriggerChance(int quarter) {
        return Math.min(25, 5 + quarter * 2);
    }

    static List<String> genericPool(OutcomeTier outcome) {
        return switch (outcome) {
            case BAD -> GENERIC_BAD;
            case EXPECTED -> GENERIC_EXPECTED;
            case GOOD -> GENERIC_GOOD;
        };
    }

    static int cardTriggerDelay(int d20) {
        if (d20 <= 5) return 0;
        if (d20 <= 10) return 1;
        if (d20 <= 14) return 2;
        return 3;
    }

    static int genericDelay(int d10) {
        if (d10 <= 4) return 0;
        if (d10 <= 7) return 1;
        if (d10 <= 9) return 2;
        return 3;
    }
}
