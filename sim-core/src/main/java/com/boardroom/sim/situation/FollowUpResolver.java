package com.boardroom.sim.situation;

import com.boardroom.sim.effect.MeterEffect;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.random.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rolls delayed consequences of played projects.
 *
 * <p>Each eligible follow-up triggers with min(40, 20 + 5 * quartersSince) percent.
 * The kind is then drawn from Good 20 / Meh 50 / Crisis 30, shifted toward Good
 * (+10 / -5) for a Good origin and toward Crisis (-10 / -10) for a Bad one.
 */
public final class FollowUpResolver {

    public static final int BASE_CHANCE = 20;
    public static final int CHANCE_PER_QUARTER = 5;
    public static final int MAX_CHANCE = 40;

    private static final int GOOD_WEIGHT = 20;
    private static final int MEH_WEIGHT = 50;

    /** Meters a follow-up can touch; Runway is excluded. */
    private static final List<Meter> FOLLOW_UP_METERS =
        List.of(Meter.DELIVERY, Meter.MORALE, Meter.GOVERNANCE, Meter.ALIGNMENT);

    private FollowUpResolver() { /* utility class */ }

    /**
     * A triggered follow-up. Crisis results carry a situation id and no effects;
     * Good and Meh results carry one meter effect.
     */
    public record FollowUpResult(
        PendingFollowUp followUp,
        FollowUpType type,
        String situationId,
        List<MeterEffect> effects
    ) {
        public FollowUpResult {
            effects = effects == null ? List.of() : List.copyOf(effects);
        }
    }

    /** Checks every non-expired follow-up in order. */
    public static List<FollowUpResult> checkAll(List<PendingFollowUp> followUps, int currentQuarter, RandomSource rng) {
        List<FollowUpResult> results = new ArrayList<>();
        for (PendingFollowUp f : followUps) {
            if (f.hasExpired(currentQuarter)) {
                continue;
            }
            checkForTrigger(f, currentQuarter, rng).ifPresent(results::add);
        }
        return results;
    }

    public static Optional<FollowUpResult> checkForTrigger(PendingFollowUp followUp, int currentQuarter,
                                                           RandomSource rng) {
        int chance = triggerChance(followUp.quartersSincePlayed(currentQuarter));
        if (rng.nextInt(1, 101) > chance) {
            return Optional.empty();
        }
        FollowUpType type = followUpType(rng.nextInt(1, 101), followUp.originalOutcome());
        return Optional.of(switch (type) {
            case GOOD -> new FollowUpResult(followUp, type, null, List.of(goodEffect(rng)));
            case MEH -> new FollowUpResult(followUp, type, null, List.of(mehEffect(rng)));
            case CRISIS -> new FollowUpResult(followUp, type, crisisSituation(followUp.originalOutcome(), rng), null);
        });
    }

    public static int triggerChance(int quartersSince) {
        return Math.min(MAX_CHANCE, BASE_CHANCE + quartersSince * CHANCE_PER_QUARTER);
    }

    static FollowUpType followUpType(int roll, OutcomeTier origin) {
        int good = GOOD_WEIGHT;
        int meh = MEH_WEIGHT;
        switch (origin) {
            case GOOD -> { good += 10; meh -= 5; }
            case BAD -> { good -= 10; meh -= 10; }
            case EXPECTED -> { }
        }
        if (roll <= good) return FollowUpType.GOOD;
        if (roll <= good + meh) return FollowUpType.MEH;
        return FollowUpType.CRISIS;
    }

    /** +3..+7 on one meter. */
    private static MeterEffect goodEffect(RandomSource rng) {
        Meter meter = FOLLOW_UP_METERS.get(rng.nextInt(0, FOLLOW_UP_METERS.size()));
        return new MeterEffect(meter, rng.nextInt(3, 8));
    }

    /** 2..5 on one meter, positive 60% of the time. */
    private static MeterEffect mehEffect(RandomSource rng) {
        Meter meter = FOLLOW_UP_METERS.get(rng.nextInt(0, FOLLOW_UP_METERS.size()));
        boolean positive = rng.nextInt(1, 101) <= 60;
        int magnitude = rng.nextInt(2, 6);
        return new MeterEffect(meter, positive ? magnitude : -magnitude);
    }

    private static String crisisSituation(OutcomeTier origin, RandomSource rng) {
        List<String> pool = switch (origin) {
            case BAD -> List.of(SituationIds.KEY_PERFORMER_QUITS, SituationIds.SECURITY_VULNERABILITY,
                SituationIds.REVIEW_SITE_BACKLASH);
            case GOOD -> List.of(SituationIds.PRESS_RECOGNITION, SituationIds.ENGAGEMENT_BOOST);
            case EXPECTED -> List.of(SituationIds.KEY_PERFORMER_QUITS, SituationIds.REVIEW_SITE_BACKLASH);
        };
        return pool.get(rng.nextInt(0, pool.size()));
    }
}
