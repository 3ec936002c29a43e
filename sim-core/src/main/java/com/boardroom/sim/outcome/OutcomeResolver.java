package com.boardroom.sim.outcome;

import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.random.RandomSource;

/**
 * Converts a base Good/Expected/Bad profile plus situational modifiers into a
 * single weighted roll.
 *
 * <h3>Modifier order</h3>
 * <p>Starting from Good {@value #BASE_GOOD} / Expected {@value #BASE_EXPECTED} /
 * Bad {@value #BASE_BAD}, modifiers are applied in this fixed order:
 * <ol>
 *   <li><strong>Alignment</strong> — (alignment - 50) / 5 moves weight from Bad to Good.</li>
 *   <li><strong>Pressure</strong> — pressure - 1 moves weight from Good to Bad.</li>
 *   <li><strong>Evil</strong> — evil / 2 moves weight from Good to Bad.</li>
 *   <li><strong>Additional risk</strong> — card position risk minus meter affinity, added to Bad.</li>
 *   <li><strong>Honeymoon</strong> — quarters 1-3 add up to +15 Good and -10 Bad, fading out.</li>
 *   <li><strong>Momentum</strong>, <strong>affinity synergy</strong> and (corporate cards only)
 *       <strong>evil path</strong> bonuses, added to Good.</li>
 * </ol>
 *
 * <h3>Saturation</h3>
 * <p>Good and Bad are clamped to [{@value #MIN_EDGE_WEIGHT}, {@value #MAX_EDGE_WEIGHT}],
 * then Expected takes the remainder of 100 with a floor of {@value #MIN_EXPECTED_WEIGHT}.
 * Every share therefore stays strictly positive and no modifier stack can push
 * an edge tier past 60%.
 *
 * <p>Pure: the only side effect is one draw from the supplied {@link RandomSource}.
 */
public final class OutcomeResolver {

    /** Starting weights before any modifier. */
    public static final int BASE_GOOD = 20;
    public static final int BASE_EXPECTED = 60;
    public static final int BASE_BAD = 20;

    /** Good and Bad never drop below this weight. */
    private static final int MIN_EDGE_WEIGHT = 5;

    /** Good and Bad never exceed this weight. */
    private static final int MAX_EDGE_WEIGHT = 60;

    /** Expected never drops below this weight. */
    private static final int MIN_EXPECTED_WEIGHT = 10;

    /** Last quarter that still gets the new-CEO honeymoon adjustment. */
    private static final int HONEYMOON_QUARTERS = 3;

    private static final int HONEYMOON_GOOD_BONUS = 15;
    private static final int HONEYMOON_BAD_REDUCTION = 10;

    // ── Crisis choice tables ───────────────────────────────────────

    /** Choices that cost Political Capital are a reliable investment. */
    public static final OutcomeWeights PC_CHOICE_WEIGHTS = new OutcomeWeights(70, 20, 10);

    /** Corporate (evil) choices are high variance. */
    public static final OutcomeWeights CORPORATE_CHOICE_WEIGHTS = new OutcomeWeights(70, 10, 20);

    /** Standard tiered choices are predictable. */
    public static final OutcomeWeights STANDARD_CHOICE_WEIGHTS = new OutcomeWeights(20, 70, 10);

    private OutcomeResolver() { /* utility class */ }

    /**
     * Situational inputs of a project roll.
     *
     * @param alignment      current Alignment meter (0-100)
     * @param pressure       board pressure level
     * @param evilScore      accumulated evil score
     * @param additionalRisk extra Bad weight (position risk minus affinity modifier; may be negative)
     * @param quarter        1-based quarter number
     * @param momentumBonus  Good bonus from the success streak
     * @param synergyBonus   Good bonus from same-affinity cards this quarter
     * @param corporate      whether the card is a corporate card (enables the evil-path bonus)
     */
    public record RollModifiers(
        int alignment,
        int pressure,
        int evilScore,
        int additionalRisk,
        int quarter,
        int momentumBonus,
        int synergyBonus,
        boolean corporate
    ) {}

    /**
     * Computes final weights for a project roll. Pure; draws nothing.
     */
    public static OutcomeWeights weightsFor(RollModifiers m) {
        int good = BASE_GOOD;
        int bad = BASE_BAD;

        int alignmentMod = (m.alignment() - 50) / 5;
        good += alignmentMod;
        bad -= alignmentMod;

        int pressureMod = m.pressure() - 1;
        good -= pressureMod;
        bad += pressureMod;

        int evilMod = m.evilScore() / 2;
        good -= evilMod;
        bad += evilMod;

        bad += m.additionalRisk();

        good += honeymoonGoodBonus(m.quarter());
        bad -= honeymoonBadReduction(m.quarter());

        good += m.momentumBonus();
        good += m.synergyBonus();
        good += evilPathBonus(m.evilScore(), m.corporate());

        good = clamp(good, MIN_EDGE_WEIGHT, MAX_EDGE_WEIGHT);
        bad = clamp(bad, MIN_EDGE_WEIGHT, MAX_EDGE_WEIGHT);
        int expected = Math.max(MIN_EXPECTED_WEIGHT, 100 - good - bad);

        return new OutcomeWeights(good, expected, bad);
    }

    /** Project/card roll: one draw over the modified weights. */
    public static OutcomeTier roll(RollModifiers modifiers, RandomSource rng) {
        return weightsFor(modifiers).roll(rng);
    }

    /**
     * Table used for a tiered crisis choice. A PC cost takes precedence over a
     * corporate intensity.
     */
    public static OutcomeWeights crisisChoiceWeights(int pcCost, int corporateIntensity) {
        if (pcCost > 0) return PC_CHOICE_WEIGHTS;
        if (corporateIntensity > 0) return CORPORATE_CHOICE_WEIGHTS;
        return STANDARD_CHOICE_WEIGHTS;
    }

    public static OutcomeTier rollCrisisChoice(int pcCost, int corporateIntensity, RandomSource rng) {
        return crisisChoiceWeights(pcCost, corporateIntensity).roll(rng);
    }

    // ── Modifier helpers ───────────────────────────────────────────

    /** +15 at quarter 1, +10 at 2, +5 at 3, 0 afterwards. */
    public static int honeymoonGoodBonus(int quarter) {
        if (quarter > HONEYMOON_QUARTERS) return 0;
        int fade = HONEYMOON_QUARTERS - quarter + 1;
        return HONEYMOON_GOOD_BONUS * fade / HONEYMOON_QUARTERS;
    }

    public static int honeymoonBadReduction(int quarter) {
        if (quarter > HONEYMOON_QUARTERS) return 0;
        int fade = HONEYMOON_QUARTERS - quarter + 1;
        return HONEYMOON_BAD_REDUCTION * fade / HONEYMOON_QUARTERS;
    }

    /** Corporate cards only: +10 at evil 20+, +5 at evil 10+. */
    public static int evilPathBonus(int evilScore, boolean corporate) {
        if (!corporate) return 0;
        if (evilScore >= 20) return 10;
        if (evilScore >= 10) return 5;
        return 0;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
