package com.boardroom.sim.economy;

import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.model.TenureState;

import java.util.ArrayList;
import java.util.List;

/**
 * Quarterly board bonus and end-of-game score.
 *
 * <h3>Quarterly bonus ($M, never negative)</h3>
 * <pre>
 *  +2 base compensation        -3 directive failed
 *  +4 directive met            -2 per meter below 20
 *  +3 profit grew              -3 evil score 15+
 *  +3 all meters 40+
 *  +2 favorability 70+
 *  +2 no new evil this quarter
 * </pre>
 *
 * <h3>Final score</h3>
 * <p>(accumulated bonus + parachute + 5 per PC + 1 per card played) x 2.0 when
 * retired, x 0.5 when ousted; truncated, never negative.
 */
public final class ScoreCalculator {

    /** $M of final score per unspent Political Capital. */
    public static final int PC_CONVERSION_RATE = 5;

    /** $M of final score per project executed. */
    public static final int PROJECTS_BONUS_RATE = 1;

    private static final double RETIRED_MULTIPLIER = 2.0;
    private static final double OUSTED_MULTIPLIER = 0.5;

    private ScoreCalculator() { /* utility class */ }

    public record QuarterlyBonus(int amount, List<String> reasons) {
        public QuarterlyBonus {
            reasons = List.copyOf(reasons);
        }
    }

    public record FinalScoreBreakdown(
        int accumulatedBonus,
        int goldenParachute,
        int pcConversion,
        int projectsBonus,
        int subtotal,
        double multiplier,
        int finalScore
    ) {}

    public static QuarterlyBonus quarterlyBonus(TenureState tenure, OrgState org,
                                                boolean directiveMet, int profitDelta) {
        int bonus = 2;
        List<String> reasons = new ArrayList<>();
        reasons.add("+$2M: Quarterly base compensation");

        if (directiveMet) {
            bonus += 4;
            reasons.add("+$4M: Met board directive");
        }
        if (profitDelta > 0) {
            bonus += 3;
            reasons.add("+$3M: Profit growth quarter-over-quarter");
        }
        if (org.countBelow(40) == 0) {
            bonus += 3;
            reasons.add("+$3M: All organizational metrics healthy");
        }
        if (tenure.favorability() >= 70) {
            bonus += 2;
            reasons.add("+$2M: Strong board confidence");
        }
        if (tenure.evilDeltaThisQuarter() <= 0) {
            bonus += 2;
            reasons.add("+$2M: Maintained ethical standards");
        }

        if (!directiveMet) {
            bonus -= 3;
            reasons.add("-$3M: Failed board directive");
        }

        List<String> critical = new ArrayList<>();
        for (Meter m : Meter.values()) {
            if (org.getMeter(m) < 20) critical.add(m.name());
        }
        if (!critical.isEmpty()) {
            int penalty = critical.size() * 2;
            bonus -= penalty;
            reasons.add("-$" + penalty + "M: Critical metrics (" + String.join(", ", critical) + ")");
        }

        if (tenure.evilScore() >= 15) {
            bonus -= 3;
            reasons.add("-$3M: Reputation concerns (Evil 15+)");
        }

        return new QuarterlyBonus(Math.max(0, bonus), reasons);
    }

    public static FinalScoreBreakdown breakdown(TenureState tenure, ResourceState resources) {
        int parachute = tenure.parachutePayout();
        int pcConversion = resources.politicalCapital() * PC_CONVERSION_RATE;
        int projects = tenure.totalCardsPlayed() * PROJECTS_BONUS_RATE;
        int subtotal = tenure.accumulatedBonus() + parachute + pcConversion + projects;
        double multiplier = tenure.retired() ? RETIRED_MULTIPLIER : OUSTED_MULTIPLIER;
        int score = Math.max(0, (int) (subtotal * multiplier));
        return new FinalScoreBreakdown(tenure.accumulatedBonus(), parachute, pcConversion, projects,
            subtotal, multiplier, score);
    }

    public static int finalScore(TenureState tenure, ResourceState resources) {
        return breakdown(tenure, resources).finalScore();
    }
}
