package com.boardroom.sim.effect;

import com.boardroom.sim.log.LogEntry;
import com.boardroom.sim.model.OrgState;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-stage effect application.
 *
 * <ol>
 *   <li>Meter effects are applied to the organization immediately.</li>
 *   <li>Profit and fine effects are collected, not applied: the caller decides
 *       how they feed the quarter's financial result (revenue scaling, fines
 *       deducted from project profit).</li>
 * </ol>
 *
 * <p>No randomness is consumed.
 */
public final class EffectPipeline {

    private EffectPipeline() { /* utility class */ }

    /**
     * Outcome of running a list of effects.
     *
     * @param org           organization after meter effects
     * @param meterDeltas   meter effects in application order
     * @param profitEffects profit effects, unscaled
     * @param fineTotal     sum of fines ($M, non-negative)
     * @param entries       log entries of every effect, in order
     */
    public record Result(
        OrgState org,
        List<MeterEffect> meterDeltas,
        List<ProfitEffect> profitEffects,
        int fineTotal,
        List<LogEntry> entries
    ) {}

    public static Result apply(List<? extends Effect> effects, OrgState org) {
        OrgState current = org;
        List<MeterEffect> meters = new ArrayList<>();
        List<ProfitEffect> profits = new ArrayList<>();
        List<LogEntry> entries = new ArrayList<>();
        int fines = 0;

        for (Effect effect : effects) {
            EffectResult result = effect.apply(current);
            current = result.org();
            entries.addAll(result.entries());

            if (effect instanceof MeterEffect m) {
                meters.add(m);
            } else if (effect instanceof ProfitEffect p) {
                profits.add(p);
            } else if (effect instanceof FineEffect f) {
                fines += f.amount();
            }
        }

        return new Result(current, List.copyOf(meters), List.copyOf(profits), fines, List.copyOf(entries));
    }
}
