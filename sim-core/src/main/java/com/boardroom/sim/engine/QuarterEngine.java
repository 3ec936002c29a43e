package com.boardroom.sim.engine;

import com.boardroom.sim.card.CardDeck;
import com.boardroom.sim.card.CardHand;
import com.boardroom.sim.card.Choice;
import com.boardroom.sim.card.EventCard;
import com.boardroom.sim.card.EventDeck;
import com.boardroom.sim.card.PlayableCard;
import com.boardroom.sim.config.DifficultySettings;
import com.boardroom.sim.crisis.CrisisInstance;
import com.boardroom.sim.crisis.CrisisState;
import com.boardroom.sim.directive.BoardDirective;
import com.boardroom.sim.economy.ProfitCalculator;
import com.boardroom.sim.economy.ResourceState;
import com.boardroom.sim.economy.ScoreCalculator;
import com.boardroom.sim.effect.Effect;
import com.boardroom.sim.effect.EffectPipeline;
import com.boardroom.sim.effect.EffectResult;
import com.boardroom.sim.effect.FineEffect;
import com.boardroom.sim.effect.ProfitEffect;
import com.boardroom.sim.exception.IllegalMoveException;
import com.boardroom.sim.favor.FavorabilityCalculator;
import com.boardroom.sim.favor.FavorabilityCalculator.FavorAdjustment;
import com.boardroom.sim.favor.SurvivalCalculator;
import com.boardroom.sim.log.LogEntry;
import com.boardroom.sim.log.QuarterLog;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.model.OutcomeTier;
import com.boardroom.sim.model.QuarterPhase;
import com.boardroom.sim.model.TenureState;
import com.boardroom.sim.outcome.OutcomeResolver;
import com.boardroom.sim.outcome.OutcomeResolver.RollModifiers;
import com.boardroom.sim.random.RandomSource;
import com.boardroom.sim.situation.FollowUpResolver;
import com.boardroom.sim.situation.FollowUpResolver.FollowUpResult;
import com.boardroom.sim.situation.FollowUpType;
import com.boardroom.sim.situation.PendingFollowUp;
import com.boardroom.sim.situation.PendingSituation;
import com.boardroom.sim.situation.SituationCatalog;
import com.boardroom.sim.situation.SituationDefinition;
import com.boardroom.sim.situation.SituationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Quarterly state machine. Each {@link #advance} call performs exactly one
 * transition and returns the new state with the log of what happened.
 *
 * <h3>Phase cycle</h3>
 * <ol>
 *   <li>DEMAND     — directive announced; 33% chance a crisis card is drawn</li>
 *   <li>PLAY_CARDS — one card play or economy action per call, up to 3 projects</li>
 *   <li>CRISIS     — follow-ups and due situations; a current crisis needs a choice</li>
 *   <li>RESOLUTION — profit, directive, favorability, bonus, survival, next quarter</li>
 * </ol>
 *
 * <p>All randomness comes from the injected {@link RandomSource}; the same
 * state, input and source sequence always produce the same result. The engine
 * holds no mutable state and is safe to share.
 */
public class QuarterEngine {

    private static final Logger log = LoggerFactory.getLogger(QuarterEngine.class);

    private static final String COMPONENT = "QuarterEngine";

    static final int CRISIS_CHANCE = 33;
    static final int BOOST_COST = 1;
    static final int BOOST_AMOUNT = 5;
    static final int SCHMOOZE_COST = 2;
    static final int SCHMOOZE_FAILURE_CHANCE = 15;
    static final int REORG_COST = 3;
    static final int REDEMPTION_COST = 2;
    static final int NEGLECT_REVENUE_CARDS = 3;
    static final int NEGLECT_METER_PENALTY = -8;
    static final int NEGLECT_FAVOR_PENALTY = -15;
    static final int REFRESH_COUNT = 3;

    private final SituationCatalog catalog;

    public QuarterEngine(SituationCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Performs one transition.
     *
     * @throws IllegalMoveException when the game is over or the input is not a legal move
     * @throws com.boardroom.sim.exception.InsufficientCapitalException when an action costs more PC than available
     */
    public QuarterResult advance(QuarterGameState state, QuarterInput input, RandomSource rng) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(rng, "rng");
        if (state.ceo().ousted()) {
            throw new IllegalMoveException(COMPONENT, "Cannot advance: CEO has been ousted");
        }
        if (state.ceo().retired()) {
            throw new IllegalMoveException(COMPONENT, "Cannot advance: CEO has retired");
        }
        QuarterInput in = input == null ? QuarterInput.none() : input;
        requirePermitted(state.quarter().phase(), in);

        return switch (state.quarter().phase()) {
            case DEMAND -> advanceDemand(state, rng);
            case PLAY_CARDS -> advancePlayCards(state, in, rng);
            case CRISIS -> advanceCrisis(state, in, rng);
            case RESOLUTION -> advanceResolution(state, in, rng);
        };
    }

    private static void requirePermitted(QuarterPhase phase, QuarterInput input) {
        boolean playAction = input.hasCard() || input.endPlayPhase()
            || input.action() != QuarterInput.Action.PLAY_CARD;
        if (playAction && phase != QuarterPhase.PLAY_CARDS) {
            throw new IllegalMoveException(COMPONENT,
                "Card plays and " + input.action() + " are not allowed in phase " + phase);
        }
        if (input.hasChoice() && phase != QuarterPhase.CRISIS) {
            throw new IllegalMoveException(COMPONENT,
                "Choice " + input.choiceId() + " is not allowed in phase " + phase);
        }
        if (input.retire() && phase != QuarterPhase.RESOLUTION) {
            throw new IllegalMoveException(COMPONENT, "Retirement is only decided in RESOLUTION, phase is " + phase);
        }
    }

    // ── Demand ─────────────────────────────────────────────────────

    private QuarterResult advanceDemand(QuarterGameState state, RandomSource rng) {
        List<LogEntry> entries = new ArrayList<>();
        QuarterGameState s = state;

        if (s.currentDirective() != null) {
            entries.add(LogEntry.info("Board Directive: " + s.currentDirective().description(s.ceo().pressure())));
        }

        int crisisRoll = rng.nextInt(1, 101);
        if (crisisRoll <= CRISIS_CHANCE && s.crisisDeck().totalCards() > 0) {
            EventDeck.Draw draw = s.crisisDeck().drawWithReshuffle(rng);
            s = s.withCrisisDeck(draw.deck()).withCurrentCrisis(draw.card(), null);
            entries.add(LogEntry.info("A situation is brewing..."));
            log.debug("[QuarterEngine] Crisis drawn. quarter={} eventId={}", s.quarterNumber(), draw.card().eventId());
        }

        return result(state, s.withQuarter(s.quarter().nextPhase()), entries);
    }

    // ── PlayCards ──────────────────────────────────────────────────

    private QuarterResult advancePlayCards(QuarterGameState state, QuarterInput input, RandomSource rng) {
        List<LogEntry> entries = new ArrayList<>();

        switch (input.action()) {
            case EXCHANGE -> {
                return result(state, exchange(state, input, entries), entries);
            }
            case BOOST -> {
                return result(state, boost(state, input, entries), entries);
            }
            case SCHMOOZE -> {
                return result(state, schmooze(state, rng, entries), entries);
            }
            case REORG -> {
                return result(state, reorg(state, rng, entries), entries);
            }
            case REDEEM_EVIL -> {
                return result(state, redeemEvil(state, entries), entries);
            }
            case PLAY_CARD -> {
                // handled below
            }
        }

        QuarterGameState s = state;
        if (input.hasCard()) {
            s = playCard(s, input.cardId(), rng, entries);
            if (s.canPlayCard() && !input.endPlayPhase()) {
                return result(state, s, entries);
            }
        }
        return result(state, endPlayPhase(s, rng, entries), entries);
    }

    private QuarterGameState exchange(QuarterGameState s, QuarterInput input, List<LogEntry> entries) {
        Meter meter = requireMeter(input);
        if (input.amount() < 1) {
            throw new IllegalMoveException(COMPONENT, "Exchange amount must be positive, was " + input.amount());
        }
        int cost = ResourceState.exchangeCost(meter);
        int total = cost * input.amount();
        if (s.org().getMeter(meter) < total) {
            throw new IllegalMoveException(COMPONENT,
                "Insufficient " + meter + " for exchange (need " + total + ", have " + s.org().getMeter(meter) + ")");
        }

        OrgState org = s.org();
        ResourceState resources = s.resources();
        for (int i = 0; i < input.amount(); i++) {
            org = org.withMeterChange(meter, -cost);
            resources = resources.earn(1);
            entries.add(LogEntry.info("Exchanged " + cost + " " + meter + " for 1 PC"));
        }
        return s.withOrg(org).withResources(resources);
    }

    private QuarterGameState boost(QuarterGameState s, QuarterInput input, List<LogEntry> entries) {
        Meter meter = requireMeter(input);
        ResourceState resources = s.resources().spend(BOOST_COST);
        int oldValue = s.org().getMeter(meter);
        OrgState org = s.org().withMeterChange(meter, BOOST_AMOUNT);
        entries.add(LogEntry.info("Spent " + BOOST_COST + " PC to boost " + meter + ": "
            + oldValue + " → " + org.getMeter(meter)));
        return s.withOrg(org).withResources(resources);
    }

    private QuarterGameState schmooze(QuarterGameState s, RandomSource rng, List<LogEntry> entries) {
        ResourceState resources = s.resources().spend(SCHMOOZE_COST);
        boolean success = rng.nextInt(0, 100) >= SCHMOOZE_FAILURE_CHANCE;
        int change = success ? rng.nextInt(1, 6) : -rng.nextInt(1, 4);
        TenureState ceo = s.ceo().withFavorabilityChange(change);

        if (success) {
            entries.add(LogEntry.info("Board schmoozing successful! Favorability +" + change
                + "% (now " + ceo.favorability() + "%)"));
        } else {
            entries.add(LogEntry.info("Board schmoozing backfired! Favorability " + change
                + "% (now " + ceo.favorability() + "%)"));
        }
        return s.withResources(resources).withCeo(ceo);
    }

    private QuarterGameState reorg(QuarterGameState s, RandomSource rng, List<LogEntry> entries) {
        ResourceState resources = s.resources().spend(REORG_COST);
        CardDeck deck = s.cardDeck().discardAll(s.hand().cards());
        CardDeck.MultiDraw draw = deck.drawMultiple(CardHand.MAX_HAND_SIZE, rng);
        entries.add(LogEntry.info("Re-org complete! Spent " + REORG_COST + " PC, drew "
            + draw.cards().size() + " new project cards"));
        return s.withResources(resources)
            .withCardDeck(draw.deck())
            .withHand(CardHand.empty().withCardsAdded(draw.cards()));
    }

    private QuarterGameState redeemEvil(QuarterGameState s, List<LogEntry> entries) {
        if (s.ceo().evilScore() <= 0) {
            throw new IllegalMoveException(COMPONENT, "Evil score is already zero; nothing to redeem");
        }
        ResourceState resources = s.resources().spend(REDEMPTION_COST);
        TenureState ceo = s.ceo().withEvilScoreChange(-1);
        entries.add(LogEntry.info("Image rehabilitated! Spent " + REDEMPTION_COST + " PC, Evil -1 (now "
            + ceo.evilScore() + ")"));
        return s.withResources(resources).withCeo(ceo);
    }

    private QuarterGameState playCard(QuarterGameState state, String cardId, RandomSource rng,
                                      List<LogEntry> entries) {
        if (!state.hand().contains(cardId)) {
            throw new IllegalMoveException(COMPONENT, "Card " + cardId + " not in hand");
        }
        if (!state.canPlayCard()) {
            throw new IllegalMoveException(COMPONENT, "Cannot play more cards this quarter");
        }

        int q = state.quarterNumber();
        int position = state.cardsPlayedThisQuarter().size();
        QuarterGameState s = state;

        int pcCost = QuarterGameState.cardPcCost(position);
        if (pcCost > 0) {
            s = s.withResources(s.resources().spend(pcCost));
            entries.add(LogEntry.info("Card #" + (position + 1) + " cost: " + pcCost + " PC"));
        }

        PlayableCard card = s.hand().find(cardId);
        entries.add(LogEntry.info("Played: " + card.title()));

        int positionRisk = QuarterGameState.positionRisk(position);
        int affinity = card.affinityModifier(s.org());
        if (positionRisk > 0) {
            entries.add(LogEntry.info("Position risk: +" + positionRisk + "% bad outcome chance"));
        }
        if (affinity > 0) {
            entries.add(LogEntry.info("Strong " + card.meterAffinity() + ": -" + affinity + "% risk (affinity bonus)"));
        } else if (affinity < 0) {
            entries.add(LogEntry.info("Weak " + card.meterAffinity() + ": +" + (-affinity) + "% risk (affinity penalty)"));
        }

        OutcomeTier tier = OutcomeTier.EXPECTED;
        int profitDelta = 0;
        int fines = 0;

        if (!card.outcomes().effectsFor(OutcomeTier.EXPECTED).isEmpty()) {
            TenureState ceo = s.ceo();
            int synergy = s.affinitySynergyBonus(card);
            RollModifiers modifiers = new RollModifiers(
                s.org().alignment(), ceo.pressure(), ceo.evilScore(), positionRisk - affinity,
                q, ceo.momentumBonus(), synergy, card.isCorporate());
            tier = OutcomeResolver.roll(modifiers, rng);

            if (ceo.momentumBonus() > 0) {
                entries.add(LogEntry.info("Momentum: +" + ceo.momentumBonus() + "% good chance ("
                    + ceo.consecutiveSuccesses() + " streak)"));
            }
            if (synergy > 0) {
                entries.add(LogEntry.info("Affinity synergy: +" + synergy + "% good chance"));
            }
            int evilPath = OutcomeResolver.evilPathBonus(ceo.evilScore(), card.isCorporate());
            if (evilPath > 0) {
                entries.add(LogEntry.info("Evil path: +" + evilPath + "% good chance (Evil " + ceo.evilScore() + ")"));
            }
            entries.add(LogEntry.outcome(tier, card.title(), "played"));

            int target = BoardDirective.PROFIT_INCREASE.requiredAmount(ceo.pressure());
            int revenueBefore = s.revenueCardsPlayed();
            OrgState org = s.org();
            for (Effect effect : card.outcomes().effectsFor(tier)) {
                if (effect instanceof ProfitEffect p && card.isRevenue()) {
                    profitDelta += ProfitCalculator.scaleRevenueProfit(p.delta(), target, org.delivery(), revenueBefore);
                } else if (effect instanceof FineEffect f) {
                    fines += f.amount();
                }
                EffectResult applied = effect.apply(org);
                org = applied.org();
                entries.addAll(applied.entries());
            }
            s = s.withOrg(org);
        }

        int quarterProfitChange = profitDelta - fines;
        if (quarterProfitChange != 0) {
            s = s.withCeo(s.ceo().withCurrentQuarterProfitChange(quarterProfitChange));
            entries.add(LogEntry.info("Profit impact: " + ProfitCalculator.formatWithSign(quarterProfitChange)));
        }

        if (tier == OutcomeTier.GOOD) {
            TenureState ceo = s.ceo().withSuccessResult(true);
            s = s.withCeo(ceo);
            if (ceo.consecutiveSuccesses() >= 2) {
                entries.add(LogEntry.info("Momentum building: " + ceo.consecutiveSuccesses() + " consecutive successes!"));
            }
        } else if (tier == OutcomeTier.BAD) {
            if (s.ceo().consecutiveSuccesses() >= 2) {
                entries.add(LogEntry.info("Momentum lost!"));
            }
            s = s.withCeo(s.ceo().withSuccessResult(false));
        }

        if (card.isCorporate()) {
            s = s.withCeo(s.ceo()
                .withEvilScoreChange(card.corporateIntensity())
                .withFavorabilityChange(card.corporateIntensity()));
            entries.add(LogEntry.info("Corporate card: EvilScore +" + card.corporateIntensity()));
        }

        s = queueSituationFromCard(s, card, tier, rng, entries);

        s = s.withHand(s.hand().withCardRemoved(cardId))
            .withCardDeck(s.cardDeck().discard(card))
            .withCardPlayed(card)
            .withFollowUpQueued(new PendingFollowUp(card.cardId(), card.title(), card.cardId(), q, tier));

        log.debug("[QuarterEngine] Card played. quarter={} cardId={} tier={}", q, cardId, tier);
        return s;
    }

    private QuarterGameState queueSituationFromCard(QuarterGameState s, PlayableCard card, OutcomeTier tier,
                                                    RandomSource rng, List<LogEntry> entries) {
        int q = s.quarterNumber();
        Optional<PendingSituation> triggered = catalog.triggersFor(card.cardId())
            .flatMap(table -> SituationResolver.checkForTrigger(table, tier, q, rng, card.cardId()));
        if (triggered.isEmpty()) {
            triggered = SituationResolver.checkGenericTrigger(card.cardId(), tier, q, rng, card.cardId());
        }
        if (triggered.isEmpty()) {
            return s;
        }

        PendingSituation situation = triggered.get();
        Optional<SituationDefinition> definition = catalog.find(situation.situationId());
        if (definition.isEmpty()) {
            log.warn("[QuarterEngine] Trigger names unknown situation. situationId={} cardId={}",
                situation.situationId(), card.cardId());
            return s;
        }

        int delay = situation.scheduledQuarter() - q;
        if (delay == 0) {
            entries.add(LogEntry.event("Situation triggered: " + definition.get().title() + " (immediate)"));
        } else {
            entries.add(LogEntry.event("Situation brewing: " + definition.get().title() + " (Q+" + delay + ")"));
        }
        return s.withSituationQueued(situation);
    }

    private QuarterGameState endPlayPhase(QuarterGameState state, RandomSource rng, List<LogEntry> entries) {
        QuarterGameState s = state;
        int cardsPlayed = s.cardsPlayedThisQuarter().size();

        int restraint = ResourceState.restraintBonus(cardsPlayed);
        if (restraint > 0) {
            s = s.withResources(s.resources().earn(restraint));
            entries.add(LogEntry.info("Restraint bonus: +" + restraint + " PC (played " + cardsPlayed
                + " card" + (cardsPlayed != 1 ? "s" : "") + ")"));
        }

        if (s.revenueCardsPlayed() >= NEGLECT_REVENUE_CARDS) {
            OrgState org = s.org()
                .withMeterChange(Meter.MORALE, NEGLECT_METER_PENALTY)
                .withMeterChange(Meter.GOVERNANCE, NEGLECT_METER_PENALTY)
                .withMeterChange(Meter.ALIGNMENT, NEGLECT_METER_PENALTY);
            s = s.withOrg(org).withCeo(s.ceo().withFavorabilityChange(NEGLECT_FAVOR_PENALTY));
            entries.add(LogEntry.event("Organizational neglect: Revenue-only focus hurts meters ("
                + NEGLECT_METER_PENALTY + ") and board favor (" + NEGLECT_FAVOR_PENALTY + ")"));
        }

        if (cardsPlayed == 0 && s.hand().size() >= REFRESH_COUNT) {
            s = refreshHand(s, rng);
            entries.add(LogEntry.info("No projects executed - refreshed " + REFRESH_COUNT + " cards from hand"));
        }

        entries.add(LogEntry.info("Ending card play phase"));
        return s.withQuarter(s.quarter().nextPhase());
    }

    private QuarterGameState refreshHand(QuarterGameState s, RandomSource rng) {
        List<PlayableCard> shuffled = new ArrayList<>(s.hand().cards());
        rng.shuffle(shuffled);
        List<PlayableCard> replaced = shuffled.subList(0, REFRESH_COUNT);

        CardHand hand = s.hand();
        for (PlayableCard c : replaced) {
            hand = hand.withCardRemoved(c.cardId());
        }
        CardDeck.MultiDraw draw = s.cardDeck().discardAll(replaced).drawMultiple(REFRESH_COUNT, rng);
        return s.withCardDeck(draw.deck()).withHand(hand.withCardsAdded(draw.cards()));
    }

    // ── Crisis ─────────────────────────────────────────────────────

    private QuarterResult advanceCrisis(QuarterGameState state, QuarterInput input, RandomSource rng) {
        List<LogEntry> entries = new ArrayList<>();
        int q = state.quarterNumber();
        QuarterGameState s = state;

        if (!s.awaitingCrisisChoice()) {
            s = processFollowUps(s.withExpiredFollowUpsRemoved(), rng, entries);
            s = s.withDueDeferredPromoted(q);
            if (s.currentCrisis() == null) {
                s = surfaceDueSituation(s, entries);
            }
        }

        if (s.currentCrisis() == null) {
            entries.add(LogEntry.info("No situations requiring attention this quarter."));
            return result(state, s.withQuarter(s.quarter().nextPhase()), entries);
        }

        EventCard card = s.currentCrisis();
        if (!input.hasChoice()) {
            if (!s.awaitingCrisisChoice()) {
                entries.add(LogEntry.event("Crisis: " + card.title()));
                entries.add(LogEntry.info("Awaiting response..."));
            }
            return result(state, s.withAwaitingCrisisChoice(true), entries);
        }

        Choice choice = card.getChoice(input.choiceId());
        entries.add(LogEntry.info("[" + card.title() + "] Response: " + choice.label()));

        if (choice.requiresCapital()) {
            s = s.withResources(s.resources().spend(choice.pcCost()));
            entries.add(LogEntry.info("Spent " + choice.pcCost() + " PC to handle the situation"));
        }

        List<Effect> effects;
        if (choice.isTiered()) {
            OutcomeTier tier = OutcomeResolver.rollCrisisChoice(choice.pcCost(), choice.corporateIntensityDelta(), rng);
            effects = choice.outcomeProfile().effectsFor(tier);
            entries.add(LogEntry.info("Outcome: " + tier));
        } else {
            effects = choice.effects();
        }

        EffectPipeline.Result applied = EffectPipeline.apply(effects, s.org());
        s = s.withOrg(applied.org());
        entries.addAll(applied.entries());

        int profitChange = applied.profitEffects().stream().mapToInt(ProfitEffect::delta).sum() - applied.fineTotal();
        if (profitChange != 0) {
            s = s.withCeo(s.ceo().withCurrentQuarterProfitChange(profitChange));
            entries.add(LogEntry.info("Profit impact: " + ProfitCalculator.formatWithSign(profitChange)));
        }

        if (choice.isCorporate()) {
            int intensity = choice.corporateIntensityDelta();
            s = s.withCeo(s.ceo().withEvilScoreChange(intensity).withFavorabilityChange(intensity));
            entries.add(LogEntry.info("Corporate choice: EvilScore +" + intensity + ", Favorability +" + intensity));
        }

        PendingSituation situation = s.currentSituation();
        if (situation != null) {
            Optional<SituationDefinition> definition = catalog.find(situation.situationId());
            if (definition.isPresent() && definition.get().isDeferChoice(choice.choiceId())) {
                s = s.withSituationDeferred(situation);
                entries.add(LogEntry.info("Deferred: " + card.title() + " (returns Q" + (q + 1) + ")"));
            }
        }

        log.debug("[QuarterEngine] Crisis resolved. quarter={} eventId={} choiceId={}", q, card.eventId(), choice.choiceId());
        return result(state, s.withCrisisCleared().withQuarter(s.quarter().nextPhase()), entries);
    }

    private QuarterGameState processFollowUps(QuarterGameState state, RandomSource rng, List<LogEntry> entries) {
        int q = state.quarterNumber();
        QuarterGameState s = state;

        for (FollowUpResult r : FollowUpResolver.checkAll(s.pendingFollowUps(), q, rng)) {
            PendingFollowUp followUp = r.followUp();
            switch (r.type()) {
                case GOOD, MEH -> {
                    EffectPipeline.Result applied = EffectPipeline.apply(r.effects(), s.org());
                    s = s.withOrg(applied.org());
                    entries.add(LogEntry.info((r.type() == FollowUpType.GOOD
                        ? "Good news on " : "Update on ") + followUp.cardTitle()));
                    entries.addAll(applied.entries());
                }
                case CRISIS -> {
                    if (r.situationId() != null) {
                        s = s.withSituationQueued(PendingSituation.create(
                            r.situationId(), followUp.cardId(), q, 0, followUp.threadId()));
                        entries.add(LogEntry.event("Crisis brewing from " + followUp.cardTitle()));
                    }
                }
            }
            s = s.withFollowUpRemoved(followUp);
        }
        return s;
    }

    private QuarterGameState surfaceDueSituation(QuarterGameState s, List<LogEntry> entries) {
        int q = s.quarterNumber();
        for (PendingSituation pending : s.pendingSituations()) {
            if (!pending.isDueAt(q)) {
                continue;
            }
            Optional<SituationDefinition> definition = catalog.find(pending.situationId());
            if (definition.isEmpty()) {
                log.warn("[QuarterEngine] Dropping unknown situation. situationId={}", pending.situationId());
                return s.withSituationSurfaced(pending);
            }
            SituationDefinition def = definition.get();
            entries.add(LogEntry.event("Situation erupts: " + def.title()));
            if (pending.deferCount() > 0) {
                entries.add(LogEntry.info("Severity escalated to " + def.effectiveSeverity(pending.deferCount())
                    + " after " + pending.deferCount() + " deferral(s)"));
            }
            return s.withSituationSurfaced(pending)
                .withCurrentCrisis(def.toEventCard(pending.deferCount()), pending);
        }
        return s;
    }

    // ── Resolution ─────────────────────────────────────────────────

    private QuarterResult advanceResolution(QuarterGameState state, QuarterInput input, RandomSource rng) {
        List<LogEntry> entries = new ArrayList<>();
        int q = state.quarterNumber();
        DifficultySettings difficulty = state.difficulty();

        if (input.retire() && state.ceo().canRetire(difficulty)) {
            TenureState retired = state.ceo().withRetirement();
            int score = ScoreCalculator.finalScore(retired, state.resources());
            entries.add(LogEntry.event("CEO RETIRES IN GLORY!"));
            entries.add(LogEntry.info("Final Score: " + score));
            log.info("[QuarterEngine] CEO retired. quarter={} finalScore={}", q, score);
            return result(state, state.withCeo(retired), entries);
        }

        entries.add(LogEntry.info("Quarter " + q + " Resolution"));

        TenureState ceo = state.ceo();
        OrgState org = state.org();

        // crisis ledger
        for (Map.Entry<Meter, Integer> impact : state.crises().totalOngoingImpact().entrySet()) {
            org = org.withMeterChange(impact.getKey(), impact.getValue());
            if (impact.getValue() != 0) {
                entries.add(LogEntry.info("Crisis ongoing impact: " + impact.getKey() + " " + signed(impact.getValue())));
            }
        }
        CrisisState.DeadlineResult deadlines = state.crises().processDeadlines(q);
        for (CrisisInstance expired : deadlines.expired()) {
            entries.add(LogEntry.event("Crisis expired: " + expired.title()));
            for (Map.Entry<Meter, Integer> impact : expired.baseImpact().entrySet()) {
                org = org.withMeterChange(impact.getKey(), impact.getValue());
                entries.add(LogEntry.meterChange(impact.getKey(), impact.getValue()));
            }
        }

        org = passiveRecovery(org, entries);

        // profit
        int cardsPlayed = state.cardsPlayedThisQuarter().size();
        int baseOperations = ProfitCalculator.baseOperations(org, rng, ceo.quartersSurvived());
        int projectImpact = ceo.currentQuarterProfit();
        int profit = ProfitCalculator.total(baseOperations, projectImpact);

        if (cardsPlayed > 0) {
            entries.add(LogEntry.info("Projects Completed: " + cardsPlayed));
            for (PlayableCard c : state.cardsPlayedThisQuarter()) {
                entries.add(LogEntry.info("  • " + c.title()));
            }
        } else {
            entries.add(LogEntry.info("Projects Completed: 0 (no strategic initiatives)"));
        }
        entries.add(LogEntry.info("Base Operations: " + ProfitCalculator.formatWithSign(baseOperations)));
        if (projectImpact != 0) {
            entries.add(LogEntry.info("Project Impact: " + ProfitCalculator.formatWithSign(projectImpact)));
        }
        entries.add(LogEntry.info("Total Quarterly Profit: " + ProfitCalculator.format(profit)));

        int profitDelta = profit - ceo.lastQuarterProfit();
        org = performanceEffects(org, profitDelta, rng, entries);
        if (cardsPlayed > 0) {
            org = deliveryEffects(org, profit, rng, entries);
        }

        // directive
        BoardDirective directive = state.currentDirective() == null
            ? BoardDirective.PROFIT_INCREASE : state.currentDirective();
        boolean directiveMet = directive.isMet(ceo.lastQuarterProfit(), profit, ceo.pressure());
        boolean weakQuarter = cardsPlayed == 0 || ceo.currentQuarterProfit() <= 0;
        if (directiveMet && weakQuarter && ceo.consecutiveWeakProjectQuarters() >= 1) {
            directiveMet = false;
            entries.add(LogEntry.event("Board Override: Sustained lack of strategic initiative"));
        }
        entries.add(LogEntry.info((directiveMet ? "Directive Met: " : "Directive Failed: ")
            + directive.description(ceo.pressure())));

        int favChange = favorabilityChange(ceo, org, profit, directiveMet, cardsPlayed, difficulty, entries);

        // bonus
        int bonus;
        if (cardsPlayed == 0) {
            bonus = 0;
            entries.add(LogEntry.info("No Bonus: No strategic initiatives executed this quarter"));
        } else {
            ScoreCalculator.QuarterlyBonus quarterly = ScoreCalculator.quarterlyBonus(ceo, org, directiveMet, profitDelta);
            bonus = quarterly.amount();
            entries.add(LogEntry.info("Quarterly Bonus: " + ProfitCalculator.format(bonus)));
            for (String reason : quarterly.reasons()) {
                entries.add(LogEntry.info("  " + reason));
            }
        }

        TenureState newCeo = ceo
            .withProfitAdded(profit)
            .withProfitRecorded(profit)
            .withProjectPerformanceRecorded(projectImpact)
            .withCardsPlayedRecorded(cardsPlayed)
            .withFavorabilityChange(favChange)
            .withQuarterComplete()
            .withBonusAwarded(bonus)
            .withEvilSnapshotForQuarter()
            .withQuarterProfitClosed(profit);

        org = exceptionalRewards(org, directiveMet, profitDelta, bonus, rng, entries);

        SurvivalCalculator.VoteInput vote = new SurvivalCalculator.VoteInput(
            newCeo.favorability(), newCeo.pressure(), newCeo.quartersSurvived(), newCeo.evilScore(),
            directiveMet, profit >= 0, newCeo.isProfitImproving(),
            newCeo.consecutiveNegativeQuarters(), newCeo.consecutiveWeakProjectQuarters(), cardsPlayed);
        if (SurvivalCalculator.rollForOuster(vote, rng)) {
            TenureState ousted = newCeo.withOusted();
            entries.add(LogEntry.event("CEO OUSTED! Golden Parachute: " + ProfitCalculator.format(ousted.parachutePayout())));
            log.info("[QuarterEngine] CEO ousted. quarter={} favorability={} risk={}%",
                q, ousted.favorability(), SurvivalCalculator.riskPercent(vote));
            QuarterGameState terminal = state.withCeo(ousted)
                .withOrg(org)
                .withCrises(deadlines.state())
                .withCrisisCleared();
            return result(state, terminal, entries);
        }

        entries.add(LogEntry.info("Survived Quarter " + q + ". Favorability: " + newCeo.favorability()
            + ", Pressure: " + newCeo.pressure()));
        if (newCeo.canRetire(difficulty)) {
            entries.add(LogEntry.event("RETIREMENT AVAILABLE! Accumulated Bonus: "
                + ProfitCalculator.format(newCeo.accumulatedBonus())));
        } else {
            entries.add(LogEntry.info("Accumulated Bonus: " + ProfitCalculator.format(newCeo.accumulatedBonus())
                + " (" + ProfitCalculator.format(difficulty.retirementThreshold()) + " to retire)"));
        }

        ResourceState resources = state.resources().withEndOfQuarterAdjustments(org);
        int pcDelta = resources.politicalCapital() - state.resources().politicalCapital();
        if (pcDelta != 0) {
            entries.add(LogEntry.info("Political Capital: " + signed(pcDelta) + " (now " + resources.politicalCapital() + ")"));
        }

        CardDeck.MultiDraw refill = state.cardDeck().drawMultiple(CardHand.MAX_HAND_SIZE - state.hand().size(), rng);
        QuarterGameState next = state
            .withOrg(org)
            .withCeo(newCeo)
            .withQuarter(state.quarter().nextPhase())
            .withCardDeck(refill.deck())
            .withHand(state.hand().withCardsAdded(refill.cards()))
            .withPlayedCardsCleared()
            .withCurrentDirective(BoardDirective.generate(newCeo.pressure(), rng))
            .withResources(resources)
            .withCrises(deadlines.state());

        log.info("[QuarterEngine] Resolution complete. quarter={} profit={} favorability={} pressure={}",
            q, profit, newCeo.favorability(), newCeo.pressure());
        return result(state, next, entries);
    }

    private int favorabilityChange(TenureState ceo, OrgState org, int profit, boolean directiveMet,
                                   int cardsPlayed, DifficultySettings difficulty, List<LogEntry> entries) {
        int change = FavorabilityCalculator.calculate(
            ceo.lastQuarterProfit(), profit, directiveMet, ceo.pressure(), ceo.evilScore(),
            ceo.consecutiveWeakProjectQuarters(), ceo.quartersSurvived(), difficulty);
        int decay = FavorabilityCalculator.tenureDecay(ceo.quartersSurvived(), difficulty);
        change += decay;

        if (cardsPlayed == 0 && change > 0) {
            change = 0;
            entries.add(LogEntry.info("Board unimpressed: No strategic initiatives executed"));
        }
        entries.add(LogEntry.info("Board Favorability: " + signed(change)));
        if (decay < 0) {
            entries.add(LogEntry.info("Board expectations risen (" + decay + " tenure adjustment)"));
        }

        if (cardsPlayed > 0) {
            change += 1;
            entries.add(LogEntry.info("Initiative Bonus: +1 Favor (active leadership)"));
        }

        change = applyAdjustment(change, FavorabilityCalculator.lowMeterAdjustment(org), "Board Concern", entries);
        change = applyAdjustment(change,
            FavorabilityCalculator.lowActivityAdjustment(cardsPlayed, ceo.quartersSurvived()), "Activity Concern", entries);
        return change;
    }

    private static int applyAdjustment(int change, FavorAdjustment adjustment, String label, List<LogEntry> entries) {
        if (adjustment.penalty() != 0) {
            entries.add(LogEntry.info(label + ": " + adjustment.reason() + " (" + signed(adjustment.penalty()) + ")"));
        }
        int adjusted = adjustment.applyTo(change);
        if (adjustment.isCapped() && adjusted < change + adjustment.penalty()) {
            entries.add(LogEntry.info("Favor capped: " + adjustment.reason() + " (was "
                + signed(change + adjustment.penalty()) + ", now " + signed(adjusted) + ")"));
        }
        return adjusted;
    }

    /** Lifts the three lowest meters toward the middle band. */
    static OrgState passiveRecovery(OrgState org, List<LogEntry> entries) {
        List<Meter> sorted = org.metersByValue();
        OrgState result = org;
        List<String> recoveries = new ArrayList<>();

        Meter lowest = sorted.get(0);
        int lowestValue = org.getMeter(lowest);
        if (lowestValue < 50) {
            int boost = Math.min(5, 50 - lowestValue);
            result = result.withMeterChange(lowest, boost);
            recoveries.add(lowest + " +" + boost);
        } else if (lowestValue < 60) {
            result = result.withMeterChange(lowest, 3);
            recoveries.add(lowest + " +3");
        }

        Meter second = sorted.get(1);
        if (org.getMeter(second) < 45) {
            int boost = Math.min(3, 45 - org.getMeter(second));
            result = result.withMeterChange(second, boost);
            recoveries.add(second + " +" + boost);
        }

        Meter third = sorted.get(2);
        if (org.getMeter(third) < 35) {
            int boost = Math.min(2, 35 - org.getMeter(third));
            result = result.withMeterChange(third, boost);
            recoveries.add(third + " +" + boost);
        }

        if (!recoveries.isEmpty()) {
            entries.add(LogEntry.info("Org stabilization: " + String.join(", ", recoveries)));
        }
        return result;
    }

    private static OrgState performanceEffects(OrgState org, int profitDelta, RandomSource rng, List<LogEntry> entries) {
        if (profitDelta >= 15) {
            int morale = rng.nextInt(2, 7);
            int alignment = rng.nextInt(1, 5);
            int runway = rng.nextInt(2, 6);
            entries.add(LogEntry.info("Excellent results! Morale +" + morale + ", Alignment +" + alignment
                + ", Runway +" + runway));
            return shiftSentiment(org, morale, alignment, runway);
        }
        if (profitDelta >= 5) {
            int morale = rng.nextInt(1, 4);
            int alignment = rng.nextInt(0, 3);
            int runway = rng.nextInt(1, 4);
            entries.add(LogEntry.info("Good results! " + describe(morale, alignment, runway, "+")));
            return shiftSentiment(org, morale, alignment, runway);
        }
        if (profitDelta <= -15) {
            int morale = rng.nextInt(2, 7);
            int alignment = rng.nextInt(1, 5);
            int runway = rng.nextInt(2, 6);
            entries.add(LogEntry.info("Poor results! Morale -" + morale + ", Alignment -" + alignment
                + ", Runway -" + runway));
            return shiftSentiment(org, -morale, -alignment, -runway);
        }
        if (profitDelta <= -5) {
            int morale = rng.nextInt(1, 4);
            int alignment = rng.nextInt(0, 3);
            int runway = rng.nextInt(1, 4);
            entries.add(LogEntry.info("Disappointing results: " + describe(morale, alignment, runway, "-")));
            return shiftSentiment(org, -morale, -alignment, -runway);
        }
        return org;
    }

    private static OrgState shiftSentiment(OrgState org, int morale, int alignment, int runway) {
        return org.withMeterChange(Meter.MORALE, morale)
            .withMeterChange(Meter.ALIGNMENT, alignment)
            .withMeterChange(Meter.RUNWAY, runway);
    }

    private static String describe(int morale, int alignment, int runway, String sign) {
        List<String> parts = new ArrayList<>();
        parts.add("Morale " + sign + morale);
        if (alignment > 0) parts.add("Alignment " + sign + alignment);
        parts.add("Runway " + sign + runway);
        return String.join(", ", parts);
    }

    /** Delivery reacts to the quarter's profit once projects were run; the deeper loss is checked first. */
    private static OrgState deliveryEffects(OrgState org, int profit, RandomSource rng, List<LogEntry> entries) {
        if (profit >= 20) {
            int boost = rng.nextInt(2, 7);
            entries.add(LogEntry.info("Strong project execution! Delivery +" + boost));
            return org.withMeterChange(Meter.DELIVERY, boost);
        }
        if (profit >= 10) {
            int boost = rng.nextInt(1, 4);
            entries.add(LogEntry.info("Solid project execution. Delivery +" + boost));
            return org.withMeterChange(Meter.DELIVERY, boost);
        }
        if (profit <= -20) {
            int penalty = rng.nextInt(2, 7);
            entries.add(LogEntry.info("Project failures impacting operations. Delivery -" + penalty));
            return org.withMeterChange(Meter.DELIVERY, -penalty);
        }
        if (profit <= -10) {
            int penalty = rng.nextInt(1, 4);
            entries.add(LogEntry.info("Project execution issues. Delivery -" + penalty));
            return org.withMeterChange(Meter.DELIVERY, -penalty);
        }
        return org;
    }

    /**
     * 40% chance of a discretionary award after an exceptional quarter
     * (bonus of 10+ with the directive met) or growth of 30+.
     */
    private static OrgState exceptionalRewards(OrgState org, boolean directiveMet, int profitDelta, int bonus,
                                               RandomSource rng, List<LogEntry> entries) {
        boolean exceptional = bonus >= 10 && directiveMet;
        boolean outstandingGrowth = profitDelta >= 30;
        if (!exceptional && !outstandingGrowth) {
            return org;
        }
        if (rng.nextInt(0, 100) >= 40) {
            return org;
        }

        OrgState result = org;
        if (outstandingGrowth) {
            int reward = rng.nextInt(3, 8);
            result = result.withMeterChange(Meter.RUNWAY, reward);
            entries.add(LogEntry.info("Board Award: +" + reward + " " + Meter.RUNWAY));
        }
        if (exceptional) {
            Meter lowest = org.metersByValue().get(0);
            if (org.getMeter(lowest) < 70) {
                int reward = rng.nextInt(2, 6);
                result = result.withMeterChange(lowest, reward);
                entries.add(LogEntry.info("Board Award: +" + reward + " " + lowest));
            }
        }
        return result;
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static Meter requireMeter(QuarterInput input) {
        if (input.meter() == null) {
            throw new IllegalMoveException(COMPONENT, input.action() + " requires a meter");
        }
        return input.meter();
    }

    private static String signed(int value) {
        return value > 0 ? "+" + value : String.valueOf(value);
    }

    private static QuarterResult result(QuarterGameState before, QuarterGameState after, List<LogEntry> entries) {
        QuarterPhase phase = before.quarter().phase();
        return new QuarterResult(after, new QuarterLog(before.quarterNumber(), phase, entries));
    }
}
