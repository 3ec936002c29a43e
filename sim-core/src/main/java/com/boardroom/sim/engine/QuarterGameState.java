package com.boardroom.sim.engine;

import com.boardroom.sim.card.CardDeck;
import com.boardroom.sim.card.CardHand;
import com.boardroom.sim.card.EventCard;
import com.boardroom.sim.card.EventDeck;
import com.boardroom.sim.card.PlayableCard;
import com.boardroom.sim.config.DifficultySettings;
import com.boardroom.sim.crisis.CrisisState;
import com.boardroom.sim.directive.BoardDirective;
import com.boardroom.sim.economy.ResourceState;
import com.boardroom.sim.model.OrgState;
import com.boardroom.sim.model.QuarterCursor;
import com.boardroom.sim.model.TenureState;
import com.boardroom.sim.situation.PendingFollowUp;
import com.boardroom.sim.situation.PendingSituation;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Complete, immutable snapshot of a game between two {@link QuarterEngine#advance} calls.
 *
 * <p>Every transition returns a new instance through a {@code with*} copy-factory;
 * the original is never mutated. The snapshot is self-contained (difficulty
 * included) so a saved game resumes without any global configuration.
 *
 * <h3>Nullable fields</h3>
 * <ul>
 *   <li>{@code currentCrisis}    — event card awaiting a response in the Crisis phase</li>
 *   <li>{@code currentSituation} — queue entry behind {@code currentCrisis} when it came from a situation</li>
 * </ul>
 *
 * <h3>Situation queues</h3>
 * <ul>
 *   <li>{@code pendingSituations}  — surface in the first Crisis phase at or after their scheduled quarter</li>
 *   <li>{@code deferredSituations} — put aside by the player; at most {@value #MAX_DEFERRED_SITUATIONS},
 *       the oldest is pushed back to pending on overflow</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuarterGameState(
    @JsonProperty("seed")                   long seed,
    @JsonProperty("difficulty")             DifficultySettings difficulty,
    @JsonProperty("org")                    OrgState org,
    @JsonProperty("quarter")                QuarterCursor quarter,
    @JsonProperty("ceo")                    TenureState ceo,
    @JsonProperty("resources")              ResourceState resources,
    @JsonProperty("crisisDeck")             EventDeck crisisDeck,
    @JsonProperty("cardDeck")               CardDeck cardDeck,
    @JsonProperty("hand")                   CardHand hand,
    @JsonProperty("cardsPlayedThisQuarter") List<PlayableCard> cardsPlayedThisQuarter,
    @JsonProperty("currentDirective")       BoardDirective currentDirective,
    @JsonProperty("currentCrisis")          EventCard currentCrisis,
    @JsonProperty("currentSituation")       PendingSituation currentSituation,
    @JsonProperty("awaitingCrisisChoice")   boolean awaitingCrisisChoice,
    @JsonProperty("crises")                 CrisisState crises,
    @JsonProperty("pendingSituations")      List<PendingSituation> pendingSituations,
    @JsonProperty("deferredSituations")     List<PendingSituation> deferredSituations,
    @JsonProperty("pendingFollowUps")       List<PendingFollowUp> pendingFollowUps
) {

    public static final int MAX_CARDS_PER_QUARTER = 3;
    public static final int MAX_DEFERRED_SITUATIONS = 5;

    public QuarterGameState {
        cardsPlayedThisQuarter = cardsPlayedThisQuarter == null ? List.of() : List.copyOf(cardsPlayedThisQuarter);
        crises = crises == null ? CrisisState.empty() : crises;
        crisisDeck = crisisDeck == null ? EventDeck.empty() : crisisDeck;
        pendingSituations = pendingSituations == null ? List.of() : List.copyOf(pendingSituations);
        deferredSituations = deferredSituations == null ? List.of() : List.copyOf(deferredSituations);
        pendingFollowUps = pendingFollowUps == null ? List.of() : List.copyOf(pendingFollowUps);
    }

    // ── Derived ────────────────────────────────────────────────────

    @JsonIgnore
    public boolean isTerminal() {
        return ceo.isTerminal();
    }

    public int quarterNumber() {
        return quarter.quarterNumber();
    }

    public boolean canPlayCard() {
        return cardsPlayedThisQuarter.size() < MAX_CARDS_PER_QUARTER && !hand.isEmpty();
    }

    /** Projects are free at every position. */
    public static int cardPcCost(int position) {
        return 0;
    }

    /** Extra Bad weight for the 1st, 2nd and 3rd project of a quarter. */
    public static int positionRisk(int position) {
        return switch (position) {
            case 0 -> 0;
            case 1 -> 10;
            case 2 -> 20;
            default -> throw new IllegalArgumentException("Invalid card position: " + position);
        };
    }

    /** +5 when one earlier card this quarter shares the affinity, +10 for two or more. */
    public int affinitySynergyBonus(PlayableCard card) {
        if (card.meterAffinity() == null) return 0;
        long matching = cardsPlayedThisQuarter.stream()
            .filter(c -> c.meterAffinity() == card.meterAffinity())
            .count();
        if (matching >= 2) return 10;
        if (matching == 1) return 5;
        return 0;
    }

    public int revenueCardsPlayed() {
        return (int) cardsPlayedThisQuarter.stream().filter(PlayableCard::isRevenue).count();
    }

    // ── Copy-factories ─────────────────────────────────────────────

    public QuarterGameState withOrg(OrgState org) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withQuarter(QuarterCursor quarter) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCeo(TenureState ceo) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withResources(ResourceState resources) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCrisisDeck(EventDeck crisisDeck) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCardDeck(CardDeck cardDeck) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withHand(CardHand hand) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCardPlayed(PlayableCard card) {
        List<PlayableCard> played = new ArrayList<>(cardsPlayedThisQuarter);
        played.add(card);
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            played, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withPlayedCardsCleared() {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            List.of(), currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCurrentDirective(BoardDirective directive) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, directive, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    /** Sets the crisis card and the situation it came from ({@code null} for a crisis-deck draw). */
    public QuarterGameState withCurrentCrisis(EventCard card, PendingSituation situation) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, card, situation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCrisisCleared() {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, null, null, false,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withAwaitingCrisisChoice(boolean awaiting) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaiting,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    public QuarterGameState withCrises(CrisisState crises) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, pendingFollowUps);
    }

    // ── Situation queues ───────────────────────────────────────────

    public QuarterGameState withSituationQueued(PendingSituation situation) {
        List<PendingSituation> pending = new ArrayList<>(pendingSituations);
        pending.add(situation);
        return withSituationQueues(pending, deferredSituations);
    }

    /** Removes one entry from the pending queue. */
    public QuarterGameState withSituationSurfaced(PendingSituation situation) {
        List<PendingSituation> pending = new ArrayList<>(pendingSituations);
        pending.remove(situation);
        return withSituationQueues(pending, deferredSituations);
    }

    /**
     * Moves a situation to the deferred list, rescheduled to next quarter with
     * its defer count incremented. On overflow the entry queued earliest is
     * returned to the pending list, scheduled for next quarter.
     */
    public QuarterGameState withSituationDeferred(PendingSituation situation) {
        int q = quarterNumber();
        List<PendingSituation> pending = new ArrayList<>(pendingSituations);
        pending.remove(situation);
        List<PendingSituation> deferred = new ArrayList<>(deferredSituations);
        deferred.add(situation.withDeferred(q));

        if (deferred.size() > MAX_DEFERRED_SITUATIONS) {
            PendingSituation oldest = deferred.stream()
                .min(Comparator.comparingInt(PendingSituation::queuedAtQuarter))
                .orElseThrow();
            deferred.remove(oldest);
            pending.add(oldest.withScheduledQuarter(q + 1));
        }
        return withSituationQueues(pending, deferred);
    }

    /** Returns deferred situations that are due at {@code quarter} to the pending list. */
    public QuarterGameState withDueDeferredPromoted(int quarter) {
        List<PendingSituation> pending = new ArrayList<>(pendingSituations);
        List<PendingSituation> deferred = new ArrayList<>();
        for (PendingSituation s : deferredSituations) {
            if (s.isDueAt(quarter)) {
                pending.add(s);
            } else {
                deferred.add(s);
            }
        }
        return withSituationQueues(pending, deferred);
    }

    private QuarterGameState withSituationQueues(List<PendingSituation> pending, List<PendingSituation> deferred) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pending, deferred, pendingFollowUps);
    }

    // ── Follow-ups ─────────────────────────────────────────────────

    public QuarterGameState withFollowUpQueued(PendingFollowUp followUp) {
        List<PendingFollowUp> followUps = new ArrayList<>(pendingFollowUps);
        followUps.add(followUp);
        return withFollowUps(followUps);
    }

    public QuarterGameState withFollowUpRemoved(PendingFollowUp followUp) {
        List<PendingFollowUp> followUps = new ArrayList<>(pendingFollowUps);
        followUps.remove(followUp);
        return withFollowUps(followUps);
    }

    public QuarterGameState withExpiredFollowUpsRemoved() {
        int q = quarterNumber();
        return withFollowUps(pendingFollowUps.stream().filter(f -> !f.hasExpired(q)).toList());
    }

    private QuarterGameState withFollowUps(List<PendingFollowUp> followUps) {
        return new QuarterGameState(seed, difficulty, org, quarter, ceo, resources, crisisDeck, cardDeck, hand,
            cardsPlayedThisQuarter, currentDirective, currentCrisis, currentSituation, awaitingCrisisChoice,
            crises, pendingSituations, deferredSituations, followUps);
    }
}
