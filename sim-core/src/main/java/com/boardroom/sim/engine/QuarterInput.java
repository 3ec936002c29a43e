package com.boardroom.sim.engine;

import com.boardroom.sim.model.Meter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Player input for one {@link QuarterEngine#advance} call.
 *
 * <p>Which fields matter depends on the phase:
 * <ul>
 *   <li><b>PlayCards</b> — {@code action} selects a card play or an economy action;
 *       {@code endPlayPhase} closes the phase after a card play (or on its own)</li>
 *   <li><b>Crisis</b> — {@code choiceId} answers the current crisis</li>
 *   <li><b>Resolution</b> — {@code retire} ends the game when eligible</li>
 * </ul>
 * Demand takes no decision. Fields that belong to another phase are rejected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuarterInput(
    @JsonProperty("action")       Action action,
    @JsonProperty("cardId")       String cardId,
    @JsonProperty("endPlayPhase") boolean endPlayPhase,
    @JsonProperty("choiceId")     String choiceId,
    @JsonProperty("meter")        Meter meter,
    @JsonProperty("amount")       int amount,
    @JsonProperty("retire")       boolean retire
) {

    /** PlayCards-phase actions. */
    public enum Action {
        PLAY_CARD,
        EXCHANGE,
        BOOST,
        SCHMOOZE,
        REORG,
        REDEEM_EVIL
    }

    public QuarterInput {
        action = action == null ? Action.PLAY_CARD : action;
    }

    /** No decision; advances phases that need none. */
    public static QuarterInput none() {
        return new QuarterInput(null, null, false, null, null, 0, false);
    }

    public static QuarterInput playCard(String cardId) {
        return new QuarterInput(Action.PLAY_CARD, cardId, false, null, null, 0, false);
    }

    public static QuarterInput playCardAndEnd(String cardId) {
        return new QuarterInput(Action.PLAY_CARD, cardId, true, null, null, 0, false);
    }

    /** Closes the play phase without playing a card. */
    public static QuarterInput endPlay() {
        return new QuarterInput(Action.PLAY_CARD, null, true, null, null, 0, false);
    }

    public static QuarterInput choose(String choiceId) {
        return new QuarterInput(null, null, false, choiceId, null, 0, false);
    }

    /** Converts {@code amount} lots of the meter into 1 PC each. */
    public static QuarterInput exchange(Meter meter, int amount) {
        return new QuarterInput(Action.EXCHANGE, null, false, null, meter, amount, false);
    }

    public static QuarterInput boost(Meter meter) {
        return new QuarterInput(Action.BOOST, null, false, null, meter, 0, false);
    }

    public static QuarterInput schmooze() {
        return new QuarterInput(Action.SCHMOOZE, null, false, null, null, 0, false);
    }

    public static QuarterInput reorg() {
        return new QuarterInput(Action.REORG, null, false, null, null, 0, false);
    }

    public static QuarterInput redeemEvil() {
        return new QuarterInput(Action.REDEEM_EVIL, null, false, null, null, 0, false);
    }

    public static QuarterInput retireNow() {
        return new QuarterInput(null, null, false, null, null, 0, true);
    }

    public boolean hasCard() {
        return cardId != null && !cardId.isBlank();
    }

    public boolean hasChoice() {
        return choiceId != null && !choiceId.isBlank();
    }
}
