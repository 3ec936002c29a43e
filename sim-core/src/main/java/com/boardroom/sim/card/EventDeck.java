package com.boardroom.sim.card;

import com.boardroom.sim.random.RandomSource;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable crisis deck. A drawn card moves straight to the discard pile;
 * an exhausted draw pile is refilled by shuffling the discards.
 */
public record EventDeck(
    @JsonProperty("drawPile")    List<EventCard> drawPile,
    @JsonProperty("discardPile") List<EventCard> discardPile
) {

    public EventDeck {
        drawPile = drawPile == null ? List.of() : List.copyOf(drawPile);
        discardPile = discardPile == null ? List.of() : List.copyOf(discardPile);
    }

    public record Draw(EventDeck deck, EventCard card) {}

    public static EventDeck empty() {
        return new EventDeck(List.of(), List.of());
    }

    public static EventDeck create(List<EventCard> cards, RandomSource rng) {
        List<EventCard> shuffled = new ArrayList<>(cards);
        rng.shuffle(shuffled);
        return new EventDeck(shuffled, List.of());
    }

    public int totalCards() {
        return drawPile.size() + discardPile.size();
    }

    /**
     * Draws the top card, reshuffling the discard pile first when the draw
     * pile is empty.
     *
     * @throws IllegalStateException when the deck holds no cards at all
     */
    public Draw drawWithReshuffle(RandomSource rng) {
        if (totalCards() == 0) {
            throw new IllegalStateException("Cannot draw from an empty crisis deck");
        }
        List<EventCard> draw = new ArrayList<>(drawPile);
        List<EventCard> discard = new ArrayList<>(discardPile);
        if (draw.isEmpty()) {
            draw.addAll(discard);
            discard.clear();
            rng.shuffle(draw);
        }
        EventCard top = draw.remove(0);
        discard.add(top);
        return new Draw(new EventDeck(draw, discard), top);
    }
}
