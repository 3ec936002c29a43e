package com.boardroom.sim.card;

import com.boardroom.sim.exception.IllegalMoveException;
import com.boardroom.sim.random.RandomSource;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable project deck: a draw pile (top is index 0) and a discard pile.
 * Drawing from an empty draw pile first reshuffles the discard pile into it.
 */
public record CardDeck(
    @JsonProperty("drawPile")    List<PlayableCard> drawPile,
    @JsonProperty("discardPile") List<PlayableCard> discardPile
) {

    public CardDeck {
        drawPile = drawPile == null ? List.of() : List.copyOf(drawPile);
        discardPile = discardPile == null ? List.of() : List.copyOf(discardPile);
    }

    /** Result of a single draw. */
    public record Draw(CardDeck deck, PlayableCard card) {}

    /** Result of drawing several cards; may hold fewer cards than requested. */
    public record MultiDraw(CardDeck deck, List<PlayableCard> cards) {}

    public static CardDeck create(List<PlayableCard> cards, RandomSource rng) {
        List<PlayableCard> shuffled = new ArrayList<>(cards);
        rng.shuffle(shuffled);
        return new CardDeck(shuffled, List.of());
    }

    public int totalCards() {
        return drawPile.size() + discardPile.size();
    }

    public Draw draw(RandomSource rng) {
        if (totalCards() == 0) {
            throw new IllegalMoveException("CardDeck", "No cards to draw");
        }
        CardDeck deck = drawPile.isEmpty() ? reshuffle(rng) : this;
        PlayableCard top = deck.drawPile.get(0);
        return new Draw(new CardDeck(deck.drawPile.subList(1, deck.drawPile.size()), deck.discardPile), top);
    }

    /**
     * Draws up to {@code count} cards, stopping early when both piles run out.
     */
    public MultiDraw drawMultiple(int count, RandomSource rng) {
        List<PlayableCard> drawn = new ArrayList<>();
        CardDeck deck = this;
        for (int i = 0; i < count && deck.totalCards() > 0; i++) {
            Draw d = deck.draw(rng);
            drawn.add(d.card());
            deck = d.deck();
        }
        return new MultiDraw(deck, List.copyOf(drawn));
    }

    public CardDeck discard(PlayableCard card) {
        List<PlayableCard> next = new ArrayList<>(discardPile);
        next.add(card);
        return new CardDeck(drawPile, next);
    }

    public CardDeck discardAll(List<PlayableCard> cards) {
        List<PlayableCard> next = new ArrayList<>(discardPile);
        next.addAll(cards);
        return new CardDeck(drawPile, next);
    }

    /** Merges both piles and shuffles them into a fresh draw pile. */
    public CardDeck reshuffle(RandomSource rng) {
        List<PlayableCard> combined = new ArrayList<>(drawPile);
        combined.addAll(discardPile);
        rng.shuffle(combined);
        return new CardDeck(combined, List.of());
    }
}
