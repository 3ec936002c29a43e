package com.boardroom.sim.card;

import com.boardroom.sim.exception.IllegalMoveException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Cards currently held, at most {@value #MAX_HAND_SIZE}.
 */
public record CardHand(@JsonProperty("cards") List<PlayableCard> cards) {

    public static final int MAX_HAND_SIZE = 7;

    public CardHand {
        cards = cards == null ? List.of() : List.copyOf(cards);
    }

    public static CardHand empty() {
        return new CardHand(List.of());
    }

    public int size() {
        return cards.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean contains(String cardId) {
        return cards.stream().anyMatch(c -> c.cardId().equals(cardId));
    }

    public PlayableCard find(String cardId) {
        return cards.stream()
            .filter(c -> c.cardId().equals(cardId))
            .findFirst()
            .orElseThrow(() -> new IllegalMoveException("CardHand", "Card " + cardId + " not in hand"));
    }

    public CardHand withCardRemoved(String cardId) {
        if (!contains(cardId)) {
            throw new IllegalMoveException("CardHand", "Card " + cardId + " not in hand");
        }
        List<PlayableCard> next = new ArrayList<>();
        for (PlayableCard c : cards) {
            if (!c.cardId().equals(cardId)) next.add(c);
        }
        return new CardHand(next);
    }

    /** Appends cards, silently dropping any beyond the hand limit. */
    public CardHand withCardsAdded(List<PlayableCard> more) {
        List<PlayableCard> next = new ArrayList<>(cards);
        for (PlayableCard c : more) {
            if (next.size() >= MAX_HAND_SIZE) break;
            next.add(c);
        }
        return new CardHand(next);
    }
}
