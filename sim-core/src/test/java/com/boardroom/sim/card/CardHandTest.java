package com.boardroom.sim.card;

import com.boardroom.sim.exception.ContentValidationException;
import com.boardroom.sim.exception.IllegalMoveException;
import com.boardroom.sim.model.Meter;
import com.boardroom.sim.model.OrgState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.boardroom.sim.card.CardFixtures.card;
import static com.boardroom.sim.card.CardFixtures.cards;
import static com.boardroom.sim.card.CardFixtures.event;
import static org.junit.jupiter.api.Assertions.*;

class CardHandTest {

    @Nested
    @DisplayName("CardHand")
    class HandTests {

        @Test
        @DisplayName("withCardsAdded() drops cards beyond seven")
        void handLimit() {
            CardHand hand = CardHand.empty().withCardsAdded(cards("1", "2", "3", "4", "5", "6", "7", "8", "9"));
            assertEquals(CardHand.MAX_HAND_SIZE, hand.size());
            assertFalse(hand.contains("8"));
        }

        @Test
        @DisplayName("withCardRemoved() removes only the named card")
        void remove() {
            CardHand hand = new CardHand(cards("a", "b", "c")).withCardRemoved("b");
            assertEquals(cards("a", "c"), hand.cards());
        }

        @Test
        @DisplayName("removing or finding a card not in hand is an illegal move")
        void notInHand() {
            CardHand hand = new CardHand(cards("a"));
            assertThrows(IllegalMoveException.class, () -> hand.withCardRemoved("z"));
            assertThrows(IllegalMoveException.class, () -> hand.find("z"));
            assertEquals(card("a"), hand.find("a"));
        }
    }

    @Nested
    @DisplayName("PlayableCard")
    class PlayableCardTests {

        @Test
        @DisplayName("affinity modifier bands: +15 / +8 / 0 / −8 / −15")
        void affinity() {
            PlayableCard c = new PlayableCard("p", "P", null, null, null, 0, CardCategory.ACTION, Meter.MORALE, 2);
            assertEquals(15, c.affinityModifier(new OrgState(60, 70, 60, 60, 60)));
            assertEquals(8, c.affinityModifier(new OrgState(60, 60, 60, 60, 60)));
            assertEquals(0, c.affinityModifier(new OrgState(60, 40, 60, 60, 60)));
            assertEquals(-8, c.affinityModifier(new OrgState(60, 39, 60, 60, 60)));
            assertEquals(-15, c.affinityModifier(new OrgState(60, 24, 60, 60, 60)));
            assertEquals(0, card("x").affinityModifier(OrgState.initial()));
        }

        @Test
        @DisplayName("defaults: Action category, moderate risk, neutral outcomes")
        void defaults() {
            PlayableCard c = new PlayableCard("p", "P", null, null, null, 0, null, null, 0);
            assertEquals(CardCategory.ACTION, c.category());
            assertEquals("MODERATE", c.riskLabel());
            assertTrue(c.outcomes().good().isEmpty());
            assertFalse(c.isCorporate());
        }
    }

    @Nested
    @DisplayName("EventCard validation")
    class EventCardTests {

        @Test
        @DisplayName("fewer than two choices is rejected")
        void tooFew() {
            assertThrows(ContentValidationException.class, () ->
                new EventCard("E", "t", null, List.of(Choice.flat("E_A", "a"))));
        }

        @Test
        @DisplayName("more than four choices is rejected")
        void tooMany() {
            List<Choice> five = List.of(Choice.flat("1", "a"), Choice.flat("2", "a"), Choice.flat("3", "a"),
                Choice.flat("4", "a"), Choice.flat("5", "a"));
            assertThrows(ContentValidationException.class, () -> new EventCard("E", "t", null, five));
        }

        @Test
        @DisplayName("duplicate choice ids are rejected")
        void duplicateIds() {
            assertThrows(ContentValidationException.class, () ->
                new EventCard("E", "t", null, List.of(Choice.flat("E_A", "a"), Choice.flat("E_A", "b"))));
        }

        @Test
        @DisplayName("getChoice() of an unknown id is an illegal move")
        void unknownChoice() {
            EventCard e = event("E");
            assertTrue(e.hasChoice("E_A"));
            assertThrows(IllegalMoveException.class, () -> e.getChoice("E_Z"));
        }

        @Test
        @DisplayName("negative PC cost is rejected")
        void negativePcCost() {
            assertThrows(IllegalArgumentException.class, () ->
                new Choice("c", "l", List.of(), null, 0, -1));
        }
    }
}
