package com.boardroom.sim.engine;

import com.boardroom.sim.card.CardHand;
import com.boardroom.sim.card.Choice;
import com.boardroom.sim.codec.GameStateCodec;
import com.boardroom.sim.economy.ResourceState;
import com.boardroom.sim.model.QuarterPhase;
import com.boardroom.sim.random.RandomSource;
import com.boardroom.sim.random.SeededRandomSource;
import com.boardroom.sim.situation.JsonSituationCatalog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.boardroom.sim.engine.EngineFixtures.NADELLA;
import static com.boardroom.sim.engine.EngineFixtures.crisisDeck;
import static com.boardroom.sim.engine.EngineFixtures.projectDeck;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Plays whole games with a simple policy and checks the state invariants
 * after every transition.
 */
class GameLoopTest {

    private static final int LAST_QUARTER = 12;
    private static final int MAX_STEPS = 400;

    private static QuarterEngine engine;

    @BeforeAll
    static void setUp() {
        engine = new QuarterEngine(JsonSituationCatalog.loadDefault());
    }

    /** Plays until the game ends or the last quarter is done; returns every state visited. */
    private static List<QuarterGameState> play(long seed) {
        RandomSource rng = new SeededRandomSource(seed);
        QuarterGameState state = GameSetup.newGame(seed, NADELLA, projectDeck(), crisisDeck(), rng);
        List<QuarterGameState> visited = new ArrayList<>();
        visited.add(state);

        for (int step = 0; step < MAX_STEPS; step++) {
            if (state.isTerminal() || state.quarterNumber() > LAST_QUARTER) {
                break;
            }
            QuarterResult result = engine.advance(state, decide(state), rng);
            assertEquals(state.quarterNumber(), result.log().quarter(), "log quarter at step " + step);
            assertEquals(state.quarter().phase(), result.log().phase(), "log phase at step " + step);
            state = result.state();
            assertInvariants(state);
            visited.add(state);
        }
        return visited;
    }

    private static QuarterInput decide(QuarterGameState state) {
        return switch (state.quarter().phase()) {
            case DEMAND -> QuarterInput.none();
            case PLAY_CARDS -> {
                if (!state.canPlayCard()) {
                    yield QuarterInput.endPlay();
                }
                String cardId = state.hand().cards().get(0).cardId();
                yield state.cardsPlayedThisQuarter().size() == 1
                    ? QuarterInput.playCardAndEnd(cardId)
                    : QuarterInput.playCard(cardId);
            }
            case CRISIS -> {
                if (!state.awaitingCrisisChoice()) {
                    yield QuarterInput.none();
                }
                Choice affordable = state.currentCrisis().choices().stream()
                    .filter(c -> state.resources().canAfford(c.pcCost()))
                    .findFirst()
                    .orElseThrow();
                yield QuarterInput.choose(affordable.choiceId());
            }
            case RESOLUTION -> state.ceo().canRetire(state.difficulty())
                ? QuarterInput.retireNow()
                : QuarterInput.none();
        };
    }

    private static void assertInvariants(QuarterGameState s) {
        int pc = s.resources().politicalCapital();
        assertTrue(pc >= 0 && pc <= ResourceState.MAX_CAPITAL, "PC out of range: " + pc);
        int favor = s.ceo().favorability();
        assertTrue(favor >= 0 && favor <= 100, "favorability out of range: " + favor);
        assertTrue(s.cardsPlayedThisQuarter().size() <= QuarterGameState.MAX_CARDS_PER_QUARTER);
        assertTrue(s.hand().size() <= CardHand.MAX_HAND_SIZE, "hand size " + s.hand().size());
        assertTrue(s.deferredSituations().size() <= QuarterGameState.MAX_DEFERRED_SITUATIONS);
        assertEquals(projectDeck().size(), s.hand().size() + s.cardDeck().totalCards(),
            "project cards must be conserved");
        assertEquals(projectDeck().size(), s.cardDeck().drawPile().size()
            + s.cardDeck().discardPile().size() + s.hand().size());
        if (s.awaitingCrisisChoice()) {
            assertNotNull(s.currentCrisis());
            assertEquals(QuarterPhase.CRISIS, s.quarter().phase());
        }
    }

    @Test
    @DisplayName("policy games keep every invariant until they end")
    void invariantsHold() {
        for (long seed : new long[] {1L, 7L, 42L, 1234L, 99_999L}) {
            List<QuarterGameState> visited = play(seed);
            QuarterGameState last = visited.get(visited.size() - 1);

            assertTrue(last.isTerminal() || last.quarterNumber() > LAST_QUARTER,
                "seed " + seed + " stopped early at " + last.quarter());
            if (!last.ceo().ousted()) {
                assertTrue(last.ceo().quartersSurvived() >= 1, "seed " + seed);
            }
        }
    }

    @Test
    @DisplayName("Deterministic — same input always produces same output")
    void deterministic() {
        List<QuarterGameState> first = play(2024L);
        List<QuarterGameState> second = play(2024L);

        assertEquals(first, second);
        GameStateCodec codec = new GameStateCodec();
        assertEquals(codec.write(first.get(first.size() - 1)), codec.write(second.get(second.size() - 1)));
    }

    @Test
    @DisplayName("different seeds produce different games")
    void seedsDiffer() {
        assertNotEquals(play(1L), play(2L));
    }
}
