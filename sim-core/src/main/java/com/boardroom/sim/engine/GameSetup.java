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
import com.boardroom.sim.random.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the opening state of a game.
 */
public final class GameSetup {

    private static final Logger log = LoggerFactory.getLogger(GameSetup.class);

    private GameSetup() { /* utility class */ }

    /**
     * Shuffles both decks with {@code rng}, deals a full hand and binds the
     * profit-floor directive. The game starts in quarter 1, Demand phase.
     */
    public static QuarterGameState newGame(long seed, DifficultySettings difficulty,
                                           List<PlayableCard> projectCards, List<EventCard> crisisCards,
                                           RandomSource rng) {
        CardDeck deck = CardDeck.create(projectCards, rng);
        EventDeck crisisDeck = EventDeck.create(crisisCards, rng);
        CardDeck.MultiDraw opening = deck.drawMultiple(CardHand.MAX_HAND_SIZE, rng);

        log.info("[GameSetup] New game. seed={} difficulty={} projects={} crises={}",
            seed, difficulty.name(), projectCards.size(), crisisCards.size());

        return new QuarterGameState(
            seed,
            difficulty,
            OrgState.initial(),
            QuarterCursor.initial(),
            TenureState.initial(difficulty),
            ResourceState.initial(),
            crisisDeck,
            opening.deck(),
            CardHand.empty().withCardsAdded(opening.cards()),
            List.of(),
            BoardDirective.PROFIT_FLOOR,
            null,
            null,
            false,
            CrisisState.empty(),
            List.of(),
            List.of(),
            List.of());
    }
}
