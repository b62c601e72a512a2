package com.cardwar.warservice.games.war.domain.deck;

import com.cardwar.warservice.games.war.domain.constants.GameMessages;
import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.cardwar.warservice.games.war.domain.rule.WarRules;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeckFactoryTest {

    private final WarRules standard = WarRules.defaults();
    private final WarRules withNukes = WarRules.defaults().toBuilder().includeSpecialCards(true).build();

    @Test
    void shouldBuild52DistinctCards() {
        List<Card> deck = new DeckFactory(new Random(1), standard).buildDeck(false);
        assertEquals(DeckFactory.STANDARD_SIZE, deck.size());
        assertEquals(52, new HashSet<>(deck).size());
        assertTrue(deck.stream().noneMatch(Card::special));
    }

    @Test
    void shouldAddOneSpecialCardPerSide() {
        List<Card> deck = new DeckFactory(new Random(1), withNukes).buildDeck(true);
        assertEquals(54, deck.size());
        assertEquals(2, deck.stream().filter(Card::special).count());
    }

    @Test
    void shuffleShouldBeAPermutationAndLeaveInputAlone() {
        DeckFactory factory = new DeckFactory(new Random(42), standard);
        List<Card> ordered = factory.buildDeck(false);
        List<Card> copy = new ArrayList<>(ordered);

        List<Card> shuffled = factory.shuffle(ordered);

        assertEquals(copy, ordered);
        assertEquals(ordered.size(), shuffled.size());
        assertEquals(new HashSet<>(ordered), new HashSet<>(shuffled));
        assertFalse(ordered.equals(shuffled), "seed 42 should not produce the identity permutation");
    }

    @Test
    void sameSeedShouldDealTheSameGame() {
        WarGameState a = new DeckFactory(new Random(7), standard).initializeGame();
        WarGameState b = new DeckFactory(new Random(7), standard).initializeGame();
        assertEquals(a.playerDeck(), b.playerDeck());
        assertEquals(a.opponentDeck(), b.opponentDeck());
    }

    @Test
    void shouldDealHalfToEachSideWithWelcomeState() {
        WarGameState s = new DeckFactory(new Random(3), standard).initializeGame(PlayerProfile.anonymous());

        assertEquals(26, s.playerDeck().size());
        assertEquals(26, s.opponentDeck().size());
        assertEquals(52, s.totalCards());
        assertTrue(s.warPile().isEmpty());
        assertNull(s.playerCard());
        assertEquals(GameStatus.INITIAL, s.gameStatus());
        assertEquals(GameMessages.WELCOME, s.message());
        assertEquals(0, s.moveCount());
        assertEquals(0L, s.lastMoveTimestamp());
        assertFalse(s.playerNukeAvailable());
        assertEquals(PlayerProfile.anonymous(), s.player());

        Set<Card> all = new HashSet<>(s.playerDeck());
        all.addAll(s.opponentDeck());
        assertEquals(52, all.size());
    }

    @Test
    void specialVariantShouldSplit27And27AndArmBothNukes() {
        WarGameState s = new DeckFactory(new Random(3), withNukes).initializeGame();
        assertEquals(27, s.playerDeck().size());
        assertEquals(27, s.opponentDeck().size());
        assertEquals(54, s.totalCards());
        assertTrue(s.playerNukeAvailable());
        assertTrue(s.opponentNukeAvailable());
    }
}
