package com.cardwar.warservice.games.war.domain.rule;

import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.Side;
import com.cardwar.warservice.games.war.domain.model.Suit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WarJudgeTest {

    private final Card ace = Card.of(Card.ACE, Suit.SPADES);
    private final Card king = Card.of(Card.KING, Suit.HEARTS);
    private final Card two = Card.of(2, Suit.CLUBS);

    @Test
    void aceShouldBeHighByDefaultAndLowWhenConfigured() {
        assertTrue(WarJudge.compare(ace, king, true) > 0);
        assertTrue(WarJudge.compare(ace, two, false) < 0);
        assertEquals(1, WarJudge.value(ace, false));
    }

    @Test
    void specialCardShouldOutrankEverything() {
        Card nuke = Card.special(Suit.HEARTS);
        assertTrue(WarJudge.compare(nuke, ace, true) > 0);
        assertTrue(WarJudge.compare(ace, nuke, false) < 0);
    }

    @Test
    void immediateWarTieShouldGoToOpponent() {
        assertEquals(Side.OPPONENT, WarJudge.immediateWarWinner(two, Card.of(2, Suit.HEARTS), true));
        assertEquals(Side.PLAYER, WarJudge.immediateWarWinner(king, two, true));
    }

    @Test
    void insufficientCardsShouldFavourLargerDeckAndPlayerOnTie() {
        assertFalse(WarJudge.canWage(5, 2, 3));
        assertTrue(WarJudge.canWage(3, 3, 3));
        assertEquals(Side.PLAYER, WarJudge.insufficientCardsWinner(5, 2));
        assertEquals(Side.OPPONENT, WarJudge.insufficientCardsWinner(1, 2));
        assertEquals(Side.PLAYER, WarJudge.insufficientCardsWinner(2, 2));
    }

    @Test
    void forcedWarShouldFireOnEveryNthMoveOnlyWhenEnabled() {
        assertFalse(WarJudge.forcedWarDue(9, 0));
        assertTrue(WarJudge.forcedWarDue(9, 10));
        assertFalse(WarJudge.forcedWarDue(10, 10));
        assertTrue(WarJudge.forcedWarDue(19, 10));
    }

    @Test
    void nukeShouldWinOutrightAtOrBelowThreshold() {
        assertTrue(WarJudge.nukeWinsOutright(8, 10));
        assertTrue(WarJudge.nukeWinsOutright(10, 10));
        assertFalse(WarJudge.nukeWinsOutright(11, 10));
    }

    @Test
    void rulesShouldRejectNonsenseValues() {
        assertThrows(IllegalArgumentException.class,
                () -> WarRules.defaults().toBuilder().warCardCount(0).build());
        assertThrows(NullPointerException.class,
                () -> WarRules.defaults().toBuilder().warPolicy(null).build());
    }
}
