package com.cardwar.warservice.games.war.guard;

import com.cardwar.warservice.games.war.domain.exception.InvariantViolationException;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static com.cardwar.warservice.support.WarFixtures.card;
import static com.cardwar.warservice.support.WarFixtures.cards;
import static com.cardwar.warservice.support.WarFixtures.playing;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvariantCheckerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private WarGameState broken() {
        return playing(cards("2C", "3C"), cards("4D")).toBuilder().totalCards(52).build();
    }

    @Test
    void displayedCardsAlreadyInADeckShouldNotBeCountedTwice() {
        WarGameState s = playing(cards("2C", "3C"), cards("4D")).toBuilder()
                .playerCard(card("3C"))
                .opponentCard(card("4D").asFaceDown())
                .build();
        assertEquals(3, InvariantChecker.countCards(s));
        assertEquals(0, InvariantChecker.inPlayCount(s));
    }

    @Test
    void looseDrawnCardsShouldBeCounted() {
        WarGameState s = playing(cards("2C"), cards("4D")).toBuilder()
                .playerCard(card("KS"))
                .opponentCard(card("QH"))
                .totalCards(4)
                .build();
        assertEquals(2, InvariantChecker.inPlayCount(s));
        assertTrue(new InvariantChecker(true, registry).verifyCardCount(s));
    }

    @Test
    void strictModeShouldThrowWithCounts() {
        InvariantChecker checker = new InvariantChecker(true, registry);

        InvariantViolationException e = assertThrows(InvariantViolationException.class,
                () -> checker.enforce(broken(), "move"));
        assertEquals(52, e.getExpected());
        assertEquals(3, e.getActual());
        assertFalse(e.recoverable());
    }

    @Test
    void lenientModeShouldCountTheViolationAndCarryOn() {
        InvariantChecker checker = new InvariantChecker(false, registry);
        WarGameState s = broken();

        assertSame(s, checker.enforce(s, "move"));
        assertSame(s, checker.enforce(s, "move"));

        assertEquals(2.0, registry.get(InvariantChecker.VIOLATION_METRIC).tag("stage", "move").counter().count());
    }

    @Test
    void validStateShouldPassWithoutTouchingTheCounter() {
        InvariantChecker checker = new InvariantChecker(true, registry);
        WarGameState s = playing(cards("2C"), cards("4D"));

        assertSame(s, checker.enforce(s, "init"));
        assertNull(registry.find(InvariantChecker.VIOLATION_METRIC).counter());
    }
}
