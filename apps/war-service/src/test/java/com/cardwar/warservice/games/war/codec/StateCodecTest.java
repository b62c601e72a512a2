package com.cardwar.warservice.games.war.codec;

import com.cardwar.warservice.games.war.domain.deck.DeckFactory;
import com.cardwar.warservice.games.war.domain.exception.StateDecodeException;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.MoveIntent;
import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.cardwar.warservice.games.war.domain.rule.WarRules;
import com.cardwar.warservice.games.war.engine.TurnResolutionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Locale;
import java.util.Random;

import static com.cardwar.warservice.support.WarFixtures.cards;
import static com.cardwar.warservice.support.WarFixtures.playing;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateCodecTest {

    private final StateCodec codec = new StateCodec(new ObjectMapper());
    private final WarRules rules = WarRules.defaults().toBuilder().includeSpecialCards(true).build();
    private final TurnResolutionEngine engine = new TurnResolutionEngine(rules,
            Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC));

    /** 开出一局并在第一次开战时停下 */
    private WarGameState midWar() {
        return engine.applyMove(playing(
                cards("2C", "KC", "3C", "4C", "5C", "7S"),
                cards("3D", "4D", "6D", "8D", "9D", "7H")), MoveIntent.draw());
    }

    @Test
    void fullTokenShouldRoundTripFreshGames() {
        WarGameState fresh = new DeckFactory(new Random(11), rules)
                .initializeGame(new PlayerProfile("Alice", "https://img.example/a.png"));

        String token = codec.encode(fresh);

        assertTrue(token.startsWith("F"));
        assertEquals(fresh, codec.decode(token));
    }

    @Test
    void fullTokenShouldRoundTripAGameInProgress() {
        WarGameState s = new DeckFactory(new Random(5), rules).initializeGame();
        for (int i = 0; i < 40 && !s.terminal(); i++) {
            s = engine.applyMove(s, MoveIntent.draw());
            assertEquals(s, codec.decode(codec.encode(s)));
        }
        WarGameState war = midWar();
        assertEquals(war, codec.decode(codec.encode(war)));
    }

    @Test
    void tokenShouldBeUrlSafe() {
        String token = codec.encode(midWar());
        assertTrue(token.matches("[A-Za-z0-9_-]+"), token);
    }

    @Test
    void compactTokenShouldKeepGameplayFieldsOnly() {
        WarGameState war = midWar().toBuilder().player(new PlayerProfile("Bob", null)).build();

        String token = codec.encodeCompact(war);
        WarGameState decoded = codec.decode(token);

        assertTrue(token.startsWith("C"));
        assertTrue(token.length() < codec.encode(war).length());
        assertEquals(war.toBuilder().message(null).victoryMessage(null).player(null).build(), decoded);
        assertTrue(decoded.warPile().get(2).faceDown());
    }

    @Test
    void compactTokenShouldResumePlayIdentically() {
        WarGameState war = midWar();
        WarGameState viaFull = engine.applyMove(codec.decode(codec.encode(war)), MoveIntent.draw());
        WarGameState viaCompact = engine.applyMove(codec.decode(codec.encodeCompact(war)), MoveIntent.draw());

        assertEquals(viaFull.playerDeck(), viaCompact.playerDeck());
        assertEquals(viaFull.opponentDeck(), viaCompact.opponentDeck());
        assertEquals(viaFull.gameStatus(), viaCompact.gameStatus());
        assertEquals(viaFull.message(), viaCompact.message());
    }

    @Test
    void defaultFormatShouldFollowConfiguration() {
        StateCodec compact = new StateCodec(new ObjectMapper(), CodecFormat.COMPACT);
        assertTrue(compact.encodeDefault(midWar()).startsWith("C"));
        assertEquals(CodecFormat.FULL, new StateCodec(new ObjectMapper(), null).defaultFormat());
    }

    @Test
    void endedGameShouldKeepItsWinnerInBothFormats() {
        WarGameState ended = engine.applyMove(playing(cards("5C"), cards("3D")), MoveIntent.draw());
        assertEquals(ended.winner(), codec.decode(codec.encode(ended)).winner());
        assertEquals(ended.winner(), codec.decode(codec.encodeCompact(ended)).winner());
        assertNull(codec.decode(codec.encodeCompact(midWar())).winner());
    }

    @Test
    void statusCodesShouldSurviveATurkishDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            WarGameState fresh = new DeckFactory(new Random(3), rules).initializeGame();
            WarGameState playing = engine.applyMove(fresh, MoveIntent.draw());

            assertEquals("initial", GameStatus.INITIAL.code());
            assertEquals("playing", GameStatus.PLAYING.code());
            assertEquals(fresh, codec.decode(codec.encode(fresh)));
            assertEquals(GameStatus.INITIAL, codec.decode(codec.encodeCompact(fresh)).gameStatus());
            assertEquals(playing.gameStatus(), codec.decode(codec.encodeCompact(playing)).gameStatus());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void malformedTokensShouldRaiseStateDecodeException() {
        assertThrows(StateDecodeException.class, () -> codec.decode(null));
        assertThrows(StateDecodeException.class, () -> codec.decode("  "));
        assertThrows(StateDecodeException.class, () -> codec.decode("Zabc"));
        assertThrows(StateDecodeException.class, () -> codec.decode("F!!not-base64!!"));
        assertThrows(StateDecodeException.class, () -> codec.decode("F" + b64("not json")));
        assertThrows(StateDecodeException.class, () -> codec.decode("F" + b64("null")));
        assertThrows(StateDecodeException.class,
                () -> codec.decode("F" + b64("{\"playerDeck\":[{\"rank\":99,\"suit\":\"S\"}]}")));
        assertThrows(StateDecodeException.class, () -> codec.decode("C" + b64("{\"p\":\"7S2\"}")));
        assertThrows(StateDecodeException.class, () -> codec.decode("C" + b64("{\"p\":\"zS\"}")));
        assertThrows(StateDecodeException.class, () -> codec.decode("C" + b64("{\"s\":\"sleeping\"}")));
    }

    @Test
    void decodeFailureShouldBeRecoverable() {
        StateDecodeException e = assertThrows(StateDecodeException.class, () -> codec.decode("Zabc"));
        assertTrue(e.recoverable());
    }

    private static String b64(String s) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(s.getBytes(StandardCharsets.UTF_8));
    }
}
