package com.cardwar.warservice.games.war.service;

import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.MoveKind;
import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import com.cardwar.warservice.games.war.domain.model.WarGameState;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 展示层只读视图：牌数、翻开的牌、文案、可用操作。
 * 不暴露牌堆内容本身。
 */
public record GameView(
        int playerDeckSize,
        int opponentDeckSize,
        int warPileSize,
        Card playerCard,
        Card opponentCard,
        String message,
        String victoryMessage,
        boolean warInProgress,
        String status,
        String winner,
        int moveCount,
        String playerName,
        String playerAvatar,
        List<String> availableActions
) {

    public GameView {
        availableActions = availableActions == null ? List.of() : List.copyOf(availableActions);
    }

    public static GameView of(WarGameState s) {
        PlayerProfile profile = s.player() == null ? PlayerProfile.anonymous() : s.player();
        List<String> actions = new ArrayList<>(2);
        if (s.gameStatus() != GameStatus.ENDED) {
            actions.add(MoveKind.DRAW.code());
            if (s.playerNukeAvailable()) actions.add(MoveKind.NUKE.code());
        }
        return new GameView(
                s.playerDeck().size(),
                s.opponentDeck().size(),
                s.warPile().size(),
                s.playerCard(),
                s.opponentCard(),
                s.message(),
                s.victoryMessage(),
                s.warInProgress(),
                s.gameStatus().code(),
                s.winner() == null ? null : s.winner().name().toLowerCase(Locale.ROOT),
                s.moveCount(),
                profile.displayNameOrDefault(),
                profile.avatarUrl(),
                actions);
    }
}
