package com.cardwar.warservice.games.war.domain.model;

import com.cardwar.warservice.engine.core.GameState;
import lombok.Builder;

import java.util.List;

/**
 * 一局 War 的完整状态（单一事实来源）。
 * - 牌堆顶 = 列表末尾（翻牌从末尾取），牌堆底 = 下标 0（赢来的牌塞到底部）；
 * - 不可变：列表在构造时复制为只读列表，每次转换由引擎构造新实例；
 * - playerCard / opponentCard 是最近一次翻开的牌，仅用于展示，牌本身已经归入某个牌堆；
 * - player 为身份服务提供的展示资料，原样透传。
 */
@Builder(toBuilder = true)
public record WarGameState(
        List<Card> playerDeck,
        List<Card> opponentDeck,
        Card playerCard,
        Card opponentCard,
        List<Card> warPile,
        String message,
        String victoryMessage,
        boolean warInProgress,
        GameStatus gameStatus,
        int moveCount,
        long lastMoveTimestamp,
        boolean playerNukeAvailable,
        boolean opponentNukeAvailable,
        int totalCards,
        Side winner,
        PlayerProfile player
) implements GameState {

    public WarGameState {
        playerDeck = playerDeck == null ? List.of() : List.copyOf(playerDeck);
        opponentDeck = opponentDeck == null ? List.of() : List.copyOf(opponentDeck);
        warPile = warPile == null ? List.of() : List.copyOf(warPile);
        gameStatus = gameStatus == null ? GameStatus.INITIAL : gameStatus;
    }

    public boolean nukeAvailable(Side side) {
        return side == Side.PLAYER ? playerNukeAvailable : opponentNukeAvailable;
    }

    @Override
    public boolean terminal() {
        return gameStatus == GameStatus.ENDED;
    }
}
