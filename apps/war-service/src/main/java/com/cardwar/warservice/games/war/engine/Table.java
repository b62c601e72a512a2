package com.cardwar.warservice.games.war.engine;

import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.Side;
import com.cardwar.warservice.games.war.domain.model.WarGameState;

import java.util.ArrayList;
import java.util.List;

/**
 * 引擎内部的“牌桌”工作副本：一手之内可变，结束时折叠回不可变的 WarGameState。
 * 只在 TurnResolutionEngine 内部使用，不会泄漏给调用方。
 */
final class Table {

    final List<Card> player;
    final List<Card> opponent;
    final List<Card> pile;
    Card playerCard;
    Card opponentCard;
    String message;
    String victoryMessage;
    boolean war;
    GameStatus status;
    boolean playerNuke;
    boolean opponentNuke;
    Side winner;

    private Table(WarGameState s) {
        this.player = new ArrayList<>(s.playerDeck());
        this.opponent = new ArrayList<>(s.opponentDeck());
        this.pile = new ArrayList<>(s.warPile());
        this.playerCard = s.playerCard();
        this.opponentCard = s.opponentCard();
        this.message = s.message();
        this.victoryMessage = s.victoryMessage();
        this.war = s.warInProgress();
        this.status = s.gameStatus();
        this.playerNuke = s.playerNukeAvailable();
        this.opponentNuke = s.opponentNukeAvailable();
        this.winner = s.winner();
    }

    static Table from(WarGameState state) {
        return new Table(state);
    }

    List<Card> deck(Side side) {
        return side == Side.PLAYER ? player : opponent;
    }

    int size(Side side) {
        return deck(side).size();
    }

    boolean anyDeckEmpty() {
        return player.isEmpty() || opponent.isEmpty();
    }

    /** 从牌堆顶（末尾）翻一张 */
    Card draw(Side side) {
        List<Card> d = deck(side);
        return d.remove(d.size() - 1);
    }

    /** 从牌堆顶取 n 张，保持原顺序 */
    List<Card> takeTop(Side side, int n) {
        List<Card> d = deck(side);
        List<Card> top = d.subList(d.size() - n, d.size());
        List<Card> out = new ArrayList<>(top);
        top.clear();
        return out;
    }

    /** 从牌堆底（下标 0）取 n 张 */
    List<Card> takeBottom(Side side, int n) {
        List<Card> bottom = deck(side).subList(0, n);
        List<Card> out = new ArrayList<>(bottom);
        bottom.clear();
        return out;
    }

    /** 赢来的牌一律翻回正面塞到牌堆底 */
    void toBottom(Side side, List<Card> cards) {
        List<Card> faceUp = new ArrayList<>(cards.size());
        for (Card c : cards) faceUp.add(c.asFaceUp());
        deck(side).addAll(0, faceUp);
    }

    void consumeNuke(Side side) {
        if (side == Side.PLAYER) playerNuke = false;
        else opponentNuke = false;
    }

    /** 终局：桌上残留的战争牌堆整体归赢家 */
    void end(Side winningSide, String endMessage) {
        if (!pile.isEmpty()) {
            toBottom(winningSide, pile);
            pile.clear();
        }
        this.status = GameStatus.ENDED;
        this.winner = winningSide;
        this.war = false;
        this.message = endMessage;
    }

    WarGameState toState(WarGameState base, int moveCount, long timestamp) {
        return base.toBuilder()
                .playerDeck(player)
                .opponentDeck(opponent)
                .warPile(pile)
                .playerCard(playerCard)
                .opponentCard(opponentCard)
                .message(message)
                .victoryMessage(victoryMessage)
                .warInProgress(war)
                .gameStatus(status)
                .playerNukeAvailable(playerNuke)
                .opponentNukeAvailable(opponentNuke)
                .winner(winner)
                .moveCount(moveCount)
                .lastMoveTimestamp(timestamp)
                .build();
    }
}
