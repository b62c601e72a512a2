package com.cardwar.warservice.games.war.engine;

import com.cardwar.warservice.engine.core.TurnEngine;
import com.cardwar.warservice.games.war.domain.constants.GameMessages;
import com.cardwar.warservice.games.war.domain.exception.InvalidMoveException;
import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.MoveIntent;
import com.cardwar.warservice.games.war.domain.model.MoveKind;
import com.cardwar.warservice.games.war.domain.model.Side;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.cardwar.warservice.games.war.domain.rule.WarJudge;
import com.cardwar.warservice.games.war.domain.rule.WarPolicy;
import com.cardwar.warservice.games.war.domain.rule.WarRules;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * War 回合结算引擎（纯函数：state + intent -> 新 state）。
 * 每手流程：
 *   1. 入场终局检查（任一方无牌直接结束，不动牌）
 *   2. 核弹（可选，一局每方一次）
 *   3. 翻牌：战争决胜 / 同点开战 / 普通比大小（可选每 N 手强制战争）
 *   4. 出场终局检查
 *   5. 手数 +1，记录时间戳
 * 牌数守恒由 InvariantChecker 在外层校验，这里不做修复。
 */
@Slf4j
public class TurnResolutionEngine implements TurnEngine<WarGameState, MoveIntent> {

    private final WarRules rules;
    private final Clock clock;

    public TurnResolutionEngine(WarRules rules, Clock clock) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public WarGameState apply(WarGameState state, MoveIntent command) {
        return applyMove(state, command);
    }

    /**
     * 结算一手。
     *
     * @throws InvalidMoveException 对局已结束，或请求了不可用的核弹
     */
    public WarGameState applyMove(WarGameState state, MoveIntent intent) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(intent, "intent");
        if (state.terminal()) {
            throw new InvalidMoveException(GameMessages.GAME_ALREADY_ENDED);
        }
        if (intent.kind() == MoveKind.NUKE && !state.nukeAvailable(intent.side())) {
            throw new InvalidMoveException(GameMessages.NUKE_UNAVAILABLE);
        }

        Table t = Table.from(state);
        t.victoryMessage = null;

        if (!endIfDeckEmpty(t)) {
            if (intent.kind() == MoveKind.NUKE) {
                nuke(t, intent.side());
            }
            if (t.status != GameStatus.ENDED && !endIfDeckEmpty(t)) {
                drawRound(t, state.moveCount());
                if (t.status != GameStatus.ENDED) {
                    endIfDeckEmpty(t);
                }
            }
        }

        WarGameState next = t.toState(state, state.moveCount() + 1, clock.millis());
        log.debug("结算完成: move={}, intent={}, status={}, player={}, opponent={}, pile={}",
                next.moveCount(), intent.name(), next.gameStatus(),
                next.playerDeck().size(), next.opponentDeck().size(), next.warPile().size());
        if (next.terminal()) {
            log.info("对局结束: winner={}, moves={}", next.winner(), next.moveCount());
        }
        return next;
    }

    // ----------- private helpers -----------

    /**
     * 任一方无牌则结束对局。双方都无牌（所有牌都压在战争牌堆里）时判给玩家。
     * @return 是否已结束
     */
    private boolean endIfDeckEmpty(Table t) {
        if (!t.anyDeckEmpty()) return false;
        Side winner = !t.player.isEmpty() || t.opponent.isEmpty() ? Side.PLAYER : Side.OPPONENT;
        t.end(winner, GameMessages.formatGameOver(winner));
        return true;
    }

    private void nuke(Table t, Side actor) {
        t.consumeNuke(actor);
        Side target = actor.other();
        int remaining = t.size(target);
        if (WarJudge.nukeWinsOutright(remaining, rules.nukeThreshold())) {
            t.toBottom(actor, t.takeBottom(target, remaining));
            t.end(actor, GameMessages.formatNukeWipeout(actor, remaining));
            log.info("核弹清场: actor={}, cards={}", actor, remaining);
            return;
        }
        int n = Math.min(rules.nukeCaptureSize(), remaining);
        t.toBottom(actor, t.takeBottom(target, n));
        t.message = GameMessages.formatNukeCapture(actor, n);
        t.victoryMessage = t.message;
        log.debug("核弹夺牌: actor={}, cards={}", actor, n);
    }

    private void drawRound(Table t, int movesBefore) {
        Card pc = t.draw(Side.PLAYER);
        Card cc = t.draw(Side.OPPONENT);
        t.playerCard = pc;
        t.opponentCard = cc;

        int cmp = WarJudge.compare(pc, cc, rules.aceHigh());
        if (t.war) {
            if (cmp == 0 && rules.warPolicy() == WarPolicy.CHAINED) {
                tie(t, pc, cc, true);
            } else {
                resolveWar(t, pc, cc);
            }
            return;
        }

        if (WarJudge.forcedWarDue(movesBefore, rules.forcedWarInterval())) {
            cmp = 0;
        }
        if (cmp == 0) {
            tie(t, pc, cc, false);
        } else {
            Side winner = cmp > 0 ? Side.PLAYER : Side.OPPONENT;
            t.toBottom(winner, List.of(pc, cc));
            t.status = GameStatus.PLAYING;
            t.message = GameMessages.formatRoundWon(winner, winner == Side.PLAYER ? pc : cc);
        }
    }

    /** 同点：牌不够则直接终局，否则双方各扣 warCardCount 张暗牌进入战争 */
    private void tie(Table t, Card pc, Card cc, boolean extending) {
        int n = rules.warCardCount();
        int pr = t.size(Side.PLAYER);
        int or = t.size(Side.OPPONENT);

        if (!WarJudge.canWage(pr, or, n)) {
            Side winner = WarJudge.insufficientCardsWinner(pr, or);
            List<Card> spoils = new ArrayList<>();
            spoils.add(pc);
            spoils.add(cc);
            spoils.addAll(t.pile);
            spoils.addAll(t.deck(winner.other()));
            t.pile.clear();
            t.deck(winner.other()).clear();
            t.toBottom(winner, spoils);
            t.end(winner, GameMessages.formatNotEnoughForWar(winner));
            log.info("牌不够开战: winner={}, player={}, opponent={}", winner, pr, or);
            return;
        }

        List<Card> playerDown = t.takeTop(Side.PLAYER, n);
        List<Card> opponentDown = t.takeTop(Side.OPPONENT, n);
        t.pile.add(pc);
        t.pile.add(cc);
        for (Card c : playerDown) t.pile.add(c.asFaceDown());
        for (Card c : opponentDown) t.pile.add(c.asFaceDown());
        t.war = true;
        t.status = GameStatus.WAR;
        t.message = extending ? GameMessages.formatWarExtended(n) : GameMessages.formatWarDeclared(n);
    }

    /** 战争决胜：赢家拿走两张翻牌 + 整个战争牌堆 */
    private void resolveWar(Table t, Card pc, Card cc) {
        Side winner = WarJudge.immediateWarWinner(pc, cc, rules.aceHigh());
        List<Card> spoils = new ArrayList<>(t.pile.size() + 2);
        spoils.add(pc);
        spoils.add(cc);
        spoils.addAll(t.pile);
        t.pile.clear();
        t.toBottom(winner, spoils);
        t.war = false;
        t.status = GameStatus.PLAYING;
        t.message = GameMessages.formatWarWon(winner, winner == Side.PLAYER ? pc : cc);
        t.victoryMessage = t.message;
    }
}
