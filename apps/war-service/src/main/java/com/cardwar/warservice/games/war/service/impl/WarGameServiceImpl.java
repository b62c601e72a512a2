package com.cardwar.warservice.games.war.service.impl;

import com.cardwar.warservice.application.user.PlayerProfileService;
import com.cardwar.warservice.games.war.codec.StateCodec;
import com.cardwar.warservice.games.war.domain.constants.GameMessages;
import com.cardwar.warservice.games.war.domain.deck.DeckFactory;
import com.cardwar.warservice.games.war.domain.exception.CooldownActiveException;
import com.cardwar.warservice.games.war.domain.exception.InvalidMoveException;
import com.cardwar.warservice.games.war.domain.exception.StateDecodeException;
import com.cardwar.warservice.games.war.domain.model.MoveIntent;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.cardwar.warservice.games.war.engine.TurnResolutionEngine;
import com.cardwar.warservice.games.war.event.GameEndedEvent;
import com.cardwar.warservice.games.war.guard.InvariantChecker;
import com.cardwar.warservice.games.war.guard.TurnRateLimiter;
import com.cardwar.warservice.games.war.service.GameView;
import com.cardwar.warservice.games.war.service.MoveResult;
import com.cardwar.warservice.games.war.service.WarGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * 一手的完整流程：解码 -> 冷却 -> 结算 -> 守恒校验 -> 编码 -> （终局）发事件。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarGameServiceImpl implements WarGameService {

    private final DeckFactory deckFactory;
    private final TurnResolutionEngine engine;
    private final StateCodec codec;
    private final TurnRateLimiter rateLimiter;
    private final InvariantChecker invariantChecker;
    private final PlayerProfileService profileService;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public MoveResult newGame(String playerId) {
        WarGameState state = invariantChecker.enforce(
                deckFactory.initializeGame(profileService.resolve(playerId)), "init");
        log.info("开新局: playerId={}, totalCards={}", playerId, state.totalCards());
        return MoveResult.accepted(state, codec.encodeDefault(state), false);
    }

    @Override
    public MoveResult play(String token, MoveIntent intent) {
        return play(token, intent, null);
    }

    @Override
    public MoveResult play(String token, MoveIntent intent, String playerId) {
        Objects.requireNonNull(intent, "intent");

        WarGameState current;
        try {
            current = codec.decode(token);
        } catch (StateDecodeException e) {
            log.warn("令牌无法解析，重开新局: err={}", e.getMessage());
            return restart(playerId);
        }
        if (!invariantChecker.verifyCardCount(current, "decode")) {
            log.warn("令牌内容不守恒，重开新局: move={}", current.moveCount());
            return restart(playerId);
        }

        try {
            rateLimiter.check(current);
        } catch (CooldownActiveException e) {
            log.debug("冷却中: retryAfterMs={}", e.getRetryAfterMs());
            return MoveResult.cooldown(current, token, e.getRetryAfterMs(), e.getMessage());
        }

        WarGameState next;
        try {
            next = engine.applyMove(current, intent);
        } catch (InvalidMoveException e) {
            log.warn("非法操作: intent={}, status={}, err={}", intent.name(), current.gameStatus(), e.getMessage());
            return MoveResult.rejected(current, token, e.getMessage());
        }
        next = invariantChecker.enforce(next, "move");

        boolean justEnded = !current.terminal() && next.terminal();
        if (justEnded) {
            eventPublisher.publishEvent(GameEndedEvent.of(next));
        }
        return MoveResult.accepted(next, codec.encodeDefault(next), justEnded);
    }

    @Override
    public GameView view(WarGameState state) {
        return GameView.of(state);
    }

    private MoveResult restart(String playerId) {
        WarGameState base = playerId == null
                ? deckFactory.initializeGame()
                : deckFactory.initializeGame(profileService.resolve(playerId));
        WarGameState fresh = base.toBuilder()
                .message(GameMessages.STATE_UNREADABLE)
                .build();
        fresh = invariantChecker.enforce(fresh, "init");
        return MoveResult.restarted(fresh, codec.encodeDefault(fresh), GameMessages.STATE_UNREADABLE);
    }
}
