package com.cardwar.warservice.games.war.service;

import com.cardwar.warservice.games.war.domain.model.MoveIntent;
import com.cardwar.warservice.games.war.domain.model.WarGameState;

/**
 * War 对局服务：无状态，对局完全由调用方持有的令牌承载。
 */
public interface WarGameService {

    /**
     * 开新局。
     *
     * @param playerId 外部用户ID，可为空（匿名）
     */
    MoveResult newGame(String playerId);

    /**
     * 在令牌对应的局面上走一手。
     * 令牌损坏会重开新局；冷却中或非法操作返回原令牌；守恒被破坏（严格模式）直接抛出。
     */
    MoveResult play(String token, MoveIntent intent);

    /**
     * 同 {@link #play(String, MoveIntent)}，令牌损坏重开时沿用该用户的资料。
     *
     * @param playerId 外部用户ID，可为空（匿名）
     */
    MoveResult play(String token, MoveIntent intent, String playerId);

    GameView view(WarGameState state);
}
