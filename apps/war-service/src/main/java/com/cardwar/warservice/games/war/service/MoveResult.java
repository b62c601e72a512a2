package com.cardwar.warservice.games.war.service;

import com.cardwar.warservice.games.war.domain.model.WarGameState;

/**
 * 出手结果：调用方应保存 token，渲染 state。
 *
 * @param justEnded    这一手让对局结束（每局只会出现一次 true）
 * @param retryAfterMs 仅 COOLDOWN 时有值
 * @param error        非 ACCEPTED 时的提示文案
 */
public record MoveResult(
        MoveStatus status,
        WarGameState state,
        String token,
        boolean justEnded,
        long retryAfterMs,
        String error
) {

    public static MoveResult accepted(WarGameState state, String token, boolean justEnded) {
        return new MoveResult(MoveStatus.ACCEPTED, state, token, justEnded, 0L, null);
    }

    public static MoveResult cooldown(WarGameState state, String token, long retryAfterMs, String error) {
        return new MoveResult(MoveStatus.COOLDOWN, state, token, false, retryAfterMs, error);
    }

    public static MoveResult rejected(WarGameState state, String token, String error) {
        return new MoveResult(MoveStatus.REJECTED, state, token, false, 0L, error);
    }

    public static MoveResult restarted(WarGameState state, String token, String error) {
        return new MoveResult(MoveStatus.RESTARTED, state, token, false, 0L, error);
    }

    public boolean accepted() {
        return status == MoveStatus.ACCEPTED;
    }
}
