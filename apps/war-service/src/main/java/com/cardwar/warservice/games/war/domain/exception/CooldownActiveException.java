package com.cardwar.warservice.games.war.domain.exception;

import lombok.Getter;

/**
 * 出手过快，冷却未结束。状态保持不变，retryAfterMs 之后可重试。
 */
@Getter
public class CooldownActiveException extends WarGameException {

    private final long retryAfterMs;

    public CooldownActiveException(String message, long retryAfterMs) {
        super(message);
        this.retryAfterMs = retryAfterMs;
    }

    @Override
    public boolean recoverable() {
        return true;
    }
}
