package com.cardwar.warservice.games.war.guard;

import com.cardwar.warservice.games.war.domain.constants.GameMessages;
import com.cardwar.warservice.games.war.domain.exception.CooldownActiveException;
import com.cardwar.warservice.games.war.domain.model.WarGameState;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * 出手冷却：两次有效出手之间至少间隔 period。
 * lastMoveTimestamp <= 0 视为从未出手，不受限制。
 */
public class TurnRateLimiter {

    public static final Duration DEFAULT_PERIOD = Duration.ofMillis(1000);

    private final Clock clock;
    private final long periodMs;

    public TurnRateLimiter(Clock clock, Duration period) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Duration p = period == null ? DEFAULT_PERIOD : period;
        if (p.isNegative()) {
            throw new IllegalArgumentException("cooldown period must not be negative: " + p);
        }
        this.periodMs = p.toMillis();
    }

    public static boolean isOnCooldown(long lastMoveTimestamp, long now, long periodMs) {
        return remaining(lastMoveTimestamp, now, periodMs) > 0;
    }

    /** 剩余冷却毫秒数；时钟回拨时按刚出手处理 */
    public static long remaining(long lastMoveTimestamp, long now, long periodMs) {
        if (lastMoveTimestamp <= 0) return 0;
        long elapsed = Math.max(0, now - lastMoveTimestamp);
        return Math.max(0, periodMs - elapsed);
    }

    public boolean isOnCooldown(WarGameState state) {
        return isOnCooldown(state.lastMoveTimestamp(), clock.millis(), periodMs);
    }

    /**
     * @throws CooldownActiveException 冷却未结束
     */
    public void check(WarGameState state) {
        long wait = remaining(state.lastMoveTimestamp(), clock.millis(), periodMs);
        if (wait > 0) {
            throw new CooldownActiveException(GameMessages.COOLDOWN, wait);
        }
    }

    public long periodMs() {
        return periodMs;
    }
}
