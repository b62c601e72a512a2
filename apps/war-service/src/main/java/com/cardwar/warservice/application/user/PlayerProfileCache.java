package com.cardwar.warservice.application.user;

import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 玩家资料本地缓存（进程内）。
 * 每个 key 记录资料本身和连续失败次数，TTL 到期后整条失效。
 * 失败次数达到 maxAttempts 后，在 TTL 内不再回源。
 */
@Slf4j
public class PlayerProfileCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long ttlMs;
    private final int maxAttempts;

    public PlayerProfileCache(Clock clock, Duration ttl, int maxAttempts) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.clock = clock;
        this.ttlMs = ttl.toMillis();
        this.maxAttempts = maxAttempts;
    }

    public Optional<PlayerProfile> get(String playerId) {
        Entry e = live(playerId);
        return e == null ? Optional.empty() : Optional.ofNullable(e.profile);
    }

    public void put(String playerId, PlayerProfile profile) {
        entries.put(playerId, new Entry(profile, 0, clock.millis() + ttlMs));
    }

    /** 记一次回源失败，返回当前连续失败次数 */
    public int recordFailure(String playerId) {
        long now = clock.millis();
        Entry updated = entries.compute(playerId, (k, old) -> {
            if (old == null || old.expiresAt <= now) {
                return new Entry(null, 1, now + ttlMs);
            }
            return new Entry(old.profile, old.failures + 1, old.expiresAt);
        });
        if (updated.failures == maxAttempts) {
            log.warn("玩家资料回源连续失败 {} 次，TTL 内暂停回源: playerId={}", maxAttempts, playerId);
        }
        return updated.failures;
    }

    /** 失败次数已达上限且未过期 */
    public boolean suppressed(String playerId) {
        Entry e = live(playerId);
        return e != null && e.failures >= maxAttempts;
    }

    private Entry live(String playerId) {
        if (playerId == null) return null;
        Entry e = entries.get(playerId);
        if (e == null) return null;
        if (e.expiresAt <= clock.millis()) {
            entries.remove(playerId, e);
            return null;
        }
        return e;
    }

    private static final class Entry {
        final PlayerProfile profile;
        final int failures;
        final long expiresAt;

        Entry(PlayerProfile profile, int failures, long expiresAt) {
            this.profile = profile;
            this.failures = failures;
            this.expiresAt = expiresAt;
        }
    }
}
