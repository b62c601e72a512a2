package com.cardwar.warservice.application.user;

import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 玩家资料查询入口：缓存 -> 身份服务 -> 兜底（"Player"，无头像）。
 * 任何失败都不抛给调用方。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerProfileService {

    private final ObjectProvider<PlayerProfileProvider> providers;
    private final PlayerProfileCache cache;

    public PlayerProfile resolve(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            return PlayerProfile.anonymous();
        }
        Optional<PlayerProfile> cached = cache.get(playerId);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (cache.suppressed(playerId)) {
            return PlayerProfile.anonymous();
        }
        PlayerProfileProvider provider = providers.getIfAvailable();
        if (provider == null) {
            return PlayerProfile.anonymous();
        }
        try {
            PlayerProfile profile = provider.fetch(playerId)
                    .map(p -> new PlayerProfile(p.displayNameOrDefault(), p.avatarUrl()))
                    .orElseGet(PlayerProfile::anonymous);
            cache.put(playerId, profile);
            return profile;
        } catch (RuntimeException e) {
            int failures = cache.recordFailure(playerId);
            log.warn("获取玩家资料失败，走兜底: playerId={}, failures={}, ex={}", playerId, failures, e.toString());
            return PlayerProfile.anonymous();
        }
    }
}
