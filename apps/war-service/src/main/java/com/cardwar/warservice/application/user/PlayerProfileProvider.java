package com.cardwar.warservice.application.user;

import com.cardwar.warservice.games.war.domain.model.PlayerProfile;

import java.util.Optional;

/**
 * 外部身份服务的接入点（由宿主应用实现）。
 * 允许抛异常，调用方负责兜底。
 */
public interface PlayerProfileProvider {

    /**
     * @param playerId 外部用户ID
     * @return 用户资料，不存在返回 empty
     */
    Optional<PlayerProfile> fetch(String playerId);
}
