package com.cardwar.warservice.games.war.domain.model;

/**
 * 玩家展示资料（身份服务提供）。引擎只透传，不做任何解释。
 */
public record PlayerProfile(String displayName, String avatarUrl) {

    public static final String DEFAULT_NAME = "Player";

    public static PlayerProfile anonymous() {
        return new PlayerProfile(DEFAULT_NAME, null);
    }

    /** 展示名兜底：为空时回落到默认名 */
    public String displayNameOrDefault() {
        return displayName == null || displayName.isBlank() ? DEFAULT_NAME : displayName;
    }
}
