package com.cardwar.warservice.games.war.domain.model;

import java.util.Locale;

/**
 * 对局阶段：INITIAL -> PLAYING <-> WAR -> ENDED（终局不可逆）。
 */
public enum GameStatus {

    /** 刚发完牌，尚未翻牌 */
    INITIAL,
    /** 普通回合进行中 */
    PLAYING,
    /** 战争进行中，下一手决定战争胜负 */
    WAR,
    /** 已结束（只读） */
    ENDED;

    /** 对外展示用的小写编码，如 "war" */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
