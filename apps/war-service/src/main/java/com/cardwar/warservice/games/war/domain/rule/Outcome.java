package com.cardwar.warservice.games.war.domain.rule;

import com.cardwar.warservice.games.war.domain.model.Side;

import java.util.Locale;

/** 终局结果（玩家视角）：胜 / 负 */
public enum Outcome {

    WIN,
    LOSS;

    /**
     * 根据赢家一方换算成玩家视角的结果。
     *
     * @param winner 赢家
     * @return 玩家赢返回 {@link #WIN}，否则 {@link #LOSS}
     */
    public static Outcome forPlayer(Side winner) {
        return winner == Side.PLAYER ? WIN : LOSS;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
