package com.cardwar.warservice.games.war.domain.rule;

/**
 * 战争中再次平局的处理策略（整局统一，不混用）。
 */
public enum WarPolicy {

    /** 战争的下一手直接按点数决胜，平局判给电脑 */
    IMMEDIATE,
    /** 战争中再次同点则继续扣牌，牌堆变大，直到分出胜负 */
    CHAINED
}
