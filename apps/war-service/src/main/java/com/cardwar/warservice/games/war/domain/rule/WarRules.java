package com.cardwar.warservice.games.war.domain.rule;

import lombok.Builder;

import java.util.Objects;

/**
 * 一套规则参数（由配置生成，引擎只读）。
 *
 * @param includeSpecialCards 是否加入双方各一张核弹牌（54 张）
 * @param aceHigh             A 是否按最大（14）比较；false 时 A 按 1 比较
 * @param warPolicy           战争中再次平局的策略
 * @param warCardCount        每方扣下的暗牌数
 * @param nukeThreshold       对手剩余牌数不超过该值时，核弹直接获胜
 * @param nukeCaptureSize     核弹未直接获胜时，从对手牌堆底部夺取的牌数
 * @param forcedWarInterval   每 N 手强制一次战争；0 表示关闭
 */
@Builder(toBuilder = true)
public record WarRules(
        boolean includeSpecialCards,
        boolean aceHigh,
        WarPolicy warPolicy,
        int warCardCount,
        int nukeThreshold,
        int nukeCaptureSize,
        int forcedWarInterval
) {

    public WarRules {
        Objects.requireNonNull(warPolicy, "warPolicy");
        if (warCardCount < 1) throw new IllegalArgumentException("warCardCount must be >= 1");
        if (nukeThreshold < 0) throw new IllegalArgumentException("nukeThreshold must be >= 0");
        if (nukeCaptureSize < 1) throw new IllegalArgumentException("nukeCaptureSize must be >= 1");
        if (forcedWarInterval < 0) throw new IllegalArgumentException("forcedWarInterval must be >= 0");
    }

    public static WarRules defaults() {
        return new WarRules(false, true, WarPolicy.IMMEDIATE, 3, 10, 10, 0);
    }
}
