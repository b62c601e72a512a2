package com.cardwar.warservice.games.war.domain.rule;

import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.Side;

/**
 * 核心规则判断。
 * 只包含纯判断逻辑：比大小、是否强制战争、能否继续战争、核弹是否直接获胜。
 * 状态变更由引擎负责。
 */
public final class WarJudge {

    private WarJudge() {}

    /** 比较用点数：核弹牌最大；A 按规则取 14 或 1 */
    public static int value(Card card, boolean aceHigh) {
        if (card.special()) return Card.SPECIAL_RANK;
        if (!aceHigh && card.rank() == Card.ACE) return 1;
        return card.rank();
    }

    /**
     * 比较两张牌。
     * @return 正数=玩家牌大，负数=电脑牌大，0=同点
     */
    public static int compare(Card playerCard, Card opponentCard, boolean aceHigh) {
        return Integer.compare(value(playerCard, aceHigh), value(opponentCard, aceHigh));
    }

    /**
     * 本手是否强制战争（按手数取模，与时间无关）。
     * @param moveCount 本手之前已完成的手数
     * @param interval  间隔 N；0 表示关闭
     */
    public static boolean forcedWarDue(int moveCount, int interval) {
        return interval > 0 && (moveCount + 1) % interval == 0;
    }

    /** 双方剩余牌数都够扣暗牌时才能开战 */
    public static boolean canWage(int playerRemaining, int opponentRemaining, int warCardCount) {
        return playerRemaining >= warCardCount && opponentRemaining >= warCardCount;
    }

    /** 牌不够开战时的赢家：剩余牌多的一方，相等判给玩家 */
    public static Side insufficientCardsWinner(int playerRemaining, int opponentRemaining) {
        return playerRemaining >= opponentRemaining ? Side.PLAYER : Side.OPPONENT;
    }

    /**
     * 战争决胜手（IMMEDIATE 策略）：严格大者胜，同点判给电脑。
     */
    public static Side immediateWarWinner(Card playerCard, Card opponentCard, boolean aceHigh) {
        return compare(playerCard, opponentCard, aceHigh) > 0 ? Side.PLAYER : Side.OPPONENT;
    }

    /** 对手剩余牌数不超过阈值时，核弹直接获胜 */
    public static boolean nukeWinsOutright(int opponentRemaining, int threshold) {
        return opponentRemaining <= threshold;
    }
}
