package com.cardwar.warservice.games.war.guard;

import com.cardwar.warservice.games.war.domain.exception.InvariantViolationException;
import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * 牌数守恒校验：双方牌堆 + 战争牌堆 + 悬空的翻牌 == totalCards。
 * 只校验、记录，不修复。
 * - strict：抛 InvariantViolationException
 * - lenient：打 error 日志并累加计数器 war.invariant.violations，状态原样返回
 */
@Slf4j
public class InvariantChecker {

    public static final String VIOLATION_METRIC = "war.invariant.violations";

    private final boolean strict;
    private final MeterRegistry meterRegistry;

    public InvariantChecker(boolean strict, MeterRegistry meterRegistry) {
        this.strict = strict;
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public boolean strict() {
        return strict;
    }

    /**
     * 统计当前状态里的总牌数。
     * 翻开的牌在结算后已归入某个牌堆，只在找不到时才单独计入。
     */
    public static int countCards(WarGameState s) {
        return s.playerDeck().size() + s.opponentDeck().size() + s.warPile().size() + inPlayCount(s);
    }

    /** 悬空的翻牌数（不在任何牌堆里） */
    public static int inPlayCount(WarGameState s) {
        int n = 0;
        if (isLoose(s.playerCard(), s)) n++;
        if (isLoose(s.opponentCard(), s)) n++;
        return n;
    }

    public boolean verifyCardCount(WarGameState s) {
        return verifyCardCount(s, "check");
    }

    public boolean verifyCardCount(WarGameState s, String stage) {
        int counted = countCards(s);
        if (counted == s.totalCards()) return true;
        log.error("牌数守恒被破坏: stage={} total={} playerDeck={} opponentDeck={} warPile={} inPlay={} counted={} move={}",
                stage, s.totalCards(), s.playerDeck().size(), s.opponentDeck().size(), s.warPile().size(),
                inPlayCount(s), counted, s.moveCount());
        return false;
    }

    /**
     * 按模式处理校验结果。
     *
     * @param stage 校验发生的环节（如 "init"、"move"），用于日志和指标标签
     * @return 原状态
     * @throws InvariantViolationException strict 模式下校验失败
     */
    public WarGameState enforce(WarGameState s, String stage) {
        if (verifyCardCount(s, stage)) return s;
        meterRegistry.counter(VIOLATION_METRIC, "stage", stage).increment();
        if (strict) {
            throw new InvariantViolationException(
                    "card count mismatch after " + stage, s.totalCards(), countCards(s));
        }
        log.warn("非严格模式，继续使用异常状态: stage={}", stage);
        return s;
    }

    private static boolean isLoose(Card card, WarGameState s) {
        if (card == null) return false;
        return !containsCard(s.playerDeck(), card)
                && !containsCard(s.opponentDeck(), card)
                && !containsCard(s.warPile(), card);
    }

    private static boolean containsCard(List<Card> cards, Card card) {
        for (Card c : cards) {
            if (c.sameCard(card)) return true;
        }
        return false;
    }
}
