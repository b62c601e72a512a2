package com.cardwar.warservice.games.war.domain.model;

import java.util.Objects;

/**
 * 一张牌（不可变值）。
 * 约定：rank 2..14（11=J, 12=Q, 13=K, 14=A）；核弹牌固定 rank=15。
 * faceDown 只在牌躺在战争牌堆里时为 true，供渲染层显示牌背。
 */
public record Card(int rank, Suit suit, boolean faceDown, boolean special) {

    public static final int MIN_RANK = 2;
    public static final int JACK = 11;
    public static final int QUEEN = 12;
    public static final int KING = 13;
    public static final int ACE = 14;
    /** 核弹牌的固定点数，高于所有普通牌 */
    public static final int SPECIAL_RANK = 15;

    public Card {
        Objects.requireNonNull(suit, "suit");
        if (special ? rank != SPECIAL_RANK : (rank < MIN_RANK || rank > ACE)) {
            throw new IllegalArgumentException("rank out of range: " + rank + (special ? " (special)" : ""));
        }
    }

    public static Card of(int rank, Suit suit) {
        return new Card(rank, suit, false, false);
    }

    public static Card special(Suit suit) {
        return new Card(SPECIAL_RANK, suit, false, true);
    }

    public Card asFaceDown() {
        return faceDown ? this : new Card(rank, suit, true, special);
    }

    public Card asFaceUp() {
        return faceDown ? new Card(rank, suit, false, special) : this;
    }

    /** 是否同一张物理牌（忽略正反面） */
    public boolean sameCard(Card other) {
        return other != null && rank == other.rank && suit == other.suit && special == other.special;
    }

    /** 牌面名称：Ace / Jack / Queen / King / Nuke / 数字 */
    public String label() {
        if (special) return "Nuke";
        switch (rank) {
            case ACE: return "Ace";
            case JACK: return "Jack";
            case QUEEN: return "Queen";
            case KING: return "King";
            default: return Integer.toString(rank);
        }
    }

    @Override
    public String toString() {
        return label() + suit.symbol() + (faceDown ? "(down)" : "");
    }
}
