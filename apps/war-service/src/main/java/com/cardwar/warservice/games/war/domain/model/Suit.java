package com.cardwar.warservice.games.war.domain.model;

/**
 * 花色：符号用于展示，code 用于紧凑编码。
 */
public enum Suit {

    SPADES('♠', 'S'),
    CLUBS('♣', 'C'),
    HEARTS('♥', 'H'),
    DIAMONDS('♦', 'D');

    private final char symbol;
    private final char code;

    Suit(char symbol, char code) {
        this.symbol = symbol;
        this.code = code;
    }

    public char symbol() { return symbol; }

    public char code() { return code; }

    /**
     * 按紧凑编码字母查找花色（大小写不敏感）。
     * @throws IllegalArgumentException 未知字母
     */
    public static Suit fromCode(char c) {
        char upper = Character.toUpperCase(c);
        for (Suit s : values()) {
            if (s.code == upper) return s;
        }
        throw new IllegalArgumentException("unknown suit code: " + c);
    }
}
