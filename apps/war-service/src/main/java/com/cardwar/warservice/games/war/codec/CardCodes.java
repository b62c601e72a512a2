package com.cardwar.warservice.games.war.codec;

import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.Suit;

import java.util.ArrayList;
import java.util.List;

/**
 * 紧凑牌编码：每张牌两个字符。
 *   第 1 位：点数十六进制（2..9, a=10 .. e=14, f=核弹）
 *   第 2 位：花色字母，大写=正面，小写=背面
 * 例："eS" = 黑桃 A，"7h" = 红桃 7（背面）。
 */
final class CardCodes {

    private CardCodes() {
    }

    static String encode(Card card) {
        if (card == null) return null;
        char rank = Character.forDigit(card.rank(), 16);
        char suit = card.faceDown()
                ? Character.toLowerCase(card.suit().code())
                : Character.toUpperCase(card.suit().code());
        return new String(new char[]{rank, suit});
    }

    static String encodeAll(List<Card> cards) {
        StringBuilder sb = new StringBuilder(cards.size() * 2);
        for (Card c : cards) sb.append(encode(c));
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException 编码非法
     */
    static Card decode(String code) {
        if (code == null || code.isEmpty()) return null;
        if (code.length() != 2) {
            throw new IllegalArgumentException("bad card code: " + code);
        }
        int rank = Character.digit(code.charAt(0), 16);
        char s = code.charAt(1);
        Suit suit = Suit.fromCode(s);
        boolean faceDown = Character.isLowerCase(s);
        boolean special = rank == Card.SPECIAL_RANK;
        return new Card(rank, suit, faceDown, special);
    }

    static List<Card> decodeAll(String packed) {
        if (packed == null || packed.isEmpty()) return List.of();
        if (packed.length() % 2 != 0) {
            throw new IllegalArgumentException("packed card string has odd length: " + packed.length());
        }
        List<Card> out = new ArrayList<>(packed.length() / 2);
        for (int i = 0; i < packed.length(); i += 2) {
            out.add(decode(packed.substring(i, i + 2)));
        }
        return out;
    }
}
