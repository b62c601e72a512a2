package com.cardwar.warservice.games.war.domain.deck;

import com.cardwar.warservice.games.war.domain.constants.GameMessages;
import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import com.cardwar.warservice.games.war.domain.model.Suit;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.cardwar.warservice.games.war.domain.rule.WarRules;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * 牌组工厂：造牌、洗牌、发牌开局。
 * 随机源由外部注入（生产用 SecureRandom，测试可传固定种子）。
 */
@Slf4j
public class DeckFactory {

    /** 标准牌组大小：4 花色 x 13 点 */
    public static final int STANDARD_SIZE = 52;
    /** 核弹牌花色：玩家一张黑桃、电脑一张红桃 */
    private static final Suit[] SPECIAL_SUITS = {Suit.SPADES, Suit.HEARTS};

    private final Random random;
    private final WarRules rules;

    public DeckFactory(Random random, WarRules rules) {
        this.random = Objects.requireNonNull(random, "random");
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /**
     * 生成一副按花色、点数排好的整牌（未洗）。
     * @param includeSpecial true 时追加双方各一张核弹牌（54 张）
     */
    public List<Card> buildDeck(boolean includeSpecial) {
        List<Card> cards = new ArrayList<>(STANDARD_SIZE + SPECIAL_SUITS.length);
        for (Suit suit : Suit.values()) {
            for (int rank = Card.MIN_RANK; rank <= Card.ACE; rank++) {
                cards.add(Card.of(rank, suit));
            }
        }
        if (includeSpecial) {
            for (Suit suit : SPECIAL_SUITS) {
                cards.add(Card.special(suit));
            }
        }
        return cards;
    }

    /**
     * Fisher–Yates 洗牌：每种排列等概率。入参不被修改，返回新列表。
     */
    public List<Card> shuffle(List<Card> cards) {
        List<Card> out = new ArrayList<>(cards);
        for (int i = out.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Card tmp = out.get(i);
            out.set(i, out.get(j));
            out.set(j, tmp);
        }
        return out;
    }

    /**
     * 开新局：造牌、洗牌、对半分（玩家 floor(n/2)，电脑拿剩下的）。
     * @param profile 玩家展示资料，可为 null
     */
    public WarGameState initializeGame(PlayerProfile profile) {
        boolean special = rules.includeSpecialCards();
        List<Card> deck = shuffle(buildDeck(special));
        int midpoint = deck.size() / 2;

        WarGameState state = WarGameState.builder()
                .playerDeck(deck.subList(0, midpoint))
                .opponentDeck(deck.subList(midpoint, deck.size()))
                .message(GameMessages.WELCOME)
                .gameStatus(GameStatus.INITIAL)
                .moveCount(0)
                .lastMoveTimestamp(0L)
                .playerNukeAvailable(special)
                .opponentNukeAvailable(special)
                .totalCards(deck.size())
                .player(profile)
                .build();
        log.debug("新局已发牌: total={}, player={}, opponent={}",
                state.totalCards(), state.playerDeck().size(), state.opponentDeck().size());
        return state;
    }

    public WarGameState initializeGame() {
        return initializeGame(null);
    }
}
