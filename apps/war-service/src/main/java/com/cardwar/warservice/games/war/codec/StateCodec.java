package com.cardwar.warservice.games.war.codec;

import com.cardwar.warservice.games.war.codec.dto.CardRecord;
import com.cardwar.warservice.games.war.codec.dto.CompactStateRecord;
import com.cardwar.warservice.games.war.codec.dto.WarStateRecord;
import com.cardwar.warservice.games.war.domain.exception.StateDecodeException;
import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import com.cardwar.warservice.games.war.domain.model.Side;
import com.cardwar.warservice.games.war.domain.model.Suit;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 状态令牌编解码：WarGameState <-> 不透明字符串。
 * 令牌 = 格式标记（1 字符）+ Base64URL(JSON)，可安全放进 URL / 表单字段。
 * 解码失败一律转成 {@link StateDecodeException}，由调用方决定是否重开新局。
 */
@Slf4j
public class StateCodec {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;
    private final CodecFormat defaultFormat;

    public StateCodec(ObjectMapper objectMapper, CodecFormat defaultFormat) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.defaultFormat = defaultFormat == null ? CodecFormat.FULL : defaultFormat;
    }

    public StateCodec(ObjectMapper objectMapper) {
        this(objectMapper, CodecFormat.FULL);
    }

    public CodecFormat defaultFormat() {
        return defaultFormat;
    }

    /** 按配置的默认格式编码 */
    public String encodeDefault(WarGameState state) {
        return encode(state, defaultFormat);
    }

    public String encode(WarGameState state) {
        return encode(state, CodecFormat.FULL);
    }

    public String encodeCompact(WarGameState state) {
        return encode(state, CodecFormat.COMPACT);
    }

    public String encode(WarGameState state, CodecFormat format) {
        Objects.requireNonNull(state, "state");
        Object payload = format == CodecFormat.COMPACT ? toCompact(state) : toRecord(state);
        try {
            byte[] json = objectMapper.writeValueAsBytes(payload);
            return format.marker() + ENCODER.encodeToString(json);
        } catch (JsonProcessingException e) {
            // 内存里的状态都是合法值，走到这里说明 ObjectMapper 配置有问题
            throw new IllegalStateException("序列化对局状态失败", e);
        }
    }

    /**
     * 解码任一格式的令牌。
     *
     * @throws StateDecodeException 令牌为空、格式未知、Base64/JSON 损坏或内容不合法
     */
    public WarGameState decode(String token) {
        if (token == null || token.isBlank()) {
            throw new StateDecodeException("empty state token");
        }
        CodecFormat format = CodecFormat.fromMarker(token.charAt(0));
        if (format == null) {
            throw new StateDecodeException("unknown state token format: " + token.charAt(0));
        }
        try {
            byte[] json = DECODER.decode(token.substring(1).trim());
            if (format == CodecFormat.COMPACT) {
                CompactStateRecord compact = objectMapper.readValue(json, CompactStateRecord.class);
                if (compact == null) throw new StateDecodeException("empty state payload");
                return fromCompact(compact);
            }
            WarStateRecord full = objectMapper.readValue(json, WarStateRecord.class);
            if (full == null) throw new StateDecodeException("empty state payload");
            return fromRecord(full);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("状态令牌解码失败: format={}, err={}", format, e.getMessage());
            throw new StateDecodeException("state token could not be decoded", e);
        }
    }

    // ----------- FULL -----------

    private WarStateRecord toRecord(WarGameState s) {
        WarStateRecord r = new WarStateRecord();
        r.setPlayerDeck(toCardRecords(s.playerDeck()));
        r.setOpponentDeck(toCardRecords(s.opponentDeck()));
        r.setPlayerCard(toCardRecord(s.playerCard()));
        r.setOpponentCard(toCardRecord(s.opponentCard()));
        r.setWarPile(toCardRecords(s.warPile()));
        r.setMessage(s.message());
        r.setVictoryMessage(s.victoryMessage());
        r.setWarInProgress(s.warInProgress());
        r.setGameStatus(s.gameStatus());
        r.setMoveCount(s.moveCount());
        r.setLastMoveTimestamp(s.lastMoveTimestamp());
        r.setPlayerNukeAvailable(s.playerNukeAvailable());
        r.setOpponentNukeAvailable(s.opponentNukeAvailable());
        r.setTotalCards(s.totalCards());
        r.setWinner(s.winner());
        if (s.player() != null) {
            r.setPlayerName(s.player().displayName());
            r.setPlayerAvatar(s.player().avatarUrl());
        }
        return r;
    }

    private WarGameState fromRecord(WarStateRecord r) {
        PlayerProfile player = r.getPlayerName() == null && r.getPlayerAvatar() == null
                ? null
                : new PlayerProfile(r.getPlayerName(), r.getPlayerAvatar());
        return WarGameState.builder()
                .playerDeck(fromCardRecords(r.getPlayerDeck()))
                .opponentDeck(fromCardRecords(r.getOpponentDeck()))
                .playerCard(fromCardRecord(r.getPlayerCard()))
                .opponentCard(fromCardRecord(r.getOpponentCard()))
                .warPile(fromCardRecords(r.getWarPile()))
                .message(r.getMessage())
                .victoryMessage(r.getVictoryMessage())
                .warInProgress(r.isWarInProgress())
                .gameStatus(r.getGameStatus())
                .moveCount(r.getMoveCount())
                .lastMoveTimestamp(r.getLastMoveTimestamp())
                .playerNukeAvailable(r.isPlayerNukeAvailable())
                .opponentNukeAvailable(r.isOpponentNukeAvailable())
                .totalCards(r.getTotalCards())
                .winner(r.getWinner())
                .player(player)
                .build();
    }

    private static CardRecord toCardRecord(Card c) {
        if (c == null) return null;
        return new CardRecord(c.rank(), String.valueOf(c.suit().code()), c.faceDown(), c.special());
    }

    private static List<CardRecord> toCardRecords(List<Card> cards) {
        List<CardRecord> out = new ArrayList<>(cards.size());
        for (Card c : cards) out.add(toCardRecord(c));
        return out;
    }

    private static Card fromCardRecord(CardRecord r) {
        if (r == null) return null;
        if (r.getSuit() == null || r.getSuit().length() != 1) {
            throw new IllegalArgumentException("bad suit: " + r.getSuit());
        }
        return new Card(r.getRank(), Suit.fromCode(r.getSuit().charAt(0)), r.isFaceDown(), r.isSpecial());
    }

    private static List<Card> fromCardRecords(List<CardRecord> records) {
        if (records == null) return List.of();
        List<Card> out = new ArrayList<>(records.size());
        for (CardRecord r : records) {
            Card c = fromCardRecord(r);
            if (c == null) {
                throw new IllegalArgumentException("null card in pile");
            }
            out.add(c);
        }
        return out;
    }

    // ----------- COMPACT -----------

    private CompactStateRecord toCompact(WarGameState s) {
        CompactStateRecord r = new CompactStateRecord();
        r.setPlayerDeck(CardCodes.encodeAll(s.playerDeck()));
        r.setOpponentDeck(CardCodes.encodeAll(s.opponentDeck()));
        r.setPlayerCard(CardCodes.encode(s.playerCard()));
        r.setOpponentCard(CardCodes.encode(s.opponentCard()));
        r.setWarPile(CardCodes.encodeAll(s.warPile()));
        r.setWarInProgress(s.warInProgress());
        r.setGameStatus(s.gameStatus().code());
        r.setMoveCount(s.moveCount());
        r.setLastMoveTimestamp(s.lastMoveTimestamp());
        r.setPlayerNukeAvailable(s.playerNukeAvailable());
        r.setOpponentNukeAvailable(s.opponentNukeAvailable());
        r.setTotalCards(s.totalCards());
        if (s.winner() != null) {
            r.setWinner(s.winner() == Side.PLAYER ? "p" : "o");
        }
        return r;
    }

    private WarGameState fromCompact(CompactStateRecord r) {
        return WarGameState.builder()
                .playerDeck(CardCodes.decodeAll(r.getPlayerDeck()))
                .opponentDeck(CardCodes.decodeAll(r.getOpponentDeck()))
                .playerCard(CardCodes.decode(r.getPlayerCard()))
                .opponentCard(CardCodes.decode(r.getOpponentCard()))
                .warPile(CardCodes.decodeAll(r.getWarPile()))
                .warInProgress(r.isWarInProgress())
                .gameStatus(statusOf(r.getGameStatus()))
                .moveCount(r.getMoveCount())
                .lastMoveTimestamp(r.getLastMoveTimestamp())
                .playerNukeAvailable(r.isPlayerNukeAvailable())
                .opponentNukeAvailable(r.isOpponentNukeAvailable())
                .totalCards(r.getTotalCards())
                .winner(winnerOf(r.getWinner()))
                .build();
    }

    private static GameStatus statusOf(String code) {
        if (code == null) return GameStatus.INITIAL;
        return GameStatus.valueOf(code.toUpperCase(Locale.ROOT));
    }

    private static Side winnerOf(String code) {
        if (code == null || code.isEmpty()) return null;
        switch (code) {
            case "p": return Side.PLAYER;
            case "o": return Side.OPPONENT;
            default: throw new IllegalArgumentException("bad winner code: " + code);
        }
    }
}
