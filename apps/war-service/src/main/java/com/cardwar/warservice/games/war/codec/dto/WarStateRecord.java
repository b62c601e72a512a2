package com.cardwar.warservice.games.war.codec.dto;

import com.cardwar.warservice.games.war.domain.model.GameStatus;
import com.cardwar.warservice.games.war.domain.model.Side;
import lombok.Data;

import java.util.List;

/**
 * WarStateRecord
 * -------------------------------------------------------
 * 一局 War 的完整序列化形式（FULL 令牌）。
 * - 牌堆顺序与内存一致：下标 0 = 牌堆底；
 * - playerName / playerAvatar 为空表示匿名。
 * -------------------------------------------------------
 */
@Data
public class WarStateRecord {
    private List<CardRecord> playerDeck;
    private List<CardRecord> opponentDeck;
    private CardRecord playerCard;
    private CardRecord opponentCard;
    private List<CardRecord> warPile;
    private String message;
    private String victoryMessage;
    private boolean warInProgress;
    private GameStatus gameStatus;
    private int moveCount;
    private long lastMoveTimestamp;
    private boolean playerNukeAvailable;
    private boolean opponentNukeAvailable;
    private int totalCards;
    /** 胜者；未结束为 null */
    private Side winner;
    private String playerName;
    private String playerAvatar;
}
