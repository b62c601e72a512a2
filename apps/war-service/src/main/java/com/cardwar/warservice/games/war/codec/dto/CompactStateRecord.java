package com.cardwar.warservice.games.war.codec.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * COMPACT 令牌的载荷：短键名 + 两字符牌编码，用于对长度敏感的传输场景。
 * 不含 message / victoryMessage / 玩家资料。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompactStateRecord {
    /** 玩家牌堆（拼接的牌编码） */
    @JsonProperty("p")
    private String playerDeck;
    @JsonProperty("o")
    private String opponentDeck;
    @JsonProperty("pc")
    private String playerCard;
    @JsonProperty("oc")
    private String opponentCard;
    /** 战争牌堆 */
    @JsonProperty("w")
    private String warPile;
    @JsonProperty("x")
    private boolean warInProgress;
    /** 状态编码，如 "war" */
    @JsonProperty("s")
    private String gameStatus;
    @JsonProperty("n")
    private int moveCount;
    @JsonProperty("t")
    private long lastMoveTimestamp;
    @JsonProperty("pn")
    private boolean playerNukeAvailable;
    @JsonProperty("on")
    private boolean opponentNukeAvailable;
    @JsonProperty("tc")
    private int totalCards;
    /** 胜者 "p"/"o"，未结束为空 */
    @JsonProperty("v")
    private String winner;
}
