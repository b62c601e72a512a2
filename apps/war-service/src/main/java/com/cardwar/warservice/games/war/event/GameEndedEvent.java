package com.cardwar.warservice.games.war.event;

import com.cardwar.warservice.games.war.domain.model.PlayerProfile;
import com.cardwar.warservice.games.war.domain.model.Side;
import com.cardwar.warservice.games.war.domain.model.WarGameState;
import com.cardwar.warservice.games.war.domain.rule.Outcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局结束事件。
 *
 * 一局从进行中切到 ended 的那一手发布一次，供战绩统计等下游监听
 * （@EventListener 即可，不需要关心令牌和引擎）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameEndedEvent {

    /** 赢家 */
    private Side winner;

    /** 玩家视角结果：win / loss */
    private Outcome outcome;

    /** 本局总手数 */
    private int moveCount;

    /** 玩家资料，COMPACT 令牌下可能为 null */
    private PlayerProfile player;

    /** 结束时间（毫秒时间戳，取自终局那一手） */
    private long timestamp;

    public static GameEndedEvent of(WarGameState ended) {
        return new GameEndedEvent(ended.winner(), Outcome.forPlayer(ended.winner()),
                ended.moveCount(), ended.player(), ended.lastMoveTimestamp());
    }
}
