package com.cardwar.warservice.games.war.event;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 终局统计：按玩家视角的胜负累加进程内计数器 war.games.ended{outcome=win|loss}。
 * 持久化的战绩由外部监听同一事件自行实现。
 */
@Slf4j
@Component
public class GameOutcomeMetricsListener {

    public static final String ENDED_METRIC = "war.games.ended";

    private final MeterRegistry meterRegistry;

    public GameOutcomeMetricsListener(ObjectProvider<MeterRegistry> meterRegistry) {
        this.meterRegistry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
    }

    @EventListener
    public void onGameEnded(GameEndedEvent event) {
        if (event.getOutcome() == null) {
            log.warn("收到缺少结果的终局事件: {}", event);
            return;
        }
        meterRegistry.counter(ENDED_METRIC, "outcome", event.getOutcome().code()).increment();
        log.info("对局结束统计: outcome={}, moves={}, player={}",
                event.getOutcome().code(), event.getMoveCount(),
                event.getPlayer() == null ? null : event.getPlayer().displayNameOrDefault());
    }
}
