package com.cardwar.warservice.config;

import com.cardwar.warservice.application.user.PlayerProfileCache;
import com.cardwar.warservice.games.war.codec.StateCodec;
import com.cardwar.warservice.games.war.domain.deck.DeckFactory;
import com.cardwar.warservice.games.war.domain.rule.WarRules;
import com.cardwar.warservice.games.war.engine.TurnResolutionEngine;
import com.cardwar.warservice.games.war.guard.InvariantChecker;
import com.cardwar.warservice.games.war.guard.TurnRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * WarEngineConfig
 * ---------------------------------------
 * War 引擎相关 Bean 的装配：把配置、时钟、随机源、指标拼到各组件里。
 *
 * 说明：
 *  - 引擎 / 编解码 / 冷却 / 校验都是无状态的普通对象，这里只负责构造；
 *  - Clock 和 Random 单独成 Bean，测试可替换。
 */
@Slf4j
@Configuration
public class WarEngineConfig {

    @Bean
    public Clock warClock() {
        return Clock.systemUTC();
    }

    /** 洗牌随机源，生产用 SecureRandom */
    @Bean
    public Random shuffleRandom() {
        return new SecureRandom();
    }

    @Bean
    public WarRules warRules(WarProperties props) {
        WarRules rules = props.toRules();
        log.info("War 规则: {}", rules);
        return rules;
    }

    @Bean
    public DeckFactory deckFactory(Random shuffleRandom, WarRules warRules) {
        return new DeckFactory(shuffleRandom, warRules);
    }

    @Bean
    public TurnResolutionEngine turnResolutionEngine(WarRules warRules, Clock warClock) {
        return new TurnResolutionEngine(warRules, warClock);
    }

    @Bean
    public StateCodec stateCodec(ObjectMapper objectMapper, WarProperties props) {
        return new StateCodec(objectMapper, props.getCodec().getFormat());
    }

    @Bean
    public TurnRateLimiter turnRateLimiter(Clock warClock, WarProperties props) {
        return new TurnRateLimiter(warClock, props.getCooldown());
    }

    /**
     * 没有配置任何指标后端时退回内存注册表，保证计数器可用。
     */
    @Bean
    public InvariantChecker invariantChecker(WarProperties props, ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
        return new InvariantChecker(props.getInvariants().isStrict(), registry);
    }

    @Bean
    public PlayerProfileCache playerProfileCache(Clock warClock, WarProperties props) {
        WarProperties.ProfileCache cfg = props.getProfileCache();
        return new PlayerProfileCache(warClock, cfg.getTtl(), cfg.getMaxAttempts());
    }
}
