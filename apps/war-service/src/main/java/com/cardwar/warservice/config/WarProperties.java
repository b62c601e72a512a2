package com.cardwar.warservice.config;

import com.cardwar.warservice.games.war.codec.CodecFormat;
import com.cardwar.warservice.games.war.domain.rule.WarPolicy;
import com.cardwar.warservice.games.war.domain.rule.WarRules;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * War 相关配置（前缀 war）。
 *
 * 规则参数、出手冷却、守恒校验模式、令牌格式、玩家资料缓存。
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Data
@Component
@ConfigurationProperties(prefix = "war")
public class WarProperties {

    private Rules rules = new Rules();

    /**
     * 两次出手的最小间隔
     */
    private Duration cooldown = Duration.ofMillis(1000);

    private Invariants invariants = new Invariants();

    private Codec codec = new Codec();

    private ProfileCache profileCache = new ProfileCache();

    public WarRules toRules() {
        return new WarRules(
                rules.isIncludeSpecialCards(),
                rules.isAceHigh(),
                rules.getWarPolicy(),
                rules.getWarCardCount(),
                rules.getNukeThreshold(),
                rules.getNukeCaptureSize(),
                rules.getForcedWarInterval());
    }

    @Data
    public static class Rules {
        /**
         * 是否加入核弹牌（双方各一张，共 54 张）
         */
        private boolean includeSpecialCards = false;
        private boolean aceHigh = true;
        /**
         * 战争中再次平局：IMMEDIATE 直接判给电脑，CHAINED 继续扣牌
         */
        private WarPolicy warPolicy = WarPolicy.IMMEDIATE;
        private int warCardCount = 3;
        private int nukeThreshold = 10;
        private int nukeCaptureSize = 10;
        /**
         * 每 N 手强制战争，0 关闭
         */
        private int forcedWarInterval = 0;
    }

    @Data
    public static class Invariants {
        /**
         * true：守恒被破坏直接抛异常；false：只记日志和指标
         */
        private boolean strict = true;
    }

    @Data
    public static class Codec {
        private CodecFormat format = CodecFormat.FULL;
    }

    @Data
    public static class ProfileCache {
        private Duration ttl = Duration.ofMinutes(10);
        /**
         * TTL 内连续失败多少次后停止回源
         */
        private int maxAttempts = 3;
    }
}
