package com.cardwar.warservice.games.war.service;

/** 一次出手请求的处理结果 */
public enum MoveStatus {

    /** 已结算，返回新令牌 */
    ACCEPTED,
    /** 冷却中，状态和令牌不变 */
    COOLDOWN,
    /** 非法操作（已结束 / 核弹不可用），状态和令牌不变 */
    REJECTED,
    /** 令牌无法解析，已重开新局 */
    RESTARTED
}
