package com.cardwar.warservice.games.war.domain.exception;

/**
 * War 游戏异常基类（非受检）。
 * recoverable() 区分“可恢复”（重开/拒绝/稍后重试）与“致命”（内部逻辑缺陷）。
 */
public abstract class WarGameException extends RuntimeException {

    protected WarGameException(String message) {
        super(message);
    }

    protected WarGameException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean recoverable();
}
