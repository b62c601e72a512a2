package com.cardwar.warservice.games.war.domain.exception;

/**
 * 状态令牌无法解码（格式错误、被截断、字段缺失）。
 * 不做修复：调用方应重新开局。
 */
public class StateDecodeException extends WarGameException {

    public StateDecodeException(String message) {
        super(message);
    }

    public StateDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean recoverable() {
        return true;
    }
}
