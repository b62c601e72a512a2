package com.cardwar.warservice.games.war.domain.exception;

/**
 * 非法指令：对局已结束、核弹不可用等。状态保持不变。
 */
public class InvalidMoveException extends WarGameException {

    public InvalidMoveException(String message) {
        super(message);
    }

    @Override
    public boolean recoverable() {
        return true;
    }
}
