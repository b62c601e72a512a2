package com.cardwar.warservice.games.war.domain.exception;

import lombok.Getter;

/**
 * 牌数守恒被破坏：说明引擎存在逻辑缺陷，该局状态已损坏。
 * 严格模式下直接向上抛出，不做任何“修复”。
 */
@Getter
public class InvariantViolationException extends WarGameException {

    private final int expected;
    private final int actual;

    public InvariantViolationException(String message, int expected, int actual) {
        super(message);
        this.expected = expected;
        this.actual = actual;
    }

    @Override
    public boolean recoverable() {
        return false;
    }
}
