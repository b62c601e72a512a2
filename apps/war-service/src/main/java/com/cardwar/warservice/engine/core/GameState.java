package com.cardwar.warservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 状态是不可变值：每次转换都返回一个新快照，调用方持有的旧引用不会被改动。
 * - 具体游戏（如 WarGameState）实现此接口。
 */
public interface GameState {

    /**
     * 对局是否已经进入终局（终局后不再接受任何指令）。
     */
    boolean terminal();

    /**
     * 已接受的指令数（每次成功转换 +1）。
     */
    int moveCount();
}
