package com.cardwar.warservice.engine.core;

/**
 * 回合引擎抽象：给定当前状态和一条指令，返回下一状态。
 * - 纯函数语义：不修改入参 state，不持有跨调用的可变数据；
 * - 泛型 S、C 保持与具体游戏解耦。
 */
public interface TurnEngine<S extends GameState, C extends Command> {

    S apply(S state, C command);
}
