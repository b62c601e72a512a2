package com.cardwar.warservice.engine.core;

/**
 * 统一的“玩家输入指令”抽象，回合制游戏每次请求对应一条指令。
 * - 传输层只需把请求翻译成 Command，对具体游戏透明；
 * - name() 用于日志与诊断。
 */
public interface Command {

    String name();
}
