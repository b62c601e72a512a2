package com.cardwar.warservice.games.war.domain.model;

/** 对局双方：玩家 / 电脑 */
public enum Side {

    PLAYER,
    OPPONENT;

    public Side other() {
        return this == PLAYER ? OPPONENT : PLAYER;
    }
}
