package com.cardwar.warservice.games.war.domain.model;

import com.cardwar.warservice.engine.core.Command;

import java.util.Locale;
import java.util.Objects;

/**
 * 一次出手意图：翻牌（draw）或核弹（nuke），以及出手方。
 * 用 record 表达不可变指令。
 */
public record MoveIntent(MoveKind kind, Side side) implements Command {

    public MoveIntent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(side, "side");
    }

    public static MoveIntent draw() {
        return new MoveIntent(MoveKind.DRAW, Side.PLAYER);
    }

    public static MoveIntent nuke() {
        return new MoveIntent(MoveKind.NUKE, Side.PLAYER);
    }

    public static MoveIntent nuke(Side side) {
        return new MoveIntent(MoveKind.NUKE, side);
    }

    @Override
    public String name() {
        return kind.code() + "@" + side.name().toLowerCase(Locale.ROOT);
    }
}
