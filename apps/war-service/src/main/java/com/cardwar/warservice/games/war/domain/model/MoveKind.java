package com.cardwar.warservice.games.war.domain.model;

import java.util.Locale;

public enum MoveKind {

    DRAW,
    NUKE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
