package com.cardwar.warservice.games.war.codec.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 单张牌的序列化形式 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CardRecord {
    /** 点数 2..14，核弹牌 15 */
    private int rank;
    /** 花色字母 S/C/H/D */
    private String suit;
    private boolean faceDown;
    private boolean special;
}
