package com.cardwar.warservice.games.war.codec;

/**
 * 状态令牌格式。令牌首字符为格式标记，其后是 Base64URL(JSON)。
 */
public enum CodecFormat {

    /** 全字段，可读字段名 */
    FULL('F'),
    /** 去掉展示文案，牌压成两字符编码 */
    COMPACT('C');

    private final char marker;

    CodecFormat(char marker) {
        this.marker = marker;
    }

    public char marker() {
        return marker;
    }

    /** 按首字符识别格式，未知返回 null */
    public static CodecFormat fromMarker(char c) {
        for (CodecFormat f : values()) {
            if (f.marker == c) return f;
        }
        return null;
    }
}
