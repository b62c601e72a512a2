package com.cardwar.warservice.games.war.domain.constants;

import com.cardwar.warservice.games.war.domain.model.Card;
import com.cardwar.warservice.games.war.domain.model.Side;

/**
 * War 游戏相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   String m = GameMessages.formatRoundWon(Side.PLAYER, card);
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 对局状态消息 ==========

    /** 新局 */
    public static final String WELCOME = "Welcome to War! Draw a card to begin.";

    /** 开战 */
    public static final String WAR_DECLARED = "WAR! %d cards face down, next card decides the winner!";

    /** 战争中再次同点（CHAINED 策略） */
    public static final String WAR_EXTENDED = "Another tie! The war goes on with %d more cards each!";

    /** 普通回合胜负 */
    public static final String ROUND_WON_PLAYER = "You win with %s!";
    public static final String ROUND_WON_OPPONENT = "Computer wins with %s!";

    /** 战争胜负 */
    public static final String WAR_WON_PLAYER = "You won the WAR with %s!";
    public static final String WAR_WON_OPPONENT = "CPU won the WAR with %s!";

    /** 牌不够开战 */
    public static final String NOT_ENOUGH_FOR_WAR = "Not enough cards for war! %s";

    /** 终局 */
    public static final String GAME_OVER = "Game Over! %s";
    public static final String YOU_WIN = "You win!";
    public static final String COMPUTER_WINS = "Computer wins!";

    /** 核弹 */
    public static final String NUKE_WIPEOUT_PLAYER = "NUKE! You wiped out the computer's last %d cards!";
    public static final String NUKE_WIPEOUT_OPPONENT = "NUKE! The computer wiped out your last %d cards!";
    public static final String NUKE_CAPTURE_PLAYER = "NUKE! You captured %d cards from the computer!";
    public static final String NUKE_CAPTURE_OPPONENT = "NUKE! The computer captured %d of your cards!";

    // ========== 错误消息 ==========

    /** 对局已结束 */
    public static final String GAME_ALREADY_ENDED = "The game is over, start a new one";

    /** 核弹不可用 */
    public static final String NUKE_UNAVAILABLE = "Nuke is not available";

    /** 冷却中 */
    public static final String COOLDOWN = "Please wait a moment before drawing again...";

    /** 状态无法解析 */
    public static final String STATE_UNREADABLE = "Game state could not be read, a new game was started";

    public static String winnerLine(Side winner) {
        return winner == Side.PLAYER ? YOU_WIN : COMPUTER_WINS;
    }

    public static String formatWarDeclared(int warCardCount) {
        return String.format(WAR_DECLARED, warCardCount);
    }

    public static String formatWarExtended(int warCardCount) {
        return String.format(WAR_EXTENDED, warCardCount);
    }

    public static String formatRoundWon(Side winner, Card winningCard) {
        return String.format(winner == Side.PLAYER ? ROUND_WON_PLAYER : ROUND_WON_OPPONENT, winningCard.label());
    }

    public static String formatWarWon(Side winner, Card winningCard) {
        return String.format(winner == Side.PLAYER ? WAR_WON_PLAYER : WAR_WON_OPPONENT, winningCard.label());
    }

    public static String formatNotEnoughForWar(Side winner) {
        return String.format(NOT_ENOUGH_FOR_WAR, winnerLine(winner));
    }

    public static String formatGameOver(Side winner) {
        return String.format(GAME_OVER, winnerLine(winner));
    }

    public static String formatNukeWipeout(Side actor, int cards) {
        return String.format(actor == Side.PLAYER ? NUKE_WIPEOUT_PLAYER : NUKE_WIPEOUT_OPPONENT, cards);
    }

    public static String formatNukeCapture(Side actor, int cards) {
        return String.format(actor == Side.PLAYER ? NUKE_CAPTURE_PLAYER : NUKE_CAPTURE_OPPONENT, cards);
    }
}
