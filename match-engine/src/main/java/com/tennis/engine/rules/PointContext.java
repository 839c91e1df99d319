package com.tennis.engine.rules;

import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.SetRecord;

/**
 * Answers "what would it mean if this player won the next point?" from the current score.
 * Only regular games are classified; every flag is false inside a tiebreak.
 */
public final class PointContext {

    private PointContext() {}

    /**
     * True at 40 against less than 40, or when holding advantage.
     */
    public static boolean isGamePointFor(int points, int opponentPoints) {
        if (points < 3) {
            return false;
        }
        return opponentPoints <= 2 || points == opponentPoints + 1;
    }

    public static boolean isGamePointFor(MatchState state, Player player) {
        if (state.isInTiebreak()) {
            return false;
        }
        return isGamePointFor(state.getGamePoints(player), state.getGamePoints(player.opponent()));
    }

    public static boolean isBreakPoint(MatchState state) {
        return isGamePointFor(state, state.getCurrentReceiver());
    }

    public static boolean isGamePoint(MatchState state) {
        return isGamePointFor(state, Player.ONE) || isGamePointFor(state, Player.TWO);
    }

    public static boolean isSetPointFor(MatchState state, Player player) {
        if (!isGamePointFor(state, player)) {
            return false;
        }
        MatchFormat format = state.getFormat();
        SetRecord set = state.currentSet();
        int gamesAfter = set.getGames(player) + 1;
        int opponentGames = set.getGames(player.opponent());
        return gamesAfter >= format.gamesToWinSet() && gamesAfter - opponentGames >= 2;
    }

    public static boolean isMatchPointFor(MatchState state, Player player) {
        return isSetPointFor(state, player)
                && state.getSetsWon(player) == state.getFormat().setsToWin() - 1;
    }

    public static PointFlags classify(MatchState state) {
        if (state.isInTiebreak()) {
            return PointFlags.NONE;
        }
        return new PointFlags(
                isBreakPoint(state),
                isGamePoint(state),
                isSetPointFor(state, Player.ONE) || isSetPointFor(state, Player.TWO),
                isMatchPointFor(state, Player.ONE) || isMatchPointFor(state, Player.TWO)
        );
    }
}
