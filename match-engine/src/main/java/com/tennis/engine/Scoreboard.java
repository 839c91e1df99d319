package com.tennis.engine;

import com.tennis.engine.model.MatchPhase;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.SetRecord;
import com.tennis.engine.rules.ServeRotation;

import java.util.List;

/**
 * Read-only view of the live score.
 *
 * @param pointsOne    display value for player one: "0", "15", "30", "40", "Ad", "" in a game, the
 *                     raw count in a tiebreak
 * @param changeEnds   players change ends before the next tiebreak point
 * @param sets         copies of every set row, current set included
 */
public record Scoreboard(
        String location,
        String playerOneName,
        String playerTwoName,
        Player server,
        int setsOne,
        int setsTwo,
        int gamesOne,
        int gamesTwo,
        String pointsOne,
        String pointsTwo,
        MatchPhase phase,
        boolean setTiebreak,
        boolean matchTiebreak,
        boolean changeEnds,
        boolean awaitingMatchTiebreakServer,
        Player winner,
        List<SetRecord> sets
) {

    public static Scoreboard of(MatchState state) {
        SetRecord current = state.currentSet();
        String[] points = displayPoints(state);
        boolean tiebreakUnderway = state.isInTiebreak() && state.getTiebreakStartServer() != null;
        return new Scoreboard(
                state.getLocation(),
                state.getPlayerOneName(),
                state.getPlayerTwoName(),
                state.getCurrentServer(),
                state.getSetsWon(Player.ONE),
                state.getSetsWon(Player.TWO),
                current.getGamesA(),
                current.getGamesB(),
                points[0],
                points[1],
                state.getPhase(),
                state.isInSetTiebreak(),
                state.isInMatchTiebreak(),
                tiebreakUnderway && ServeRotation.isEndChange(state.tiebreakPointsPlayed()),
                state.isInMatchTiebreak() && state.getTiebreakStartServer() == null,
                state.getWinner(),
                state.getSets().stream().map(SetRecord::copy).toList()
        );
    }

    private static String[] displayPoints(MatchState state) {
        if (state.isInTiebreak()) {
            return new String[] {
                    String.valueOf(state.getTiebreakPoints(Player.ONE)),
                    String.valueOf(state.getTiebreakPoints(Player.TWO))
            };
        }
        int one = state.getGamePoints(Player.ONE);
        int two = state.getGamePoints(Player.TWO);
        if (one >= 3 && two >= 3) {
            if (one == two) return new String[] {"40", "40"};
            if (one == two + 1) return new String[] {"Ad", ""};
            if (two == one + 1) return new String[] {"", "Ad"};
        }
        return new String[] {gameScore(one), gameScore(two)};
    }

    /**
     * Call a regular-game point count the way the umpire would.
     */
    public static String gameScore(int points) {
        return switch (points) {
            case 0 -> "0";
            case 1 -> "15";
            case 2 -> "30";
            default -> points < 0 ? "0" : "40";
        };
    }
}
