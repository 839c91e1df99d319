package com.tennis.engine;

import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.PlayerStatistics;
import com.tennis.engine.model.SetRecord;
import com.tennis.engine.rules.ServeRotation;

import java.util.List;

/**
 * Consistency checks run after every recorded point. A failure means the controller itself is
 * broken, so it is reported as an {@link IllegalStateException} rather than handled.
 */
final class MatchInvariants {

    private MatchInvariants() {}

    static void check(MatchState state, int undoDepth) {
        if (state.getPointLog().size() != undoDepth) {
            fail("point log has " + state.getPointLog().size() + " entries but undo history holds " + undoDepth);
        }
        checkSets(state);
        checkTiebreak(state);
        checkStatistics(state);
    }

    private static void checkSets(MatchState state) {
        MatchFormat format = state.getFormat();
        List<SetRecord> sets = state.getSets();
        int setsWon = state.getSetsWon(Player.ONE) + state.getSetsWon(Player.TWO);
        if (state.completedSets() != setsWon) {
            fail(state.completedSets() + " sets finished but " + setsWon + " sets won");
        }
        for (int i = 0; i < sets.size(); i++) {
            SetRecord set = sets.get(i);
            int high = Math.max(set.getGamesA(), set.getGamesB());
            int diff = Math.abs(set.getGamesA() - set.getGamesB());
            if (set.isFinished() && !set.isTiebreakPlayed() && (high < format.gamesToWinSet() || diff < 2)) {
                fail("set " + (i + 1) + " finished at " + set + " without a two-game margin");
            }
            if (set.isFinished() && set.isTiebreakPlayed()
                    && Math.abs(set.getTiebreakScoreA() - set.getTiebreakScoreB()) < 2) {
                fail("tiebreak of set " + (i + 1) + " finished at " + set + " without a two-point margin");
            }
            if (!set.isFinished() && !state.isInTiebreak() && diff >= 2 && high >= format.gamesToWinSet()) {
                fail("set " + (i + 1) + " at " + set + " should have been closed");
            }
        }
    }

    private static void checkTiebreak(MatchState state) {
        MatchFormat format = state.getFormat();
        if (state.isInSetTiebreak()) {
            SetRecord set = state.currentSet();
            if (set.getGamesA() != format.tiebreakAtGames() || set.getGamesB() != format.tiebreakAtGames()) {
                fail("set tiebreak active at " + set);
            }
        }
        if (state.isInMatchTiebreak()) {
            int oneSetShort = format.setsToWin() - 1;
            if (!format.hasMatchTiebreak()
                    || state.getSetsWon(Player.ONE) != oneSetShort
                    || state.getSetsWon(Player.TWO) != oneSetShort) {
                fail("match tiebreak active without level sets under a match-tiebreak format");
            }
        }
        Player start = state.getTiebreakStartServer();
        if (state.isInTiebreak() && start != null
                && state.getCurrentServer() != ServeRotation.serverFor(start, state.tiebreakPointsPlayed())) {
            fail("tiebreak server out of rotation after " + state.tiebreakPointsPlayed() + " points");
        }
    }

    private static void checkStatistics(MatchState state) {
        for (Player player : Player.values()) {
            PlayerStatistics total = new PlayerStatistics();
            for (int i = 0; i < state.getSets().size(); i++) {
                total.plus(state.setStatistics(i, player));
            }
            PlayerStatistics match = state.matchStatistics(player);
            if (!total.equals(match)) {
                fail("match statistics of " + player.label() + " differ from the sum of its set statistics");
            }
            int expectedPlayed = match.getPointsWon() + state.matchStatistics(player.opponent()).getPointsWon();
            if (match.getPointsPlayed() != expectedPlayed) {
                fail(player.label() + " played " + match.getPointsPlayed() + " points, expected " + expectedPlayed);
            }
        }
        if (state.matchStatistics(Player.ONE).getPointsPlayed() != state.getPointLog().size()) {
            fail("points played do not match the point log");
        }
    }

    private static void fail(String message) {
        throw new IllegalStateException("Match state invariant violated: " + message);
    }
}
