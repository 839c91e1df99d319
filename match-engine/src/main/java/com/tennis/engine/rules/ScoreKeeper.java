package com.tennis.engine.rules;

import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.SetRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Score transitions: points into games, games into sets, sets into the match, with the set and
 * match tiebreaks in between.
 */
public class ScoreKeeper {

    private static final Logger log = LoggerFactory.getLogger(ScoreKeeper.class);

    /**
     * Largest unit of score a point completed.
     */
    public enum Transition {
        POINT,
        GAME,
        SET,
        MATCH
    }

    /**
     * Award the next point to {@code winner} and advance the score.
     *
     * @throws IllegalStateException if the match is already over or the match tiebreak has no
     *                               starting server yet
     */
    public Transition awardPoint(MatchState state, Player winner) {
        if (state.isMatchComplete()) {
            throw new IllegalStateException("Match is already complete");
        }
        if (state.isInTiebreak()) {
            if (state.getTiebreakStartServer() == null) {
                throw new IllegalStateException("Tiebreak has no starting server");
            }
            return state.isInMatchTiebreak()
                    ? awardMatchTiebreakPoint(state, winner)
                    : awardSetTiebreakPoint(state, winner);
        }
        return awardRegularPoint(state, winner);
    }

    private Transition awardRegularPoint(MatchState state, Player winner) {
        state.addGamePoint(winner);
        int points = state.getGamePoints(winner);
        int opponentPoints = state.getGamePoints(winner.opponent());
        if (points < 4 || points - opponentPoints < 2) {
            return Transition.POINT;
        }

        MatchFormat format = state.getFormat();
        SetRecord set = state.currentSet();
        set.addGame(winner);
        state.resetGamePoints();
        state.setCurrentServer(state.getCurrentServer().opponent());
        log.info("Game {} ({}), set {} now {}", winner.label(), state.getPlayerName(winner),
                state.getCurrentSetIndex() + 1, set);

        int tiebreakAt = format.tiebreakAtGames();
        if (set.getGamesA() == tiebreakAt && set.getGamesB() == tiebreakAt) {
            startSetTiebreak(state);
            return Transition.GAME;
        }
        if (isSetWon(set, winner, format)) {
            return closeSet(state, winner);
        }
        return Transition.GAME;
    }

    private Transition awardSetTiebreakPoint(MatchState state, Player winner) {
        state.addTiebreakPoint(winner);
        if (!isTiebreakWon(state, winner, state.getFormat().setTiebreakTarget())) {
            state.setCurrentServer(ServeRotation.serverFor(state.getTiebreakStartServer(), state.tiebreakPointsPlayed()));
            return Transition.POINT;
        }

        // Games stay level; the tiebreak score decides the set. Whoever served the last
        // tiebreak point keeps the serve for the next set.
        SetRecord set = state.currentSet();
        set.stampTiebreakScore(state.getTiebreakPoints(Player.ONE), state.getTiebreakPoints(Player.TWO));
        state.setInSetTiebreak(false);
        state.setTiebreakStartServer(null);
        state.resetTiebreakPoints();
        return closeSet(state, winner);
    }

    private Transition awardMatchTiebreakPoint(MatchState state, Player winner) {
        state.addTiebreakPoint(winner);
        if (!isTiebreakWon(state, winner, state.getFormat().decidingTiebreakTarget())) {
            state.setCurrentServer(ServeRotation.serverFor(state.getTiebreakStartServer(), state.tiebreakPointsPlayed()));
            return Transition.POINT;
        }

        SetRecord decider = new SetRecord();
        decider.copyGamesFrom(state.getSets().get(state.getSets().size() - 1));
        decider.stampTiebreakScore(state.getTiebreakPoints(Player.ONE), state.getTiebreakPoints(Player.TWO));
        decider.finish();
        state.appendTrailingSet(decider);
        state.addSetWon(winner);
        state.setInMatchTiebreak(false);
        log.info("Match tiebreak won by {} ({}) {}-{}", winner.label(), state.getPlayerName(winner),
                decider.getTiebreakScoreA(), decider.getTiebreakScoreB());
        log.info("Match complete: {} wins {}-{}", state.getPlayerName(winner),
                state.getSetsWon(winner), state.getSetsWon(winner.opponent()));
        return Transition.MATCH;
    }

    private void startSetTiebreak(MatchState state) {
        state.setInSetTiebreak(true);
        state.currentSet().markTiebreakPlayed();
        state.resetTiebreakPoints();
        // Whoever is next to serve opens the tiebreak
        state.setTiebreakStartServer(state.getCurrentServer());
        log.info("Set tiebreak in set {}, {} serves first", state.getCurrentSetIndex() + 1,
                state.getPlayerName(state.getCurrentServer()));
    }

    private Transition closeSet(MatchState state, Player winner) {
        SetRecord set = state.currentSet();
        set.finish();
        state.addSetWon(winner);
        log.info("Set {} to {} ({}), sets {}-{}", state.getCurrentSetIndex() + 1, state.getPlayerName(winner), set,
                state.getSetsWon(Player.ONE), state.getSetsWon(Player.TWO));

        if (state.isMatchComplete()) {
            log.info("Match complete: {} wins {}-{}", state.getPlayerName(winner),
                    state.getSetsWon(winner), state.getSetsWon(winner.opponent()));
            return Transition.MATCH;
        }

        MatchFormat format = state.getFormat();
        int oneSetShort = format.setsToWin() - 1;
        if (format.hasMatchTiebreak()
                && state.getSetsWon(Player.ONE) == oneSetShort
                && state.getSetsWon(Player.TWO) == oneSetShort) {
            // Starting server is chosen by the operator before the first point
            state.setInMatchTiebreak(true);
            state.resetGamePoints();
            state.resetTiebreakPoints();
            state.setTiebreakStartServer(null);
            log.info("Sets level at {}-{}, match tiebreak to {} replaces the deciding set",
                    oneSetShort, oneSetShort, format.decidingTiebreakTarget());
            return Transition.SET;
        }

        state.openSet();
        state.resetGamePoints();
        state.resetTiebreakPoints();
        return Transition.SET;
    }

    static boolean isSetWon(SetRecord set, Player player, MatchFormat format) {
        int games = set.getGames(player);
        return games >= format.gamesToWinSet() && games - set.getGames(player.opponent()) >= 2;
    }

    static boolean isTiebreakWon(MatchState state, Player player, int target) {
        int points = state.getTiebreakPoints(player);
        return points >= target && points - state.getTiebreakPoints(player.opponent()) >= 2;
    }
}
