package com.tennis.engine.stats;

import com.tennis.engine.event.PointEvent;
import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.PlayerStatistics;
import com.tennis.engine.model.ServeType;

import java.util.function.Consumer;

/**
 * Turns a resolved point into counter updates. Every update lands on both the match-scope and
 * the current-set statistics of the player concerned, so the two scopes never drift apart.
 */
public class StatisticsAggregator {

    /**
     * Record a resolved point. Must run before the score advances, while the current set is
     * still the set the point was played in.
     *
     * @param state      live match state
     * @param server     player who served the point
     * @param event      how the point was played
     * @param breakPoint whether the receiver held a break point before the point
     * @return the player who won the point
     */
    public Player record(MatchState state, Player server, PointEvent event, boolean breakPoint) {
        Player returner = server.opponent();
        Player winner = event.winner(server);
        ServeType serveType = event.serveType();

        recordServe(state, server, event);

        if (event.returnOutcome() != null) {
            recordReturn(state, server, returner, event.returnOutcome(), serveType);
        }
        if (event.rallyOutcome() != null) {
            recordRally(state, server, returner, event.rallyOutcome(), serveType);
        }

        update(state, winner, s -> s.recordPoint(true));
        update(state, winner.opponent(), s -> s.recordPoint(false));

        Player netPlayer = event.netPlayer();
        if (netPlayer != null) {
            boolean won = netPlayer == winner;
            update(state, netPlayer, s -> s.recordNetPoint(won));
        }

        if (breakPoint) {
            boolean converted = winner == returner;
            update(state, returner, s -> s.recordBreakPoint(converted));
        }
        return winner;
    }

    private void recordServe(MatchState state, Player server, PointEvent event) {
        ServeOutcome serve = event.serve();
        ServeType type = serve.serveType();

        if (event.firstServeFault()) {
            update(state, server, s -> s.recordServe(ServeType.FIRST, false));
        }
        update(state, server, s -> s.recordServe(type, serve.isIn()));

        if (serve == ServeOutcome.DOUBLE_FAULT) {
            update(state, server, PlayerStatistics::recordDoubleFault);
        } else if (serve.isAce()) {
            update(state, server, s -> {
                s.recordAce(type);
                s.recordServePointWon(type);
            });
        } else if (serve.isServiceWinner()) {
            update(state, server, s -> {
                s.recordServiceWinner(type);
                s.recordServePointWon(type);
            });
        }
    }

    private void recordReturn(MatchState state, Player server, Player returner, ReturnOutcome outcome, ServeType type) {
        switch (outcome) {
            case RETURN_WINNER -> update(state, returner, s -> {
                s.recordReturnWinner();
                s.recordReturnPointWon(type);
            });
            case RETURN_UNFORCED_ERROR -> {
                update(state, returner, PlayerStatistics::recordReturnUnforcedError);
                update(state, server, s -> s.recordServePointWon(type));
            }
            case RETURN_FORCED_ERROR -> {
                update(state, returner, PlayerStatistics::recordReturnForcedError);
                update(state, server, s -> {
                    s.recordForcedErrorDrawn();
                    s.recordServePointWon(type);
                });
            }
            case RETURN_IN -> {
                // rally follows
            }
        }
    }

    private void recordRally(MatchState state, Player server, Player returner, RallyOutcome outcome, ServeType type) {
        switch (outcome) {
            case SERVER_WINNER -> update(state, server, s -> {
                s.recordRallyWinner();
                s.recordServePointWon(type);
            });
            case RETURNER_WINNER -> update(state, returner, s -> {
                s.recordRallyWinner();
                s.recordReturnPointWon(type);
            });
            case SERVER_UNFORCED_ERROR -> {
                update(state, server, PlayerStatistics::recordUnforcedError);
                update(state, returner, s -> s.recordReturnPointWon(type));
            }
            case RETURNER_UNFORCED_ERROR -> {
                update(state, returner, PlayerStatistics::recordUnforcedError);
                update(state, server, s -> s.recordServePointWon(type));
            }
            case SERVER_FORCED_ERROR_DRAWN -> update(state, returner, s -> {
                s.recordForcedErrorDrawn();
                s.recordReturnPointWon(type);
            });
            case RETURNER_FORCED_ERROR_DRAWN -> update(state, server, s -> {
                s.recordForcedErrorDrawn();
                s.recordServePointWon(type);
            });
        }
    }

    private static void update(MatchState state, Player player, Consumer<PlayerStatistics> change) {
        change.accept(state.matchStatistics(player));
        change.accept(state.currentSetStatistics(player));
    }
}
