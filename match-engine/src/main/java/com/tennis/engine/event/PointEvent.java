package com.tennis.engine.event;

import com.tennis.engine.model.Player;
import com.tennis.engine.model.ServeType;

/**
 * Structured description of how a point was played, from the serve to the shot that ended it.
 *
 * @param firstServeFault whether a first serve was faulted before {@code serve}
 * @param serve           the deciding serve outcome (second-serve kinds when a fault preceded it)
 * @param returnOutcome   return outcome, {@code null} when the serve ended the point
 * @param rallyOutcome    rally outcome, {@code null} unless the return was in
 * @param netPlayer       player marked as having come to the net, or {@code null}
 */
public record PointEvent(
        boolean firstServeFault,
        ServeOutcome serve,
        ReturnOutcome returnOutcome,
        RallyOutcome rallyOutcome,
        Player netPlayer
) {

    public PointEvent {
        if (serve == null || serve == ServeOutcome.FIRST_FAULT) {
            throw new IllegalArgumentException("A point needs a deciding serve outcome");
        }
        if (firstServeFault && serve.serveType() != ServeType.SECOND) {
            throw new IllegalArgumentException("Only a second serve can follow a first-serve fault");
        }
        if (serve.isTerminal() != (returnOutcome == null)) {
            throw new IllegalArgumentException("Return outcome must be present exactly when the serve was returnable");
        }
        boolean rallyExpected = returnOutcome != null && !returnOutcome.isTerminal();
        if (rallyExpected != (rallyOutcome != null)) {
            throw new IllegalArgumentException("Rally outcome must be present exactly when the return was in");
        }
        if (netPlayer != null && rallyOutcome == null) {
            throw new IllegalArgumentException("A net point can only be marked on a rally");
        }
    }

    public static PointEvent ofServe(boolean firstServeFault, ServeOutcome serve) {
        return new PointEvent(firstServeFault, serve, null, null, null);
    }

    public static PointEvent ofReturn(boolean firstServeFault, ServeOutcome serve, ReturnOutcome returnOutcome) {
        return new PointEvent(firstServeFault, serve, returnOutcome, null, null);
    }

    public static PointEvent ofRally(boolean firstServeFault, ServeOutcome serve, RallyOutcome rallyOutcome, Player netPlayer) {
        return new PointEvent(firstServeFault, serve, ReturnOutcome.RETURN_IN, rallyOutcome, netPlayer);
    }

    public ServeType serveType() {
        return serve.serveType();
    }

    /**
     * The side that won the point.
     */
    public Role winningRole() {
        if (rallyOutcome != null) {
            return rallyOutcome.winner();
        }
        if (returnOutcome != null) {
            return returnOutcome.winner();
        }
        return serve.winner();
    }

    public Player winner(Player server) {
        return winningRole().resolve(server);
    }
}
