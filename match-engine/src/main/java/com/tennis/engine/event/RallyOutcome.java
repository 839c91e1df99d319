package com.tennis.engine.event;

/**
 * How a rally ended. Every rally outcome decides the point.
 * <p>
 * The forced-error kinds name the player who made the error; the opponent is credited with
 * drawing it.
 */
public enum RallyOutcome {
    SERVER_WINNER(Role.SERVER),
    RETURNER_WINNER(Role.RETURNER),
    SERVER_UNFORCED_ERROR(Role.RETURNER),
    RETURNER_UNFORCED_ERROR(Role.SERVER),
    SERVER_FORCED_ERROR_DRAWN(Role.RETURNER),
    RETURNER_FORCED_ERROR_DRAWN(Role.SERVER);

    private final Role winner;

    RallyOutcome(Role winner) {
        this.winner = winner;
    }

    public Role winner() {
        return winner;
    }
}
