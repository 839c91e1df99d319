package com.tennis.engine.event;

/**
 * What happened on the return of a serve that landed in.
 */
public enum ReturnOutcome {
    RETURN_WINNER(Role.RETURNER),
    RETURN_UNFORCED_ERROR(Role.SERVER),
    RETURN_FORCED_ERROR(Role.SERVER),
    RETURN_IN(null);

    private final Role winner;

    ReturnOutcome(Role winner) {
        this.winner = winner;
    }

    public boolean isTerminal() {
        return winner != null;
    }

    /**
     * Who wins the point, or {@code null} when the rally continues.
     */
    public Role winner() {
        return winner;
    }
}
