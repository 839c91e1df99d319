package com.tennis.engine.event;

import com.tennis.engine.model.ServeType;

import java.util.EnumSet;
import java.util.Set;

/**
 * What happened on serve. Terminal outcomes decide the point on their own.
 */
public enum ServeOutcome {
    FIRST_IN(ServeType.FIRST, true, null),
    FIRST_FAULT(ServeType.FIRST, false, null),
    SECOND_IN(ServeType.SECOND, true, null),
    DOUBLE_FAULT(ServeType.SECOND, false, Role.RETURNER),
    ACE_FIRST(ServeType.FIRST, true, Role.SERVER),
    ACE_SECOND(ServeType.SECOND, true, Role.SERVER),
    SERVICE_WINNER_FIRST(ServeType.FIRST, true, Role.SERVER),
    SERVICE_WINNER_SECOND(ServeType.SECOND, true, Role.SERVER);

    /**
     * Outcomes accepted after a first-serve fault.
     */
    public static final Set<ServeOutcome> AFTER_FIRST_FAULT = EnumSet.of(SECOND_IN, DOUBLE_FAULT);

    private final ServeType serveType;
    private final boolean in;
    private final Role winner;

    ServeOutcome(ServeType serveType, boolean in, Role winner) {
        this.serveType = serveType;
        this.in = in;
        this.winner = winner;
    }

    public ServeType serveType() {
        return serveType;
    }

    /**
     * Whether the serve landed in (aces and service winners included).
     */
    public boolean isIn() {
        return in;
    }

    public boolean isTerminal() {
        return winner != null;
    }

    /**
     * Who wins the point, or {@code null} while the point is still live.
     */
    public Role winner() {
        return winner;
    }

    public boolean isAce() {
        return this == ACE_FIRST || this == ACE_SECOND;
    }

    public boolean isServiceWinner() {
        return this == SERVICE_WINNER_FIRST || this == SERVICE_WINNER_SECOND;
    }
}
