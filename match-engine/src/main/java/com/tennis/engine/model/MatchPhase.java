package com.tennis.engine.model;

/**
 * Phase of play. {@link #SET_COMPLETE} is transient: it is only reported as the outcome of the
 * point that closed a set, never held by the live state.
 */
public enum MatchPhase {
    REGULAR_GAME,
    SET_TIEBREAK,
    MATCH_TIEBREAK,
    SET_COMPLETE,
    MATCH_COMPLETE
}
