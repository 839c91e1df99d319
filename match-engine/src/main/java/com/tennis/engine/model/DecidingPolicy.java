package com.tennis.engine.model;

/**
 * How the match is decided when the first two sets are split.
 */
public enum DecidingPolicy {
    REGULAR_THIRD_SET,
    MATCH_TIEBREAK_10
}
