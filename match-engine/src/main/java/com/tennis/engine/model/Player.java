package com.tennis.engine.model;

/**
 * The two sides of a singles match, in the order the players were entered.
 */
public enum Player {
    ONE,
    TWO;

    public Player opponent() {
        return this == ONE ? TWO : ONE;
    }

    /**
     * Zero-based slot used to index per-player counters.
     */
    public int index() {
        return this == ONE ? 0 : 1;
    }

    /**
     * Short label used in logs and exports ("P1" / "P2").
     */
    public String label() {
        return this == ONE ? "P1" : "P2";
    }
}
