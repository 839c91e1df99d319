package com.tennis.engine.stats;

/**
 * Which statistics to read: the whole match, or a single set.
 */
public final class StatisticsScope {

    private static final StatisticsScope MATCH = new StatisticsScope(-1);

    private final int setIndex;

    private StatisticsScope(int setIndex) {
        this.setIndex = setIndex;
    }

    public static StatisticsScope match() {
        return MATCH;
    }

    /**
     * @param setIndex zero-based set index
     */
    public static StatisticsScope set(int setIndex) {
        if (setIndex < 0) {
            throw new IllegalArgumentException("Set index must be >= 0: " + setIndex);
        }
        return new StatisticsScope(setIndex);
    }

    public boolean isMatch() {
        return setIndex < 0;
    }

    public int setIndex() {
        if (isMatch()) {
            throw new IllegalStateException("Match scope has no set index");
        }
        return setIndex;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StatisticsScope that && setIndex == that.setIndex;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(setIndex);
    }

    @Override
    public String toString() {
        return isMatch() ? "match" : "set " + (setIndex + 1);
    }
}
