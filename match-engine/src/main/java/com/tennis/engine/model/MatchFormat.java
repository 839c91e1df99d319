package com.tennis.engine.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Fixed scoring parameters for a match. Immutable once the match starts.
 *
 * @param gamesToWinSet          games needed to take a set (win by two)
 * @param tiebreakAtGames        games-all score that triggers a set tiebreak
 * @param setTiebreakTarget      points needed to win a set tiebreak (win by two)
 * @param decidingPolicy         what replaces the third set, if anything
 * @param decidingTiebreakTarget points needed to win the match tiebreak (win by two)
 * @param bestOfSets             sets in the match
 */
public record MatchFormat(
        int gamesToWinSet,
        int tiebreakAtGames,
        int setTiebreakTarget,
        DecidingPolicy decidingPolicy,
        int decidingTiebreakTarget,
        int bestOfSets
) {

    private static final Logger log = LoggerFactory.getLogger(MatchFormat.class);

    public MatchFormat {
        if (gamesToWinSet < 1 || tiebreakAtGames < 1 || setTiebreakTarget < 1 || decidingTiebreakTarget < 1) {
            throw new IllegalArgumentException("Format targets must be positive");
        }
        if (bestOfSets < 1 || bestOfSets % 2 == 0) {
            throw new IllegalArgumentException("bestOfSets must be a positive odd number: " + bestOfSets);
        }
        if (decidingPolicy == null) {
            throw new IllegalArgumentException("decidingPolicy is required");
        }
    }

    /**
     * The supported presets, in menu order.
     */
    public enum Preset {
        FULL_SETS(1, "Best-of-3 full sets (to 6, TB7 at 6-6)"),
        MATCH_TIEBREAK(2, "Best-of-3 with match TB10 instead of 3rd set"),
        SHORT_SETS(3, "Best-of-3 short sets to 4 (TB7 at 4-4)");

        private final int choice;
        private final String description;

        Preset(int choice, String description) {
            this.choice = choice;
            this.description = description;
        }

        public int getChoice() {
            return choice;
        }

        public String getDescription() {
            return description;
        }

        public MatchFormat format() {
            return switch (this) {
                case FULL_SETS -> new MatchFormat(6, 6, 7, DecidingPolicy.REGULAR_THIRD_SET, 10, 3);
                case MATCH_TIEBREAK -> new MatchFormat(6, 6, 7, DecidingPolicy.MATCH_TIEBREAK_10, 10, 3);
                case SHORT_SETS -> new MatchFormat(4, 4, 7, DecidingPolicy.REGULAR_THIRD_SET, 10, 3);
            };
        }
    }

    public static MatchFormat fullSets() {
        return Preset.FULL_SETS.format();
    }

    public static MatchFormat withMatchTiebreak() {
        return Preset.MATCH_TIEBREAK.format();
    }

    public static MatchFormat shortSets() {
        return Preset.SHORT_SETS.format();
    }

    /**
     * Resolve a numbered menu selection. Anything unrecognized falls back to short sets.
     */
    public static MatchFormat fromChoice(int choice) {
        for (Preset preset : Preset.values()) {
            if (preset.choice == choice) {
                return preset.format();
            }
        }
        log.warn("Unrecognized format selection {}, falling back to {}", choice, Preset.SHORT_SETS);
        return shortSets();
    }

    /**
     * Resolve a preset by name (case-insensitive). Unknown or blank names fall back to short sets.
     */
    public static MatchFormat fromName(String name) {
        if (name != null && !name.isBlank()) {
            String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (Preset preset : Preset.values()) {
                if (preset.name().equals(normalized)) {
                    return preset.format();
                }
            }
        }
        log.warn("Unrecognized format name '{}', falling back to {}", name, Preset.SHORT_SETS);
        return shortSets();
    }

    public int setsToWin() {
        return bestOfSets / 2 + 1;
    }

    public boolean hasMatchTiebreak() {
        return decidingPolicy == DecidingPolicy.MATCH_TIEBREAK_10;
    }
}
