package com.tennis.engine.model;

import java.util.Objects;

/**
 * Games score of one set, plus its tiebreak score when one was played.
 */
public class SetRecord {

    private final int[] games = new int[2];
    private final int[] tiebreakPoints = new int[2];
    private boolean finished;
    private boolean tiebreakPlayed;

    public SetRecord() {}

    private SetRecord(SetRecord other) {
        this.games[0] = other.games[0];
        this.games[1] = other.games[1];
        this.tiebreakPoints[0] = other.tiebreakPoints[0];
        this.tiebreakPoints[1] = other.tiebreakPoints[1];
        this.finished = other.finished;
        this.tiebreakPlayed = other.tiebreakPlayed;
    }

    public SetRecord copy() {
        return new SetRecord(this);
    }

    public int getGames(Player player) {
        return games[player.index()];
    }

    public int getGamesA() {
        return games[0];
    }

    public int getGamesB() {
        return games[1];
    }

    public int getTiebreakScoreA() {
        return tiebreakPoints[0];
    }

    public int getTiebreakScoreB() {
        return tiebreakPoints[1];
    }

    public boolean isFinished() {
        return finished;
    }

    public boolean isTiebreakPlayed() {
        return tiebreakPlayed;
    }

    /**
     * Games played so far in this set; also the zero-based index of the game in progress.
     */
    public int gamesPlayed() {
        return games[0] + games[1];
    }

    public void addGame(Player player) {
        requireOpen();
        games[player.index()]++;
    }

    /**
     * Copy the games score of another set; used for the row that displays a match tiebreak.
     */
    public void copyGamesFrom(SetRecord other) {
        requireOpen();
        games[0] = other.games[0];
        games[1] = other.games[1];
    }

    public void markTiebreakPlayed() {
        requireOpen();
        tiebreakPlayed = true;
    }

    public void stampTiebreakScore(int pointsA, int pointsB) {
        tiebreakPlayed = true;
        tiebreakPoints[0] = pointsA;
        tiebreakPoints[1] = pointsB;
    }

    public void finish() {
        finished = true;
    }

    private void requireOpen() {
        if (finished) {
            throw new IllegalStateException("Set is already finished");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetRecord that)) return false;
        return finished == that.finished
                && tiebreakPlayed == that.tiebreakPlayed
                && games[0] == that.games[0] && games[1] == that.games[1]
                && tiebreakPoints[0] == that.tiebreakPoints[0] && tiebreakPoints[1] == that.tiebreakPoints[1];
    }

    @Override
    public int hashCode() {
        return Objects.hash(games[0], games[1], tiebreakPoints[0], tiebreakPoints[1], finished, tiebreakPlayed);
    }

    @Override
    public String toString() {
        String score = games[0] + "-" + games[1];
        return tiebreakPlayed ? score + " (TB " + tiebreakPoints[0] + "-" + tiebreakPoints[1] + ")" : score;
    }
}
