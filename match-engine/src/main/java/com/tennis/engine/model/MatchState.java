package com.tennis.engine.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything known about a match in progress. One instance is owned and mutated by the match
 * controller; undo snapshots are independent deep copies made with {@link #copy()}.
 */
public class MatchState {

    private final MatchFormat format;
    private final String playerOneName;
    private final String playerTwoName;
    private final String location;

    private final List<SetRecord> sets = new ArrayList<>();
    private final List<PlayerStatistics> setStatsOne = new ArrayList<>();
    private final List<PlayerStatistics> setStatsTwo = new ArrayList<>();
    private int currentSetIndex;

    // Regular-game points: 0, 1, 2, 3 = 0/15/30/40; above that the win-by-two rule decides
    private final int[] gamePoints = new int[2];

    private boolean inSetTiebreak;
    private boolean inMatchTiebreak;
    private final int[] tiebreakPoints = new int[2];
    private Player tiebreakStartServer;

    private Player currentServer;
    private final int[] setsWon = new int[2];

    private final PlayerStatistics matchStatsOne = new PlayerStatistics();
    private final PlayerStatistics matchStatsTwo = new PlayerStatistics();

    private final List<PointRecord> pointLog = new ArrayList<>();

    public MatchState(MatchFormat format, String playerOneName, String playerTwoName, String location, Player startingServer) {
        this.format = Objects.requireNonNull(format, "format");
        this.playerOneName = playerOneName;
        this.playerTwoName = playerTwoName;
        this.location = location;
        this.currentServer = Objects.requireNonNull(startingServer, "startingServer");
        openSet();
    }

    private MatchState(MatchState other) {
        this.format = other.format;
        this.playerOneName = other.playerOneName;
        this.playerTwoName = other.playerTwoName;
        this.location = other.location;
        other.sets.forEach(s -> this.sets.add(s.copy()));
        other.setStatsOne.forEach(s -> this.setStatsOne.add(s.copy()));
        other.setStatsTwo.forEach(s -> this.setStatsTwo.add(s.copy()));
        this.currentSetIndex = other.currentSetIndex;
        System.arraycopy(other.gamePoints, 0, this.gamePoints, 0, 2);
        this.inSetTiebreak = other.inSetTiebreak;
        this.inMatchTiebreak = other.inMatchTiebreak;
        System.arraycopy(other.tiebreakPoints, 0, this.tiebreakPoints, 0, 2);
        this.tiebreakStartServer = other.tiebreakStartServer;
        this.currentServer = other.currentServer;
        System.arraycopy(other.setsWon, 0, this.setsWon, 0, 2);
        this.matchStatsOne.plus(other.matchStatsOne);
        this.matchStatsTwo.plus(other.matchStatsTwo);
        this.pointLog.addAll(other.pointLog);
    }

    /**
     * Deep copy. Point records are immutable and shared.
     */
    public MatchState copy() {
        return new MatchState(this);
    }

    // ============ META ============

    public MatchFormat getFormat() {
        return format;
    }

    public String getPlayerOneName() {
        return playerOneName;
    }

    public String getPlayerTwoName() {
        return playerTwoName;
    }

    public String getPlayerName(Player player) {
        return player == Player.ONE ? playerOneName : playerTwoName;
    }

    public String getLocation() {
        return location;
    }

    // ============ SETS ============

    public List<SetRecord> getSets() {
        return Collections.unmodifiableList(sets);
    }

    public int getCurrentSetIndex() {
        return currentSetIndex;
    }

    public SetRecord currentSet() {
        return sets.get(currentSetIndex);
    }

    /**
     * Append a fresh set with its own statistics and make it current.
     */
    public SetRecord openSet() {
        SetRecord set = new SetRecord();
        sets.add(set);
        setStatsOne.add(new PlayerStatistics());
        setStatsTwo.add(new PlayerStatistics());
        currentSetIndex = sets.size() - 1;
        return set;
    }

    /**
     * Append a finished row without moving the current set index. Used for the decider of a
     * match-tiebreak match, which is shown as a set of its own.
     */
    public void appendTrailingSet(SetRecord set) {
        sets.add(set);
        setStatsOne.add(new PlayerStatistics());
        setStatsTwo.add(new PlayerStatistics());
    }

    public int completedSets() {
        return (int) sets.stream().filter(SetRecord::isFinished).count();
    }

    public int getSetsWon(Player player) {
        return setsWon[player.index()];
    }

    public void addSetWon(Player player) {
        setsWon[player.index()]++;
    }

    // ============ GAME / TIEBREAK COUNTERS ============

    public int getGamePoints(Player player) {
        return gamePoints[player.index()];
    }

    public void addGamePoint(Player player) {
        gamePoints[player.index()]++;
    }

    public void resetGamePoints() {
        gamePoints[0] = 0;
        gamePoints[1] = 0;
    }

    public int getTiebreakPoints(Player player) {
        return tiebreakPoints[player.index()];
    }

    public int tiebreakPointsPlayed() {
        return tiebreakPoints[0] + tiebreakPoints[1];
    }

    public void addTiebreakPoint(Player player) {
        tiebreakPoints[player.index()]++;
    }

    public void resetTiebreakPoints() {
        tiebreakPoints[0] = 0;
        tiebreakPoints[1] = 0;
    }

    public boolean isInSetTiebreak() {
        return inSetTiebreak;
    }

    public void setInSetTiebreak(boolean inSetTiebreak) {
        this.inSetTiebreak = inSetTiebreak;
    }

    public boolean isInMatchTiebreak() {
        return inMatchTiebreak;
    }

    public void setInMatchTiebreak(boolean inMatchTiebreak) {
        this.inMatchTiebreak = inMatchTiebreak;
    }

    public boolean isInTiebreak() {
        return inSetTiebreak || inMatchTiebreak;
    }

    public Player getTiebreakStartServer() {
        return tiebreakStartServer;
    }

    public void setTiebreakStartServer(Player tiebreakStartServer) {
        this.tiebreakStartServer = tiebreakStartServer;
    }

    public Player getCurrentServer() {
        return currentServer;
    }

    public void setCurrentServer(Player currentServer) {
        this.currentServer = Objects.requireNonNull(currentServer, "currentServer");
    }

    public Player getCurrentReceiver() {
        return currentServer.opponent();
    }

    // ============ PHASE ============

    public boolean isMatchComplete() {
        int needed = format.setsToWin();
        return setsWon[0] >= needed || setsWon[1] >= needed;
    }

    public MatchPhase getPhase() {
        if (isMatchComplete()) return MatchPhase.MATCH_COMPLETE;
        if (inMatchTiebreak) return MatchPhase.MATCH_TIEBREAK;
        if (inSetTiebreak) return MatchPhase.SET_TIEBREAK;
        return MatchPhase.REGULAR_GAME;
    }

    /**
     * Winner of the match, or {@code null} while it is still being played.
     */
    public Player getWinner() {
        if (!isMatchComplete()) return null;
        return setsWon[0] > setsWon[1] ? Player.ONE : Player.TWO;
    }

    // ============ STATISTICS ============

    public PlayerStatistics matchStatistics(Player player) {
        return player == Player.ONE ? matchStatsOne : matchStatsTwo;
    }

    public PlayerStatistics setStatistics(int setIndex, Player player) {
        return (player == Player.ONE ? setStatsOne : setStatsTwo).get(setIndex);
    }

    public PlayerStatistics currentSetStatistics(Player player) {
        return setStatistics(currentSetIndex, player);
    }

    // ============ LOG ============

    public List<PointRecord> getPointLog() {
        return Collections.unmodifiableList(pointLog);
    }

    public void appendPoint(PointRecord record) {
        pointLog.add(Objects.requireNonNull(record, "record"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchState that)) return false;
        return currentSetIndex == that.currentSetIndex
                && inSetTiebreak == that.inSetTiebreak
                && inMatchTiebreak == that.inMatchTiebreak
                && format.equals(that.format)
                && Objects.equals(playerOneName, that.playerOneName)
                && Objects.equals(playerTwoName, that.playerTwoName)
                && Objects.equals(location, that.location)
                && sets.equals(that.sets)
                && setStatsOne.equals(that.setStatsOne)
                && setStatsTwo.equals(that.setStatsTwo)
                && Arrays.equals(gamePoints, that.gamePoints)
                && Arrays.equals(tiebreakPoints, that.tiebreakPoints)
                && Arrays.equals(setsWon, that.setsWon)
                && tiebreakStartServer == that.tiebreakStartServer
                && currentServer == that.currentServer
                && matchStatsOne.equals(that.matchStatsOne)
                && matchStatsTwo.equals(that.matchStatsTwo)
                && pointLog.equals(that.pointLog);
    }

    @Override
    public int hashCode() {
        return Objects.hash(format, sets, currentSetIndex, currentServer, pointLog.size(),
                gamePoints[0], gamePoints[1], tiebreakPoints[0], tiebreakPoints[1], setsWon[0], setsWon[1]);
    }
}
