package com.tennis.engine.model;

import java.util.Arrays;

/**
 * Counters for one player, either across the whole match or within a single set.
 */
public class PlayerStatistics {

    // Serve attempts
    private int firstServesAttempted;
    private int firstServesIn;
    private int secondServesAttempted;
    private int secondServesIn;

    // Serve results
    private int acesFirst;
    private int acesSecond;
    private int serviceWinnersFirst;
    private int serviceWinnersSecond;
    private int doubleFaults;
    private int pointsWonOnFirstServe;
    private int pointsWonOnSecondServe;

    // Return
    private int returnPointsWonVsFirst;
    private int returnPointsWonVsSecond;
    private int returnWinners;
    private int returnUnforcedErrors;
    private int returnForcedErrors;

    // Rally
    private int rallyWinners;
    private int unforcedErrors;
    private int forcedErrorsDrawn;

    // Net
    private int netPointsWon;
    private int netPointsTotal;

    // Pressure
    private int breakPointsWon;
    private int breakPointsTotal;

    // Totals
    private int pointsWon;
    private int pointsPlayed;

    public PlayerStatistics() {}

    public PlayerStatistics copy() {
        return new PlayerStatistics().plus(this);
    }

    /**
     * Add every counter of {@code other} into this instance.
     *
     * @return this instance, for chaining
     */
    public PlayerStatistics plus(PlayerStatistics other) {
        firstServesAttempted += other.firstServesAttempted;
        firstServesIn += other.firstServesIn;
        secondServesAttempted += other.secondServesAttempted;
        secondServesIn += other.secondServesIn;
        acesFirst += other.acesFirst;
        acesSecond += other.acesSecond;
        serviceWinnersFirst += other.serviceWinnersFirst;
        serviceWinnersSecond += other.serviceWinnersSecond;
        doubleFaults += other.doubleFaults;
        pointsWonOnFirstServe += other.pointsWonOnFirstServe;
        pointsWonOnSecondServe += other.pointsWonOnSecondServe;
        returnPointsWonVsFirst += other.returnPointsWonVsFirst;
        returnPointsWonVsSecond += other.returnPointsWonVsSecond;
        returnWinners += other.returnWinners;
        returnUnforcedErrors += other.returnUnforcedErrors;
        returnForcedErrors += other.returnForcedErrors;
        rallyWinners += other.rallyWinners;
        unforcedErrors += other.unforcedErrors;
        forcedErrorsDrawn += other.forcedErrorsDrawn;
        netPointsWon += other.netPointsWon;
        netPointsTotal += other.netPointsTotal;
        breakPointsWon += other.breakPointsWon;
        breakPointsTotal += other.breakPointsTotal;
        pointsWon += other.pointsWon;
        pointsPlayed += other.pointsPlayed;
        return this;
    }

    // ============ UPDATES ============

    public void recordServe(ServeType type, boolean in) {
        if (type == ServeType.FIRST) {
            firstServesAttempted++;
            if (in) firstServesIn++;
        } else {
            secondServesAttempted++;
            if (in) secondServesIn++;
        }
    }

    public void recordAce(ServeType type) {
        if (type == ServeType.FIRST) acesFirst++; else acesSecond++;
    }

    public void recordServiceWinner(ServeType type) {
        if (type == ServeType.FIRST) serviceWinnersFirst++; else serviceWinnersSecond++;
    }

    public void recordDoubleFault() {
        doubleFaults++;
    }

    public void recordServePointWon(ServeType type) {
        if (type == ServeType.FIRST) pointsWonOnFirstServe++; else pointsWonOnSecondServe++;
    }

    public void recordReturnPointWon(ServeType type) {
        if (type == ServeType.FIRST) returnPointsWonVsFirst++; else returnPointsWonVsSecond++;
    }

    public void recordReturnWinner() {
        returnWinners++;
    }

    public void recordReturnUnforcedError() {
        returnUnforcedErrors++;
    }

    public void recordReturnForcedError() {
        returnForcedErrors++;
    }

    public void recordRallyWinner() {
        rallyWinners++;
    }

    public void recordUnforcedError() {
        unforcedErrors++;
    }

    public void recordForcedErrorDrawn() {
        forcedErrorsDrawn++;
    }

    public void recordNetPoint(boolean won) {
        netPointsTotal++;
        if (won) netPointsWon++;
    }

    public void recordBreakPoint(boolean converted) {
        breakPointsTotal++;
        if (converted) breakPointsWon++;
    }

    public void recordPoint(boolean won) {
        pointsPlayed++;
        if (won) pointsWon++;
    }

    // ============ GETTERS ============

    public int getFirstServesAttempted() {
        return firstServesAttempted;
    }

    public int getFirstServesIn() {
        return firstServesIn;
    }

    public int getSecondServesAttempted() {
        return secondServesAttempted;
    }

    public int getSecondServesIn() {
        return secondServesIn;
    }

    public int getAcesFirst() {
        return acesFirst;
    }

    public int getAcesSecond() {
        return acesSecond;
    }

    public int getServiceWinnersFirst() {
        return serviceWinnersFirst;
    }

    public int getServiceWinnersSecond() {
        return serviceWinnersSecond;
    }

    public int getDoubleFaults() {
        return doubleFaults;
    }

    public int getPointsWonOnFirstServe() {
        return pointsWonOnFirstServe;
    }

    public int getPointsWonOnSecondServe() {
        return pointsWonOnSecondServe;
    }

    public int getReturnPointsWonVsFirst() {
        return returnPointsWonVsFirst;
    }

    public int getReturnPointsWonVsSecond() {
        return returnPointsWonVsSecond;
    }

    public int getReturnWinners() {
        return returnWinners;
    }

    public int getReturnUnforcedErrors() {
        return returnUnforcedErrors;
    }

    public int getReturnForcedErrors() {
        return returnForcedErrors;
    }

    public int getRallyWinners() {
        return rallyWinners;
    }

    public int getUnforcedErrors() {
        return unforcedErrors;
    }

    public int getForcedErrorsDrawn() {
        return forcedErrorsDrawn;
    }

    public int getNetPointsWon() {
        return netPointsWon;
    }

    public int getNetPointsTotal() {
        return netPointsTotal;
    }

    public int getBreakPointsWon() {
        return breakPointsWon;
    }

    public int getBreakPointsTotal() {
        return breakPointsTotal;
    }

    public int getPointsWon() {
        return pointsWon;
    }

    public int getPointsPlayed() {
        return pointsPlayed;
    }

    private int[] counters() {
        return new int[] {
                firstServesAttempted, firstServesIn, secondServesAttempted, secondServesIn,
                acesFirst, acesSecond, serviceWinnersFirst, serviceWinnersSecond, doubleFaults,
                pointsWonOnFirstServe, pointsWonOnSecondServe,
                returnPointsWonVsFirst, returnPointsWonVsSecond, returnWinners, returnUnforcedErrors, returnForcedErrors,
                rallyWinners, unforcedErrors, forcedErrorsDrawn,
                netPointsWon, netPointsTotal, breakPointsWon, breakPointsTotal,
                pointsWon, pointsPlayed
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlayerStatistics that)) return false;
        return Arrays.equals(counters(), that.counters());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counters());
    }

    @Override
    public String toString() {
        return "PlayerStatistics{pointsWon=" + pointsWon + ", pointsPlayed=" + pointsPlayed
                + ", aces=" + (acesFirst + acesSecond) + ", doubleFaults=" + doubleFaults
                + ", breakPoints=" + breakPointsWon + "/" + breakPointsTotal + "}";
    }
}
