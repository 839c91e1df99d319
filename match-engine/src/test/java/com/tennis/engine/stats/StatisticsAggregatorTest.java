package com.tennis.engine.stats;

import com.tennis.engine.event.PointEvent;
import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;
import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.PlayerStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.tennis.engine.model.Player.ONE;
import static com.tennis.engine.model.Player.TWO;
import static org.assertj.core.api.Assertions.assertThat;

class StatisticsAggregatorTest {

    private final StatisticsAggregator aggregator = new StatisticsAggregator();
    private MatchState state;

    @BeforeEach
    void setUp() {
        state = new MatchState(MatchFormat.fullSets(), "Server", "Returner", "Court 1", ONE);
    }

    @Test
    void aceOnFirstServe() {
        Player winner = aggregator.record(state, ONE, PointEvent.ofServe(false, ServeOutcome.ACE_FIRST), false);

        assertThat(winner).isEqualTo(ONE);
        PlayerStatistics server = state.matchStatistics(ONE);
        assertThat(server.getFirstServesAttempted()).isEqualTo(1);
        assertThat(server.getFirstServesIn()).isEqualTo(1);
        assertThat(server.getAcesFirst()).isEqualTo(1);
        assertThat(server.getPointsWonOnFirstServe()).isEqualTo(1);
        assertThat(server.getPointsWon()).isEqualTo(1);
        assertThat(server.getPointsPlayed()).isEqualTo(1);
        assertThat(state.matchStatistics(TWO).getPointsPlayed()).isEqualTo(1);
        assertThat(state.matchStatistics(TWO).getPointsWon()).isZero();
    }

    @Test
    void doubleFaultAfterFirstServeFault() {
        Player winner = aggregator.record(state, ONE, PointEvent.ofServe(true, ServeOutcome.DOUBLE_FAULT), false);

        assertThat(winner).isEqualTo(TWO);
        PlayerStatistics server = state.matchStatistics(ONE);
        assertThat(server.getFirstServesAttempted()).isEqualTo(1);
        assertThat(server.getFirstServesIn()).isZero();
        assertThat(server.getSecondServesAttempted()).isEqualTo(1);
        assertThat(server.getSecondServesIn()).isZero();
        assertThat(server.getDoubleFaults()).isEqualTo(1);
        assertThat(state.matchStatistics(TWO).getPointsWon()).isEqualTo(1);
    }

    @Test
    void serviceWinnerOnSecondServe() {
        aggregator.record(state, ONE, PointEvent.ofServe(true, ServeOutcome.SERVICE_WINNER_SECOND), false);

        PlayerStatistics server = state.matchStatistics(ONE);
        assertThat(server.getSecondServesIn()).isEqualTo(1);
        assertThat(server.getServiceWinnersSecond()).isEqualTo(1);
        assertThat(server.getPointsWonOnSecondServe()).isEqualTo(1);
    }

    @Test
    void returnWinnerCountsAgainstServeType() {
        Player winner = aggregator.record(state, ONE,
                PointEvent.ofReturn(true, ServeOutcome.SECOND_IN, ReturnOutcome.RETURN_WINNER), false);

        assertThat(winner).isEqualTo(TWO);
        PlayerStatistics returner = state.matchStatistics(TWO);
        assertThat(returner.getReturnWinners()).isEqualTo(1);
        assertThat(returner.getReturnPointsWonVsSecond()).isEqualTo(1);
        assertThat(returner.getReturnPointsWonVsFirst()).isZero();
        assertThat(state.matchStatistics(ONE).getSecondServesIn()).isEqualTo(1);
    }

    @Test
    void returnForcedErrorCreditsServerWithDrawnError() {
        Player winner = aggregator.record(state, ONE,
                PointEvent.ofReturn(false, ServeOutcome.FIRST_IN, ReturnOutcome.RETURN_FORCED_ERROR), false);

        assertThat(winner).isEqualTo(ONE);
        assertThat(state.matchStatistics(TWO).getReturnForcedErrors()).isEqualTo(1);
        assertThat(state.matchStatistics(ONE).getForcedErrorsDrawn()).isEqualTo(1);
        assertThat(state.matchStatistics(ONE).getPointsWonOnFirstServe()).isEqualTo(1);
    }

    @Test
    void returnUnforcedError() {
        aggregator.record(state, ONE,
                PointEvent.ofReturn(false, ServeOutcome.FIRST_IN, ReturnOutcome.RETURN_UNFORCED_ERROR), false);

        assertThat(state.matchStatistics(TWO).getReturnUnforcedErrors()).isEqualTo(1);
        assertThat(state.matchStatistics(ONE).getPointsWonOnFirstServe()).isEqualTo(1);
    }

    @Test
    void rallyOutcomesAttributeToTheRightPlayer() {
        record(RallyOutcome.SERVER_WINNER);
        record(RallyOutcome.RETURNER_WINNER);
        record(RallyOutcome.SERVER_UNFORCED_ERROR);
        record(RallyOutcome.RETURNER_UNFORCED_ERROR);
        record(RallyOutcome.SERVER_FORCED_ERROR_DRAWN);
        record(RallyOutcome.RETURNER_FORCED_ERROR_DRAWN);

        PlayerStatistics server = state.matchStatistics(ONE);
        PlayerStatistics returner = state.matchStatistics(TWO);
        assertThat(server.getRallyWinners()).isEqualTo(1);
        assertThat(returner.getRallyWinners()).isEqualTo(1);
        assertThat(server.getUnforcedErrors()).isEqualTo(1);
        assertThat(returner.getUnforcedErrors()).isEqualTo(1);
        assertThat(server.getForcedErrorsDrawn()).isEqualTo(1);
        assertThat(returner.getForcedErrorsDrawn()).isEqualTo(1);
        assertThat(server.getPointsWonOnFirstServe()).isEqualTo(3);
        assertThat(returner.getReturnPointsWonVsFirst()).isEqualTo(3);
        assertThat(server.getPointsWon()).isEqualTo(3);
        assertThat(returner.getPointsWon()).isEqualTo(3);
        assertThat(server.getFirstServesIn()).isEqualTo(6);
    }

    @Test
    void netPointCanBeCreditedToEitherPlayer() {
        aggregator.record(state, ONE, PointEvent.ofRally(false, ServeOutcome.FIRST_IN, RallyOutcome.SERVER_WINNER, TWO), false);
        aggregator.record(state, ONE, PointEvent.ofRally(false, ServeOutcome.FIRST_IN, RallyOutcome.SERVER_WINNER, ONE), false);

        assertThat(state.matchStatistics(TWO).getNetPointsTotal()).isEqualTo(1);
        assertThat(state.matchStatistics(TWO).getNetPointsWon()).isZero();
        assertThat(state.matchStatistics(ONE).getNetPointsTotal()).isEqualTo(1);
        assertThat(state.matchStatistics(ONE).getNetPointsWon()).isEqualTo(1);
    }

    @Test
    void breakPointCountedForReturnerWhateverEndedThePoint() {
        aggregator.record(state, ONE, PointEvent.ofServe(false, ServeOutcome.ACE_FIRST), true);
        aggregator.record(state, ONE, PointEvent.ofServe(true, ServeOutcome.DOUBLE_FAULT), true);
        aggregator.record(state, ONE, PointEvent.ofRally(false, ServeOutcome.FIRST_IN, RallyOutcome.SERVER_UNFORCED_ERROR, null), false);

        PlayerStatistics returner = state.matchStatistics(TWO);
        assertThat(returner.getBreakPointsTotal()).isEqualTo(2);
        assertThat(returner.getBreakPointsWon()).isEqualTo(1);
        assertThat(state.matchStatistics(ONE).getBreakPointsTotal()).isZero();
    }

    @Test
    void setScopeMirrorsMatchScope() {
        record(RallyOutcome.RETURNER_WINNER);
        aggregator.record(state, ONE, PointEvent.ofServe(false, ServeOutcome.ACE_FIRST), true);

        assertThat(state.currentSetStatistics(ONE)).isEqualTo(state.matchStatistics(ONE));
        assertThat(state.currentSetStatistics(TWO)).isEqualTo(state.matchStatistics(TWO));
    }

    private void record(RallyOutcome outcome) {
        aggregator.record(state, ONE, PointEvent.ofRally(false, ServeOutcome.FIRST_IN, outcome, null), false);
    }
}
