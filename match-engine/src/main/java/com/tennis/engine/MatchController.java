package com.tennis.engine;

import com.tennis.engine.event.PointEvent;
import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;
import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchPhase;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.PlayerStatistics;
import com.tennis.engine.model.PointRecord;
import com.tennis.engine.rules.PointContext;
import com.tennis.engine.rules.PointFlags;
import com.tennis.engine.rules.ScoreKeeper;
import com.tennis.engine.rules.ServeRotation;
import com.tennis.engine.stats.StatisticsAggregator;
import com.tennis.engine.stats.StatisticsScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Records a match one point at a time.
 * <p>
 * A point is submitted as a short sequence: serve outcome, then (if the serve was returnable) a
 * return outcome, then (if the return was in) a rally outcome. The first serve submission opens a
 * point transaction and snapshots the match for undo; the submission that decides the point
 * updates statistics, advances the score and appends to the point log. Out-of-order submissions
 * are rejected with {@link PointSequenceException} and leave the match untouched.
 * <p>
 * Not thread-safe; callers serialize access.
 */
public class MatchController {

    private static final Logger log = LoggerFactory.getLogger(MatchController.class);

    private final ScoreKeeper scoreKeeper = new ScoreKeeper();
    private final StatisticsAggregator aggregator = new StatisticsAggregator();
    private final UndoHistory history = new UndoHistory();
    private final MatchListener listener;

    private MatchState state;
    private PointTransaction pending;

    private MatchController(MatchState state, MatchListener listener) {
        this.state = state;
        this.listener = listener != null ? listener : MatchListener.NONE;
    }

    public static MatchController startMatch(MatchFormat format, String playerOneName, String playerTwoName,
                                             String location, Player startingServer) {
        return startMatch(format, playerOneName, playerTwoName, location, startingServer, MatchListener.NONE);
    }

    public static MatchController startMatch(MatchFormat format, String playerOneName, String playerTwoName,
                                             String location, Player startingServer, MatchListener listener) {
        MatchState state = new MatchState(format, playerOneName, playerTwoName, location, startingServer);
        log.info("Match started: {} vs {} at {}, format={}, {} serves first",
                playerOneName, playerTwoName, location, format, state.getPlayerName(startingServer));
        return new MatchController(state, listener);
    }

    // ============ SUBMISSIONS ============

    public PointProgress submitServeOutcome(ServeOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        PointStep step = pendingStep();
        if (step == PointStep.SECOND_SERVE) {
            if (!ServeOutcome.AFTER_FIRST_FAULT.contains(outcome)) {
                throw new PointSequenceException(step, "After a first-serve fault only "
                        + step.acceptedOutcomes() + " are accepted, got " + outcome);
            }
        } else if (step == PointStep.SERVE) {
            begin();
        } else {
            throw outOfOrder(step, "serve outcome " + outcome);
        }

        if (outcome == ServeOutcome.FIRST_FAULT) {
            pending.firstServeFault = true;
            pending.step = PointStep.SECOND_SERVE;
            return inProgress();
        }
        pending.serve = outcome;
        if (outcome.isTerminal()) {
            return resolve(PointEvent.ofServe(pending.firstServeFault, outcome));
        }
        pending.step = PointStep.RETURN;
        return inProgress();
    }

    public PointProgress submitReturnOutcome(ReturnOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        PointStep step = pendingStep();
        if (step != PointStep.RETURN) {
            throw outOfOrder(step, "return outcome " + outcome);
        }
        if (outcome.isTerminal()) {
            return resolve(PointEvent.ofReturn(pending.firstServeFault, pending.serve, outcome));
        }
        pending.step = PointStep.RALLY;
        return inProgress();
    }

    /**
     * @param netPlayer player to credit with a net approach on this point, or {@code null}
     */
    public PointProgress submitRallyOutcome(RallyOutcome outcome, Player netPlayer) {
        Objects.requireNonNull(outcome, "outcome");
        PointStep step = pendingStep();
        if (step != PointStep.RALLY) {
            throw outOfOrder(step, "rally outcome " + outcome);
        }
        return resolve(PointEvent.ofRally(pending.firstServeFault, pending.serve, outcome, netPlayer));
    }

    public PointProgress submitRallyOutcome(RallyOutcome outcome) {
        return submitRallyOutcome(outcome, null);
    }

    /**
     * Pick who serves the first point of the match tiebreak. Allowed until that point is served.
     */
    public void chooseMatchTiebreakServer(Player player) {
        Objects.requireNonNull(player, "player");
        if (!state.isInMatchTiebreak() || state.tiebreakPointsPlayed() > 0 || pending != null) {
            throw new PointSequenceException(pendingStep(), "The match tiebreak server can only be chosen before its first point");
        }
        state.setTiebreakStartServer(player);
        state.setCurrentServer(player);
        log.info("Match tiebreak: {} serves first", state.getPlayerName(player));
    }

    /**
     * Back out of the point being recorded without recording anything.
     *
     * @return false if no point was in progress
     */
    public boolean abortPointTransaction() {
        if (pending == null) {
            return false;
        }
        history.discardTop();
        pending = null;
        log.info("Point abandoned before it was decided");
        return true;
    }

    /**
     * Remove the most recently recorded point, restoring score, statistics and log exactly as they
     * were before it. A point still being recorded is abandoned first.
     *
     * @return false if there is nothing to undo
     */
    public boolean undo() {
        abortPointTransaction();
        return history.pop()
                .map(previous -> {
                    state = previous;
                    log.info("Undid last point, {} points remain in the log", state.getPointLog().size());
                    return true;
                })
                .orElseGet(() -> {
                    log.info("Nothing to undo");
                    return false;
                });
    }

    // ============ READ ACCESSORS ============

    public PointStep pendingStep() {
        if (pending != null) {
            return pending.step;
        }
        if (state.isMatchComplete()) {
            return PointStep.MATCH_OVER;
        }
        if (state.isInMatchTiebreak() && state.getTiebreakStartServer() == null) {
            return PointStep.MATCH_TIEBREAK_SERVER;
        }
        return PointStep.SERVE;
    }

    public boolean isPointInProgress() {
        return pending != null;
    }

    public Scoreboard currentScoreboard() {
        return Scoreboard.of(state);
    }

    /**
     * Copy of a player's statistics.
     *
     * @throws IllegalArgumentException if the set does not exist
     */
    public PlayerStatistics statistics(StatisticsScope scope, Player player) {
        Objects.requireNonNull(player, "player");
        if (scope.isMatch()) {
            return state.matchStatistics(player).copy();
        }
        int setIndex = scope.setIndex();
        if (setIndex >= state.getSets().size()) {
            throw new IllegalArgumentException("No set " + (setIndex + 1) + ", " + state.getSets().size() + " played so far");
        }
        return state.setStatistics(setIndex, player).copy();
    }

    public PlayerStatistics matchStatistics(Player player) {
        return statistics(StatisticsScope.match(), player);
    }

    public List<PointRecord> pointLog() {
        return List.copyOf(state.getPointLog());
    }

    public boolean isMatchComplete() {
        return state.isMatchComplete();
    }

    public boolean isSetTiebreakActive() {
        return state.isInSetTiebreak();
    }

    public boolean isMatchTiebreakActive() {
        return state.isInMatchTiebreak();
    }

    public int undoDepth() {
        return history.size();
    }

    /**
     * Deep copy of the whole match, for exporters.
     */
    public MatchState snapshot() {
        return state.copy();
    }

    // ============ INTERNALS ============

    private void begin() {
        history.push(state);
        if (state.isInTiebreak()) {
            state.setCurrentServer(ServeRotation.serverFor(state.getTiebreakStartServer(), state.tiebreakPointsPlayed()));
        }
        pending = new PointTransaction(state.getCurrentServer(), PointContext.classify(state), state);
    }

    private PointProgress resolve(PointEvent event) {
        PointTransaction point = pending;
        Player winner = aggregator.record(state, point.server, event, point.flags.breakPoint());
        PointRecord record = new PointRecord(
                point.setIndex,
                point.gameIndex,
                point.tiebreak,
                point.pointNumber,
                point.server,
                event.serveType(),
                event,
                winner,
                point.flags.breakPoint(),
                point.flags.gamePoint(),
                point.flags.setPoint(),
                point.flags.matchPoint()
        );
        state.appendPoint(record);
        ScoreKeeper.Transition transition = scoreKeeper.awardPoint(state, winner);
        pending = null;

        MatchInvariants.check(state, history.size());
        log.debug("Point {} to {} [{}] -> {}", state.getPointLog().size(), winner.label(), record.pressureTags(), transition);

        listener.onPointRecorded(record);
        if (state.isInTiebreak() && ServeRotation.isEndChange(state.tiebreakPointsPlayed())) {
            log.info("Change ends (tiebreak, after {} points)", state.tiebreakPointsPlayed());
            listener.onEndChange(state.tiebreakPointsPlayed());
        }
        if (transition == ScoreKeeper.Transition.MATCH) {
            listener.onMatchComplete();
        }
        MatchPhase phase = transition == ScoreKeeper.Transition.SET ? MatchPhase.SET_COMPLETE : state.getPhase();
        return new PointProgress(pendingStep(), record, phase);
    }

    private PointProgress inProgress() {
        return new PointProgress(pending.step, null, state.getPhase());
    }

    private PointSequenceException outOfOrder(PointStep expected, String submitted) {
        String message = switch (expected) {
            case MATCH_OVER -> "The match is over; cannot accept " + submitted;
            case MATCH_TIEBREAK_SERVER -> "Choose who serves first in the match tiebreak before submitting " + submitted;
            default -> "Expected " + expected + " but got " + submitted;
        };
        return new PointSequenceException(expected, message);
    }

    /**
     * A point between its first serve and its deciding shot.
     */
    private static final class PointTransaction {
        private final Player server;
        private final PointFlags flags;
        private final int setIndex;
        private final int gameIndex;
        private final boolean tiebreak;
        private final int pointNumber;

        private PointStep step = PointStep.SERVE;
        private boolean firstServeFault;
        private ServeOutcome serve;

        private PointTransaction(Player server, PointFlags flags, MatchState state) {
            this.server = server;
            this.flags = flags;
            this.setIndex = state.getCurrentSetIndex();
            this.gameIndex = state.currentSet().gamesPlayed();
            this.tiebreak = state.isInTiebreak();
            this.pointNumber = tiebreak
                    ? state.tiebreakPointsPlayed() + 1
                    : state.getGamePoints(Player.ONE) + state.getGamePoints(Player.TWO) + 1;
        }
    }
}
