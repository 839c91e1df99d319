package com.tennis.tracker.service;

import com.tennis.engine.MatchController;
import com.tennis.engine.MatchListener;
import com.tennis.engine.PointProgress;
import com.tennis.engine.Scoreboard;
import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;
import com.tennis.engine.model.MatchFormat;
import com.tennis.engine.model.MatchState;
import com.tennis.engine.model.Player;
import com.tennis.engine.model.PointRecord;
import com.tennis.engine.stats.StatisticsScope;
import com.tennis.tracker.config.TrackerProperties;
import com.tennis.tracker.dto.PointResponse;
import com.tennis.tracker.dto.ProgressResponse;
import com.tennis.tracker.dto.StartMatchRequest;
import com.tennis.tracker.dto.StatisticsResponse;
import com.tennis.tracker.dto.StatusResponse;
import com.tennis.tracker.dto.UndoResponse;
import com.tennis.tracker.exception.NoActiveMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the match being recorded. The engine is single-threaded, so every operation runs under
 * this service's lock.
 */
@Service
public class MatchSessionService {

    private static final Logger log = LoggerFactory.getLogger(MatchSessionService.class);

    private final TrackerProperties properties;
    private MatchController match;

    public MatchSessionService(TrackerProperties properties) {
        this.properties = properties;
    }

    /**
     * Start a new match, replacing any match in progress.
     */
    public synchronized Scoreboard start(StartMatchRequest request) {
        MatchFormat format = resolveFormat(request);
        if (match != null && !match.isMatchComplete()) {
            log.warn("Discarding unfinished match to start {} vs {}", request.playerOne(), request.playerTwo());
        }
        String location = request.location() == null ? "" : request.location();
        match = MatchController.startMatch(format, request.playerOne().trim(), request.playerTwo().trim(),
                location, request.firstServer(), new LoggingListener());
        return match.currentScoreboard();
    }

    // ============ POINT SUBMISSION ============

    public synchronized ProgressResponse serve(ServeOutcome outcome) {
        return respond(active().submitServeOutcome(outcome));
    }

    public synchronized ProgressResponse returnShot(ReturnOutcome outcome) {
        return respond(active().submitReturnOutcome(outcome));
    }

    public synchronized ProgressResponse rally(RallyOutcome outcome, Player netPlayer) {
        return respond(active().submitRallyOutcome(outcome, netPlayer));
    }

    public synchronized boolean abortPoint() {
        return active().abortPointTransaction();
    }

    public synchronized UndoResponse undo() {
        boolean undone = active().undo();
        return UndoResponse.of(undone, match.currentScoreboard());
    }

    public synchronized Scoreboard chooseMatchTiebreakServer(Player server) {
        active().chooseMatchTiebreakServer(server);
        return match.currentScoreboard();
    }

    // ============ READS ============

    public synchronized Scoreboard scoreboard() {
        return active().currentScoreboard();
    }

    /**
     * @param set 1-based set number, or {@code null} for match totals
     */
    public synchronized StatisticsResponse statistics(Integer set) {
        MatchController current = active();
        StatisticsScope scope;
        if (set == null) {
            scope = StatisticsScope.match();
        } else if (set < 1) {
            throw new IllegalArgumentException("Set numbers start at 1: " + set);
        } else {
            scope = StatisticsScope.set(set - 1);
        }
        Scoreboard board = current.currentScoreboard();
        return new StatisticsResponse(
                set == null ? "match" : "set " + set,
                StatisticsResponse.PlayerLine.from(board.playerOneName(), current.statistics(scope, Player.ONE)),
                StatisticsResponse.PlayerLine.from(board.playerTwoName(), current.statistics(scope, Player.TWO))
        );
    }

    public synchronized List<PointResponse> points() {
        List<PointRecord> entries = active().pointLog();
        List<PointResponse> points = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            points.add(PointResponse.from(entries.get(i), i + 1));
        }
        return points;
    }

    public synchronized StatusResponse status() {
        MatchController current = active();
        return new StatusResponse(
                current.isMatchComplete(),
                current.isSetTiebreakActive(),
                current.isMatchTiebreakActive(),
                current.isPointInProgress(),
                current.pendingStep(),
                current.pendingStep().acceptedOutcomes(),
                current.undoDepth(),
                current.currentScoreboard().winner()
        );
    }

    /**
     * Deep copy of the match for exporting.
     */
    public synchronized MatchState snapshot() {
        return active().snapshot();
    }

    public synchronized boolean hasMatch() {
        return match != null;
    }

    private MatchController active() {
        if (match == null) {
            throw new NoActiveMatchException();
        }
        return match;
    }

    private ProgressResponse respond(PointProgress progress) {
        return ProgressResponse.from(progress, match.pointLog().size(), match.currentScoreboard());
    }

    private MatchFormat resolveFormat(StartMatchRequest request) {
        if (request.formatChoice() != null) {
            return MatchFormat.fromChoice(request.formatChoice());
        }
        if (request.format() != null) {
            return MatchFormat.fromName(request.format());
        }
        return MatchFormat.fromName(properties.getDefaultFormat());
    }

    /**
     * Logs the final line score once the engine reports the match is over.
     */
    private final class LoggingListener implements MatchListener {

        @Override
        public void onMatchComplete() {
            Scoreboard board = match.currentScoreboard();
            String winner = board.winner() == Player.ONE ? board.playerOneName() : board.playerTwoName();
            log.info("{} wins {} vs {}: {}", winner, board.playerOneName(), board.playerTwoName(), board.sets());
        }
    }
}
