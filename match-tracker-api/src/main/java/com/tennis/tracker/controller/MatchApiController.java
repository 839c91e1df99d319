package com.tennis.tracker.controller;

import com.tennis.engine.Scoreboard;
import com.tennis.engine.model.MatchFormat;
import com.tennis.tracker.dto.PointResponse;
import com.tennis.tracker.dto.ProgressResponse;
import com.tennis.tracker.dto.RallyRequest;
import com.tennis.tracker.dto.ReturnRequest;
import com.tennis.tracker.dto.ServeRequest;
import com.tennis.tracker.dto.StartMatchRequest;
import com.tennis.tracker.dto.StatisticsResponse;
import com.tennis.tracker.dto.StatusResponse;
import com.tennis.tracker.dto.TiebreakServerRequest;
import com.tennis.tracker.dto.UndoResponse;
import com.tennis.tracker.service.MatchSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: start a match, submit each point shot by shot, correct mistakes and read
 * the score and statistics.
 */
@RestController
@RequestMapping("/api/match")
@Tag(name = "Match", description = "Record a match point by point")
public class MatchApiController {

    private final MatchSessionService session;

    public MatchApiController(MatchSessionService session) {
        this.session = session;
    }

    @PostMapping
    @Operation(summary = "Start a match",
               description = "Format is chosen by menu number (1 full sets, 2 match tiebreak, 3 short sets) or preset name; " +
                       "unknown selections fall back to short sets")
    public ResponseEntity<Scoreboard> start(@Valid @RequestBody StartMatchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(session.start(request));
    }

    // ============ POINT ENTRY ============

    @PostMapping("/point/serve")
    @Operation(summary = "Submit serve outcome", description = "Opens a point, or completes the second serve after FIRST_FAULT")
    public ProgressResponse serve(@Valid @RequestBody ServeRequest request) {
        return session.serve(request.outcome());
    }

    @PostMapping("/point/return")
    @Operation(summary = "Submit return outcome", description = "Only after FIRST_IN or SECOND_IN")
    public ProgressResponse returnShot(@Valid @RequestBody ReturnRequest request) {
        return session.returnShot(request.outcome());
    }

    @PostMapping("/point/rally")
    @Operation(summary = "Submit rally outcome", description = "Only after RETURN_IN; optionally marks who came to the net")
    public ProgressResponse rally(@Valid @RequestBody RallyRequest request) {
        return session.rally(request.outcome(), request.netPlayer());
    }

    @PostMapping("/point/abort")
    @Operation(summary = "Abort the point in progress", description = "Discards the partially entered point")
    public Map<String, Object> abort() {
        boolean aborted = session.abortPoint();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("aborted", aborted);
        response.put("message", aborted ? "Point abandoned." : "No point in progress.");
        return response;
    }

    @PostMapping("/undo")
    @Operation(summary = "Undo last point", description = "Restores score, statistics and log to before the last recorded point")
    public UndoResponse undo() {
        return session.undo();
    }

    @PostMapping("/tiebreak-server")
    @Operation(summary = "Choose match tiebreak server", description = "Required before the first point of a deciding match tiebreak")
    public Scoreboard chooseTiebreakServer(@Valid @RequestBody TiebreakServerRequest request) {
        return session.chooseMatchTiebreakServer(request.server());
    }

    // ============ READS ============

    @GetMapping("/formats")
    @Operation(summary = "Format menu", description = "Presets accepted as formatChoice or format when starting a match")
    public List<Map<String, Object>> formats() {
        List<Map<String, Object>> menu = new ArrayList<>();
        for (MatchFormat.Preset preset : MatchFormat.Preset.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("choice", preset.getChoice());
            entry.put("name", preset.name());
            entry.put("description", preset.getDescription());
            entry.put("format", preset.format());
            menu.add(entry);
        }
        return menu;
    }

    @GetMapping("/scoreboard")
    @Operation(summary = "Scoreboard")
    public Scoreboard scoreboard() {
        return session.scoreboard();
    }

    @GetMapping("/statistics")
    @Operation(summary = "Statistics", description = "Match totals, or a single set with ?set=N (1-based)")
    public StatisticsResponse statistics(
            @Parameter(description = "Set number, 1-based; omit for match totals")
            @RequestParam(required = false) Integer set
    ) {
        return session.statistics(set);
    }

    @GetMapping("/points")
    @Operation(summary = "Point-by-point log")
    public List<PointResponse> points() {
        return session.points();
    }

    @GetMapping("/status")
    @Operation(summary = "Match status", description = "Completion, tiebreak flags and the submission expected next")
    public StatusResponse status() {
        return session.status();
    }
}
