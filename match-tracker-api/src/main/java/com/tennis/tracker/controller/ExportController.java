package com.tennis.tracker.controller;

import com.tennis.engine.model.MatchState;
import com.tennis.tracker.export.MatchExportService;
import com.tennis.tracker.service.MatchSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/match/export")
@Tag(name = "Export", description = "Download the match as text, JSON or CSV")
public class ExportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final MatchSessionService session;
    private final MatchExportService exportService;

    public ExportController(MatchSessionService session, MatchExportService exportService) {
        this.session = session;
        this.exportService = exportService;
    }

    @GetMapping("/text")
    @Operation(summary = "Text summary", description = "Set scores, statistics blocks and the point-by-point log")
    public ResponseEntity<String> text() {
        MatchState state = session.snapshot();
        return download(exportService.textSummary(state), state, ".txt", MediaType.TEXT_PLAIN);
    }

    @GetMapping("/json")
    @Operation(summary = "JSON document")
    public ResponseEntity<String> json() {
        MatchState state = session.snapshot();
        return download(exportService.json(state), state, ".json", MediaType.APPLICATION_JSON);
    }

    @GetMapping("/csv")
    @Operation(summary = "CSV table", description = "totals (match totals), sets (per-set statistics) or points (point log)")
    public ResponseEntity<String> csv(
            @Parameter(description = "totals, sets or points")
            @RequestParam(defaultValue = "totals") String table
    ) {
        MatchState state = session.snapshot();
        return switch (table) {
            case "totals" -> download(exportService.csvMatchTotals(state), state, "_match_totals.csv", TEXT_CSV);
            case "sets" -> download(exportService.csvPerSet(state), state, "_per_set_stats.csv", TEXT_CSV);
            case "points" -> download(exportService.csvPoints(state), state, "_points.csv", TEXT_CSV);
            default -> throw new IllegalArgumentException("Unknown CSV table '" + table + "', expected totals, sets or points");
        };
    }

    private ResponseEntity<String> download(String body, MatchState state, String suffix, MediaType type) {
        String fileName = exportService.fileBase(state, LocalDateTime.now()) + suffix;
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(fileName).build().toString())
                .body(body);
    }
}
