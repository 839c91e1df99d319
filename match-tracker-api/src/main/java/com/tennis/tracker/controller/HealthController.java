package com.tennis.tracker.controller;

import com.tennis.tracker.service.MatchSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final MatchSessionService session;

    public HealthController(MatchSessionService session) {
        this.session = session;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Liveness and whether a match has been started")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());
        health.put("matchLoaded", session.hasMatch());
        return health;
    }
}
