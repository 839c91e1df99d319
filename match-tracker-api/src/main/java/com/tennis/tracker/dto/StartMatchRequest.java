package com.tennis.tracker.dto;

import com.tennis.engine.model.Player;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Start a new match. {@code formatChoice} (1, 2 or 3) wins over {@code format} (a preset name);
 * with neither, the configured default format applies.
 */
public record StartMatchRequest(
        @NotBlank String playerOne,
        @NotBlank String playerTwo,
        String location,
        Integer formatChoice,
        String format,
        @NotNull Player firstServer
) {
}
