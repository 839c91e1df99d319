package com.tennis.tracker.dto;

import com.tennis.engine.Scoreboard;

public record UndoResponse(boolean undone, String message, Scoreboard scoreboard) {

    public static UndoResponse of(boolean undone, Scoreboard scoreboard) {
        return new UndoResponse(undone, undone ? "Last point undone." : "Nothing to undo.", scoreboard);
    }
}
