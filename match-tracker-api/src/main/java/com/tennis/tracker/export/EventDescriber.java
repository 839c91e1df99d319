package com.tennis.tracker.export;

import com.tennis.engine.event.PointEvent;
import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;

/**
 * Renders a structured point event as the operator-facing event trail,
 * e.g. {@code 1st fault -> 2nd in; Return in; Rally: server winner.}
 */
public final class EventDescriber {

    private EventDescriber() {}

    public static String describe(PointEvent event) {
        StringBuilder text = new StringBuilder();
        if (event.firstServeFault()) {
            text.append("1st fault -> ");
        }
        text.append(serve(event.serve()));
        if (event.returnOutcome() != null) {
            text.append(returnShot(event.returnOutcome()));
        }
        if (event.rallyOutcome() != null) {
            text.append(rally(event.rallyOutcome()));
        }
        return text.toString();
    }

    private static String serve(ServeOutcome serve) {
        return switch (serve) {
            case FIRST_IN -> "1st in; ";
            case FIRST_FAULT -> "1st fault -> ";
            case SECOND_IN -> "2nd in; ";
            case DOUBLE_FAULT -> "double fault.";
            case ACE_FIRST -> "Ace (1st).";
            case ACE_SECOND -> "Ace (2nd).";
            case SERVICE_WINNER_FIRST -> "Service winner (1st).";
            case SERVICE_WINNER_SECOND -> "Service winner (2nd).";
        };
    }

    private static String returnShot(ReturnOutcome outcome) {
        return switch (outcome) {
            case RETURN_WINNER -> "Return winner.";
            case RETURN_UNFORCED_ERROR -> "Return UE.";
            case RETURN_FORCED_ERROR -> "Return FE (drawn by server).";
            case RETURN_IN -> "Return in; ";
        };
    }

    private static String rally(RallyOutcome outcome) {
        return switch (outcome) {
            case SERVER_WINNER -> "Rally: server winner.";
            case RETURNER_WINNER -> "Rally: returner winner.";
            case SERVER_UNFORCED_ERROR -> "Rally: server UE.";
            case RETURNER_UNFORCED_ERROR -> "Rally: returner UE.";
            case SERVER_FORCED_ERROR_DRAWN -> "Rally: server FE (drawn by returner).";
            case RETURNER_FORCED_ERROR_DRAWN -> "Rally: returner FE (drawn by server).";
        };
    }
}
