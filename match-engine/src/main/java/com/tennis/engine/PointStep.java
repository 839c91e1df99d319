package com.tennis.engine;

import com.tennis.engine.event.RallyOutcome;
import com.tennis.engine.event.ReturnOutcome;
import com.tennis.engine.event.ServeOutcome;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * What the controller expects next while a point is being recorded.
 */
public enum PointStep {
    SERVE,
    SECOND_SERVE,
    RETURN,
    RALLY,
    MATCH_TIEBREAK_SERVER,
    MATCH_OVER;

    /**
     * Names of the outcomes accepted at this step, for error reporting.
     */
    public List<String> acceptedOutcomes() {
        return switch (this) {
            case SERVE -> names(Arrays.asList(ServeOutcome.values()));
            case SECOND_SERVE -> names(ServeOutcome.AFTER_FIRST_FAULT);
            case RETURN -> names(Arrays.asList(ReturnOutcome.values()));
            case RALLY -> names(Arrays.asList(RallyOutcome.values()));
            case MATCH_TIEBREAK_SERVER, MATCH_OVER -> List.of();
        };
    }

    private static List<String> names(Collection<? extends Enum<?>> values) {
        return values.stream().map(Enum::name).toList();
    }
}
