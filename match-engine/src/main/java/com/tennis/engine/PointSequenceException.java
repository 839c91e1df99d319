package com.tennis.engine;

import java.util.List;

/**
 * An outcome was submitted out of order: the controller was expecting a different step of the
 * point. Nothing is recorded when this is thrown.
 */
public class PointSequenceException extends RuntimeException {

    private final PointStep expected;

    public PointSequenceException(PointStep expected, String message) {
        super(message);
        this.expected = expected;
    }

    public PointStep getExpected() {
        return expected;
    }

    public List<String> getAcceptedOutcomes() {
        return expected.acceptedOutcomes();
    }
}
