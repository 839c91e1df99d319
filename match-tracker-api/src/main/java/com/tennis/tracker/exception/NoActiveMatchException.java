package com.tennis.tracker.exception;

/**
 * Thrown when an operation needs a match but none has been started.
 */
public class NoActiveMatchException extends RuntimeException {

    public NoActiveMatchException() {
        super("No match in progress; start one with POST /api/match");
    }
}
