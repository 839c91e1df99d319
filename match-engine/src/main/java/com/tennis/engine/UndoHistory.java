package com.tennis.engine;

import com.tennis.engine.model.MatchState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Stack of full match snapshots, one per recorded point, newest on top.
 */
public class UndoHistory {

    private final Deque<MatchState> snapshots = new ArrayDeque<>();

    /**
     * Push a deep copy of {@code state}.
     */
    public void push(MatchState state) {
        snapshots.push(state.copy());
    }

    /**
     * Remove and return the newest snapshot.
     */
    public Optional<MatchState> pop() {
        return Optional.ofNullable(snapshots.poll());
    }

    /**
     * Drop the newest snapshot without restoring it.
     *
     * @throws IllegalStateException if there is nothing to discard
     */
    public void discardTop() {
        if (snapshots.poll() == null) {
            throw new IllegalStateException("No snapshot to discard");
        }
    }

    public int size() {
        return snapshots.size();
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }
}
