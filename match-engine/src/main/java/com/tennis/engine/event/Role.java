package com.tennis.engine.event;

import com.tennis.engine.model.Player;

/**
 * Side of the point relative to who is serving it.
 */
public enum Role {
    SERVER,
    RETURNER;

    public Player resolve(Player server) {
        return this == SERVER ? server : server.opponent();
    }
}
