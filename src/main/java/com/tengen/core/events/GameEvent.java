package com.tengen.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event about the current game.
 *
 * @param eventType one of {@link #WILL_CREATE}, {@link #DID_CREATE}, {@link #LOADED}, {@link #SAVED}
 * @param gameId    the game this event is about (nullable for {@code game.willCreate} before the first game)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record GameEvent(
    String eventType,
    String gameId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String WILL_CREATE = "game.willCreate";
    public static final String DID_CREATE = "game.didCreate";
    public static final String LOADED = "game.loaded";
    public static final String SAVED = "game.saved";

    public static GameEvent of(String eventType, String gameId, Map<String, Object> payload) {
        return new GameEvent(eventType, gameId, payload, Instant.now());
    }
}
