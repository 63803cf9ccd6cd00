package io.github.drompincen.collabsync.runtime.event;

import io.github.drompincen.collabsync.protocol.event.Event;

/**
 * Applies what an event means to local state (participants, typing flags, session metadata).
 */
@FunctionalInterface
public interface EventEffects {

    void apply(Event event, boolean local);
}
