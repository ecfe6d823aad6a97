package com.ringbench.ring;

import com.ringbench.actor.RingActor;

import java.util.List;

/**
 * One instantiated ring of actors, identified by its entry point.
 * Only the caller that built the chain injects the initial token.
 */
public interface Chain extends AutoCloseable {

    /**
     * Sends the initial token to actor 1 with the ring's transfer operation.
     * Does not wait for the transfer to complete.
     *
     * @param token The initial token, at least 0
     */
    void inject(int token);

    /**
     * Returns the ring's actors in ring order, actor 1 first.
     *
     * @return The actors
     */
    List<? extends RingActor> actors();

    default int size() {
        return actors().size();
    }

    /**
     * Disposes of every actor of the ring.
     */
    @Override
    default void close() {
        for (RingActor actor : actors()) {
            actor.close();
        }
    }
}
