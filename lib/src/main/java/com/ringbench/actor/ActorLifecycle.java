package com.ringbench.actor;

/**
 * Defines lifecycle callbacks for a callback-style actor driven by an ActorRunner.
 *
 * @param <T> The type of messages accepted by the actor
 */
public interface ActorLifecycle<T> {
    /** Called once before the first message is delivered. */
    void preStart();

    /**
     * Called to dispatch a received message to the actor.
     *
     * @param message the message to be processed by the actor
     */
    void receive(T message);

    /** Called once when the actor is disposed. */
    void postStop();
}
