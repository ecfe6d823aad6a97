package com.ringbench.actor;

/**
 * A member of a token ring.
 * <p>
 * An actor receives tokens one at a time. A non-zero token is forwarded to the next
 * actor decremented by one; token 0 makes the actor report its name on the run's finish
 * channel, after which it receives nothing more.
 */
public interface RingActor {

    /**
     * Returns the actor's 1-based position in its ring.
     *
     * @return The actor name
     */
    int name();

    /**
     * Hands the actor to the dispatcher so it begins waiting for tokens.
     */
    void start();

    /**
     * Returns whether the actor received token 0 and reported.
     *
     * @return true once the actor has reported
     */
    boolean isFinished();

    /**
     * Returns how many tokens the actor has received, the terminal 0 included.
     *
     * @return The number of tokens received
     */
    long received();

    /**
     * Disposes of the actor after its run. Resuming a closed actor is an error.
     */
    void close();
}
