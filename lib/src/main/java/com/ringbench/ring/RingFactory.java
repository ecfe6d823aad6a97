package com.ringbench.ring;

import com.ringbench.channel.RendezvousChannel;

/**
 * Builds closed rings of started actors. Implementations differ in the actor style and
 * primitive used, so the runner can swap them without changing its own logic.
 */
public interface RingFactory {

    /**
     * Builds a ring of {@code size} actors, all reporting on {@code finish}.
     *
     * @param size The number of actors, at least 1
     * @param finish The finish channel shared by every chain of the run
     * @return The chain, ready for its initial token
     */
    Chain build(int size, RendezvousChannel<Integer> finish);
}
