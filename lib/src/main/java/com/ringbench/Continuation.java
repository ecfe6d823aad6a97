package com.ringbench;

/**
 * Resumes a suspended task with the value it was waiting for.
 * Primitives retain a continuation while its owner is parked and hand it back to the
 * dispatcher once the value is available.
 *
 * @param <T> the type of value delivered on resumption
 */
@FunctionalInterface
public interface Continuation<T> {

    /**
     * Resumes the suspended task.
     *
     * @param value the value the task was waiting for
     */
    void resume(T value);
}
