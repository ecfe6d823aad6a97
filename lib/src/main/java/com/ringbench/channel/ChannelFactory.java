package com.ringbench.channel;

import com.ringbench.dispatcher.Dispatcher;

/**
 * Creates primitive instances bound to a dispatcher, e.g. {@code RendezvousChannel::new}.
 *
 * @param <T> The type of values carried by the created channels
 */
@FunctionalInterface
public interface ChannelFactory<T> {

    Channel<T> create(Dispatcher dispatcher);
}
