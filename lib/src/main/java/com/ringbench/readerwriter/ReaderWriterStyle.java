package com.ringbench.readerwriter;

import com.ringbench.channel.ChannelFactory;
import com.ringbench.dispatcher.Dispatcher;

/**
 * The two encodings of the reader/writer pair compared by the harness.
 */
public enum ReaderWriterStyle {

    STRICT {
        @Override
        public ReaderWriter create(Dispatcher dispatcher, ChannelFactory<Integer> channelFactory) {
            return new StrictReaderWriter(dispatcher, channelFactory);
        }
    },

    TWEAKED {
        @Override
        public ReaderWriter create(Dispatcher dispatcher, ChannelFactory<Integer> channelFactory) {
            return new TweakedReaderWriter(dispatcher, channelFactory);
        }
    };

    public abstract ReaderWriter create(Dispatcher dispatcher, ChannelFactory<Integer> channelFactory);
}
