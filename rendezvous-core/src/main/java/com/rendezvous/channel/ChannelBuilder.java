package com.rendezvous.channel;

import com.rendezvous.serialization.MessageSerializer;
import com.rendezvous.store.StoreConnector;

import java.util.Objects;

/**
 * Builder for {@link Channel} handles.
 *
 * <pre>{@code
 * Channel<Order> channel = Channel.builder(connector)
 *     .channelId(3)
 *     .serializer(new OrderSerializer())
 *     .open();
 * }</pre>
 *
 * @param <M> The payload type
 */
public class ChannelBuilder<M> {

    private final StoreConnector connector;
    private final MessageSerializer<M> serializer;
    private int channelId;
    private boolean flush;
    private ProcessIdentity identity = ProcessIdentity.current();

    ChannelBuilder(StoreConnector connector, MessageSerializer<M> serializer) {
        this.connector = Objects.requireNonNull(connector, "connector cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
    }

    /**
     * Sets the channel id. Defaults to 0.
     *
     * @param channelId The channel id, between 0 and 9999
     * @return This builder
     */
    public ChannelBuilder<M> channelId(int channelId) {
        this.channelId = channelId;
        return this;
    }

    /**
     * Erases the whole store before registering the channel. Only meant for tests and
     * demos that need a clean slate.
     *
     * @param flush Whether to flush
     * @return This builder
     */
    public ChannelBuilder<M> flush(boolean flush) {
        this.flush = flush;
        return this;
    }

    /**
     * Sets how the calling process is identified. Defaults to
     * {@link ProcessIdentity#current()}.
     *
     * @param identity The identity strategy
     * @return This builder
     */
    public ChannelBuilder<M> identity(ProcessIdentity identity) {
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        return this;
    }

    /**
     * Switches the payload serializer, and with it the payload type.
     *
     * @param serializer The serializer
     * @param <T> The new payload type
     * @return A builder for the new payload type carrying over every other setting
     */
    public <T> ChannelBuilder<T> serializer(MessageSerializer<T> serializer) {
        ChannelBuilder<T> builder = new ChannelBuilder<>(connector, serializer);
        builder.channelId = channelId;
        builder.flush = flush;
        builder.identity = identity;
        return builder;
    }

    /**
     * Opens the channel, registering it in the store if no process has yet.
     *
     * @return A handle on the channel
     */
    public Channel<M> open() {
        Channel<M> channel = new Channel<>(channelId, connector, identity, serializer);
        channel.register(flush);
        return channel;
    }
}
