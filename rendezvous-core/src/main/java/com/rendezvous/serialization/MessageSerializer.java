package com.rendezvous.serialization;

import java.io.Serializable;

/**
 * Converts channel payloads to and from the bytes stored in a pair queue.
 * Serializers travel with their channel handle, so they must be serializable themselves.
 *
 * @param <M> The payload type
 */
public interface MessageSerializer<M> extends Serializable {

    /**
     * Encodes a payload.
     *
     * @param message The payload
     * @return The encoded bytes
     * @throws com.rendezvous.channel.ChannelException.SerializationException if the payload cannot be encoded
     */
    byte[] serialize(M message);

    /**
     * Decodes a payload.
     *
     * @param bytes The encoded bytes
     * @return The payload
     * @throws com.rendezvous.channel.ChannelException.SerializationException if the bytes cannot be decoded
     */
    M deserialize(byte[] bytes);
}
