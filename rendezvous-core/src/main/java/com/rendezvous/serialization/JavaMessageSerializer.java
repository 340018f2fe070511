package com.rendezvous.serialization;

import com.rendezvous.channel.ChannelException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serial;
import java.io.Serializable;

/**
 * {@link MessageSerializer} based on Java object serialization.
 *
 * @param <M> The payload type
 */
public final class JavaMessageSerializer<M extends Serializable> implements MessageSerializer<M> {

    @Serial
    private static final long serialVersionUID = 1L;

    @Override
    public byte[] serialize(M message) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(message);
        } catch (IOException e) {
            throw new ChannelException.SerializationException("Failed to serialize message of type "
                    + (message == null ? "null" : message.getClass().getName()), e);
        }
        return bytes.toByteArray();
    }

    @Override
    public M deserialize(byte[] bytes) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            @SuppressWarnings("unchecked")
            M message = (M) in.readObject();
            return message;
        } catch (IOException | ClassNotFoundException e) {
            throw new ChannelException.SerializationException("Failed to deserialize message", e);
        }
    }
}
