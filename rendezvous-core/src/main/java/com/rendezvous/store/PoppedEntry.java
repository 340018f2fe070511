package com.rendezvous.store;

import java.util.Objects;

/**
 * The outcome of a {@link MessageStore#blockingPop}: the queue that fired and the value
 * taken from its head.
 */
public record PoppedEntry(String key, byte[] value) {

    public PoppedEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
