package com.rendezvous.channel;

import java.util.Optional;

/**
 * Outcome of a receive on a {@link Channel}.
 * Sealed to ensure exhaustive handling: a message was delivered, a non-blocking receive
 * found nothing, or a blocking receive timed out. Neither of the latter two is an error.
 *
 * @param <M> The payload type
 */
public sealed interface Receipt<M> permits Receipt.Delivered, Receipt.Empty, Receipt.TimedOut {

    /**
     * A message taken from a pair queue, tagged with the process that sent it.
     */
    record Delivered<M>(int senderId, M message) implements Receipt<M> {
        @Override
        public boolean isDelivered() {
            return true;
        }

        @Override
        public Optional<Delivered<M>> delivered() {
            return Optional.of(this);
        }
    }

    /**
     * A non-blocking receive found no message.
     */
    record Empty<M>() implements Receipt<M> {
        @Override
        public boolean isDelivered() {
            return false;
        }

        @Override
        public Optional<Delivered<M>> delivered() {
            return Optional.empty();
        }
    }

    /**
     * A blocking receive waited for its full timeout window without a message arriving.
     */
    record TimedOut<M>() implements Receipt<M> {
        @Override
        public boolean isDelivered() {
            return false;
        }

        @Override
        public Optional<Delivered<M>> delivered() {
            return Optional.empty();
        }
    }

    boolean isDelivered();

    Optional<Delivered<M>> delivered();

    default boolean isEmpty() {
        return this instanceof Empty;
    }

    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * Returns the delivered message or fails.
     *
     * @return The delivered receipt
     * @throws IllegalStateException if no message was delivered
     */
    default Delivered<M> getOrThrow() {
        return delivered().orElseThrow(() -> new IllegalStateException("No message delivered: " + this));
    }

    static <M> Receipt<M> empty() {
        return new Empty<>();
    }

    static <M> Receipt<M> timedOut() {
        return new TimedOut<>();
    }
}
