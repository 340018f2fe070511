package com.rendezvous.channel;

import com.rendezvous.registry.Caller;
import com.rendezvous.registry.ChannelKeys;
import com.rendezvous.registry.MembershipRegistry;
import com.rendezvous.serialization.JavaMessageSerializer;
import com.rendezvous.serialization.MessageSerializer;
import com.rendezvous.store.MessageStore;
import com.rendezvous.store.PoppedEntry;
import com.rendezvous.store.StoreConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A channel shared by a group of OS-level processes that exchange messages through a
 * common {@link MessageStore}.
 *
 * <p>Each process opens its own handle on the channel, joins it under a channel-level id,
 * and can then send to one, several or all members and receive selectively from one,
 * several or any sender. Messages between a given sender and receiver are delivered in
 * send order.
 *
 * <p>A handle holds no connection. Every operation connects through the
 * {@link StoreConnector}, does its work and disconnects, which keeps the handle
 * serializable: it can be created by a parent process and passed to the children that
 * use it. The identity of the calling process is resolved on every call through a
 * {@link ProcessIdentity}.
 *
 * <p>Usage:
 * <pre>{@code
 * Channel<Serializable> channel = Channel.open(1, connector);
 * channel.join(2);
 * channel.sendTo(1, "hello");
 * Receipt<Serializable> reply = channel.recvFromAny();
 * }</pre>
 *
 * @param <M> The payload type
 */
public final class Channel<M> implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    private static final byte[] WAKEUP_MARKER = "WAKEUP".getBytes(StandardCharsets.US_ASCII);

    private final int channelId;
    private final StoreConnector connector;
    private final ProcessIdentity identity;
    private final MessageSerializer<M> serializer;
    private final transient ChannelKeys keys;
    private final transient MembershipRegistry registry;

    Channel(int channelId, StoreConnector connector, ProcessIdentity identity, MessageSerializer<M> serializer) {
        this.channelId = channelId;
        this.connector = Objects.requireNonNull(connector, "connector cannot be null");
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer cannot be null");
        this.keys = new ChannelKeys(channelId);
        this.registry = new MembershipRegistry(keys);
    }

    /**
     * Opens a channel with Java-serialized payloads, registering it if this is the first
     * process to reference the channel id.
     *
     * @param channelId The channel id
     * @param connector Connector to the shared store
     * @return A handle on the channel
     */
    public static Channel<Serializable> open(int channelId, StoreConnector connector) {
        return open(channelId, connector, false);
    }

    /**
     * Opens a channel with Java-serialized payloads.
     *
     * @param channelId The channel id
     * @param connector Connector to the shared store
     * @param flush Whether to erase the entire store first; for resets between tests
     * @return A handle on the channel
     */
    public static Channel<Serializable> open(int channelId, StoreConnector connector, boolean flush) {
        return builder(connector).channelId(channelId).flush(flush).open();
    }

    /**
     * Starts building a channel handle with a non-default identity or payload serializer.
     *
     * @param connector Connector to the shared store
     * @return A builder using Java serialization and the current process identity
     */
    public static ChannelBuilder<Serializable> builder(StoreConnector connector) {
        return new ChannelBuilder<>(connector, new JavaMessageSerializer<>());
    }

    /**
     * Registers the channel in the store unless it already exists. Called once per handle
     * by {@link ChannelBuilder#open()}.
     */
    void register(boolean flush) {
        try (MessageStore store = connector.connect()) {
            if (flush) {
                logger.info("Flushing store before opening channel {}", channelId);
                store.flushAll();
            }
            registry.register(store);
        }
    }

    public int channelId() {
        return channelId;
    }

    /**
     * Joins the calling process to this channel.
     *
     * @param processId The channel-level id to join under, between 0 and 9998
     * @throws ChannelException.AlreadyJoinedException if this OS process already joined
     * @throws ChannelException.IdInUseException if another process holds {@code processId}
     */
    public void join(int processId) {
        try (MessageStore store = connector.connect()) {
            registry.join(store, identity.osProcessId(), processId);
        }
    }

    /**
     * Removes the calling process from this channel. Messages still queued for it stay in
     * the store.
     *
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     */
    public void leave() {
        try (MessageStore store = connector.connect()) {
            registry.leave(store, identity.osProcessId());
        }
    }

    /**
     * Returns the channel-level id the calling process joined under.
     *
     * @return The caller's id
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     */
    public int processId() {
        try (MessageStore store = connector.connect()) {
            return registry.authorize(store, identity.osProcessId()).processId();
        }
    }

    /**
     * Lists the processes that have currently joined.
     *
     * @return The channel-level ids in ascending order
     */
    public Set<Integer> members() {
        try (MessageStore store = connector.connect()) {
            return registry.members(store);
        }
    }

    public boolean isMember(int processId) {
        try (MessageStore store = connector.connect()) {
            return registry.isMember(store, processId);
        }
    }

    // ==================== Sending ====================

    /**
     * Sends a message to one process.
     *
     * @param destination The receiving process
     * @param message The payload
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     * @throws ChannelException.DestinationNotMemberException if the destination has not joined
     */
    public void sendTo(int destination, M message) {
        sendTo(List.of(destination), message);
    }

    /**
     * Sends a message to each of several processes. Destinations are handled in iteration
     * order; the first one that is not a member aborts the call, after the earlier ones
     * have been sent to.
     *
     * @param destinations The receiving processes
     * @param message The payload
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     * @throws ChannelException.DestinationNotMemberException if a destination has not joined
     */
    public void sendTo(Collection<Integer> destinations, M message) {
        Objects.requireNonNull(destinations, "destinations cannot be null");
        try (MessageStore store = connector.connect()) {
            Caller caller = registry.authorize(store, identity.osProcessId());
            byte[] payload = serializer.serialize(message);
            for (int destination : destinations) {
                if (!registry.isMember(store, destination)) {
                    throw new ChannelException.DestinationNotMemberException(channelId, destination);
                }
                deliver(store, caller.processId(), destination, payload);
            }
        }
    }

    /**
     * Sends a message to every current member, the caller included.
     *
     * @param message The payload
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     */
    public void sendToAll(M message) {
        try (MessageStore store = connector.connect()) {
            Caller caller = registry.authorize(store, identity.osProcessId());
            byte[] payload = serializer.serialize(message);
            for (int destination : registry.members(store)) {
                deliver(store, caller.processId(), destination, payload);
            }
        }
    }

    /**
     * Queues the payload, then signals the receiver. A receiver woken by the signal
     * always finds the payload already in place.
     */
    private void deliver(MessageStore store, int sender, int destination, byte[] payload) {
        store.append(keys.pairKey(sender, destination), payload);
        store.append(keys.wakeupKey(destination), WAKEUP_MARKER);
        logger.debug("Channel {}: sent {} bytes from {} to {}", channelId, payload.length, sender, destination);
    }

    // ==================== Receiving ====================

    /**
     * Waits indefinitely for a message from one process.
     *
     * @param sender The sending process
     * @return The delivered message
     * @throws InterruptedException if interrupted while waiting
     */
    public Receipt<M> recvFrom(int sender) throws InterruptedException {
        return recvFrom(List.of(sender), true, Duration.ZERO);
    }

    /**
     * Receives a message from one process.
     *
     * @param sender The sending process
     * @param block Whether to wait when no message is queued
     * @param timeout Upper bound of each wait; {@link Duration#ZERO} waits indefinitely
     * @return The delivered message, {@link Receipt.Empty} or {@link Receipt.TimedOut}
     * @throws InterruptedException if interrupted while waiting
     */
    public Receipt<M> recvFrom(int sender, boolean block, Duration timeout) throws InterruptedException {
        return recvFrom(List.of(sender), block, timeout);
    }

    /**
     * Waits indefinitely for a message from any of several processes.
     *
     * @param senders The sending processes
     * @return The delivered message
     * @throws InterruptedException if interrupted while waiting
     */
    public Receipt<M> recvFrom(Collection<Integer> senders) throws InterruptedException {
        return recvFrom(senders, true, Duration.ZERO);
    }

    /**
     * Receives a message from any of several processes.
     *
     * @param senders The sending processes; each must be a member
     * @param block Whether to wait when no message is queued
     * @param timeout Upper bound of each wait; {@link Duration#ZERO} waits indefinitely
     * @return The delivered message, {@link Receipt.Empty} or {@link Receipt.TimedOut}
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     * @throws ChannelException.UnknownSenderException if a sender is not a member
     * @throws InterruptedException if interrupted while waiting
     */
    public Receipt<M> recvFrom(Collection<Integer> senders, boolean block, Duration timeout)
            throws InterruptedException {
        Objects.requireNonNull(senders, "senders cannot be null");
        if (senders.isEmpty()) {
            throw new IllegalArgumentException("At least one sender is required");
        }
        List<Integer> requested = List.copyOf(senders);
        return receive((store, receiver) -> {
            Set<Integer> members = registry.members(store);
            List<String> candidates = new ArrayList<>(requested.size() + 1);
            for (int sender : requested) {
                if (!members.contains(sender)) {
                    throw new ChannelException.UnknownSenderException(channelId, sender);
                }
                candidates.add(keys.pairKey(sender, receiver));
            }
            return candidates;
        }, block, timeout);
    }

    /**
     * Waits indefinitely for a message from any other member.
     *
     * @return The delivered message
     * @throws InterruptedException if interrupted while waiting
     */
    public Receipt<M> recvFromAny() throws InterruptedException {
        return recvFromAny(true, Duration.ZERO);
    }

    /**
     * Receives a message from any member other than the caller. Members that join while
     * the caller is waiting are picked up as soon as they send.
     *
     * @param block Whether to wait when no message is queued
     * @param timeout Upper bound of each wait; {@link Duration#ZERO} waits indefinitely
     * @return The delivered message, {@link Receipt.Empty} or {@link Receipt.TimedOut}
     * @throws ChannelException.UnknownProcessException if the caller has not joined
     * @throws InterruptedException if interrupted while waiting
     */
    public Receipt<M> recvFromAny(boolean block, Duration timeout) throws InterruptedException {
        return receive((store, receiver) -> {
            List<String> candidates = new ArrayList<>();
            for (int sender : registry.members(store)) {
                if (sender != receiver) {
                    candidates.add(keys.pairKey(sender, receiver));
                }
            }
            return candidates;
        }, block, timeout);
    }

    /**
     * Selective receive over a set of pair queues that is recomputed on every attempt.
     *
     * <p>The candidate queues are a snapshot of membership taken before blocking. A process
     * that joins and sends while the caller waits has no queue in that snapshot, so every
     * send also pushes onto the receiver's wakeup queue, which is always among the
     * candidates. Popping a wakeup marker means "recompute and wait again"; only a pop from
     * a pair queue ends the loop. Each wait gets the full timeout window.
     */
    private Receipt<M> receive(CandidateSelector selector, boolean block, Duration timeout)
            throws InterruptedException {
        Duration window = timeout == null ? Duration.ZERO : timeout;
        if (window.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + timeout);
        }
        try (MessageStore store = connector.connect()) {
            Caller caller = registry.authorize(store, identity.osProcessId());
            String wakeupKey = keys.wakeupKey(caller.processId());

            while (true) {
                List<String> candidates = selector.pairKeys(store, caller.processId());
                candidates.add(wakeupKey);
                logger.trace("Channel {}: process {} waiting on {}", channelId, caller.processId(), candidates);

                if (!block && store.countExisting(candidates) == 0) {
                    return Receipt.empty();
                }

                Optional<PoppedEntry> popped = store.blockingPop(candidates, window);
                if (popped.isEmpty()) {
                    return Receipt.timedOut();
                }

                PoppedEntry entry = popped.get();
                if (entry.key().equals(wakeupKey)) {
                    logger.trace("Channel {}: process {} woken up, recomputing senders", channelId, caller.processId());
                    continue;
                }

                int sender = keys.decodePairKey(entry.key()).senderId();
                M message = serializer.deserialize(entry.value());
                logger.debug("Channel {}: process {} received from {}", channelId, caller.processId(), sender);
                return new Receipt.Delivered<>(sender, message);
            }
        }
    }

    @Override
    public String toString() {
        return "Channel[" + channelId + " via " + connector + "]";
    }

    @Serial
    private Object readResolve() {
        return new Channel<>(channelId, connector, identity, serializer);
    }

    /**
     * Produces the pair queue keys a receive waits on, read fresh from the store.
     */
    @FunctionalInterface
    private interface CandidateSelector {
        List<String> pairKeys(MessageStore store, int receiver);
    }
}
