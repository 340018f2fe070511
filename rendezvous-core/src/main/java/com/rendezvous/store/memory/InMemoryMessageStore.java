package com.rendezvous.store.memory;

import com.rendezvous.store.MessageStore;
import com.rendezvous.store.PoppedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JVM-local {@link MessageStore} with the same semantics the channel protocol relies on
 * from Redis: one value kind per key, queues that vanish once drained, and a multi-key
 * blocking pop that checks keys in order and hands each element to exactly one waiter.
 *
 * <p>All state sits behind a single lock; every append signals waiting poppers, which
 * then rescan their keys.
 *
 * <p>Instances are shared by every connection a {@link InMemoryStoreConnector} hands out,
 * so {@link #close()} has no effect.
 */
public class InMemoryMessageStore implements MessageStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryMessageStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition dataAppended = lock.newCondition();

    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<String, Deque<byte[]>> queues = new HashMap<>();

    @Override
    public boolean addToSet(String key, String member) {
        Objects.requireNonNull(member, "member cannot be null");
        lock.lock();
        try {
            return sets.computeIfAbsent(key, k -> new HashSet<>()).add(member);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isSetMember(String key, String member) {
        lock.lock();
        try {
            Set<String> set = sets.get(key);
            return set != null && set.contains(member);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> setMembers(String key) {
        lock.lock();
        try {
            Set<String> set = sets.get(key);
            return set == null ? Set.of() : Set.copyOf(set);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeFromSet(String key, String member) {
        lock.lock();
        try {
            Set<String> set = sets.get(key);
            if (set == null || !set.remove(member)) {
                return false;
            }
            if (set.isEmpty()) {
                sets.remove(key);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void putField(String key, String field, String value) {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        lock.lock();
        try {
            hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(field, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> getField(String key, String field) {
        lock.lock();
        try {
            Map<String, String> hash = hashes.get(key);
            return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeField(String key, String field) {
        lock.lock();
        try {
            Map<String, String> hash = hashes.get(key);
            if (hash == null || hash.remove(field) == null) {
                return false;
            }
            if (hash.isEmpty()) {
                hashes.remove(key);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> fields(String key) {
        lock.lock();
        try {
            Map<String, String> hash = hashes.get(key);
            return hash == null ? Map.of() : Map.copyOf(hash);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void append(String key, byte[] value) {
        Objects.requireNonNull(value, "value cannot be null");
        lock.lock();
        try {
            queues.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(value.clone());
            dataAppended.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PoppedEntry> blockingPop(List<String> keys, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(keys, "keys cannot be null");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one key is required");
        }
        boolean forever = timeout == null || timeout.isZero();
        if (!forever && timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + timeout);
        }
        long remainingNanos = forever ? 0L : toNanosSaturated(timeout);

        lock.lockInterruptibly();
        try {
            while (true) {
                for (String key : keys) {
                    Deque<byte[]> queue = queues.get(key);
                    if (queue != null) {
                        byte[] value = queue.pollFirst();
                        if (queue.isEmpty()) {
                            queues.remove(key);
                        }
                        return Optional.of(new PoppedEntry(key, value));
                    }
                }
                if (forever) {
                    dataAppended.await();
                } else {
                    if (remainingNanos <= 0L) {
                        return Optional.empty();
                    }
                    remainingNanos = dataAppended.awaitNanos(remainingNanos);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long countExisting(Collection<String> keys) {
        lock.lock();
        try {
            return keys.stream().filter(this::exists).count();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flushAll() {
        lock.lock();
        try {
            sets.clear();
            hashes.clear();
            queues.clear();
        } finally {
            lock.unlock();
        }
        logger.info("In-memory store flushed");
    }

    /**
     * Returns the number of elements queued under a key.
     *
     * @param key The queue key
     * @return The queue length, 0 if the queue does not exist
     */
    public int queueLength(String key) {
        lock.lock();
        try {
            Deque<byte[]> queue = queues.get(key);
            return queue == null ? 0 : queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        // shared between connections
    }

    private boolean exists(String key) {
        return sets.containsKey(key) || hashes.containsKey(key) || queues.containsKey(key);
    }

    private static long toNanosSaturated(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
