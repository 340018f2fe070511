package com.rendezvous.redis;

import com.rendezvous.store.MessageStore;
import com.rendezvous.store.PoppedEntry;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisFuture;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * {@link MessageStore} over one Lettuce connection.
 *
 * <p>Keys are strings and values raw bytes; set members and hash values are stored as
 * UTF-8. Every command runs synchronously except {@code BLPOP}, which is issued on the
 * async API and awaited here: a wait without timeout must not be cut short by the
 * connection's command timeout.
 *
 * <p>Redis errors ({@link RedisException} and its subclasses) propagate to the caller.
 */
public class RedisMessageStore implements MessageStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisMessageStore.class);

    private final StatefulRedisConnection<String, byte[]> connection;
    private final RedisCommands<String, byte[]> commands;

    public RedisMessageStore(StatefulRedisConnection<String, byte[]> connection) {
        this.connection = Objects.requireNonNull(connection, "connection cannot be null");
        this.commands = connection.sync();
    }

    @Override
    public boolean addToSet(String key, String member) {
        return commands.sadd(key, encode(member)) > 0;
    }

    @Override
    public boolean isSetMember(String key, String member) {
        return Boolean.TRUE.equals(commands.sismember(key, encode(member)));
    }

    @Override
    public Set<String> setMembers(String key) {
        Set<byte[]> members = commands.smembers(key);
        Set<String> decoded = new LinkedHashSet<>();
        if (members != null) {
            for (byte[] member : members) {
                decoded.add(decode(member));
            }
        }
        return decoded;
    }

    @Override
    public boolean removeFromSet(String key, String member) {
        return commands.srem(key, encode(member)) > 0;
    }

    @Override
    public void putField(String key, String field, String value) {
        commands.hset(key, field, encode(value));
    }

    @Override
    public Optional<String> getField(String key, String field) {
        return Optional.ofNullable(commands.hget(key, field)).map(RedisMessageStore::decode);
    }

    @Override
    public boolean removeField(String key, String field) {
        return commands.hdel(key, field) > 0;
    }

    @Override
    public Map<String, String> fields(String key) {
        Map<String, byte[]> raw = commands.hgetall(key);
        Map<String, String> decoded = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((field, value) -> decoded.put(field, decode(value)));
        }
        return decoded;
    }

    @Override
    public void append(String key, byte[] value) {
        commands.rpush(key, value);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Runs BLPOP through the async API, so the wait is bounded only by {@code timeout}.
     * If the calling thread is interrupted, the pending command is cancelled locally. The
     * server may already have popped an entry for it, and that entry is then lost.
     */
    @Override
    public Optional<PoppedEntry> blockingPop(List<String> keys, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(keys, "keys cannot be null");
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one key is required");
        }
        double seconds = toSeconds(timeout);
        RedisFuture<KeyValue<String, byte[]>> future =
                connection.async().blpop(seconds, keys.toArray(new String[0]));

        KeyValue<String, byte[]> result;
        try {
            result = future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RedisException(cause);
        }

        if (result == null || !result.hasValue()) {
            logger.trace("BLPOP on {} timed out after {}s", keys, seconds);
            return Optional.empty();
        }
        return Optional.of(new PoppedEntry(result.getKey(), result.getValue()));
    }

    @Override
    public long countExisting(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        Long count = commands.exists(keys.toArray(new String[0]));
        return count == null ? 0L : count;
    }

    @Override
    public void flushAll() {
        commands.flushall();
        logger.info("Flushed Redis database");
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing Redis connection", e);
        }
    }

    /**
     * Converts a wait to BLPOP's fractional seconds, where 0 means no timeout. A positive
     * wait below Redis' millisecond resolution is rounded up so it stays finite.
     */
    static double toSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero()) {
            return 0.0;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative: " + timeout);
        }
        return Math.max(1L, timeout.toMillis()) / 1000.0;
    }

    private static byte[] encode(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String decode(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
