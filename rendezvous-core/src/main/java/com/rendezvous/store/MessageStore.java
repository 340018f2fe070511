package com.rendezvous.store;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A single connection to the shared key-value store that channels rendezvous through.
 * The store is the only state shared between processes; every primitive here is expected
 * to be atomic on its own.
 *
 * <p>Keys hold exactly one kind of value: a set of strings, a hash of string fields, or a
 * queue of byte arrays. A queue that is drained to zero elements no longer exists.
 */
public interface MessageStore extends AutoCloseable {

    /**
     * Adds a member to a set.
     *
     * @param key The set key
     * @param member The member to add
     * @return true if the member was not present before
     */
    boolean addToSet(String key, String member);

    /**
     * Checks whether a set contains a member.
     *
     * @param key The set key
     * @param member The member
     * @return true if the member is present
     */
    boolean isSetMember(String key, String member);

    /**
     * Lists the members of a set.
     *
     * @param key The set key
     * @return The members, empty if the set does not exist
     */
    Set<String> setMembers(String key);

    /**
     * Removes a member from a set.
     *
     * @param key The set key
     * @param member The member to remove
     * @return true if the member was present
     */
    boolean removeFromSet(String key, String member);

    /**
     * Sets a field of a hash.
     *
     * @param key The hash key
     * @param field The field
     * @param value The value
     */
    void putField(String key, String field, String value);

    /**
     * Reads a field of a hash.
     *
     * @param key The hash key
     * @param field The field
     * @return The value, or empty if the field is absent
     */
    Optional<String> getField(String key, String field);

    /**
     * Removes a field from a hash.
     *
     * @param key The hash key
     * @param field The field
     * @return true if the field was present
     */
    boolean removeField(String key, String field);

    /**
     * Reads every field of a hash.
     *
     * @param key The hash key
     * @return The fields and their values, empty if the hash does not exist
     */
    Map<String, String> fields(String key);

    /**
     * Appends a value to the tail of a queue, creating the queue if needed.
     *
     * @param key The queue key
     * @param value The value
     */
    void append(String key, byte[] value);

    /**
     * Pops the head of the first non-empty queue among {@code keys}, waiting until one of
     * them receives data or the timeout elapses. Keys are checked in the order given.
     * No two callers ever pop the same element.
     *
     * @param keys The queue keys to wait on
     * @param timeout How long to wait; {@link Duration#ZERO} waits indefinitely
     * @return The key that fired with the popped value, or empty on timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Optional<PoppedEntry> blockingPop(List<String> keys, Duration timeout) throws InterruptedException;

    /**
     * Counts how many of the given keys currently exist.
     *
     * @param keys The keys to check
     * @return The number of existing keys
     */
    long countExisting(Collection<String> keys);

    /**
     * Erases every key in the store. Intended for resets between tests.
     */
    void flushAll();

    /**
     * Closes this connection. Store failures while closing are not reported.
     */
    @Override
    void close();
}
