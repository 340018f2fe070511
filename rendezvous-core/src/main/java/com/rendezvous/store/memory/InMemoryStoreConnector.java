package com.rendezvous.store.memory;

import com.rendezvous.store.MessageStore;
import com.rendezvous.store.StoreConnector;

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connector to a named {@link InMemoryMessageStore}.
 *
 * <p>Stores are registered per JVM under their name. A connector only serializes that
 * name, so a deserialized connector (and any channel holding it) reattaches to the same
 * store as long as it is read back in the same JVM.
 */
public final class InMemoryStoreConnector implements StoreConnector {

    private static final Map<String, InMemoryMessageStore> STORES = new ConcurrentHashMap<>();

    private final String name;
    private final transient InMemoryMessageStore store;

    private InMemoryStoreConnector(String name) {
        this.name = name;
        this.store = STORES.computeIfAbsent(name, n -> new InMemoryMessageStore());
    }

    /**
     * Creates a connector to a fresh store with a generated name.
     *
     * @return A new connector
     */
    public static InMemoryStoreConnector create() {
        return new InMemoryStoreConnector("store-" + UUID.randomUUID());
    }

    /**
     * Returns a connector to the store registered under {@code name}, creating the store
     * on first use.
     *
     * @param name The store name
     * @return A connector to that store
     */
    public static InMemoryStoreConnector named(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return new InMemoryStoreConnector(name);
    }

    @Override
    public MessageStore connect() {
        return store;
    }

    /**
     * Gives direct access to the store, e.g. for inspecting queue lengths in tests.
     *
     * @return The backing store
     */
    public InMemoryMessageStore store() {
        return store;
    }

    public String name() {
        return name;
    }

    /**
     * Unregisters the store. Connectors created afterwards under the same name get a new,
     * empty store.
     */
    public void release() {
        STORES.remove(name, store);
    }

    @Override
    public String toString() {
        return "InMemoryStoreConnector[" + name + "]";
    }

    @Serial
    private Object writeReplace() {
        return new SerializationProxy(name);
    }

    @Serial
    private void readObject(ObjectInputStream stream) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    private static class SerializationProxy implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final String name;

        SerializationProxy(String name) {
            this.name = name;
        }

        @Serial
        private Object readResolve() {
            return new InMemoryStoreConnector(name);
        }
    }
}
