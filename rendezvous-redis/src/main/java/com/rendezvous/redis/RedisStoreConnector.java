package com.rendezvous.redis;

import com.rendezvous.store.MessageStore;
import com.rendezvous.store.StoreConnector;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.util.Objects;

/**
 * Opens {@link RedisMessageStore} connections.
 *
 * <p>Only the {@link RedisStoreConfig} is serialized. The {@link RedisClient} is created on
 * first use in each process and shared by every connection that process opens; each
 * {@link #connect()} returns a fresh connection that the caller closes.
 */
public final class RedisStoreConnector implements StoreConnector {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(RedisStoreConnector.class);

    static final RedisCodec<String, byte[]> CODEC = RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);

    private final RedisStoreConfig config;
    private transient volatile RedisClient client;

    public RedisStoreConnector(RedisStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Connector configured from system properties.
     *
     * @return A connector
     * @see RedisStoreConfig#fromSystemProperties()
     */
    public static RedisStoreConnector fromSystemProperties() {
        return new RedisStoreConnector(RedisStoreConfig.fromSystemProperties());
    }

    public RedisStoreConfig getConfig() {
        return config;
    }

    @Override
    public MessageStore connect() {
        return new RedisMessageStore(client().connect(CODEC));
    }

    /**
     * Shuts the shared client down. A later {@link #connect()} creates a new one.
     */
    public void shutdown() {
        RedisClient current;
        synchronized (this) {
            current = client;
            client = null;
        }
        if (current != null) {
            logger.info("Shutting down Redis client for {}:{}", config.getHost(), config.getPort());
            current.shutdown();
        }
    }

    private RedisClient client() {
        RedisClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    logger.info("Connecting to Redis at {}:{} (database {})",
                            config.getHost(), config.getPort(), config.getDatabase());
                    current = RedisClient.create(buildRedisUri(config));
                    current.setOptions(buildClientOptions(config));
                    client = current;
                }
            }
        }
        return current;
    }

    static RedisURI buildRedisUri(RedisStoreConfig config) {
        RedisURI.Builder uriBuilder = RedisURI.builder()
                .withHost(config.getHost())
                .withPort(config.getPort())
                .withDatabase(config.getDatabase());

        if (config.getPassword() != null) {
            uriBuilder.withPassword(config.getPassword().toCharArray());
        }

        if (config.isSsl()) {
            uriBuilder.withSsl(true);
        }

        return uriBuilder.build();
    }

    /**
     * The connect timeout bounds establishing the TCP connection. Command timeouts keep
     * Lettuce's default; blocking pops do not use them.
     */
    static ClientOptions buildClientOptions(RedisStoreConfig config) {
        return ClientOptions.builder()
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(config.getConnectTimeout())
                        .build())
                .build();
    }

    @Override
    public String toString() {
        return "RedisStoreConnector[" + config.getHost() + ":" + config.getPort() + "/" + config.getDatabase() + "]";
    }
}
