package com.rendezvous.redis;

import java.io.Serial;
import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for a Redis-backed channel store.
 *
 * <p>Defaults point at a local server ({@code localhost:6379}, database 0). Settings can be
 * built programmatically or read from system properties prefixed with
 * {@value #PROPERTY_PREFIX}:
 * <ul>
 *   <li>{@code rendezvous.redis.host}</li>
 *   <li>{@code rendezvous.redis.port}</li>
 *   <li>{@code rendezvous.redis.database}</li>
 *   <li>{@code rendezvous.redis.password}</li>
 *   <li>{@code rendezvous.redis.ssl}</li>
 *   <li>{@code rendezvous.redis.connectTimeoutMillis}</li>
 * </ul>
 */
public final class RedisStoreConfig implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final String PROPERTY_PREFIX = "rendezvous.redis.";

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_DATABASE = 0;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final String host;
    private final int port;
    private final int database;
    private final String password;
    private final boolean ssl;
    private final Duration connectTimeout;

    private RedisStoreConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.password = builder.password;
        this.ssl = builder.ssl;
        this.connectTimeout = builder.connectTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return A configuration with every default
     */
    public static RedisStoreConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from {@link System#getProperties()}.
     *
     * @return The configuration, defaults filling in absent properties
     */
    public static RedisStoreConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from a property set.
     *
     * @param properties The properties
     * @return The configuration, defaults filling in absent properties
     * @throws IllegalArgumentException if a numeric property does not parse
     */
    public static RedisStoreConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String host = properties.getProperty(PROPERTY_PREFIX + "host");
        if (host != null) {
            builder.host(host);
        }
        String port = properties.getProperty(PROPERTY_PREFIX + "port");
        if (port != null) {
            builder.port(parseInt("port", port));
        }
        String database = properties.getProperty(PROPERTY_PREFIX + "database");
        if (database != null) {
            builder.database(parseInt("database", database));
        }
        builder.password(properties.getProperty(PROPERTY_PREFIX + "password"));
        String ssl = properties.getProperty(PROPERTY_PREFIX + "ssl");
        if (ssl != null) {
            builder.ssl(Boolean.parseBoolean(ssl.trim()));
        }
        String timeout = properties.getProperty(PROPERTY_PREFIX + "connectTimeoutMillis");
        if (timeout != null) {
            builder.connectTimeout(Duration.ofMillis(parseInt("connectTimeoutMillis", timeout)));
        }
        return builder.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getDatabase() {
        return database;
    }

    /**
     * @return The password, or null when the server needs none
     */
    public String getPassword() {
        return password;
    }

    public boolean isSsl() {
        return ssl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RedisStoreConfig)) {
            return false;
        }
        RedisStoreConfig that = (RedisStoreConfig) o;
        return port == that.port
                && database == that.database
                && ssl == that.ssl
                && host.equals(that.host)
                && Objects.equals(password, that.password)
                && connectTimeout.equals(that.connectTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, database, password, ssl, connectTimeout);
    }

    @Override
    public String toString() {
        return "RedisStoreConfig{host=" + host + ", port=" + port + ", database=" + database
                + ", ssl=" + ssl + ", password=" + (password == null ? "none" : "****") + "}";
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int database = DEFAULT_DATABASE;
        private String password;
        private boolean ssl;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host cannot be null");
            return this;
        }

        public Builder port(int port) {
            if (port < 1 || port > 65_535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder database(int database) {
            if (database < 0) {
                throw new IllegalArgumentException("Database index cannot be negative: " + database);
            }
            this.database = database;
            return this;
        }

        public Builder password(String password) {
            this.password = password == null || password.isBlank() ? null : password;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
            if (connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new IllegalArgumentException("Connect timeout must be positive: " + connectTimeout);
            }
            this.connectTimeout = connectTimeout;
            return this;
        }

        public RedisStoreConfig build() {
            return new RedisStoreConfig(this);
        }
    }
}
