package com.rendezvous.store;

import java.io.Serializable;

/**
 * Opens connections to a {@link MessageStore}.
 *
 * <p>A connector is the only store-related state a channel keeps. It has to stay
 * serializable so that a channel handle can be passed to another process; live
 * connections are never part of it.
 */
@FunctionalInterface
public interface StoreConnector extends Serializable {

    /**
     * Opens a new connection. The caller closes it.
     *
     * @return A connected store
     */
    MessageStore connect();
}
