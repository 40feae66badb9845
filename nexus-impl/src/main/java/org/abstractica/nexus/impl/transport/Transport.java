package org.abstractica.nexus.impl.transport;

import java.net.SocketAddress;

/**
 * Accepts connections and delivers their events.
 *
 * <p>The transport knows nothing about frame contents; it moves text frames
 * and liveness probes between the server and its peers.</p>
 */
public interface Transport extends AutoCloseable
{
    /**
     * Sets the callback for newly opened connections.
     *
     * <p>Must be called before {@link #start()}.</p>
     *
     * @param acceptor the acceptor
     */
    void setAcceptor(ConnectionAcceptor acceptor);

    /**
     * Starts accepting connections.
     */
    void start();

    /**
     * Stops accepting connections and releases resources.
     */
    @Override
    void close();

    /**
     * Returns the local address this transport is bound to.
     *
     * @return the local socket address, or null if not bound
     */
    SocketAddress getLocalAddress();
}
