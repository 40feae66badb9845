package org.abstractica.nexus.impl.transport;

/**
 * Called by a transport for every newly opened connection.
 */
@FunctionalInterface
public interface ConnectionAcceptor
{
    /**
     * Accepts a new connection.
     *
     * @param connection the opened connection
     * @return the listener for the connection's events, or null to refuse it
     */
    ConnectionListener accept(Connection connection);
}
