package org.abstractica.nexus;

/**
 * Server statistics for monitoring and observability.
 *
 * <p>Statistics are pollable snapshots. The application can query these
 * values and push to a monitoring system of choice.</p>
 */
public interface ServerStats
{
    /**
     * Returns the number of currently open connections.
     *
     * @return active connection count
     */
    int getActiveConnections();

    /**
     * Returns the number of participants in the registry.
     *
     * @return participant count
     */
    int getParticipantCount();

    /**
     * Returns the number of inbound frames received since start.
     *
     * @return received frame count
     */
    long getFramesReceived();

    /**
     * Returns the number of inbound frames dropped because they were malformed,
     * invalid or rate-limited.
     *
     * @return dropped frame count
     */
    long getFramesDropped();

    /**
     * Returns the number of participants removed by the heartbeat monitor.
     *
     * @return eviction count
     */
    long getEvictions();
}
