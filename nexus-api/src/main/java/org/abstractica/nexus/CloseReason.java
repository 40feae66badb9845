package org.abstractica.nexus;

/**
 * Reason a participant's connection was closed.
 *
 * <p>Sealed interface enabling exhaustive handling of close causes.</p>
 */
public sealed interface CloseReason
{
    /**
     * The peer closed the connection.
     */
    record TransportClosed() implements CloseReason {}

    /**
     * The transport reported an error.
     *
     * @param cause the underlying failure
     */
    record TransportError(Throwable cause) implements CloseReason {}

    /**
     * The connection did not answer two consecutive liveness probes.
     */
    record HeartbeatTimeout() implements CloseReason {}

    /**
     * The participant was silent for longer than the liveness TTL.
     */
    record Stale() implements CloseReason {}

    /**
     * The server explicitly disconnected the participant.
     *
     * @param message reason provided by the server
     */
    record Kicked(String message) implements CloseReason {}

    /**
     * The server is shutting down.
     */
    record ServerShutdown() implements CloseReason {}
}
