package org.abstractica.nexus.impl.transport;

/**
 * One persistent, bidirectional, message-oriented connection.
 *
 * <p>All methods are thread-safe and may be called from any thread. Sends are
 * fire-and-forget; a send on a closed connection is silently discarded.</p>
 */
public interface Connection
{
    /**
     * Queues a text frame for delivery.
     *
     * @param text the frame text
     */
    void sendText(String text);

    /**
     * Sends a transport-level liveness probe.
     *
     * <p>The peer's answer is reported through {@link ConnectionListener#onPong()}.</p>
     */
    void sendPing();

    /**
     * Closes the connection immediately.
     *
     * <p>The transport reports the close through
     * {@link ConnectionListener#onClosed()}. Idempotent.</p>
     */
    void close();

    /**
     * Returns whether the connection is still open.
     */
    boolean isOpen();

    /**
     * Returns a printable description of the remote peer.
     */
    String getRemoteAddress();
}
