package org.abstractica.nexus.impl.transport;

/**
 * Receives the events of one connection.
 *
 * <p>The transport calls these methods for a given connection from one thread
 * at a time and in the order the events happened.</p>
 */
public interface ConnectionListener
{
    /**
     * A text frame arrived.
     *
     * @param text the frame text
     */
    void onText(String text);

    /**
     * The peer answered a liveness probe.
     */
    void onPong();

    /**
     * The connection closed, for whatever reason. May be reported more than once.
     */
    void onClosed();

    /**
     * The transport failed on this connection.
     *
     * @param cause the failure
     */
    void onError(Throwable cause);
}
