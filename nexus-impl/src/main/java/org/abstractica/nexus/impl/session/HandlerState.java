package org.abstractica.nexus.impl.session;

/**
 * Lifecycle state of a {@link ConnectionHandler}.
 */
public enum HandlerState
{
    /**
     * Connection accepted, participant not yet announced.
     */
    CONNECTING,

    /**
     * Participant registered and announced; frames are dispatched.
     */
    ACTIVE,

    /**
     * Terminal. The participant was removed and inbound frames are discarded.
     */
    CLOSED
}
