package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.CloseReason;
import org.abstractica.nexus.Participant;

import java.util.Optional;

/**
 * Callback interface from connection handler to server.
 *
 * <p>Used by ConnectionHandler to report lifecycle events and failures.
 * Every method is called outside the handler's lock.</p>
 */
public interface HandlerCallback
{
    /**
     * Notifies that a participant was registered and announced.
     *
     * @param handler     the handler owning the participant
     * @param participant the new participant
     */
    void onParticipantJoined(ConnectionHandler handler, Participant participant);

    /**
     * Notifies that a handler reached its terminal state.
     *
     * @param handler the closed handler
     * @param removed the participant this close removed, empty if another path removed it first
     * @param reason  why the handler closed
     */
    void onHandlerClosed(ConnectionHandler handler, Optional<Participant> removed, CloseReason reason);

    /**
     * Reports an exception thrown while processing an inbound frame.
     *
     * @param handler   the handler that processed the frame
     * @param frameType the frame's wire type
     * @param exception the failure
     */
    void onDispatchError(ConnectionHandler handler, String frameType, Exception exception);
}
