package org.abstractica.nexus.handlers;

/**
 * Handles exceptions thrown while dispatching an inbound frame.
 *
 * <p>When a command fails unexpectedly, the server catches the exception,
 * invokes this handler and keeps the connection open; one faulty frame
 * should not affect the participant's session or anyone else's.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a command.
     *
     * @param participantId the participant whose frame failed
     * @param frameType     the wire type of the failing frame
     * @param exception     the exception thrown
     */
    void handle(String participantId, String frameType, Exception exception);
}
