package org.abstractica.nexus;

import org.abstractica.nexus.handlers.ErrorHandler;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A server that keeps a shared view of participants moving inside one room.
 *
 * <p>Every accepted connection becomes a participant. The server validates and
 * rate-limits inbound frames, updates the shared registry, and routes state
 * changes to everyone and chat only to participants within the proximity
 * radius of the sender.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * NexusServer server = new DefaultNexusServerFactory().builder()
 *     .port(5000)
 *     .room(new Room(1600, 900))
 *     .proximityRadius(200)
 *     .build();
 *
 * server.onParticipantJoined(p -> LOG.info("{} joined", p.name()));
 * server.onParticipantLeft((p, reason) -> LOG.info("{} left: {}", p.name(), reason));
 *
 * server.start();
 * }</pre>
 */
public interface NexusServer extends AutoCloseable
{
    /**
     * Starts the server.
     *
     * <p>Binds the transport and schedules the heartbeat monitor. This method
     * returns immediately; the server runs on background threads.</p>
     */
    void start();

    /**
     * Stops accepting new connections.
     *
     * <p>Existing connections stay open and keep being served.</p>
     */
    void stop();

    /**
     * Closes every connection, cancels the heartbeat monitor and releases the
     * transport.
     */
    @Override
    void close();

    /**
     * Returns the room all participants share.
     *
     * @return the room
     */
    Room getRoom();

    /**
     * Returns a snapshot of the live participants in registration order.
     *
     * @return unmodifiable participant list
     */
    List<Participant> getParticipants();

    /**
     * Closes the connection of a participant.
     *
     * @param participantId the participant to disconnect
     * @param reason        message recorded with the close
     * @return true if a live connection was closed
     */
    boolean kick(String participantId, String reason);

    /**
     * Registers a callback for newly connected participants.
     *
     * <p>Called after the welcome and state frames were sent and the join was
     * announced.</p>
     *
     * @param handler called with the provisional participant
     */
    void onParticipantJoined(Consumer<Participant> handler);

    /**
     * Registers a callback for removed participants.
     *
     * <p>Called exactly once per participant, after the removal was
     * broadcast.</p>
     *
     * @param handler called with the last known participant state and the reason
     */
    void onParticipantLeft(BiConsumer<Participant, CloseReason> handler);

    /**
     * Registers an error handler for exceptions thrown while dispatching a frame.
     *
     * @param handler called when a command fails unexpectedly
     */
    void onError(ErrorHandler handler);

    /**
     * Returns server statistics.
     *
     * @return live statistics view
     */
    ServerStats getStats();
}
