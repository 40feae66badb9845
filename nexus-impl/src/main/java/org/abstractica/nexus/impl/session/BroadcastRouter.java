package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.impl.protocol.FrameCodec;
import org.abstractica.nexus.impl.protocol.ServerFrame;
import org.abstractica.nexus.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Delivers outbound frames to open connections.
 *
 * <p>Delivery is fire-and-forget: a frame is encoded once, handed to each
 * target connection, and a failure on one target is logged without
 * affecting the others.</p>
 *
 * <p>Thread-safe.</p>
 */
public class BroadcastRouter
{
    private static final Logger LOG = LoggerFactory.getLogger(BroadcastRouter.class);

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final FrameCodec codec;
    private final LongSupplier clock;

    public BroadcastRouter(FrameCodec codec, LongSupplier clock)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Makes a connection reachable under a participant id.
     */
    public void register(String participantId, Connection connection)
    {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(connection, "connection");
        connections.put(participantId, connection);
    }

    /**
     * Stops routing to a participant. Idempotent.
     */
    public void unregister(String participantId)
    {
        Objects.requireNonNull(participantId, "participantId");
        connections.remove(participantId);
    }

    /**
     * Sends a frame to one participant.
     *
     * @return true if the participant had a routable connection
     */
    public boolean send(String participantId, ServerFrame frame)
    {
        Connection connection = connections.get(participantId);
        if (connection == null)
        {
            return false;
        }
        deliver(participantId, connection, codec.encode(frame, clock.getAsLong()));
        return true;
    }

    /**
     * Sends a frame to every open connection except an optional one.
     *
     * @param frame     the frame
     * @param excludeId participant to skip, or null to reach everyone
     * @return number of connections the frame was handed to
     */
    public int broadcast(ServerFrame frame, String excludeId)
    {
        String text = codec.encode(frame, clock.getAsLong());
        int delivered = 0;
        for (Map.Entry<String, Connection> entry : connections.entrySet())
        {
            if (entry.getKey().equals(excludeId))
            {
                continue;
            }
            if (deliver(entry.getKey(), entry.getValue(), text))
            {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Sends a frame only to the given participants.
     *
     * @param participantIds the audience
     * @param frame          the frame
     * @return number of connections the frame was handed to
     */
    public int broadcastTo(Collection<String> participantIds, ServerFrame frame)
    {
        String text = codec.encode(frame, clock.getAsLong());
        int delivered = 0;
        for (String participantId : participantIds)
        {
            Connection connection = connections.get(participantId);
            if (connection != null && deliver(participantId, connection, text))
            {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Returns the number of routable connections.
     */
    public int size()
    {
        return connections.size();
    }

    private static boolean deliver(String participantId, Connection connection, String text)
    {
        if (!connection.isOpen())
        {
            return false;
        }
        try
        {
            connection.sendText(text);
            return true;
        }
        catch (RuntimeException e)
        {
            LOG.warn("Failed to deliver frame to {}: {}", participantId, e.getMessage());
            return false;
        }
    }
}
