package org.abstractica.nexus.impl.protocol;

import org.abstractica.nexus.Room;

import java.util.List;
import java.util.Set;

/**
 * Frames sent from server to client.
 *
 * <p>Record components are the payload fields on the wire.</p>
 */
public sealed interface ServerFrame permits
        ServerFrame.Welcome,
        ServerFrame.State,
        ServerFrame.Joined,
        ServerFrame.Moved,
        ServerFrame.Renamed,
        ServerFrame.Left,
        ServerFrame.Pong,
        ServerFrame.Proximity,
        ServerFrame.Chat,
        ServerFrame.ChatError
{
    /**
     * Returns the wire type of this frame.
     */
    String type();

    /**
     * Identity and room of a new connection.
     *
     * @param selfId the participant id assigned to the connection
     * @param room   the shared room
     */
    record Welcome(String selfId, Room room) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "welcome";
        }
    }

    /**
     * Full participant list.
     *
     * @param participants every live participant
     */
    record State(List<WireParticipant> participants) implements ServerFrame
    {
        public State
        {
            participants = List.copyOf(participants);
        }

        @Override
        public String type()
        {
            return "state";
        }
    }

    /**
     * A new participant connected.
     *
     * @param participant the new participant
     */
    record Joined(WireParticipant participant) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "joined";
        }
    }

    /**
     * A participant moved.
     *
     * @param id the participant
     * @param x  new x
     * @param y  new y
     */
    record Moved(String id, int x, int y) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "moved";
        }
    }

    /**
     * A participant changed its display name.
     *
     * @param id   the participant
     * @param name the stored (clamped) name
     */
    record Renamed(String id, String name) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "renamed";
        }
    }

    /**
     * A participant was removed.
     *
     * @param id the removed participant
     */
    record Left(String id) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "left";
        }
    }

    /**
     * Answer to a client ping.
     */
    record Pong() implements ServerFrame
    {
        @Override
        public String type()
        {
            return "pong";
        }
    }

    /**
     * Participants within the proximity radius of the mover.
     *
     * @param selfId the mover
     * @param nearby ids of nearby participants, never including the mover
     */
    record Proximity(String selfId, Set<String> nearby) implements ServerFrame
    {
        public Proximity
        {
            nearby = Set.copyOf(nearby);
        }

        @Override
        public String type()
        {
            return "proximity";
        }
    }

    /**
     * A chat message delivered to the sender and its neighbours.
     *
     * @param senderId   the sender
     * @param senderName the sender's name at send time
     * @param message    sanitized text
     * @param timestamp  server time the message was accepted
     */
    record Chat(String senderId, String senderName, String message, long timestamp) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "chat";
        }
    }

    /**
     * Chat could not be delivered to anyone.
     *
     * @param message human-readable explanation
     */
    record ChatError(String message) implements ServerFrame
    {
        @Override
        public String type()
        {
            return "chat_error";
        }
    }
}
