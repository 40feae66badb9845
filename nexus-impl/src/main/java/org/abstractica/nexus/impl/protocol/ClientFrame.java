package org.abstractica.nexus.impl.protocol;

import java.util.Objects;
import java.util.Optional;

/**
 * Frames sent from client to server, decoded and validated at the boundary.
 *
 * <p>Dispatch goes through {@link Visitor}, so every variant must be handled
 * by every dispatcher.</p>
 */
public sealed interface ClientFrame permits
        ClientFrame.Join,
        ClientFrame.Move,
        ClientFrame.Rename,
        ClientFrame.Ping,
        ClientFrame.Chat,
        ClientFrame.Unknown,
        ClientFrame.Invalid
{
    /**
     * Returns the wire type of this frame.
     */
    String type();

    /**
     * Passes this frame to the matching visitor method.
     *
     * @param visitor the dispatcher
     */
    void accept(Visitor visitor);

    /**
     * One method per frame variant.
     */
    interface Visitor
    {
        void onJoin(Join join);

        void onMove(Move move);

        void onRename(Rename rename);

        void onPing(Ping ping);

        void onChat(Chat chat);

        void onUnknown(Unknown unknown);

        void onInvalid(Invalid invalid);
    }

    /**
     * Set or confirm the display name and request the full state.
     *
     * @param name trimmed name, empty if absent or blank
     */
    record Join(Optional<String> name) implements ClientFrame
    {
        public Join
        {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String type()
        {
            return "join";
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onJoin(this);
        }
    }

    /**
     * Proposed new position. Both coordinates are finite.
     *
     * @param x proposed x
     * @param y proposed y
     */
    record Move(double x, double y) implements ClientFrame
    {
        public Move
        {
            if (!Double.isFinite(x) || !Double.isFinite(y))
            {
                throw new IllegalArgumentException("Coordinates must be finite: " + x + ", " + y);
            }
        }

        @Override
        public String type()
        {
            return "move";
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onMove(this);
        }
    }

    /**
     * Change the display name.
     *
     * @param name trimmed, non-empty name
     */
    record Rename(String name) implements ClientFrame
    {
        public Rename
        {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String type()
        {
            return "rename";
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onRename(this);
        }
    }

    /**
     * Application-level liveness probe.
     */
    record Ping() implements ClientFrame
    {
        @Override
        public String type()
        {
            return "ping";
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onPing(this);
        }
    }

    /**
     * Proximity-scoped chat message, not yet sanitized.
     *
     * @param message raw message text
     */
    record Chat(String message) implements ClientFrame
    {
        public Chat
        {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String type()
        {
            return "chat";
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onChat(this);
        }
    }

    /**
     * Well-formed frame of a type this server does not know.
     *
     * @param type the unrecognized type
     */
    record Unknown(String type) implements ClientFrame
    {
        public Unknown
        {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onUnknown(this);
        }
    }

    /**
     * Known frame type whose payload failed validation.
     *
     * @param type   the frame type
     * @param reason what was wrong with the payload
     */
    record Invalid(String type, String reason) implements ClientFrame
    {
        public Invalid
        {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public void accept(Visitor visitor)
        {
            visitor.onInvalid(this);
        }
    }
}
