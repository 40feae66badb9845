package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.CloseReason;
import org.abstractica.nexus.Participant;
import org.abstractica.nexus.Room;
import org.abstractica.nexus.impl.protocol.ClientFrame;
import org.abstractica.nexus.impl.protocol.FrameCodec;
import org.abstractica.nexus.impl.protocol.FrameDecodingException;
import org.abstractica.nexus.impl.protocol.ServerFrame;
import org.abstractica.nexus.impl.protocol.TextSanitizer;
import org.abstractica.nexus.impl.protocol.WireParticipant;
import org.abstractica.nexus.impl.proximity.ProximityEngine;
import org.abstractica.nexus.impl.registry.SessionRegistry;
import org.abstractica.nexus.impl.transport.Connection;
import org.abstractica.nexus.impl.transport.ConnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Drives one connection through its lifecycle.
 *
 * <p>State machine: CONNECTING → ACTIVE → CLOSED. {@link #open()} registers
 * and announces the participant. Inbound frames are decoded and dispatched
 * while ACTIVE and discarded otherwise. {@link #close(CloseReason)} is
 * idempotent: whichever path closes first removes the participant and
 * announces its departure.</p>
 *
 * <p>Frame handling, open and close run under the room lock shared by every
 * handler of a server. A registry change and the broadcast announcing it are
 * therefore never interleaved with another handler's snapshot and its
 * delivery. Callbacks to the server run outside the lock.</p>
 */
public class ConnectionHandler implements ConnectionListener
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionHandler.class);

    private final String participantId;
    private final Connection connection;
    private final SessionRegistry registry;
    private final ProximityEngine proximity;
    private final BroadcastRouter router;
    private final Object roomLock;
    private final FrameCodec codec;
    private final SessionSettings settings;
    private final LongSupplier clock;
    private final HandlerCallback callback;
    private final DefaultServerStats stats;

    private final ConnectionState state;
    private final CommandDispatcher dispatcher = new CommandDispatcher();

    public ConnectionHandler(
            String participantId,
            Connection connection,
            SessionRegistry registry,
            ProximityEngine proximity,
            BroadcastRouter router,
            Object roomLock,
            FrameCodec codec,
            SessionSettings settings,
            LongSupplier clock,
            HandlerCallback callback,
            DefaultServerStats stats
    )
    {
        this.participantId = Objects.requireNonNull(participantId, "participantId");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.proximity = Objects.requireNonNull(proximity, "proximity");
        this.router = Objects.requireNonNull(router, "router");
        this.roomLock = Objects.requireNonNull(roomLock, "roomLock");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.state = new ConnectionState(new RateLimiter(settings.moveIntervalMs(), settings.chatIntervalMs()));
    }

    // ========== Lifecycle ==========

    /**
     * Registers the participant, greets the connection and announces the
     * newcomer to everyone else.
     *
     * @throws IllegalStateException if the handler was already opened
     */
    public void open()
    {
        Participant participant;
        synchronized (roomLock)
        {
            if (state.lifecycle() != HandlerState.CONNECTING)
            {
                throw new IllegalStateException("Handler already opened: " + state.lifecycle());
            }

            participant = registry.register(participantId, clock.getAsLong());
            router.register(participantId, connection);

            router.send(participantId, new ServerFrame.Welcome(participantId, registry.getRoom()));
            router.send(participantId, stateFrame());
            router.broadcast(new ServerFrame.Joined(WireParticipant.of(participant)), participantId);

            state.lifecycle(HandlerState.ACTIVE);
        }

        LOG.info("Participant {} connected from {}", participantId, connection.getRemoteAddress());
        callback.onParticipantJoined(this, participant);
    }

    /**
     * Closes the handler. Only the first call has any effect.
     *
     * @param reason why the connection is closing
     */
    public void close(CloseReason reason)
    {
        close(reason, Long.MAX_VALUE);
    }

    /**
     * Closes the handler as {@link CloseReason.Stale} if the participant has
     * still not been seen since the cutoff. Activity recorded after the TTL
     * scan keeps the connection open.
     *
     * @param cutoffMs the oldest acceptable last-seen time
     * @return true if this call closed the handler
     */
    public boolean closeIfStale(long cutoffMs)
    {
        return close(new CloseReason.Stale(), cutoffMs);
    }

    private boolean close(CloseReason reason, long cutoffMs)
    {
        Objects.requireNonNull(reason, "reason");

        Optional<Participant> removed;
        synchronized (roomLock)
        {
            if (state.lifecycle() == HandlerState.CLOSED)
            {
                return false;
            }
            Optional<Participant> current = registry.find(participantId);
            if (current.isPresent() && current.get().lastSeenMs() >= cutoffMs)
            {
                return false;
            }
            state.lifecycle(HandlerState.CLOSED);

            router.unregister(participantId);
            removed = registry.remove(participantId);
            if (removed.isPresent())
            {
                router.broadcast(new ServerFrame.Left(participantId), null);
            }
        }

        // Re-enters onClosed on some transports; the handler is already CLOSED by then.
        connection.close();

        LOG.info("Participant {} closed: {}", participantId, reason);
        callback.onHandlerClosed(this, removed, reason);
        return true;
    }

    /**
     * Runs one liveness probe.
     *
     * <p>If nothing was heard since the previous probe the handler closes
     * with {@link CloseReason.HeartbeatTimeout}. Otherwise the alive flag is
     * cleared and a ping is sent.</p>
     *
     * @return false if this probe closed the handler
     */
    public boolean probe()
    {
        synchronized (roomLock)
        {
            if (state.lifecycle() != HandlerState.ACTIVE)
            {
                return true;
            }
            if (state.isAlive())
            {
                state.clearAlive();
                connection.sendPing();
                return true;
            }
        }

        close(new CloseReason.HeartbeatTimeout());
        return false;
    }

    /**
     * Returns the participant id of this connection.
     */
    public String getParticipantId()
    {
        return participantId;
    }

    /**
     * Returns the current lifecycle state.
     */
    public HandlerState getState()
    {
        synchronized (roomLock)
        {
            return state.lifecycle();
        }
    }

    // ========== ConnectionListener Interface ==========

    @Override
    public void onText(String text)
    {
        ClientFrame frame;
        RuntimeException failure = null;

        synchronized (roomLock)
        {
            if (state.lifecycle() != HandlerState.ACTIVE)
            {
                return;
            }
            stats.recordFrameReceived();

            try
            {
                frame = codec.decode(text);
            }
            catch (FrameDecodingException e)
            {
                LOG.debug("Dropping malformed frame from {}: {}", participantId, e.getMessage());
                stats.recordFrameDropped();
                return;
            }

            long nowMs = clock.getAsLong();
            state.markAlive();
            registry.touch(participantId, nowMs);

            try
            {
                frame.accept(dispatcher);
            }
            catch (RuntimeException e)
            {
                failure = e;
            }
        }

        if (failure != null)
        {
            callback.onDispatchError(this, frame.type(), failure);
        }
    }

    @Override
    public void onPong()
    {
        synchronized (roomLock)
        {
            if (state.lifecycle() != HandlerState.ACTIVE)
            {
                return;
            }
            state.markAlive();
            registry.touch(participantId, clock.getAsLong());
        }
    }

    @Override
    public void onClosed()
    {
        close(new CloseReason.TransportClosed());
    }

    @Override
    public void onError(Throwable cause)
    {
        LOG.warn("Transport error on {}: {}", participantId, cause.getMessage());
        close(new CloseReason.TransportError(cause));
    }

    // ========== Helpers ==========

    private ServerFrame.State stateFrame()
    {
        List<WireParticipant> participants = new ArrayList<>();
        for (Participant participant : registry.snapshot())
        {
            participants.add(WireParticipant.of(participant));
        }
        return new ServerFrame.State(participants);
    }

    private static int roundInto(double value, int max)
    {
        long rounded = Math.round(value);
        return (int) Math.max(0, Math.min(max, rounded));
    }

    /**
     * Command semantics. Always invoked under the room lock.
     */
    private final class CommandDispatcher implements ClientFrame.Visitor
    {
        @Override
        public void onJoin(ClientFrame.Join join)
        {
            Optional<String> name = join.name()
                    .flatMap(raw -> TextSanitizer.displayName(raw, settings.maxNameLength()));
            if (name.isEmpty())
            {
                router.send(participantId, stateFrame());
                return;
            }

            Optional<Participant> renamed = registry.rename(participantId, name.get());
            if (renamed.isEmpty())
            {
                return;
            }
            router.send(participantId, stateFrame());
            router.broadcast(new ServerFrame.Renamed(participantId, renamed.get().name()), null);
        }

        @Override
        public void onMove(ClientFrame.Move move)
        {
            Optional<Participant> current = registry.find(participantId);
            if (current.isEmpty())
            {
                return;
            }

            if (!state.rateLimiter().tryAcquireMove(clock.getAsLong()))
            {
                LOG.trace("Move rate limit exceeded for participant {}", participantId);
                stats.recordFrameDropped();
                return;
            }

            Room room = registry.getRoom();
            int x = roundInto(move.x(), room.width());
            int y = roundInto(move.y(), room.height());
            if (x == current.get().x() && y == current.get().y())
            {
                return;
            }

            Optional<Participant> moved = registry.updatePosition(participantId, x, y);
            if (moved.isEmpty())
            {
                return;
            }
            router.broadcast(new ServerFrame.Moved(participantId, moved.get().x(), moved.get().y()), participantId);
            router.send(participantId, new ServerFrame.Proximity(participantId, proximity.nearbyOf(moved.get())));
        }

        @Override
        public void onRename(ClientFrame.Rename rename)
        {
            Optional<String> name = TextSanitizer.displayName(rename.name(), settings.maxNameLength());
            Optional<Participant> current = registry.find(participantId);
            if (name.isEmpty() || current.isEmpty() || name.get().equals(current.get().name()))
            {
                return;
            }

            registry.rename(participantId, name.get())
                    .ifPresent(p -> router.broadcast(new ServerFrame.Renamed(participantId, p.name()), participantId));
        }

        @Override
        public void onPing(ClientFrame.Ping ping)
        {
            router.send(participantId, new ServerFrame.Pong());
        }

        @Override
        public void onChat(ClientFrame.Chat chat)
        {
            Optional<String> message = TextSanitizer.chatMessage(chat.message(), settings.maxMessageLength());
            if (message.isEmpty())
            {
                LOG.debug("Empty or invalid message from participant {}", participantId);
                stats.recordFrameDropped();
                return;
            }

            long nowMs = clock.getAsLong();
            if (!state.rateLimiter().tryAcquireChat(nowMs))
            {
                LOG.debug("Chat rate limit exceeded for participant {}", participantId);
                stats.recordFrameDropped();
                return;
            }

            Optional<Participant> sender = registry.find(participantId);
            if (sender.isEmpty())
            {
                return;
            }

            Set<String> nearby = proximity.nearbyOf(sender.get());
            if (nearby.isEmpty())
            {
                router.send(participantId, new ServerFrame.ChatError(SessionSettings.NO_ONE_NEARBY));
                return;
            }

            Set<String> recipients = new LinkedHashSet<>();
            recipients.add(participantId);
            recipients.addAll(nearby);

            LOG.debug("Chat from {} to {} nearby participants", sender.get().name(), nearby.size());
            router.broadcastTo(recipients,
                    new ServerFrame.Chat(participantId, sender.get().name(), message.get(), nowMs));
        }

        @Override
        public void onUnknown(ClientFrame.Unknown unknown)
        {
            LOG.debug("Ignoring frame of unknown type '{}' from {}", unknown.type(), participantId);
        }

        @Override
        public void onInvalid(ClientFrame.Invalid invalid)
        {
            LOG.debug("Dropping invalid {} frame from {}: {}", invalid.type(), participantId, invalid.reason());
            stats.recordFrameDropped();
        }
    }
}
