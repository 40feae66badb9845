package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.CloseReason;
import org.abstractica.nexus.NexusServer;
import org.abstractica.nexus.Participant;
import org.abstractica.nexus.Room;
import org.abstractica.nexus.ServerStats;
import org.abstractica.nexus.handlers.ErrorHandler;
import org.abstractica.nexus.impl.protocol.FrameCodec;
import org.abstractica.nexus.impl.protocol.ServerFrame;
import org.abstractica.nexus.impl.proximity.ProximityEngine;
import org.abstractica.nexus.impl.registry.SessionRegistry;
import org.abstractica.nexus.impl.transport.Connection;
import org.abstractica.nexus.impl.transport.ConnectionListener;
import org.abstractica.nexus.impl.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Default implementation of the NexusServer interface.
 *
 * <p>Accepts connections from the transport, creates one
 * {@link ConnectionHandler} per connection and runs the heartbeat monitor.
 * All handlers share one room lock, which orders every registry change and
 * its broadcast against the snapshot a newcomer receives.</p>
 */
public class DefaultNexusServer implements NexusServer, HandlerCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultNexusServer.class);

    private final Transport transport;
    private final SessionRegistry registry;
    private final ProximityEngine proximity;
    private final BroadcastRouter router;
    private final FrameCodec codec;
    private final SessionSettings settings;
    private final LongSupplier clock;
    private final HeartbeatMonitor heartbeatMonitor;
    private final Object roomLock = new Object();

    private final Map<String, ConnectionHandler> handlers = new ConcurrentHashMap<>();
    private final List<Consumer<Participant>> joinedCallbacks = new CopyOnWriteArrayList<>();
    private final List<BiConsumer<Participant, CloseReason>> leftCallbacks = new CopyOnWriteArrayList<>();
    private volatile ErrorHandler errorHandler;

    private final DefaultServerStats stats;

    private volatile boolean running;
    private volatile boolean acceptingConnections;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultNexusServerFactory} to create instances.</p>
     */
    DefaultNexusServer(
            Transport transport,
            SessionRegistry registry,
            ProximityEngine proximity,
            FrameCodec codec,
            SessionSettings settings,
            Duration heartbeatInterval,
            Duration connectionTtl,
            LongSupplier clock
    )
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.proximity = Objects.requireNonNull(proximity, "proximity");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.router = new BroadcastRouter(codec, clock);
        this.stats = new DefaultServerStats(registry, router);
        this.heartbeatMonitor = new HeartbeatMonitor(
                heartbeatInterval,
                connectionTtl,
                handlers::values,
                registry,
                this::evictStale,
                clock,
                stats
        );

        this.running = false;
        this.acceptingConnections = false;
    }

    // ========== NexusServer Interface ==========

    @Override
    public void start()
    {
        if (running)
        {
            throw new IllegalStateException("Server already started");
        }

        LOG.info("Starting server");

        transport.setAcceptor(this::accept);
        transport.start();

        running = true;
        acceptingConnections = true;

        heartbeatMonitor.start();

        LOG.info("Server listening on {}", transport.getLocalAddress());
    }

    @Override
    public void stop()
    {
        LOG.info("Stopping server (no new connections)");
        acceptingConnections = false;
    }

    @Override
    public void close()
    {
        if (!running)
        {
            return;
        }

        LOG.info("Closing server");

        running = false;
        acceptingConnections = false;

        heartbeatMonitor.close();

        for (ConnectionHandler handler : List.copyOf(handlers.values()))
        {
            handler.close(new CloseReason.ServerShutdown());
        }

        transport.close();

        LOG.info("Server closed");
    }

    @Override
    public Room getRoom()
    {
        return registry.getRoom();
    }

    @Override
    public List<Participant> getParticipants()
    {
        return registry.snapshot();
    }

    @Override
    public boolean kick(String participantId, String reason)
    {
        Objects.requireNonNull(participantId, "participantId");
        ConnectionHandler handler = handlers.get(participantId);
        if (handler == null)
        {
            return false;
        }
        handler.close(new CloseReason.Kicked(reason == null ? "" : reason));
        return true;
    }

    @Override
    public void onParticipantJoined(Consumer<Participant> handler)
    {
        Objects.requireNonNull(handler, "handler");
        joinedCallbacks.add(handler);
    }

    @Override
    public void onParticipantLeft(BiConsumer<Participant, CloseReason> handler)
    {
        Objects.requireNonNull(handler, "handler");
        leftCallbacks.add(handler);
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = handler;
    }

    @Override
    public ServerStats getStats()
    {
        return stats;
    }

    // ========== HandlerCallback Interface ==========

    @Override
    public void onParticipantJoined(ConnectionHandler handler, Participant participant)
    {
        for (Consumer<Participant> callback : joinedCallbacks)
        {
            try
            {
                callback.accept(participant);
            }
            catch (Exception e)
            {
                LOG.error("Participant joined callback error", e);
            }
        }
    }

    @Override
    public void onHandlerClosed(ConnectionHandler handler, Optional<Participant> removed, CloseReason reason)
    {
        handlers.remove(handler.getParticipantId(), handler);
        removed.ifPresent(participant -> notifyLeft(participant, reason));
    }

    @Override
    public void onDispatchError(ConnectionHandler handler, String frameType, Exception exception)
    {
        ErrorHandler target = errorHandler;
        if (target == null)
        {
            LOG.error("Error handling {} frame from {}", frameType, handler.getParticipantId(), exception);
            return;
        }
        try
        {
            target.handle(handler.getParticipantId(), frameType, exception);
        }
        catch (Exception e)
        {
            LOG.error("Error handler threw", e);
        }
    }

    // ========== Internal ==========

    HeartbeatMonitor heartbeatMonitor()
    {
        return heartbeatMonitor;
    }

    private ConnectionListener accept(Connection connection)
    {
        if (!acceptingConnections)
        {
            LOG.debug("Refusing connection from {} while not accepting connections",
                    connection.getRemoteAddress());
            return null;
        }

        String participantId = UUID.randomUUID().toString();
        ConnectionHandler handler = new ConnectionHandler(
                participantId,
                connection,
                registry,
                proximity,
                router,
                roomLock,
                codec,
                settings,
                clock,
                this,
                stats
        );
        handlers.put(participantId, handler);

        try
        {
            handler.open();
        }
        catch (RuntimeException e)
        {
            LOG.error("Failed to open connection from {}", connection.getRemoteAddress(), e);
            handler.close(new CloseReason.TransportError(e));
            return null;
        }
        return handler;
    }

    boolean evictStale(String participantId, long cutoffMs)
    {
        ConnectionHandler handler = handlers.get(participantId);
        if (handler != null)
        {
            return handler.closeIfStale(cutoffMs);
        }

        // Registry entry without a live handler.
        Optional<Participant> removed;
        synchronized (roomLock)
        {
            removed = registry.removeIfStale(participantId, cutoffMs);
            if (removed.isPresent())
            {
                router.broadcast(new ServerFrame.Left(participantId), null);
            }
        }
        removed.ifPresent(participant -> notifyLeft(participant, new CloseReason.Stale()));
        return removed.isPresent();
    }

    private void notifyLeft(Participant participant, CloseReason reason)
    {
        for (BiConsumer<Participant, CloseReason> callback : leftCallbacks)
        {
            try
            {
                callback.accept(participant, reason);
            }
            catch (Exception e)
            {
                LOG.error("Participant left callback error", e);
            }
        }
    }
}
