package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.CloseReason;
import org.abstractica.nexus.Participant;
import org.abstractica.nexus.Room;
import org.abstractica.nexus.impl.protocol.FrameCodec;
import org.abstractica.nexus.impl.proximity.LinearProximityEngine;
import org.abstractica.nexus.impl.proximity.ProximityEngine;
import org.abstractica.nexus.impl.registry.SessionRegistry;
import org.abstractica.nexus.impl.transport.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ConnectionHandler}.
 */
class ConnectionHandlerTest
{
    private final AtomicLong clock = new AtomicLong(10_000L);
    private final RecordingCallback callback = new RecordingCallback();
    private final FrameCodec codec = new FrameCodec();
    private final SessionSettings settings = new SessionSettings(12, 1000, 200, 32);

    private SessionRegistry registry;
    private BroadcastRouter router;
    private DefaultServerStats stats;
    private RecordingConnection connection;

    @BeforeEach
    void setUp()
    {
        registry = new SessionRegistry(new Room(1600, 900));
        router = new BroadcastRouter(codec, clock::get);
        stats = new DefaultServerStats(registry, router);
        connection = new RecordingConnection();
    }

    private ConnectionHandler handler(ProximityEngine proximity)
    {
        return new ConnectionHandler("p-1", connection, registry, proximity, router, new Object(), codec,
                settings, clock::get, callback, stats);
    }

    private ConnectionHandler openHandler()
    {
        ConnectionHandler handler = handler(new LinearProximityEngine(registry, 200));
        handler.open();
        return handler;
    }

    @Test
    void open_registersAndGreets()
    {
        ConnectionHandler handler = openHandler();

        assertEquals(HandlerState.ACTIVE, handler.getState());
        assertTrue(registry.find("p-1").isPresent());
        assertEquals(2, connection.sent.size());
        assertTrue(connection.sent.get(0).contains("\"welcome\""));
        assertTrue(connection.sent.get(1).contains("\"state\""));
        assertEquals(1, callback.joined);
    }

    @Test
    void open_twice_throws()
    {
        ConnectionHandler handler = openHandler();

        assertThrows(IllegalStateException.class, handler::open);
    }

    @Test
    void close_isIdempotent()
    {
        ConnectionHandler handler = openHandler();

        handler.close(new CloseReason.Kicked("first"));
        handler.close(new CloseReason.TransportClosed());
        handler.onClosed();

        assertEquals(HandlerState.CLOSED, handler.getState());
        assertEquals(1, callback.closed.size());
        assertEquals(new CloseReason.Kicked("first"), callback.closed.get(0));
        assertTrue(callback.removed.get(0).isPresent());
        assertFalse(connection.open);
        assertTrue(registry.find("p-1").isEmpty());
    }

    @Test
    void close_afterRegistryEviction_reportsNothingRemoved()
    {
        ConnectionHandler handler = openHandler();
        registry.remove("p-1");

        handler.close(new CloseReason.Stale());

        assertTrue(callback.removed.get(0).isEmpty());
    }

    @Test
    void closeIfStale_activityAfterCutoff_staysOpen()
    {
        ConnectionHandler handler = openHandler();
        clock.set(50_000L);
        handler.onText("{\"type\":\"ping\",\"payload\":{}}");

        assertFalse(handler.closeIfStale(20_000L));

        assertEquals(HandlerState.ACTIVE, handler.getState());
        assertTrue(connection.open);
        assertTrue(callback.closed.isEmpty());
    }

    @Test
    void closeIfStale_silentSinceCutoff_closesAsStale()
    {
        ConnectionHandler handler = openHandler();

        assertTrue(handler.closeIfStale(20_000L));
        assertFalse(handler.closeIfStale(20_000L));

        assertEquals(HandlerState.CLOSED, handler.getState());
        assertEquals(List.of(new CloseReason.Stale()), callback.closed);
        assertTrue(registry.find("p-1").isEmpty());
    }

    @Test
    void framesAfterClose_areDiscarded()
    {
        ConnectionHandler handler = openHandler();
        handler.close(new CloseReason.TransportClosed());
        int sentBefore = connection.sent.size();

        handler.onText("{\"type\":\"ping\",\"payload\":{}}");

        assertEquals(sentBefore, connection.sent.size());
        assertEquals(0, stats.getFramesReceived());
    }

    @Test
    void dispatchFailure_isReportedAndConnectionStaysOpen()
    {
        ProximityEngine failing = new ProximityEngine()
        {
            @Override
            public Set<String> nearbyOf(Participant participant)
            {
                throw new IllegalStateException("boom");
            }

            @Override
            public int getRadius()
            {
                return 200;
            }
        };
        ConnectionHandler handler = handler(failing);
        handler.open();

        handler.onText("{\"type\":\"chat\",\"payload\":{\"message\":\"hi\"}}");

        assertEquals("chat", callback.errorFrameType);
        assertInstanceOf(IllegalStateException.class, callback.error);
        assertEquals(HandlerState.ACTIVE, handler.getState());
        assertTrue(connection.open);
    }

    @Test
    void probe_pingsWhileAliveThenCloses()
    {
        ConnectionHandler handler = openHandler();

        assertTrue(handler.probe());
        assertEquals(1, connection.pings);

        assertFalse(handler.probe());
        assertEquals(new CloseReason.HeartbeatTimeout(), callback.closed.get(0));
    }

    @Test
    void pong_keepsConnectionAlive()
    {
        ConnectionHandler handler = openHandler();

        handler.probe();
        clock.addAndGet(5_000);
        handler.onPong();

        assertTrue(handler.probe());
        assertEquals(15_000L, registry.find("p-1").orElseThrow().lastSeenMs());
    }

    @Test
    void transportError_closesWithCause()
    {
        ConnectionHandler handler = openHandler();
        IllegalStateException cause = new IllegalStateException("reset");

        handler.onError(cause);

        assertEquals(new CloseReason.TransportError(cause), callback.closed.get(0));
    }

    // ========== Test Doubles ==========

    private static final class RecordingCallback implements HandlerCallback
    {
        int joined;
        final List<CloseReason> closed = new ArrayList<>();
        final List<Optional<Participant>> removed = new ArrayList<>();
        String errorFrameType;
        Exception error;

        @Override
        public void onParticipantJoined(ConnectionHandler handler, Participant participant)
        {
            joined++;
        }

        @Override
        public void onHandlerClosed(ConnectionHandler handler, Optional<Participant> participant, CloseReason reason)
        {
            closed.add(reason);
            removed.add(participant);
        }

        @Override
        public void onDispatchError(ConnectionHandler handler, String frameType, Exception exception)
        {
            errorFrameType = frameType;
            error = exception;
        }
    }

    private static final class RecordingConnection implements Connection
    {
        final List<String> sent = new ArrayList<>();
        int pings;
        boolean open = true;

        @Override
        public void sendText(String text)
        {
            sent.add(text);
        }

        @Override
        public void sendPing()
        {
            pings++;
        }

        @Override
        public void close()
        {
            open = false;
        }

        @Override
        public boolean isOpen()
        {
            return open;
        }

        @Override
        public String getRemoteAddress()
        {
            return "test-peer";
        }
    }
}
