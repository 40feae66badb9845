package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.Room;
import org.abstractica.nexus.impl.protocol.FrameCodec;
import org.abstractica.nexus.impl.registry.SessionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link HeartbeatMonitor}.
 */
class HeartbeatMonitorTest
{
    private final AtomicLong clock = new AtomicLong(0);
    private final List<String> evicted = new CopyOnWriteArrayList<>();

    private SessionRegistry registry;
    private DefaultServerStats stats;
    private HeartbeatMonitor monitor;

    @BeforeEach
    void setUp()
    {
        registry = new SessionRegistry(new Room(100, 100));
        stats = new DefaultServerStats(registry, new BroadcastRouter(new FrameCodec(), clock::get));
    }

    @AfterEach
    void tearDown()
    {
        if (monitor != null)
        {
            monitor.close();
        }
    }

    private HeartbeatMonitor monitor(Duration interval, Runnable onEvict)
    {
        return monitor(interval, (id, cutoffMs) ->
        {
            if (registry.removeIfStale(id, cutoffMs).isEmpty())
            {
                return false;
            }
            evicted.add(id);
            onEvict.run();
            return true;
        });
    }

    private HeartbeatMonitor monitor(Duration interval, HeartbeatMonitor.StaleEvictor evictor)
    {
        return new HeartbeatMonitor(
                interval,
                Duration.ofSeconds(30),
                () -> List.of(),
                registry,
                evictor,
                clock::get,
                stats
        );
    }

    @Test
    void runCycle_evictsOnlyParticipantsOlderThanTtl()
    {
        monitor = monitor(Duration.ofSeconds(15), () -> {});
        registry.register("old", 0);
        registry.register("recent", 20_000);

        monitor.runCycle(40_000);

        assertEquals(List.of("old"), evicted);
        assertEquals(1, stats.getEvictions());
        assertTrue(registry.find("recent").isPresent());
    }

    @Test
    void runCycle_atExactTtl_keepsParticipant()
    {
        monitor = monitor(Duration.ofSeconds(15), () -> {});
        registry.register("edge", 10_000);

        monitor.runCycle(40_000);

        assertTrue(evicted.isEmpty());
    }

    @Test
    void runCycle_participantSeenAfterScan_isNotCounted()
    {
        registry.register("busy", 0);
        registry.register("gone", 0);
        monitor = monitor(Duration.ofSeconds(15), (id, cutoffMs) ->
        {
            // A frame from "busy" lands between the scan and its eviction.
            registry.touch("busy", 40_000);
            if (registry.removeIfStale(id, cutoffMs).isEmpty())
            {
                return false;
            }
            evicted.add(id);
            return true;
        });

        monitor.runCycle(40_000);

        assertEquals(List.of("gone"), evicted);
        assertEquals(1, stats.getEvictions());
        assertTrue(registry.find("busy").isPresent());
    }

    @Test
    void start_runsCyclesPeriodically() throws Exception
    {
        CountDownLatch evictedLatch = new CountDownLatch(1);
        monitor = monitor(Duration.ofMillis(20), evictedLatch::countDown);
        registry.register("ghost", 0);
        clock.set(60_000);

        monitor.start();

        assertTrue(evictedLatch.await(2, TimeUnit.SECONDS), "scheduled cycle should evict the ghost");
        assertEquals(List.of("ghost"), evicted);
    }

    @Test
    void start_twice_throws()
    {
        monitor = monitor(Duration.ofSeconds(15), () -> {});
        monitor.start();

        assertThrows(IllegalStateException.class, monitor::start);
    }

    @Test
    void close_beforeStart_isHarmless()
    {
        monitor = monitor(Duration.ofSeconds(15), () -> {});

        assertDoesNotThrow(monitor::close);
    }
}
