package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.impl.registry.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Periodic liveness check.
 *
 * <p>Each cycle probes every open handler, then evicts every participant
 * whose last activity is older than the TTL. A connection that stays silent
 * through two consecutive probes is closed by the first pass.</p>
 */
public class HeartbeatMonitor implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final Duration interval;
    private final Duration ttl;
    private final Supplier<Collection<ConnectionHandler>> handlers;
    private final SessionRegistry registry;
    private final StaleEvictor staleEvictor;
    private final LongSupplier clock;
    private final DefaultServerStats stats;

    private ScheduledExecutorService scheduler;

    /**
     * Creates a monitor.
     *
     * @param interval     time between cycles
     * @param ttl          maximum silence before a participant is evicted
     * @param handlers     supplies the handlers to probe
     * @param registry     the participant registry
     * @param staleEvictor removes a participant that is still stale
     * @param clock        wall-clock milliseconds
     * @param stats        eviction counter
     */
    public HeartbeatMonitor(
            Duration interval,
            Duration ttl,
            Supplier<Collection<ConnectionHandler>> handlers,
            SessionRegistry registry,
            StaleEvictor staleEvictor,
            LongSupplier clock,
            DefaultServerStats stats
    )
    {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.staleEvictor = Objects.requireNonNull(staleEvictor, "staleEvictor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /**
     * Starts the periodic cycle on a daemon thread.
     */
    public synchronized void start()
    {
        if (scheduler != null)
        {
            throw new IllegalStateException("Heartbeat monitor already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r ->
        {
            Thread thread = new Thread(r, "nexus-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.debug("Heartbeat monitor started (interval {} ms, ttl {} ms)", periodMs, ttl.toMillis());
    }

    /**
     * Stops the cycle. A cycle already running is allowed to finish.
     */
    @Override
    public synchronized void close()
    {
        if (scheduler != null)
        {
            scheduler.shutdownNow();
            scheduler = null;
            LOG.debug("Heartbeat monitor stopped");
        }
    }

    /**
     * Runs one cycle.
     *
     * @param nowMs current time
     */
    public void runCycle(long nowMs)
    {
        for (ConnectionHandler handler : List.copyOf(handlers.get()))
        {
            try
            {
                if (!handler.probe())
                {
                    LOG.info("Terminated unresponsive connection {}", handler.getParticipantId());
                    stats.recordEviction();
                }
            }
            catch (RuntimeException e)
            {
                LOG.error("Error probing connection {}", handler.getParticipantId(), e);
            }
        }

        long cutoffMs = nowMs - ttl.toMillis();
        for (String participantId : registry.findStale(cutoffMs))
        {
            if (staleEvictor.evict(participantId, cutoffMs))
            {
                LOG.info("Removed stale participant {}", participantId);
                stats.recordEviction();
            }
        }
    }

    private void tick()
    {
        try
        {
            runCycle(clock.getAsLong());
        }
        catch (Exception e)
        {
            LOG.error("Error in heartbeat cycle", e);
        }
    }

    /**
     * Removes one participant found by the TTL scan.
     */
    @FunctionalInterface
    public interface StaleEvictor
    {
        /**
         * @param participantId the participant found by the scan
         * @param cutoffMs      the cutoff the scan used
         * @return true if the participant was still stale and has been removed
         */
        boolean evict(String participantId, long cutoffMs);
    }
}
