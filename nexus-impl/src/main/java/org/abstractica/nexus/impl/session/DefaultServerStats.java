package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.ServerStats;
import org.abstractica.nexus.impl.registry.SessionRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ServerStats.
 *
 * <p>Connection and participant counts are read live; frame and eviction
 * counters accumulate since creation.</p>
 */
public class DefaultServerStats implements ServerStats
{
    private final SessionRegistry registry;
    private final BroadcastRouter router;
    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong framesDropped = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);

    /**
     * Creates stats over a registry and a router.
     *
     * @param registry the participant registry
     * @param router   the router holding open connections
     */
    public DefaultServerStats(SessionRegistry registry, BroadcastRouter router)
    {
        this.registry = registry;
        this.router = router;
    }

    @Override
    public int getActiveConnections()
    {
        return router.size();
    }

    @Override
    public int getParticipantCount()
    {
        return registry.size();
    }

    @Override
    public long getFramesReceived()
    {
        return framesReceived.get();
    }

    @Override
    public long getFramesDropped()
    {
        return framesDropped.get();
    }

    @Override
    public long getEvictions()
    {
        return evictions.get();
    }

    // ========== Update Methods ==========

    public void recordFrameReceived()
    {
        framesReceived.incrementAndGet();
    }

    public void recordFrameDropped()
    {
        framesDropped.incrementAndGet();
    }

    public void recordEviction()
    {
        evictions.incrementAndGet();
    }
}
