package org.abstractica.nexus.impl.session;

/**
 * Everything the server tracks about one connection besides its participant.
 *
 * <p>The lifecycle and the rate limiter are guarded by the owning handler's
 * lock. The alive flag is written from the transport thread and the heartbeat
 * thread, so it is volatile.</p>
 */
final class ConnectionState
{
    private final RateLimiter rateLimiter;
    private HandlerState lifecycle = HandlerState.CONNECTING;
    private volatile boolean alive = true;

    ConnectionState(RateLimiter rateLimiter)
    {
        this.rateLimiter = rateLimiter;
    }

    RateLimiter rateLimiter()
    {
        return rateLimiter;
    }

    HandlerState lifecycle()
    {
        return lifecycle;
    }

    void lifecycle(HandlerState lifecycle)
    {
        this.lifecycle = lifecycle;
    }

    boolean isAlive()
    {
        return alive;
    }

    void markAlive()
    {
        alive = true;
    }

    void clearAlive()
    {
        alive = false;
    }
}
