package org.abstractica.nexus.impl.session;

/**
 * Per-connection rate gates for moves and chat.
 *
 * <p>Each gate remembers the time of its last accepted command and rejects
 * anything that arrives sooner than its interval. Rejected commands are not
 * queued. The gates are independent of each other and of other connections.</p>
 *
 * <p>Not thread-safe; owned by one {@link ConnectionHandler}.</p>
 */
public class RateLimiter
{
    private final Gate moveGate;
    private final Gate chatGate;

    /**
     * Creates a rate limiter.
     *
     * @param moveIntervalMs minimum time between accepted moves
     * @param chatIntervalMs minimum time between accepted chat messages
     */
    public RateLimiter(long moveIntervalMs, long chatIntervalMs)
    {
        this.moveGate = new Gate(moveIntervalMs);
        this.chatGate = new Gate(chatIntervalMs);
    }

    /**
     * Tries to pass the move gate.
     *
     * @param nowMs arrival time
     * @return true if the move is accepted
     */
    public boolean tryAcquireMove(long nowMs)
    {
        return moveGate.tryAcquire(nowMs);
    }

    /**
     * Tries to pass the chat gate.
     *
     * @param nowMs arrival time
     * @return true if the message is accepted
     */
    public boolean tryAcquireChat(long nowMs)
    {
        return chatGate.tryAcquire(nowMs);
    }

    private static final class Gate
    {
        private final long intervalMs;
        private boolean used;
        private long lastAcceptedMs;

        Gate(long intervalMs)
        {
            if (intervalMs < 0)
            {
                throw new IllegalArgumentException("Interval must be >= 0: " + intervalMs);
            }
            this.intervalMs = intervalMs;
        }

        boolean tryAcquire(long nowMs)
        {
            if (used && nowMs - lastAcceptedMs < intervalMs)
            {
                return false;
            }
            used = true;
            lastAcceptedMs = nowMs;
            return true;
        }
    }
}
