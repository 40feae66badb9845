package org.abstractica.nexus.impl.session;

/**
 * Per-connection limits shared by all handlers.
 *
 * @param moveIntervalMs   minimum time between accepted moves
 * @param chatIntervalMs   minimum time between accepted chat messages
 * @param maxMessageLength maximum chat message length
 * @param maxNameLength    maximum display name length
 */
public record SessionSettings(long moveIntervalMs, long chatIntervalMs, int maxMessageLength, int maxNameLength)
{
    public static final String NO_ONE_NEARBY = "No one nearby to chat with";

    public SessionSettings
    {
        if (moveIntervalMs < 0 || chatIntervalMs < 0)
        {
            throw new IllegalArgumentException("Rate-limit intervals must be >= 0");
        }
        if (maxMessageLength <= 0 || maxNameLength <= 0)
        {
            throw new IllegalArgumentException("Length limits must be positive");
        }
    }
}
