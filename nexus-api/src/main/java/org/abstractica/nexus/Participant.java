package org.abstractica.nexus;

import java.util.Objects;

/**
 * One connected actor in the room.
 *
 * <p>Participants are immutable snapshots. The registry replaces the stored
 * value on every change.</p>
 *
 * @param id         unique identifier, fixed for the lifetime of the connection
 * @param name       display name
 * @param x          horizontal position, within {@code [0, room.width]}
 * @param y          vertical position, within {@code [0, room.height]}
 * @param color      visual identifier assigned at creation
 * @param lastSeenMs time of the last inbound frame or heartbeat response
 */
public record Participant(String id, String name, int x, int y, String color, long lastSeenMs)
{
    public Participant
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(color, "color");
    }

    public Participant withPosition(int newX, int newY)
    {
        return new Participant(id, name, newX, newY, color, lastSeenMs);
    }

    public Participant withName(String newName)
    {
        return new Participant(id, newName, x, y, color, lastSeenMs);
    }

    public Participant withLastSeen(long nowMs)
    {
        return new Participant(id, name, x, y, color, nowMs);
    }
}
