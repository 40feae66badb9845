package org.abstractica.nexus.impl.protocol;

import org.abstractica.nexus.Participant;

/**
 * The client-visible part of a participant.
 *
 * @param id    participant id
 * @param name  display name
 * @param x     x position
 * @param y     y position
 * @param color visual identifier
 */
public record WireParticipant(String id, String name, int x, int y, String color)
{
    public static WireParticipant of(Participant participant)
    {
        return new WireParticipant(
                participant.id(),
                participant.name(),
                participant.x(),
                participant.y(),
                participant.color()
        );
    }
}
