package org.abstractica.nexus.impl.proximity;

import org.abstractica.nexus.Participant;
import org.abstractica.nexus.impl.registry.SessionRegistry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Proximity by a linear scan over a fresh registry snapshot.
 *
 * <p>Compares squared distances, so no square root is taken per pair. Cost is
 * linear in the number of participants, which suits a single room.</p>
 */
public class LinearProximityEngine implements ProximityEngine
{
    private final SessionRegistry registry;
    private final int radius;
    private final long radiusSquared;

    /**
     * Creates an engine over a registry.
     *
     * @param registry the live participants
     * @param radius   the proximity radius, non-negative
     */
    public LinearProximityEngine(SessionRegistry registry, int radius)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (radius < 0)
        {
            throw new IllegalArgumentException("Radius must be >= 0: " + radius);
        }
        this.radius = radius;
        this.radiusSquared = (long) radius * radius;
    }

    @Override
    public Set<String> nearbyOf(Participant participant)
    {
        Objects.requireNonNull(participant, "participant");

        Set<String> nearby = new LinkedHashSet<>();
        for (Participant other : registry.snapshot())
        {
            if (other.id().equals(participant.id()))
            {
                continue;
            }
            if (isWithinRadius(participant, other))
            {
                nearby.add(other.id());
            }
        }
        return Collections.unmodifiableSet(nearby);
    }

    @Override
    public int getRadius()
    {
        return radius;
    }

    boolean isWithinRadius(Participant a, Participant b)
    {
        long dx = (long) a.x() - b.x();
        long dy = (long) a.y() - b.y();
        return dx * dx + dy * dy <= radiusSquared;
    }
}
