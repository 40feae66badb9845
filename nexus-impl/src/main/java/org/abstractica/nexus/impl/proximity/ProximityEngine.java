package org.abstractica.nexus.impl.proximity;

import org.abstractica.nexus.Participant;

import java.util.Set;

/**
 * Computes which participants are close enough to interact.
 *
 * <p>Implementations may use any spatial structure as long as the result is
 * exactly the set of other live participants within the radius.</p>
 */
public interface ProximityEngine
{
    /**
     * Returns the ids of every other live participant within the proximity
     * radius of {@code participant}.
     *
     * <p>The result never contains the participant itself and reflects
     * registry state no older than the call.</p>
     *
     * @param participant the reference participant
     * @return ids of nearby participants
     */
    Set<String> nearbyOf(Participant participant);

    /**
     * Returns the proximity radius.
     */
    int getRadius();
}
