package org.abstractica.nexus.impl.registry;

import org.abstractica.nexus.Participant;
import org.abstractica.nexus.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.UnaryOperator;

/**
 * The single source of truth for live participants.
 *
 * <p>Every call holds the registry lock for its whole duration, so mutations
 * never interleave and snapshots never observe a half-applied change.
 * Stored participants are immutable; a mutation replaces the stored value.</p>
 *
 * <p>Only {@link #register(String, long)} inserts. Updates on an id that is not
 * present report not-found instead of re-creating the entry, so a removed id
 * can never come back.</p>
 */
public class SessionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);
    private static final int GUEST_SUFFIX_LENGTH = 5;

    private final Room room;
    private final Random random;
    private final Map<String, Participant> participants;

    /**
     * Creates a registry for a room.
     *
     * @param room   the room all participants live in
     * @param random source for spawn positions and colors
     */
    public SessionRegistry(Room room, Random random)
    {
        this.room = Objects.requireNonNull(room, "room");
        this.random = Objects.requireNonNull(random, "random");
        this.participants = new LinkedHashMap<>();
    }

    public SessionRegistry(Room room)
    {
        this(room, new Random());
    }

    // ========== Mutations ==========

    /**
     * Inserts a provisional participant with a random spawn position, a random
     * color and a guest name.
     *
     * @param id    the new participant id
     * @param nowMs creation time, used as the initial last-seen time
     * @return the registered participant
     * @throws IllegalStateException if the id is already registered
     */
    public synchronized Participant register(String id, long nowMs)
    {
        Objects.requireNonNull(id, "id");
        if (participants.containsKey(id))
        {
            throw new IllegalStateException("Participant already registered: " + id);
        }

        Participant participant = new Participant(
                id,
                guestName(id),
                random.nextInt(room.width()),
                random.nextInt(room.height()),
                randomColor(),
                nowMs
        );
        participants.put(id, participant);

        LOG.debug("Participant registered: id={}, position=({}, {})", id, participant.x(), participant.y());
        return participant;
    }

    /**
     * Moves a participant, clamping the position into the room.
     *
     * @param id the participant
     * @param x  proposed x
     * @param y  proposed y
     * @return the updated participant, or empty if not registered
     */
    public synchronized Optional<Participant> updatePosition(String id, int x, int y)
    {
        return replace(id, p -> p.withPosition(room.clampX(x), room.clampY(y)));
    }

    /**
     * Changes a participant's display name.
     *
     * @param id   the participant
     * @param name the already sanitized name
     * @return the updated participant, or empty if not registered
     */
    public synchronized Optional<Participant> rename(String id, String name)
    {
        Objects.requireNonNull(name, "name");
        return replace(id, p -> p.withName(name));
    }

    /**
     * Refreshes a participant's last-seen time.
     *
     * @param id    the participant
     * @param nowMs the activity time
     * @return the updated participant, or empty if not registered
     */
    public synchronized Optional<Participant> touch(String id, long nowMs)
    {
        return replace(id, p -> p.withLastSeen(nowMs));
    }

    /**
     * Removes a participant.
     *
     * <p>Idempotent: removing an absent id returns empty. Exactly one caller
     * receives the removed participant.</p>
     *
     * @param id the participant
     * @return the removed participant, or empty if it was not registered
     */
    public synchronized Optional<Participant> remove(String id)
    {
        Objects.requireNonNull(id, "id");
        Participant removed = participants.remove(id);
        if (removed != null)
        {
            LOG.debug("Participant removed: id={}", id);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Removes a participant only if it has not been seen since the cutoff.
     *
     * @param id       the participant
     * @param cutoffMs the oldest acceptable last-seen time
     * @return the removed participant, or empty if it was absent or active
     */
    public synchronized Optional<Participant> removeIfStale(String id, long cutoffMs)
    {
        Objects.requireNonNull(id, "id");
        Participant current = participants.get(id);
        if (current == null || current.lastSeenMs() >= cutoffMs)
        {
            return Optional.empty();
        }
        return remove(id);
    }

    // ========== Queries ==========

    /**
     * Looks up a participant.
     *
     * @param id the participant
     * @return the current value, or empty if not registered
     */
    public synchronized Optional<Participant> find(String id)
    {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(participants.get(id));
    }

    /**
     * Returns all participants in registration order.
     *
     * @return an immutable copy
     */
    public synchronized List<Participant> snapshot()
    {
        return List.copyOf(participants.values());
    }

    /**
     * Returns the ids of participants whose last-seen time predates the cutoff.
     *
     * @param cutoffMs the oldest acceptable last-seen time
     * @return stale ids in registration order
     */
    public synchronized List<String> findStale(long cutoffMs)
    {
        List<String> stale = new ArrayList<>();
        for (Participant participant : participants.values())
        {
            if (participant.lastSeenMs() < cutoffMs)
            {
                stale.add(participant.id());
            }
        }
        return stale;
    }

    public synchronized int size()
    {
        return participants.size();
    }

    public Room getRoom()
    {
        return room;
    }

    // ========== Internal ==========

    private Optional<Participant> replace(String id, UnaryOperator<Participant> change)
    {
        Objects.requireNonNull(id, "id");
        Participant current = participants.get(id);
        if (current == null)
        {
            return Optional.empty();
        }
        Participant updated = change.apply(current);
        participants.put(id, updated);
        return Optional.of(updated);
    }

    private String randomColor()
    {
        return "hsl(" + random.nextInt(360) + " 90% 60%)";
    }

    private static String guestName(String id)
    {
        return "Guest-" + id.substring(0, Math.min(GUEST_SUFFIX_LENGTH, id.length()));
    }
}
