package org.abstractica.nexus.impl.config;

import org.abstractica.nexus.NexusServerFactory;
import org.abstractica.nexus.Room;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Server settings read from the environment and system properties.
 *
 * <p>Every setting has an environment variable and a system property; the
 * system property wins when both are present. Absent settings take their
 * defaults.</p>
 */
public record NexusConfig(
        int port,
        int roomWidth,
        int roomHeight,
        long moveRateLimitMs,
        long chatRateLimitMs,
        int maxMessageLength,
        int maxNameLength,
        long heartbeatIntervalMs,
        long connectionTtlMs,
        int proximityRadius
)
{
    /**
     * One configurable setting.
     */
    enum Key
    {
        PORT("PORT", "nexus.port", 5000, 0, 65535),
        ROOM_WIDTH("ROOM_WIDTH", "nexus.room.width", 1600, 1, Integer.MAX_VALUE),
        ROOM_HEIGHT("ROOM_HEIGHT", "nexus.room.height", 900, 1, Integer.MAX_VALUE),
        MOVE_RATE_LIMIT_MS("MOVE_RATE_LIMIT_MS", "nexus.move.rate-limit-ms", 12, 0, Long.MAX_VALUE),
        CHAT_RATE_LIMIT_MS("CHAT_RATE_LIMIT_MS", "nexus.chat.rate-limit-ms", 1000, 0, Long.MAX_VALUE),
        MAX_MESSAGE_LENGTH("MAX_MESSAGE_LENGTH", "nexus.chat.max-length", 200, 1, Integer.MAX_VALUE),
        MAX_NAME_LENGTH("MAX_NAME_LENGTH", "nexus.name.max-length", 32, 1, Integer.MAX_VALUE),
        HEARTBEAT_INTERVAL_MS("HEARTBEAT_INTERVAL_MS", "nexus.heartbeat-interval-ms", 15000, 1, Long.MAX_VALUE),
        CONNECTION_TTL_MS("CONNECTION_TTL_MS", "nexus.connection-ttl-ms", 30000, 1, Long.MAX_VALUE),
        PROXIMITY_RADIUS("PROXIMITY_RADIUS", "nexus.proximity-radius", 200, 0, Integer.MAX_VALUE);

        private final String envName;
        private final String propertyName;
        private final long defaultValue;
        private final long min;
        private final long max;

        Key(String envName, String propertyName, long defaultValue, long min, long max)
        {
            this.envName = envName;
            this.propertyName = propertyName;
            this.defaultValue = defaultValue;
            this.min = min;
            this.max = max;
        }

        String envName()
        {
            return envName;
        }

        String propertyName()
        {
            return propertyName;
        }
    }

    /**
     * Returns the built-in defaults.
     */
    public static NexusConfig defaults()
    {
        return load(Map.of(), new Properties());
    }

    /**
     * Loads settings from the process environment and the JVM system properties.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static NexusConfig fromEnvironment()
    {
        return load(System.getenv(), System.getProperties());
    }

    /**
     * Loads settings from the given sources.
     *
     * @param env        environment variables
     * @param properties system properties, taking precedence over {@code env}
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static NexusConfig load(Map<String, String> env, Properties properties)
    {
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(properties, "properties");

        return new NexusConfig(
                (int) read(Key.PORT, env, properties),
                (int) read(Key.ROOM_WIDTH, env, properties),
                (int) read(Key.ROOM_HEIGHT, env, properties),
                read(Key.MOVE_RATE_LIMIT_MS, env, properties),
                read(Key.CHAT_RATE_LIMIT_MS, env, properties),
                (int) read(Key.MAX_MESSAGE_LENGTH, env, properties),
                (int) read(Key.MAX_NAME_LENGTH, env, properties),
                read(Key.HEARTBEAT_INTERVAL_MS, env, properties),
                read(Key.CONNECTION_TTL_MS, env, properties),
                (int) read(Key.PROXIMITY_RADIUS, env, properties)
        );
    }

    /**
     * Copies these settings onto a server builder.
     *
     * @param builder the builder to configure
     * @return the same builder
     */
    public NexusServerFactory.Builder applyTo(NexusServerFactory.Builder builder)
    {
        return builder
                .port(port)
                .room(new Room(roomWidth, roomHeight))
                .moveInterval(Duration.ofMillis(moveRateLimitMs))
                .chatInterval(Duration.ofMillis(chatRateLimitMs))
                .maxMessageLength(maxMessageLength)
                .maxNameLength(maxNameLength)
                .heartbeatInterval(Duration.ofMillis(heartbeatIntervalMs))
                .connectionTtl(Duration.ofMillis(connectionTtlMs))
                .proximityRadius(proximityRadius);
    }

    private static long read(Key key, Map<String, String> env, Properties properties)
    {
        String name = key.propertyName();
        String raw = properties.getProperty(name);
        if (raw == null)
        {
            name = key.envName();
            raw = env.get(name);
        }
        if (raw == null || raw.isBlank())
        {
            return key.defaultValue;
        }

        long value;
        try
        {
            value = Long.parseLong(raw.trim());
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(name + " is not a number: " + raw, e);
        }
        if (value < key.min || value > key.max)
        {
            throw new IllegalArgumentException(
                    name + " must be between " + key.min + " and " + key.max + ": " + value);
        }
        return value;
    }
}
