package org.abstractica.nexus;

import java.net.InetAddress;
import java.time.Duration;

/**
 * Factory for creating NexusServer instances.
 *
 * <p>Use the builder to configure the server before creation:</p>
 * <pre>{@code
 * NexusServerFactory factory = new DefaultNexusServerFactory();
 * NexusServer server = factory.builder()
 *     .port(5000)
 *     .heartbeatInterval(Duration.ofSeconds(15))
 *     .connectionTtl(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 */
public interface NexusServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a NexusServer.
     */
    interface Builder
    {
        /**
         * Sets the port to listen on.
         *
         * <p>Optional. Defaults to 5000. Port 0 binds an ephemeral port.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the address to bind to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the room dimensions.
         *
         * <p>Optional. Defaults to 1600 x 900.</p>
         *
         * @param room the room
         * @return this builder
         */
        Builder room(Room room);

        /**
         * Sets the minimum interval between two accepted moves of one connection.
         *
         * <p>Optional. Defaults to 12 milliseconds.</p>
         *
         * @param interval the move interval
         * @return this builder
         */
        Builder moveInterval(Duration interval);

        /**
         * Sets the minimum interval between two accepted chat messages of one connection.
         *
         * <p>Optional. Defaults to 1 second.</p>
         *
         * @param interval the chat interval
         * @return this builder
         */
        Builder chatInterval(Duration interval);

        /**
         * Sets the maximum chat message length after sanitizing.
         *
         * <p>Optional. Defaults to 200 characters.</p>
         *
         * @param length maximum length
         * @return this builder
         */
        Builder maxMessageLength(int length);

        /**
         * Sets the maximum display name length.
         *
         * <p>Optional. Defaults to 32 characters.</p>
         *
         * @param length maximum length
         * @return this builder
         */
        Builder maxNameLength(int length);

        /**
         * Sets the interval between liveness probes.
         *
         * <p>Optional. Defaults to 15 seconds. A connection that misses two
         * consecutive probes is closed.</p>
         *
         * @param interval the heartbeat interval
         * @return this builder
         */
        Builder heartbeatInterval(Duration interval);

        /**
         * Sets how long a participant may stay silent before it is evicted.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param ttl the liveness TTL
         * @return this builder
         */
        Builder connectionTtl(Duration ttl);

        /**
         * Sets the distance within which participants are considered nearby.
         *
         * <p>Optional. Defaults to 200.</p>
         *
         * @param radius the proximity radius
         * @return this builder
         */
        Builder proximityRadius(int radius);

        /**
         * Builds the server.
         *
         * @return the configured server
         * @throws IllegalStateException if the configuration is inconsistent
         */
        NexusServer build();
    }
}
