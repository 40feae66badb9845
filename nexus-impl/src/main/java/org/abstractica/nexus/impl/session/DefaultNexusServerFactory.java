package org.abstractica.nexus.impl.session;

import org.abstractica.nexus.NexusServer;
import org.abstractica.nexus.NexusServerFactory;
import org.abstractica.nexus.Room;
import org.abstractica.nexus.impl.protocol.FrameCodec;
import org.abstractica.nexus.impl.proximity.LinearProximityEngine;
import org.abstractica.nexus.impl.registry.SessionRegistry;
import org.abstractica.nexus.impl.transport.HttpStatusHandler;
import org.abstractica.nexus.impl.transport.Transport;
import org.abstractica.nexus.impl.transport.WebSocketTransport;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Default implementation of NexusServerFactory.
 *
 * <p>Creates DefaultNexusServer instances using a builder pattern.</p>
 */
public class DefaultNexusServerFactory implements NexusServerFactory
{
    public static final int DEFAULT_PORT = 5000;

    @Override
    public DefaultBuilder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int port = DEFAULT_PORT;
        private InetAddress bindAddress;
        private Room room = new Room(1600, 900);
        private Duration moveInterval = Duration.ofMillis(12);
        private Duration chatInterval = Duration.ofSeconds(1);
        private int maxMessageLength = 200;
        private int maxNameLength = 32;
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration connectionTtl = Duration.ofSeconds(30);
        private int proximityRadius = 200;
        private Transport customTransport; // Optional custom transport for testing
        private LongSupplier clock = System::currentTimeMillis;
        private Random random = new Random();

        @Override
        public DefaultBuilder port(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public DefaultBuilder bindAddress(InetAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        @Override
        public DefaultBuilder room(Room room)
        {
            this.room = Objects.requireNonNull(room, "room");
            return this;
        }

        @Override
        public DefaultBuilder moveInterval(Duration interval)
        {
            this.moveInterval = nonNegative(interval, "Move interval");
            return this;
        }

        @Override
        public DefaultBuilder chatInterval(Duration interval)
        {
            this.chatInterval = nonNegative(interval, "Chat interval");
            return this;
        }

        @Override
        public DefaultBuilder maxMessageLength(int length)
        {
            if (length <= 0)
            {
                throw new IllegalArgumentException("maxMessageLength must be positive: " + length);
            }
            this.maxMessageLength = length;
            return this;
        }

        @Override
        public DefaultBuilder maxNameLength(int length)
        {
            if (length <= 0)
            {
                throw new IllegalArgumentException("maxNameLength must be positive: " + length);
            }
            this.maxNameLength = length;
            return this;
        }

        @Override
        public DefaultBuilder heartbeatInterval(Duration interval)
        {
            this.heartbeatInterval = positive(interval, "Heartbeat interval");
            return this;
        }

        @Override
        public DefaultBuilder connectionTtl(Duration ttl)
        {
            this.connectionTtl = positive(ttl, "Connection TTL");
            return this;
        }

        @Override
        public DefaultBuilder proximityRadius(int radius)
        {
            if (radius < 0)
            {
                throw new IllegalArgumentException("Proximity radius must be >= 0: " + radius);
            }
            this.proximityRadius = radius;
            return this;
        }

        /**
         * Sets a custom transport for testing purposes.
         *
         * <p>If not set, a WebSocketTransport will be created automatically.</p>
         *
         * @param transport the transport to use
         * @return this builder
         */
        public DefaultBuilder transport(Transport transport)
        {
            this.customTransport = transport;
            return this;
        }

        /**
         * Sets the millisecond clock. Defaults to the system clock.
         *
         * @param clock the clock
         * @return this builder
         */
        public DefaultBuilder clock(LongSupplier clock)
        {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the source of spawn positions and colors.
         *
         * @param random the random source
         * @return this builder
         */
        public DefaultBuilder random(Random random)
        {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        @Override
        public NexusServer build()
        {
            // Create transport (use custom if provided, otherwise create WebSocket)
            Transport transport;
            if (customTransport != null)
            {
                transport = customTransport;
            }
            else
            {
                InetSocketAddress socketAddress = bindAddress != null
                        ? new InetSocketAddress(bindAddress, port)
                        : new InetSocketAddress(port);
                transport = new WebSocketTransport(socketAddress, new HttpStatusHandler(room, clock));
            }

            SessionRegistry registry = new SessionRegistry(room, random);
            SessionSettings settings = new SessionSettings(
                    moveInterval.toMillis(),
                    chatInterval.toMillis(),
                    maxMessageLength,
                    maxNameLength
            );

            return new DefaultNexusServer(
                    transport,
                    registry,
                    new LinearProximityEngine(registry, proximityRadius),
                    new FrameCodec(),
                    settings,
                    heartbeatInterval,
                    connectionTtl,
                    clock
            );
        }

        private static Duration positive(Duration value, String what)
        {
            Objects.requireNonNull(value, what);
            if (value.isNegative() || value.isZero())
            {
                throw new IllegalArgumentException(what + " must be positive");
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String what)
        {
            Objects.requireNonNull(value, what);
            if (value.isNegative())
            {
                throw new IllegalArgumentException(what + " must not be negative");
            }
            return value;
        }
    }
}
