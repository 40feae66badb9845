package org.abstractica.nexus.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory transport for tests.
 *
 * <p>Connections are opened explicitly and every event is delivered
 * synchronously on the calling thread, so tests can drive the server step by
 * step without sockets or sleeps.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * SimulatedTransport transport = new SimulatedTransport();
 * NexusServer server = builder.transport(transport).build();
 * server.start();
 *
 * SimulatedConnection alice = transport.connect();
 * alice.receive("{\"type\":\"ping\",\"payload\":{}}");
 * List<String> frames = alice.getSentFrames();
 * }</pre>
 *
 * @see WebSocketTransport for production use
 */
public class SimulatedTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedTransport.class);

    private final List<SimulatedConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicInteger nextPeer = new AtomicInteger(1);
    private final SocketAddress localAddress = new InetSocketAddress("127.0.0.1", 5000);

    private volatile ConnectionAcceptor acceptor;
    private volatile boolean running;

    @Override
    public void setAcceptor(ConnectionAcceptor acceptor)
    {
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
    }

    @Override
    public void start()
    {
        if (acceptor == null)
        {
            throw new IllegalStateException("Acceptor must be set before start");
        }
        running = true;
        LOG.debug("Simulated transport started");
    }

    @Override
    public void close()
    {
        running = false;
        for (SimulatedConnection connection : connections)
        {
            connection.close();
        }
        connections.clear();
        LOG.debug("Simulated transport closed");
    }

    @Override
    public SocketAddress getLocalAddress()
    {
        return running ? localAddress : null;
    }

    /**
     * Opens a new connection as if a peer had connected.
     *
     * @return the peer side of the new connection
     * @throws IllegalStateException if the transport is not running
     */
    public SimulatedConnection connect()
    {
        if (!running)
        {
            throw new IllegalStateException("Transport is not running");
        }

        SimulatedConnection connection = new SimulatedConnection("peer-" + nextPeer.getAndIncrement());
        ConnectionListener listener = acceptor.accept(connection);
        if (listener == null)
        {
            connection.close();
            return connection;
        }
        connection.attach(listener);
        connections.add(connection);
        return connection;
    }

    /**
     * Returns every connection opened so far that has not been closed by the transport.
     */
    public List<SimulatedConnection> getConnections()
    {
        return List.copyOf(connections);
    }
}
