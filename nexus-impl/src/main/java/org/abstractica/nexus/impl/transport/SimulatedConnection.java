package org.abstractica.nexus.impl.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A connection of {@link SimulatedTransport}.
 *
 * <p>Records everything the server sends and lets a test inject inbound
 * events. Liveness probes are not answered automatically; call
 * {@link #answerPing()} to simulate the peer's pong.</p>
 */
public class SimulatedConnection implements Connection
{
    private final String remoteAddress;
    private final List<String> sentFrames = new ArrayList<>();

    private ConnectionListener listener;
    private int pingsReceived;
    private boolean open = true;

    SimulatedConnection(String remoteAddress)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
    }

    synchronized void attach(ConnectionListener listener)
    {
        this.listener = listener;
    }

    // ========== Connection Interface ==========

    @Override
    public synchronized void sendText(String text)
    {
        if (open)
        {
            sentFrames.add(text);
        }
    }

    @Override
    public synchronized void sendPing()
    {
        if (open)
        {
            pingsReceived++;
        }
    }

    @Override
    public void close()
    {
        ConnectionListener toNotify;
        synchronized (this)
        {
            if (!open)
            {
                return;
            }
            open = false;
            toNotify = listener;
        }
        if (toNotify != null)
        {
            toNotify.onClosed();
        }
    }

    @Override
    public synchronized boolean isOpen()
    {
        return open;
    }

    @Override
    public String getRemoteAddress()
    {
        return remoteAddress;
    }

    // ========== Peer Side ==========

    /**
     * Delivers a text frame from the peer to the server.
     *
     * @param text the frame text
     */
    public void receive(String text)
    {
        ConnectionListener target = activeListener();
        if (target != null)
        {
            target.onText(text);
        }
    }

    /**
     * Answers a liveness probe.
     */
    public void answerPing()
    {
        ConnectionListener target = activeListener();
        if (target != null)
        {
            target.onPong();
        }
    }

    /**
     * Simulates a transport failure followed by the close.
     *
     * @param cause the failure
     */
    public void fail(Throwable cause)
    {
        ConnectionListener target = activeListener();
        if (target != null)
        {
            target.onError(cause);
        }
        close();
    }

    /**
     * Returns every frame the server sent, oldest first.
     */
    public synchronized List<String> getSentFrames()
    {
        return List.copyOf(sentFrames);
    }

    /**
     * Forgets the frames recorded so far.
     */
    public synchronized void clearSentFrames()
    {
        sentFrames.clear();
    }

    /**
     * Returns how many liveness probes the server sent.
     */
    public synchronized int getPingsReceived()
    {
        return pingsReceived;
    }

    private synchronized ConnectionListener activeListener()
    {
        return open ? listener : null;
    }
}
