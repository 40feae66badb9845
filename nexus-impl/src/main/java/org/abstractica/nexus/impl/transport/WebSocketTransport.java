package org.abstractica.nexus.impl.transport;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * WebSocket transport on Netty.
 *
 * <p>Each accepted TCP connection gets this pipeline:</p>
 * <ol>
 *   <li>{@link HttpServerCodec} and {@link HttpObjectAggregator}</li>
 *   <li>{@link HttpStatusHandler}, answering plain HTTP requests</li>
 *   <li>{@link WebSocketServerProtocolHandler}, performing the upgrade and
 *       answering pings and close frames; pongs are passed on</li>
 *   <li>{@link WebSocketFrameAggregator}, joining fragmented frames</li>
 *   <li>{@link WebSocketFrameHandler}, bridging to {@link ConnectionListener}</li>
 * </ol>
 *
 * <p>Netty runs all handlers of a channel on one event loop thread, which
 * keeps each connection's events in arrival order.</p>
 */
public class WebSocketTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);
    private static final int MAX_CONTENT_LENGTH = 65536;
    private static final String WEBSOCKET_PATH = "/";

    private final InetSocketAddress bindAddress;
    private final HttpStatusHandler httpStatusHandler;

    private volatile ConnectionAcceptor acceptor;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * Creates a transport that will bind to the given address on start.
     *
     * @param bindAddress       the address to listen on
     * @param httpStatusHandler handler for non-upgrade HTTP requests
     */
    public WebSocketTransport(InetSocketAddress bindAddress, HttpStatusHandler httpStatusHandler)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.httpStatusHandler = Objects.requireNonNull(httpStatusHandler, "httpStatusHandler");
    }

    @Override
    public void setAcceptor(ConnectionAcceptor acceptor)
    {
        this.acceptor = Objects.requireNonNull(acceptor, "acceptor");
    }

    @Override
    public synchronized void start()
    {
        if (acceptor == null)
        {
            throw new IllegalStateException("Acceptor must be set before start");
        }
        if (serverChannel != null)
        {
            throw new IllegalStateException("Transport already started");
        }

        bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        workerGroup = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());

        WebSocketServerProtocolConfig protocolConfig = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(WEBSOCKET_PATH)
                .checkStartsWith(true)
                .dropPongFrames(false)
                .build();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>()
                {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                        pipeline.addLast(httpStatusHandler);
                        pipeline.addLast(new WebSocketServerProtocolHandler(protocolConfig));
                        pipeline.addLast(new WebSocketFrameAggregator(MAX_CONTENT_LENGTH));
                        pipeline.addLast(new WebSocketFrameHandler(acceptor));
                    }
                });

        try
        {
            serverChannel = bootstrap.bind(bindAddress).sync().channel();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            shutdownGroups();
            throw new IllegalStateException("Interrupted while binding " + bindAddress, e);
        }
        catch (Exception e)
        {
            shutdownGroups();
            throw new IllegalStateException("Failed to bind " + bindAddress, e);
        }

        LOG.info("WebSocket transport listening on {}", serverChannel.localAddress());
    }

    @Override
    public synchronized void close()
    {
        if (serverChannel != null)
        {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        shutdownGroups();
        LOG.info("WebSocket transport closed");
    }

    @Override
    public synchronized SocketAddress getLocalAddress()
    {
        return serverChannel == null ? null : serverChannel.localAddress();
    }

    private void shutdownGroups()
    {
        if (workerGroup != null)
        {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null)
        {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}
