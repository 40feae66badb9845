package org.abstractica.nexus.impl.transport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A {@link Connection} over an upgraded Netty channel.
 *
 * <p>Writes are queued in the channel's outbound buffer; there is no flow
 * control beyond what Netty does.</p>
 */
class NettyConnection implements Connection
{
    private static final Logger LOG = LoggerFactory.getLogger(NettyConnection.class);

    private final Channel channel;

    NettyConnection(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public void sendText(String text)
    {
        if (!channel.isActive())
        {
            return;
        }
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(logFailure("text frame"));
    }

    @Override
    public void sendPing()
    {
        if (!channel.isActive())
        {
            return;
        }
        channel.writeAndFlush(new PingWebSocketFrame()).addListener(logFailure("ping"));
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public String getRemoteAddress()
    {
        return String.valueOf(channel.remoteAddress());
    }

    private ChannelFutureListener logFailure(String what)
    {
        return future ->
        {
            if (!future.isSuccess())
            {
                LOG.debug("Failed to send {} to {}: {}", what, channel.remoteAddress(),
                        future.cause() == null ? "cancelled" : future.cause().getMessage());
            }
        };
    }
}
