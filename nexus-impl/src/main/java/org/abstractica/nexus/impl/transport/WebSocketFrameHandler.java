package org.abstractica.nexus.impl.transport;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges one WebSocket channel to a {@link ConnectionListener}.
 *
 * <p>The connection is offered to the acceptor once the upgrade handshake has
 * completed. One instance per channel.</p>
 */
class WebSocketFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame>
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    private final ConnectionAcceptor acceptor;
    private ConnectionListener listener;

    WebSocketFrameHandler(ConnectionAcceptor acceptor)
    {
        this.acceptor = acceptor;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
    {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete)
        {
            NettyConnection connection = new NettyConnection(ctx.channel());
            listener = acceptor.accept(connection);
            if (listener == null)
            {
                LOG.debug("Connection from {} refused", connection.getRemoteAddress());
                ctx.close();
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
    {
        if (listener == null)
        {
            return;
        }

        if (frame instanceof TextWebSocketFrame)
        {
            listener.onText(((TextWebSocketFrame) frame).text());
        }
        else if (frame instanceof PongWebSocketFrame)
        {
            listener.onPong();
        }
        else
        {
            LOG.debug("Ignoring {} from {}", frame.getClass().getSimpleName(), ctx.channel().remoteAddress());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        if (listener != null)
        {
            listener.onClosed();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        LOG.warn("Transport error on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        if (listener != null)
        {
            listener.onError(cause);
        }
        ctx.close();
    }
}
