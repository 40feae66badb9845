package org.abstractica.nexus.impl.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.abstractica.nexus.Room;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Answers plain HTTP requests on the WebSocket port.
 *
 * <ul>
 *   <li>{@code GET /health}: {@code {"ok":true,"time":<epoch millis>}}</li>
 *   <li>{@code GET /room}: {@code {"width":..,"height":..}}</li>
 * </ul>
 *
 * <p>WebSocket upgrade requests are passed on; anything else gets 404.
 * Stateless, shared by all channels.</p>
 */
@ChannelHandler.Sharable
public class HttpStatusHandler extends SimpleChannelInboundHandler<FullHttpRequest>
{
    private final ObjectMapper mapper = new ObjectMapper();
    private final Room room;
    private final LongSupplier clock;

    public HttpStatusHandler(Room room, LongSupplier clock)
    {
        this.room = Objects.requireNonNull(room, "room");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) throws JsonProcessingException
    {
        if (isUpgrade(request))
        {
            ctx.fireChannelRead(request.retain());
            return;
        }

        String path = new QueryStringDecoder(request.uri()).path();
        if (!HttpMethod.GET.equals(request.method()))
        {
            respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED, "{}");
            return;
        }

        switch (path)
        {
            case "/health" ->
            {
                ObjectNode body = mapper.createObjectNode();
                body.put("ok", true);
                body.put("time", clock.getAsLong());
                respond(ctx, request, HttpResponseStatus.OK, mapper.writeValueAsString(body));
            }
            case "/room" -> respond(ctx, request, HttpResponseStatus.OK, mapper.writeValueAsString(room));
            default -> respond(ctx, request, HttpResponseStatus.NOT_FOUND, "{}");
        }
    }

    private static boolean isUpgrade(FullHttpRequest request)
    {
        return request.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);
    }

    private static void respond(ChannelHandlerContext ctx, FullHttpRequest request,
                                HttpResponseStatus status, String json)
    {
        FullHttpResponse response = new DefaultFullHttpResponse(
                request.protocolVersion(),
                status,
                Unpooled.copiedBuffer(json, StandardCharsets.UTF_8)
        );
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
        HttpUtil.setContentLength(response, response.content().readableBytes());

        if (HttpUtil.isKeepAlive(request))
        {
            HttpUtil.setKeepAlive(response, true);
            ctx.writeAndFlush(response);
        }
        else
        {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
