package org.abstractica.nexus.impl.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.abstractica.nexus.Room;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link HttpStatusHandler}.
 */
class HttpStatusHandlerTest
{
    private final ObjectMapper mapper = new ObjectMapper();
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp()
    {
        channel = new EmbeddedChannel(new HttpStatusHandler(new Room(1600, 900), () -> 4242L));
    }

    @AfterEach
    void tearDown()
    {
        channel.finishAndReleaseAll();
    }

    private FullHttpResponse exchange(HttpMethod method, String uri)
    {
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri));
        return channel.readOutbound();
    }

    private JsonNode body(FullHttpResponse response) throws Exception
    {
        try
        {
            return mapper.readTree(response.content().toString(StandardCharsets.UTF_8));
        }
        finally
        {
            response.release();
        }
    }

    @Test
    void health_returnsOkAndTime() throws Exception
    {
        FullHttpResponse response = exchange(HttpMethod.GET, "/health");

        assertEquals(HttpResponseStatus.OK, response.status());
        assertEquals("application/json; charset=UTF-8", response.headers().get(HttpHeaderNames.CONTENT_TYPE));
        JsonNode body = body(response);
        assertTrue(body.get("ok").asBoolean());
        assertEquals(4242L, body.get("time").asLong());
    }

    @Test
    void health_ignoresQueryString() throws Exception
    {
        FullHttpResponse response = exchange(HttpMethod.GET, "/health?verbose=1");

        assertEquals(HttpResponseStatus.OK, response.status());
        response.release();
    }

    @Test
    void room_returnsDimensions() throws Exception
    {
        FullHttpResponse response = exchange(HttpMethod.GET, "/room");

        assertEquals(HttpResponseStatus.OK, response.status());
        JsonNode body = body(response);
        assertEquals(1600, body.get("width").asInt());
        assertEquals(900, body.get("height").asInt());
    }

    @Test
    void unknownPath_returns404()
    {
        FullHttpResponse response = exchange(HttpMethod.GET, "/nothing-here");

        assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
        response.release();
    }

    @Test
    void nonGet_returns405()
    {
        FullHttpResponse response = exchange(HttpMethod.POST, "/health");

        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, response.status());
        response.release();
    }

    @Test
    void upgradeRequest_isPassedOn()
    {
        FullHttpRequest upgrade = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, "/");
        upgrade.headers().set(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET);
        upgrade.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE);

        channel.writeInbound(upgrade);

        FullHttpRequest passed = channel.readInbound();
        assertSame(upgrade, passed);
        assertNull(channel.readOutbound());
        passed.release();
    }
}
