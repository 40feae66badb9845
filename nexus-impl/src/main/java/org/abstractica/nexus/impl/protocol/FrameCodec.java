package org.abstractica.nexus.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Encodes and decodes JSON text frames.
 *
 * <p>Wire format: {@code {"type": string, "payload": object}}. Outbound frames
 * additionally carry {@code "ts"}, the server time in epoch milliseconds.</p>
 *
 * <p>Decoding never throws for a well-formed envelope: unknown types become
 * {@link ClientFrame.Unknown} and bad payload fields become
 * {@link ClientFrame.Invalid}. Only text that is not a JSON object with a
 * string {@code type} is rejected with {@link FrameDecodingException}.</p>
 *
 * <p>Thread-safe.</p>
 */
public final class FrameCodec
{
    private final ObjectMapper mapper;

    public FrameCodec()
    {
        this(new ObjectMapper().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS));
    }

    public FrameCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    // ========== Decoding ==========

    /**
     * Decodes an inbound text frame.
     *
     * @param text the raw frame text
     * @return the decoded frame
     * @throws FrameDecodingException if the text is not a valid envelope
     */
    public ClientFrame decode(String text)
    {
        Objects.requireNonNull(text, "text");

        JsonNode root;
        try
        {
            root = mapper.readTree(text);
        }
        catch (JsonProcessingException e)
        {
            throw new FrameDecodingException("Frame is not valid JSON", e);
        }

        if (root == null || !root.isObject())
        {
            throw new FrameDecodingException("Frame is not a JSON object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual())
        {
            throw new FrameDecodingException("Frame has no string type");
        }

        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject())
        {
            payload = mapper.createObjectNode();
        }

        String type = typeNode.asText();
        return switch (type)
        {
            case "join" -> new ClientFrame.Join(optionalText(payload.get("name")));
            case "move" -> decodeMove(payload);
            case "rename" -> optionalText(payload.get("name"))
                    .<ClientFrame>map(ClientFrame.Rename::new)
                    .orElseGet(() -> new ClientFrame.Invalid(type, "missing name"));
            case "ping" -> new ClientFrame.Ping();
            case "chat" -> decodeChat(payload);
            default -> new ClientFrame.Unknown(type);
        };
    }

    private static ClientFrame decodeMove(JsonNode payload)
    {
        double x = parseNumber(payload.get("x"));
        double y = parseNumber(payload.get("y"));
        if (!Double.isFinite(x) || !Double.isFinite(y))
        {
            return new ClientFrame.Invalid("move", "coordinates must be finite numbers");
        }
        return new ClientFrame.Move(x, y);
    }

    private static ClientFrame decodeChat(JsonNode payload)
    {
        JsonNode message = payload.get("message");
        if (message == null || !message.isTextual())
        {
            return new ClientFrame.Invalid("chat", "message must be a string");
        }
        return new ClientFrame.Chat(message.asText());
    }

    /**
     * Parses a JSON number or numeric string.
     *
     * @return the value, or NaN if the node holds no number
     */
    private static double parseNumber(JsonNode node)
    {
        if (node == null || node.isNull())
        {
            return Double.NaN;
        }
        if (node.isNumber())
        {
            return node.asDouble();
        }
        if (node.isTextual())
        {
            String text = node.asText().trim();
            if (text.isEmpty())
            {
                return Double.NaN;
            }
            try
            {
                return Double.parseDouble(text);
            }
            catch (NumberFormatException e)
            {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /**
     * Reads a scalar as trimmed text.
     *
     * @return the text, or empty if absent, not a scalar, or blank
     */
    private static Optional<String> optionalText(JsonNode node)
    {
        if (node == null || node.isNull() || node.isContainerNode())
        {
            return Optional.empty();
        }
        String text = node.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    // ========== Encoding ==========

    /**
     * Encodes an outbound frame.
     *
     * @param frame the frame to encode
     * @param nowMs the server timestamp to attach
     * @return JSON text
     */
    public String encode(ServerFrame frame, long nowMs)
    {
        Objects.requireNonNull(frame, "frame");

        ObjectNode root = mapper.createObjectNode();
        root.put("type", frame.type());
        root.set("payload", mapper.valueToTree(frame));
        root.put("ts", nowMs);

        try
        {
            return mapper.writeValueAsString(root);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalStateException("Failed to encode frame: " + frame.type(), e);
        }
    }
}
