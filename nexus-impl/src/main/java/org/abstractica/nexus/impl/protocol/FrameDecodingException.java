package org.abstractica.nexus.impl.protocol;

/**
 * Thrown when an inbound frame cannot be decoded at all.
 */
public class FrameDecodingException extends RuntimeException
{
    public FrameDecodingException(String message)
    {
        super(message);
    }

    public FrameDecodingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
