package org.abstractica.nexus.impl.protocol;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes user-supplied text before it is stored or relayed.
 */
public final class TextSanitizer
{
    private static final Pattern MARKUP = Pattern.compile("[<>]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextSanitizer() {}

    /**
     * Trims and clamps a display name.
     *
     * @param raw       the proposed name
     * @param maxLength maximum length in chars
     * @return the stored form, or empty if nothing is left
     */
    public static Optional<String> displayName(String raw, int maxLength)
    {
        if (raw == null)
        {
            return Optional.empty();
        }
        String name = clamp(raw.trim(), maxLength);
        return name.isEmpty() ? Optional.empty() : Optional.of(name);
    }

    /**
     * Sanitizes a chat message: trim, clamp, strip angle brackets, collapse
     * whitespace runs to a single space.
     *
     * @param raw       the raw message
     * @param maxLength maximum length in chars
     * @return the relayed form, or empty if nothing is left
     */
    public static Optional<String> chatMessage(String raw, int maxLength)
    {
        if (raw == null)
        {
            return Optional.empty();
        }
        String message = clamp(raw.trim(), maxLength);
        message = MARKUP.matcher(message).replaceAll("");
        message = WHITESPACE_RUN.matcher(message).replaceAll(" ").trim();
        return message.isEmpty() ? Optional.empty() : Optional.of(message);
    }

    /**
     * Truncates to at most {@code maxLength} chars without splitting a surrogate pair.
     */
    static String clamp(String text, int maxLength)
    {
        if (text.length() <= maxLength)
        {
            return text;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1)))
        {
            end--;
        }
        return text.substring(0, end);
    }
}
