package org.abstractica.nexus;

/**
 * The fixed-size coordinate space shared by all participants.
 *
 * @param width  maximum x coordinate
 * @param height maximum y coordinate
 */
public record Room(int width, int height)
{
    public Room
    {
        if (width <= 0 || height <= 0)
        {
            throw new IllegalArgumentException("Room dimensions must be positive: " + width + "x" + height);
        }
    }

    /**
     * Clamps a horizontal coordinate into {@code [0, width]}.
     */
    public int clampX(int x)
    {
        return Math.max(0, Math.min(width, x));
    }

    /**
     * Clamps a vertical coordinate into {@code [0, height]}.
     */
    public int clampY(int y)
    {
        return Math.max(0, Math.min(height, y));
    }
}
