package com.questrail.vault.protocol.model;

import java.util.Optional;

/**
 * Direction of a vault protocol message.
 *
 * <p>On the wire the direction is the first three ASCII bytes of every frame.</p>
 */
public enum Direction
{
    REQUEST("req"),
    RESPONSE("res");

    private final String tag;

    Direction(String tag)
    {
        this.tag = tag;
    }

    /**
     * The three-character ASCII wire tag.
     */
    public String tag()
    {
        return tag;
    }

    /**
     * Resolves a wire tag.
     *
     * @return the direction, or {@link Optional#empty()} for anything other
     *         than {@code req} / {@code res}
     */
    public static Optional<Direction> fromTag(String tag)
    {
        for (Direction d : values()) {
            if (d.tag.equals(tag)) {
                return Optional.of(d);
            }
        }
        return Optional.empty();
    }
}
