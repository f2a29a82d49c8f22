package com.questrail.archon.protocol.model;

import java.util.Locale;

/**
 * ReferenceId
 * -----------------------------------------------------------------------------
 * Rotating message reference used to pair each reply with its command.
 *
 * <p>The value occupies one byte on the wire, rendered as two uppercase hex
 * digits, and wraps from {@code FF} back to {@code 00}.</p>
 */
public record ReferenceId(int value)
{
    public static final ReferenceId INITIAL = new ReferenceId(0);

    public ReferenceId {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("reference id must be 0-255: " + value);
        }
    }

    /**
     * The id used by the command that follows this one.
     */
    public ReferenceId next() {
        return new ReferenceId((value + 1) & 0xFF);
    }

    /**
     * The id of the command that preceded this one.
     */
    public ReferenceId previous() {
        return new ReferenceId((value + 0xFF) & 0xFF);
    }

    /**
     * Two uppercase hex digits, as sent on the wire.
     */
    public String hex() {
        return String.format(Locale.ROOT, "%02X", value);
    }

    /**
     * Parses the two hex digits that follow {@code >} or {@code <}. Case-insensitive.
     *
     * @throws IllegalArgumentException if the text is not exactly two hex digits
     */
    public static ReferenceId parse(String hex) {
        if (hex == null || hex.length() != 2) {
            throw new IllegalArgumentException("reference id must be two hex digits: " + hex);
        }
        try {
            return new ReferenceId(Integer.parseInt(hex, 16));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("reference id must be two hex digits: " + hex, e);
        }
    }

    @Override
    public String toString() {
        return hex();
    }
}
