package com.questrail.archon.protocol.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One line of controller configuration memory.
 *
 * @param line  configuration memory line number, fixed when the configuration is loaded
 * @param key   text before the first {@code =}
 * @param value text after the first {@code =}; may be empty
 */
public record ConfigEntry(int line, String key, String value)
{
    /** Highest line number addressable with four hex digits. */
    public static final int MAX_LINE = 0xFFFF;

    public ConfigEntry {
        if (line < 0 || line > MAX_LINE) {
            throw new IllegalArgumentException("line must be 0-" + MAX_LINE + ": " + line);
        }
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public ConfigEntry withValue(String newValue) {
        return new ConfigEntry(line, key, newValue);
    }

    /**
     * Line number as four uppercase hex digits, as used by WCONFIG and RCONFIG.
     */
    public String lineHex() {
        return hexLine(line);
    }

    /**
     * {@code key=value}, the form RCONFIG returns.
     */
    public String text() {
        return key + "=" + value;
    }

    public static String hexLine(int line) {
        return String.format(Locale.ROOT, "%04X", line);
    }
}
