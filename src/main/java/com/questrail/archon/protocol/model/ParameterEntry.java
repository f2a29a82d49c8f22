package com.questrail.archon.protocol.model;

import java.util.Objects;

/**
 * A named parameter stored in one {@code PARAMETERn} configuration line.
 *
 * <p>The backing {@link ConfigEntry} shares {@link #line()}; its key is
 * {@link #slot()} and its value is {@code name=value}.</p>
 *
 * @param line  configuration memory line holding this parameter
 * @param slot  configuration key, e.g. {@code PARAMETER7}
 * @param name  parameter name used by LOADPARAM and friends
 * @param value current value
 */
public record ParameterEntry(int line, String slot, String name, String value)
{
    public ParameterEntry {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public ParameterEntry withValue(String newValue) {
        return new ParameterEntry(line, slot, name, newValue);
    }

    /**
     * The value stored in the backing configuration line: {@code name=value}.
     */
    public String configValue() {
        return name + "=" + value;
    }

    /**
     * The full configuration text: {@code slot=name=value}.
     */
    public String composite() {
        return slot + "=" + configValue();
    }

    public ConfigEntry toConfigEntry() {
        return new ConfigEntry(line, slot, configValue());
    }

    /**
     * Splits a configuration line into a parameter when it has the
     * {@code PARAMETERn=name=value} shape.
     *
     * <p>{@code PARAMETERS=n} (the parameter count) is not a parameter.</p>
     *
     * @return the parameter, or {@code null} when the key/value pair is not a parameter
     */
    public static ParameterEntry parse(int line, String key, String value) {
        if (!key.startsWith("PARAMETER") || key.equals("PARAMETERS")) {
            return null;
        }
        int eq = value.indexOf('=');
        if (eq < 0) {
            return null;
        }
        return new ParameterEntry(line, key, value.substring(0, eq), value.substring(eq + 1));
    }
}
