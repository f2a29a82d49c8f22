package com.questrail.archon.emulator;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.model.ConfigEntry;
import com.questrail.archon.protocol.model.ParameterEntry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Configuration memory of the emulated controller, indexed by line number
 * and, for {@code PARAMETERn} lines, by parameter name.
 *
 * <p>Writes are serialized; reads see either the old or the new entry.</p>
 */
public final class EmulatedConfigurationMemory
{
    private final Map<Integer, ConfigEntry> lines = new TreeMap<>();
    private final Map<String, ParameterEntry> parameters = new HashMap<>();

    /**
     * Stores a line. {@code PARAMETERn=name=value} lines (but not {@code PARAMETERS=})
     * are indexed by name as well and must have exactly three {@code =}-separated parts.
     *
     * @throws ArchonException.Validation on a malformed parameter line
     */
    public synchronized ConfigEntry write(int line, String key, String value) {
        if (key.startsWith("PARAMETER") && !key.equals("PARAMETERS")) {
            ParameterEntry p = ParameterEntry.parse(line, key, value);
            if (p == null || p.value().contains("=")) {
                throw new ArchonException.Validation("expected PARAMETERn=name=value but got " + key + "=" + value);
            }
            parameters.values().removeIf(old -> old.line() == line);
            parameters.put(p.name(), p);
        } else {
            parameters.values().removeIf(old -> old.line() == line);
        }
        ConfigEntry entry = new ConfigEntry(line, key, value);
        lines.put(line, entry);
        return entry;
    }

    /**
     * @return {@code key=value} for the line
     * @throws ArchonException.Validation when the line was never written
     */
    public synchronized String read(int line) {
        ConfigEntry e = lines.get(line);
        if (e == null) {
            throw new ArchonException.Validation("line " + ConfigEntry.hexLine(line) + " not found in configuration memory");
        }
        return e.text();
    }

    /**
     * Sets a parameter and its backing line to {@code value}.
     *
     * @throws ArchonException.Validation when no such parameter was loaded
     */
    public synchronized ParameterEntry writeParameter(String name, String value) {
        ParameterEntry p = parameters.get(name);
        if (p == null) {
            throw new ArchonException.Validation(name + " not found in parameter memory");
        }
        ParameterEntry updated = p.withValue(value);
        parameters.put(name, updated);
        lines.put(updated.line(), updated.toConfigEntry());
        return updated;
    }

    public synchronized Optional<ParameterEntry> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public synchronized Optional<ConfigEntry> line(int line) {
        return Optional.ofNullable(lines.get(line));
    }

    /**
     * Forgets everything ({@code CLEARCONFIG}).
     */
    public synchronized void clear() {
        lines.clear();
        parameters.clear();
    }

    public synchronized int size() {
        return lines.size();
    }
}
