package com.questrail.archon.client;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.codec.ArchonCommandEncoder;
import com.questrail.archon.protocol.model.ConfigEntry;
import com.questrail.archon.protocol.model.ParameterEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ArchonConfigurationMemory
 * =============================================================================
 * Host-side mirror of the controller's line-indexed configuration memory.
 *
 * <p>Entries are numbered by position when a configuration is loaded and the
 * numbering is stable for the session. {@code PARAMETERn=name=value} lines are
 * indexed a second time by parameter name; a parameter and its backing
 * configuration line always carry the same value.</p>
 *
 * <h2>Write path</h2>
 * <ul>
 *   <li>Unknown keys and names are {@link ArchonException.Validation} errors.</li>
 *   <li>Writing the value already held sends nothing and returns {@code false}.</li>
 *   <li>Otherwise a {@code WCONFIG} is sent and, only when it succeeds, the
 *       mirror is updated and {@code true} returned. A failed write leaves the
 *       mirror untouched and propagates the channel error.</li>
 * </ul>
 */
public final class ArchonConfigurationMemory
{
    private static final Logger log = LoggerFactory.getLogger(ArchonConfigurationMemory.class);

    public static final String BIGBUF = "BIGBUF";

    private final ArchonCommandChannel channel;

    // guarded by this
    private final Map<String, ConfigEntry> byKey = new LinkedHashMap<>();
    private final Map<Integer, ConfigEntry> byLine = new HashMap<>();
    private final Map<String, ParameterEntry> parameters = new LinkedHashMap<>();

    public ArchonConfigurationMemory(ArchonCommandChannel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Replaces the mirror with the given ordered entries. Nothing is sent.
     *
     * @param entries key/value pairs in configuration order; line numbers are their positions
     */
    public synchronized void load(List<Map.Entry<String, String>> entries) {
        if (entries.size() > ConfigEntry.MAX_LINE + 1) {
            throw new ArchonException.Validation("too many configuration lines: " + entries.size());
        }
        byKey.clear();
        byLine.clear();
        parameters.clear();
        int line = 0;
        for (Map.Entry<String, String> e : entries) {
            ConfigEntry entry = new ConfigEntry(line, e.getKey(), e.getValue());
            byKey.put(entry.key(), entry);
            byLine.put(line, entry);
            ParameterEntry p = ParameterEntry.parse(line, entry.key(), entry.value());
            if (p != null) {
                parameters.put(p.name(), p);
            }
            line++;
        }
        log.debug("Loaded {} configuration lines, {} parameters", byKey.size(), parameters.size());
    }

    /**
     * Writes a configuration key.
     *
     * @return {@code true} when a WCONFIG was sent and accepted, {@code false} when the value was unchanged
     */
    public synchronized boolean writeConfig(String key, String value) {
        Objects.requireNonNull(value, "value");
        ConfigEntry entry = byKey.get(key);
        if (entry == null) {
            throw new ArchonException.Validation("configuration key not found: " + key);
        }
        if (entry.value().equals(value)) {
            log.debug("config key {}={} not written: no change", key, value);
            return false;
        }

        channel.send(ArchonCommandEncoder.writeConfig(entry.line(), key, value));

        ConfigEntry updated = entry.withValue(value);
        byKey.put(key, updated);
        byLine.put(updated.line(), updated);
        ParameterEntry p = ParameterEntry.parse(updated.line(), key, value);
        parameters.values().removeIf(old -> old.line() == updated.line());
        if (p != null) {
            parameters.put(p.name(), p);
        }
        return true;
    }

    public boolean writeConfig(String key, int value) {
        return writeConfig(key, Integer.toString(value));
    }

    /**
     * Writes a parameter through its backing {@code PARAMETERn} line.
     *
     * @return {@code true} when a WCONFIG was sent and accepted, {@code false} when the value was unchanged
     */
    public synchronized boolean writeParameter(String name, String value) {
        Objects.requireNonNull(value, "value");
        ParameterEntry p = parameters.get(name);
        if (p == null) {
            throw new ArchonException.Validation("parameter not found: " + name);
        }
        if (p.value().equals(value)) {
            log.debug("parameter {}={} not written: no change", name, value);
            return false;
        }

        ParameterEntry updated = p.withValue(value);
        ConfigEntry backing = updated.toConfigEntry();
        channel.send(ArchonCommandEncoder.writeConfig(backing));

        parameters.put(name, updated);
        byKey.put(backing.key(), backing);
        byLine.put(backing.line(), backing);
        return true;
    }

    /**
     * Reads one line back from the controller.
     *
     * @return the controller's {@code key=value} text for the line
     */
    public String readConfig(int line) {
        synchronized (this) {
            if (!byLine.containsKey(line)) {
                throw new ArchonException.Validation("configuration line not found: " + line);
            }
        }
        return channel.send(ArchonCommandEncoder.readConfig(line));
    }

    public synchronized Optional<ConfigEntry> entry(String key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public synchronized Optional<ConfigEntry> line(int line) {
        return Optional.ofNullable(byLine.get(line));
    }

    public synchronized Optional<ParameterEntry> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    /**
     * Entries in line order, as uploaded to the controller.
     */
    public synchronized List<ConfigEntry> entries() {
        return new ArrayList<>(byKey.values());
    }

    public synchronized int size() {
        return byKey.size();
    }

    /**
     * Whether the loaded configuration selects the two-buffer ring.
     */
    public synchronized boolean bigBuffer() {
        ConfigEntry e = byKey.get(BIGBUF);
        return e != null && "1".equals(e.value().trim());
    }
}
