package com.questrail.archon.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * KeyValueConfigFile
 * -----------------------------------------------------------------------------
 * Server configuration in {@code KEY=VALUE} lines.
 *
 * <pre>
 *   # comment line
 *   ARCHON_IP=localhost
 *   ARCHON_PORT=3032               # trailing comment
 * </pre>
 *
 * <p>Blank lines and lines starting with {@code #} are skipped, as is anything
 * after a {@code #} on a value line. Keys and values are trimmed. The last
 * occurrence of a repeated key wins.</p>
 */
public final class KeyValueConfigFile
{
    private final Map<String, String> values;

    private KeyValueConfigFile(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static KeyValueConfigFile load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public static KeyValueConfigFile parse(String text) {
        try {
            return parse(new StringReader(text));
        }
        catch (IOException e) {
            throw new IllegalStateException("unexpected I/O error reading a string", e);
        }
    }

    /**
     * @throws IllegalArgumentException on a non-comment line without {@code =} or with an empty key
     */
    public static KeyValueConfigFile parse(Reader reader) throws IOException {
        Map<String, String> values = new LinkedHashMap<>();
        BufferedReader in = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String line;
        int number = 0;
        while ((line = in.readLine()) != null) {
            number++;
            int hash = line.indexOf('#');
            String text = (hash >= 0 ? line.substring(0, hash) : line).trim();
            if (text.isEmpty()) {
                continue;
            }
            int eq = text.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("line " + number + ": expected KEY=VALUE but got \"" + text + "\"");
            }
            values.put(text.substring(0, eq).trim(), text.substring(eq + 1).trim());
        }
        return new KeyValueConfigFile(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getString(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * @throws IllegalArgumentException when the value is present but not an integer
     */
    public int getInt(String key, int defaultValue) {
        String v = values.get(key);
        if (v == null || v.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + v, e);
        }
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, String> asMap() {
        return values;
    }
}
