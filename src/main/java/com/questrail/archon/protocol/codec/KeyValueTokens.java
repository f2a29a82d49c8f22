package com.questrail.archon.protocol.codec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Splits space-separated {@code KEY=VALUE} reply payloads (FRAME, STATUS, SYSTEM, TIMER).
 */
public final class KeyValueTokens
{
    private KeyValueTokens() {}

    /**
     * Parses a payload into an ordered map. Tokens without {@code =} are skipped;
     * a token with an empty value maps to the empty string. The last occurrence
     * of a duplicated key wins.
     */
    public static Map<String, String> parse(String payload) {
        Map<String, String> values = new LinkedHashMap<>();
        if (payload == null || payload.isBlank()) {
            return values;
        }
        for (String token : payload.trim().split("\\s+")) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            values.put(token.substring(0, eq), token.substring(eq + 1));
        }
        return values;
    }

    /**
     * Inverse of {@link #parse(String)}.
     */
    public static String format(Map<String, String> values) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        return sb.toString();
    }
}
