package com.questrail.archon.protocol.codec;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.model.ConfigEntry;
import com.questrail.archon.protocol.model.ReferenceId;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * ArchonCommandEncoder
 * -----------------------------------------------------------------------------
 * Builds outbound command text and frames it for the wire.
 *
 * <p>Every command leaves the host as</p>
 * <pre>
 *   '>' + hex2(reference id) + command text + '\n'
 * </pre>
 * <p>encoded as ASCII. Command bodies never contain a newline.</p>
 */
public final class ArchonCommandEncoder
{
    private ArchonCommandEncoder() {}

    /**
     * Frames one command for transmission.
     *
     * @throws ArchonException.Validation if the command is empty or contains a line break
     */
    public static byte[] encode(ReferenceId ref, String command) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(command, "command");
        if (command.isEmpty() || command.indexOf('\n') >= 0 || command.indexOf('\r') >= 0) {
            throw new ArchonException.Validation("illegal command text: \"" + command + "\"");
        }
        return (">" + ref.hex() + command + "\n").getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * {@code WCONFIGllllKEY=VALUE}
     */
    public static String writeConfig(int line, String key, String value) {
        return ArchonVerbs.WCONFIG + ConfigEntry.hexLine(line) + key + "=" + value;
    }

    public static String writeConfig(ConfigEntry entry) {
        return writeConfig(entry.line(), entry.key(), entry.value());
    }

    /**
     * {@code RCONFIGllll}
     */
    public static String readConfig(int line) {
        return ArchonVerbs.RCONFIG + ConfigEntry.hexLine(line);
    }

    /**
     * {@code FETCHaaaaaaaabbbbbbbb}: address and block count as 8 uppercase hex digits each.
     */
    public static String fetch(long address, long blocks) {
        return String.format(Locale.ROOT, "%s%08X%08X", ArchonVerbs.FETCH, address, blocks);
    }

    /**
     * {@code LOCKn} for a 1-based buffer number; {@code LOCK0} unlocks.
     */
    public static String lock(int bufferNumber) {
        if (bufferNumber < 0) {
            throw new ArchonException.Validation("buffer number must be >= 0: " + bufferNumber);
        }
        return ArchonVerbs.LOCK + bufferNumber;
    }

    /**
     * Parameter verbs take the name and value separated by spaces,
     * e.g. {@code FASTLOADPARAM Expose 1}.
     */
    public static String parameterCommand(String verb, String name, String value) {
        return verb + " " + name + " " + value;
    }
}
