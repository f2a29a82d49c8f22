package com.questrail.archon.protocol.codec;

import com.questrail.archon.protocol.model.ReferenceId;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * A command as received by a controller: its reference id and command text.
 *
 * <p>This is the controller side of {@link ArchonCommandEncoder}. Replies are
 * built with {@link #success(String)} and {@link #error(String)}.</p>
 */
public record InboundCommand(ReferenceId ref, String command)
{
    public InboundCommand {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(command, "command");
    }

    /**
     * Parses {@code >RRcommand}. CR and LF are discarded.
     *
     * @return empty for blank lines, lines not starting with {@code >}, or a malformed id;
     *         the controller ignores those silently
     */
    public static Optional<InboundCommand> parse(String line) {
        String text = line.replace("\r", "").replace("\n", "");
        if (text.length() < 3 || text.charAt(0) != '>') {
            return Optional.empty();
        }
        try {
            return Optional.of(new InboundCommand(ReferenceId.parse(text.substring(1, 3)), text.substring(3)));
        }
        catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean is(String verb) {
        return command.equals(verb);
    }

    public boolean startsWith(String verb) {
        return command.startsWith(verb);
    }

    /** {@code <RR} + payload + newline. */
    public byte[] success(String payload) {
        return ("<" + ref.hex() + payload + "\n").getBytes(StandardCharsets.US_ASCII);
    }

    /** {@code ?RR} + details + newline. */
    public byte[] error(String details) {
        return ("?" + ref.hex() + details + "\n").getBytes(StandardCharsets.US_ASCII);
    }
}
