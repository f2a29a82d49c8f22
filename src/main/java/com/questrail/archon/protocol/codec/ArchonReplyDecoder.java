package com.questrail.archon.protocol.codec;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.model.ReferenceId;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ArchonReplyDecoder
 * -----------------------------------------------------------------------------
 * Classifies inbound reply lines and FETCH block headers.
 *
 * <ul>
 *   <li>{@code ?...}: controller error, surfaced verbatim</li>
 *   <li>{@code <RR...}: success when RR is the id of the command sent</li>
 *   <li>anything else: command/reply mismatch</li>
 * </ul>
 */
public final class ArchonReplyDecoder
{
    /** Length of the {@code <RR} checksum prefix. */
    public static final int CHECKSUM_LEN = 3;

    private ArchonReplyDecoder() {}

    /**
     * Validates a reply line (without its newline) and strips the checksum.
     *
     * @param expected id of the command that was sent
     * @param command  command text, for diagnostics
     * @param reply    reply line with trailing CR/LF removed
     * @return payload following the checksum, possibly empty
     */
    public static String decode(ReferenceId expected, String command, String reply) {
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(reply, "reply");

        if (reply.startsWith("?")) {
            throw new ArchonException.ControllerError(command, reply);
        }

        String checksum = "<" + expected.hex();
        if (reply.length() < CHECKSUM_LEN || !reply.startsWith(checksum)) {
            throw new ArchonException.Mismatch(checksum, reply);
        }
        return reply.substring(CHECKSUM_LEN);
    }

    /**
     * The 4-byte header that must precede every FETCH block: {@code <RR:}.
     */
    public static byte[] blockHeader(ReferenceId ref) {
        return ("<" + ref.hex() + ":").getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Validates a FETCH block header.
     *
     * @throws ArchonException.ControllerError if the header starts with {@code ?}
     * @throws ArchonException.Mismatch        if it is not {@code <RR:} for the expected id
     */
    public static void checkBlockHeader(ReferenceId expected, String command, byte[] header) {
        if (header.length != ArchonVerbs.BLOCK_HEADER_LEN) {
            throw new IllegalArgumentException("block header must be " + ArchonVerbs.BLOCK_HEADER_LEN + " bytes");
        }
        String text = new String(header, StandardCharsets.US_ASCII);
        if (text.charAt(0) == '?') {
            throw new ArchonException.ControllerError(command, text);
        }
        String wanted = "<" + expected.hex() + ":";
        if (!text.equals(wanted)) {
            throw new ArchonException.Mismatch(wanted, text);
        }
    }

    /**
     * Removes trailing CR and LF characters.
     */
    public static String trimLineEnd(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
