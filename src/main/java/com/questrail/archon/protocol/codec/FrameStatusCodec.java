package com.questrail.archon.protocol.codec;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.model.BufferDescriptor;
import com.questrail.archon.protocol.model.BufferMode;
import com.questrail.archon.protocol.model.FrameRingState;
import com.questrail.archon.protocol.model.RingGeometry;
import com.questrail.archon.protocol.model.SampleMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * FrameStatusCodec
 * -----------------------------------------------------------------------------
 * Reads and writes the payload of a FRAME reply.
 *
 * <p>The payload is a flat sequence of space-separated {@code KEY=VALUE}
 * tokens:</p>
 * <pre>
 *   TIMER=hhhhhhhhhhhhhhhh RBUF=n WBUF=n
 *   BUF1SAMPLE=.. BUF1COMPLETE=.. BUF1MODE=.. BUF1BASE=.. BUF1FRAME=..
 *   BUF1WIDTH=.. BUF1HEIGHT=.. BUF1PIXELS=.. BUF1LINES=.. BUF1RAWBLOCKS=..
 *   BUF1RAWLINES=.. BUF1RAWOFFSET=.. BUF1TIMESTAMP=.. BUF1RETIMESTAMP=..
 *   BUF1FETIMESTAMP=.. BUF2...
 * </pre>
 *
 * <p>Timestamps are hex, everything else decimal. Keys this codec does not
 * know about, including {@code BUFn} keys for n beyond the ring, are ignored.
 * Missing keys leave the field zeroed.</p>
 */
public final class FrameStatusCodec
{
    private FrameStatusCodec() {}

    /**
     * Builds a ring snapshot from a FRAME payload.
     *
     * @param payload       reply text after the checksum
     * @param geometry      current ring geometry; only buffers 1..N are read
     * @param previousIndex newest index from the previous query
     * @throws ArchonException.Validation if a recognised key has an unparseable value
     */
    public static FrameRingState decode(String payload, RingGeometry geometry, int previousIndex) {
        Map<String, String> tokens = KeyValueTokens.parse(payload);

        String timer = tokens.getOrDefault("TIMER", "");
        int rbuf = intValue(tokens, "RBUF");
        int wbuf = intValue(tokens, "WBUF");

        List<BufferDescriptor> buffers = new ArrayList<>(geometry.size());
        for (int i = 0; i < geometry.size(); i++) {
            String p = "BUF" + (i + 1);
            BufferDescriptor.Builder b = BufferDescriptor.builder();
            try {
                b.sampleMode(SampleMode.fromCode(intValue(tokens, p + "SAMPLE")));
                b.mode(BufferMode.fromCode(intValue(tokens, p + "MODE")));
            }
            catch (IllegalArgumentException e) {
                throw new ArchonException.Validation("malformed FRAME reply: " + e.getMessage());
            }
            b.complete(intValue(tokens, p + "COMPLETE") != 0)
                    .baseAddress(longValue(tokens, p + "BASE", 10))
                    .frameNumber(intValue(tokens, p + "FRAME"))
                    .width(intValue(tokens, p + "WIDTH"))
                    .height(intValue(tokens, p + "HEIGHT"))
                    .pixelsProgress(intValue(tokens, p + "PIXELS"))
                    .linesProgress(intValue(tokens, p + "LINES"))
                    .rawBlocks(intValue(tokens, p + "RAWBLOCKS"))
                    .rawLines(intValue(tokens, p + "RAWLINES"))
                    .rawOffset(intValue(tokens, p + "RAWOFFSET"))
                    .timestamp(longValue(tokens, p + "TIMESTAMP", 16))
                    .risingEdge(longValue(tokens, p + "RETIMESTAMP", 16))
                    .fallingEdge(longValue(tokens, p + "FETIMESTAMP", 16));
            buffers.add(b.build());
        }

        int newest = NewestFrameSelector.select(buffers, previousIndex);
        return new FrameRingState(timer, rbuf, wbuf, buffers, newest);
    }

    /**
     * Renders a ring snapshot as a FRAME payload (no trailing space).
     */
    public static String encode(FrameRingState state) {
        Map<String, String> tokens = new LinkedHashMap<>();
        tokens.put("TIMER", state.timer());
        tokens.put("RBUF", Integer.toString(state.readBuffer()));
        tokens.put("WBUF", Integer.toString(state.writeBuffer()));
        for (int i = 0; i < state.size(); i++) {
            BufferDescriptor b = state.buffer(i);
            String p = "BUF" + (i + 1);
            tokens.put(p + "SAMPLE", Integer.toString(b.sampleMode().code()));
            tokens.put(p + "COMPLETE", b.complete() ? "1" : "0");
            tokens.put(p + "MODE", Integer.toString(b.mode().code()));
            tokens.put(p + "BASE", Long.toString(b.baseAddress()));
            tokens.put(p + "FRAME", Integer.toString(b.frameNumber()));
            tokens.put(p + "WIDTH", Integer.toString(b.width()));
            tokens.put(p + "HEIGHT", Integer.toString(b.height()));
            tokens.put(p + "PIXELS", Integer.toString(b.pixelsProgress()));
            tokens.put(p + "LINES", Integer.toString(b.linesProgress()));
            tokens.put(p + "RAWBLOCKS", Integer.toString(b.rawBlocks()));
            tokens.put(p + "RAWLINES", Integer.toString(b.rawLines()));
            tokens.put(p + "RAWOFFSET", Integer.toString(b.rawOffset()));
            tokens.put(p + "TIMESTAMP", hex16(b.timestamp()));
            tokens.put(p + "RETIMESTAMP", hex16(b.risingEdge()));
            tokens.put(p + "FETIMESTAMP", hex16(b.fallingEdge()));
        }
        return KeyValueTokens.format(tokens);
    }

    public static String hex16(long ticks) {
        return String.format(Locale.ROOT, "%016X", ticks);
    }

    private static int intValue(Map<String, String> tokens, String key) {
        String v = tokens.get(key);
        if (v == null || v.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(v);
        }
        catch (NumberFormatException e) {
            throw new ArchonException.Validation("malformed FRAME value " + key + "=" + v);
        }
    }

    private static long longValue(Map<String, String> tokens, String key, int radix) {
        String v = tokens.get(key);
        if (v == null || v.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(v, radix);
        }
        catch (NumberFormatException e) {
            throw new ArchonException.Validation("malformed FRAME value " + key + "=" + v);
        }
    }
}
