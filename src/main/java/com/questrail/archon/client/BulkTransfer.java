package com.questrail.archon.client;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.ArchonCommandEncoder;
import com.questrail.archon.protocol.model.RingGeometry;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * BulkTransfer
 * -----------------------------------------------------------------------------
 * Reads raw controller memory with FETCH.
 *
 * <p>The request is validated against the ring geometry before anything is
 * sent. The address must lie in {@code [0xA0000000, lastBase + maxBlocks]} and
 * the block count must not exceed {@code 1.5e9 / N / 1024}. Blocks are then
 * read one by one; a bad header aborts the transfer. The session is released
 * when the transfer ends, normally or not.</p>
 */
public final class BulkTransfer
{
    private final ArchonCommandChannel channel;
    private final Supplier<RingGeometry> geometry;

    public BulkTransfer(ArchonCommandChannel channel, Supplier<RingGeometry> geometry) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.geometry = Objects.requireNonNull(geometry, "geometry");
    }

    /**
     * Number of FETCH blocks needed to cover {@code bytes}, rounded up.
     */
    public static long blocksFor(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be >= 0: " + bytes);
        }
        return (bytes + ArchonVerbs.BLOCK_LEN - 1) / ArchonVerbs.BLOCK_LEN;
    }

    /**
     * @throws ArchonException.Validation when the address or block count is out of range
     */
    public static void validate(RingGeometry geometry, long address, long blocks) {
        if (address < geometry.minAddress() || address > geometry.maxAddress()) {
            throw new ArchonException.Validation(String.format(
                    "requested address 0x%X outside range {0x%X:0x%X}",
                    address, geometry.minAddress(), geometry.maxAddress()));
        }
        if (blocks <= 0 || blocks > geometry.maxBlocks()) {
            throw new ArchonException.Validation(
                    "requested block count " + blocks + " outside range {1:" + geometry.maxBlocks() + "}");
        }
    }

    /**
     * Fetches {@code blocks} blocks starting at {@code address}.
     *
     * @return {@code blocks * 1024} bytes
     */
    public byte[] fetch(long address, long blocks) {
        validate(geometry.get(), address, blocks);
        byte[] data = new byte[Math.toIntExact(blocks * ArchonVerbs.BLOCK_LEN)];
        try (ArchonCommandChannel.BulkRead read = channel.openBulk(ArchonCommandEncoder.fetch(address, blocks))) {
            for (int i = 0; i < blocks; i++) {
                read.readBlock(data, i * ArchonVerbs.BLOCK_LEN);
            }
        }
        return data;
    }
}
