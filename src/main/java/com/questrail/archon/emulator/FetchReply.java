package com.questrail.archon.emulator;

import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.ArchonReplyDecoder;
import com.questrail.archon.protocol.model.ReferenceId;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * FetchReply
 * -----------------------------------------------------------------------------
 * The block stream that answers one accepted FETCH command.
 *
 * <p>Blocks are produced on demand, one {@code <RR:} header plus
 * {@value ArchonVerbs#BLOCK_LEN} data bytes per call to {@link #next()}, so a
 * transport can pace the stream to what the connection accepts. Not
 * thread-safe; one consumer drains it.</p>
 */
public final class FetchReply
{
    private final EmulatedController controller;
    private final byte[] header;
    private final long address;
    private final long blocks;
    private long produced;

    FetchReply(EmulatedController controller, ReferenceId ref, long address, long blocks) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.header = ArchonReplyDecoder.blockHeader(ref);
        this.address = address;
        this.blocks = blocks;
    }

    public boolean hasNext() {
        return produced < blocks;
    }

    /**
     * @return header and data of the next block
     */
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("all " + blocks + " blocks sent");
        }
        byte[] data = controller.fetchBlock(address, produced++);
        byte[] frame = new byte[header.length + data.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(data, 0, frame, header.length, data.length);
        return frame;
    }

    public long blockCount() {
        return blocks;
    }

    public long produced() {
        return produced;
    }

    public long bytesProduced() {
        return produced * (ArchonVerbs.BLOCK_HEADER_LEN + ArchonVerbs.BLOCK_LEN);
    }

    /** Bytes on the wire for the whole reply. */
    public long length() {
        return blocks * (ArchonVerbs.BLOCK_HEADER_LEN + ArchonVerbs.BLOCK_LEN);
    }
}
