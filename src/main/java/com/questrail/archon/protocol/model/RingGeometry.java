package com.questrail.archon.protocol.model;

import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;

/**
 * RingGeometry
 * -----------------------------------------------------------------------------
 * Number of frame buffers and their fixed addresses in controller memory.
 *
 * <p>The controller splits its image memory into two buffers when the
 * {@code BIGBUF} configuration flag is set and three otherwise. Buffer 0 always
 * starts at {@code 0xA0000000}; the remaining base addresses depend on the
 * buffer count.</p>
 */
public record RingGeometry(int size)
{
    /** Bytes of controller memory shared by all frame buffers. */
    public static final long IMAGE_MEMORY_BYTES = 1_500_000_000L;

    public static final long BASE_ADDRESS_0 = 0xA0000000L;

    private static final long[] BIG_BUFFER_BASES = { BASE_ADDRESS_0, 0xD0000000L };
    private static final long[] SMALL_BUFFER_BASES = { BASE_ADDRESS_0, 0xC0000000L, 0xE0000000L };

    public RingGeometry {
        if (size != 2 && size != 3) {
            throw new IllegalArgumentException("ring size must be 2 or 3: " + size);
        }
    }

    /**
     * Geometry selected by the {@code BIGBUF} flag.
     */
    public static RingGeometry forBigBuffer(boolean bigBuffer) {
        return new RingGeometry(bigBuffer ? 2 : 3);
    }

    public boolean bigBuffer() {
        return size == 2;
    }

    /**
     * Base address of the buffer at a 0-based index.
     *
     * @throws ArchonException.Validation when the index is outside the ring
     */
    public long baseAddress(int index) {
        checkIndex(index);
        return (bigBuffer() ? BIG_BUFFER_BASES : SMALL_BUFFER_BASES)[index];
    }

    /**
     * @throws ArchonException.Validation when the index is outside {@code [0, size)}
     */
    public void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new ArchonException.Validation(
                    "buffer index " + index + " outside range {0:" + (size - 1) + "}");
        }
    }

    /** Largest FETCH block count for a single buffer. */
    public long maxBlocks() {
        return IMAGE_MEMORY_BYTES / size / ArchonVerbs.BLOCK_LEN;
    }

    public long minAddress() {
        return BASE_ADDRESS_0;
    }

    /** Highest address a FETCH may start from. */
    public long maxAddress() {
        return baseAddress(size - 1) + maxBlocks();
    }
}
