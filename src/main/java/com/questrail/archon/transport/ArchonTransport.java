package com.questrail.archon.transport;

import java.io.IOException;

/**
 * ArchonTransport
 * -----------------------------------------------------------------------------
 * Minimal port for the byte stream between the host and one Archon controller.
 *
 * <p>This port is intentionally small. Framing, reference ids and reply
 * validation live in the command channel above it; the transport only moves
 * bytes.</p>
 *
 * <p>Implementations may be backed by a blocking socket or a test harness.</p>
 */
public interface ArchonTransport extends AutoCloseable
{
    /**
     * Open the connection. Calling {@code connect()} on an open transport is a no-op.
     *
     * @throws IOException if the peer cannot be reached
     */
    void connect() throws IOException;

    /**
     * Wait until at least one byte (or end of stream) is available.
     *
     * @param timeoutMillis maximum wait; 0 checks without blocking
     * @return {@code true} when a subsequent {@link #read} will not block
     */
    boolean poll(int timeoutMillis) throws IOException;

    /**
     * Read up to {@code len} bytes.
     *
     * @return number of bytes read, at least 1, or -1 when the peer has closed the stream
     */
    int read(byte[] buffer, int offset, int len) throws IOException;

    /**
     * Write all of {@code bytes} and flush.
     */
    void write(byte[] bytes) throws IOException;

    boolean isOpen();

    /**
     * Release the connection. Safe to call more than once.
     */
    @Override
    void close();
}
