package com.questrail.archon.client;

import com.questrail.archon.internal.time.MonotonicClock;
import com.questrail.archon.observability.ArchonCommandEvent;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.observability.ArchonTransportEvent;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.ArchonCommandEncoder;
import com.questrail.archon.protocol.codec.ArchonReplyDecoder;
import com.questrail.archon.protocol.model.ReferenceId;
import com.questrail.archon.transport.ArchonTransport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ArchonCommandChannel
 * =============================================================================
 * One host session with an Archon controller: reference id counter, in-flight
 * flag and transport.
 *
 * <h2>Exchange rules</h2>
 * <ul>
 *   <li>Only one exchange is in flight at a time. A caller that finds the
 *       session busy gets {@link ArchonException.Busy}; nothing is written and
 *       the reference id does not move.</li>
 *   <li>The reference id advances exactly once per command written, whatever
 *       the outcome of the exchange. The first command goes out as {@code >01}.</li>
 *   <li>A reply must start with {@code <} and the id of the command just sent.
 *       A {@code ?} reply is a {@link ArchonException.ControllerError}.</li>
 *   <li>FETCH commands are answered with binary blocks instead of a reply line;
 *       they go through {@link #openBulk(String)}, which keeps the session
 *       in flight until the returned {@link BulkRead} is closed.</li>
 * </ul>
 *
 * <h2>Thread safety</h2>
 * <p>Safe to call from several threads. Callers that lose the race are told
 * so with {@link ArchonException.Busy} instead of being queued.</p>
 */
public final class ArchonCommandChannel implements AutoCloseable
{
    private final ArchonTransport transport;
    private final int replyTimeoutMillis;
    private final MonotonicClock clock;
    private final ArchonObservabilitySink sink;

    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    // written only while inFlight is held
    private volatile ReferenceId refId = ReferenceId.INITIAL;

    public ArchonCommandChannel(ArchonTransport transport,
                                int replyTimeoutMillis,
                                MonotonicClock clock,
                                ArchonObservabilitySink sink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (replyTimeoutMillis <= 0) {
            throw new IllegalArgumentException("replyTimeoutMillis must be > 0");
        }
        this.replyTimeoutMillis = replyTimeoutMillis;
    }

    /**
     * Opens the transport.
     *
     * @throws UncheckedIOException if the controller cannot be reached
     */
    public void connect() {
        try {
            transport.connect();
        }
        catch (IOException e) {
            throw new UncheckedIOException("cannot connect to Archon", e);
        }
        sink.onTransportEvent(new ArchonTransportEvent(Instant.now(), ArchonTransportEvent.Kind.CONNECTED, transport.toString()));
    }

    public boolean isConnected() {
        return transport.isOpen();
    }

    /**
     * Sends a command and returns the reply payload, logging at the level its verb calls for.
     */
    public String send(String command) {
        return send(command, ArchonVerbs.isQuiet(command));
    }

    /**
     * Sends a command and returns the payload after the 3-character checksum.
     *
     * @param quiet log the exchange at the lowest level
     * @throws ArchonException.Busy            another exchange is in flight
     * @throws ArchonException.Timeout         no complete reply line within the reply timeout
     * @throws ArchonException.ControllerError the controller answered {@code ?}
     * @throws ArchonException.Mismatch        the reply carries another reference id
     * @throws ArchonException.TransportClosed the controller closed the connection
     * @throws ArchonException.Validation      the command is empty, multi-line or a FETCH
     */
    public String send(String command, boolean quiet) {
        Objects.requireNonNull(command, "command");
        if (ArchonVerbs.isBulk(command)) {
            throw new ArchonException.Validation("FETCH must be sent with openBulk: " + command);
        }
        acquire(command);
        ReferenceId ref = null;
        try {
            ref = writeCommand(command);
            String reply = readReplyLine(command);
            String payload = ArchonReplyDecoder.decode(ref, command, reply);
            sink.onCommand(new ArchonCommandEvent(Instant.now(), ref.hex(), command, payload, true, quiet));
            return payload;
        }
        catch (ArchonException e) {
            if (ref != null) {
                sink.onCommand(new ArchonCommandEvent(Instant.now(), ref.hex(), command, e.getMessage(), false, quiet));
            }
            throw e;
        }
        finally {
            inFlight.set(false);
        }
    }

    /**
     * Writes a FETCH command and hands the session to the returned reader.
     *
     * <p>The session stays in flight until {@link BulkRead#close()}; callers use
     * try-with-resources.</p>
     */
    public BulkRead openBulk(String command) {
        Objects.requireNonNull(command, "command");
        if (!ArchonVerbs.isBulk(command)) {
            throw new ArchonException.Validation("not a FETCH command: " + command);
        }
        acquire(command);
        try {
            ReferenceId ref = writeCommand(command);
            sink.onCommand(new ArchonCommandEvent(Instant.now(), ref.hex(), command, "", true, false));
            return new BulkRead(ref, command);
        }
        catch (RuntimeException e) {
            inFlight.set(false);
            throw e;
        }
    }

    /**
     * Id of the most recently written command; {@code 00} before the first one.
     */
    public ReferenceId referenceId() {
        return refId;
    }

    public boolean isBusy() {
        return inFlight.get();
    }

    @Override
    public void close() {
        if (transport.isOpen()) {
            transport.close();
            sink.onTransportEvent(new ArchonTransportEvent(Instant.now(), ArchonTransportEvent.Kind.DISCONNECTED, transport.toString()));
        }
    }

    private void acquire(String command) {
        if (!inFlight.compareAndSet(false, true)) {
            throw new ArchonException.Busy(command);
        }
    }

    private ReferenceId writeCommand(String command) {
        ReferenceId next = refId.next();
        byte[] frame = ArchonCommandEncoder.encode(next, command);
        refId = next;
        try {
            transport.write(frame);
        }
        catch (IOException e) {
            throw ioFailure(command, e);
        }
        return next;
    }

    private String readReplyLine(String command) {
        return readLine(command, clock.nowNanos(), new ByteArrayOutputStream(64));
    }

    /**
     * Reads up to the next newline, appending to {@code line}, which may already
     * hold the start of the reply.
     */
    private String readLine(String command, long start, ByteArrayOutputStream line) {
        byte[] one = new byte[1];
        try {
            while (true) {
                long remaining = replyTimeoutMillis - clock.millisSince(start);
                if (remaining <= 0 || !transport.poll((int) remaining)) {
                    throw new ArchonException.Timeout("timeout waiting for reply to " + command);
                }
                int n = transport.read(one, 0, 1);
                if (n < 0) {
                    throw new ArchonException.TransportClosed("controller closed the connection during " + command);
                }
                if (n == 0) {
                    continue;
                }
                if (one[0] == '\n') {
                    break;
                }
                line.write(one[0]);
            }
        }
        catch (IOException e) {
            throw ioFailure(command, e);
        }
        return ArchonReplyDecoder.trimLineEnd(line.toString(StandardCharsets.US_ASCII));
    }

    private void readFully(String command, byte[] buffer, int offset, int len, long startNanos) {
        int done = 0;
        try {
            while (done < len) {
                long remaining = replyTimeoutMillis - clock.millisSince(startNanos);
                if (remaining <= 0 || !transport.poll((int) remaining)) {
                    throw new ArchonException.Timeout("timeout after " + done + " of " + len + " bytes of " + command);
                }
                int n = transport.read(buffer, offset + done, len - done);
                if (n < 0) {
                    throw new ArchonException.TransportClosed("controller closed the connection during " + command);
                }
                done += n;
            }
        }
        catch (IOException e) {
            throw ioFailure(command, e);
        }
    }

    private RuntimeException ioFailure(String command, IOException e) {
        if (e instanceof InterruptedIOException) {
            return new ArchonException.Timeout("timeout during " + command + ": " + e.getMessage());
        }
        return new UncheckedIOException("I/O error during " + command, e);
    }

    /**
     * BulkRead
     * -------------------------------------------------------------------------
     * Reader for the blocks that answer one FETCH command.
     *
     * <p>Each call to {@link #readBlock} consumes one {@code <RR:} header and
     * {@value ArchonVerbs#BLOCK_LEN} data bytes. Closing releases the session;
     * the release happens exactly once however often {@code close()} is called.</p>
     */
    public final class BulkRead implements AutoCloseable
    {
        private final ReferenceId ref;
        private final String command;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final byte[] header = new byte[ArchonVerbs.BLOCK_HEADER_LEN];

        private BulkRead(ReferenceId ref, String command) {
            this.ref = ref;
            this.command = command;
        }

        /**
         * Reads the next block into {@code destination} at {@code offset}.
         *
         * @throws ArchonException.ControllerError the header starts with {@code ?}
         * @throws ArchonException.Mismatch        the header has the wrong id
         */
        public void readBlock(byte[] destination, int offset) {
            if (!open.get()) {
                throw new IllegalStateException("bulk read already closed");
            }
            if (offset < 0 || offset + ArchonVerbs.BLOCK_LEN > destination.length) {
                throw new IndexOutOfBoundsException("block at " + offset + " does not fit " + destination.length + " bytes");
            }
            long start = clock.nowNanos();
            readFully(command, header, 0, header.length, start);
            if (header[0] == '?') {
                throw controllerError(start);
            }
            ArchonReplyDecoder.checkBlockHeader(ref, command, header);
            readFully(command, destination, offset, ArchonVerbs.BLOCK_LEN, start);
        }

        public ReferenceId referenceId() {
            return ref;
        }

        // the controller answers a refused FETCH with one ?RR line instead of blocks
        private ArchonException controllerError(long start) {
            ByteArrayOutputStream line = new ByteArrayOutputStream(64);
            int end = 0;
            while (end < header.length && header[end] != '\n') {
                end++;
            }
            line.write(header, 0, end);
            String reply = end < header.length
                    ? ArchonReplyDecoder.trimLineEnd(line.toString(StandardCharsets.US_ASCII))
                    : readLine(command, start, line);
            return new ArchonException.ControllerError(command, reply);
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                inFlight.set(false);
            }
        }
    }
}
