package com.questrail.archon.transport;

import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * FakeArchonTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link ArchonTransport} implementation.
 *
 * <p>Records every command line written and serves inbound bytes from a queue.
 * A {@link Responder} may be installed to produce the reply for each written
 * line; otherwise tests inject inbound bytes directly. {@link #poll(int)} never
 * waits: an empty queue reports "nothing readable", which the channel treats
 * as a timeout.</p>
 */
public final class FakeArchonTransport implements ArchonTransport {

    /**
     * Produces the bytes the controller would send back for one command line.
     */
    @FunctionalInterface
    public interface Responder {
        /**
         * @param line the command as written, without the trailing newline
         * @return reply bytes to enqueue, or {@code null} for silence
         */
        byte[] reply(String line);
    }

    private final Deque<Byte> inbound = new ArrayDeque<>();
    private final List<String> written = new ArrayList<>();
    private Responder responder;
    private boolean open;
    private boolean peerClosed;
    private int connects;
    private volatile CountDownLatch pollGate;
    private volatile CountDownLatch pollEntered;

    @Override
    public synchronized void connect() {
        open = true;
        connects++;
    }

    @Override
    public boolean poll(int timeoutMillis) throws InterruptedIOException {
        CountDownLatch gate = pollGate;
        if (gate != null) {
            CountDownLatch entered = pollEntered;
            if (entered != null) {
                entered.countDown();
            }
            try {
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    return false;
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted in poll");
            }
        }
        synchronized (this) {
            return !inbound.isEmpty() || peerClosed;
        }
    }

    @Override
    public synchronized int read(byte[] buffer, int offset, int len) {
        if (inbound.isEmpty()) {
            return peerClosed ? -1 : 0;
        }
        int n = 0;
        while (n < len && !inbound.isEmpty()) {
            buffer[offset + n] = inbound.poll();
            n++;
        }
        return n;
    }

    @Override
    public void write(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.US_ASCII);
        String line = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        Responder r;
        synchronized (this) {
            written.add(line);
            r = responder;
        }
        if (r != null) {
            byte[] reply = r.reply(line);
            if (reply != null) {
                inject(reply);
            }
        }
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void close() {
        open = false;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized void respondWith(Responder responder) {
        this.responder = responder;
    }

    public synchronized void inject(byte[] bytes) {
        for (byte b : bytes) {
            inbound.add(b);
        }
    }

    public void inject(String text) {
        inject(text.getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Simulates the controller closing its end once queued bytes are drained.
     */
    public synchronized void closeFromPeer() {
        peerClosed = true;
    }

    /**
     * Holds every {@link #poll(int)} until {@code gate} opens. {@code entered}
     * counts down when a poll starts waiting.
     */
    public void holdPolls(CountDownLatch gate, CountDownLatch entered) {
        this.pollEntered = entered;
        this.pollGate = gate;
    }

    public synchronized List<String> written() {
        return new ArrayList<>(written);
    }

    public synchronized String lastWritten() {
        return written.isEmpty() ? null : written.get(written.size() - 1);
    }

    public synchronized int connects() {
        return connects;
    }

    public synchronized void clear() {
        written.clear();
    }

    /**
     * Responder that acknowledges every command with an empty {@code <RR} reply.
     */
    public static Responder acknowledgeAll() {
        return line -> ("<" + line.substring(1, 3) + "\n").getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Responder that answers every command with {@code <RR} followed by {@code payload}.
     */
    public static Responder replyWith(String payload) {
        return line -> ("<" + line.substring(1, 3) + payload + "\n").getBytes(StandardCharsets.US_ASCII);
    }
}
