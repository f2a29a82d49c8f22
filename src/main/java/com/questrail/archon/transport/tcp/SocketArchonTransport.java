package com.questrail.archon.transport.tcp;

import com.questrail.archon.transport.ArchonTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PushbackInputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Objects;

/**
 * SocketArchonTransport
 * -----------------------------------------------------------------------------
 * {@link ArchonTransport} over a blocking {@link Socket}.
 *
 * <p>{@link #poll(int)} is implemented by reading one byte under a socket
 * timeout and pushing it back, so a following {@link #read} returns it
 * immediately. Reads use the timeout of the most recent poll.</p>
 *
 * <p>Not thread-safe; the command channel serializes access.</p>
 */
public final class SocketArchonTransport implements ArchonTransport
{
    private static final Logger log = LoggerFactory.getLogger(SocketArchonTransport.class);

    private final String host;
    private final int port;
    private final int connectTimeoutMillis;

    private Socket socket;
    private PushbackInputStream in;
    private OutputStream out;
    private boolean endOfStream;

    public SocketArchonTransport(String host, int port, int connectTimeoutMillis) {
        this.host = Objects.requireNonNull(host, "host");
        if (port <= 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (connectTimeoutMillis < 0) {
            throw new IllegalArgumentException("connectTimeoutMillis must be >= 0");
        }
        this.port = port;
        this.connectTimeoutMillis = connectTimeoutMillis;
    }

    @Override
    public void connect() throws IOException {
        if (isOpen()) {
            return;
        }
        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.setKeepAlive(true);
            s.connect(new InetSocketAddress(host, port), connectTimeoutMillis);
        }
        catch (IOException e) {
            s.close();
            throw e;
        }
        InputStream raw = s.getInputStream();
        this.socket = s;
        this.in = new PushbackInputStream(new BufferedInputStream(raw), 1);
        this.out = new BufferedOutputStream(s.getOutputStream());
        this.endOfStream = false;
        log.debug("Connected to Archon at {}:{}", host, port);
    }

    @Override
    public boolean poll(int timeoutMillis) throws IOException {
        requireOpen();
        if (endOfStream || in.available() > 0) {
            return true;
        }
        // a zero socket timeout means infinite, so a non-blocking check uses 1 ms
        socket.setSoTimeout(Math.max(1, timeoutMillis));
        try {
            int b = in.read();
            if (b < 0) {
                endOfStream = true;
            } else {
                in.unread(b);
            }
            return true;
        }
        catch (SocketTimeoutException e) {
            return false;
        }
    }

    @Override
    public int read(byte[] buffer, int offset, int len) throws IOException {
        requireOpen();
        if (endOfStream) {
            return -1;
        }
        int n = in.read(buffer, offset, len);
        if (n < 0) {
            endOfStream = true;
        }
        return n;
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        requireOpen();
        out.write(bytes);
        out.flush();
    }

    @Override
    public boolean isOpen() {
        return socket != null && !socket.isClosed();
    }

    @Override
    public void close() {
        Socket s = socket;
        socket = null;
        if (s == null) {
            return;
        }
        try {
            s.close();
            log.debug("Closed Archon connection {}:{}", host, port);
        }
        catch (IOException e) {
            log.warn("Error closing Archon connection {}:{}", host, port, e);
        }
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }

    private void requireOpen() throws IOException {
        if (!isOpen()) {
            throw new IOException("not connected to " + host + ":" + port);
        }
    }
}
