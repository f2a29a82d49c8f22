package com.questrail.archon.client;

import com.questrail.archon.api.DetectorController;
import com.questrail.archon.internal.time.MonotonicClock;
import com.questrail.archon.internal.time.SystemMonotonicClock;
import com.questrail.archon.observability.ArchonErrorEvent;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.ArchonCommandEncoder;
import com.questrail.archon.protocol.codec.KeyValueTokens;
import com.questrail.archon.protocol.model.BufferDescriptor;
import com.questrail.archon.protocol.model.ConfigEntry;
import com.questrail.archon.protocol.model.FrameRingState;
import com.questrail.archon.transport.ArchonTransport;
import com.questrail.archon.transport.tcp.SocketArchonTransport;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ArchonController
 * =============================================================================
 * Archon implementation of {@link DetectorController}.
 *
 * <p>Owns one {@link ArchonCommandChannel} session and the three views built on
 * it: {@link ArchonConfigurationMemory}, {@link FrameRing} and
 * {@link BulkTransfer}. All protocol errors surface as
 * {@link ArchonException} subtypes; {@link ArchonException.Busy} is passed to
 * the caller except in {@link #awaitNewFrame}, which polls and therefore retries.</p>
 *
 * <h2>Typical sequence</h2>
 * <pre>
 *   controller.open();
 *   controller.loadConfiguration(acf, true);
 *   controller.applyAll();
 *   controller.powerOn();
 *   controller.expose(1);
 *   FrameRingState ready = controller.awaitNewFrame(lastFrame, timeout);
 *   FrameData image = controller.readNewestFrame();
 * </pre>
 */
public final class ArchonController implements DetectorController
{
    private final ArchonClientConfig config;
    private final ArchonCommandChannel channel;
    private final ArchonConfigurationMemory memory;
    private final FrameRing ring;
    private final BulkTransfer bulk;
    private final MonotonicClock clock;
    private final ArchonObservabilitySink sink;

    public ArchonController(ArchonClientConfig config,
                            ArchonTransport transport,
                            MonotonicClock clock,
                            ArchonObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.channel = new ArchonCommandChannel(transport, config.replyTimeoutMillis(), clock, sink);
        this.memory = new ArchonConfigurationMemory(channel);
        this.ring = new FrameRing(channel);
        this.bulk = new BulkTransfer(channel, ring::geometry);
    }

    /**
     * Controller talking TCP to {@code config.host():config.port()}.
     */
    public static ArchonController overTcp(ArchonClientConfig config, ArchonObservabilitySink sink) {
        SocketArchonTransport transport =
                new SocketArchonTransport(config.host(), config.port(), config.connectTimeoutMillis());
        return new ArchonController(config, transport, SystemMonotonicClock.INSTANCE, sink);
    }

    // ---------------------------------------------------------------------
    // DetectorController
    // ---------------------------------------------------------------------

    @Override
    public void open() {
        if (!channel.isConnected()) {
            channel.connect();
        }
    }

    @Override
    public boolean isOpen() {
        return channel.isConnected();
    }

    @Override
    public String command(String command) {
        return channel.send(command);
    }

    @Override
    public FrameRingState readStatus() {
        return ring.refreshStatus();
    }

    @Override
    public byte[] fetch(long address, long blocks) {
        return bulk.fetch(address, blocks);
    }

    @Override
    public void close() {
        channel.close();
    }

    // ---------------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------------

    /**
     * Loads the {@code [CONFIG]} section of an ACF file into configuration memory.
     *
     * <p>With {@code upload} set the whole configuration is written to the
     * controller between {@code POLLOFF} and {@code POLLON}, after a
     * {@code CLEARCONFIG}. The frame ring is then resized from {@code BIGBUF}.</p>
     *
     * @throws IOException if the file cannot be read
     */
    public void loadConfiguration(Path acf, boolean upload) throws IOException {
        List<Map.Entry<String, String>> entries = AcfReader.read(acf);
        memory.load(entries);
        if (upload) {
            uploadConfiguration();
        }
        ring.resize(memory.bigBuffer());
    }

    private void uploadConfiguration() {
        channel.send(ArchonVerbs.POLLOFF);
        try {
            channel.send(ArchonVerbs.CLEARCONFIG);
            for (ConfigEntry entry : memory.entries()) {
                channel.send(ArchonCommandEncoder.writeConfig(entry), true);
            }
        }
        catch (ArchonException e) {
            sink.onError(new ArchonErrorEvent(Instant.now(), "configuration upload failed", e));
            try {
                channel.send(ArchonVerbs.POLLON);
            }
            catch (ArchonException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        channel.send(ArchonVerbs.POLLON);
    }

    public ArchonConfigurationMemory configuration() {
        return memory;
    }

    public boolean writeConfig(String key, String value) {
        return memory.writeConfig(key, value);
    }

    public String readConfig(int line) {
        return memory.readConfig(line);
    }

    public boolean writeParameter(String name, String value) {
        return memory.writeParameter(name, value);
    }

    public void applyAll() {
        channel.send(ArchonVerbs.APPLYALL);
    }

    public void loadTiming() {
        channel.send(ArchonVerbs.LOADTIMING);
    }

    public void loadParams() {
        channel.send(ArchonVerbs.LOADPARAMS);
    }

    public void powerOn() {
        channel.send(ArchonVerbs.POWERON);
    }

    public void powerOff() {
        channel.send(ArchonVerbs.POWEROFF);
    }

    /**
     * Loads one parameter into the running timing core with {@code FASTLOADPARAM}.
     */
    public void loadParameter(String name, String value) {
        channel.send(ArchonCommandEncoder.parameterCommand(ArchonVerbs.FASTLOADPARAM, name, value));
    }

    /**
     * Stages one parameter with {@code FASTPREPPARAM}.
     */
    public void prepParameter(String name, String value) {
        channel.send(ArchonCommandEncoder.parameterCommand(ArchonVerbs.FASTPREPPARAM, name, value));
    }

    // ---------------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------------

    /**
     * Controller timer in 10 ns ticks.
     */
    public long timer() {
        String value = KeyValueTokens.parse(channel.send(ArchonVerbs.TIMER)).get("TIMER");
        if (value == null || value.isEmpty()) {
            throw new ArchonException.Validation("TIMER reply has no TIMER key");
        }
        try {
            return Long.parseUnsignedLong(value, 16);
        }
        catch (NumberFormatException e) {
            throw new ArchonException.Validation("malformed TIMER value: " + value);
        }
    }

    public Map<String, String> system() {
        return KeyValueTokens.parse(channel.send(ArchonVerbs.SYSTEM));
    }

    public Map<String, String> status() {
        return KeyValueTokens.parse(channel.send(ArchonVerbs.STATUS));
    }

    public FrameRing frameRing() {
        return ring;
    }

    public ArchonCommandChannel channel() {
        return channel;
    }

    // ---------------------------------------------------------------------
    // Exposure
    // ---------------------------------------------------------------------

    /**
     * Starts {@code exposures} exposures by writing and loading the expose parameter.
     */
    public void expose(int exposures) {
        if (exposures <= 0) {
            throw new ArchonException.Validation("number of exposures must be > 0: " + exposures);
        }
        String value = Integer.toString(exposures);
        memory.writeParameter(config.exposeParam(), value);
        loadParameter(config.exposeParam(), value);
    }

    public void abort() {
        loadParameter(config.abortParam(), "1");
    }

    /**
     * Polls FRAME until the newest complete frame number exceeds {@code lastFrame}.
     *
     * @return the status snapshot that showed the new frame
     * @throws ArchonException.Timeout when no new frame appears within {@code timeoutMillis}
     */
    public FrameRingState awaitNewFrame(int lastFrame, int timeoutMillis) {
        long start = clock.nowNanos();
        while (true) {
            try {
                FrameRingState state = ring.refreshStatus();
                if (state.newestCompleteFrame() > lastFrame) {
                    return state;
                }
            }
            catch (ArchonException.Busy busy) {
                // another caller holds the session; poll again
            }
            if (clock.millisSince(start) >= timeoutMillis) {
                throw new ArchonException.Timeout("no new frame after " + lastFrame + " within " + timeoutMillis + " ms");
            }
            pause();
        }
    }

    public FrameRingState awaitNewFrame(int lastFrame) {
        return awaitNewFrame(lastFrame, config.readoutTimeoutMillis());
    }

    /**
     * Reads the newest complete frame: refresh status, lock its buffer, fetch
     * the image and unlock. The buffer is unlocked whether or not the fetch succeeds.
     *
     * @throws ArchonException.Validation when no buffer holds a complete frame
     */
    public FrameData readNewestFrame() {
        FrameRingState state = ring.refreshStatus();
        int index = state.newestIndex();
        BufferDescriptor buffer = state.newest();
        if (!buffer.complete() || buffer.frameNumber() == 0) {
            throw new ArchonException.Validation("no complete frame in the ring");
        }
        long imageBytes = buffer.imageBytes();
        if (imageBytes <= 0) {
            throw new ArchonException.Validation("buffer " + (index + 1) + " reports an empty image");
        }

        ring.lockBuffer(index);
        byte[] raw;
        try {
            raw = bulk.fetch(buffer.baseAddress(), BulkTransfer.blocksFor(imageBytes));
        }
        catch (RuntimeException e) {
            unlockAfterFailure(e);
            throw e;
        }
        ring.unlock();

        return new FrameData(buffer.frameNumber(), index, buffer.width(), buffer.height(),
                buffer.sampleMode(), Arrays.copyOf(raw, Math.toIntExact(imageBytes)));
    }

    private void unlockAfterFailure(RuntimeException primary) {
        try {
            ring.unlock();
        }
        catch (ArchonException e) {
            primary.addSuppressed(e);
        }
    }

    private void pause() {
        if (config.framePollMillis() == 0) {
            return;
        }
        try {
            Thread.sleep(config.framePollMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchonException.Timeout("interrupted while waiting for a frame");
        }
    }
}
