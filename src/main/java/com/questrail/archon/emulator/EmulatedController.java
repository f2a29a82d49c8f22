package com.questrail.archon.emulator;

import com.questrail.archon.internal.time.MonotonicClock;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.ArchonVerbs;
import com.questrail.archon.protocol.codec.FrameStatusCodec;
import com.questrail.archon.protocol.model.BufferDescriptor;
import com.questrail.archon.protocol.model.ConfigEntry;
import com.questrail.archon.protocol.model.RingGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * EmulatedController
 * =============================================================================
 * Device state of one emulated Archon: configuration memory, frame ring,
 * exposure sequencer, power flag and image geometry.
 *
 * <p>The command dispatcher ({@link ArchonEmulator}) calls in here for every
 * verb with an effect. Failures are reported as {@link ArchonException}s and
 * become {@code ?} replies; none of them leave partial state behind.</p>
 *
 * <h2>Configuration hooks</h2>
 * <ul>
 *   <li>{@code BIGBUF}: ring of 2 ({@code 1}) or 3 buffers, base addresses reset</li>
 *   <li>{@code TAPLINES}, {@code PIXELCOUNT}, {@code LINECOUNT}: image geometry</li>
 * </ul>
 *
 * <h2>Parameter hooks</h2>
 * <ul>
 *   <li>expose parameter &gt; 0: start that many exposures</li>
 *   <li>abort parameter &gt; 0: abort the running exposure</li>
 *   <li>{@code exptime}: exposure time; {@code longexposure=1} makes it seconds</li>
 * </ul>
 */
public final class EmulatedController implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(EmulatedController.class);

    public static final String BIGBUF = "BIGBUF";
    public static final String TAPLINES = "TAPLINES";
    public static final String PIXELCOUNT = "PIXELCOUNT";
    public static final String LINECOUNT = "LINECOUNT";
    public static final String EXPTIME = "exptime";
    public static final String LONGEXPOSURE = "longexposure";

    private static final String SYSTEM_HEADER = "[SYSTEM]";

    private final EmulatorConfig config;
    private final MonotonicClock clock;
    private final long startNanos;

    private final EmulatedConfigurationMemory memory = new EmulatedConfigurationMemory();
    private final EmulatedFrameRing ring = new EmulatedFrameRing();
    private final ExposureSequencer sequencer;
    private final Object parameterLock = new Object();

    private volatile boolean powerOn;
    private volatile ExposureTiming timing = ExposureTiming.NONE;
    private volatile int tapLines = -1;
    private volatile int pixelCount = -1;
    private volatile int lineCount = -1;

    public EmulatedController(EmulatorConfig config,
                              ExecutorService exposureExecutor,
                              MonotonicClock clock,
                              ArchonObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startNanos = clock.nowNanos();
        this.sequencer = new ExposureSequencer(ring, exposureExecutor, clock, this::timerTicks, sink);
    }

    /**
     * Controller with a dedicated daemon thread for exposures.
     */
    public static EmulatedController create(EmulatorConfig config, MonotonicClock clock, ArchonObservabilitySink sink) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "archon-exposure");
            t.setDaemon(true);
            return t;
        });
        return new EmulatedController(config, executor, clock, sink);
    }

    // ---------------------------------------------------------------------
    // Reports
    // ---------------------------------------------------------------------

    /**
     * Contents of the system file without its {@code [SYSTEM]} header, lines joined by spaces.
     */
    public String systemReport() {
        Path file = config.system().orElseThrow(
                () -> new ArchonException.Validation("no EMULATOR_SYSTEM file configured"));
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.ISO_8859_1);
        }
        catch (IOException e) {
            log.error("Cannot read system file {}", file, e);
            throw new ArchonException.Validation("cannot read system file " + file);
        }
        return lines.stream()
                .map(String::trim)
                .filter(l -> !l.isEmpty() && !l.equals(SYSTEM_HEADER))
                .collect(Collectors.joining(" "));
    }

    public String statusReport() {
        return "VALID=1 COUNT=1 LOG=0 POWER=" + (powerOn ? 1 : 0) + " POWERGOOD=1 OVERHEAT=0 BACKPLANE_TEMP=40"
                + " P2V5_V=2.5 P2V5_I=0 P5V_V=5 P5V_I=0 P6V_V=6 P6V_I=0 N6V_V=-6 N6V_I=0"
                + " P17V_V=17 P17V_I=0 N17V_V=-17 N17V_I=0 P35V_V=35 P35V_I=0 N35V_V=-35 N35V_I=0"
                + " P100V_V=100 P100V_I=0 N100V_V=-100 N100V_I=0 USER_V=0 USER_I=0 HEATER_V=0 HEATER_I=0 FANTACH=0";
    }

    /**
     * Controller timer: 10 ns ticks since the emulator started.
     */
    public long timerTicks() {
        return (clock.nowNanos() - startNanos) / 10L;
    }

    public String timerReport() {
        return "TIMER=" + FrameStatusCodec.hex16(timerTicks());
    }

    /**
     * @throws ArchonException.Validation before a {@code BIGBUF} line has been written
     */
    public String frameReport() {
        return FrameStatusCodec.encode(ring.snapshot(FrameStatusCodec.hex16(timerTicks())));
    }

    // ---------------------------------------------------------------------
    // Configuration memory
    // ---------------------------------------------------------------------

    public void writeConfig(int line, String key, String value) {
        Integer hookValue = null;
        if (key.equals(BIGBUF) || key.equals(TAPLINES) || key.equals(PIXELCOUNT) || key.equals(LINECOUNT)) {
            hookValue = parseInt(key, value);
        }
        memory.write(line, key, value);
        if (hookValue == null) {
            return;
        }
        switch (key) {
            case BIGBUF -> ring.configure(hookValue == 1);
            case TAPLINES -> tapLines = hookValue;
            case PIXELCOUNT -> pixelCount = hookValue;
            case LINECOUNT -> lineCount = hookValue;
            default -> { }
        }
    }

    public String readConfig(int line) {
        return memory.read(line);
    }

    public void clearConfig() {
        memory.clear();
    }

    /**
     * Writes a parameter and applies its side effects.
     *
     * @throws ArchonException.Validation for an unknown name, a non-numeric value
     *         where a number is needed, or an exposure that cannot start
     */
    public void writeParameter(String name, String value) {
        // check, store and start as one step across connections
        synchronized (parameterLock) {
            applyParameter(name, value);
        }
    }

    private void applyParameter(String name, String value) {
        boolean expose = name.equals(config.exposeParam());
        boolean abort = name.equals(config.abortParam());
        boolean numeric = expose || abort || name.equals(EXPTIME) || name.equals(LONGEXPOSURE);
        int n = numeric ? parseInt(name, value) : 0;

        if (expose && n > 0) {
            // a rejected start leaves memory unchanged
            plan(n);
            if (sequencer.isExposing()) {
                throw new ArchonException.Validation("exposure already in progress");
            }
        }

        memory.writeParameter(name, value);

        if (expose && n > 0) {
            sequencer.start(plan(n));
        }
        if (abort && n > 0) {
            sequencer.abort();
        }
        if (name.equals(EXPTIME)) {
            timing = timing.withExposureTime(Math.max(0, n));
            log.debug("exptime = {} {}", timing.exposureTime(), timing.unit());
        }
        if (name.equals(LONGEXPOSURE)) {
            timing = timing.withLongExposure(n == 1);
            log.debug("exptime = {} {}", timing.exposureTime(), timing.unit());
        }
    }

    private ExposurePlan plan(int exposures) {
        ring.geometry();  // fails until BIGBUF is written
        int width = pixelCount > 0 ? pixelCount * Math.max(1, tapLines) : 0;
        int height = Math.max(0, lineCount);
        return new ExposurePlan(exposures, config.framesPerExposure(), timing.exposureMillis(),
                config.readoutTimeMillis(), width, height);
    }

    // ---------------------------------------------------------------------
    // Frame buffers
    // ---------------------------------------------------------------------

    public void lock(int bufferNumber) {
        ring.lock(bufferNumber);
    }

    /**
     * Checks a FETCH request against the configured ring.
     */
    public void checkFetch(long address, long blocks) {
        RingGeometry g = ring.geometry();
        if (blocks <= 0 || blocks > g.maxBlocks()) {
            throw new ArchonException.Validation("block count " + blocks + " outside range {1:" + g.maxBlocks() + "}");
        }
        if (address < g.minAddress() || address > g.maxAddress()) {
            throw new ArchonException.Validation(String.format("address 0x%X outside range", address));
        }
    }

    /**
     * One block of emulated image data.
     *
     * <p>Samples are 16-bit little-endian values of {@link #patternSample(int, long)},
     * seeded with the frame number of the buffer whose base address is {@code address}
     * (0 when no buffer starts there).</p>
     */
    public byte[] fetchBlock(long address, long block) {
        int frame = ring.bufferAt(address).map(BufferDescriptor::frameNumber).orElse(0);
        byte[] data = new byte[ArchonVerbs.BLOCK_LEN];
        long first = block * (ArchonVerbs.BLOCK_LEN / 2);
        for (int i = 0; i < data.length / 2; i++) {
            int sample = patternSample(frame, first + i);
            data[2 * i] = (byte) sample;
            data[2 * i + 1] = (byte) (sample >>> 8);
        }
        return data;
    }

    /**
     * Test pattern value of the sample at {@code index} for a frame.
     */
    public static int patternSample(int frameNumber, long index) {
        return (int) ((frameNumber * 1000L + index) & 0xFFFF);
    }

    // ---------------------------------------------------------------------
    // Power and accessors
    // ---------------------------------------------------------------------

    public void powerOn() {
        powerOn = true;
    }

    public void powerOff() {
        powerOn = false;
    }

    public boolean isPowerOn() {
        return powerOn;
    }

    public EmulatedConfigurationMemory memory() {
        return memory;
    }

    public EmulatedFrameRing frameRing() {
        return ring;
    }

    public ExposureSequencer sequencer() {
        return sequencer;
    }

    public ExposureTiming timing() {
        return timing;
    }

    public Optional<ConfigEntry> line(int line) {
        return memory.line(line);
    }

    @Override
    public void close() {
        sequencer.close();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new ArchonException.Validation(key + " requires an integer but got \"" + value + "\"");
        }
    }
}
