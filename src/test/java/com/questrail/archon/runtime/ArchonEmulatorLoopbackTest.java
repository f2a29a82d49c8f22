package com.questrail.archon.runtime;

import com.questrail.archon.client.ArchonClientConfig;
import com.questrail.archon.client.ArchonController;
import com.questrail.archon.client.FrameData;
import com.questrail.archon.emulator.EmulatedController;
import com.questrail.archon.emulator.EmulatorConfig;
import com.questrail.archon.observability.ArchonTransportEvent;
import com.questrail.archon.observability.NullObservabilitySink;
import com.questrail.archon.observability.RecordingObservabilitySink;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.model.FrameRingState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ArchonEmulatorLoopbackTest
 * -----------------------------------------------------------------------------
 * Client and emulator over a real TCP connection on the loopback interface.
 *
 * <p>The emulator binds an ephemeral port; the client connects with
 * {@link ArchonController#overTcp}. Everything the client sees travels
 * through the Netty pipeline and the socket transport.</p>
 */
final class ArchonEmulatorLoopbackTest
{
    private RecordingObservabilitySink emulatorSink;
    private ArchonEmulatorRuntime runtime;
    private ArchonController client;

    private static Path resource(String name) throws Exception
    {
        return Path.of(ArchonEmulatorLoopbackTest.class.getResource(name).toURI());
    }

    @BeforeEach
    void setUp() throws Exception
    {
        emulatorSink = new RecordingObservabilitySink();
        runtime = ArchonEmulatorRuntime.builder()
                .withConfig(EmulatorConfig.builder()
                        .withPort(0)
                        .withReadoutTimeMillis(40)
                        .withSystemFile(resource("/archon/test.system"))
                        .build())
                .withBindHost("127.0.0.1")
                .withObservabilitySink(emulatorSink)
                .build();
        runtime.start();

        ArchonClientConfig config = ArchonClientConfig.builder()
                .withHost("127.0.0.1")
                .withPort(runtime.port())
                .withReplyTimeoutMillis(2000)
                .withReadoutTimeoutMillis(3000)
                .build();
        client = ArchonController.overTcp(config, NullObservabilitySink.INSTANCE);
        client.open();
    }

    @AfterEach
    void tearDown()
    {
        if (client != null) {
            client.close();
        }
        if (runtime != null) {
            runtime.stop();
        }
    }

    @Test
    void exposureFrameArrivesOverTcp() throws Exception
    {
        client.loadConfiguration(resource("/archon/test.acf"), true);
        assertEquals("1", client.system().get("BACKPLANE_TYPE"));

        client.expose(1);
        FrameRingState state = client.awaitNewFrame(0);
        assertEquals(1, state.newestCompleteFrame());

        FrameData frame = client.readNewestFrame();

        assertEquals(8, frame.width());
        assertEquals(4, frame.height());
        assertEquals(EmulatedController.patternSample(1, 0), frame.sample16(0, 0));
        assertEquals(EmulatedController.patternSample(1, 31), frame.sample16(7, 3));
        assertEquals(1, runtime.controller().frameRing().frameCounter());
    }

    @Test
    void controllerErrorKeepsSessionUsable() throws Exception
    {
        client.loadConfiguration(resource("/archon/test.acf"), true);

        assertThrows(ArchonException.ControllerError.class, () -> client.command("RCONFIG0FFF"));
        assertEquals("LINECOUNT=4", client.readConfig(1));
    }

    @Test
    void fullFetchBlockStreamsOverTcp() throws Exception
    {
        client.loadConfiguration(resource("/archon/test.acf"), true);

        byte[] data = client.fetch(0xA0000000L, 3);

        assertEquals(3 * 1024, data.length);
        int last = (data[3 * 1024 - 2] & 0xFF) | (data[3 * 1024 - 1] & 0xFF) << 8;
        assertEquals(EmulatedController.patternSample(0, 3 * 512 - 1), last);
    }

    @Test
    void refusedFetchLeavesSessionInStep()
    {
        ArchonException.ControllerError e =
                assertThrows(ArchonException.ControllerError.class, () -> client.fetch(0xA0000000L, 1));

        assertTrue(e.reply().startsWith("?01"), e.reply());
        assertTrue(e.reply().length() > 4, e.reply());
        for (int i = 0; i < 3; i++) {
            assertTrue(client.command("TIMER").startsWith("TIMER="));
        }
    }

    @Test
    void longFetchIsPacedByTheConnection() throws Exception
    {
        client.loadConfiguration(resource("/archon/test.acf"), true);
        int blocks = 4096;

        byte[] data = client.fetch(0xA0000000L, blocks);

        assertEquals(blocks * 1024, data.length);
        int last = (data[blocks * 1024 - 2] & 0xFF) | (data[blocks * 1024 - 1] & 0xFF) << 8;
        assertEquals(EmulatedController.patternSample(0, blocks * 512L - 1), last);
        assertEquals("TIMER=", client.command("TIMER").substring(0, 6));
    }

    @Test
    void emulatorReportsListening()
    {
        assertTrue(client.isOpen());
        assertTrue(emulatorSink.getAllEvents().stream()
                .anyMatch(e -> e instanceof ArchonTransportEvent t && t.kind() == ArchonTransportEvent.Kind.LISTENING));
    }

    @Test
    void connectToClosedPortFails() throws Exception
    {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        ArchonController unreachable = ArchonController.overTcp(
                ArchonClientConfig.builder().withHost("127.0.0.1").withPort(port).withConnectTimeoutMillis(500).build(),
                NullObservabilitySink.INSTANCE);

        assertThrows(UncheckedIOException.class, unreachable::open);
        assertFalse(unreachable.isOpen());
    }
}
