package com.questrail.archon.emulator;

import com.questrail.archon.internal.time.SystemMonotonicClock;
import com.questrail.archon.observability.ArchonCommandEvent;
import com.questrail.archon.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ArchonEmulatorTest
 * -----------------------------------------------------------------------------
 * Line-level dispatch: one command line in, reply bytes out.
 */
final class ArchonEmulatorTest
{
    private EmulatedController controller;
    private RecordingObservabilitySink sink;
    private ArchonEmulator emulator;

    @BeforeEach
    void setUp()
    {
        EmulatorConfig config = EmulatorConfig.builder().withReadoutTimeMillis(20).build();
        sink = new RecordingObservabilitySink();
        controller = EmulatedController.create(config, SystemMonotonicClock.INSTANCE, sink);
        emulator = new ArchonEmulator(controller, sink);
    }

    @AfterEach
    void tearDown()
    {
        controller.close();
    }

    private byte[] send(String line)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        emulator.handle(line, out::writeBytes);
        return out.toByteArray();
    }

    private String reply(String line)
    {
        return new String(send(line), StandardCharsets.US_ASCII);
    }

    private void configure()
    {
        assertEquals("<01\n", reply(">01WCONFIG0000BIGBUF=0"));
        assertEquals("<02\n", reply(">02WCONFIG0001PIXELCOUNT=4"));
        assertEquals("<03\n", reply(">03WCONFIG0002LINECOUNT=2"));
        assertEquals("<04\n", reply(">04WCONFIG0003PARAMETER0=Expose=0"));
        assertEquals("<05\n", reply(">05WCONFIG0004PARAMETER1=abort=0"));
    }

    @Test
    void linesWithoutCommandPrefixGetNoReply()
    {
        assertEquals(0, send("STATUS").length);
        assertEquals(0, send("").length);
    }

    @Test
    void unknownVerbGetsNoReply()
    {
        assertEquals(0, send(">01SELFDESTRUCT").length);
    }

    @Test
    void acknowledgedVerbsEchoReference()
    {
        assertEquals("<1F\n", reply(">1FAPPLYALL"));
        assertEquals("<20\n", reply(">20POLLOFF"));
        assertEquals("<21\n", reply(">21LOADPARAMS"));
        assertEquals("<22\n", reply(">22FASTPREPPARAM Expose 1"));
    }

    @Test
    void statusReportsPower()
    {
        assertTrue(reply(">01STATUS").contains(" POWER=0 "));
        reply(">02POWERON");
        assertTrue(reply(">03STATUS").startsWith("<03VALID=1"));
        assertTrue(reply(">04STATUS").contains(" POWER=1 "));
    }

    @Test
    void timerIsSixteenHexDigits()
    {
        assertTrue(reply(">0ATIMER").matches("<0ATIMER=[0-9A-F]{16}\n"));
    }

    @Test
    void frameBeforeBigBufIsError()
    {
        assertTrue(reply(">01FRAME").startsWith("?01"));
    }

    @Test
    void configRoundTripsThroughRconfig()
    {
        configure();

        assertEquals("<06LINECOUNT=2\n", reply(">06RCONFIG0002"));
        assertEquals("<07PARAMETER0=Expose=0\n", reply(">07RCONFIG0003"));
        assertTrue(reply(">08RCONFIG0099").startsWith("?08"));
    }

    @Test
    void malformedConfigCommandsAreErrors()
    {
        assertTrue(reply(">01WCONFIG0000A").startsWith("?01"));
        assertTrue(reply(">02WCONFIG00Z0ABC=1").startsWith("?02"));
        assertTrue(reply(">03RCONFIG001").startsWith("?03"));
        assertTrue(reply(">04WCONFIG0000LINECOUNT=x").startsWith("?04"));
    }

    @Test
    void frameReportDescribesRing()
    {
        configure();

        String frame = reply(">06FRAME");

        assertTrue(frame.startsWith("<06TIMER="));
        assertTrue(frame.contains(" BUF3BASE=" + 0xE0000000L + " "));
        assertFalse(frame.contains("BUF4"));
    }

    @Test
    void lockValidatesBufferNumber()
    {
        configure();

        assertEquals("<06\n", reply(">06LOCK3"));
        assertTrue(reply(">07LOCK4").startsWith("?07"));
        assertTrue(reply(">08LOCKX").startsWith("?08"));
        assertEquals("<09\n", reply(">09LOCK0"));
    }

    @Test
    void fetchStreamsHeaderedBlocks()
    {
        configure();

        byte[] bytes = send(">06FETCHA000000000000002");

        assertEquals(2 * (4 + 1024), bytes.length);
        assertEquals("<06:", new String(bytes, 0, 4, StandardCharsets.US_ASCII));
        assertEquals("<06:", new String(bytes, 1028, 4, StandardCharsets.US_ASCII));
        int firstOfSecondBlock = (bytes[1032] & 0xFF) | (bytes[1033] & 0xFF) << 8;
        assertEquals(EmulatedController.patternSample(0, 512), firstOfSecondBlock);
    }

    @Test
    void largestFetchIsProducedOnDemand()
    {
        configure();
        long maxBlocks = controller.frameRing().geometry().maxBlocks();
        List<FetchReply> streams = new ArrayList<>();
        ByteArrayOutputStream direct = new ByteArrayOutputStream();

        emulator.handle(String.format(">06FETCHA0000000%08X", maxBlocks), new EmulatorOutput() {
            @Override
            public void write(byte[] bytes)
            {
                direct.writeBytes(bytes);
            }

            @Override
            public void stream(FetchReply reply)
            {
                streams.add(reply);
            }
        });

        assertEquals(0, direct.size());
        assertEquals(1, streams.size());
        FetchReply reply = streams.get(0);
        assertEquals(maxBlocks, reply.blockCount());
        assertEquals(0, reply.produced());
        assertEquals(maxBlocks * 1028, reply.length());

        byte[] first = reply.next();
        assertEquals(1028, first.length);
        assertEquals("<06:", new String(first, 0, 4, StandardCharsets.US_ASCII));
        assertEquals(1, reply.produced());
        assertTrue(reply.hasNext());
    }

    @Test
    void malformedFetchIsError()
    {
        configure();

        assertTrue(reply(">06FETCHA0000000").startsWith("?06"));
        assertTrue(reply(">07FETCH9000000000000001").startsWith("?07"));
        assertTrue(reply(">08FETCHA000000000000000").startsWith("?08"));
    }

    @Test
    void loadParamStartsExposure() throws Exception
    {
        configure();

        assertEquals("<06\n", reply(">06LOADPARAM Expose 1"));
        assertTrue(controller.sequencer().awaitIdle(2, TimeUnit.SECONDS));
        assertEquals(1, controller.frameRing().frameCounter());
        assertEquals("<07PARAMETER0=Expose=1\n", reply(">07RCONFIG0003"));
    }

    @Test
    void exposeBeforeBigBufIsError()
    {
        reply(">01WCONFIG0000PARAMETER0=Expose=0");

        assertTrue(reply(">02FASTLOADPARAM Expose 1").startsWith("?02"));
        assertEquals("<03PARAMETER0=Expose=0\n", reply(">03RCONFIG0000"));
    }

    @Test
    void unknownParameterIsError()
    {
        configure();

        assertTrue(reply(">06FASTLOADPARAM nosuch 1").startsWith("?06"));
        assertTrue(reply(">07LOADPARAM Expose").startsWith("?07"));
    }

    @Test
    void fetchLogHasNoEntries()
    {
        assertEquals("<01(null)\n", reply(">01FETCHLOG"));
    }

    @Test
    void repliesAreReportedToSink()
    {
        reply(">01POWERON");
        reply(">02FRAME");

        assertEquals(2, sink.getCommands().size());
        ArchonCommandEvent failed = sink.getCommands().get(1);
        assertFalse(failed.success());
        assertTrue(failed.quiet());
    }
}
