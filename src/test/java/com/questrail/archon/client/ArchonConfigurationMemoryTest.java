package com.questrail.archon.client;

import com.questrail.archon.observability.NullObservabilitySink;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.time.ManualMonotonicClock;
import com.questrail.archon.transport.FakeArchonTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ArchonConfigurationMemoryTest
{
    private FakeArchonTransport transport;
    private ArchonConfigurationMemory memory;

    @BeforeEach
    void setUp()
    {
        transport = new FakeArchonTransport();
        transport.respondWith(FakeArchonTransport.acknowledgeAll());
        ArchonCommandChannel channel =
                new ArchonCommandChannel(transport, 100, new ManualMonotonicClock(), NullObservabilitySink.INSTANCE);
        channel.connect();
        memory = new ArchonConfigurationMemory(channel);
        memory.load(List.of(
                Map.entry("BIGBUF", "1"),
                Map.entry("LINECOUNT", "4"),
                Map.entry("PARAMETERS", "2"),
                Map.entry("PARAMETER0", "Expose=0"),
                Map.entry("PARAMETER1", "exptime=100")));
    }

    @Test
    void linesNumberedInFileOrder()
    {
        assertEquals(5, memory.size());
        assertEquals(1, memory.entry("LINECOUNT").orElseThrow().line());
        assertEquals("PARAMETER1", memory.line(4).orElseThrow().key());
        assertTrue(memory.bigBuffer());
        assertEquals("100", memory.parameter("exptime").orElseThrow().value());
        assertTrue(memory.parameter("PARAMETERS").isEmpty());
    }

    @Test
    void changedValueIsWrittenToLine()
    {
        assertTrue(memory.writeConfig("LINECOUNT", 2048));

        assertEquals(List.of(">01WCONFIG0001LINECOUNT=2048"), transport.written());
        assertEquals("2048", memory.entry("LINECOUNT").orElseThrow().value());
    }

    @Test
    void unchangedValueSendsNothing()
    {
        assertFalse(memory.writeConfig("LINECOUNT", "4"));
        assertFalse(memory.writeParameter("exptime", "100"));
        assertTrue(transport.written().isEmpty());
    }

    @Test
    void unknownKeyIsValidationError()
    {
        assertThrows(ArchonException.Validation.class, () -> memory.writeConfig("NOSUCHKEY", "1"));
        assertThrows(ArchonException.Validation.class, () -> memory.writeParameter("nosuch", "1"));
        assertThrows(ArchonException.Validation.class, () -> memory.readConfig(99));
        assertTrue(transport.written().isEmpty());
    }

    @Test
    void parameterWriteUpdatesCompositeLine()
    {
        assertTrue(memory.writeParameter("Expose", "3"));

        assertEquals(List.of(">01WCONFIG0003PARAMETER0=Expose=3"), transport.written());
        assertEquals("Expose=3", memory.entry("PARAMETER0").orElseThrow().value());
        assertEquals("3", memory.parameter("Expose").orElseThrow().value());
    }

    @Test
    void rawWriteOfParameterLineUpdatesParameterIndex()
    {
        memory.writeConfig("PARAMETER1", "longexposure=1");

        assertTrue(memory.parameter("exptime").isEmpty());
        assertEquals("1", memory.parameter("longexposure").orElseThrow().value());
    }

    @Test
    void rawWriteWithoutNameDropsParameterOfThatLine()
    {
        memory.writeConfig("PARAMETER1", "unused");

        assertTrue(memory.parameter("exptime").isEmpty());
        assertEquals("unused", memory.line(4).orElseThrow().value());
        assertEquals("0", memory.parameter("Expose").orElseThrow().value());
        assertThrows(ArchonException.Validation.class, () -> memory.writeParameter("exptime", "200"));
    }

    @Test
    void failedWriteLeavesMirrorUnchanged()
    {
        transport.respondWith(line -> ("?" + line.substring(1, 3) + "\n").getBytes(StandardCharsets.US_ASCII));

        assertThrows(ArchonException.ControllerError.class, () -> memory.writeConfig("LINECOUNT", "8"));
        assertEquals("4", memory.entry("LINECOUNT").orElseThrow().value());
    }

    @Test
    void readConfigReturnsControllerText()
    {
        transport.respondWith(FakeArchonTransport.replyWith("LINECOUNT=4"));

        assertEquals("LINECOUNT=4", memory.readConfig(1));
        assertEquals(">01RCONFIG0001", transport.lastWritten());
    }
}
