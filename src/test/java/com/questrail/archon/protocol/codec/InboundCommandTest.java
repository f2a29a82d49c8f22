package com.questrail.archon.protocol.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class InboundCommandTest
{
    @Test
    void parseSplitsReferenceAndCommand()
    {
        InboundCommand in = InboundCommand.parse(">3ASTATUS\r\n").orElseThrow();
        assertEquals(0x3A, in.ref().value());
        assertEquals("STATUS", in.command());
        assertTrue(in.is("STATUS"));
    }

    @Test
    void linesWithoutPrefixAreIgnored()
    {
        assertTrue(InboundCommand.parse("STATUS").isEmpty());
        assertTrue(InboundCommand.parse(">Z1STATUS").isEmpty());
        assertTrue(InboundCommand.parse(">1").isEmpty());
    }

    @Test
    void repliesEchoTheReference()
    {
        InboundCommand in = InboundCommand.parse(">0APOWERON").orElseThrow();
        assertEquals("<0A\n", new String(in.success(""), StandardCharsets.US_ASCII));
        assertEquals("?0Abad\n", new String(in.error("bad"), StandardCharsets.US_ASCII));
    }

    @Test
    void keyValueTokensKeepOrder()
    {
        Map<String, String> values = KeyValueTokens.parse("A=1 B= C=x=y");
        assertEquals("1", values.get("A"));
        assertEquals("", values.get("B"));
        assertEquals("x=y", values.get("C"));
        assertEquals("A=1 B= C=x=y", KeyValueTokens.format(values));
    }
}
