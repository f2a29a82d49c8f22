package com.questrail.archon.protocol.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ReferenceIdTest
{
    @Test
    void nextWrapsFromFfToZero()
    {
        assertEquals(new ReferenceId(0x00), new ReferenceId(0xFF).next());
        assertEquals(new ReferenceId(0x01), ReferenceId.INITIAL.next());
    }

    @Test
    void previousWrapsFromZeroToFf()
    {
        assertEquals(new ReferenceId(0xFF), ReferenceId.INITIAL.previous());
    }

    @Test
    void hexIsTwoUppercaseDigits()
    {
        assertEquals("0A", new ReferenceId(10).hex());
        assertEquals("FF", new ReferenceId(255).hex());
    }

    @Test
    void parseAcceptsEitherCase()
    {
        assertEquals(new ReferenceId(0xAB), ReferenceId.parse("ab"));
        assertEquals(new ReferenceId(0xAB), ReferenceId.parse("AB"));
    }

    @Test
    void parseRejectsWrongLengthOrDigits()
    {
        assertThrows(IllegalArgumentException.class, () -> ReferenceId.parse("1"));
        assertThrows(IllegalArgumentException.class, () -> ReferenceId.parse("123"));
        assertThrows(IllegalArgumentException.class, () -> ReferenceId.parse("G1"));
        assertThrows(IllegalArgumentException.class, () -> new ReferenceId(256));
    }
}
