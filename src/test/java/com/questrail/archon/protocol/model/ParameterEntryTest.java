package com.questrail.archon.protocol.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ParameterEntryTest
{
    @Test
    void parseSplitsNameAndValue()
    {
        ParameterEntry p = ParameterEntry.parse(7, "PARAMETER3", "exptime=250");
        assertNotNull(p);
        assertEquals(7, p.line());
        assertEquals("PARAMETER3", p.slot());
        assertEquals("exptime", p.name());
        assertEquals("250", p.value());
        assertEquals("PARAMETER3=exptime=250", p.composite());
    }

    @Test
    void parameterCountIsNotAParameter()
    {
        assertNull(ParameterEntry.parse(4, "PARAMETERS", "4"));
        assertNull(ParameterEntry.parse(4, "LINECOUNT", "a=b"));
        assertNull(ParameterEntry.parse(4, "PARAMETER0", "novalue"));
    }

    @Test
    void backingEntryKeepsLineAndComposite()
    {
        ParameterEntry p = new ParameterEntry(12, "PARAMETER1", "abort", "0").withValue("1");
        ConfigEntry e = p.toConfigEntry();
        assertEquals(12, e.line());
        assertEquals("PARAMETER1", e.key());
        assertEquals("abort=1", e.value());
        assertEquals("000C", e.lineHex());
        assertEquals("PARAMETER1=abort=1", e.text());
    }
}
