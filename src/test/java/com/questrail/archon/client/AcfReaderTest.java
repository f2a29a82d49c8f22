package com.questrail.archon.client;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AcfReaderTest
{
    @Test
    void onlyConfigSectionIsRead() throws Exception
    {
        List<Map.Entry<String, String>> entries =
                AcfReader.read(Path.of(AcfReaderTest.class.getResource("/archon/test.acf").toURI()));

        assertEquals(11, entries.size());
        assertEquals(Map.entry("BIGBUF", "0"), entries.get(0));
        assertTrue(entries.stream().noneMatch(e -> e.getKey().equals("BACKPLANE_TYPE")));
        assertTrue(entries.stream().noneMatch(e -> e.getKey().equals("IGNORED")));
    }

    @Test
    void quotesRemovedAndBackslashesTurned() throws Exception
    {
        List<Map.Entry<String, String>> entries = AcfReader.read(new StringReader(
                "[CONFIG]\nPARAMETER0=\"Expose=0\"\nMOD1\\XVN_V1=\"1.5\"\nCONSTANT0=\n"));

        assertEquals(Map.entry("PARAMETER0", "Expose=0"), entries.get(0));
        assertEquals(Map.entry("MOD1/XVN_V1", "1.5"), entries.get(1));
        assertEquals(Map.entry("CONSTANT0", ""), entries.get(2));
    }

    @Test
    void fileWithoutConfigSectionIsEmpty() throws Exception
    {
        assertTrue(AcfReader.read(new StringReader("[SYSTEM]\nA=1\n")).isEmpty());
    }
}
