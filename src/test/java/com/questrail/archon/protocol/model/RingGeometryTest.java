package com.questrail.archon.protocol.model;

import com.questrail.archon.protocol.ArchonException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RingGeometryTest
{
    @Test
    void bigBufferHasTwoBuffers()
    {
        RingGeometry g = RingGeometry.forBigBuffer(true);
        assertEquals(2, g.size());
        assertEquals(0xA0000000L, g.baseAddress(0));
        assertEquals(0xD0000000L, g.baseAddress(1));
        assertEquals(1_500_000_000L / 2 / 1024, g.maxBlocks());
    }

    @Test
    void normalBufferHasThreeBuffers()
    {
        RingGeometry g = RingGeometry.forBigBuffer(false);
        assertEquals(3, g.size());
        assertEquals(0xA0000000L, g.baseAddress(0));
        assertEquals(0xC0000000L, g.baseAddress(1));
        assertEquals(0xE0000000L, g.baseAddress(2));
        assertEquals(1_500_000_000L / 3 / 1024, g.maxBlocks());
    }

    @Test
    void addressRangeEndsAfterLastBase()
    {
        RingGeometry g = RingGeometry.forBigBuffer(false);
        assertEquals(0xA0000000L, g.minAddress());
        assertEquals(0xE0000000L + g.maxBlocks(), g.maxAddress());
    }

    @Test
    void indexOutsideRingIsValidationError()
    {
        RingGeometry g = RingGeometry.forBigBuffer(true);
        assertThrows(ArchonException.Validation.class, () -> g.checkIndex(2));
        assertThrows(ArchonException.Validation.class, () -> g.checkIndex(-1));
        assertDoesNotThrow(() -> g.checkIndex(1));
    }

    @Test
    void onlyTwoOrThreeBuffersAllowed()
    {
        assertThrows(IllegalArgumentException.class, () -> new RingGeometry(4));
    }
}
