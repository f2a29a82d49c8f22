package com.questrail.archon.emulator;

import com.questrail.archon.internal.time.SystemMonotonicClock;
import com.questrail.archon.observability.ExposureStateEvent;
import com.questrail.archon.observability.RecordingObservabilitySink;
import com.questrail.archon.protocol.ArchonException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExposureSequencerTest
 * -----------------------------------------------------------------------------
 * Runs the sequencer on a real single-thread executor with short readouts.
 */
final class ExposureSequencerTest
{
    private EmulatedFrameRing ring;
    private RecordingObservabilitySink sink;
    private ExposureSequencer sequencer;

    @BeforeEach
    void setUp()
    {
        ring = new EmulatedFrameRing();
        ring.configure(false);
        sink = new RecordingObservabilitySink();
        sequencer = new ExposureSequencer(ring, Executors.newSingleThreadExecutor(),
                SystemMonotonicClock.INSTANCE, () -> 42L, sink);
    }

    @AfterEach
    void tearDown()
    {
        sequencer.close();
    }

    @Test
    void framesCompleteInRingOrder() throws Exception
    {
        BlockingQueue<FrameCompletion> completions = sequencer.subscribe();

        sequencer.start(new ExposurePlan(2, 2, 0, 20, 4, 4));

        for (int expected = 1; expected <= 4; expected++) {
            FrameCompletion c = completions.poll(2, TimeUnit.SECONDS);
            assertNotNull(c, "frame " + expected);
            assertEquals(expected, c.frameNumber());
            assertEquals((expected - 1) % 3, c.bufferIndex());
            assertTrue(c.buffer().complete());
        }
        assertTrue(sequencer.awaitIdle(2, TimeUnit.SECONDS));
        assertEquals(ExposureState.IDLE, sequencer.state());

        List<ExposureStateEvent> events = sink.getExposureEvents();
        assertEquals(ExposureStateEvent.Kind.STARTED, events.get(0).kind());
        assertEquals(ExposureStateEvent.Kind.FINISHED, events.get(events.size() - 1).kind());
        assertEquals(4, events.stream().filter(e -> e.kind() == ExposureStateEvent.Kind.FRAME_COMPLETE).count());
    }

    @Test
    void abortLeavesBufferIncomplete() throws Exception
    {
        sequencer.start(new ExposurePlan(1, 1, 0, 10_000, 4, 4));
        Thread.sleep(100);

        assertTrue(sequencer.abort());
        assertTrue(sequencer.awaitIdle(1, TimeUnit.SECONDS));

        assertEquals(ExposureState.ABORTED, sequencer.state());
        assertFalse(ring.buffer(0).complete());
        assertEquals(0, ring.frameCounter());
    }

    @Test
    void abortDuringExposureWaitStopsWithinOneTick() throws Exception
    {
        sequencer.start(new ExposurePlan(1, 1, 10_000, 20, 4, 4));
        Thread.sleep(200);
        assertTrue(sequencer.isExposing());

        long requested = System.nanoTime();
        assertTrue(sequencer.abort());
        assertTrue(sequencer.awaitIdle(2, TimeUnit.SECONDS));
        long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - requested);

        assertTrue(latencyMillis <= ExposureSequencer.TICK_MILLIS + 100, latencyMillis + " ms");
        assertEquals(ExposureState.ABORTED, sequencer.state());
        assertFalse(ring.buffer(0).complete());
        assertEquals(0, ring.frameCounter());
        assertEquals(ExposureStateEvent.Kind.ABORTED, sink.getExposureEvents().get(sink.getExposureEvents().size() - 1).kind());
    }

    @Test
    void startedIsReportedBeforeAnyFrame() throws Exception
    {
        for (int i = 0; i < 20; i++) {
            RecordingObservabilitySink runSink = new RecordingObservabilitySink();
            ExposureSequencer quick = new ExposureSequencer(ring, Executors.newSingleThreadExecutor(),
                    SystemMonotonicClock.INSTANCE, () -> 42L, runSink);
            try {
                quick.start(new ExposurePlan(1, 1, 0, 0, 0, 0));
                assertTrue(quick.awaitIdle(2, TimeUnit.SECONDS));

                List<ExposureStateEvent> events = runSink.getExposureEvents();
                assertEquals(ExposureStateEvent.Kind.STARTED, events.get(0).kind());
                assertEquals(ExposureStateEvent.Kind.FINISHED, events.get(events.size() - 1).kind());
            }
            finally {
                quick.close();
            }
        }
    }

    @Test
    void secondStartWhileExposingIsRejected() throws Exception
    {
        sequencer.start(new ExposurePlan(1, 1, 10_000, 0, 4, 4));

        assertThrows(ArchonException.Validation.class, () -> sequencer.start(new ExposurePlan(1, 1, 0, 0, 4, 4)));

        sequencer.abort();
        assertTrue(sequencer.awaitIdle(1, TimeUnit.SECONDS));
    }

    @Test
    void abortWhenIdleDoesNothing()
    {
        assertFalse(sequencer.abort());
        assertEquals(ExposureState.IDLE, sequencer.state());
    }

    @Test
    void exposureTimeDelaysReadout() throws Exception
    {
        BlockingQueue<FrameCompletion> completions = sequencer.subscribe();
        long start = System.nanoTime();

        sequencer.start(new ExposurePlan(1, 1, 150, 0, 4, 4));

        assertNotNull(completions.poll(2, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(150));
    }
}
