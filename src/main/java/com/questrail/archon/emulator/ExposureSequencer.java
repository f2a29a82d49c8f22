package com.questrail.archon.emulator;

import com.questrail.archon.internal.time.MonotonicClock;
import com.questrail.archon.observability.ArchonErrorEvent;
import com.questrail.archon.observability.ArchonObservabilitySink;
import com.questrail.archon.observability.ExposureStateEvent;
import com.questrail.archon.protocol.ArchonException;
import com.questrail.archon.protocol.model.BufferDescriptor;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * ExposureSequencer
 * =============================================================================
 * Emulates exposure and readout on its own thread, advancing the
 * {@link EmulatedFrameRing} the way the controller's timing core would.
 *
 * <h2>Run</h2>
 * For each of {@code exposures x framesPerExposure} frames:
 * <ol>
 *   <li>wait the exposure time in ticks of at most {@value #TICK_MILLIS} ms, checking abort</li>
 *   <li>advance the write slot, {@code slot = (slot mod N) + 1}</li>
 *   <li>read out row by row, updating line progress; rows take 90 % of the readout time in total</li>
 *   <li>mark the slot complete with the next global frame number and publish a {@link FrameCompletion}</li>
 * </ol>
 *
 * <h2>Abort</h2>
 * <p>Cooperative. The running loop notices within one tick, leaves the slot
 * being read incomplete and ends in {@link ExposureState#ABORTED}. The
 * {@code exposing} and {@code abort} flags are cleared on every exit.</p>
 *
 * <h2>Subscribers</h2>
 * <p>Completions are offered to every queue returned by {@link #subscribe()}.
 * The sequencer never blocks on a subscriber.</p>
 */
public final class ExposureSequencer implements AutoCloseable
{
    static final long TICK_MILLIS = 50;

    private final EmulatedFrameRing ring;
    private final ExecutorService executor;
    private final MonotonicClock clock;
    private final LongSupplier timer;
    private final ArchonObservabilitySink sink;

    private final AtomicBoolean exposing = new AtomicBoolean(false);
    private final AtomicBoolean abort = new AtomicBoolean(false);
    private volatile ExposureState state = ExposureState.IDLE;

    private final List<BlockingQueue<FrameCompletion>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * @param timer controller timer in 10 ns ticks, used for buffer timestamps
     */
    public ExposureSequencer(EmulatedFrameRing ring,
                             ExecutorService executor,
                             MonotonicClock clock,
                             LongSupplier timer,
                             ArchonObservabilitySink sink) {
        this.ring = Objects.requireNonNull(ring, "ring");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Starts a run.
     *
     * @throws ArchonException.Validation when a run is already in progress
     */
    public void start(ExposurePlan plan) {
        Objects.requireNonNull(plan, "plan");
        if (!exposing.compareAndSet(false, true)) {
            throw new ArchonException.Validation("exposure already in progress");
        }
        abort.set(false);
        state = ExposureState.EXPOSING;
        // STARTED precedes every event of the run
        sink.onExposureEvent(new ExposureStateEvent(Instant.now(), ExposureStateEvent.Kind.STARTED,
                ring.frameCounter(), -1));
        try {
            executor.execute(() -> run(plan));
        }
        catch (RejectedExecutionException e) {
            state = ExposureState.IDLE;
            sink.onExposureEvent(new ExposureStateEvent(Instant.now(), ExposureStateEvent.Kind.ABORTED,
                    ring.frameCounter(), -1));
            exposing.set(false);
            throw new ArchonException.Validation("exposure executor is shut down");
        }
    }

    /**
     * Requests an abort. Ignored when no run is in progress.
     *
     * @return {@code true} when a running exposure will stop
     */
    public boolean abort() {
        if (!exposing.get()) {
            return false;
        }
        abort.set(true);
        return true;
    }

    public ExposureState state() {
        return state;
    }

    public boolean isExposing() {
        return exposing.get();
    }

    /**
     * A new queue that receives every later frame completion.
     */
    public BlockingQueue<FrameCompletion> subscribe() {
        BlockingQueue<FrameCompletion> queue = new LinkedBlockingQueue<>();
        subscribers.add(queue);
        return queue;
    }

    public void unsubscribe(BlockingQueue<FrameCompletion> queue) {
        subscribers.remove(queue);
    }

    /**
     * Waits until no run is in progress.
     *
     * @return {@code false} if the wait timed out
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = clock.nowNanos() + unit.toNanos(timeout);
        while (exposing.get()) {
            if (clock.nowNanos() - deadline >= 0) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    @Override
    public void close() {
        abort();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void run(ExposurePlan plan) {
        boolean aborted = false;
        try {
            outer:
            for (int n = 0; n < plan.exposures(); n++) {
                for (int f = 0; f < plan.framesPerExposure(); f++) {
                    if (!sleepUnlessAborted(TimeUnit.MILLISECONDS.toNanos(plan.exposureMillis()))) {
                        aborted = true;
                        break outer;
                    }
                    if (!readOut(plan)) {
                        aborted = true;
                        break outer;
                    }
                }
            }
        }
        catch (ArchonException e) {
            aborted = true;
            sink.onError(new ArchonErrorEvent(Instant.now(), "exposure stopped: " + e.getMessage(), e));
        }
        catch (InterruptedException e) {
            aborted = true;
            Thread.currentThread().interrupt();
        }
        finally {
            state = aborted ? ExposureState.ABORTED : ExposureState.IDLE;
            sink.onExposureEvent(new ExposureStateEvent(Instant.now(),
                    aborted ? ExposureStateEvent.Kind.ABORTED : ExposureStateEvent.Kind.FINISHED,
                    ring.frameCounter(), -1));
            abort.set(false);
            exposing.set(false);
        }
    }

    /**
     * Reads one frame into the next slot.
     *
     * @return {@code false} when aborted part way; the slot is left incomplete
     */
    private boolean readOut(ExposurePlan plan) throws InterruptedException {
        int index = ring.advance();
        ring.beginReadout(index, plan.width(), plan.height(), timer.getAsLong());

        long rowNanos = plan.rowNanos();
        for (int row = 0; row < plan.height(); row++) {
            if (!sleepUnlessAborted(rowNanos)) {
                return false;
            }
            ring.progress(index, row + 1, plan.width());
        }
        if (abort.get()) {
            return false;
        }

        int frame = ring.complete(index, timer.getAsLong());
        BufferDescriptor done = ring.buffer(index);
        FrameCompletion completion = new FrameCompletion(frame, index, done);
        for (BlockingQueue<FrameCompletion> q : subscribers) {
            q.offer(completion);
        }
        sink.onExposureEvent(new ExposureStateEvent(Instant.now(), ExposureStateEvent.Kind.FRAME_COMPLETE, frame, index));
        return true;
    }

    /**
     * Sleeps {@code nanos} in ticks of at most {@value #TICK_MILLIS} ms.
     *
     * @return {@code false} as soon as an abort is seen
     */
    private boolean sleepUnlessAborted(long nanos) throws InterruptedException {
        long start = clock.nowNanos();
        while (true) {
            if (abort.get()) {
                return false;
            }
            long remaining = nanos - (clock.nowNanos() - start);
            if (remaining <= 0) {
                return true;
            }
            long tick = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(TICK_MILLIS));
            TimeUnit.NANOSECONDS.sleep(tick);
        }
    }
}
