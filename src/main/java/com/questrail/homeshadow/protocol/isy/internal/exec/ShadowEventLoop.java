package com.questrail.homeshadow.protocol.isy.internal.exec;

import com.questrail.homeshadow.protocol.isy.internal.events.ShadowEvent;
import com.questrail.homeshadow.protocol.isy.internal.time.WallClock;
import com.questrail.homeshadow.protocol.isy.observability.NullObservabilitySink;
import com.questrail.homeshadow.protocol.isy.observability.ShadowErrorEvent;
import com.questrail.homeshadow.protocol.isy.observability.ShadowObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ShadowEventLoop
 * =============================================================================
 * The client's serialized event loop.
 *
 * <h2>Purpose</h2>
 * This class provides the "actor-like" runtime behavior of the shadow client:
 * <ul>
 *   <li>Serialized event processing (one event at a time)</li>
 *   <li>Every frame, timer expiry and command handled in receipt order</li>
 *   <li>All shadow mutations and feed publishes on one thread</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Producers (transport threads, timer threads, callers) only enqueue. The
 * loop thread hands each event to the {@link ShadowCoordinator}. An exception
 * while processing is reported to the observability sink and the loop moves
 * on to the next event.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.submit(...)  → accepted before start; processed once started
 *   loop.start()      → starts the loop thread
 *   loop.stop()       → stops the loop; queued and later events are dropped
 *   loop.stop(last)   → same, and {@code last} is the final event processed
 * </pre>
 * A stopped loop cannot be restarted.
 *
 * <p>The coordinator is never entered by two threads. If the loop thread is
 * still busy when the stop timeout elapses, the final event is handed to it
 * and runs once the in-flight event completes.</p>
 */
public final class ShadowEventLoop {

    private final ShadowCoordinator coordinator;
    private final WallClock wallClock;
    private final ShadowObservabilitySink observabilitySink;

    private final BlockingQueue<ShadowEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final Duration stopTimeout;

    private final Object handoffLock = new Object();
    private boolean loopThreadActive;
    private ShadowEvent finalEvent;

    private volatile Thread eventLoopThread;

    public ShadowEventLoop(ShadowCoordinator coordinator,
                           WallClock wallClock,
                           ShadowObservabilitySink observabilitySink)
    {
        this(coordinator, wallClock, observabilitySink, Duration.ofSeconds(5));
    }

    ShadowEventLoop(ShadowCoordinator coordinator,
                    WallClock wallClock,
                    ShadowObservabilitySink observabilitySink,
                    Duration stopTimeout)
    {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Event loop already stopped");
        }
        if (running.compareAndSet(false, true)) {
            synchronized (handoffLock) {
                loopThreadActive = true;
            }
            eventLoopThread = new Thread(this::runEventLoop, "isy-shadow-dispatch");
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread.
     * Blocks until the event loop thread terminates or the stop timeout elapses.
     */
    public void stop() {
        stop(null);
    }

    /**
     * Stops the loop and processes {@code last} after every other event.
     *
     * @param last final event, or {@code null} for none
     * @return {@code true} when {@code last} was processed before returning;
     *         {@code false} when it was handed to a loop thread that is still
     *         finishing an event
     */
    public boolean stop(ShadowEvent last) {
        stopped.set(true);
        Thread thread = eventLoopThread;
        if (running.compareAndSet(true, false)) {
            if (thread != null && thread != Thread.currentThread()) {
                thread.interrupt();
                try {
                    thread.join(stopTimeout.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        eventQueue.clear();

        if (last == null) {
            return true;
        }
        if (thread != Thread.currentThread()) {
            synchronized (handoffLock) {
                if (loopThreadActive) {
                    finalEvent = last;
                    return false;
                }
            }
        }
        processSafely(last);
        return true;
    }

    /**
     * Submits an event for processing.
     * Events are processed sequentially in submission order.
     *
     * @param event the event to process (must not be null)
     * @return {@code false} when the loop is stopped and the event was dropped
     */
    public boolean submit(ShadowEvent event) {
        Objects.requireNonNull(event, "event");
        if (stopped.get()) {
            return false;
        }
        return eventQueue.offer(event);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /** Number of events waiting to be processed. */
    public int backlog() {
        return eventQueue.size();
    }

    /**
     * Main event loop - runs on dedicated thread.
     */
    private void runEventLoop() {
        try {
            while (running.get()) {
                try {
                    ShadowEvent event = eventQueue.take(); // Blocks until event available
                    if (running.get()) {
                        coordinator.process(event);
                    }
                } catch (InterruptedException e) {
                    // stop() interrupts; the loop condition decides whether to exit
                    continue;
                } catch (Exception e) {
                    observabilitySink.onError(new ShadowErrorEvent(
                        wallClock.now(),
                        "Event processing error",
                        e
                    ));
                }
            }
        } finally {
            ShadowEvent last;
            synchronized (handoffLock) {
                loopThreadActive = false;
                last = finalEvent;
                finalEvent = null;
            }
            if (last != null) {
                processSafely(last);
            }
        }
    }

    private void processSafely(ShadowEvent event) {
        try {
            coordinator.process(event);
        } catch (RuntimeException e) {
            observabilitySink.onError(new ShadowErrorEvent(wallClock.now(), "Error processing final event", e));
        }
    }
}
