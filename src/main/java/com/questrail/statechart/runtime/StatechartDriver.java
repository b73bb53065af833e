package com.questrail.statechart.runtime;

import com.questrail.statechart.api.EnqueueOutcome;
import com.questrail.statechart.api.Event;
import com.questrail.statechart.api.EventSink;
import com.questrail.statechart.api.FatalFaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * StatechartDriver
 * =============================================================================
 * Runs one {@link DispatchEngine} on a dedicated event-loop thread.
 *
 * <h2>Threading model</h2>
 * <ul>
 *   <li>Producers on any thread call {@link #enqueue(Event)}; it only touches
 *       the engine's queue.</li>
 *   <li>The event loop initializes the instance, then processes queued events
 *       one run-to-completion step at a time.</li>
 *   <li>{@link #inspect(Function)} reads the instance under the same lock the
 *       loop holds for each step, so callers never observe a partial step.</li>
 * </ul>
 * Real-time timer adapters deliver expiries into the queue, so timers need no
 * extra wiring.
 *
 * <h2>Faults</h2>
 * A fatal fault halts the instance and ends the loop. Any other exception
 * escaping a step is logged and the loop continues with the next event.
 */
public final class StatechartDriver implements EventSink
{
    private static final Logger log = LoggerFactory.getLogger(StatechartDriver.class);

    private static final long POLL_MILLIS = 50;

    private final DispatchEngine engine;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object stepLock = new Object();

    private volatile Thread eventLoopThread;

    public StatechartDriver(DispatchEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "statechart-" + engine.machineName());
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop thread gracefully.
     * Blocks until the event loop thread terminates.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public EnqueueOutcome enqueue(Event event) {
        return engine.enqueue(event);
    }

    /** Applies {@code query} to the instance between steps. */
    public <T> T inspect(Function<? super DispatchEngine, T> query) {
        Objects.requireNonNull(query, "query");
        synchronized (stepLock) {
            return query.apply(engine);
        }
    }

    private void runEventLoop() {
        try {
            synchronized (stepLock) {
                if (!engine.isInitialized()) {
                    engine.init();
                }
            }
            while (running.get() && !engine.isHalted()) {
                try {
                    if (!engine.queue().awaitNonEmpty(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                        continue;
                    }
                    synchronized (stepLock) {
                        engine.processNext();
                    }
                } catch (InterruptedException e) {
                    if (running.get()) {
                        Thread.currentThread().interrupt();
                    }
                    return;
                } catch (FatalFaultException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("{} event processing error", engine.machineName(), e);
                }
            }
        } catch (FatalFaultException e) {
            log.error("{} event loop stopped by fatal fault: {}", engine.machineName(), e.fault());
        } finally {
            running.set(false);
        }
    }
}
