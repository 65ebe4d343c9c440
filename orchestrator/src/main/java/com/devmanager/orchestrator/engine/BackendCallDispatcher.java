package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.engine.EngineException.Kind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one Manager call at a time on its own thread and waits for it with a
 * deadline.
 *
 * Every dispatch gets a fresh capacity-1 channel. When the caller gives up on
 * a slow call the thread keeps running and eventually drops its outcome into
 * that abandoned channel, so a late answer can never be mistaken for the
 * answer to a later call. While such an orphan is still alive new dispatches
 * are refused.
 */
public class BackendCallDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BackendCallDispatcher.class);

    /** Outcome of one call: exactly one of value and failure is set. */
    private record Outcome<T>(T value, Throwable failure) {}

    /** A call thread and whether its callable has returned. */
    private record InFlight(Thread thread, AtomicBoolean finished) {
        boolean busy() {
            return !finished.get() && thread.isAlive();
        }
    }

    private final MeterRegistry meters;
    private final AtomicLong    sequence = new AtomicLong();

    private volatile InFlight inFlight;

    public BackendCallDispatcher(MeterRegistry meters) {
        this.meters = meters;
    }

    /**
     * Run {@code call} on a new thread and wait up to {@code timeout} for it.
     *
     * @param label short operation name, used for the thread name and metrics
     * @throws EngineException BACKEND_CALL when a call is already running or the
     *                         deadline passes; the call's own EngineException
     *                         unchanged; BACKEND_CALL wrapping anything else
     */
    public <T> T dispatch(String label, Callable<T> call, Duration timeout) {
        InFlight running = inFlight;
        if (running != null && running.busy()) {
            throw new EngineException(Kind.BACKEND_CALL,
                    "Manager call already in progress (" + running.thread().getName() + ")");
        }

        BlockingQueue<Outcome<T>> channel = new ArrayBlockingQueue<>(1);
        AtomicBoolean finished = new AtomicBoolean();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Thread worker = new Thread(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            Outcome<T> outcome;
            try {
                outcome = new Outcome<>(call.call(), null);
            } catch (Throwable t) {
                outcome = new Outcome<>(null, t);
            }
            finished.set(true);
            if (!channel.offer(outcome)) {
                log.warn("Dropping outcome of {}: channel already holds a value", Thread.currentThread().getName());
            }
            MDC.clear();
        }, "manager-call-" + label + "-" + sequence.incrementAndGet());
        worker.setDaemon(true);

        Timer.Sample sample = Timer.start(meters);
        inFlight = new InFlight(worker, finished);
        worker.start();
        log.debug("Dispatched {} on {}", label, worker.getName());

        Outcome<T> outcome;
        try {
            outcome = channel.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            record(sample, label, "interrupted");
            throw new EngineException(Kind.UNHANDLED, "Interrupted while waiting for " + label, e);
        }

        if (outcome == null) {
            record(sample, label, "timeout");
            log.warn("{} did not answer within {}; abandoning {}", label, timeout, worker.getName());
            throw new EngineException(Kind.BACKEND_CALL,
                    "Manager call '" + label + "' timed out after " + timeout.toSeconds() + " seconds");
        }
        if (outcome.failure() != null) {
            record(sample, label, "failure");
            Throwable failure = outcome.failure();
            if (failure instanceof EngineException ee) throw ee;
            throw new EngineException(Kind.BACKEND_CALL,
                    "Manager call '" + label + "' failed: " + failure.getMessage(), failure);
        }
        record(sample, label, "success");
        return outcome.value();
    }

    /** True while a call thread (possibly an abandoned one) is still running. */
    public boolean isBusy() {
        InFlight running = inFlight;
        return running != null && running.busy();
    }

    /**
     * Join the in-flight call thread, if any, for at most {@code maxWait}.
     *
     * @return true if no call thread is alive afterwards
     */
    public boolean awaitQuiescence(Duration maxWait) {
        InFlight running = inFlight;
        if (running == null || !running.thread().isAlive()) return true;
        Thread t = running.thread();
        log.info("Waiting up to {} for {} to finish", maxWait, t.getName());
        try {
            t.join(maxWait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("{} still running after {}", t.getName(), maxWait);
            return false;
        }
        return true;
    }

    private void record(Timer.Sample sample, String label, String outcome) {
        sample.stop(meters.timer("devmanager.backend.calls", "operation", label, "outcome", outcome));
    }
}
