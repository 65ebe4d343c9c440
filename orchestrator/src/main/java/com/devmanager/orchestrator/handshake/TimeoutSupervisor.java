package com.devmanager.orchestrator.handshake;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-shot deadline for the Worker result wait.
 *
 * At most one deadline is armed at a time; arming again replaces the previous
 * one. Cancelling is synchronous and never fails: if the deadline already
 * fired, its action runs anyway and the engine discards it because its state
 * or wait cycle no longer matches.
 */
public class TimeoutSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutSupervisor.class);

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "result-timeout");
        t.setDaemon(true);
        return t;
    });

    private ScheduledFuture<?> pending;

    public synchronized void arm(Duration timeout, Runnable onTimeout) {
        cancel();
        pending = timer.schedule(onTimeout, timeout.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Result deadline armed for {}", timeout);
    }

    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    public synchronized boolean isArmed() {
        return pending != null && !pending.isDone();
    }

    public void shutdown() {
        cancel();
        timer.shutdownNow();
    }
}
