package com.oracle.thinking.core;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an action on a daemon thread at a fixed period until {@link #cancel()} is called.
 * A period of zero creates an inert task, which is how tests keep sweeps off.
 */
@Slf4j
public final class RepeatingTask {

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private RepeatingTask(String name, ScheduledExecutorService scheduler) {
        this.name = name;
        this.scheduler = scheduler;
    }

    public static RepeatingTask start(String name, long periodMs, Runnable action) {
        if (periodMs <= 0) {
            return new RepeatingTask(name, null);
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
        RepeatingTask task = new RepeatingTask(name, scheduler);
        scheduler.scheduleAtFixedRate(() -> task.runSafely(action), periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.debug("Started repeating task {} every {} ms", name, periodMs);
        return task;
    }

    public boolean isActive() {
        return scheduler != null && !cancelled.get();
    }

    /**
     * Stops the task. Only the first call has any effect.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true) || scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Stopped repeating task {}", name);
    }

    private void runSafely(Runnable action) {
        // an exception escaping here would silently stop future runs
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Repeating task {} failed: {}", name, e.getMessage(), e);
        }
    }
}
