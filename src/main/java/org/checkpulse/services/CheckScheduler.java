package org.checkpulse.services;

import org.checkpulse.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns one periodic timer per check.
 * <p>
 * Timers only dispatch; runs execute on the worker executor so a slow command never delays
 * other checks' timers. A fire that arrives while the previous run of the same check is still
 * in flight is dropped, never queued. The in-flight guard is kept per check name, so it also
 * holds across a cancel and reschedule of the same name.
 */
public class CheckScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CheckScheduler.class);

    private final ScheduledExecutorService timer;
    private final ExecutorService workers;
    private final ConcurrentHashMap<String, Handle> handles = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicBoolean> guards = new ConcurrentHashMap<>();
    // held without the scheduler monitor, so finishing runs never wait on shutdown()
    private final Object guardLock = new Object();

    static final class Handle {
        final ScheduledTask task;
        final AtomicBoolean running;
        final AtomicLong dropped = new AtomicLong();
        volatile boolean cancelled;
        volatile ScheduledFuture<?> future;

        Handle(ScheduledTask task, AtomicBoolean running) {
            this.task = task;
            this.running = running;
        }
    }

    /**
     * @param workerThreads maximum concurrent runs across all checks, 0 for unbounded
     */
    public CheckScheduler(int workerThreads) {
        this(newTimer(), newWorkers(workerThreads));
    }

    public CheckScheduler(ScheduledExecutorService timer, ExecutorService workers) {
        this.timer = timer;
        this.workers = workers;
    }

    /**
     * Starts firing {@code task} immediately and then every {@code task.intervalSeconds()}.
     * A task already scheduled under the same name is cancelled first. If a run of that name
     * is still in flight, fires of the new task are dropped until it finishes.
     */
    public synchronized void schedule(ScheduledTask task) {
        cancel(task.name());

        long interval = Math.max(1, task.intervalSeconds());
        Handle handle;
        synchronized (guardLock) {
            AtomicBoolean guard = guards.computeIfAbsent(task.name(), k -> new AtomicBoolean(false));
            handle = new Handle(task, guard);
            handles.put(task.name(), handle);
        }
        handle.future = timer.scheduleAtFixedRate(() -> fire(handle), 0, interval, TimeUnit.SECONDS);
        logger.info("Scheduling check {} every {}s", task.name(), interval);
    }

    /**
     * Stops future fires. A run in flight is left to finish.
     *
     * @return true if a task was scheduled under {@code name}
     */
    public synchronized boolean cancel(String name) {
        Handle handle;
        boolean inFlight;
        synchronized (guardLock) {
            handle = handles.remove(name);
            if (handle == null) return false;

            handle.cancelled = true;
            inFlight = handle.running.get();
            if (!inFlight) {
                guards.remove(name, handle.running);
            }
        }
        ScheduledFuture<?> future = handle.future;
        if (future != null) {
            future.cancel(false);
        }
        logger.info("Cancelled check {}{}", name, inFlight ? " (run in flight)" : "");
        return true;
    }

    /**
     * Runs a check outside its timer, subject to the same no-overlap rule.
     *
     * @return true if a run was dispatched
     */
    public boolean runNow(String name) {
        Handle handle = handles.get(name);
        if (handle == null) {
            logger.warn("Run requested for unknown check {}", name);
            return false;
        }
        return fire(handle);
    }

    public boolean isScheduled(String name) {
        return handles.containsKey(name);
    }

    /**
     * True while a run of {@code name} is in flight, including a run left over from a cancelled task.
     */
    public boolean isRunning(String name) {
        AtomicBoolean guard = guards.get(name);
        return guard != null && guard.get();
    }

    public long droppedFires(String name) {
        Handle handle = handles.get(name);
        return handle == null ? 0 : handle.dropped.get();
    }

    public Set<String> scheduledNames() {
        return Set.copyOf(handles.keySet());
    }

    boolean fire(Handle handle) {
        if (handle.cancelled) return false;

        if (!handle.running.compareAndSet(false, true)) {
            long dropped = handle.dropped.incrementAndGet();
            logger.debug("Check {} still running, dropping fire ({} dropped so far)", handle.task.name(), dropped);
            return false;
        }
        if (handle.cancelled) {
            handle.running.set(false);
            releaseGuard(handle);
            return false;
        }

        try {
            workers.execute(() -> runWithLogging(handle));
            return true;
        } catch (RejectedExecutionException e) {
            handle.running.set(false);
            logger.warn("Check {} rejected by worker pool: {}", handle.task.name(), e.getMessage());
            return false;
        }
    }

    private void runWithLogging(Handle handle) {
        ScheduledTask task = handle.task;
        LogContext.start("CheckScheduler", task.name());
        long start = System.currentTimeMillis();
        try {
            task.execute();
        } catch (Exception e) {
            logger.error("Error in scheduled check {}: {}", task.name(), e.getMessage(), e);
        } finally {
            handle.running.set(false);
            if (handle.cancelled) {
                releaseGuard(handle);
            }
            logger.debug("Check {} finished in {}ms", task.name(), System.currentTimeMillis() - start);
            LogContext.clear();
        }
    }

    /**
     * Drops the guard of a cancelled handle once its last run is over, unless a rescheduled
     * task of the same name has taken it over.
     */
    private void releaseGuard(Handle handle) {
        String name = handle.task.name();
        synchronized (guardLock) {
            Handle current = handles.get(name);
            if ((current == null || current.running != handle.running) && !handle.running.get()) {
                guards.remove(name, handle.running);
            }
        }
    }

    /**
     * Cancels every timer and stops both executors.
     */
    public synchronized void shutdown() {
        logger.info("[--------- Shutting down CheckScheduler ---------]");
        for (String name : Set.copyOf(handles.keySet())) {
            cancel(name);
        }
        timer.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("CheckScheduler did not terminate gracefully");
            } else {
                logger.info("[--------- CheckScheduler stopped ---------]");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("CheckScheduler shutdown interrupted.");
        }
    }

    private static ScheduledExecutorService newTimer() {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2,
                r -> new Thread(r, "check-timer-" + counter.incrementAndGet()));
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private static ExecutorService newWorkers(int workerThreads) {
        AtomicInteger counter = new AtomicInteger();
        if (workerThreads > 0) {
            return Executors.newFixedThreadPool(workerThreads, r -> new Thread(r, "check-worker-" + counter.incrementAndGet()));
        }
        return Executors.newCachedThreadPool(r -> new Thread(r, "check-worker-" + counter.incrementAndGet()));
    }
}
