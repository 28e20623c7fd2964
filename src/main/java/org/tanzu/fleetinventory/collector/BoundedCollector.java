package org.tanzu.fleetinventory.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.fleetinventory.identity.DeviceIdentity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs blocking per-device work with bounded concurrency and a deadline per task.
 *
 * At most {@code maxConcurrency} tasks are running at any time. Each task gets
 * {@code perTaskTimeout} from the moment it starts running. When the deadline elapses the
 * task is settled as {@link TaskState#TIMED_OUT}, its worker thread is interrupted and its
 * slot is handed to the next queued task straight away. The remote call behind an abandoned
 * task may still be running; whatever it returns later is discarded.
 *
 * Slots are tracked with a semaphore rather than a fixed-size thread pool: worker threads
 * come from an unbounded daemon pool, so a call that ignores interruption keeps its thread
 * but never its slot. Dispatch happens on {@link #submit} and on every task completion and
 * never blocks.
 *
 * There is no retry. Every submission settles exactly once as completed, timed out or failed.
 *
 * A collector is single-use: submit the batch, call {@link #drain()}, then {@link #close()}.
 * Closing before the drain returns abandons the whole batch.
 *
 * @param <T> Type of the value produced by the work functions
 */
public class BoundedCollector<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BoundedCollector.class);

    private final String name;
    private final int maxConcurrency;
    private final Duration perTaskTimeout;
    private final ExecutorService workers;
    private final Semaphore slots;

    private final Queue<Task> queue = new ConcurrentLinkedQueue<>();
    private final Map<DeviceIdentity, Task> tasks = new LinkedHashMap<>();
    private final List<DeviceIdentity> rejectedDuplicates = new ArrayList<>();

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peakConcurrency = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger timedOut = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    private volatile boolean closed;

    /**
     * Creates a collector.
     *
     * @param name Name used for worker threads and log messages
     * @param maxConcurrency Maximum number of tasks running at once, at least 1
     * @param perTaskTimeout Deadline of each task, counted from the moment it starts running
     */
    public BoundedCollector(String name, int maxConcurrency, Duration perTaskTimeout) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, was " + maxConcurrency);
        }
        if (perTaskTimeout == null || perTaskTimeout.isZero() || perTaskTimeout.isNegative()) {
            throw new IllegalArgumentException("perTaskTimeout must be positive, was " + perTaskTimeout);
        }
        this.name = name;
        this.maxConcurrency = maxConcurrency;
        this.perTaskTimeout = perTaskTimeout;
        this.slots = new Semaphore(maxConcurrency);
        this.workers = Executors.newCachedThreadPool(daemonThreads(name));
    }

    public String getName() { return name; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public Duration getPerTaskTimeout() { return perTaskTimeout; }

    /**
     * Enqueues work for one device.
     *
     * A device already submitted to this collector is rejected: the first submission stands
     * and the identity is recorded in {@link #getRejectedDuplicates()}.
     *
     * @param identity The device the work is for
     * @param work The blocking work function
     * @return true if the work was enqueued, false if it was rejected as a duplicate
     * @throws IllegalStateException if the collector has been closed
     */
    public boolean submit(DeviceIdentity identity, CollectorWork<T> work) {
        if (closed) {
            throw new IllegalStateException("Collector '" + name + "' is closed");
        }
        Task task = new Task(identity, work);
        synchronized (tasks) {
            if (tasks.containsKey(identity)) {
                rejectedDuplicates.add(identity);
                logger.warn("[{}] Duplicate submission for {} rejected, first submission stands", name, identity.qualifiedName());
                return false;
            }
            tasks.put(identity, task);
        }
        queue.add(task);
        logger.debug("[{}] Queued {}", name, identity.qualifiedName());
        dispatch();
        return true;
    }

    /**
     * Blocks until every submitted task has settled.
     *
     * @return Outcome per identity, in submission order
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public Map<DeviceIdentity, TaskOutcome<T>> drain() {
        List<Task> snapshot;
        synchronized (tasks) {
            snapshot = new ArrayList<>(tasks.values());
        }
        CompletableFuture<?>[] outcomes = snapshot.stream()
                .map(task -> task.outcome)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(outcomes).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while draining collector '" + name + "'", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Collector '" + name + "' task settled abnormally", e.getCause());
        }

        Map<DeviceIdentity, TaskOutcome<T>> result = new LinkedHashMap<>();
        for (Task task : snapshot) {
            result.put(task.identity, task.outcome.join());
        }
        logger.info("[{}] Drained {} tasks: {}", name, result.size(), getStats());
        return Collections.unmodifiableMap(result);
    }

    /**
     * Gets the current state of the task submitted for an identity.
     *
     * @param identity The device identity
     * @return The task state, or null if nothing was submitted for it
     */
    public TaskState stateOf(DeviceIdentity identity) {
        synchronized (tasks) {
            Task task = tasks.get(identity);
            return task == null ? null : task.state.get();
        }
    }

    public List<DeviceIdentity> getRejectedDuplicates() {
        synchronized (tasks) {
            return List.copyOf(rejectedDuplicates);
        }
    }

    public CollectorStats getStats() {
        int submitted;
        int duplicates;
        synchronized (tasks) {
            submitted = tasks.size();
            duplicates = rejectedDuplicates.size();
        }
        return new CollectorStats(submitted, completed.get(), timedOut.get(), failed.get(),
                peakConcurrency.get(), duplicates);
    }

    /**
     * Discards the collector. Queued tasks settle as failed with a {@link CancellationException},
     * running tasks are interrupted and abandoned.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Task pending;
        int dropped = 0;
        while ((pending = queue.poll()) != null) {
            if (pending.state.compareAndSet(TaskState.PENDING, TaskState.FAILED)) {
                failed.incrementAndGet();
                pending.outcome.complete(TaskOutcome.failed(
                        new CancellationException("Collector '" + name + "' closed before task started"), Duration.ZERO));
                dropped++;
            }
        }
        List<Task> snapshot;
        synchronized (tasks) {
            snapshot = new ArrayList<>(tasks.values());
        }
        for (Task task : snapshot) {
            Future<?> handle = task.handle;
            if (task.state.get() == TaskState.RUNNING && handle != null) {
                handle.cancel(true);
            }
        }
        workers.shutdownNow();
        if (dropped > 0) {
            logger.warn("[{}] Closed with {} queued tasks dropped", name, dropped);
        }
    }

    private void dispatch() {
        while (!closed) {
            if (!slots.tryAcquire()) {
                return;
            }
            Task task = queue.poll();
            if (task == null) {
                slots.release();
                // Work enqueued while this thread held the permit would otherwise wait for the next completion.
                if (queue.isEmpty()) {
                    return;
                }
                continue;
            }
            start(task);
        }
    }

    private void start(Task task) {
        if (!task.state.compareAndSet(TaskState.PENDING, TaskState.RUNNING)) {
            slots.release();
            return;
        }
        int now = running.incrementAndGet();
        peakConcurrency.accumulateAndGet(now, Math::max);
        long startedAt = System.nanoTime();

        CompletableFuture<T> call = new CompletableFuture<>();
        try {
            task.handle = workers.submit(() -> {
                try {
                    call.complete(task.work.collect(task.identity));
                } catch (Throwable t) {
                    call.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }

        call.orTimeout(perTaskTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .whenComplete((value, error) -> finish(task, value, error, startedAt));
    }

    private void finish(Task task, T value, Throwable error, long startedAt) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;

        TaskOutcome<T> outcome;
        TaskState terminal;
        if (cause == null) {
            outcome = TaskOutcome.completed(value, elapsed);
            terminal = TaskState.COMPLETED;
        } else if (cause instanceof TimeoutException) {
            outcome = TaskOutcome.timedOut(elapsed);
            terminal = TaskState.TIMED_OUT;
            Future<?> handle = task.handle;
            if (handle != null) {
                handle.cancel(true);
            }
        } else {
            outcome = TaskOutcome.failed(cause, elapsed);
            terminal = TaskState.FAILED;
        }

        if (task.state.compareAndSet(TaskState.RUNNING, terminal)) {
            switch (terminal) {
                case COMPLETED:
                    completed.incrementAndGet();
                    logger.debug("[{}] {} completed in {} ms", name, task.identity.qualifiedName(), elapsed.toMillis());
                    break;
                case TIMED_OUT:
                    timedOut.incrementAndGet();
                    logger.warn("[{}] {} timed out after {} ms, slot reassigned", name, task.identity.qualifiedName(), elapsed.toMillis());
                    break;
                default:
                    failed.incrementAndGet();
                    logger.warn("[{}] {} failed: {}", name, task.identity.qualifiedName(), cause.getMessage());
                    break;
            }
            task.outcome.complete(outcome);
        }

        running.decrementAndGet();
        slots.release();
        dispatch();
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "collector-" + name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class Task {
        private final DeviceIdentity identity;
        private final CollectorWork<T> work;
        private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.PENDING);
        private final CompletableFuture<TaskOutcome<T>> outcome = new CompletableFuture<>();
        private volatile Future<?> handle;

        private Task(DeviceIdentity identity, CollectorWork<T> work) {
            this.identity = identity;
            this.work = work;
        }
    }
}
