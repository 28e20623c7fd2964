package org.tanzu.fleetinventory.collector;

import java.time.Duration;

/**
 * Settled result of one collector task: completed with a value, timed out, or failed with an error.
 *
 * @param <T> Type of the value produced by the work function
 */
public final class TaskOutcome<T> {

    private final TaskState state;
    private final T value;
    private final Throwable error;
    private final Duration elapsed;

    private TaskOutcome(TaskState state, T value, Throwable error, Duration elapsed) {
        this.state = state;
        this.value = value;
        this.error = error;
        this.elapsed = elapsed;
    }

    /**
     * Outcome of a task whose work function returned.
     *
     * @param value The returned value, possibly null
     * @param elapsed Time from start to return
     * @return The outcome
     */
    public static <T> TaskOutcome<T> completed(T value, Duration elapsed) {
        return new TaskOutcome<>(TaskState.COMPLETED, value, null, elapsed);
    }

    /**
     * Outcome of a task abandoned at its deadline. Whatever the call returns afterwards is discarded.
     *
     * @param elapsed Time from start to the deadline
     * @return The outcome
     */
    public static <T> TaskOutcome<T> timedOut(Duration elapsed) {
        return new TaskOutcome<>(TaskState.TIMED_OUT, null, null, elapsed);
    }

    /**
     * Outcome of a task whose work function threw, or that was dropped when the collector closed.
     *
     * @param error The exception thrown by the work function
     * @param elapsed Time from start to failure, zero for tasks that never started
     * @return The outcome
     */
    public static <T> TaskOutcome<T> failed(Throwable error, Duration elapsed) {
        return new TaskOutcome<>(TaskState.FAILED, null, error, elapsed);
    }

    /**
     * @return One of the terminal states
     */
    public TaskState getState() { return state; }

    /**
     * @return Running time of the task; for a timed-out task, roughly the deadline
     */
    public Duration getElapsed() { return elapsed; }

    public boolean isCompleted() { return state == TaskState.COMPLETED; }
    public boolean isTimedOut() { return state == TaskState.TIMED_OUT; }
    public boolean isFailed() { return state == TaskState.FAILED; }

    /**
     * Gets the produced value.
     *
     * @return The value of a completed task (may be null if the work function returned null)
     * @throws IllegalStateException if the task did not complete
     */
    public T getValue() {
        if (state != TaskState.COMPLETED) {
            throw new IllegalStateException("Task did not complete: " + state);
        }
        return value;
    }

    /**
     * Gets the error of a failed task.
     *
     * @return The error, or null unless the task failed
     */
    public Throwable getError() { return error; }

    @Override
    public String toString() {
        switch (state) {
            case COMPLETED:
                return "Completed{" + value + "}";
            case FAILED:
                return "Failed{" + (error == null ? "unknown" : error.getMessage()) + "}";
            default:
                return "TimedOut{" + elapsed + "}";
        }
    }
}
