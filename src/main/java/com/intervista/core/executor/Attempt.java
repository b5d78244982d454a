package com.intervista.core.executor;

import com.intervista.core.model.Task;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight attempt. The worker, the deadline timer and cancellation race to settle it; only the
 * first one wins and only a winning completion reaches the coordinator.
 */
final class Attempt {

    private final Task task;
    private final long startedNanos;
    private final BlockingQueue<Completion> completions;
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile Future<?> work;
    private volatile Future<?> deadline;

    Attempt(Task task, BlockingQueue<Completion> completions) {
        this.task = task;
        this.startedNanos = System.nanoTime();
        this.completions = completions;
    }

    Task task() {
        return task;
    }

    long elapsedMs() {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    void bindWork(Future<?> work) {
        this.work = work;
    }

    void bindDeadline(Future<?> deadline) {
        this.deadline = deadline;
    }

    boolean settle(Completion completion) {
        if (settled.compareAndSet(false, true)) {
            completions.add(completion);
            return true;
        }
        return false;
    }

    /** Interrupts the worker after a timeout settled the attempt. */
    void interruptWorker() {
        var w = work;
        if (w != null) {
            w.cancel(true);
        }
    }

    void stopDeadline() {
        var d = deadline;
        if (d != null) {
            d.cancel(false);
        }
    }

    /** Settles without a completion and stops both the worker and the timer. */
    void abandon() {
        settled.set(true);
        stopDeadline();
        interruptWorker();
    }
}
