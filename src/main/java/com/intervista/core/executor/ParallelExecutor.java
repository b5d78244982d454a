package com.intervista.core.executor;

import com.intervista.core.analyzer.AnalyzerRegistry;
import com.intervista.core.analyzer.SubmissionStore;
import com.intervista.core.metrics.IntervistaMetrics;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.report.FeedbackGenerator;
import com.intervista.core.report.ResultIntegrator;
import com.intervista.core.state.GraphState;
import com.intervista.core.state.StaleRevisionException;
import com.intervista.core.state.StateManager;
import com.intervista.core.state.StateMutation.TransitionTask;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs sessions' task graphs.
 * <p>
 * Each session gets a coordinator ({@link SessionRun}) on the session pool. Coordinators share one
 * worker pool for analyzer calls and one timer that enforces the per-attempt deadline by interrupting
 * the worker. At most {@code workers} attempts of one session run at a time.
 */
@Service
public class ParallelExecutor {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);

    private final StateManager stateManager;
    private final AnalyzerRegistry registry;
    private final SubmissionStore submissions;
    private final ResultIntegrator integrator;
    private final FeedbackGenerator feedbackGenerator;
    private final ExecutorProperties properties;
    private final IntervistaMetrics metrics;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final ExecutorService sessionPool;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService timer;
    private final ConcurrentHashMap<String, SessionRun> runs = new ConcurrentHashMap<>();

    public ParallelExecutor(StateManager stateManager, AnalyzerRegistry registry, SubmissionStore submissions,
                            ResultIntegrator integrator, FeedbackGenerator feedbackGenerator,
                            ExecutorProperties properties, IntervistaMetrics metrics, Clock clock) {
        this.stateManager = stateManager;
        this.registry = registry;
        this.submissions = submissions;
        this.integrator = integrator;
        this.feedbackGenerator = feedbackGenerator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.retryPolicy = RetryPolicy.from(properties);
        this.sessionPool = Executors.newFixedThreadPool(properties.getSessionThreads(), daemonThreads("session-coordinator"));
        this.workerPool = Executors.newCachedThreadPool(daemonThreads("analyzer-worker"));
        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("task-deadline"));
    }

    /**
     * Starts coordinating a session whose tasks are already in the state manager. Calling it again
     * while the session runs returns the same future.
     *
     * @return completes with the final state once every task is terminal
     */
    public CompletableFuture<GraphState> run(String sessionId) {
        var run = runs.computeIfAbsent(sessionId, id -> {
            var created = new SessionRun(id, this);
            sessionPool.execute(created);
            return created;
        });
        return run.completion();
    }

    /**
     * Cancels a session: in-flight attempts are interrupted and every unfinished task becomes CANCELLED.
     * Safe to call any number of times, and on sessions that already finished.
     */
    public void cancel(String sessionId) {
        var run = runs.get(sessionId);
        if (run != null) {
            run.requestCancel();
            return;
        }
        if (!stateManager.isLive(sessionId)) {
            return;
        }
        // Not coordinated right now (e.g. resumed but not restarted): cancel directly.
        for (Task task : stateManager.get(sessionId).taskState().ordered()) {
            if (task.isTerminal()) continue;
            try {
                if (task.status() == TaskStatus.FAILED) {
                    stateManager.apply(sessionId, TransitionTask.requeue(task.id(), null));
                    stateManager.apply(sessionId, TransitionTask.cancel(task.id(), TaskStatus.PENDING));
                } else {
                    stateManager.apply(sessionId, TransitionTask.cancel(task.id(), task.status()));
                }
            } catch (StaleRevisionException e) {
                log.debug("Task {} moved while cancelling: {}", task.id(), e.getMessage());
            }
        }
    }

    /** Completion of the session's current run, if it is being coordinated right now. */
    public Optional<CompletableFuture<GraphState>> completion(String sessionId) {
        return Optional.ofNullable(runs.get(sessionId)).map(SessionRun::completion);
    }

    public boolean isRunning(String sessionId) {
        return runs.containsKey(sessionId);
    }

    @PreDestroy
    void shutdown() {
        runs.values().forEach(SessionRun::requestCancel);
        sessionPool.shutdown();
        try {
            if (!sessionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                sessionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            sessionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workerPool.shutdownNow();
        timer.shutdownNow();
        log.info("Parallel executor stopped");
    }

    void finished(String sessionId, SessionRun run) {
        runs.remove(sessionId, run);
    }

    StateManager stateManager() { return stateManager; }
    AnalyzerRegistry registry() { return registry; }
    SubmissionStore submissions() { return submissions; }
    ResultIntegrator integrator() { return integrator; }
    FeedbackGenerator feedbackGenerator() { return feedbackGenerator; }
    ExecutorProperties properties() { return properties; }
    IntervistaMetrics metrics() { return metrics; }
    Clock clock() { return clock; }
    RetryPolicy retryPolicy() { return retryPolicy; }
    ExecutorService workers() { return workerPool; }
    ScheduledExecutorService timer() { return timer; }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
