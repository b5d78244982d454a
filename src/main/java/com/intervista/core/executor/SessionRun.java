package com.intervista.core.executor;

import com.intervista.core.analyzer.AnalysisInput;
import com.intervista.core.analyzer.AnalyzerCapability;
import com.intervista.core.analyzer.AnalyzerException;
import com.intervista.core.analyzer.Deadline;
import com.intervista.core.analyzer.DeadlineExceededException;
import com.intervista.core.analyzer.InputUnavailableException;
import com.intervista.core.analyzer.InvalidParamsException;
import com.intervista.core.analyzer.TransientProviderException;
import com.intervista.core.config.InvalidConfigurationException;
import com.intervista.core.logging.MdcContext;
import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;
import com.intervista.core.model.TaskType;
import com.intervista.core.report.IntegrationException;
import com.intervista.core.state.GraphState;
import com.intervista.core.state.StaleRevisionException;
import com.intervista.core.state.StateMutation;
import com.intervista.core.state.StateMutation.TransitionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Coordinator of one session. Runs on a session thread, dispatches ready tasks to the shared worker
 * pool and reacts to their completions, which arrive over this run's queue. The coordinator is the
 * only thread that moves the session's tasks; workers never touch state.
 */
final class SessionRun implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SessionRun.class);

    /** Upper bound on a single wait, so cancellation and stray wake-ups are noticed. */
    private static final long MAX_WAIT_MS = 1_000;

    private final String sessionId;
    private final ParallelExecutor executor;
    private final LinkedBlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final Map<String, Attempt> inFlight = new HashMap<>();
    private final CompletableFuture<GraphState> done = new CompletableFuture<>();
    private final long startedNanos = System.nanoTime();
    private volatile boolean cancelRequested;

    SessionRun(String sessionId, ParallelExecutor executor) {
        this.sessionId = sessionId;
        this.executor = executor;
    }

    CompletableFuture<GraphState> completion() {
        return done;
    }

    void requestCancel() {
        cancelRequested = true;
        completions.add(Completion.wakeUp());
    }

    @Override
    public void run() {
        MdcContext.setSession(sessionId);
        log.info("Session {} started", sessionId);
        try {
            coordinate();
        } catch (InterruptedException e) {
            log.warn("Coordinator of session {} interrupted; cancelling", sessionId);
            cancelRequested = true;
            cancelEverything();
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Coordinator of session {} failed", sessionId, e);
            abandonInFlight();
            done.completeExceptionally(e);
            executor.finished(sessionId, this);
            MdcContext.clear();
            return;
        }
        try {
            GraphState finalState = executor.stateManager().get(sessionId);
            executor.stateManager().flush(sessionId);
            long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000;
            executor.metrics().recordSessionResult(finalState.sessionStatus(), elapsedMs);
            log.info("Session {} finished: {} in {} ms", sessionId, finalState.sessionStatus(), elapsedMs);
            done.complete(finalState);
        } catch (RuntimeException e) {
            done.completeExceptionally(e);
        } finally {
            executor.finished(sessionId, this);
            MdcContext.clear();
        }
    }

    private void coordinate() throws InterruptedException {
        while (true) {
            if (cancelRequested) {
                cancelEverything();
                return;
            }
            GraphState state = skipBlocked(executor.stateManager().get(sessionId));
            Instant now = executor.clock().instant();

            List<Task> ready = state.taskState().readyTasks(now);
            int capacity = executor.properties().getWorkers() - inFlight.size();
            for (Task task : ready) {
                if (capacity <= 0) break;
                if (inFlight.containsKey(task.id())) continue;
                if (dispatch(task)) capacity--;
            }

            state = executor.stateManager().get(sessionId);
            if (inFlight.isEmpty() && !state.taskState().hasUnfinishedTasks()) {
                return;
            }

            long waitMs = MAX_WAIT_MS;
            if (inFlight.isEmpty()) {
                var nextRetry = state.taskState().nextRetryAt(executor.clock().instant());
                if (nextRetry.isPresent()) {
                    waitMs = Math.max(1, Duration.between(executor.clock().instant(), nextRetry.get()).toMillis());
                } else if (state.taskState().readyTasks(executor.clock().instant()).isEmpty()) {
                    skipUnreachable(state);
                    continue;
                }
            }

            Completion completion = completions.poll(Math.min(waitMs, MAX_WAIT_MS), TimeUnit.MILLISECONDS);
            while (completion != null) {
                handle(completion);
                completion = completions.poll();
            }
        }
    }

    /**
     * Starts one attempt. INTEGRATION and FEEDBACK run right here on the coordinator; analysis tasks go
     * to the worker pool under a hard deadline.
     */
    private boolean dispatch(Task task) {
        if (!apply(TransitionTask.start(task.id()))) {
            return false;
        }
        log.debug("Dispatching {} (priority {}, attempt {})", task.id(), task.priority(), task.attemptCount() + 1);

        var attempt = new Attempt(task, completions);
        if (!task.type().isModality()) {
            runInProcess(task, attempt);
            inFlight.put(task.id(), attempt);
            return true;
        }

        AnalyzerCapability capability;
        try {
            capability = executor.registry().require(task.modality());
        } catch (InvalidConfigurationException e) {
            log.error("Cannot run {}: {}", task.id(), e.getMessage());
            attempt.settle(Completion.failure(task, new InvalidParamsException(e.getMessage()), 0));
            inFlight.put(task.id(), attempt);
            return true;
        }

        var deadline = Deadline.after(Duration.ofMillis(executor.properties().getTaskTimeoutMs()), executor.clock());
        var userContext = executor.stateManager().get(sessionId).userContext();
        var work = executor.workers().submit(() -> {
            MdcContext.setTask(sessionId, task.id(), task.type().name());
            try {
                var inputs = executor.submissions().get(task.inputRef())
                        .orElseThrow(() -> new InputUnavailableException("Submission " + task.inputRef() + " is not available"));
                AnalysisResult result = capability.analyze(
                        new AnalysisInput(sessionId, task.id(), userContext, inputs), task.inputParams(), deadline);
                attempt.settle(Completion.success(task, result, attempt.elapsedMs()));
            } catch (AnalyzerException e) {
                attempt.settle(Completion.failure(task, e, attempt.elapsedMs()));
            } catch (RuntimeException e) {
                attempt.settle(Completion.failure(task,
                        new TransientProviderException("Analyzer error: " + e.getMessage(), e), attempt.elapsedMs()));
            } finally {
                MdcContext.clear();
            }
        });
        attempt.bindWork(work);
        attempt.bindDeadline(executor.timer().schedule(() -> {
            var timeout = new DeadlineExceededException(
                    "Timed out after " + executor.properties().getTaskTimeoutMs() + " ms");
            if (attempt.settle(Completion.timeout(task, timeout, attempt.elapsedMs()))) {
                attempt.interruptWorker();
            }
        }, executor.properties().getTaskTimeoutMs(), TimeUnit.MILLISECONDS));
        inFlight.put(task.id(), attempt);
        return true;
    }

    private void runInProcess(Task task, Attempt attempt) {
        MdcContext.setTask(sessionId, task.id(), task.type().name());
        try {
            GraphState state = executor.stateManager().get(sessionId);
            if (task.type() == TaskType.INTEGRATION) {
                var score = executor.integrator().integrate(state);
                log.info("Session {} overall score {}", sessionId, String.format("%.3f", score.overallScore()));
                attempt.settle(Completion.integrated(task, score, attempt.elapsedMs()));
            } else {
                // the report is a view over the state and is rebuilt on request; this checks it can be built
                var report = executor.feedbackGenerator().generate(state);
                log.info("Session {} feedback: {} strengths, {} weaknesses", sessionId,
                        report.strengths().size(), report.weaknesses().size());
                attempt.settle(Completion.success(task, null, attempt.elapsedMs()));
            }
        } catch (IntegrationException e) {
            attempt.settle(Completion.failure(task, new InvalidParamsException(e.getMessage()), attempt.elapsedMs()));
        } catch (RuntimeException e) {
            attempt.settle(Completion.failure(task,
                    new TransientProviderException(task.type() + " failed: " + e.getMessage(), e), attempt.elapsedMs()));
        } finally {
            MdcContext.clearTask();
        }
    }

    private void handle(Completion completion) {
        if (completion.kind() == Completion.Kind.WAKE_UP) {
            return;
        }
        Task task = completion.task();
        var attempt = inFlight.remove(task.id());
        if (attempt != null) {
            attempt.stopDeadline();
        }
        executor.metrics().recordTaskDuration(task.type(), completion.elapsedMs());
        MdcContext.setTask(sessionId, task.id(), task.type().name());
        try {
            switch (completion.kind()) {
                case SUCCEEDED -> succeed(task, completion);
                case TIMED_OUT -> {
                    executor.metrics().recordTimeout(task.type());
                    fail(task, completion.error());
                }
                case FAILED -> fail(task, completion.error());
                default -> { }
            }
        } finally {
            MdcContext.clearTask();
        }
    }

    private void succeed(Task task, Completion completion) {
        AnalysisResult result = completion.result();
        if (result != null) {
            if (!task.id().equals(result.taskId()) || result.modality() != task.modality()) {
                fail(task, new InvalidParamsException("Analyzer returned a result for " + result.taskId()
                        + "/" + result.modality()));
                return;
            }
            if (!apply(new StateMutation.RecordResult(result))) return;
        }
        if (completion.integration() != null
                && !apply(new StateMutation.RecordIntegration(task.id(), completion.integration()))) {
            return;
        }
        if (apply(TransitionTask.succeed(task.id()))) {
            executor.metrics().recordTaskOutcome(task.type(), TaskStatus.SUCCEEDED);
            log.info("{} succeeded", task.id());
        }
    }

    private void fail(Task task, RuntimeException error) {
        String message = error.getMessage();
        if (error instanceof InputUnavailableException) {
            if (apply(TransitionTask.skip(task.id(), TaskStatus.RUNNING, message))) {
                executor.metrics().recordTaskOutcome(task.type(), TaskStatus.SKIPPED);
                log.info("{} skipped: {}", task.id(), message);
            }
            return;
        }
        boolean retryable = error instanceof AnalyzerException ae ? ae.retryable() : true;
        if (!retryable) {
            if (apply(TransitionTask.failPermanently(task.id(), message))) {
                executor.metrics().recordTaskOutcome(task.type(), TaskStatus.FAILED);
                log.error("{} failed permanently: {}", task.id(), message);
            }
            return;
        }
        if (!apply(TransitionTask.fail(task.id(), message))) {
            return;
        }
        executor.metrics().recordTaskOutcome(task.type(), TaskStatus.FAILED);
        Task failed = executor.stateManager().get(sessionId).taskState().require(task.id());
        if (failed.isRetryable()) {
            Duration backoff = executor.retryPolicy().backoff(failed.attemptCount());
            Instant retryAt = executor.clock().instant().plus(backoff);
            if (apply(TransitionTask.requeue(task.id(), retryAt))) {
                executor.metrics().recordRetry(task.type());
                log.warn("{} attempt {}/{} failed ({}); retrying in {} ms", task.id(), failed.attemptCount(),
                        failed.maxAttempts(), message, backoff.toMillis());
            }
        } else {
            log.warn("{} failed after {} attempts: {}", task.id(), failed.attemptCount(), message);
        }
    }

    /** Skips PENDING tasks that wait on a dependency which can no longer succeed. */
    private GraphState skipBlocked(GraphState state) {
        List<Task> blocked = state.taskState().blockedTasks();
        while (!blocked.isEmpty()) {
            for (Task task : blocked) {
                if (apply(TransitionTask.skip(task.id(), TaskStatus.PENDING, "upstream dependency did not succeed"))) {
                    executor.metrics().recordTaskOutcome(task.type(), TaskStatus.SKIPPED);
                    log.info("{} skipped: upstream dependency did not succeed", task.id());
                }
            }
            state = executor.stateManager().get(sessionId);
            blocked = state.taskState().blockedTasks();
        }
        return state;
    }

    /**
     * Nothing running, nothing ready, no backoff pending, yet tasks remain: their dependencies name tasks
     * that were never added. They are skipped so the session can finish.
     */
    private void skipUnreachable(GraphState state) {
        for (Task task : state.taskState().withStatus(TaskStatus.PENDING)) {
            log.warn("{} skipped: dependencies {} can never be satisfied", task.id(),
                    state.taskState().dependenciesOf(task.id()));
            apply(TransitionTask.skip(task.id(), TaskStatus.PENDING, "unsatisfiable dependencies"));
        }
    }

    private void cancelEverything() {
        abandonInFlight();
        GraphState state = executor.stateManager().get(sessionId);
        for (Task task : state.taskState().ordered()) {
            if (task.isTerminal()) continue;
            if (task.status() == TaskStatus.FAILED) {
                apply(TransitionTask.requeue(task.id(), null));
                apply(TransitionTask.cancel(task.id(), TaskStatus.PENDING));
            } else {
                apply(TransitionTask.cancel(task.id(), task.status()));
            }
        }
        log.info("Session {} cancelled", sessionId);
    }

    private void abandonInFlight() {
        inFlight.values().forEach(Attempt::abandon);
        inFlight.clear();
    }

    /** Applies a mutation; a lost compare-and-set means someone else already moved the task. */
    private boolean apply(StateMutation mutation) {
        try {
            executor.stateManager().apply(sessionId, mutation);
            return true;
        } catch (StaleRevisionException e) {
            log.debug("Dropped {}: {}", mutation.describe(), e.getMessage());
            return false;
        }
    }
}
