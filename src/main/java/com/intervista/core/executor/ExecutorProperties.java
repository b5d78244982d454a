package com.intervista.core.executor;

import com.intervista.core.config.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds {@code intervista.executor.*}.
 *
 * <pre>
 * intervista:
 *   executor:
 *     workers: 4               # concurrent attempts per session
 *     task-timeout-ms: 30000   # hard deadline per attempt
 *     max-attempts: 3
 *     backoff-base-ms: 200
 *     backoff-max-ms: 5000
 *     session-threads: 8       # sessions coordinated at the same time
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "intervista.executor")
public class ExecutorProperties {

    private int workers = 4;
    private long taskTimeoutMs = 30_000;
    private int maxAttempts = 3;
    private long backoffBaseMs = 200;
    private long backoffMaxMs = 5_000;
    private int sessionThreads = 8;

    @PostConstruct
    void validate() {
        if (workers < 1) {
            throw new InvalidConfigurationException("intervista.executor.workers must be >= 1, got " + workers);
        }
        if (taskTimeoutMs < 1) {
            throw new InvalidConfigurationException("intervista.executor.task-timeout-ms must be positive, got " + taskTimeoutMs);
        }
        if (maxAttempts < 1) {
            throw new InvalidConfigurationException("intervista.executor.max-attempts must be >= 1, got " + maxAttempts);
        }
        if (backoffBaseMs < 0 || backoffMaxMs < backoffBaseMs) {
            throw new InvalidConfigurationException("intervista.executor backoff must satisfy 0 <= base <= max, got base="
                    + backoffBaseMs + " max=" + backoffMaxMs);
        }
        if (sessionThreads < 1) {
            throw new InvalidConfigurationException("intervista.executor.session-threads must be >= 1, got " + sessionThreads);
        }
    }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public long getTaskTimeoutMs() { return taskTimeoutMs; }
    public void setTaskTimeoutMs(long taskTimeoutMs) { this.taskTimeoutMs = taskTimeoutMs; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public long getBackoffBaseMs() { return backoffBaseMs; }
    public void setBackoffBaseMs(long backoffBaseMs) { this.backoffBaseMs = backoffBaseMs; }
    public long getBackoffMaxMs() { return backoffMaxMs; }
    public void setBackoffMaxMs(long backoffMaxMs) { this.backoffMaxMs = backoffMaxMs; }
    public int getSessionThreads() { return sessionThreads; }
    public void setSessionThreads(int sessionThreads) { this.sessionThreads = sessionThreads; }
}
