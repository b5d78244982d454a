package com.intervista.core.state;

import com.intervista.core.model.Task;
import com.intervista.core.model.TaskStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable collection of a session's tasks plus their dependency adjacency.
 * <p>
 * {@code dependencies} maps a task id to the ids it waits for. A dependency may name a task that
 * has not been added yet; such a task simply never becomes ready until it is. The graph is kept
 * acyclic: every insertion is checked before anything is stored.
 *
 * @param tasks        tasks by id
 * @param dependencies dependency ids by task id
 * @param nextSequence creation counter used for FIFO tie-breaking
 */
public record TaskState(
    Map<String, Task> tasks,
    Map<String, Set<String>> dependencies,
    long nextSequence
) implements Serializable {

    /** CRITICAL first, then HIGH, NORMAL, LOW; equal priorities in creation order. */
    public static final Comparator<Task> DISPATCH_ORDER =
            Comparator.comparingInt((Task t) -> t.priority().rank()).reversed()
                    .thenComparingLong(Task::sequence);

    public TaskState {
        tasks = tasks == null ? Map.of() : Map.copyOf(tasks);
        var deps = new HashMap<String, Set<String>>();
        if (dependencies != null) {
            dependencies.forEach((id, ids) -> deps.put(id, ids == null ? Set.of() : Set.copyOf(ids)));
        }
        dependencies = Map.copyOf(deps);
    }

    public static TaskState empty() {
        return new TaskState(Map.of(), Map.of(), 0L);
    }

    /**
     * Adds one task.
     *
     * @throws CyclicDependencyException if the new edges close a cycle
     * @throws IllegalArgumentException  if a task with the same id exists
     */
    public TaskState add(Task task, Collection<String> dependsOn) {
        return addAll(List.of(new TaskNode(task, Set.copyOf(dependsOn))));
    }

    /**
     * Adds a batch of tasks atomically, in list order. The whole batch is validated before
     * insertion, so a cycle anywhere leaves this state untouched.
     */
    public TaskState addAll(List<TaskNode> nodes) {
        var newTasks = new HashMap<>(tasks);
        var newDeps = new HashMap<>(dependencies);
        long sequence = nextSequence;
        for (var node : nodes) {
            String id = node.task().id();
            if (newTasks.containsKey(id)) {
                throw new IllegalArgumentException("Task " + id + " already exists");
            }
            newTasks.put(id, node.task().withSequence(sequence++));
            newDeps.put(id, node.dependencies());
        }
        findCycle(newDeps).ifPresent(cycle -> {
            throw new CyclicDependencyException(cycle);
        });
        return new TaskState(newTasks, newDeps, sequence);
    }

    public Optional<Task> task(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Task require(String id) {
        var task = tasks.get(id);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task " + id);
        }
        return task;
    }

    public Set<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, Set.of());
    }

    /** All tasks in creation order. */
    public List<Task> ordered() {
        return tasks.values().stream()
                .sorted(Comparator.comparingLong(Task::sequence))
                .toList();
    }

    public TaskState withTask(Task updated) {
        if (!tasks.containsKey(updated.id())) {
            throw new IllegalArgumentException("Unknown task " + updated.id());
        }
        var newTasks = new HashMap<>(tasks);
        newTasks.put(updated.id(), updated);
        return new TaskState(newTasks, dependencies, nextSequence);
    }

    /**
     * PENDING tasks whose backoff has elapsed and whose dependencies are satisfied, in dispatch order.
     * A dependency is satisfied when it SUCCEEDED or, for a best-effort task, when it is terminal.
     */
    public List<Task> readyTasks(Instant now) {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .filter(t -> t.retryAt() == null || !t.retryAt().isAfter(now))
                .filter(this::dependenciesSatisfied)
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    /**
     * PENDING tasks that can never run because a strict dependency ended without succeeding.
     */
    public List<Task> blockedTasks() {
        var blocked = new ArrayList<Task>();
        for (var task : ordered()) {
            if (task.status() != TaskStatus.PENDING || task.bestEffort()) continue;
            for (var depId : dependenciesOf(task.id())) {
                var dep = tasks.get(depId);
                if (dep != null && dep.isTerminal() && dep.status() != TaskStatus.SUCCEEDED) {
                    blocked.add(task);
                    break;
                }
            }
        }
        return blocked;
    }

    /** Earliest pending backoff deadline after {@code now}, if any task is waiting on one. */
    public Optional<Instant> nextRetryAt(Instant now) {
        return tasks.values().stream()
                .filter(t -> t.status() == TaskStatus.PENDING && t.retryAt() != null && t.retryAt().isAfter(now))
                .map(Task::retryAt)
                .min(Comparator.naturalOrder());
    }

    public boolean hasUnfinishedTasks() {
        return tasks.values().stream().anyMatch(t -> !t.isTerminal());
    }

    public List<Task> withStatus(TaskStatus status) {
        return ordered().stream().filter(t -> t.status() == status).toList();
    }

    /**
     * Returns a copy in which tasks caught RUNNING by a crash are PENDING again.
     * Used only when restoring a persisted snapshot; succeeded work is kept as is.
     */
    public TaskState requeueInterrupted() {
        var newTasks = new HashMap<>(tasks);
        for (var task : tasks.values()) {
            if (task.status() == TaskStatus.RUNNING) {
                newTasks.put(task.id(), new Task(task.id(), task.type(), task.priority(), TaskStatus.PENDING,
                        task.inputRef(), task.inputParams(), task.bestEffort(), task.sequence(),
                        task.createdAt(), null, null, null, task.attemptCount(), task.maxAttempts(),
                        task.lastError()));
            }
        }
        return new TaskState(newTasks, dependencies, nextSequence);
    }

    private boolean dependenciesSatisfied(Task task) {
        for (var depId : dependenciesOf(task.id())) {
            var dep = tasks.get(depId);
            if (dep == null) return false;
            if (dep.status() == TaskStatus.SUCCEEDED) continue;
            if (task.bestEffort() && dep.isTerminal()) continue;
            return false;
        }
        return true;
    }

    private static Optional<List<String>> findCycle(Map<String, Set<String>> adjacency) {
        var visiting = new HashSet<String>();
        var done = new HashSet<String>();
        var path = new ArrayList<String>();
        for (var start : adjacency.keySet().stream().sorted().toList()) {
            var cycle = visit(start, adjacency, visiting, done, path);
            if (cycle.isPresent()) return cycle;
        }
        return Optional.empty();
    }

    private static Optional<List<String>> visit(String id, Map<String, Set<String>> adjacency,
                                                Set<String> visiting, Set<String> done, List<String> path) {
        if (done.contains(id)) return Optional.empty();
        if (visiting.contains(id)) {
            var cycle = new ArrayList<>(path.subList(path.indexOf(id), path.size()));
            cycle.add(id);
            return Optional.of(cycle);
        }
        visiting.add(id);
        path.add(id);
        for (var dep : adjacency.getOrDefault(id, Set.of())) {
            var cycle = visit(dep, adjacency, visiting, done, path);
            if (cycle.isPresent()) return cycle;
        }
        path.remove(path.size() - 1);
        visiting.remove(id);
        done.add(id);
        return Optional.empty();
    }
}
