package com.intervista.core.state;

import com.intervista.core.model.Task;

import java.io.Serializable;
import java.util.Objects;
import java.util.Set;

/**
 * A task together with the ids of the tasks it depends on.
 */
public record TaskNode(Task task, Set<String> dependencies) implements Serializable {

    public TaskNode {
        Objects.requireNonNull(task, "task");
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    public static TaskNode of(Task task, String... dependencies) {
        return new TaskNode(task, Set.of(dependencies));
    }
}
