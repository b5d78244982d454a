package com.intervista.core.model;

/**
 * Thrown when a task is asked to move to a status its current status cannot reach.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to, String reason) {
        super("Task " + taskId + " cannot move from " + from + " to " + to
                + (reason != null ? ": " + reason : ""));
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
