package io.github.drompincen.repowatch.runtime.error;

public class TaskNotFoundException extends RepoWatchException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() { return taskId; }
}
