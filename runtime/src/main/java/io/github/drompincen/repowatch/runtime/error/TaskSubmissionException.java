package io.github.drompincen.repowatch.runtime.error;

public class TaskSubmissionException extends RepoWatchException {

    public TaskSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
