package io.github.drompincen.repowatch.runtime.error;

public class PersistenceFailureException extends RepoWatchException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
