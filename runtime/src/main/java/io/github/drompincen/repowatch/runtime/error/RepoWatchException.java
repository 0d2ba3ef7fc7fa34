package io.github.drompincen.repowatch.runtime.error;

/**
 * Root of the monitor's error taxonomy. Registry operations surface these to the caller;
 * a running task catches them at its boundary and ends in ERROR.
 */
public class RepoWatchException extends RuntimeException {

    public RepoWatchException(String message) {
        super(message);
    }

    public RepoWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
