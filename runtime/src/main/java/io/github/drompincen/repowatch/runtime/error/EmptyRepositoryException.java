package io.github.drompincen.repowatch.runtime.error;

public class EmptyRepositoryException extends RepoWatchException {

    public EmptyRepositoryException() {
        super("Repository owner and name must not be empty");
    }
}
