package io.github.drompincen.repowatch.runtime.error;

public class MissingCredentialException extends RepoWatchException {

    public MissingCredentialException(String property) {
        super("Credential is not configured: " + property);
    }
}
