package io.github.drompincen.repowatch.protocol.api;

/**
 * Lifecycle of a monitoring task. A task starts at {@link #WAITING}, moves through the
 * working phases while the worker executes it and ends at {@link #DONE} or {@link #ERROR}.
 */
public enum TaskPhase {
    WAITING,
    FETCHING,
    SAVING,
    NOTIFYING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
