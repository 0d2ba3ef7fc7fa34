package io.github.drompincen.repowatch.protocol.api;

public enum ScheduleStatus {
    RUNNING,
    STOPPED
}
