package io.github.drompincen.repowatch.runtime.error;

import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;

public class InvalidStateTransitionException extends RepoWatchException {

    private final String scheduleId;
    private final ScheduleStatus current;
    private final ScheduleStatus required;

    public InvalidStateTransitionException(String scheduleId, ScheduleStatus current, ScheduleStatus required) {
        super("Schedule " + scheduleId + " is " + current + ", expected " + required);
        this.scheduleId = scheduleId;
        this.current = current;
        this.required = required;
    }

    public String getScheduleId() { return scheduleId; }
    public ScheduleStatus getCurrent() { return current; }
    public ScheduleStatus getRequired() { return required; }
}
