package io.github.drompincen.repowatch.runtime.error;

public class ScheduleNotFoundException extends RepoWatchException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public String getScheduleId() { return scheduleId; }
}
