package io.github.drompincen.repowatch.persistence.document;

import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

@Document(collection = "repo_schedules")
public class RepoScheduleDocument {

    public static final String NO_DATE = "-";

    @Id
    private String scheduleId;
    private String name;
    private String repoOwner;
    private String repoName;
    private String cron;
    private Set<EventKind> eventTypes = EnumSet.noneOf(EventKind.class);
    private long runNumber;
    // epoch seconds, 0 when never run
    private long lastRunTime;
    private String lastRunDate = NO_DATE;
    private String nextRunDate = NO_DATE;
    @Indexed
    private ScheduleStatus status = ScheduleStatus.RUNNING;
    private Instant createdAt;
    private Instant updatedAt;

    public RepoScheduleDocument() {}

    public String fullRepoName() {
        return repoOwner + "/" + repoName;
    }

    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getRepoOwner() { return repoOwner; }
    public void setRepoOwner(String repoOwner) { this.repoOwner = repoOwner; }
    public String getRepoName() { return repoName; }
    public void setRepoName(String repoName) { this.repoName = repoName; }
    public String getCron() { return cron; }
    public void setCron(String cron) { this.cron = cron; }
    public Set<EventKind> getEventTypes() { return eventTypes; }
    public void setEventTypes(Set<EventKind> eventTypes) { this.eventTypes = eventTypes; }
    public long getRunNumber() { return runNumber; }
    public void setRunNumber(long runNumber) { this.runNumber = runNumber; }
    public long getLastRunTime() { return lastRunTime; }
    public void setLastRunTime(long lastRunTime) { this.lastRunTime = lastRunTime; }
    public String getLastRunDate() { return lastRunDate; }
    public void setLastRunDate(String lastRunDate) { this.lastRunDate = lastRunDate; }
    public String getNextRunDate() { return nextRunDate; }
    public void setNextRunDate(String nextRunDate) { this.nextRunDate = nextRunDate; }
    public ScheduleStatus getStatus() { return status; }
    public void setStatus(ScheduleStatus status) { this.status = status; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
