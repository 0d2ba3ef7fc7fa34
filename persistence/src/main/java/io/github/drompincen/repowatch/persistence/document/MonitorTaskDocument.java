package io.github.drompincen.repowatch.persistence.document;

import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Document(collection = "repo_tasks")
@CompoundIndex(name = "schedule_status_end_idx", def = "{'scheduleId': 1, 'status': 1, 'endTime': -1}")
public class MonitorTaskDocument {

    @Id
    private String taskId;
    // null for ad-hoc runs
    private String scheduleId;
    private String name;
    private String repoOwner;
    private String repoName;
    private Set<EventKind> eventTypes = EnumSet.noneOf(EventKind.class);
    private TaskPhase status = TaskPhase.WAITING;
    private String statusDetail;
    private String workerHandle;
    private Instant startTime;
    private Instant endTime;
    private Map<String, Object> statistic = new LinkedHashMap<>();
    private String errorMessage;
    private Instant createdAt;

    public MonitorTaskDocument() {}

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getRepoOwner() { return repoOwner; }
    public void setRepoOwner(String repoOwner) { this.repoOwner = repoOwner; }
    public String getRepoName() { return repoName; }
    public void setRepoName(String repoName) { this.repoName = repoName; }
    public Set<EventKind> getEventTypes() { return eventTypes; }
    public void setEventTypes(Set<EventKind> eventTypes) { this.eventTypes = eventTypes; }
    public TaskPhase getStatus() { return status; }
    public void setStatus(TaskPhase status) { this.status = status; }
    public String getStatusDetail() { return statusDetail; }
    public void setStatusDetail(String statusDetail) { this.statusDetail = statusDetail; }
    public String getWorkerHandle() { return workerHandle; }
    public void setWorkerHandle(String workerHandle) { this.workerHandle = workerHandle; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public Map<String, Object> getStatistic() { return statistic; }
    public void setStatistic(Map<String, Object> statistic) { this.statistic = statistic; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
