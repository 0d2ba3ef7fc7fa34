package io.github.drompincen.repowatch.persistence.document;

import io.github.drompincen.repowatch.protocol.api.EventKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "repo_events")
@CompoundIndex(name = "schedule_event_idx", def = "{'scheduleId': 1, 'eventId': 1}")
public class RepoEventDocument {

    @Id
    private String id;
    private String eventId;
    private EventKind kind;
    private String githubType;
    private String repoName;
    private String actor;
    private Instant createdAt;
    private Map<String, Object> payload;
    private String scheduleId;
    @Indexed
    private String taskId;
    private Instant savedAt;

    public RepoEventDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getEventId() { return eventId; }
    public void setEventId(String eventId) { this.eventId = eventId; }
    public EventKind getKind() { return kind; }
    public void setKind(EventKind kind) { this.kind = kind; }
    public String getGithubType() { return githubType; }
    public void setGithubType(String githubType) { this.githubType = githubType; }
    public String getRepoName() { return repoName; }
    public void setRepoName(String repoName) { this.repoName = repoName; }
    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public Instant getSavedAt() { return savedAt; }
    public void setSavedAt(Instant savedAt) { this.savedAt = savedAt; }
}
