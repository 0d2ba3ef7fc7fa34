package io.github.drompincen.repowatch.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One previously-seen event for one schedule entry. The index is deliberately not unique:
 * two overlapping runs of the same entry may both record the same fingerprint.
 */
@Document(collection = "repo_event_fingerprints")
@CompoundIndex(name = "schedule_fingerprint_idx", def = "{'scheduleId': 1, 'fingerprint': 1}")
public class EventFingerprintDocument {

    @Id
    private String id;
    private String scheduleId;
    private String fingerprint;
    private Instant createdAt;

    public EventFingerprintDocument() {}

    public EventFingerprintDocument(String scheduleId, String fingerprint, Instant createdAt) {
        this.scheduleId = scheduleId;
        this.fingerprint = fingerprint;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
