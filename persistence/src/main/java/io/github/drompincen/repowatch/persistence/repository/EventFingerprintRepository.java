package io.github.drompincen.repowatch.persistence.repository;

import io.github.drompincen.repowatch.persistence.document.EventFingerprintDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface EventFingerprintRepository extends MongoRepository<EventFingerprintDocument, String> {
    boolean existsByScheduleIdAndFingerprint(String scheduleId, String fingerprint);
    long deleteByScheduleId(String scheduleId);
}
