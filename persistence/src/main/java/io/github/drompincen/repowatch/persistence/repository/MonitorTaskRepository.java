package io.github.drompincen.repowatch.persistence.repository;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MonitorTaskRepository extends MongoRepository<MonitorTaskDocument, String> {
    List<MonitorTaskDocument> findByScheduleIdOrderByCreatedAtDesc(String scheduleId);
    List<MonitorTaskDocument> findAllByOrderByCreatedAtDesc();
    Optional<MonitorTaskDocument> findFirstByScheduleIdAndStatusOrderByEndTimeDesc(String scheduleId, TaskPhase status);
    long deleteByScheduleId(String scheduleId);
}
