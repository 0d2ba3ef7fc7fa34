package io.github.drompincen.repowatch.persistence.repository;

import io.github.drompincen.repowatch.persistence.document.RepoEventDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface RepoEventRepository extends MongoRepository<RepoEventDocument, String> {
    List<RepoEventDocument> findByScheduleIdOrderByCreatedAtDesc(String scheduleId);
    List<RepoEventDocument> findByTaskIdOrderByCreatedAtDesc(String taskId);
    boolean existsByEventIdAndScheduleId(String eventId, String scheduleId);
    long deleteByScheduleId(String scheduleId);
}
