package io.github.drompincen.repowatch.persistence.repository;

import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface RepoScheduleRepository extends MongoRepository<RepoScheduleDocument, String> {
}
