package io.github.drompincen.repowatch.gateway.controller;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoEventDocument;
import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.protocol.api.MonitorTaskResponse;
import io.github.drompincen.repowatch.protocol.api.RepoEventResponse;
import io.github.drompincen.repowatch.protocol.api.RepoScheduleResponse;

final class ResponseMappers {

    private ResponseMappers() {}

    static RepoScheduleResponse toResponse(RepoScheduleDocument doc) {
        return new RepoScheduleResponse(
                doc.getScheduleId(),
                doc.getName(),
                doc.getRepoOwner(),
                doc.getRepoName(),
                doc.getCron(),
                doc.getEventTypes(),
                doc.getRunNumber(),
                doc.getLastRunTime(),
                doc.getLastRunDate(),
                doc.getNextRunDate(),
                doc.getStatus(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    static MonitorTaskResponse toResponse(MonitorTaskDocument doc) {
        return new MonitorTaskResponse(
                doc.getTaskId(),
                doc.getScheduleId(),
                doc.getName(),
                doc.getRepoOwner(),
                doc.getRepoName(),
                doc.getStatus(),
                doc.getStatusDetail(),
                doc.getWorkerHandle(),
                doc.getStartTime(),
                doc.getEndTime(),
                doc.getStatistic(),
                doc.getErrorMessage(),
                doc.getCreatedAt()
        );
    }

    static RepoEventResponse toResponse(RepoEventDocument doc) {
        return new RepoEventResponse(
                doc.getEventId(),
                doc.getKind(),
                doc.getGithubType(),
                doc.getActor(),
                doc.getCreatedAt(),
                doc.getRepoName(),
                doc.getPayload(),
                doc.getScheduleId(),
                doc.getTaskId(),
                doc.getSavedAt()
        );
    }
}
