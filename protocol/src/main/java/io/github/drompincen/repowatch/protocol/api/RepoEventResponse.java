package io.github.drompincen.repowatch.protocol.api;

import java.time.Instant;
import java.util.Map;

public record RepoEventResponse(
        String eventId,
        EventKind kind,
        String githubType,
        String actor,
        Instant createdAt,
        String repoName,
        Map<String, Object> payload,
        String scheduleId,
        String taskId,
        Instant savedAt
) {}
