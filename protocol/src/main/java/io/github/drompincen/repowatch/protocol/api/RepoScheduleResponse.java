package io.github.drompincen.repowatch.protocol.api;

import java.time.Instant;
import java.util.Set;

public record RepoScheduleResponse(
        String scheduleId,
        String name,
        String repoOwner,
        String repoName,
        String cron,
        Set<EventKind> eventTypes,
        long runNumber,
        long lastRunTime,
        String lastRunDate,
        String nextRunDate,
        ScheduleStatus status,
        Instant createdAt,
        Instant updatedAt
) {}
