package io.github.drompincen.repowatch.protocol.api;

import java.time.Instant;
import java.util.Map;

public record MonitorTaskResponse(
        String taskId,
        String scheduleId,
        String name,
        String repoOwner,
        String repoName,
        TaskPhase status,
        String statusDetail,
        String workerHandle,
        Instant startTime,
        Instant endTime,
        Map<String, Object> statistic,
        String errorMessage,
        Instant createdAt
) {}
