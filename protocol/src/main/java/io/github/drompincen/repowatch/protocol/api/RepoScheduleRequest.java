package io.github.drompincen.repowatch.protocol.api;

import java.util.Set;

public record RepoScheduleRequest(
        String name,
        String repoOwner,
        String repoName,
        String cron,
        Set<EventKind> eventTypes
) {}
