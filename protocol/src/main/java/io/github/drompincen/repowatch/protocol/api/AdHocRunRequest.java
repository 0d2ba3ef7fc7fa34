package io.github.drompincen.repowatch.protocol.api;

import java.util.Set;

public record AdHocRunRequest(
        String repoOwner,
        String repoName,
        Set<EventKind> eventTypes
) {}
