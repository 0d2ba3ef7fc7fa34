package io.github.drompincen.repowatch.runtime.github;

import io.github.drompincen.repowatch.protocol.api.EventKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One repository activity item, reduced to the fields the monitor works with.
 * {@code rawPayload} keeps the source payload for persistence.
 */
public record NormalizedEvent(
        String id,
        EventKind kind,
        String githubType,
        String actor,
        Instant createdAt,
        String repoName,
        EventPayload payload,
        Map<String, Object> rawPayload
) {
    public NormalizedEvent {
        // payloads carry JSON nulls, which Map.copyOf rejects
        rawPayload = rawPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawPayload));
    }
}
