package io.github.drompincen.repowatch.runtime.notify;

import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.runtime.github.EventPayload;
import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class TestEvents {

    private TestEvents() {}

    public static NormalizedEvent push(String id, String message) {
        return new NormalizedEvent(id, EventKind.PUSH, "PushEvent", "alice",
                Instant.parse("2024-05-01T12:01:00Z"), "octo/repo",
                new EventPayload.PushPayload("refs/heads/main", 3, List.of(message)), Map.of());
    }

    public static NormalizedEvent issue(String id, String title) {
        return new NormalizedEvent(id, EventKind.ISSUES, "IssuesEvent", "bob",
                Instant.parse("2024-05-01T12:02:00Z"), "octo/repo",
                new EventPayload.IssuePayload("opened", 12, title, "https://github.com/octo/repo/issues/12"),
                Map.of());
    }

    public static List<NormalizedEvent> pushes(int count) {
        List<NormalizedEvent> events = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            events.add(push("evt-" + i, "commit " + i));
        }
        return events;
    }
}
