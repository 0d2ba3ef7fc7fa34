package io.github.drompincen.repowatch.runtime.github;

import java.util.List;

/**
 * Type-specific part of a {@link NormalizedEvent}. Each variant holds only the fields
 * the formatter needs for its {@link io.github.drompincen.repowatch.protocol.api.EventKind}.
 */
public sealed interface EventPayload {

    record PushPayload(String ref, int size, List<String> commitMessages) implements EventPayload {
        public PushPayload {
            commitMessages = commitMessages == null ? List.of() : List.copyOf(commitMessages);
        }

        public String branch() {
            if (ref == null || ref.isBlank()) return "unknown";
            return ref.substring(ref.lastIndexOf('/') + 1);
        }
    }

    record IssuePayload(String action, long number, String title, String htmlUrl) implements EventPayload {}

    record PullRequestPayload(String action, long number, String title, String htmlUrl) implements EventPayload {}

    /** Branch or tag creation and deletion. */
    record RefPayload(String refType, String ref) implements EventPayload {}

    record ReleasePayload(String action, String name, String tagName, String htmlUrl) implements EventPayload {
        public String displayName() {
            if (name != null && !name.isBlank()) return name;
            if (tagName != null && !tagName.isBlank()) return tagName;
            return "Unknown";
        }
    }

    record OtherPayload() implements EventPayload {}
}
