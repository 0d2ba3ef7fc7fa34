package io.github.drompincen.repowatch.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Repository activity types understood by the monitor. Each kind maps to one GitHub
 * event type, except {@link #OTHER} which covers every type without a dedicated payload.
 */
public enum EventKind {
    PUSH("push", "PushEvent"),
    ISSUES("issues", "IssuesEvent"),
    PULL_REQUEST("pull-request", "PullRequestEvent"),
    CREATE_REF("create-ref", "CreateEvent"),
    DELETE_REF("delete-ref", "DeleteEvent"),
    RELEASE("release", "ReleaseEvent"),
    OTHER("other", null);

    private final String tag;
    private final String githubType;

    EventKind(String tag, String githubType) {
        this.tag = tag;
        this.githubType = githubType;
    }

    @JsonValue
    public String tag() { return tag; }

    public String githubType() { return githubType; }

    public static EventKind fromGithubType(String type) {
        if (type != null) {
            for (EventKind kind : values()) {
                if (type.equals(kind.githubType)) return kind;
            }
        }
        return OTHER;
    }

    /**
     * Accepts either the tag ({@code pull-request}), the enum name ({@code PULL_REQUEST})
     * or the GitHub type name ({@code PullRequestEvent}).
     */
    @JsonCreator
    public static EventKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        String v = value.trim();
        for (EventKind kind : values()) {
            if (kind.tag.equalsIgnoreCase(v)
                    || kind.name().equalsIgnoreCase(v)
                    || (kind.githubType != null && kind.githubType.equalsIgnoreCase(v))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value.toLowerCase(Locale.ROOT));
    }

    public static Set<EventKind> defaultMonitored() {
        return EnumSet.of(PUSH, ISSUES, PULL_REQUEST);
    }
}
