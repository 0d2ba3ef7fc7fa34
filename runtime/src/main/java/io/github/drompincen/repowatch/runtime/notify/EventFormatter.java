package io.github.drompincen.repowatch.runtime.notify;

import io.github.drompincen.repowatch.runtime.github.EventPayload;
import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;

import java.util.Optional;

/**
 * One-line human readable descriptions of events, shared by all channels.
 */
public final class EventFormatter {

    static final int COMMIT_MESSAGE_LIMIT = 100;

    private EventFormatter() {}

    public static String summary(NormalizedEvent event) {
        String actor = event.actor();
        EventPayload payload = event.payload();
        return switch (event.kind()) {
            case PUSH -> {
                EventPayload.PushPayload push = (EventPayload.PushPayload) payload;
                yield actor + " pushed " + push.size() + " commit(s) to " + push.branch();
            }
            case ISSUES -> {
                EventPayload.IssuePayload issue = (EventPayload.IssuePayload) payload;
                yield actor + " " + issue.action() + " issue: " + issue.title();
            }
            case PULL_REQUEST -> {
                EventPayload.PullRequestPayload pr = (EventPayload.PullRequestPayload) payload;
                yield actor + " " + pr.action() + " pull request: " + pr.title();
            }
            case CREATE_REF -> {
                EventPayload.RefPayload ref = (EventPayload.RefPayload) payload;
                yield actor + " created " + ref.refType() + ": " + ref.ref();
            }
            case DELETE_REF -> {
                EventPayload.RefPayload ref = (EventPayload.RefPayload) payload;
                yield actor + " deleted " + ref.refType() + ": " + ref.ref();
            }
            case RELEASE -> {
                EventPayload.ReleasePayload release = (EventPayload.ReleasePayload) payload;
                yield actor + " " + release.action() + " release: " + release.displayName();
            }
            case OTHER -> actor + " triggered " + event.githubType();
        };
    }

    /**
     * Extra labelled line for the detailed report: the first commit message of a push,
     * or the web link of an issue, pull request or release.
     */
    public static Optional<Detail> detail(NormalizedEvent event) {
        EventPayload payload = event.payload();
        switch (event.kind()) {
            case PUSH: {
                EventPayload.PushPayload push = (EventPayload.PushPayload) payload;
                if (push.commitMessages().isEmpty()) return Optional.empty();
                return Optional.of(new Detail("Commit", truncate(push.commitMessages().get(0), COMMIT_MESSAGE_LIMIT)));
            }
            case ISSUES:
                return Optional.of(new Detail("Issue", orNa(((EventPayload.IssuePayload) payload).htmlUrl())));
            case PULL_REQUEST:
                return Optional.of(new Detail("Pull request", orNa(((EventPayload.PullRequestPayload) payload).htmlUrl())));
            case RELEASE:
                return Optional.of(new Detail("Release", orNa(((EventPayload.ReleasePayload) payload).htmlUrl())));
            default:
                return Optional.empty();
        }
    }

    public static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }

    public record Detail(String label, String value) {}
}
