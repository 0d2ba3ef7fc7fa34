package io.github.drompincen.repowatch.runtime.notify;

import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.runtime.github.EventPayload;
import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownReportRendererTest {

    private final MarkdownReportRenderer renderer = new MarkdownReportRenderer();

    @Test
    void render_listsAtMostTenEventsWithOverflowNote() {
        NotificationMessage message = renderer.render(new NotificationBatch("octo", "repo", TestEvents.pushes(12)));

        assertThat(message.kind()).isEqualTo(MessageKind.MARKDOWN);
        assertThat(message.title()).isEqualTo("GitHub repo monitor - octo/repo");
        assertThat(message.body())
                .contains("[octo/repo](https://github.com/octo/repo)")
                .contains("**Events**: 12")
                .contains("**10. PushEvent**")
                .doesNotContain("**11. PushEvent**")
                .contains("2 more events not shown");
    }

    @Test
    void render_addsTypeSpecificDetail() {
        String body = renderer.render(new NotificationBatch("octo", "repo",
                List.of(TestEvents.push("1", "x".repeat(150)), TestEvents.issue("2", "Crash on start")))).body();

        assertThat(body)
                .contains("alice pushed 3 commit(s) to main")
                .contains("- **Commit**: " + "x".repeat(100) + "\n")
                .contains("bob opened issue: Crash on start")
                .contains("- **Issue**: https://github.com/octo/repo/issues/12")
                .doesNotContain("more events not shown");
    }

    @Test
    void summaries_coverEveryKind() {
        assertThat(EventFormatter.summary(event(EventKind.CREATE_REF, "CreateEvent",
                new EventPayload.RefPayload("tag", "v1")))).isEqualTo("eve created tag: v1");
        assertThat(EventFormatter.summary(event(EventKind.DELETE_REF, "DeleteEvent",
                new EventPayload.RefPayload("branch", "old")))).isEqualTo("eve deleted branch: old");
        assertThat(EventFormatter.summary(event(EventKind.PULL_REQUEST, "PullRequestEvent",
                new EventPayload.PullRequestPayload("closed", 5, "Speed up", null))))
                .isEqualTo("eve closed pull request: Speed up");
        assertThat(EventFormatter.summary(event(EventKind.RELEASE, "ReleaseEvent",
                new EventPayload.ReleasePayload("published", null, "v3", null))))
                .isEqualTo("eve published release: v3");
        assertThat(EventFormatter.summary(event(EventKind.OTHER, "ForkEvent", new EventPayload.OtherPayload())))
                .isEqualTo("eve triggered ForkEvent");
    }

    @Test
    void detail_missingLinkIsNa() {
        NormalizedEvent pr = event(EventKind.PULL_REQUEST, "PullRequestEvent",
                new EventPayload.PullRequestPayload("opened", 5, "t", null));

        assertThat(EventFormatter.detail(pr)).hasValue(new EventFormatter.Detail("Pull request", "N/A"));
    }

    private static NormalizedEvent event(EventKind kind, String type, EventPayload payload) {
        return new NormalizedEvent("1", kind, type, "eve", Instant.parse("2024-05-01T12:00:00Z"),
                "octo/repo", payload, Map.of());
    }
}
