package io.github.drompincen.repowatch.runtime.task;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoEventDocument;
import io.github.drompincen.repowatch.persistence.repository.MonitorTaskRepository;
import io.github.drompincen.repowatch.persistence.repository.RepoEventRepository;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.dedup.EventDeduplicator;
import io.github.drompincen.repowatch.runtime.github.EventPayload;
import io.github.drompincen.repowatch.runtime.github.GitHubEventFetcher;
import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import io.github.drompincen.repowatch.runtime.notify.NotificationDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RepoMonitorTaskRunnerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:05:00Z");

    @Mock private MonitorTaskRepository taskRepository;
    @Mock private RepoEventRepository eventRepository;
    @Mock private TaskLifecycle lifecycle;
    @Mock private GitHubEventFetcher fetcher;
    @Mock private EventDeduplicator deduplicator;
    @Mock private NotificationDispatcher dispatcher;
    @Captor private ArgumentCaptor<Map<String, Object>> statisticCaptor;
    @Captor private ArgumentCaptor<RepoEventDocument> eventCaptor;

    private RepoMonitorTaskRunner runner;

    @BeforeEach
    void setUp() {
        runner = new RepoMonitorTaskRunner(taskRepository, eventRepository, lifecycle, fetcher,
                deduplicator, dispatcher, new RepoWatchProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        when(fetcher.hasCredential()).thenReturn(true);
        when(taskRepository.findFirstByScheduleIdAndStatusOrderByEndTimeDesc(anyString(), eq(TaskPhase.DONE)))
                .thenReturn(Optional.empty());
    }

    @Test
    void missingCredential_goesStraightToErrorWithEndTime() {
        when(taskRepository.findById("t1")).thenReturn(Optional.of(task("t1", "s1")));
        when(fetcher.hasCredential()).thenReturn(false);

        runner.run("t1");

        verify(lifecycle).markError(eq("t1"), contains("repowatch.github.token"));
        verify(lifecycle).markEnded("t1");
        verify(lifecycle, never()).markStarted(any());
        verify(lifecycle, never()).markDone(any());
        verify(fetcher, never()).fetch(any(), any(), any(), any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void scheduledRun_fetchesDedupsSavesAndNotifies() {
        MonitorTaskDocument task = task("t1", "s1");
        when(taskRepository.findById("t1")).thenReturn(Optional.of(task));
        NormalizedEvent seen = event("evt-1");
        NormalizedEvent fresh = event("evt-2");
        when(fetcher.fetch(eq("octo"), eq("repo"), any(), any())).thenReturn(List.of(seen, fresh));
        when(deduplicator.filterNew("s1", List.of(seen, fresh))).thenReturn(List.of(fresh));

        runner.run("t1");

        InOrder order = inOrder(lifecycle, fetcher, deduplicator, eventRepository, dispatcher);
        order.verify(lifecycle).markStarted("t1");
        order.verify(lifecycle).enterPhase("t1", TaskPhase.FETCHING, "fetching events");
        order.verify(fetcher).fetch(eq("octo"), eq("repo"), eq(EventKind.defaultMonitored()),
                eq(NOW.minusSeconds(3600)));
        order.verify(deduplicator).filterNew("s1", List.of(seen, fresh));
        order.verify(lifecycle).enterPhase("t1", TaskPhase.SAVING, "saving 1 events");
        order.verify(eventRepository).save(eventCaptor.capture());
        order.verify(lifecycle).enterPhase(eq("t1"), eq(TaskPhase.NOTIFYING), anyString());
        order.verify(dispatcher).notify("octo", "repo", List.of(fresh));
        order.verify(lifecycle).markDone("t1");
        order.verify(lifecycle).markEnded("t1");

        RepoEventDocument saved = eventCaptor.getValue();
        assertThat(saved.getEventId()).isEqualTo("evt-2");
        assertThat(saved.getScheduleId()).isEqualTo("s1");
        assertThat(saved.getTaskId()).isEqualTo("t1");
        assertThat(saved.getSavedAt()).isEqualTo(NOW);

        verify(lifecycle).recordStatistic(eq("t1"), statisticCaptor.capture());
        assertThat(statisticCaptor.getValue())
                .containsEntry("event_count", 1)
                .containsEntry("fetched_count", 2);
        verify(lifecycle, never()).markError(any(), any());
    }

    @Test
    void since_isEndOfLastSuccessfulRun() {
        MonitorTaskDocument previous = task("t0", "s1");
        previous.setEndTime(Instant.parse("2024-05-01T12:00:03Z"));
        when(taskRepository.findFirstByScheduleIdAndStatusOrderByEndTimeDesc("s1", TaskPhase.DONE))
                .thenReturn(Optional.of(previous));
        when(taskRepository.findById("t1")).thenReturn(Optional.of(task("t1", "s1")));
        when(fetcher.fetch(any(), any(), any(), any())).thenReturn(List.of());
        when(deduplicator.filterNew(anyString(), anyList())).thenReturn(List.of());

        runner.run("t1");

        verify(fetcher).fetch(any(), any(), any(), eq(Instant.parse("2024-05-01T12:00:03Z")));
        verify(lifecycle).markDone("t1");
    }

    @Test
    void adHocRun_skipsDeduplication() {
        when(taskRepository.findById("t1")).thenReturn(Optional.of(task("t1", null)));
        NormalizedEvent event = event("evt-1");
        when(fetcher.fetch(any(), any(), any(), any())).thenReturn(List.of(event));

        runner.run("t1");

        verifyNoInteractions(deduplicator);
        verify(eventRepository, never()).existsByEventIdAndScheduleId(any(), any());
        verify(dispatcher).notify("octo", "repo", List.of(event));
        verify(lifecycle).markDone("t1");
    }

    @Test
    void alreadyStoredEvent_isNotSavedTwice() {
        when(taskRepository.findById("t1")).thenReturn(Optional.of(task("t1", "s1")));
        NormalizedEvent event = event("evt-9");
        when(fetcher.fetch(any(), any(), any(), any())).thenReturn(List.of(event));
        when(deduplicator.filterNew("s1", List.of(event))).thenReturn(List.of(event));
        when(eventRepository.existsByEventIdAndScheduleId("evt-9", "s1")).thenReturn(true);

        runner.run("t1");

        verify(eventRepository, never()).save(any());
        verify(lifecycle).markDone("t1");
    }

    @Test
    void failureDuringRun_endsInErrorWithEndTime() {
        when(taskRepository.findById("t1")).thenReturn(Optional.of(task("t1", "s1")));
        when(fetcher.fetch(any(), any(), any(), any())).thenReturn(List.of(event("evt-1")));
        when(deduplicator.filterNew(anyString(), anyList())).thenThrow(new IllegalStateException("store down"));

        runner.run("t1");

        verify(lifecycle).markError("t1", "store down");
        verify(lifecycle).markEnded("t1");
        verify(lifecycle, never()).markDone(any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void vanishedTask_isIgnored() {
        when(taskRepository.findById("gone")).thenReturn(Optional.empty());

        runner.run("gone");

        verifyNoInteractions(lifecycle, fetcher);
    }

    private static MonitorTaskDocument task(String id, String scheduleId) {
        MonitorTaskDocument task = new MonitorTaskDocument();
        task.setTaskId(id);
        task.setScheduleId(scheduleId);
        task.setRepoOwner("octo");
        task.setRepoName("repo");
        task.setEventTypes(EventKind.defaultMonitored());
        return task;
    }

    private static NormalizedEvent event(String id) {
        return new NormalizedEvent(id, EventKind.PUSH, "PushEvent", "alice",
                Instant.parse("2024-05-01T12:01:00Z"), "octo/repo",
                new EventPayload.PushPayload("refs/heads/main", 1, List.of("fix")), Map.of("size", 1));
    }
}
