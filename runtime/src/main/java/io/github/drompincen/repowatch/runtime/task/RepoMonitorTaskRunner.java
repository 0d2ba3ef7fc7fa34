package io.github.drompincen.repowatch.runtime.task;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoEventDocument;
import io.github.drompincen.repowatch.persistence.repository.MonitorTaskRepository;
import io.github.drompincen.repowatch.persistence.repository.RepoEventRepository;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.dedup.EventDeduplicator;
import io.github.drompincen.repowatch.runtime.error.MissingCredentialException;
import io.github.drompincen.repowatch.runtime.github.GitHubEventFetcher;
import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import io.github.drompincen.repowatch.runtime.notify.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of one monitoring task, executed on a worker thread:
 * fetch, deduplicate, save, notify. Any failure ends the task in ERROR; the end time is
 * always recorded and nothing is retried.
 */
@Component
public class RepoMonitorTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(RepoMonitorTaskRunner.class);

    private final MonitorTaskRepository taskRepository;
    private final RepoEventRepository eventRepository;
    private final TaskLifecycle lifecycle;
    private final GitHubEventFetcher fetcher;
    private final EventDeduplicator deduplicator;
    private final NotificationDispatcher dispatcher;
    private final Duration defaultLookback;
    private final Clock clock;

    public RepoMonitorTaskRunner(MonitorTaskRepository taskRepository,
                                 RepoEventRepository eventRepository,
                                 TaskLifecycle lifecycle,
                                 GitHubEventFetcher fetcher,
                                 EventDeduplicator deduplicator,
                                 NotificationDispatcher dispatcher,
                                 RepoWatchProperties properties,
                                 Clock clock) {
        this.taskRepository = taskRepository;
        this.eventRepository = eventRepository;
        this.lifecycle = lifecycle;
        this.fetcher = fetcher;
        this.deduplicator = deduplicator;
        this.dispatcher = dispatcher;
        this.defaultLookback = properties.getScheduler().getDefaultLookback();
        this.clock = clock;
    }

    public void run(String taskId) {
        MonitorTaskDocument task = taskRepository.findById(taskId).orElse(null);
        if (task == null) {
            log.warn("Task {} no longer exists, nothing to run", taskId);
            return;
        }

        try {
            if (!fetcher.hasCredential()) {
                throw new MissingCredentialException("repowatch.github.token");
            }
            lifecycle.markStarted(taskId);
            execute(task);
            lifecycle.markDone(taskId);
            log.info("Task {} for {}/{} done", taskId, task.getRepoOwner(), task.getRepoName());
        } catch (Exception e) {
            log.error("Task {} for {}/{} failed: {}", taskId, task.getRepoOwner(), task.getRepoName(),
                    e.getMessage(), e);
            lifecycle.markError(taskId, e.getMessage());
        } finally {
            lifecycle.markEnded(taskId);
        }
    }

    private void execute(MonitorTaskDocument task) {
        String taskId = task.getTaskId();
        String scheduleId = task.getScheduleId();

        lifecycle.enterPhase(taskId, TaskPhase.FETCHING, "fetching events");
        Instant since = since(scheduleId);
        List<NormalizedEvent> fetched = fetcher.fetch(task.getRepoOwner(), task.getRepoName(),
                task.getEventTypes(), since);
        List<NormalizedEvent> fresh = scheduleId == null ? fetched : deduplicator.filterNew(scheduleId, fetched);

        lifecycle.enterPhase(taskId, TaskPhase.SAVING, "saving " + fresh.size() + " events");
        int saved = save(task, fresh);

        lifecycle.enterPhase(taskId, TaskPhase.NOTIFYING, "notifying " + fresh.size() + " events");
        dispatcher.notify(task.getRepoOwner(), task.getRepoName(), fresh);

        Map<String, Object> statistic = new LinkedHashMap<>();
        statistic.put("event_count", fresh.size());
        statistic.put("fetched_count", fetched.size());
        statistic.put("saved_count", saved);
        lifecycle.recordStatistic(taskId, statistic);
    }

    /** End of the last successful run of the schedule, or the default lookback window. */
    Instant since(String scheduleId) {
        Instant fallback = clock.instant().minus(defaultLookback);
        if (scheduleId == null) {
            return fallback;
        }
        return taskRepository.findFirstByScheduleIdAndStatusOrderByEndTimeDesc(scheduleId, TaskPhase.DONE)
                .map(MonitorTaskDocument::getEndTime)
                .orElse(fallback);
    }

    private int save(MonitorTaskDocument task, List<NormalizedEvent> events) {
        int saved = 0;
        Instant now = clock.instant();
        for (NormalizedEvent event : events) {
            if (task.getScheduleId() != null
                    && eventRepository.existsByEventIdAndScheduleId(event.id(), task.getScheduleId())) {
                continue;
            }
            RepoEventDocument doc = new RepoEventDocument();
            doc.setEventId(event.id());
            doc.setKind(event.kind());
            doc.setGithubType(event.githubType());
            doc.setRepoName(event.repoName());
            doc.setActor(event.actor());
            doc.setCreatedAt(event.createdAt());
            doc.setPayload(event.rawPayload());
            doc.setScheduleId(task.getScheduleId());
            doc.setTaskId(task.getTaskId());
            doc.setSavedAt(now);
            eventRepository.save(doc);
            saved++;
        }
        return saved;
    }
}
