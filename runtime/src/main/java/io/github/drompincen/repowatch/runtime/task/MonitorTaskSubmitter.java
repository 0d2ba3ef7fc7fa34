package io.github.drompincen.repowatch.runtime.task;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.persistence.repository.MonitorTaskRepository;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import io.github.drompincen.repowatch.runtime.error.EmptyRepositoryException;
import io.github.drompincen.repowatch.runtime.error.PersistenceFailureException;
import io.github.drompincen.repowatch.runtime.error.TaskSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates WAITING task records and hands them to the {@link TaskQueue}. A task whose
 * enqueue fails is deleted again so no WAITING record is left without queued work.
 */
@Service
public class MonitorTaskSubmitter {

    private static final Logger log = LoggerFactory.getLogger(MonitorTaskSubmitter.class);
    private static final String NAME_PREFIX = "GitHub repo monitor - ";

    private final MonitorTaskRepository taskRepository;
    private final TaskQueue taskQueue;
    private final TaskLifecycle lifecycle;
    private final Clock clock;

    public MonitorTaskSubmitter(MonitorTaskRepository taskRepository,
                                TaskQueue taskQueue,
                                TaskLifecycle lifecycle,
                                Clock clock) {
        this.taskRepository = taskRepository;
        this.taskQueue = taskQueue;
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    /** Submits a run for an existing schedule. Schedule counters are left to the caller. */
    public MonitorTaskDocument submit(RepoScheduleDocument schedule) {
        return submit(schedule.getScheduleId(), NAME_PREFIX + schedule.getName(),
                schedule.getRepoOwner(), schedule.getRepoName(), schedule.getEventTypes());
    }

    /** Submits a one-off run that belongs to no schedule and therefore skips deduplication. */
    public MonitorTaskDocument submitAdHoc(String repoOwner, String repoName, Set<EventKind> eventTypes) {
        if (repoOwner == null || repoOwner.isBlank() || repoName == null || repoName.isBlank()) {
            throw new EmptyRepositoryException();
        }
        String owner = repoOwner.trim();
        String repo = repoName.trim();
        return submit(null, NAME_PREFIX + owner + "/" + repo, owner, repo, eventTypes);
    }

    MonitorTaskDocument submit(String scheduleId, String name, String repoOwner, String repoName,
                               Set<EventKind> eventTypes) {
        MonitorTaskDocument task = new MonitorTaskDocument();
        task.setTaskId(UUID.randomUUID().toString());
        task.setScheduleId(scheduleId);
        task.setName(name);
        task.setRepoOwner(repoOwner);
        task.setRepoName(repoName);
        task.setEventTypes(eventTypes == null || eventTypes.isEmpty()
                ? EventKind.defaultMonitored() : EnumSet.copyOf(eventTypes));
        task.setStatus(TaskPhase.WAITING);
        task.setCreatedAt(clock.instant());
        MonitorTaskDocument saved = store(() -> taskRepository.save(task));

        String handle;
        try {
            handle = taskQueue.enqueue(saved.getTaskId());
        } catch (Exception e) {
            log.error("Task submission failed for {}/{}: {}", repoOwner, repoName, e.getMessage());
            TaskSubmissionException failure =
                    new TaskSubmissionException("Could not queue task for " + repoOwner + "/" + repoName, e);
            try {
                taskRepository.deleteById(saved.getTaskId());
            } catch (DataAccessException cleanup) {
                log.error("Could not remove unqueued task {}: {}", saved.getTaskId(), cleanup.getMessage());
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }

        String workerHandle = handle;
        store(() -> {
            lifecycle.recordWorkerHandle(saved.getTaskId(), workerHandle);
            return null;
        });
        saved.setWorkerHandle(handle);
        log.info("GitHub repo monitor task: {}/{} task_id:{} worker:{}",
                repoOwner, repoName, saved.getTaskId(), handle);
        return saved;
    }

    private static <T> T store(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Task store unavailable: " + e.getMessage(), e);
        }
    }
}
