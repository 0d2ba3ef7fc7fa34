package io.github.drompincen.repowatch.runtime.task;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoEventDocument;
import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.persistence.repository.MonitorTaskRepository;
import io.github.drompincen.repowatch.persistence.repository.RepoEventRepository;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.runtime.error.TaskNotFoundException;
import io.github.drompincen.repowatch.runtime.scheduler.RepoScheduleService;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Manual runs and the task/event audit trail.
 */
@Service
public class MonitorTaskService {

    private final RepoScheduleService scheduleService;
    private final MonitorTaskSubmitter submitter;
    private final MonitorTaskRepository taskRepository;
    private final RepoEventRepository eventRepository;

    public MonitorTaskService(RepoScheduleService scheduleService,
                              MonitorTaskSubmitter submitter,
                              MonitorTaskRepository taskRepository,
                              RepoEventRepository eventRepository) {
        this.scheduleService = scheduleService;
        this.submitter = submitter;
        this.taskRepository = taskRepository;
        this.eventRepository = eventRepository;
    }

    /** Runs a schedule now, whatever its status. Run counters are not touched. */
    public MonitorTaskDocument triggerNow(String scheduleId) {
        RepoScheduleDocument schedule = scheduleService.get(scheduleId);
        return submitter.submit(schedule);
    }

    public MonitorTaskDocument runAdHoc(String repoOwner, String repoName, Set<EventKind> eventTypes) {
        return submitter.submitAdHoc(repoOwner, repoName, eventTypes);
    }

    /** Newest first; all tasks when {@code scheduleId} is null. */
    public List<MonitorTaskDocument> listTasks(String scheduleId) {
        if (scheduleId == null || scheduleId.isBlank()) {
            return taskRepository.findAllByOrderByCreatedAtDesc();
        }
        return taskRepository.findByScheduleIdOrderByCreatedAtDesc(scheduleId);
    }

    public MonitorTaskDocument getTask(String taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /** Events of a schedule or of a single task, newest first. */
    public List<RepoEventDocument> listEvents(String scheduleId, String taskId) {
        if (taskId != null && !taskId.isBlank()) {
            return eventRepository.findByTaskIdOrderByCreatedAtDesc(taskId);
        }
        if (scheduleId != null && !scheduleId.isBlank()) {
            return eventRepository.findByScheduleIdOrderByCreatedAtDesc(scheduleId);
        }
        return eventRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }
}
