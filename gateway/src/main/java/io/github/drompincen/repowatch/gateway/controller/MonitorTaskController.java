package io.github.drompincen.repowatch.gateway.controller;

import io.github.drompincen.repowatch.protocol.api.AdHocRunRequest;
import io.github.drompincen.repowatch.protocol.api.MonitorTaskResponse;
import io.github.drompincen.repowatch.protocol.api.RepoEventResponse;
import io.github.drompincen.repowatch.runtime.task.MonitorTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
public class MonitorTaskController {

    private final MonitorTaskService taskService;

    public MonitorTaskController(MonitorTaskService taskService) {
        this.taskService = taskService;
    }

    @GetMapping("/api/repo-tasks")
    public List<MonitorTaskResponse> listTasks(@RequestParam(required = false) String scheduleId) {
        return taskService.listTasks(scheduleId).stream()
                .map(ResponseMappers::toResponse)
                .collect(Collectors.toList());
    }

    @GetMapping("/api/repo-tasks/{taskId}")
    public MonitorTaskResponse getTask(@PathVariable String taskId) {
        return ResponseMappers.toResponse(taskService.getTask(taskId));
    }

    @GetMapping("/api/repo-tasks/{taskId}/events")
    public List<RepoEventResponse> taskEvents(@PathVariable String taskId) {
        taskService.getTask(taskId);
        return taskService.listEvents(null, taskId).stream()
                .map(ResponseMappers::toResponse)
                .collect(Collectors.toList());
    }

    /** One-off run for a repository that has no schedule; results are not deduplicated. */
    @PostMapping("/api/repo-tasks/run")
    public ResponseEntity<MonitorTaskResponse> runAdHoc(@RequestBody AdHocRunRequest req) {
        var task = taskService.runAdHoc(req.repoOwner(), req.repoName(), req.eventTypes());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMappers.toResponse(task));
    }

    @GetMapping("/api/repo-events")
    public List<RepoEventResponse> listEvents(@RequestParam(required = false) String scheduleId) {
        return taskService.listEvents(scheduleId, null).stream()
                .map(ResponseMappers::toResponse)
                .collect(Collectors.toList());
    }
}
