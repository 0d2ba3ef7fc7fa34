package io.github.drompincen.repowatch.gateway.controller;

import io.github.drompincen.repowatch.protocol.api.IdsRequest;
import io.github.drompincen.repowatch.protocol.api.MonitorTaskResponse;
import io.github.drompincen.repowatch.protocol.api.RepoEventResponse;
import io.github.drompincen.repowatch.protocol.api.RepoScheduleRequest;
import io.github.drompincen.repowatch.protocol.api.RepoScheduleResponse;
import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;
import io.github.drompincen.repowatch.runtime.scheduler.RepoScheduleService;
import io.github.drompincen.repowatch.runtime.scheduler.ScheduleFilter;
import io.github.drompincen.repowatch.runtime.task.MonitorTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/repo-schedules")
public class RepoScheduleController {

    private final RepoScheduleService scheduleService;
    private final MonitorTaskService taskService;

    public RepoScheduleController(RepoScheduleService scheduleService, MonitorTaskService taskService) {
        this.scheduleService = scheduleService;
        this.taskService = taskService;
    }

    // --- Schedule CRUD ---

    @GetMapping
    public List<RepoScheduleResponse> list(@RequestParam(required = false) String name,
                                           @RequestParam(required = false) String repoOwner,
                                           @RequestParam(required = false) String repoName,
                                           @RequestParam(required = false) ScheduleStatus status) {
        return scheduleService.list(new ScheduleFilter(name, repoOwner, repoName, status)).stream()
                .map(ResponseMappers::toResponse)
                .collect(Collectors.toList());
    }

    @GetMapping("/{scheduleId}")
    public RepoScheduleResponse get(@PathVariable String scheduleId) {
        return ResponseMappers.toResponse(scheduleService.get(scheduleId));
    }

    @PostMapping
    public ResponseEntity<RepoScheduleResponse> create(@RequestBody RepoScheduleRequest req) {
        var doc = scheduleService.create(req.name(), req.repoOwner(), req.repoName(), req.cron(), req.eventTypes());
        return ResponseEntity.status(HttpStatus.CREATED).body(ResponseMappers.toResponse(doc));
    }

    @PutMapping("/{scheduleId}")
    public RepoScheduleResponse update(@PathVariable String scheduleId, @RequestBody RepoScheduleRequest req) {
        return ResponseMappers.toResponse(scheduleService.update(scheduleId, req));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<Void> delete(@PathVariable String scheduleId) {
        scheduleService.delete(scheduleId);
        return ResponseEntity.noContent().build();
    }

    // --- Batch operations ---

    @PostMapping("/delete")
    public ResponseEntity<Void> deleteAll(@RequestBody IdsRequest req) {
        scheduleService.delete(ids(req));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/stop")
    public ResponseEntity<Void> stopAll(@RequestBody IdsRequest req) {
        scheduleService.stop(ids(req));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/recover")
    public ResponseEntity<Void> recoverAll(@RequestBody IdsRequest req) {
        scheduleService.recover(ids(req));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{scheduleId}/stop")
    public RepoScheduleResponse stop(@PathVariable String scheduleId) {
        scheduleService.stop(scheduleId);
        return get(scheduleId);
    }

    @PostMapping("/{scheduleId}/recover")
    public RepoScheduleResponse recover(@PathVariable String scheduleId) {
        scheduleService.recover(scheduleId);
        return get(scheduleId);
    }

    // --- Runs and audit trail ---

    @PostMapping("/{scheduleId}/trigger")
    public ResponseEntity<MonitorTaskResponse> trigger(@PathVariable String scheduleId) {
        var task = taskService.triggerNow(scheduleId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ResponseMappers.toResponse(task));
    }

    @GetMapping("/{scheduleId}/tasks")
    public List<MonitorTaskResponse> tasks(@PathVariable String scheduleId) {
        scheduleService.get(scheduleId);
        return taskService.listTasks(scheduleId).stream()
                .map(ResponseMappers::toResponse)
                .collect(Collectors.toList());
    }

    @GetMapping("/{scheduleId}/events")
    public List<RepoEventResponse> events(@PathVariable String scheduleId) {
        scheduleService.get(scheduleId);
        return taskService.listEvents(scheduleId, null).stream()
                .map(ResponseMappers::toResponse)
                .collect(Collectors.toList());
    }

    private static List<String> ids(IdsRequest req) {
        return req != null && req.ids() != null ? req.ids() : List.of();
    }
}
