package io.github.drompincen.repowatch.runtime.task;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Field-level updates of a task's lifecycle state. Every write is a single-document
 * {@code $set} so the worker and the submitter never overwrite each other's fields,
 * and no write moves a task out of DONE or ERROR.
 */
@Service
public class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);
    private static final List<TaskPhase> TERMINAL = List.of(TaskPhase.DONE, TaskPhase.ERROR);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public TaskLifecycle(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    public void markStarted(String taskId) {
        set(byId(taskId), Update.update("startTime", clock.instant()));
    }

    public void enterPhase(String taskId, TaskPhase phase, String detail) {
        if (phase.isTerminal()) {
            throw new IllegalArgumentException("Use markDone/markError for terminal phase " + phase);
        }
        set(active(taskId), Update.update("status", phase).set("statusDetail", detail));
        log.debug("Task {} -> {} ({})", taskId, phase, detail);
    }

    public void recordStatistic(String taskId, Map<String, Object> statistic) {
        set(byId(taskId), Update.update("statistic", statistic));
    }

    public void recordWorkerHandle(String taskId, String handle) {
        set(byId(taskId), Update.update("workerHandle", handle));
    }

    public void markDone(String taskId) {
        set(active(taskId), Update.update("status", TaskPhase.DONE).set("statusDetail", null));
    }

    public void markError(String taskId, String message) {
        set(active(taskId), Update.update("status", TaskPhase.ERROR)
                .set("statusDetail", null)
                .set("errorMessage", message));
    }

    public void markEnded(String taskId) {
        set(byId(taskId), Update.update("endTime", clock.instant()));
    }

    private void set(Query query, Update update) {
        mongoTemplate.updateFirst(query, update, MonitorTaskDocument.class);
    }

    private static Query byId(String taskId) {
        return Query.query(Criteria.where("_id").is(taskId));
    }

    private static Query active(String taskId) {
        return Query.query(Criteria.where("_id").is(taskId).and("status").nin(TERMINAL));
    }
}
