package io.github.drompincen.repowatch.runtime.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * In-process queue: each task body runs on the bounded monitor worker pool.
 * A full pool rejects the submission, which the submitter turns into a failed submit.
 */
@Component
public class ExecutorTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskQueue.class);

    private final TaskExecutor executor;
    private final RepoMonitorTaskRunner runner;

    public ExecutorTaskQueue(@Qualifier("monitorTaskExecutor") TaskExecutor executor,
                             RepoMonitorTaskRunner runner) {
        this.executor = executor;
        this.runner = runner;
    }

    @Override
    public String enqueue(String taskId) {
        String handle = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        executor.execute(() -> {
            try {
                runner.run(taskId);
            } catch (Exception e) {
                log.error("Worker {} crashed on task {}: {}", handle, taskId, e.getMessage(), e);
            }
        });
        log.debug("Queued task {} as {}", taskId, handle);
        return handle;
    }
}
