package io.github.drompincen.repowatch.runtime.task;

/**
 * Worker substrate that executes submitted monitoring tasks asynchronously.
 */
public interface TaskQueue {

    /**
     * Hands the task to a worker.
     *
     * @return an opaque handle identifying the queued work
     * @throws RuntimeException if the work could not be queued
     */
    String enqueue(String taskId);
}
