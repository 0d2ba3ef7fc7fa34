package io.github.drompincen.repowatch.gateway.controller;

import io.github.drompincen.repowatch.runtime.error.EmptyRepositoryException;
import io.github.drompincen.repowatch.runtime.error.InvalidCronExpressionException;
import io.github.drompincen.repowatch.runtime.error.InvalidStateTransitionException;
import io.github.drompincen.repowatch.runtime.error.PersistenceFailureException;
import io.github.drompincen.repowatch.runtime.error.RepoWatchException;
import io.github.drompincen.repowatch.runtime.error.ScheduleNotFoundException;
import io.github.drompincen.repowatch.runtime.error.TaskNotFoundException;
import io.github.drompincen.repowatch.runtime.error.TaskSubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the monitor's exceptions to HTTP statuses with a small JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({InvalidCronExpressionException.class, EmptyRepositoryException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({ScheduleNotFoundException.class, TaskNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RepoWatchException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<Map<String, Object>> conflict(InvalidStateTransitionException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({PersistenceFailureException.class, TaskSubmissionException.class})
    public ResponseEntity<Map<String, Object>> unavailable(RepoWatchException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", e.getClass().getSimpleName().replace("Exception", ""));
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
