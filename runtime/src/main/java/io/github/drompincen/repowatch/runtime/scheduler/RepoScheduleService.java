package io.github.drompincen.repowatch.runtime.scheduler;

import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.persistence.repository.EventFingerprintRepository;
import io.github.drompincen.repowatch.persistence.repository.MonitorTaskRepository;
import io.github.drompincen.repowatch.persistence.repository.RepoEventRepository;
import io.github.drompincen.repowatch.persistence.repository.RepoScheduleRepository;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.RepoScheduleRequest;
import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.cron.CronEvaluator;
import io.github.drompincen.repowatch.runtime.error.EmptyRepositoryException;
import io.github.drompincen.repowatch.runtime.error.InvalidStateTransitionException;
import io.github.drompincen.repowatch.runtime.error.PersistenceFailureException;
import io.github.drompincen.repowatch.runtime.error.ScheduleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns the persisted repository schedules: creation, partial updates and the
 * RUNNING/STOPPED transitions together with their next-run bookkeeping.
 */
@Service
public class RepoScheduleService {

    private static final Logger log = LoggerFactory.getLogger(RepoScheduleService.class);

    private final RepoScheduleRepository scheduleRepository;
    private final MonitorTaskRepository taskRepository;
    private final RepoEventRepository eventRepository;
    private final EventFingerprintRepository fingerprintRepository;
    private final Clock clock;
    private final ZoneId zone;

    public RepoScheduleService(RepoScheduleRepository scheduleRepository,
                               MonitorTaskRepository taskRepository,
                               RepoEventRepository eventRepository,
                               EventFingerprintRepository fingerprintRepository,
                               RepoWatchProperties properties,
                               Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.taskRepository = taskRepository;
        this.eventRepository = eventRepository;
        this.fingerprintRepository = fingerprintRepository;
        this.clock = clock;
        this.zone = properties.getScheduler().zoneId();
    }

    public List<RepoScheduleDocument> list(ScheduleFilter filter) {
        ScheduleFilter f = filter != null ? filter : ScheduleFilter.all();
        return store(() -> scheduleRepository.findAll().stream()
                .filter(f::matches)
                .collect(Collectors.toList()));
    }

    public Optional<RepoScheduleDocument> find(String scheduleId) {
        return store(() -> scheduleRepository.findById(scheduleId));
    }

    public RepoScheduleDocument get(String scheduleId) {
        return find(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    public RepoScheduleDocument create(String name, String repoOwner, String repoName,
                                       String cron, Set<EventKind> eventTypes) {
        String owner = trimToNull(repoOwner);
        String repo = trimToNull(repoName);
        if (owner == null || repo == null) {
            throw new EmptyRepositoryException();
        }
        CronEvaluator evaluator = CronEvaluator.parse(cron, zone);
        Instant now = clock.instant();

        RepoScheduleDocument doc = new RepoScheduleDocument();
        doc.setScheduleId(UUID.randomUUID().toString());
        doc.setName(name != null && !name.isBlank() ? name.trim() : owner + "/" + repo);
        doc.setRepoOwner(owner);
        doc.setRepoName(repo);
        doc.setCron(evaluator.expression());
        doc.setEventTypes(eventTypes == null || eventTypes.isEmpty()
                ? EventKind.defaultMonitored() : EnumSet.copyOf(eventTypes));
        doc.setRunNumber(0);
        doc.setLastRunTime(0);
        doc.setLastRunDate(RepoScheduleDocument.NO_DATE);
        doc.setNextRunDate(nextRunDate(evaluator, now));
        doc.setStatus(ScheduleStatus.RUNNING);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        RepoScheduleDocument saved = store(() -> scheduleRepository.save(doc));
        log.info("Created schedule {} for {} (cron='{}', events={})",
                saved.getScheduleId(), saved.fullRepoName(), saved.getCron(), saved.getEventTypes());
        return saved;
    }

    /**
     * Merges the non-empty fields of {@code changes}. The cron expression is re-validated and
     * the next run recomputed only when it actually changes; a stopped schedule keeps its
     * cleared next-run date until it is recovered.
     */
    public RepoScheduleDocument update(String scheduleId, RepoScheduleRequest changes) {
        RepoScheduleDocument doc = get(scheduleId);
        if (changes == null) return doc;

        CronEvaluator evaluator = null;
        String cron = trimToNull(changes.cron());
        if (cron != null && !cron.equals(doc.getCron())) {
            evaluator = CronEvaluator.parse(cron, zone);
        }

        if (changes.name() != null && !changes.name().isBlank()) doc.setName(changes.name().trim());
        String owner = trimToNull(changes.repoOwner());
        if (owner != null) doc.setRepoOwner(owner);
        String repo = trimToNull(changes.repoName());
        if (repo != null) doc.setRepoName(repo);
        if (changes.eventTypes() != null && !changes.eventTypes().isEmpty()) {
            doc.setEventTypes(EnumSet.copyOf(changes.eventTypes()));
        }

        Instant now = clock.instant();
        if (evaluator != null) {
            doc.setCron(evaluator.expression());
            if (doc.getStatus() == ScheduleStatus.RUNNING) {
                doc.setNextRunDate(nextRunDate(evaluator, now));
            }
        }
        doc.setUpdatedAt(now);
        RepoScheduleDocument saved = store(() -> scheduleRepository.save(doc));
        log.info("Updated schedule {} (cron='{}', next run {})",
                scheduleId, saved.getCron(), saved.getNextRunDate());
        return saved;
    }

    public void stop(String scheduleId) {
        stop(List.of(scheduleId));
    }

    /** All ids are checked before any schedule is touched. */
    public void stop(List<String> scheduleIds) {
        List<RepoScheduleDocument> docs = requireAll(scheduleIds, ScheduleStatus.RUNNING);
        Instant now = clock.instant();
        for (RepoScheduleDocument doc : docs) {
            doc.setStatus(ScheduleStatus.STOPPED);
            doc.setNextRunDate(RepoScheduleDocument.NO_DATE);
            doc.setUpdatedAt(now);
            store(() -> scheduleRepository.save(doc));
            log.info("Stopped schedule {} ({})", doc.getScheduleId(), doc.fullRepoName());
        }
    }

    public void recover(String scheduleId) {
        recover(List.of(scheduleId));
    }

    /** All ids are checked before any schedule is touched. */
    public void recover(List<String> scheduleIds) {
        List<RepoScheduleDocument> docs = requireAll(scheduleIds, ScheduleStatus.STOPPED);
        Instant now = clock.instant();
        for (RepoScheduleDocument doc : docs) {
            CronEvaluator evaluator = CronEvaluator.parse(doc.getCron(), zone);
            doc.setStatus(ScheduleStatus.RUNNING);
            doc.setNextRunDate(nextRunDate(evaluator, now));
            doc.setUpdatedAt(now);
            store(() -> scheduleRepository.save(doc));
            log.info("Recovered schedule {} ({}), next run {}",
                    doc.getScheduleId(), doc.fullRepoName(), doc.getNextRunDate());
        }
    }

    /**
     * Removes the schedule together with its tasks, stored events and fingerprints. The
     * cascade runs even when the schedule itself is already gone, but the caller is still
     * told it was not found.
     */
    public void delete(String scheduleId) {
        boolean existed = store(() -> scheduleRepository.existsById(scheduleId));
        long tasks = store(() -> taskRepository.deleteByScheduleId(scheduleId));
        long events = store(() -> eventRepository.deleteByScheduleId(scheduleId));
        long fingerprints = store(() -> fingerprintRepository.deleteByScheduleId(scheduleId));
        store(() -> {
            scheduleRepository.deleteById(scheduleId);
            return null;
        });
        log.info("Deleted schedule {} with {} tasks, {} events and {} fingerprints",
                scheduleId, tasks, events, fingerprints);
        if (!existed) {
            throw new ScheduleNotFoundException(scheduleId);
        }
    }

    /** Fails with NotFound before deleting anything if any id is unknown. */
    public void delete(List<String> scheduleIds) {
        requireAll(scheduleIds, null);
        for (String id : scheduleIds) {
            delete(id);
        }
    }

    String nextRunDate(CronEvaluator evaluator, Instant now) {
        return DisplayDates.format(now.plusSeconds(evaluator.secondsUntilNext(now)), zone);
    }

    private List<RepoScheduleDocument> requireAll(List<String> scheduleIds, ScheduleStatus requiredStatus) {
        List<String> ids = scheduleIds != null ? scheduleIds : List.of();
        List<RepoScheduleDocument> docs = ids.stream()
                .map(this::get)
                .collect(Collectors.toList());
        if (requiredStatus != null) {
            for (RepoScheduleDocument doc : docs) {
                if (doc.getStatus() != requiredStatus) {
                    throw new InvalidStateTransitionException(doc.getScheduleId(), doc.getStatus(), requiredStatus);
                }
            }
        }
        return docs;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static <T> T store(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Schedule store unavailable: " + e.getMessage(), e);
        }
    }
}
