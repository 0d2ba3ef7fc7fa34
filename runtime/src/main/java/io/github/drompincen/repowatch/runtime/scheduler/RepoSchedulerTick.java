package io.github.drompincen.repowatch.runtime.scheduler;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.persistence.repository.RepoScheduleRepository;
import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;
import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import io.github.drompincen.repowatch.runtime.cron.CronEvaluator;
import io.github.drompincen.repowatch.runtime.task.MonitorTaskSubmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Periodic driver: scans every schedule and fires the RUNNING ones whose next cron time
 * falls inside the lookahead window and that have not run within the cooldown.
 * <p>
 * The cooldown check is a soft guard. Two overlapping ticks can both fire the same
 * schedule; downstream deduplication absorbs most of the resulting duplicates.
 */
@Component
public class RepoSchedulerTick {

    private static final Logger log = LoggerFactory.getLogger(RepoSchedulerTick.class);

    private final RepoScheduleRepository scheduleRepository;
    private final MonitorTaskSubmitter taskSubmitter;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration lookahead;
    private final Duration cooldown;

    public RepoSchedulerTick(RepoScheduleRepository scheduleRepository,
                             MonitorTaskSubmitter taskSubmitter,
                             RepoWatchProperties properties,
                             Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.taskSubmitter = taskSubmitter;
        this.clock = clock;
        this.zone = properties.getScheduler().zoneId();
        this.lookahead = properties.getScheduler().getLookahead();
        this.cooldown = properties.getScheduler().getCooldown();
    }

    @Scheduled(fixedDelayString = "${repowatch.scheduler.tick-interval-ms:60000}")
    public void scheduledTick() {
        tick();
    }

    /**
     * @return number of schedules fired during this tick
     */
    public int tick() {
        Instant now = clock.instant();
        List<RepoScheduleDocument> schedules = scheduleRepository.findAll();
        int fired = 0;

        for (RepoScheduleDocument schedule : schedules) {
            try {
                if (schedule.getStatus() != ScheduleStatus.RUNNING) continue;

                CronEvaluator evaluator = CronEvaluator.parse(schedule.getCron(), zone);
                if (isDue(schedule, evaluator, now)) {
                    log.info("Cron run for {} (schedule {})", schedule.fullRepoName(), schedule.getScheduleId());
                    fire(schedule, evaluator, now);
                    fired++;
                }
            } catch (Exception e) {
                log.error("Scheduler tick failed for schedule {}: {}",
                        schedule.getScheduleId(), e.getMessage(), e);
            }
        }
        if (fired > 0) {
            log.debug("Tick at {} fired {} of {} schedules", now, fired, schedules.size());
        }
        return fired;
    }

    boolean isDue(RepoScheduleDocument schedule, CronEvaluator evaluator, Instant now) {
        long secondsUntilNext = evaluator.secondsUntilNext(now);
        long sinceLastRun = Math.abs(now.getEpochSecond() - schedule.getLastRunTime());
        return secondsUntilNext < lookahead.getSeconds() && sinceLastRun > cooldown.getSeconds();
    }

    private void fire(RepoScheduleDocument schedule, CronEvaluator evaluator, Instant now) {
        MonitorTaskDocument task = taskSubmitter.submit(schedule);

        // re-read so a concurrent stop or delete is not overwritten by the stale tick copy
        Optional<RepoScheduleDocument> fresh = scheduleRepository.findById(schedule.getScheduleId());
        if (fresh.isEmpty()) {
            log.warn("Schedule {} disappeared after submitting task {}", schedule.getScheduleId(), task.getTaskId());
            return;
        }
        RepoScheduleDocument doc = fresh.get();
        doc.setRunNumber(doc.getRunNumber() + 1);
        doc.setLastRunTime(now.getEpochSecond());
        doc.setLastRunDate(DisplayDates.format(now, zone));
        if (doc.getStatus() == ScheduleStatus.RUNNING) {
            doc.setNextRunDate(DisplayDates.format(nextRunAfterFire(evaluator, now), zone));
        }
        doc.setUpdatedAt(now);
        scheduleRepository.save(doc);
    }

    /**
     * Next run as recorded after a fire: evaluated from one second past the lookahead
     * window, then shifted back by the window. The result sits exactly one lookahead before
     * the first cron time that lies beyond the window, i.e. when the tick will pick it up.
     */
    Instant nextRunAfterFire(CronEvaluator evaluator, Instant firedAt) {
        Instant shifted = firedAt.plus(lookahead).plusSeconds(1);
        return evaluator.nextFire(shifted).minus(lookahead);
    }
}
