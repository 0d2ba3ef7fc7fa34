package io.github.drompincen.repowatch.runtime.dedup;

import io.github.drompincen.repowatch.persistence.document.EventFingerprintDocument;
import io.github.drompincen.repowatch.persistence.repository.EventFingerprintRepository;
import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops events a schedule has already seen, keyed by the source event id.
 * <p>
 * The fingerprint is written as soon as an event is judged new, before the event is
 * saved or notified. A crash later in the run therefore loses the tail of that batch
 * instead of re-announcing it. The check and the insert are separate operations, so two
 * overlapping runs of one schedule may both keep the same event.
 */
@Component
public class EventDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(EventDeduplicator.class);

    private final EventFingerprintRepository fingerprintRepository;
    private final Clock clock;

    public EventDeduplicator(EventFingerprintRepository fingerprintRepository, Clock clock) {
        this.fingerprintRepository = fingerprintRepository;
        this.clock = clock;
    }

    public List<NormalizedEvent> filterNew(String scheduleId, List<NormalizedEvent> events) {
        List<NormalizedEvent> fresh = new ArrayList<>();
        for (NormalizedEvent event : events) {
            String fingerprint = event.id();
            if (fingerprint == null || fingerprint.isBlank()) {
                // nothing to key on
                fresh.add(event);
                continue;
            }
            if (fingerprintRepository.existsByScheduleIdAndFingerprint(scheduleId, fingerprint)) {
                continue;
            }
            fingerprintRepository.save(new EventFingerprintDocument(scheduleId, fingerprint, clock.instant()));
            fresh.add(event);
        }
        log.debug("Schedule {}: {} of {} events are new", scheduleId, fresh.size(), events.size());
        return fresh;
    }
}
