package io.github.drompincen.repowatch.runtime.notify;

import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans a batch of new events out to every configured channel. A channel failure is
 * logged and recorded in the result; it never stops the remaining channels and never
 * propagates to the caller.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationChannel> channels;

    public NotificationDispatcher(List<NotificationChannel> channels) {
        this.channels = List.copyOf(channels);
    }

    public List<ChannelResult> notify(String repoOwner, String repoName, List<NormalizedEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        NotificationBatch batch = new NotificationBatch(repoOwner, repoName, events);
        List<ChannelResult> results = new ArrayList<>(channels.size());

        for (NotificationChannel channel : channels) {
            if (!channel.isConfigured()) {
                log.debug("Channel {} not configured, skipping", channel.name());
                results.add(ChannelResult.skipped(channel.name()));
                continue;
            }
            try {
                ChannelResult result = channel.send(batch);
                results.add(result);
                if (result.outcome() == ChannelResult.Outcome.SENT) {
                    log.info("Sent {} events for {} via {}", events.size(), batch.fullName(), channel.name());
                } else {
                    log.warn("Channel {} did not deliver {}: {}", channel.name(), batch.fullName(), result.detail());
                }
            } catch (Exception e) {
                log.error("Channel {} failed for {}: {}", channel.name(), batch.fullName(), e.getMessage(), e);
                results.add(ChannelResult.failed(channel.name(), e.getMessage()));
            }
        }
        return results;
    }
}
