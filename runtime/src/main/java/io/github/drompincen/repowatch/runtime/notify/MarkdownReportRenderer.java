package io.github.drompincen.repowatch.runtime.notify;

import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Markdown digest of a batch, listing at most {@value #MAX_EVENTS} events.
 */
@Component
public class MarkdownReportRenderer {

    static final int MAX_EVENTS = 10;

    public NotificationMessage render(NotificationBatch batch) {
        String title = "GitHub repo monitor - " + batch.fullName();
        List<NormalizedEvent> events = batch.events();

        StringBuilder md = new StringBuilder();
        md.append("### GitHub repo monitor\n\n");
        md.append("**Repository**: [").append(batch.fullName()).append("](").append(batch.htmlUrl()).append(")\n\n");
        md.append("**Events**: ").append(events.size()).append("\n\n");
        md.append("---\n\n");

        int shown = Math.min(events.size(), MAX_EVENTS);
        for (int i = 0; i < shown; i++) {
            NormalizedEvent event = events.get(i);
            md.append("**").append(i + 1).append(". ").append(event.githubType()).append("**\n\n");
            md.append("- **Actor**: ").append(event.actor()).append('\n');
            md.append("- **Time**: ").append(event.createdAt() == null ? "-" : event.createdAt()).append('\n');
            md.append("- **Details**: ").append(EventFormatter.summary(event)).append('\n');
            EventFormatter.detail(event).ifPresent(d ->
                    md.append("- **").append(d.label()).append("**: ").append(d.value()).append('\n'));
            md.append('\n');
        }
        if (events.size() > MAX_EVENTS) {
            md.append("\n... ").append(events.size() - MAX_EVENTS).append(" more events not shown\n");
        }
        return NotificationMessage.markdown(title, md.toString());
    }
}
