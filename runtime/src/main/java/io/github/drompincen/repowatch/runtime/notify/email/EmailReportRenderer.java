package io.github.drompincen.repowatch.runtime.notify.email;

import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;
import io.github.drompincen.repowatch.runtime.notify.EventFormatter;
import io.github.drompincen.repowatch.runtime.notify.NotificationBatch;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * HTML table report. Cell content is escaped and truncated; at most
 * {@value #MAX_REPOSITORIES} repositories with {@value #MAX_ROWS_PER_REPOSITORY} rows each.
 */
@Component
public class EmailReportRenderer {

    static final int MAX_CELL_LENGTH = 2000;
    static final int MAX_ROWS_PER_REPOSITORY = 10;
    static final int MAX_REPOSITORIES = 5;

    public String subject(List<NotificationBatch> batches) {
        int total = batches.stream().mapToInt(b -> b.events().size()).sum();
        if (batches.size() == 1) {
            return "[repowatch] " + batches.get(0).fullName() + ": " + total + " new events";
        }
        return "[repowatch] " + total + " new events in " + batches.size() + " repositories";
    }

    public String render(List<NotificationBatch> batches) {
        StringBuilder html = new StringBuilder();
        html.append("<html><body style=\"font-family:sans-serif\">");
        html.append("<h2>GitHub repo monitor</h2>");

        int repos = Math.min(batches.size(), MAX_REPOSITORIES);
        for (int r = 0; r < repos; r++) {
            NotificationBatch batch = batches.get(r);
            List<NormalizedEvent> events = batch.events();
            html.append("<h3><a href=\"").append(escape(batch.htmlUrl())).append("\">")
                    .append(escape(batch.fullName())).append("</a> (").append(events.size()).append(")</h3>");
            html.append("<table border=\"1\" cellpadding=\"4\" cellspacing=\"0\">");
            html.append("<tr><th>#</th><th>Type</th><th>Actor</th><th>Time</th><th>Content</th></tr>");

            int rows = Math.min(events.size(), MAX_ROWS_PER_REPOSITORY);
            for (int i = 0; i < rows; i++) {
                NormalizedEvent event = events.get(i);
                html.append("<tr>")
                        .append("<td>").append(i + 1).append("</td>")
                        .append("<td>").append(cell(event.githubType())).append("</td>")
                        .append("<td>").append(cell(event.actor())).append("</td>")
                        .append("<td>").append(event.createdAt() == null ? "-" : event.createdAt()).append("</td>")
                        .append("<td><code>").append(cell(content(event))).append("</code></td>")
                        .append("</tr>");
            }
            html.append("</table>");
            if (events.size() > rows) {
                html.append("<p>... ").append(events.size() - rows).append(" more events not shown</p>");
            }
        }
        if (batches.size() > repos) {
            html.append("<p>... ").append(batches.size() - repos).append(" more repositories not shown</p>");
        }
        html.append("</body></html>");
        return html.toString();
    }

    private static String content(NormalizedEvent event) {
        String summary = EventFormatter.summary(event);
        return EventFormatter.detail(event)
                .map(d -> summary + "\n" + d.label() + ": " + d.value())
                .orElse(summary);
    }

    static String cell(String value) {
        return escape(EventFormatter.truncate(value, MAX_CELL_LENGTH));
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
