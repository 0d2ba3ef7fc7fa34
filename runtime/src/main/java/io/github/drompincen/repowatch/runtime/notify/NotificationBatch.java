package io.github.drompincen.repowatch.runtime.notify;

import io.github.drompincen.repowatch.runtime.github.NormalizedEvent;

import java.util.List;

/** The new events of one repository, handed to every channel. */
public record NotificationBatch(String repoOwner, String repoName, List<NormalizedEvent> events) {

    public NotificationBatch {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public String fullName() {
        return repoOwner + "/" + repoName;
    }

    public String htmlUrl() {
        return "https://github.com/" + fullName();
    }
}
