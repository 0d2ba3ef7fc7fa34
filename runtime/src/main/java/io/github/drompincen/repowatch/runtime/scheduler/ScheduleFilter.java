package io.github.drompincen.repowatch.runtime.scheduler;

import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;

import java.util.Locale;

/**
 * Optional criteria for listing schedules; null fields match everything.
 * The name matches as a case-insensitive substring, the other fields exactly.
 */
public record ScheduleFilter(String name, String repoOwner, String repoName, ScheduleStatus status) {

    public static ScheduleFilter all() {
        return new ScheduleFilter(null, null, null, null);
    }

    public boolean matches(RepoScheduleDocument doc) {
        if (name != null && !name.isBlank()) {
            String docName = doc.getName() != null ? doc.getName().toLowerCase(Locale.ROOT) : "";
            if (!docName.contains(name.trim().toLowerCase(Locale.ROOT))) return false;
        }
        if (repoOwner != null && !repoOwner.isBlank() && !repoOwner.trim().equals(doc.getRepoOwner())) return false;
        if (repoName != null && !repoName.isBlank() && !repoName.trim().equals(doc.getRepoName())) return false;
        return status == null || status == doc.getStatus();
    }
}
