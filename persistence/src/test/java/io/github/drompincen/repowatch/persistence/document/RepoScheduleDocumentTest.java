package io.github.drompincen.repowatch.persistence.document;

import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.ScheduleStatus;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class RepoScheduleDocumentTest {

    @Test
    void newScheduleHasNeverRunDefaults() {
        RepoScheduleDocument doc = new RepoScheduleDocument();

        assertThat(doc.getStatus()).isEqualTo(ScheduleStatus.RUNNING);
        assertThat(doc.getRunNumber()).isZero();
        assertThat(doc.getLastRunTime()).isZero();
        assertThat(doc.getLastRunDate()).isEqualTo(RepoScheduleDocument.NO_DATE);
        assertThat(doc.getNextRunDate()).isEqualTo(RepoScheduleDocument.NO_DATE);
        assertThat(doc.getEventTypes()).isEmpty();
    }

    @Test
    void fullRepoNameJoinsOwnerAndName() {
        RepoScheduleDocument doc = new RepoScheduleDocument();
        doc.setRepoOwner("spring-projects");
        doc.setRepoName("spring-boot");
        doc.setEventTypes(EnumSet.of(EventKind.PUSH, EventKind.RELEASE));

        assertThat(doc.fullRepoName()).isEqualTo("spring-projects/spring-boot");
        assertThat(doc.getEventTypes()).containsExactlyInAnyOrder(EventKind.PUSH, EventKind.RELEASE);
    }
}
