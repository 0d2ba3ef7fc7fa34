package io.github.drompincen.repowatch.runtime.task;

import io.github.drompincen.repowatch.persistence.document.MonitorTaskDocument;
import io.github.drompincen.repowatch.persistence.document.RepoScheduleDocument;
import io.github.drompincen.repowatch.persistence.repository.MonitorTaskRepository;
import io.github.drompincen.repowatch.protocol.api.EventKind;
import io.github.drompincen.repowatch.protocol.api.TaskPhase;
import io.github.drompincen.repowatch.runtime.error.EmptyRepositoryException;
import io.github.drompincen.repowatch.runtime.error.PersistenceFailureException;
import io.github.drompincen.repowatch.runtime.error.TaskSubmissionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MonitorTaskSubmitterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:04:30Z");

    @Mock private MonitorTaskRepository taskRepository;
    @Mock private TaskQueue taskQueue;
    @Mock private TaskLifecycle lifecycle;
    @Captor private ArgumentCaptor<MonitorTaskDocument> taskCaptor;

    private MonitorTaskSubmitter submitter;

    @BeforeEach
    void setUp() {
        submitter = new MonitorTaskSubmitter(taskRepository, taskQueue, lifecycle, Clock.fixed(NOW, ZoneOffset.UTC));
        when(taskRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
        when(taskQueue.enqueue(anyString())).thenReturn("worker-1");
    }

    @Test
    void submit_persistsWaitingTaskThenEnqueuesAndRecordsHandle() {
        RepoScheduleDocument schedule = new RepoScheduleDocument();
        schedule.setScheduleId("s1");
        schedule.setName("spring watch");
        schedule.setRepoOwner("spring-projects");
        schedule.setRepoName("spring-boot");
        schedule.setEventTypes(EnumSet.of(EventKind.RELEASE));

        MonitorTaskDocument task = submitter.submit(schedule);

        InOrder order = inOrder(taskRepository, taskQueue, lifecycle);
        order.verify(taskRepository).save(taskCaptor.capture());
        order.verify(taskQueue).enqueue(task.getTaskId());
        order.verify(lifecycle).recordWorkerHandle(task.getTaskId(), "worker-1");

        MonitorTaskDocument saved = taskCaptor.getValue();
        assertThat(saved.getStatus()).isEqualTo(TaskPhase.WAITING);
        assertThat(saved.getScheduleId()).isEqualTo("s1");
        assertThat(saved.getName()).isEqualTo("GitHub repo monitor - spring watch");
        assertThat(saved.getEventTypes()).containsExactly(EventKind.RELEASE);
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        assertThat(task.getWorkerHandle()).isEqualTo("worker-1");
    }

    @Test
    void enqueueFailure_deletesTaskAndReportsError() {
        when(taskQueue.enqueue(anyString())).thenThrow(new RejectedExecutionException("pool full"));

        assertThatThrownBy(() -> submitter.submitAdHoc("octo", "repo", null))
                .isInstanceOf(TaskSubmissionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);

        verify(taskRepository).save(taskCaptor.capture());
        verify(taskRepository).deleteById(taskCaptor.getValue().getTaskId());
        verify(lifecycle, never()).recordWorkerHandle(any(), any());
    }

    @Test
    void storeUnavailableOnSave_isPersistenceFailureAndNothingQueued() {
        when(taskRepository.save(any())).thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> submitter.submitAdHoc("octo", "repo", null))
                .isInstanceOf(PersistenceFailureException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verifyNoInteractions(taskQueue);
    }

    @Test
    void rollbackFailure_keepsEnqueueErrorAsCause() {
        when(taskQueue.enqueue(anyString())).thenThrow(new RejectedExecutionException("pool full"));
        doThrow(new DataAccessResourceFailureException("mongo down")).when(taskRepository).deleteById(anyString());

        assertThatThrownBy(() -> submitter.submitAdHoc("octo", "repo", null))
                .isInstanceOf(TaskSubmissionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class)
                .satisfies(e -> assertThat(e.getSuppressed())
                        .hasOnlyElementsOfType(DataAccessResourceFailureException.class)
                        .hasSize(1));
    }

    @Test
    void storeUnavailableOnHandle_isPersistenceFailure() {
        doThrow(new DataAccessResourceFailureException("mongo down"))
                .when(lifecycle).recordWorkerHandle(anyString(), anyString());

        assertThatThrownBy(() -> submitter.submitAdHoc("octo", "repo", null))
                .isInstanceOf(PersistenceFailureException.class);
    }

    @Test
    void adHoc_hasNoScheduleAndDefaultTypes() {
        MonitorTaskDocument task = submitter.submitAdHoc(" octo ", " repo ", null);

        assertThat(task.getScheduleId()).isNull();
        assertThat(task.getRepoOwner()).isEqualTo("octo");
        assertThat(task.getRepoName()).isEqualTo("repo");
        assertThat(task.getName()).isEqualTo("GitHub repo monitor - octo/repo");
        assertThat(task.getEventTypes()).isEqualTo(EventKind.defaultMonitored());
    }

    @Test
    void adHoc_blankRepository_isRejected() {
        assertThatThrownBy(() -> submitter.submitAdHoc("octo", "  ", null))
                .isInstanceOf(EmptyRepositoryException.class);
        verifyNoInteractions(taskRepository, taskQueue);
    }
}
