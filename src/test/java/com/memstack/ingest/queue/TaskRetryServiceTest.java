package com.memstack.ingest.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Task Retry Service Tests")
class TaskRetryServiceTest {

    @Mock
    private TaskLogStore taskLogStore;

    @Mock
    private QueueManager queueManager;

    private TaskRetryService retryService;

    @BeforeEach
    void setUp() {
        retryService = new TaskRetryService(taskLogStore, queueManager);
    }

    @Test
    @DisplayName("Should resubmit a failed task")
    void retry_failedTask_shouldResubmit() {
        // Given
        TaskLog failed = taskLog("t1", TaskStatus.FAILED);
        when(taskLogStore.find("t1")).thenReturn(Optional.of(failed));
        when(taskLogStore.markRetried("t1")).thenReturn(true);
        when(queueManager.resubmit(failed)).thenReturn(new SubmissionReceipt("t2", "g1", 1));

        // When
        Optional<SubmissionReceipt> receipt = retryService.retry("t1");

        // Then
        assertThat(receipt).hasValueSatisfying(r -> {
            assertThat(r.taskId()).isEqualTo("t2");
            assertThat(r.groupId()).isEqualTo("g1");
        });
        verify(queueManager).resubmit(failed);
    }

    @Test
    @DisplayName("Should resubmit a failed task only once")
    void retry_sameTaskTwice_shouldResubmitOnce() {
        // Given: the store lets only the first caller claim the retry
        TaskLog failed = taskLog("t1", TaskStatus.FAILED);
        when(taskLogStore.find("t1")).thenReturn(Optional.of(failed));
        when(taskLogStore.markRetried("t1")).thenReturn(true, false);
        when(queueManager.resubmit(failed)).thenReturn(new SubmissionReceipt("t2", "g1", 1));

        // When
        Optional<SubmissionReceipt> first = retryService.retry("t1");
        Optional<SubmissionReceipt> second = retryService.retry("t1");

        // Then
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        verify(queueManager, times(1)).resubmit(any());
    }

    @Test
    @DisplayName("Should give the retry back when the resubmission is refused")
    void retry_resubmitRefused_shouldReleaseRetry() {
        // Given
        TaskLog failed = taskLog("t1", TaskStatus.FAILED);
        when(taskLogStore.find("t1")).thenReturn(Optional.of(failed));
        when(taskLogStore.markRetried("t1")).thenReturn(true);
        when(queueManager.resubmit(failed)).thenThrow(new IllegalStateException("Queue manager is shutting down"));

        // When / Then
        assertThatThrownBy(() -> retryService.retry("t1"))
            .isInstanceOf(IllegalStateException.class);
        verify(taskLogStore).releaseRetry("t1");
    }

    @Test
    @DisplayName("Should not retry a task that did not fail")
    void retry_completedTask_shouldBeRefused() {
        // Given
        when(taskLogStore.find("t1")).thenReturn(Optional.of(taskLog("t1", TaskStatus.COMPLETED)));

        // When
        Optional<SubmissionReceipt> receipt = retryService.retry("t1");

        // Then
        assertThat(receipt).isEmpty();
        verify(queueManager, never()).resubmit(any());
    }

    @Test
    @DisplayName("Should not retry an unknown task")
    void retry_unknownTask_shouldBeRefused() {
        // Given
        when(taskLogStore.find("missing")).thenReturn(Optional.empty());

        // When
        Optional<SubmissionReceipt> receipt = retryService.retry("missing");

        // Then
        assertThat(receipt).isEmpty();
        verify(queueManager, never()).resubmit(any());
    }

    private static TaskLog taskLog(String taskId, TaskStatus status) {
        return TaskLog.builder()
            .taskId(taskId)
            .groupId("g1")
            .taskType("add_episode")
            .payload(Map.of("uuid", "ep-1"))
            .status(status)
            .build();
    }
}
