package com.memstack.ingest.api;

import com.memstack.ingest.queue.QueueManager;
import com.memstack.ingest.queue.SubmissionReceipt;
import com.memstack.ingest.queue.TaskLog;
import com.memstack.ingest.queue.TaskLogStore;
import com.memstack.ingest.queue.TaskRetryService;
import com.memstack.ingest.status.ItemStatusStore;
import com.memstack.ingest.status.ProcessingStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller to enqueue tasks and observe their progress.
 *
 * <p>Submission is fire-and-forget; completion is observed by polling the task log or
 * the item status.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueueController {

    private final QueueManager queueManager;
    private final TaskLogStore taskLogStore;
    private final TaskRetryService taskRetryService;
    private final ItemStatusStore itemStatusStore;

    /**
     * Queue a task.
     *
     * POST /api/v1/queue/groups/{groupId}/tasks
     */
    @PostMapping("/queue/groups/{groupId}/tasks")
    public ResponseEntity<SubmitTaskResponse> submit(@PathVariable String groupId,
                                                     @Valid @RequestBody SubmitTaskRequest request) {
        SubmissionReceipt receipt = queueManager.submit(groupId, request.getKind(), request.getPayload());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitTaskResponse.accepted(receipt));
    }

    /**
     * Queue depth and worker state of a group.
     *
     * GET /api/v1/queue/groups/{groupId}
     */
    @GetMapping("/queue/groups/{groupId}")
    public ResponseEntity<GroupQueueResponse> getGroup(@PathVariable String groupId) {
        return ResponseEntity.ok(new GroupQueueResponse(
            groupId,
            queueManager.getQueueDepth(groupId),
            queueManager.isWorkerRunning(groupId)));
    }

    /**
     * Groups that have received tasks, with their current state.
     *
     * GET /api/v1/queue/groups
     */
    @GetMapping("/queue/groups")
    public ResponseEntity<List<GroupQueueResponse>> listGroups() {
        List<GroupQueueResponse> groups = queueManager.getGroupIds().stream()
            .map(groupId -> new GroupQueueResponse(
                groupId,
                queueManager.getQueueDepth(groupId),
                queueManager.isWorkerRunning(groupId)))
            .toList();
        return ResponseEntity.ok(groups);
    }

    /**
     * Task log of a group, oldest first.
     *
     * GET /api/v1/queue/groups/{groupId}/tasks
     */
    @GetMapping("/queue/groups/{groupId}/tasks")
    public ResponseEntity<List<TaskLog>> listTasks(@PathVariable String groupId) {
        return ResponseEntity.ok(taskLogStore.findByGroup(groupId));
    }

    /**
     * GET /api/v1/queue/tasks/{taskId}
     */
    @GetMapping("/queue/tasks/{taskId}")
    public ResponseEntity<TaskLog> getTask(@PathVariable String taskId) {
        return taskLogStore.find(taskId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Re-submit a failed task as a new task.
     *
     * POST /api/v1/queue/tasks/{taskId}/retry
     */
    @PostMapping("/queue/tasks/{taskId}/retry")
    public ResponseEntity<SubmitTaskResponse> retry(@PathVariable String taskId) {
        return taskRetryService.retry(taskId)
            .map(receipt -> ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmitTaskResponse.accepted(receipt)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT)
                .body(SubmitTaskResponse.error("Task " + taskId + " is unknown or not FAILED")));
    }

    /**
     * Register a record as PENDING before its episode is submitted.
     *
     * POST /api/v1/items/{recordId}
     */
    @PostMapping("/items/{recordId}")
    public ResponseEntity<ItemStatusResponse> registerItem(@PathVariable String recordId) {
        if (itemStatusStore.getStatus(recordId).isPresent()) {
            throw new IllegalArgumentException("Record " + recordId + " already exists");
        }
        itemStatusStore.createPending(recordId);
        log.info("Registered record {} as PENDING", recordId);
        return ResponseEntity.status(HttpStatus.CREATED).body(new ItemStatusResponse(
            recordId, ProcessingStatus.PENDING, itemStatusStore.getHistory(recordId)));
    }

    /**
     * GET /api/v1/items/{recordId}/status
     */
    @GetMapping("/items/{recordId}/status")
    public ResponseEntity<ItemStatusResponse> getItemStatus(@PathVariable String recordId) {
        return itemStatusStore.getStatus(recordId)
            .map(status -> ResponseEntity.ok(
                new ItemStatusResponse(recordId, status, itemStatusStore.getHistory(recordId))))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
