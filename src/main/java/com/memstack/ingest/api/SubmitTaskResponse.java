package com.memstack.ingest.api;

import com.memstack.ingest.queue.SubmissionReceipt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Submit task response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitTaskResponse {

    private boolean success;
    private String taskId;
    private String groupId;
    private int queueDepth;
    private String error;

    public static SubmitTaskResponse accepted(SubmissionReceipt receipt) {
        return SubmitTaskResponse.builder()
            .success(true)
            .taskId(receipt.taskId())
            .groupId(receipt.groupId())
            .queueDepth(receipt.queueDepth())
            .build();
    }

    public static SubmitTaskResponse error(String error) {
        return SubmitTaskResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
