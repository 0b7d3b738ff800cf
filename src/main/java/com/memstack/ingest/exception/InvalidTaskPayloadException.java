package com.memstack.ingest.exception;

import lombok.Getter;

@Getter
public class InvalidTaskPayloadException extends TaskProcessingException {

    private final String taskKind;

    public InvalidTaskPayloadException(String taskKind, String message) {
        super("Invalid payload for task kind '" + taskKind + "': " + message);
        this.taskKind = taskKind;
    }

    public InvalidTaskPayloadException(String taskKind, String message, Throwable cause) {
        super("Invalid payload for task kind '" + taskKind + "': " + message, cause);
        this.taskKind = taskKind;
    }
}
