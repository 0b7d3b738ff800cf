package com.memstack.ingest.exception;

import lombok.Getter;

@Getter
public class NoTaskHandlerException extends TaskProcessingException {

    private final String taskKind;

    public NoTaskHandlerException(String taskKind) {
        super("No handler registered for task kind: " + taskKind);
        this.taskKind = taskKind;
    }
}
