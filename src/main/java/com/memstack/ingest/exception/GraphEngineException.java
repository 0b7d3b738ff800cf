package com.memstack.ingest.exception;

import lombok.Getter;

@Getter
public class GraphEngineException extends RuntimeException {

    private final String operation;

    public GraphEngineException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }
}
