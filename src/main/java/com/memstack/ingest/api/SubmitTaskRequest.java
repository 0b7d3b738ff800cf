package com.memstack.ingest.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Submit task request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitTaskRequest {

    @NotBlank(message = "Task kind is required")
    private String kind;

    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();
}
