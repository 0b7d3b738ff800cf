package com.memstack.ingest.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the external graph-reasoning engine ({@code memstack.graph-engine}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "memstack.graph-engine")
public class GraphEngineProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8001";

    private int connectTimeoutMs = 10000;

    /**
     * Extraction calls run LLM prompts, so the default is generous.
     */
    private int responseTimeoutSeconds = 600;

    /**
     * Bound on parallel community updates issued for one episode.
     */
    @Min(1)
    private int maxConcurrency = 5;
}
