package com.memstack.ingest.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "memstack.neo4j")
public class Neo4jProperties {

    @NotBlank
    private String uri = "bolt://localhost:7687";

    private String username = "neo4j";

    private String password = "password";
}
