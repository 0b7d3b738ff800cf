package com.memstack.ingest.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code memstack.*} configuration property classes.
 *
 * <ul>
 *   <li>{@link QueueProperties} - per-group worker pool
 *   <li>{@link GraphEngineProperties} - external graph engine client
 *   <li>{@link Neo4jProperties} - graph query/write primitive
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
    QueueProperties.class,
    GraphEngineProperties.class,
    Neo4jProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
