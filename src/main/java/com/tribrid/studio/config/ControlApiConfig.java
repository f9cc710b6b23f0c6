package com.tribrid.studio.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the external Training Control API.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "studio.control")
public class ControlApiConfig {

    /**
     * Scheme, host and port of the backend.
     */
    private String baseUrl = "http://localhost:8012";

    /**
     * Path prefix of the training endpoints.
     */
    private String basePath = "/api/agent/train";

    /**
     * Timeout for pull calls. The live stream has none.
     */
    private long responseTimeoutMs = 10_000;

    /**
     * Maximum number of runs requested per listing.
     */
    private int runsLimit = 200;

    /**
     * Largest response body buffered in memory (history pages can be large).
     */
    private int maxInMemorySizeBytes = 16 * 1024 * 1024;
}
