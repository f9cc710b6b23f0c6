package com.tribrid.studio.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Top-level configuration for the training studio service.
 *
 * Holds feature toggles shared by the telemetry pipeline.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "studio")
public class StudioConfig {

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Reject structurally identical metric events delivered more than once.
         */
        private boolean deduplicationEnabled = true;
    }
}
