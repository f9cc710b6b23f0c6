package com.tribrid.studio.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to start a training run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartRunBody {

    @NotBlank(message = "corpusId is required")
    private String corpusId;

    /**
     * Metric the run optimizes, backend default when absent.
     */
    private String primaryMetric;

    @Min(value = 1, message = "primaryK must be at least 1")
    private Integer primaryK;
}
