package com.tribrid.studio.control.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the backend's start-run call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StartRunRequest {

    private String corpusId;

    private String primaryMetric;

    private Integer primaryK;

    /**
     * The agent endpoints name the corpus repo_id.
     */
    @JsonProperty("repo_id")
    public String getRepoId() {
        return corpusId;
    }
}
