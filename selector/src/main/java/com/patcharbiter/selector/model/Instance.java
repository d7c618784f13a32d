package com.patcharbiter.selector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One benchmark task: a repository snapshot plus the issue to resolve.
 * Loaded from the instance list; SWE-bench rows carry many more fields,
 * which are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Instance(
        @JsonProperty("instance_id")       String instanceId,
        @JsonProperty("base_commit")       String baseCommit,
        @JsonProperty("problem_statement") String problemStatement) {
}
