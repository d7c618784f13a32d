package com.patcharbiter.selector.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The per-(instance, group) checkpoint. Its presence on disk marks the
 * group as done.
 */
@JsonPropertyOrder(alphabetic = true)
public record StatisticsRecord(
        @JsonProperty("instance_id")    String  instanceId,
        @JsonProperty("patch_id")       int     patchId,
        @JsonProperty("is_success")     int     isSuccess,
        @JsonProperty("is_all_success") boolean isAllSuccess,
        @JsonProperty("is_all_failed")  boolean isAllFailed) {

    public static StatisticsRecord selected(String instanceId, CandidatePatch chosen) {
        return new StatisticsRecord(instanceId, chosen.id(), chosen.groundTruthSuccess() ? 1 : 0, false, false);
    }

    public static StatisticsRecord allSuccess(String instanceId) {
        return new StatisticsRecord(instanceId, 0, 1, true, false);
    }

    public static StatisticsRecord allFailed(String instanceId) {
        return new StatisticsRecord(instanceId, 0, 0, false, true);
    }
}
