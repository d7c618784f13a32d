package com.patcharbiter.selector.model;

import java.util.List;

/**
 * Result of one instance's worker task. Failures are values, not thrown
 * exceptions, so the orchestrator can keep collecting.
 */
public record WorkerOutcome(String instanceId, boolean success, List<GroupOutcome> groups, String error) {

    public static WorkerOutcome completed(String instanceId, List<GroupOutcome> groups) {
        return new WorkerOutcome(instanceId, true, List.copyOf(groups), null);
    }

    public static WorkerOutcome failed(String instanceId, String error) {
        return new WorkerOutcome(instanceId, false, List.of(), error);
    }
}
