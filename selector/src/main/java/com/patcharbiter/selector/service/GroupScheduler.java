package com.patcharbiter.selector.service;

import com.patcharbiter.selector.agent.EpisodeRequest;
import com.patcharbiter.selector.agent.SelectorAgent;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.io.ResultStore;
import com.patcharbiter.selector.model.CandidateGroup;
import com.patcharbiter.selector.model.CandidateLog;
import com.patcharbiter.selector.model.CandidatePatch;
import com.patcharbiter.selector.model.GroupOutcome;
import com.patcharbiter.selector.model.Instance;
import com.patcharbiter.selector.model.StatisticsRecord;
import com.patcharbiter.selector.model.WorkingSet;
import com.patcharbiter.selector.patch.CandidatePipeline;
import com.patcharbiter.selector.sandbox.Sandbox;
import com.patcharbiter.selector.sandbox.SandboxFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Processes the candidate groups of one instance, one group at a time.
 *
 * Per group:
 *  1. Skip it if its statistics checkpoint already exists
 *  2. Record trivial groups (all candidates succeed, or none does) directly
 *  3. Otherwise make up to {@code max-retry} attempts: build the working
 *     set, run the vote in a fresh sandbox, then save the patch and the
 *     checkpoint. A failed attempt tears its sandbox down and the next one
 *     starts from scratch.
 *
 * Nothing is written for a group whose attempts all fail, so a later run
 * picks it up again.
 */
@Service
public class GroupScheduler {

    private static final Logger log = LoggerFactory.getLogger(GroupScheduler.class);

    private final CandidatePipeline pipeline;
    private final SandboxFactory    sandboxes;
    private final SelectorAgent     agent;
    private final ConsensusRunner   consensus;
    private final ResultStore       store;
    private final int               numCandidate;
    private final int               groupSize;
    private final int               maxRetry;

    public GroupScheduler(CandidatePipeline pipeline,
                          SandboxFactory sandboxes,
                          SelectorAgent agent,
                          ConsensusRunner consensus,
                          ResultStore store,
                          SelectorProperties properties) {
        this.pipeline     = pipeline;
        this.sandboxes    = sandboxes;
        this.agent        = agent;
        this.consensus    = consensus;
        this.store        = store;
        this.numCandidate = properties.numCandidate();
        this.groupSize    = properties.groupSize();
        this.maxRetry     = properties.maxRetry();
    }

    // ------------------------------------------------------------------
    // Instance level
    // ------------------------------------------------------------------

    /** Process every group in order. Stops early if the thread is interrupted. */
    public List<GroupOutcome> processInstance(Instance instance, CandidateLog candidates) {
        List<CandidateGroup> groups = candidates.groups(numCandidate, groupSize);
        List<GroupOutcome> outcomes = new ArrayList<>();
        for (CandidateGroup group : groups) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Interrupted, {} of {} groups not processed", groups.size() - outcomes.size(), groups.size());
                break;
            }
            outcomes.add(processGroup(instance, group));
        }
        return outcomes;
    }

    // ------------------------------------------------------------------
    // Group level
    // ------------------------------------------------------------------

    public GroupOutcome processGroup(Instance instance, CandidateGroup group) {
        String instanceId = instance.instanceId();
        int    groupId    = group.groupId();
        MDC.put("instanceId", instanceId);
        MDC.put("groupId",    String.valueOf(groupId));
        MDC.put("groupLog",   "group_" + groupId + "/" + instanceId);
        try {
            if (store.statisticsExist(instanceId, groupId)) {
                log.info("Group {} of {} already processed, skipping", groupId, instanceId);
                return GroupOutcome.SKIPPED;
            }
            if (group.isAllFailed() || group.isAllSuccess()) {
                return recordTrivial(instanceId, group);
            }
            for (int attempt = 1; attempt <= maxRetry; attempt++) {
                MDC.put("attempt", String.valueOf(attempt));
                if (attempt(instance, group, attempt)) {
                    return GroupOutcome.SELECTED;
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Interrupted during attempt {}, abandoning group {}", attempt, groupId);
                    return GroupOutcome.UNRESOLVED;
                }
            }
            log.error("Group {} of {} unresolved after {} attempts", groupId, instanceId, maxRetry);
            return GroupOutcome.UNRESOLVED;
        } finally {
            MDC.remove("groupId");
            MDC.remove("groupLog");
            MDC.remove("attempt");
        }
    }

    private GroupOutcome recordTrivial(String instanceId, CandidateGroup group) {
        boolean allFailed = group.isAllFailed();
        log.info("Group {} of {}: {}, no selection needed",
                group.groupId(), instanceId, allFailed ? "all candidates fail" : "all candidates succeed");
        store.saveResult(instanceId, group.groupId(),
                group.patches().isEmpty() ? "" : group.patches().get(0),
                allFailed ? StatisticsRecord.allFailed(instanceId) : StatisticsRecord.allSuccess(instanceId));
        return GroupOutcome.TRIVIAL;
    }

    /** @return true when the group's results were written */
    private boolean attempt(Instance instance, CandidateGroup group, int attempt) {
        String  instanceId = instance.instanceId();
        Sandbox sandbox    = null;
        try {
            log.info("Attempt {}/{} for group {} of {}", attempt, maxRetry, group.groupId(), instanceId);
            WorkingSet workingSet = pipeline.build(group);

            CandidatePatch chosen;
            String         patchText;
            if (workingSet.size() == 1) {
                chosen    = workingSet.first();
                patchText = chosen.rawDiff();
                log.info("Only candidate {} left after filtering, selected without voting", chosen.id());
            } else {
                sandbox = sandboxes.create(instance);
                sandbox.start();
                Sandbox started = sandbox;
                ConsensusRunner.Consensus vote = consensus.decide(group.size(), round ->
                        agent.run(started, new EpisodeRequest(instance, workingSet, round,
                                store.trajectoryFile(instanceId, group.groupId(), round - 1))));
                chosen    = vote.chosen();
                patchText = vote.patchText();
            }

            store.saveResult(instanceId, group.groupId(), patchText, StatisticsRecord.selected(instanceId, chosen));
            log.info("Group {} of {} selected candidate {} (success={})",
                    group.groupId(), instanceId, chosen.id(), chosen.groundTruthSuccess());
            return true;
        } catch (RuntimeException e) {
            log.warn("Attempt {}/{} failed: {}", attempt, maxRetry, e.getMessage(), e);
            return false;
        } finally {
            if (sandbox != null) {
                forceStop(sandbox);
            }
        }
    }

    // The docker CLI calls in stop() would fail at once with the interrupt flag set.
    private static void forceStop(Sandbox sandbox) {
        boolean interrupted = Thread.interrupted();
        try {
            sandbox.stop();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
