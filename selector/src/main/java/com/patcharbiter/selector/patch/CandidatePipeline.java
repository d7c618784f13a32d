package com.patcharbiter.selector.patch;

import com.patcharbiter.selector.model.CandidateGroup;
import com.patcharbiter.selector.model.CandidatePatch;
import com.patcharbiter.selector.model.WorkingSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a raw candidate group into the working set an episode selects from:
 *
 *   1. drop candidates with an empty diff
 *   2. keep only regression-clean candidates, unless none of them is
 *   3. deduplicate by canonical signature, first occurrence wins
 *
 * The display id of a candidate is its 1-based position in the result.
 */
@Component
public class CandidatePipeline {

    private static final Logger log = LoggerFactory.getLogger(CandidatePipeline.class);

    public WorkingSet build(CandidateGroup group) {
        List<CandidatePatch> candidates = new ArrayList<>();
        for (int idx = 0; idx < group.size(); idx++) {
            String diff = group.patches().get(idx);
            if (diff == null || diff.isBlank()) {
                continue;
            }
            candidates.add(new CandidatePatch(
                    idx,
                    diff,
                    PatchCanonicalizer.canonicalize(diff),
                    group.regressions().get(idx).isEmpty(),
                    group.successIds().get(idx) == 1));
        }
        if (candidates.isEmpty()) {
            throw new EmptyWorkingSetException(group.instanceId(), group.groupId());
        }

        List<CandidatePatch> regressionClean = candidates.stream()
                .filter(CandidatePatch::regressionClean)
                .toList();
        if (!regressionClean.isEmpty()) {
            candidates = regressionClean;
        }
        log.info("Regression filter kept {} of {} candidates", candidates.size(), group.size());

        List<CandidatePatch> unique = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (CandidatePatch candidate : candidates) {
            if (seen.add(candidate.signature())) {
                unique.add(candidate);
            }
        }
        log.info("Deduplication kept {} candidates: original ids {}",
                unique.size(), unique.stream().map(CandidatePatch::id).toList());
        return new WorkingSet(unique);
    }
}
