package com.patcharbiter.selector.agent;

import com.patcharbiter.selector.model.WorkingSet;

/**
 * Prompts that seed every selection episode.
 *
 * The system prompt fixes the role and the report format that
 * {@link DecisionParser} looks for; the user prompt carries the task itself.
 */
public final class SelectorPrompts {

    private SelectorPrompts() {}

    public static String system(int candidateCount) {
        return SYSTEM_PROMPT.replace("{{CANDIDATE_COUNT}}", String.valueOf(candidateCount));
    }

    /** Repository path, issue text and every candidate labelled {@code Patch-<display id>}. */
    public static String user(String projectPath, String issue, WorkingSet workingSet) {
        StringBuilder sb = new StringBuilder()
                .append("\n[Codebase path]:\n").append(projectPath).append("\n\n")
                .append("[Github issue description]:\n```\n").append(issue).append("\n```\n\n")
                .append("[Candidate Patches]:");
        for (int displayId = 1; displayId <= workingSet.size(); displayId++) {
            sb.append("\nPatch-").append(displayId).append(":\n```\n")
              .append(workingSet.byDisplayId(displayId).rawDiff())
              .append("\n```");
        }
        return sb.toString();
    }

    /** Sent when a reply carries neither a decision nor a tool call. */
    public static final String NUDGE = """
            The task is not completed yet. Keep investigating with the tools, or, if you \
            have made your choice, report it in the required format:
            ### Status: succeed
            ### Result: Patch-x
            ### Analysis: [Explain why Patch-x is correct.]""";

    // ------------------------------------------------------------------
    // System prompt  ({{CANDIDATE_COUNT}} is replaced per episode)
    // ------------------------------------------------------------------

    private static final String SYSTEM_PROMPT = """
            # ROLE: Act as an expert code evaluator. Given a codebase, a github issue and \
            **{{CANDIDATE_COUNT}} candidate patches** proposed by your colleagues, your \
            responsibility is to **select the correct one** to solve the issue.

            # WORK PROCESS:
            You are given a software issue and multiple candidate patches. Your goal is to \
            identify the patch that correctly resolves the issue.

            Follow these steps methodically:

            **1. Understand the Issue and Codebase**
            Carefully read the issue description to comprehend the problem. You may need to \
            examine the codebase for context, including:
                (1) Code referenced in the issue description;
                (2) The original code modified by each patch;
                (3) Unchanged parts of the same file;
                (4) Related files, functions, or modules that interact with the affected code.

            **2. Analyze the Candidate Patches**
            For each patch, analyze its logic and intended fix. Consider whether the changes \
            align with the issue description and coding conventions.

            **3. Validate Functionality (Optional but Recommended)**
            If needed, write and run unit tests to evaluate the correctness and potential \
            side effects of each patch. The working tree is reset after you finish.

            **4. Select the Best Patch**
            Choose the patch that best resolves the issue with minimal risk of introducing \
            new problems.

            # FINAL REPORT: If you have successfully selected the correct patch, submit your \
            answer in the following format:
            ### Status: succeed
            ### Result: Patch-x
            ### Analysis: [Explain why Patch-x is correct.]

            # IMPORTANT TIPS:
            1. Never avoid making a selection.
            2. Do not propose new patches.
            3. There must be at least one correct patch.
            """;
}
