package com.patcharbiter.selector.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionParserTest {

    @Test
    void extractSelection_standardReport_returnsNumber() {
        String reply = """
                After running the tests, Patch-3 fails while Patch-2 passes.
                ### Status: succeed
                ### Result: Patch-2
                ### Analysis: Patch-2 guards the division.
                """;

        assertThat(DecisionParser.extractSelection(reply)).contains("2");
    }

    @Test
    void extractSelection_withoutHashesAndOtherSuccessWord_isAccepted() {
        String reply = "Status: successful\nResult: Patch-1\nAnalysis: only correct one";

        assertThat(DecisionParser.extractSelection(reply)).contains("1");
    }

    @Test
    void extractSelection_isCaseInsensitive() {
        assertThat(DecisionParser.extractSelection("### STATUS: Succeed\n### RESULT: patch-4 ### analysis: ok"))
                .contains("patch-4");
    }

    @Test
    void extractSelection_tokenIsTextAfterLastPatchPrefix() {
        assertThat(DecisionParser.extractSelection(
                "### Status: succeed\n### Result: Patch-1 over Patch-3\n### Analysis: x"))
                .contains("3");
    }

    @Test
    void extractSelection_outOfRangeNumber_isStillReturned() {
        assertThat(DecisionParser.extractSelection("### Status: succeed\n### Result: Patch-99\n### Analysis: x"))
                .contains("99");
    }

    @Test
    void extractSelection_failedStatus_isNoDecision() {
        assertThat(DecisionParser.extractSelection("### Status: failed\n### Result: Patch-1\n### Analysis: x"))
                .isEmpty();
    }

    @Test
    void extractSelection_statusNotFollowedByResult_isNoDecision() {
        assertThat(DecisionParser.extractSelection("### Status: succeed\nI still need to check.\n### Result: Patch-1\n### Analysis: x"))
                .isEmpty();
    }

    @Test
    void extractSelection_missingAnalysis_isNoDecision() {
        assertThat(DecisionParser.extractSelection("### Status: succeed\n### Result: Patch-1")).isEmpty();
    }

    @Test
    void extractSelection_plainReasoning_isNoDecision() {
        assertThat(DecisionParser.extractSelection("Let me look at the tests first.")).isEmpty();
    }
}
