package com.patcharbiter.selector.patch;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommentStripperTest {

    @Test
    void strip_trailingComment_isRemoved() {
        assertThat(CommentStripper.strip("x = 1  # set x")).isEqualTo("x = 1");
    }

    @Test
    void strip_noComment_onlyTrimsTrailingWhitespace() {
        assertThat(CommentStripper.strip("    return value   ")).isEqualTo("    return value");
    }

    @Test
    void strip_hashInSingleAndDoubleQuotes_isKept() {
        assertThat(CommentStripper.strip("a = '#' + \"#\"")).isEqualTo("a = '#' + \"#\"");
    }

    @Test
    void strip_hashInTripleQuotedString_isKept() {
        assertThat(CommentStripper.strip("doc = \"\"\"a # b\"\"\"  # c")).isEqualTo("doc = \"\"\"a # b\"\"\"");
    }

    @Test
    void strip_escapedQuote_doesNotEndString() {
        assertThat(CommentStripper.strip("s = \"a\\\"#\" # c")).isEqualTo("s = \"a\\\"#\"");
    }

    @Test
    void strip_unterminatedString_fallsBackToFirstHash() {
        assertThat(CommentStripper.strip("s = 'abc # c")).isEqualTo("s = 'abc");
    }

    @Test
    void strip_unclosedBracket_fallsBackToFirstHash() {
        assertThat(CommentStripper.strip("call(a,  # first arg")).isEqualTo("call(a,");
    }

    @Test
    void strip_unclosedBracketWithoutComment_isUnchanged() {
        assertThat(CommentStripper.strip("call(a,")).isEqualTo("call(a,");
    }
}
