package com.patcharbiter.selector.sandbox;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Exercises output framing against a real local bash instead of a container.
 */
class ShellSessionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    ShellSession session;

    @BeforeEach
    void setUp() throws IOException {
        assumeTrue(Files.isExecutable(Path.of("/bin/bash")), "needs /bin/bash");
        Process bash = new ProcessBuilder("/bin/bash").redirectErrorStream(true).start();
        session = new ShellSession(bash, "local");
    }

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.close();
        }
    }

    @Test
    void execute_returnsCommandOutputWithoutTrailingNewline() {
        ShellOutput output = session.execute("echo hello", TIMEOUT);

        assertThat(output.timedOut()).isFalse();
        assertThat(output.text()).isEqualTo("hello");
    }

    @Test
    void execute_multiLineOutput_isKeptIntact() {
        assertThat(session.execute("printf 'a\\nb\\n'", TIMEOUT).text()).isEqualTo("a\nb");
    }

    @Test
    void execute_outputWithoutFinalNewline_completesBeforeDeadline() {
        ShellOutput output = session.execute("printf abc", TIMEOUT);

        assertThat(output.timedOut()).isFalse();
        assertThat(output.text()).isEqualTo("abc");
        assertThat(session.execute("echo next", TIMEOUT).text()).isEqualTo("next");
    }

    @Test
    void execute_silentCommand_returnsEmptyText() {
        ShellOutput output = session.execute("true", TIMEOUT);

        assertThat(output.timedOut()).isFalse();
        assertThat(output.text()).isEmpty();
    }

    @Test
    void execute_stateSurvivesBetweenCommands() {
        session.execute("cd /tmp && export SELECTOR_TEST=42", TIMEOUT);

        assertThat(session.execute("pwd", TIMEOUT).text()).isEqualTo("/tmp");
        assertThat(session.execute("echo $SELECTOR_TEST", TIMEOUT).text()).isEqualTo("42");
    }

    @Test
    void execute_stderrIsMergedIntoOutput() {
        assertThat(session.execute("echo oops 1>&2", TIMEOUT).text()).isEqualTo("oops");
    }

    @Test
    void execute_slowCommand_timesOutWithObservation() {
        ShellOutput output = session.execute("echo started; sleep 5", Duration.ofSeconds(1));

        assertThat(output.timedOut()).isTrue();
        assertThat(output.text())
                .startsWith("### Observation: Error: Command 'echo started; sleep 5' timed out after 1 seconds.")
                .contains("Partial output:");
    }

    @Test
    void execute_shellExits_throwsSessionException() {
        assertThatThrownBy(() -> session.execute("exit 3", TIMEOUT))
                .isInstanceOf(ShellSessionException.class)
                .hasMessageContaining("exited with code 3");
    }

    @Test
    void close_isIdempotentAndEndsTheSession() {
        session.close();
        session.close();

        assertThat(session.isAlive()).isFalse();
        assertThatThrownBy(() -> session.execute("echo hi", TIMEOUT))
                .isInstanceOf(ShellSessionException.class);
    }
}
