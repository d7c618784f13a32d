package com.patcharbiter.selector.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.sandbox.Sandbox;
import com.patcharbiter.selector.sandbox.ShellOutput;
import com.patcharbiter.selector.sandbox.ShellSession;
import com.patcharbiter.selector.sandbox.ShellSessionException;
import com.patcharbiter.selector.tool.impl.BashTool;
import com.patcharbiter.selector.tool.impl.StrReplaceEditTool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SandboxToolExecutor.
 *
 * The sandbox and its shell are Mockito mocks; the assertions are on the
 * exact command lines the helper scripts receive.
 */
@ExtendWith(MockitoExtension.class)
class SandboxToolExecutorTest {

    static final SelectorProperties.Sandbox CONFIG = new SelectorProperties.Sandbox(
            "swebench", "sweb.eval.x86_64.", "latest", "/tmp", "/tmp",
            "/home/swe-bench/", "/home/swe-bench/tools", "/home/swe-bench/py312/bin/python3",
            Duration.ofSeconds(60), Duration.ofSeconds(300), "docker");

    static final String READ_BACK = "cat /home/swe-bench/tools/log.out";

    @Mock Sandbox      sandbox;
    @Mock ShellSession session;

    ObjectMapper        json   = new ObjectMapper();
    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    SandboxToolExecutor executor;

    @BeforeEach
    void setUp() {
        when(sandbox.openSession()).thenReturn(session);
        lenient().when(session.isAlive()).thenReturn(true);
        ToolRegistry registry = new ToolRegistry(List.of(new BashTool(), new StrReplaceEditTool()), meters);
        executor = new SandboxToolExecutor(sandbox, registry, CONFIG);
    }

    // ------------------------------------------------------------------
    // Command encoding
    // ------------------------------------------------------------------

    @Test
    void execute_bash_runsScriptAndReadsBackItsLog() throws Exception {
        when(session.execute(anyString(), any()))
                .thenReturn(ShellOutput.completed(""))
                .thenReturn(ShellOutput.completed("total 0\nTool Call Status: 0"));

        ToolResult result = executor.execute("bash", json.readTree("{\"command\": \"ls -la\", \"restart\": null}"));

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("total 0");
        verify(session).execute(
                eq("cd /home/swe-bench/tools && /home/swe-bench/py312/bin/python3 execute_bash.py"
                        + " --command 'ls -la' > /home/swe-bench/tools/log.out 2>&1"),
                eq(Duration.ofSeconds(120)));
        verify(session).execute(eq(READ_BACK), eq(Duration.ofSeconds(60)));
    }

    @Test
    void execute_editor_encodesIntegersAndRanges() throws Exception {
        when(session.execute(anyString(), any())).thenReturn(ShellOutput.completed("ok\nTool Call Status: 0"));

        executor.execute("str_replace_based_edit_tool", json.readTree(
                "{\"command\": \"view\", \"path\": \"/testbed/a.py\", \"view_range\": [1, 20]}"));
        executor.execute("str_replace_based_edit_tool", json.readTree(
                "{\"command\": \"insert\", \"path\": \"/testbed/a.py\", \"insert_line\": 3, \"new_str\": \"x = 1\"}"));

        verify(session).execute(
                eq("cd /home/swe-bench/tools && /home/swe-bench/py312/bin/python3 execute_str_replace_editor.py"
                        + " --command view --path /testbed/a.py --view_range '[1, 20]'"
                        + " > /home/swe-bench/tools/log.out 2>&1"),
                any());
        verify(session).execute(
                eq("cd /home/swe-bench/tools && /home/swe-bench/py312/bin/python3 execute_str_replace_editor.py"
                        + " --command insert --path /testbed/a.py --insert_line 3 --new_str 'x = 1'"
                        + " > /home/swe-bench/tools/log.out 2>&1"),
                any());
    }

    // ------------------------------------------------------------------
    // Status line
    // ------------------------------------------------------------------

    @Test
    void execute_statusMinusOne_isAFailedResultWithOutput() throws Exception {
        when(session.execute(anyString(), any()))
                .thenReturn(ShellOutput.completed(""))
                .thenReturn(ShellOutput.completed("Tool Call Status: -1\nError: file not found"));

        ToolResult result = executor.execute("str_replace_based_edit_tool",
                json.readTree("{\"command\": \"view\", \"path\": \"/nope\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.output()).isEqualTo("Error: file not found");
        assertThat(meters.counter("selector.tool.calls", "tool", "str_replace_based_edit_tool",
                "status", "failure").count()).isEqualTo(1.0);
    }

    @Test
    void fromScriptOutput_onlyFirstStatusLineIsRemoved() {
        ToolResult result = SandboxToolExecutor.fromScriptOutput(
                "a\n  Tool Call Status: 0\nTool Call Status: -1");

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("a\nTool Call Status: -1");
    }

    // ------------------------------------------------------------------
    // Recoverable failures
    // ------------------------------------------------------------------

    @Test
    void execute_unknownTool_failsWithoutTouchingTheShell() throws Exception {
        ToolResult result = executor.execute("python", json.readTree("{\"code\": \"print(1)\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.toObservation()).contains("`bash`").contains("`str_replace_based_edit_tool`");
        verify(session, never()).execute(anyString(), any());
    }

    @Test
    void execute_objectArgument_failsWithoutTouchingTheShell() throws Exception {
        ToolResult result = executor.execute("bash", json.readTree("{\"command\": {\"cmd\": \"ls\"}}"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("object type");
        verify(session, never()).execute(anyString(), any());
    }

    @Test
    void execute_keyWithShellSyntax_failsWithoutTouchingTheShell() throws Exception {
        ToolResult result = executor.execute("bash",
                json.readTree("{\"command\": \"ls\", \"x; touch /tmp/pwned\": \"y\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not a valid argument name");
        verify(session, never()).execute(anyString(), any());
    }

    @Test
    void execute_undeclaredKey_failsWithoutTouchingTheShell() throws Exception {
        ToolResult result = executor.execute("bash", json.readTree("{\"command\": \"ls\", \"timeout\": 5}"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("has no argument 'timeout'");
        verify(session, never()).execute(anyString(), any());
    }

    @Test
    void execute_timeout_reportsObservationAndReopensSession() throws Exception {
        ShellOutput timedOut = ShellOutput.timedOut("sleep 999", 120, "");
        when(session.execute(anyString(), any())).thenReturn(timedOut);

        ToolResult result = executor.execute("bash", json.readTree("{\"command\": \"sleep 999\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.output()).contains("timed out after 120 seconds");
        verify(sandbox, times(2)).openSession();
        verify(session, times(1)).execute(anyString(), any());
    }

    @Test
    void execute_deadShell_reportsFailureAndReopensSession() throws Exception {
        when(session.execute(anyString(), any())).thenThrow(new ShellSessionException("exited with code 137"));

        ToolResult result = executor.execute("bash", json.readTree("{\"command\": \"kill -9 $$\"}"));

        assertThat(result.success()).isFalse();
        assertThat(result.output()).contains("shell session was lost");
        verify(sandbox, times(2)).openSession();
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void resetWorkingTree_runsGitReset() {
        when(session.execute(anyString(), any())).thenReturn(ShellOutput.completed("HEAD is now at abc123"));

        executor.resetWorkingTree();

        verify(session).execute("git reset --hard HEAD", Duration.ofSeconds(60));
    }

    @Test
    void close_closesSessionOnlyOnce() {
        executor.close();
        executor.close();

        verify(session, times(1)).close();
    }
}
