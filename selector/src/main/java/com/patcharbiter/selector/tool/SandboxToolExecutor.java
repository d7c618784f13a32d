package com.patcharbiter.selector.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.sandbox.Sandbox;
import com.patcharbiter.selector.sandbox.ShellOutput;
import com.patcharbiter.selector.sandbox.ShellSession;
import com.patcharbiter.selector.sandbox.ShellSessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ToolExecutor} that runs the helper scripts through an interactive
 * shell in a {@link Sandbox}.
 *
 * The executor owns its shell session. After a timed-out command or a dead
 * shell the session is replaced, so the next call starts from a clean
 * prompt. Closing the executor closes the session but not the sandbox.
 */
public class SandboxToolExecutor implements ToolExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxToolExecutor.class);

    static final String STATUS_PREFIX = "Tool Call Status:";
    static final String FAILED_STATUS = "-1";

    private final Sandbox                    sandbox;
    private final ToolRegistry               registry;
    private final ToolCommandEncoder         encoder;
    private final SelectorProperties.Sandbox config;

    private ShellSession session;

    public SandboxToolExecutor(Sandbox sandbox, ToolRegistry registry, SelectorProperties.Sandbox config) {
        this.sandbox  = sandbox;
        this.registry = registry;
        this.config   = config;
        this.encoder  = new ToolCommandEncoder(config);
        this.session  = sandbox.openSession();
    }

    // ------------------------------------------------------------------
    // ToolExecutor
    // ------------------------------------------------------------------

    @Override
    public ToolResult execute(String toolName, JsonNode arguments) {
        SandboxTool tool;
        try {
            tool = registry.get(toolName);
        } catch (ToolNotFoundException e) {
            log.warn("Model called unknown tool '{}'", toolName);
            return ToolResult.failed("The tool name you provided is not in the list. Please choose one from "
                    + String.join(" or ", registry.toolNames().stream().map(n -> "`" + n + "`").toList()) + "!");
        }
        return registry.instrumented(toolName, () -> run(tool, arguments));
    }

    /** Discard every change the agent made to the checkout. */
    public void resetWorkingTree() {
        ShellOutput output = shell("git reset --hard HEAD", config.commandTimeout());
        if (output.timedOut()) {
            log.warn("Working tree reset timed out: {}", output.text());
        }
    }

    @Override
    public void close() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private ToolResult run(SandboxTool tool, JsonNode arguments) {
        String command;
        try {
            command = encoder.invocation(tool.manifest(), arguments);
        } catch (ToolArgumentException e) {
            log.warn("Rejected arguments for '{}': {}", tool.manifest().name(), e.getMessage());
            return ToolResult.failed(e.getMessage());
        }
        log.debug("Tool '{}' -> {}", tool.manifest().name(), command);

        try {
            ShellOutput invocation = shell(command, tool.policy().commandTimeout());
            if (invocation.timedOut()) {
                return ToolResult.failed(invocation.text());
            }
            ShellOutput readBack = shell(encoder.readBack(), config.commandTimeout());
            if (readBack.timedOut()) {
                return ToolResult.failed(readBack.text());
            }
            return fromScriptOutput(readBack.text());
        } catch (ShellSessionException e) {
            log.warn("Shell died while running '{}': {}", tool.manifest().name(), e.getMessage());
            reopen();
            return ToolResult.failed("Error: the shell session was lost while running the tool ("
                    + e.getMessage() + "). A new shell has been started; run the command again.");
        }
    }

    /** Remove the status line the scripts print and map {@code -1} to failure. */
    static ToolResult fromScriptOutput(String raw) {
        List<String> lines = new ArrayList<>(raw.lines().toList());
        String status = null;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.startsWith(STATUS_PREFIX)) {
                status = line.substring(STATUS_PREFIX.length()).strip();
                lines.remove(i);
                break;
            }
        }
        String content = String.join("\n", lines);
        return FAILED_STATUS.equals(status) ? ToolResult.failed(content, content) : ToolResult.ok(content);
    }

    private ShellOutput shell(String command, Duration timeout) {
        ShellOutput output = session().execute(command, timeout);
        if (output.timedOut()) {
            // A command still running in the old shell would swallow the next one.
            reopen();
        }
        return output;
    }

    private ShellSession session() {
        if (session == null || !session.isAlive()) {
            reopen();
        }
        return session;
    }

    private void reopen() {
        close();
        session = sandbox.openSession();
    }
}
