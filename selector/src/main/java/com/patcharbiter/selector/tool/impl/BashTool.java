package com.patcharbiter.selector.tool.impl;

import com.patcharbiter.selector.tool.SandboxTool;
import com.patcharbiter.selector.tool.ToolManifest;
import com.patcharbiter.selector.tool.ToolPolicy;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Runs a shell command in the repository checkout of the container. */
@Component
public class BashTool implements SandboxTool {

    private static final ToolManifest MANIFEST = new ToolManifest(
            "bash",
            "1.0.0",
            """
            Run commands in a bash shell.
            * State is persistent across command calls and discussions with the user.
            * You can use the shell to read files, run tests or reproduce the issue.
            * Avoid commands that produce a very large amount of output.
            * Run long-lived commands in the background, e.g. 'sleep 10 &'.
            * Set restart to true to get a fresh shell if the current one is unusable.""",
            "execute_bash.py",
            Map.of(
                    "type", "object",
                    "properties", Map.of(
                            "command", Map.of(
                                    "type", "string",
                                    "description", "The bash command to run. Required unless the tool is being restarted."),
                            "restart", Map.of(
                                    "type", "boolean",
                                    "description", "Specifying true will restart this tool. Otherwise, leave this unspecified.")),
                    "required", List.of("command")));

    private static final ToolPolicy POLICY = new ToolPolicy(120);

    @Override
    public ToolManifest manifest() {
        return MANIFEST;
    }

    @Override
    public ToolPolicy policy() {
        return POLICY;
    }
}
