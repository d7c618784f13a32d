package com.patcharbiter.selector.tool;

/**
 * A tool the selector agent may call. Every tool is backed by a helper
 * script installed in the container; the Java side only describes it, and
 * {@link SandboxToolExecutor} turns calls into shell commands.
 */
public interface SandboxTool {

    ToolManifest manifest();

    ToolPolicy policy();
}
