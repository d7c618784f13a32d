package com.patcharbiter.selector.tool;

import java.util.Map;

/**
 * Identity and documentation contract for a sandbox tool.
 *
 * @param name        name the model calls the tool by
 * @param version     semantic version of the tool contract
 * @param description shown to the model verbatim
 * @param script      file name of the helper script inside the container's tools directory
 * @param inputSchema JSON schema of the call arguments
 */
public record ToolManifest(
        String              name,
        String              version,
        String              description,
        String              script,
        Map<String, Object> inputSchema) {
}
