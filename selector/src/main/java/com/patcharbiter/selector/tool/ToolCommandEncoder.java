package com.patcharbiter.selector.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.patcharbiter.selector.config.SelectorProperties;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a tool call into the shell commands that run its helper script.
 *
 * The script writes to {@code log.out} in the tools directory and the
 * executor reads that file back with a second command, so that the output
 * of the call is not interleaved with shell noise.
 */
public class ToolCommandEncoder {

    private static final String LOG_FILE = "log.out";

    // Keys are spliced into the command line unquoted.
    private static final Pattern ARGUMENT_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final SelectorProperties.Sandbox config;

    public ToolCommandEncoder(SelectorProperties.Sandbox config) {
        this.config = config;
    }

    /**
     * @throws ToolArgumentException if {@code arguments} is not an object, has
     *         a key the tool does not declare, or one of its values has no
     *         command-line form
     */
    public String invocation(ToolManifest manifest, JsonNode arguments) {
        StringBuilder command = new StringBuilder()
                .append("cd ").append(config.toolsDir())
                .append(" && ").append(config.python())
                .append(' ').append(manifest.script());

        if (arguments != null && !arguments.isNull() && !arguments.isMissingNode()) {
            if (!arguments.isObject()) {
                throw new ToolArgumentException("Failed call tool. Arguments of '" + manifest.name()
                        + "' must be a JSON object, got " + arguments);
            }
            Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                checkKey(manifest, field.getKey());
                ToolArgument value = ToolArgument.of(field.getKey(), field.getValue());
                if (value != null) {
                    command.append(" --").append(field.getKey()).append(' ').append(value.render());
                }
            }
        }
        return command.append(" > ").append(logFile()).append(" 2>&1").toString();
    }

    private static void checkKey(ToolManifest manifest, String key) {
        if (!ARGUMENT_KEY.matcher(key).matches()) {
            throw new ToolArgumentException("Failed call tool. '" + key + "' is not a valid argument name for '"
                    + manifest.name() + "'");
        }
        Object declared = manifest.inputSchema().get("properties");
        if (declared instanceof Map && !((Map<?, ?>) declared).containsKey(key)) {
            Map<?, ?> properties = (Map<?, ?>) declared;
            throw new ToolArgumentException("Failed call tool. '" + manifest.name() + "' has no argument '"
                    + key + "'; expected one of " + properties.keySet());
        }
    }

    public String readBack() {
        return "cat " + logFile();
    }

    private String logFile() {
        String dir = config.toolsDir();
        return (dir.endsWith("/") ? dir : dir + "/") + LOG_FILE;
    }
}
