package com.patcharbiter.selector.tool;

import com.patcharbiter.selector.llm.ToolDefinition;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process tool registry.
 *
 * All {@link SandboxTool} beans are collected at startup via constructor
 * injection. The registry resolves tools by name, describes them to the
 * model, and times and counts every call:
 * <pre>
 *   selector.tool.calls{tool, status="success|failure|error"}
 *   selector.tool.duration{tool}
 * </pre>
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, SandboxTool> tools = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public ToolRegistry(List<SandboxTool> allTools, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (SandboxTool tool : allTools) {
            tools.put(tool.manifest().name(), tool);
            log.info("Registered tool '{}' v{} [{}]",
                    tool.manifest().name(),
                    tool.manifest().version(),
                    tool.manifest().script());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public SandboxTool get(String name) {
        SandboxTool tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    /** Returns all registered tool names (sorted). */
    public List<String> toolNames() {
        return tools.keySet().stream().sorted().toList();
    }

    /** Tool descriptions handed to the model on every turn, in name order. */
    public List<ToolDefinition> definitions() {
        return toolNames().stream()
                .map(tools::get)
                .map(SandboxTool::manifest)
                .map(m -> new ToolDefinition(m.name(), m.description(), m.inputSchema()))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Run one tool call with timing and counting. Exceptions are counted as
     * {@code error} and rethrown.
     */
    public ToolResult instrumented(String toolName, Supplier<ToolResult> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            ToolResult result = call.get();
            status = result.success() ? "success" : "failure";
            return result;
        } finally {
            sample.stop(meterRegistry.timer("selector.tool.duration", "tool", toolName));
            meterRegistry.counter("selector.tool.calls", "tool", toolName, "status", status).increment();
        }
    }
}
