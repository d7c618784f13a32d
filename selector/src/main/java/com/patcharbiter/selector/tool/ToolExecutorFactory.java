package com.patcharbiter.selector.tool;

import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.sandbox.Sandbox;
import org.springframework.stereotype.Component;

/** Creates one {@link SandboxToolExecutor} per episode. */
@Component
public class ToolExecutorFactory {

    private final ToolRegistry       registry;
    private final SelectorProperties properties;

    public ToolExecutorFactory(ToolRegistry registry, SelectorProperties properties) {
        this.registry   = registry;
        this.properties = properties;
    }

    public SandboxToolExecutor open(Sandbox sandbox) {
        return new SandboxToolExecutor(sandbox, registry, properties.sandbox());
    }
}
