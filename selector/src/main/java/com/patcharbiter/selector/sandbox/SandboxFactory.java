package com.patcharbiter.selector.sandbox;

import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.model.Instance;
import org.springframework.stereotype.Component;

/**
 * Creates an unstarted {@link Sandbox} per attempt.
 */
@Component
public class SandboxFactory {

    private final SelectorProperties properties;
    private final CommandRunner      runner;

    public SandboxFactory(SelectorProperties properties, CommandRunner runner) {
        this.properties = properties;
        this.runner     = runner;
    }

    public Sandbox create(Instance instance) {
        return new Sandbox(instance,
                properties.sandbox(),
                properties.toolsPath().toString(),
                runner,
                ShellLauncher.processBuilder());
    }
}
