package com.patcharbiter.selector.sandbox;

import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.model.Instance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One container built from the instance's prebuilt image, plus at most one
 * interactive shell attached to it.
 *
 * Lifecycle: {@link #start()} once, any number of {@link #openSession()}
 * calls (each replaces the previous shell), then {@link #stop()}. A sandbox
 * belongs to the worker that created it and serves one episode at a time.
 */
public class Sandbox {

    private static final Logger log = LoggerFactory.getLogger(Sandbox.class);

    private final Instance                   instance;
    private final SelectorProperties.Sandbox config;
    private final String                     toolsPath;
    private final CommandRunner              runner;
    private final ShellLauncher              launcher;

    private String       containerId;
    private String       projectPath;
    private ShellSession session;
    private int          sessionCount;

    public Sandbox(Instance instance,
                   SelectorProperties.Sandbox config,
                   String toolsPath,
                   CommandRunner runner,
                   ShellLauncher launcher) {
        this.instance  = instance;
        this.config    = config;
        this.toolsPath = toolsPath;
        this.runner    = runner;
        this.launcher  = launcher;
    }

    // ------------------------------------------------------------------
    // Container lifecycle
    // ------------------------------------------------------------------

    /**
     * Run the container, install the tool scripts and check out the base commit.
     *
     * @throws SandboxStartException on any failure; the container, if one was
     *         created, is left for {@link #stop()} to remove
     */
    public void start() {
        String image = config.imageFor(instance.instanceId());
        try {
            CommandResult run = docker("run", "-d", "-t", "-i", "--privileged",
                    "-v", config.hostShare() + ":" + config.containerShare() + ":rw",
                    image);
            containerId = lastLine(run.output());
            log.info("Container {} started with image {}", shortId(), image);

            check(runner.run(List.of("chmod", "-R", "777", toolsPath), config.dockerCommandTimeout()),
                    "chmod " + toolsPath);
            docker("cp", toolsPath, containerId + ":" + config.toolsParent());

            CommandResult checkout = docker("exec", containerId, "git", "checkout", instance.baseCommit());
            log.info("Checked out {}: {}", instance.baseCommit(), checkout.output().strip());

            projectPath = docker("exec", containerId, "pwd").output().strip();
        } catch (RuntimeException e) {
            throw new SandboxStartException("Could not start sandbox for " + instance.instanceId()
                    + " from image " + image + ": " + e.getMessage(), e);
        }
    }

    /**
     * Tear everything down. Idempotent, safe after a failed {@link #start()},
     * and never throws: a container that cannot be removed is logged.
     */
    public void stop() {
        closeSession();
        if (containerId == null) {
            return;
        }
        String id = containerId;
        containerId = null;
        try {
            docker("stop", id);
            docker("rm", id);
            log.info("Container {} stopped and removed", abbreviate(id));
        } catch (RuntimeException e) {
            log.warn("Could not remove container {}, manual cleanup may be needed: {}",
                    abbreviate(id), e.getMessage());
        }
    }

    public boolean isStarted() {
        return containerId != null;
    }

    /** Working directory of the container, where the repository is checked out. */
    public String projectPath() {
        if (projectPath == null) {
            throw new IllegalStateException("Sandbox not started");
        }
        return projectPath;
    }

    // ------------------------------------------------------------------
    // Shell sessions
    // ------------------------------------------------------------------

    /**
     * Open a fresh interactive shell in the container, closing the current one.
     *
     * @throws ShellSessionException if the shell process cannot be spawned
     */
    public ShellSession openSession() {
        if (containerId == null) {
            throw new IllegalStateException("Container not started. Call start() first.");
        }
        closeSession();
        List<String> command = List.of(config.dockerBinary(), "exec", "-i", containerId, "/bin/bash");
        try {
            sessionCount++;
            session = new ShellSession(launcher.launch(command), shortId() + "#" + sessionCount);
            log.debug("Opened shell session {}#{}", shortId(), sessionCount);
            return session;
        } catch (IOException e) {
            throw new ShellSessionException("Could not open a shell in container " + shortId(), e);
        }
    }

    private void closeSession() {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private CommandResult docker(String... args) {
        List<String> command = new ArrayList<>();
        command.add(config.dockerBinary());
        command.addAll(List.of(args));
        return check(runner.run(command, config.dockerCommandTimeout()), "docker " + args[0]);
    }

    private static CommandResult check(CommandResult result, String what) {
        if (!result.success()) {
            throw new SandboxException(what + " failed with exit code " + result.exitCode()
                    + ": " + result.output().strip());
        }
        return result;
    }

    private static String lastLine(String output) {
        List<String> lines = output.strip().lines().toList();
        if (lines.isEmpty()) {
            throw new SandboxException("docker run printed no container id");
        }
        return lines.get(lines.size() - 1).strip();
    }

    private String shortId() {
        return containerId == null ? "<none>" : abbreviate(containerId);
    }

    private static String abbreviate(String id) {
        return id.length() > 12 ? id.substring(0, 12) : id;
    }
}
