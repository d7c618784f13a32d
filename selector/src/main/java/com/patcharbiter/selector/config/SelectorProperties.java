package com.patcharbiter.selector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Everything a selection run is parameterised by, bound from {@code selector.*}.
 *
 * Output directories default to fixed sub-directories of {@code outputPath}.
 */
@ConfigurationProperties(prefix = "selector")
public record SelectorProperties(
        Path instancesFile,
        Path candidatesFile,
        @DefaultValue("output") Path outputPath,
        @DefaultValue("tools") Path toolsPath,
        @DefaultValue("10") int numCandidate,
        @DefaultValue("10") int groupSize,
        @DefaultValue("3") int maxRetry,
        @DefaultValue("50") int maxTurn,
        @DefaultValue("4") int maxWorkers,
        @DefaultValue("true") boolean majorityVoting,
        @DefaultValue("false") boolean runOnStartup,
        @DefaultValue Sandbox sandbox) {

    public SelectorProperties {
        if (numCandidate <= 0 || groupSize <= 0 || maxRetry <= 0 || maxTurn <= 0 || maxWorkers <= 0) {
            throw new IllegalArgumentException(
                    "selector.num-candidate, group-size, max-retry, max-turn and max-workers must be positive");
        }
    }

    public Path patchesPath() {
        return outputPath.resolve("patches");
    }

    public Path trajectoriesPath() {
        return outputPath.resolve("trajectories");
    }

    public Path statisticsPath() {
        return outputPath.resolve("statistics");
    }

    /**
     * Container-side settings.
     *
     * @param namespace            registry namespace of the per-instance images
     * @param imagePrefix          image name before the mangled instance id
     * @param hostShare            host directory bind-mounted into every container
     * @param toolsParent          container directory the tool scripts are copied into
     * @param toolsDir             where the scripts end up inside the container
     * @param python               interpreter that runs the tool scripts
     * @param commandTimeout       default deadline of one shell command
     * @param dockerCommandTimeout deadline of one docker CLI invocation
     */
    public record Sandbox(
            @DefaultValue("swebench") String namespace,
            @DefaultValue("sweb.eval.x86_64.") String imagePrefix,
            @DefaultValue("latest") String tag,
            @DefaultValue("/tmp") String hostShare,
            @DefaultValue("/tmp") String containerShare,
            @DefaultValue("/home/swe-bench/") String toolsParent,
            @DefaultValue("/home/swe-bench/tools") String toolsDir,
            @DefaultValue("/home/swe-bench/py312/bin/python3") String python,
            @DefaultValue("60s") Duration commandTimeout,
            @DefaultValue("300s") Duration dockerCommandTimeout,
            @DefaultValue("docker") String dockerBinary) {

        /** SWE-bench image names replace "__" in the instance id with "_1776_". */
        public String imageFor(String instanceId) {
            return namespace + "/" + imagePrefix + instanceId.replace("__", "_1776_") + ":" + tag;
        }
    }
}
