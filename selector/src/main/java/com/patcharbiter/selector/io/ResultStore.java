package com.patcharbiter.selector.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.model.StatisticsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.IntFunction;

/**
 * Files a run produces, laid out per group:
 * <pre>
 *   patches/group_&lt;g&gt;/&lt;instance&gt;_&lt;n&gt;.patch
 *   trajectories/group_&lt;g&gt;/&lt;instance&gt;_voting_&lt;v&gt;_trail_&lt;n&gt;.json
 *   statistics/group_&lt;g&gt;/&lt;instance&gt;.json
 * </pre>
 * A non-empty statistics file is the checkpoint that marks a group done, so
 * it is written atomically and last.
 */
@Component
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private final SelectorProperties properties;
    private final ObjectMapper       json;

    public ResultStore(SelectorProperties properties, ObjectMapper json) {
        this.properties = properties;
        this.json       = json;
    }

    public boolean statisticsExist(String instanceId, int groupId) {
        Path file = statisticsFile(instanceId, groupId);
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            log.warn("Could not inspect {}, treating the group as not done: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Write a group's patch and then its statistics checkpoint. If the
     * checkpoint cannot be written the patch is removed again, so a retry
     * reuses the same trial index.
     */
    public void saveResult(String instanceId, int groupId, String patchText, StatisticsRecord record) {
        Path patch = savePatch(instanceId, groupId, patchText);
        try {
            saveStatistics(groupId, record);
        } catch (RuntimeException e) {
            try {
                Files.deleteIfExists(patch);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /** Write the patch under the first free trial index, starting at 1. */
    public Path savePatch(String instanceId, int groupId, String patchText) {
        Path dir = groupDir(properties.patchesPath(), groupId);
        try {
            Files.createDirectories(dir);
            Path file = firstFree(dir, n -> instanceId + "_" + n + ".patch");
            Files.writeString(file, patchText, StandardCharsets.UTF_8);
            log.info("Patch saved in {}", file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save patch for " + instanceId + " group " + groupId, e);
        }
    }

    /** Pretty-printed, sorted keys, replaced atomically. */
    public Path saveStatistics(int groupId, StatisticsRecord record) {
        Path file = statisticsFile(record.instanceId(), groupId);
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), record.instanceId(), ".tmp");
            try {
                Files.writeString(tmp, json.writerWithDefaultPrettyPrinter().writeValueAsString(record),
                        StandardCharsets.UTF_8);
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.info("Statistics saved in {}", file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save statistics for " + record.instanceId()
                    + " group " + groupId, e);
        }
    }

    /**
     * First unused trajectory path for this voting index. Only the directory
     * is created; the recorder writes the file.
     */
    public Path trajectoryFile(String instanceId, int groupId, int votingIndex) {
        Path dir = groupDir(properties.trajectoriesPath(), groupId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create " + dir, e);
        }
        return firstFree(dir, n -> instanceId + "_voting_" + votingIndex + "_trail_" + n + ".json");
    }

    Path statisticsFile(String instanceId, int groupId) {
        return groupDir(properties.statisticsPath(), groupId).resolve(instanceId + ".json");
    }

    // Each group is handled by one worker, so the check-then-write cannot race.
    private static Path firstFree(Path dir, IntFunction<String> name) {
        for (int n = 1; ; n++) {
            Path file = dir.resolve(name.apply(n));
            if (!Files.exists(file)) {
                return file;
            }
        }
    }

    private static Path groupDir(Path base, int groupId) {
        return base.resolve("group_" + groupId);
    }
}
