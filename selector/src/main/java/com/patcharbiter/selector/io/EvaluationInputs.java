package com.patcharbiter.selector.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.model.CandidateLog;
import com.patcharbiter.selector.model.Instance;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The two input files of a run: the instance list (a JSON array) and the
 * candidate log (one JSON object per line, keyed by instance id).
 */
public record EvaluationInputs(List<Instance> instances, Map<String, CandidateLog> candidates) {

    private static final TypeReference<List<Instance>> INSTANCE_LIST = new TypeReference<>() {};

    public EvaluationInputs {
        instances = List.copyOf(instances);
        candidates = Map.copyOf(candidates);
    }

    /**
     * @throws UncheckedIOException if either file cannot be read or parsed
     */
    public static EvaluationInputs load(ObjectMapper json, Path instancesFile, Path candidatesFile) {
        try {
            List<Instance> instances = json.readValue(instancesFile.toFile(), INSTANCE_LIST);

            Map<String, CandidateLog> candidates = new LinkedHashMap<>();
            try (BufferedReader reader = Files.newBufferedReader(candidatesFile, StandardCharsets.UTF_8)) {
                String line;
                int lineNo = 0;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) {
                        continue;
                    }
                    CandidateLog log = json.readValue(line, CandidateLog.class);
                    if (log.instanceId() == null) {
                        throw new IOException(candidatesFile + ":" + lineNo + " has no instance_id");
                    }
                    candidates.put(log.instanceId(), log);
                }
            }
            return new EvaluationInputs(instances, candidates);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load evaluation inputs: " + e.getMessage(), e);
        }
    }

    public Optional<Instance> instance(String instanceId) {
        return instances.stream().filter(i -> i.instanceId().equals(instanceId)).findFirst();
    }

    public Optional<CandidateLog> candidatesFor(String instanceId) {
        return Optional.ofNullable(candidates.get(instanceId));
    }
}
