package com.patcharbiter.selector.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.io.EvaluationInputs;
import com.patcharbiter.selector.model.WorkerOutcome;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts evaluation runs in the background, at most one at a time.
 *
 * Inputs are re-read from disk for every run, so a finished run can be
 * restarted after the candidate log changes. Completed groups are skipped
 * through their checkpoints.
 */
@Service
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    public enum StartResult { STARTED, ALREADY_RUNNING, UNKNOWN_INSTANCE }

    private final EvaluationOrchestrator orchestrator;
    private final SelectorProperties     properties;
    private final ObjectMapper           objectMapper;

    private final AtomicBoolean   running  = new AtomicBoolean();
    private final ExecutorService launcher = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "evaluation-launcher");
        thread.setDaemon(true);
        return thread;
    });

    public EvaluationService(EvaluationOrchestrator orchestrator,
                             SelectorProperties properties,
                             ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.properties   = properties;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    public StartResult startAll() {
        if (!running.compareAndSet(false, true)) {
            return StartResult.ALREADY_RUNNING;
        }
        launcher.submit(() -> {
            try {
                List<WorkerOutcome> outcomes = orchestrator.runAll(loadInputs());
                log.info("Run complete: {} instances, {} failed", outcomes.size(),
                        outcomes.stream().filter(o -> !o.success()).count());
            } catch (RuntimeException e) {
                log.error("Evaluation run aborted: {}", e.getMessage(), e);
            } finally {
                running.set(false);
            }
        });
        return StartResult.STARTED;
    }

    /**
     * Start a single instance.
     *
     * @throws java.io.UncheckedIOException if the input files cannot be read
     */
    public StartResult startOne(String instanceId) {
        EvaluationInputs inputs = loadInputs();
        if (inputs.instance(instanceId).isEmpty()) {
            return StartResult.UNKNOWN_INSTANCE;
        }
        if (!running.compareAndSet(false, true)) {
            return StartResult.ALREADY_RUNNING;
        }
        launcher.submit(() -> {
            try {
                WorkerOutcome outcome = orchestrator.runOne(inputs, instanceId);
                log.info("Single-instance run complete: {}", outcome);
            } catch (RuntimeException e) {
                log.error("Run of {} aborted: {}", instanceId, e.getMessage(), e);
            } finally {
                running.set(false);
            }
        });
        return StartResult.STARTED;
    }

    public boolean isRunning() {
        return running.get();
    }

    public EvaluationOrchestrator.Progress progress() {
        return orchestrator.progress();
    }

    @PreDestroy
    void shutdown() {
        launcher.shutdownNow();
    }

    private EvaluationInputs loadInputs() {
        if (properties.instancesFile() == null || properties.candidatesFile() == null) {
            throw new IllegalStateException("selector.instances-file and selector.candidates-file must be set");
        }
        return EvaluationInputs.load(objectMapper, properties.instancesFile(), properties.candidatesFile());
    }
}
