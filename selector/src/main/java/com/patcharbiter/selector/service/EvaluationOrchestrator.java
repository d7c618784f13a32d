package com.patcharbiter.selector.service;

import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.io.EvaluationInputs;
import com.patcharbiter.selector.model.CandidateLog;
import com.patcharbiter.selector.model.GroupOutcome;
import com.patcharbiter.selector.model.Instance;
import com.patcharbiter.selector.model.WorkerOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the selection over many instances at once.
 *
 * One task per instance on a fixed pool of {@code max-workers} threads;
 * inside a task everything is sequential. A task never throws: exceptions
 * and errors come back as {@link WorkerOutcome#failed} so one broken
 * instance does not stop the others.
 *
 * Progress is exposed as
 * <pre>
 *   selector.instances{state="total|completed|failed"}
 * </pre>
 */
@Component
public class EvaluationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    /** Snapshot of the current or last run. */
    public record Progress(int total, int completed, int failed) {
        public int finished() {
            return completed + failed;
        }
    }

    private final GroupScheduler scheduler;
    private final int            maxWorkers;

    private final AtomicInteger total     = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed    = new AtomicInteger();

    public EvaluationOrchestrator(GroupScheduler scheduler,
                                  SelectorProperties properties,
                                  MeterRegistry meterRegistry) {
        this.scheduler  = scheduler;
        this.maxWorkers = properties.maxWorkers();
        Gauge.builder("selector.instances", total, AtomicInteger::get)
                .tag("state", "total").register(meterRegistry);
        Gauge.builder("selector.instances", completed, AtomicInteger::get)
                .tag("state", "completed").register(meterRegistry);
        Gauge.builder("selector.instances", failed, AtomicInteger::get)
                .tag("state", "failed").register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /**
     * Process every instance of {@code inputs}. Blocks until all tasks are
     * done. If the calling thread is interrupted the pool is shut down and
     * the outcomes collected so far are returned.
     */
    public List<WorkerOutcome> runAll(EvaluationInputs inputs) {
        List<Instance> instances = inputs.instances();
        resetProgress(instances.size());
        log.info("Starting evaluation of {} instances with {} workers", instances.size(), maxWorkers);

        ExecutorService workers = Executors.newFixedThreadPool(maxWorkers, workerThreads());
        CompletionService<WorkerOutcome> completion = new ExecutorCompletionService<>(workers);
        List<WorkerOutcome> outcomes = new ArrayList<>();
        try {
            for (Instance instance : instances) {
                completion.submit(() -> work(instance, inputs.candidatesFor(instance.instanceId())));
            }
            for (int i = 0; i < instances.size(); i++) {
                outcomes.add(completion.take().get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Evaluation interrupted after {} of {} instances", outcomes.size(), instances.size());
        } catch (ExecutionException e) {
            // work() catches everything, so this is a programming error
            throw new IllegalStateException("Worker task failed unexpectedly", e.getCause());
        } finally {
            workers.shutdownNow();
        }
        log.info("Evaluation finished: {}", progress());
        return outcomes;
    }

    /** Process one instance in the caller's thread. */
    public WorkerOutcome runOne(EvaluationInputs inputs, String instanceId) {
        Optional<Instance> instance = inputs.instance(instanceId);
        if (instance.isEmpty()) {
            return WorkerOutcome.failed(instanceId, "Unknown instance: " + instanceId);
        }
        resetProgress(1);
        return work(instance.get(), inputs.candidatesFor(instanceId));
    }

    public Progress progress() {
        return new Progress(total.get(), completed.get(), failed.get());
    }

    // ------------------------------------------------------------------
    // Worker task
    // ------------------------------------------------------------------

    WorkerOutcome work(Instance instance, Optional<CandidateLog> candidates) {
        String instanceId = instance.instanceId();
        MDC.put("instanceId", instanceId);
        WorkerOutcome outcome;
        try {
            if (candidates.isEmpty()) {
                outcome = WorkerOutcome.failed(instanceId, "No candidate log entry for " + instanceId);
            } else {
                List<GroupOutcome> groups = scheduler.processInstance(instance, candidates.get());
                outcome = WorkerOutcome.completed(instanceId, groups);
            }
        } catch (RuntimeException | Error e) {
            // An Error from one instance (deep recursion, a huge trajectory) must not cancel the others.
            log.error("Worker for {} failed: {}", instanceId, e.getMessage(), e);
            outcome = WorkerOutcome.failed(instanceId, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        try {
            if (outcome.success()) {
                completed.incrementAndGet();
                log.info("Finished {}: groups {} ({}/{})", instanceId, outcome.groups(),
                        progress().finished(), total.get());
            } else {
                failed.incrementAndGet();
                log.error("Failed {}: {} ({}/{})", instanceId, outcome.error(),
                        progress().finished(), total.get());
            }
            return outcome;
        } finally {
            MDC.clear();
        }
    }

    private void resetProgress(int size) {
        total.set(size);
        completed.set(0);
        failed.set(0);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "selector-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
