package com.patcharbiter.selector.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.TestFixtures;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.io.EvaluationInputs;
import com.patcharbiter.selector.model.WorkerOutcome;
import com.patcharbiter.selector.service.EvaluationService.StartResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EvaluationServiceTest {

    @Mock EvaluationOrchestrator orchestrator;

    @TempDir Path output;

    EvaluationService service;

    @BeforeEach
    void setUp() throws Exception {
        SelectorProperties properties = TestFixtures.properties(output);
        Files.writeString(properties.instancesFile(),
                "[{\"instance_id\": \"x-1\", \"base_commit\": \"base123\", \"problem_statement\": \"p\"}]");
        Files.writeString(properties.candidatesFile(),
                "{\"instance_id\": \"x-1\", \"issue\": \"p\", \"patches\": [\"+a\"], \"success_id\": [1]}\n");
        service = new EvaluationService(orchestrator, properties, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void startAll_whileRunning_isRejected() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        when(orchestrator.runAll(any())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.<WorkerOutcome>of();
        });

        assertThat(service.startAll()).isEqualTo(StartResult.STARTED);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(service.isRunning()).isTrue();
        assertThat(service.startAll()).isEqualTo(StartResult.ALREADY_RUNNING);
        assertThat(service.startOne("x-1")).isEqualTo(StartResult.ALREADY_RUNNING);

        release.countDown();
        waitUntilIdle();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void startOne_unknownInstance_isRejectedWithoutStarting() {
        assertThat(service.startOne("missing")).isEqualTo(StartResult.UNKNOWN_INSTANCE);
        assertThat(service.isRunning()).isFalse();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void startOne_knownInstance_runsIt() throws Exception {
        CountDownLatch done = new CountDownLatch(1);
        when(orchestrator.runOne(any(EvaluationInputs.class), eq("x-1"))).thenAnswer(inv -> {
            done.countDown();
            return WorkerOutcome.completed("x-1", List.of());
        });

        assertThat(service.startOne("x-1")).isEqualTo(StartResult.STARTED);
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        waitUntilIdle();
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void startOne_missingInputFiles_throws() throws Exception {
        Files.delete(output.resolve("candidates.jsonl"));

        assertThatThrownBy(() -> service.startOne("x-1")).isInstanceOf(UncheckedIOException.class);
        assertThat(service.isRunning()).isFalse();
    }

    private void waitUntilIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (service.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }
}
