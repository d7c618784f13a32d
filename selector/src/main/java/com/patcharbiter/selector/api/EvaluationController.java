package com.patcharbiter.selector.api;

import com.patcharbiter.selector.api.dto.EvaluationStatusResponse;
import com.patcharbiter.selector.service.EvaluationService;
import com.patcharbiter.selector.service.EvaluationService.StartResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for evaluation runs.
 *
 * POST /evaluations                          start a full run in the background
 * POST /evaluations/instances/{instanceId}   start a run of one instance
 * GET  /evaluations/status                   running flag and progress counters
 */
@RestController
@RequestMapping("/evaluations")
public class EvaluationController {

    private final EvaluationService evaluationService;

    public EvaluationController(EvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    /**
     * Start a full run.
     * Returns 409 if a run is already active.
     *
     * Example:
     *   curl -X POST http://localhost:8080/evaluations
     */
    @PostMapping
    public ResponseEntity<EvaluationStatusResponse> startAll() {
        return accepted(evaluationService.startAll(), "all instances");
    }

    /**
     * Start a run of a single instance.
     * Returns 404 if the instance is not in the instance list, 409 if a run is already active.
     */
    @PostMapping("/instances/{instanceId}")
    public ResponseEntity<EvaluationStatusResponse> startOne(@PathVariable String instanceId) {
        return accepted(evaluationService.startOne(instanceId), instanceId);
    }

    @GetMapping("/status")
    public EvaluationStatusResponse status() {
        return status(evaluationService.isRunning());
    }

    private ResponseEntity<EvaluationStatusResponse> accepted(StartResult result, String target) {
        return switch (result) {
            case STARTED -> ResponseEntity.status(HttpStatus.ACCEPTED).body(status(true));
            case ALREADY_RUNNING -> throw new ResponseStatusException(
                    HttpStatus.CONFLICT, "An evaluation run is already active");
            case UNKNOWN_INSTANCE -> throw new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "Instance not found: " + target);
        };
    }

    private EvaluationStatusResponse status(boolean running) {
        return EvaluationStatusResponse.from(running, evaluationService.progress());
    }
}
