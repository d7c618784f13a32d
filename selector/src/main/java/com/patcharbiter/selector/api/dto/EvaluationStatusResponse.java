package com.patcharbiter.selector.api.dto;

import com.patcharbiter.selector.service.EvaluationOrchestrator;

public record EvaluationStatusResponse(boolean running, int total, int completed, int failed) {

    public static EvaluationStatusResponse from(boolean running, EvaluationOrchestrator.Progress progress) {
        return new EvaluationStatusResponse(running, progress.total(), progress.completed(), progress.failed());
    }
}
