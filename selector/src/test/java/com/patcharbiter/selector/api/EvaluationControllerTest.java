package com.patcharbiter.selector.api;

import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.service.EvaluationOrchestrator.Progress;
import com.patcharbiter.selector.service.EvaluationService;
import com.patcharbiter.selector.service.EvaluationService.StartResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for EvaluationController.
 *
 * Only the web layer is started; EvaluationService is a mock, so no run
 * ever touches docker or the model.
 */
@WebMvcTest(EvaluationController.class)
class EvaluationControllerTest {

    @Autowired MockMvc            mockMvc;
    @MockitoBean EvaluationService evaluationService;
    @MockitoBean SelectorProperties selectorProperties;

    // ------------------------------------------------------------------
    // POST /evaluations
    // ------------------------------------------------------------------

    @Test
    void startAll_idle_returns202WithProgress() throws Exception {
        when(evaluationService.startAll()).thenReturn(StartResult.STARTED);
        when(evaluationService.progress()).thenReturn(new Progress(0, 0, 0));

        mockMvc.perform(post("/evaluations"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void startAll_alreadyRunning_returns409() throws Exception {
        when(evaluationService.startAll()).thenReturn(StartResult.ALREADY_RUNNING);

        mockMvc.perform(post("/evaluations"))
                .andExpect(status().isConflict());
    }

    // ------------------------------------------------------------------
    // POST /evaluations/instances/{instanceId}
    // ------------------------------------------------------------------

    @Test
    void startOne_knownInstance_returns202() throws Exception {
        when(evaluationService.startOne("django__django-11099")).thenReturn(StartResult.STARTED);
        when(evaluationService.progress()).thenReturn(new Progress(1, 0, 0));

        mockMvc.perform(post("/evaluations/instances/django__django-11099"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    void startOne_unknownInstance_returns404() throws Exception {
        when(evaluationService.startOne("nope")).thenReturn(StartResult.UNKNOWN_INSTANCE);

        mockMvc.perform(post("/evaluations/instances/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void startOne_alreadyRunning_returns409() throws Exception {
        when(evaluationService.startOne("x-1")).thenReturn(StartResult.ALREADY_RUNNING);

        mockMvc.perform(post("/evaluations/instances/x-1"))
                .andExpect(status().isConflict());
    }

    // ------------------------------------------------------------------
    // GET /evaluations/status
    // ------------------------------------------------------------------

    @Test
    void status_reportsCounters() throws Exception {
        when(evaluationService.isRunning()).thenReturn(true);
        when(evaluationService.progress()).thenReturn(new Progress(10, 6, 1));

        mockMvc.perform(get("/evaluations/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.total").value(10))
                .andExpect(jsonPath("$.completed").value(6))
                .andExpect(jsonPath("$.failed").value(1));
    }
}
