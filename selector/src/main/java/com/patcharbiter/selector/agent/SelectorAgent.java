package com.patcharbiter.selector.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.llm.ChatClient;
import com.patcharbiter.selector.llm.ChatMessage;
import com.patcharbiter.selector.llm.ChatResponse;
import com.patcharbiter.selector.llm.ToolCall;
import com.patcharbiter.selector.llm.ToolDefinition;
import com.patcharbiter.selector.model.CandidatePatch;
import com.patcharbiter.selector.model.WorkingSet;
import com.patcharbiter.selector.sandbox.Sandbox;
import com.patcharbiter.selector.tool.SandboxToolExecutor;
import com.patcharbiter.selector.tool.ToolExecutorFactory;
import com.patcharbiter.selector.tool.ToolRegistry;
import com.patcharbiter.selector.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The selection agent loop.
 *
 * For one episode this class:
 *   1. Opens a shell in the sandbox and resets the checkout
 *   2. Seeds the conversation with the role, the issue and every candidate
 *   3. Runs a multi-turn conversation with the model:
 *        → the model calls tools (bash, file editor) to inspect or test
 *        → we run them in the sandbox and return the results
 *        → repeat until the model writes its final report
 *   4. Resets the checkout again and returns the selected candidate
 *
 * A report naming a patch that does not exist selects the first candidate,
 * as does running out of turns. Model and sandbox failures propagate and
 * abort the attempt.
 */
@Component
public class SelectorAgent {

    private static final Logger log = LoggerFactory.getLogger(SelectorAgent.class);

    private final ChatClient          chat;
    private final ToolRegistry        tools;
    private final ToolExecutorFactory executors;
    private final ObjectMapper        objectMapper;
    private final int                 maxTurn;

    public SelectorAgent(ChatClient chat,
                         ToolRegistry tools,
                         ToolExecutorFactory executors,
                         ObjectMapper objectMapper,
                         SelectorProperties properties) {
        this.chat         = chat;
        this.tools        = tools;
        this.executors    = executors;
        this.objectMapper = objectMapper;
        this.maxTurn      = properties.maxTurn();
    }

    // ------------------------------------------------------------------
    // Entry point, called once per voting round
    // ------------------------------------------------------------------

    public EpisodeResult run(Sandbox sandbox, EpisodeRequest request) {
        MDC.put("round", String.valueOf(request.round()));
        try (SandboxToolExecutor executor = executors.open(sandbox)) {
            executor.resetWorkingTree();
            EpisodeResult result = converse(sandbox, request, executor);
            executor.resetWorkingTree();
            return result;
        } finally {
            MDC.remove("round");
        }
    }

    // ------------------------------------------------------------------
    // Conversation
    // ------------------------------------------------------------------

    private EpisodeResult converse(Sandbox sandbox, EpisodeRequest request, SandboxToolExecutor executor) {
        WorkingSet workingSet = request.workingSet();
        List<ToolDefinition> definitions = tools.definitions();
        TrajectoryRecorder trajectory = new TrajectoryRecorder(objectMapper, request.trajectoryFile(),
                request.instance().instanceId(), request.round(), chat.model(), maxTurn);

        List<ChatMessage> conversation = new ArrayList<>();
        conversation.add(ChatMessage.system(SelectorPrompts.system(workingSet.size())));
        conversation.add(ChatMessage.user(SelectorPrompts.user(
                sandbox.projectPath(), request.instance().problemStatement(), workingSet)));

        log.info("Episode started: {} candidates, max {} turns", workingSet.size(), maxTurn);
        EpisodeState   state  = EpisodeState.INIT;
        CandidatePatch chosen = workingSet.first();
        int turn = 0;

        while (turn < maxTurn) {
            turn++;
            state = EpisodeState.THINKING;
            log.debug("Turn {}/{}", turn, maxTurn);

            ChatResponse response = chat.chat(conversation, definitions);
            trajectory.recordInteraction(turn, conversation, response, definitions);
            conversation.add(ChatMessage.assistant(response));

            // --- Final report ---
            Optional<String> selection = DecisionParser.extractSelection(response.content());
            if (selection.isPresent()) {
                String token = selection.get();
                if (!workingSet.isValidSelection(token)) {
                    log.warn("Agent selected '{}', not one of 1..{}; using Patch-1", token, workingSet.size());
                }
                chosen = workingSet.resolveSelection(token);
                state  = EpisodeState.DECIDED;
                break;
            }

            // --- Tool calls ---
            if (response.hasToolCalls()) {
                state = EpisodeState.WAITING_ON_TOOL;
                for (ToolCall call : response.toolCalls()) {
                    ToolResult result = executor.execute(call.name(), call.arguments());
                    log.debug("Tool '{}' returned success={}", call.name(), result.success());
                    conversation.add(ChatMessage.toolResult(call, result.success(), result.toObservation()));
                }
            } else {
                conversation.add(ChatMessage.user(SelectorPrompts.NUDGE));
            }
        }

        if (state != EpisodeState.DECIDED) {
            state = EpisodeState.EXHAUSTED;
            log.warn("No selection after {} turns; using Patch-1", maxTurn);
        } else {
            log.info("Episode decided after {} turns: candidate {}", turn, chosen.id());
        }
        trajectory.finish(state, chosen.id(), chosen.rawDiff());
        return new EpisodeResult(chosen, state, turn);
    }
}
