package com.patcharbiter.selector.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.patcharbiter.selector.llm.ChatMessage;
import com.patcharbiter.selector.llm.ChatResponse;
import com.patcharbiter.selector.llm.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes one episode's conversation to a pretty-printed JSON file.
 *
 * The file is rewritten after every interaction so that a crashed attempt
 * still leaves its trajectory behind. Each interaction stores only the
 * messages added since the previous one. Write failures are logged and
 * never abort the episode.
 */
public class TrajectoryRecorder {

    private static final Logger log = LoggerFactory.getLogger(TrajectoryRecorder.class);

    private final ObjectMapper json;
    private final Path         file;
    private final ObjectNode   root;
    private final ArrayNode    interactions;
    private int                recordedMessages;

    public TrajectoryRecorder(ObjectMapper json, Path file, String instanceId, int round,
                              String model, int maxTurns) {
        this.json = json;
        this.file = file;
        this.root = json.createObjectNode();
        root.put("instance_id", instanceId);
        root.put("round", round);
        root.put("model", model);
        root.put("max_turns", maxTurns);
        root.put("start_time", Instant.now().toString());
        root.putNull("end_time");
        this.interactions = root.putArray("interactions");
    }

    public void recordInteraction(int turn, List<ChatMessage> conversation, ChatResponse response,
                                  List<ToolDefinition> tools) {
        ObjectNode interaction = interactions.addObject();
        interaction.put("turn", turn);
        interaction.put("timestamp", Instant.now().toString());
        interaction.set("input_messages",
                json.valueToTree(conversation.subList(recordedMessages, conversation.size())));
        interaction.set("response", json.valueToTree(response));
        ArrayNode toolNames = interaction.putArray("tools_available");
        tools.forEach(t -> toolNames.add(t.name()));
        recordedMessages = conversation.size();
        write();
    }

    public void finish(EpisodeState state, int chosenId, String chosenPatch) {
        root.put("end_time", Instant.now().toString());
        root.put("state", state.name());
        root.put("success", state == EpisodeState.DECIDED);
        root.put("chosen_id", chosenId);
        root.put("final_result", chosenPatch);
        write();
    }

    private void write() {
        try {
            Files.createDirectories(file.getParent());
            json.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
        } catch (IOException e) {
            log.warn("Could not write trajectory {}: {}", file, e.getMessage());
        }
    }
}
