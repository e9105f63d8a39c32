package com.linlay.taskrunner.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.taskrunner.config.RunCacheProperties;
import com.linlay.taskrunner.model.Turn;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives the cache key of a run from what determines its output: instructions, the tail of the
 * conversation, the message and the model settings.
 */
public class RunCacheKeyFactory {

    private final ObjectMapper objectMapper;
    private final RunCacheProperties properties;

    public RunCacheKeyFactory(ObjectMapper objectMapper, RunCacheProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String key(String systemPrompt, List<Turn> history, String message, String model, double temperature) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("system_prompt", systemPrompt == null ? "" : systemPrompt);
        ArrayNode recent = params.putArray("recent_history");
        List<Turn> turns = history == null ? List.of() : history;
        int window = Math.max(0, properties.getHistoryWindow());
        int maxChars = properties.getHistoryContentMaxChars();
        for (Turn turn : turns.subList(Math.max(0, turns.size() - window), turns.size())) {
            String content = turn.content();
            if (maxChars > 0 && content.length() > maxChars) {
                content = content.substring(0, maxChars);
            }
            recent.addObject()
                    .put("role", turn.role().wireName())
                    .put("content", content);
        }
        params.put("current_message", message == null ? "" : message);
        params.put("model", model == null ? "" : model);
        params.put("temperature", temperature);
        try {
            byte[] canonical = objectMapper.writeValueAsBytes(params);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException ex) {
            throw new IllegalStateException("Cannot derive run cache key", ex);
        }
    }
}
