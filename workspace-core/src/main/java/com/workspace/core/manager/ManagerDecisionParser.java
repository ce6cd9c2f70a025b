package com.workspace.core.manager;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Total decoder for the manager model's reply. Tolerates prose around the JSON
 * object; anything undecodable or outside the action vocabulary becomes
 * {@link ManagerDecision#fallback()}.
 */
@Component
@Slf4j
public class ManagerDecisionParser {

    // The candidate must be exactly one object; "{...} or {...}" is ambiguous
    private final ObjectReader objectReader;

    public ManagerDecisionParser(ObjectMapper objectMapper) {
        this.objectReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ManagerDecision parse(String rawText) {
        return tryParse(rawText).orElseGet(() -> {
            log.debug("[MANAGER] Unusable decision output, defaulting to final | rawLength={}",
                rawText != null ? rawText.length() : 0);
            return ManagerDecision.fallback();
        });
    }

    /**
     * Empty when the text has no decodable object or the action is not recognized.
     */
    Optional<ManagerDecision> tryParse(String rawText) {
        if (rawText == null) {
            return Optional.empty();
        }
        return readObject(extractJsonCandidate(rawText))
            .flatMap(node -> ManagerAction.fromString(textField(node, "action"))
                .map(action -> ManagerDecision.of(action, textField(node, "reason"))));
    }

    /**
     * Drops everything before the first '{' and after the last '}'.
     */
    static String extractJsonCandidate(String rawText) {
        String candidate = rawText.strip();
        if (!candidate.startsWith("{")) {
            int start = candidate.indexOf('{');
            if (start != -1) {
                candidate = candidate.substring(start);
            }
        }
        if (!candidate.endsWith("}")) {
            int end = candidate.lastIndexOf('}');
            if (end != -1) {
                candidate = candidate.substring(0, end + 1);
            }
        }
        return candidate;
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectReader.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String textField(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
