package com.workspace.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.workspace.core.query.model.Chunk;
import com.workspace.core.query.model.RagResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds the response shapes Study RAG has used over time into one chunk list.
 *
 * Recognized shapes (first non-empty list wins):
 *   {"answer": "...", "chunks":    [ ... ]}
 *   {"answer": "...", "retrieved": [ ... ]}
 *   {"answer": "...", "results":   [ ... ]}
 *
 * Pure and total: never throws, worst case is an empty chunk list.
 */
@Component
public class RagResponseNormalizer {

    public static final String FALLBACK_SOURCE = "chunk";

    private static final String[] LIST_KEYS = {"chunks", "retrieved", "results"};
    private static final String[] TEXT_KEYS = {"content", "text", "page_content"};

    public RagResult normalize(JsonNode response, int topK) {
        JsonNode root = response != null && response.isObject() ? response : MissingNode.getInstance();

        JsonNode items = locateItems(root);
        int limit = Math.max(0, Math.min(topK, items.size()));

        List<Chunk> chunks = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            chunks.add(toChunk(items.get(i), i + 1));
        }

        return RagResult.builder()
            .answer(textOf(root.path("answer")))
            .chunks(chunks)
            .raw(response)
            .build();
    }

    private JsonNode locateItems(JsonNode root) {
        for (String key : LIST_KEYS) {
            JsonNode candidate = root.path(key);
            if (candidate.isArray() && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return MissingNode.getInstance();
    }

    private Chunk toChunk(JsonNode item, int idx) {
        // Some backends return bare strings instead of objects
        if (item.isTextual()) {
            return Chunk.builder()
                .idx(idx)
                .source(FALLBACK_SOURCE)
                .text(item.asText())
                .build();
        }

        JsonNode metadata = item.path("metadata");
        if (!metadata.isObject()) {
            metadata = MissingNode.getInstance();
        }

        String text = "";
        for (String key : TEXT_KEYS) {
            text = textOf(item.path(key));
            if (!text.isEmpty()) {
                break;
            }
        }
        if (text.isEmpty()) {
            text = textOf(metadata.path("text"));
        }

        String source = firstNonEmpty(
            textOf(item.path("source")),
            textOf(metadata.path("source")),
            textOf(metadata.path("file_name")));

        String chunkId = firstNonEmpty(
            scalarOf(item.path("chunk_id")),
            scalarOf(metadata.path("chunk_id")));

        return Chunk.builder()
            .idx(idx)
            .source(source.isEmpty() ? FALLBACK_SOURCE : source)
            .page(pageOf(metadata.path("page")))
            .chunkId(chunkId.isEmpty() ? null : chunkId)
            .text(text)
            .build();
    }

    private Integer pageOf(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static String textOf(JsonNode node) {
        return node.isTextual() ? node.asText() : "";
    }

    // Chunk ids arrive as strings or numbers depending on the index
    private static String scalarOf(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : "";
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
